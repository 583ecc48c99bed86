/*
 * Copyright (c) 2026 MakiBytes.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package de.makibytes.orderwatch.watcher;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.orderwatch.model.BlockHeader;
import de.makibytes.orderwatch.model.BlockId;
import de.makibytes.orderwatch.model.HeaderEvent;
import static de.makibytes.orderwatch.watcher.Headers.hash;
import static de.makibytes.orderwatch.watcher.Headers.header;

@DisplayName("ReorgResolver Tests")
class ReorgResolverTest {

    private final Map<String, BlockHeader> chain = new HashMap<>();
    private final List<BlockId> lookups = new ArrayList<>();
    private ReorgResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ReorgResolver(10);
        for (long n = 90; n <= 101; n++) {
            add(header("a", n));
        }
    }

    @Test
    @DisplayName("direct child is accepted without lookups")
    void directChildAccepted() throws Exception {
        ReorgResolver.Resolution resolution = resolve(header("a", 100), header("a", 101));

        assertEquals(List.of(new HeaderEvent.HeaderAccepted(header("a", 101))), resolution.events());
        assertEquals(header("a", 101), resolution.head());
        assertFalse(resolution.isReorg());
        assertTrue(lookups.isEmpty());
    }

    @Test
    @DisplayName("missing headers between last and new head are filled in")
    void gapIsFilled() throws Exception {
        add(header("a", 102));
        add(header("a", 103));

        ReorgResolver.Resolution resolution = resolve(header("a", 100), header("a", 103));

        assertEquals(List.of(accepted("a", 101), accepted("a", 102), accepted("a", 103)), resolution.events());
        assertEquals(2, lookups.size());
    }

    @Test
    @DisplayName("fork reconnecting at 99 restarts at 100")
    void forkReconnectingBelowLastAccepted() throws Exception {
        add(header("b", 100, "a"));
        add(header("b", 101));

        ReorgResolver.Resolution resolution = resolve(header("a", 100), header("b", 101));

        assertEquals(List.of(
                new HeaderEvent.ReorgDetected(100),
                new HeaderEvent.HeaderAccepted(header("b", 100, "a")),
                accepted("b", 101)), resolution.events());
        assertEquals(1, resolution.rewound());
    }

    @Test
    @DisplayName("deeper fork with a longer replacement chain")
    void deeperForkLongerChain() throws Exception {
        add(header("b", 99, "a"));
        for (long n = 100; n <= 104; n++) {
            add(header("b", n));
        }

        ReorgResolver.Resolution resolution = resolve(header("a", 101), header("b", 104));

        List<HeaderEvent> events = resolution.events();
        assertEquals(new HeaderEvent.ReorgDetected(99), events.get(0));
        assertEquals(7, events.size());
        assertEquals(new HeaderEvent.HeaderAccepted(header("b", 99, "a")), events.get(1));
        assertEquals(accepted("b", 104), events.get(6));
        assertEquals(3, resolution.rewound());
        assertLinked(header("a", 98), events);
    }

    @Test
    @DisplayName("fork deeper than max reorg is reported as overflow")
    void reorgOverflow() {
        resolver = new ReorgResolver(3);
        add(header("b", 96, "a"));
        for (long n = 97; n <= 101; n++) {
            add(header("b", n));
        }

        WatcherException ex = assertThrows(WatcherException.class,
                () -> resolve(header("a", 100), header("b", 101)));
        assertEquals(WatcherException.Reason.REORG_OVERFLOW, ex.getReason());
    }

    @Test
    @DisplayName("unknown parent is a lookup failure")
    void missingParent() {
        WatcherException ex = assertThrows(WatcherException.class,
                () -> resolve(header("a", 100), header("c", 103)));
        assertEquals(WatcherException.Reason.NOT_FOUND, ex.getReason());
    }

    @Test
    @DisplayName("headers without number or hash are malformed")
    void malformedHeaders() {
        BlockHeader noNumber = new BlockHeader(null, hash("a", 101), hash("a", 100), null, null, null, null, null);
        BlockHeader noHash = new BlockHeader(101L, null, hash("a", 100), null, null, null, null, null);

        assertEquals(WatcherException.Reason.NUMBER_MISSING,
                assertThrows(WatcherException.class, () -> resolve(header("a", 100), noNumber)).getReason());
        assertEquals(WatcherException.Reason.HASH_MISSING,
                assertThrows(WatcherException.class, () -> resolve(header("a", 100), noHash)).getReason());
    }

    @Test
    @DisplayName("ancestor with an unexpected number fails the sanity check")
    void insaneNumber() {
        // #103 names #101 as its parent
        chain.put(hash("x", 102), BlockHeader.of(101, hash("x", 102), hash("a", 100)));
        BlockHeader latest = BlockHeader.of(103, hash("x", 103), hash("x", 102));

        WatcherException ex = assertThrows(WatcherException.class, () -> resolve(header("a", 100), latest));
        assertEquals(WatcherException.Reason.INSANE_NUMBER, ex.getReason());
    }

    @Test
    @DisplayName("lookup answering with a different hash fails the sanity check")
    void insaneParentHash() {
        chain.put(hash("x", 101), BlockHeader.of(101, hash("y", 101), hash("a", 100)));
        BlockHeader latest = BlockHeader.of(102, hash("x", 102), hash("x", 101));

        WatcherException ex = assertThrows(WatcherException.class, () -> resolve(header("a", 100), latest));
        assertEquals(WatcherException.Reason.INSANE_PARENT_HASH, ex.getReason());
    }

    @Test
    @DisplayName("fork switching again to a deeper branch resolves from the previous result")
    void secondDeeperForkAfterResolution() throws Exception {
        add(header("b", 100, "a"));
        add(header("b", 101));
        add(header("c", 98, "a"));
        for (long n = 99; n <= 102; n++) {
            add(header("c", n));
        }

        ReorgResolver.Resolution first = resolve(header("a", 100), header("b", 101));
        ReorgResolver.Resolution second = resolve(first.head(), header("c", 102));

        assertEquals(new HeaderEvent.ReorgDetected(98), second.events().get(0));
        assertLinked(header("a", 97), second.events());
        assertEquals(header("c", 102), second.head());
    }

    @Test
    @DisplayName("random chains with forks always emit a linked, gap-free sequence")
    void randomChainsStayLinked() throws Exception {
        Random random = new Random(42);
        for (int round = 0; round < 500; round++) {
            chain.clear();
            int maxReorg = 1 + random.nextInt(10);
            resolver = new ReorgResolver(maxReorg);
            for (long n = 0; n <= 60; n++) {
                add(BlockHeader.of(n, hash("m", n), hash("m", n - 1)));
            }
            long last = 20 + random.nextInt(30);
            int forkDepth = random.nextInt(maxReorg);
            long forkPoint = last - forkDepth;
            long newHead = last + 1 + random.nextInt(maxReorg - forkDepth);
            String branch = "f" + round;
            for (long n = forkPoint + 1; n <= newHead; n++) {
                String parent = n == forkPoint + 1 ? hash("m", n - 1) : hash(branch, n - 1);
                add(BlockHeader.of(n, hash(branch, n), parent));
            }
            BlockHeader latest = chain.get(hash(branch, newHead));

            ReorgResolver.Resolution resolution = resolve(chain.get(hash("m", last)), latest);

            List<HeaderEvent> events = resolution.events();
            long restart = last + 1;
            if (forkPoint < last) {
                HeaderEvent first = events.get(0);
                assertInstanceOf(HeaderEvent.ReorgDetected.class, first);
                restart = forkPoint + 1;
                assertEquals(restart, first.blockHeight());
            }
            assertLinked(chain.get(hash("m", restart - 1)), events);
            assertEquals(latest, resolution.head());
        }
    }

    private ReorgResolver.Resolution resolve(BlockHeader last, BlockHeader latest) throws Exception {
        return resolver.resolve(last, latest, id -> {
            lookups.add(id);
            BlockHeader found = chain.get(id.hash());
            if (found == null) {
                throw new WatcherException(WatcherException.Reason.NOT_FOUND, "no header " + id);
            }
            return found;
        });
    }

    private void add(BlockHeader header) {
        chain.put(header.hash(), header);
    }

    private static HeaderEvent accepted(String branch, long number) {
        return new HeaderEvent.HeaderAccepted(header(branch, number));
    }

    private static void assertLinked(BlockHeader base, List<HeaderEvent> events) {
        BlockHeader previous = base;
        for (HeaderEvent event : events) {
            if (event instanceof HeaderEvent.HeaderAccepted accepted) {
                assertTrue(accepted.header().extendsFrom(previous), accepted.header() + " does not extend " + previous);
                previous = accepted.header();
            }
        }
    }
}
