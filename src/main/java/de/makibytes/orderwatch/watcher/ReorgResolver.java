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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.makibytes.orderwatch.model.BlockHeader;
import de.makibytes.orderwatch.model.BlockId;
import de.makibytes.orderwatch.model.HeaderEvent;

/**
 * Links a newly observed head to the last accepted header by walking parent
 * hashes backwards.
 *
 * <p>
 * The pending chain starts with the new head. While its oldest element does not
 * directly extend the base, its parent is fetched and prepended. When the oldest
 * element sits right above the base but names a different parent, the base
 * itself was orphaned and is rewound to its own parent. Identity is always the
 * block hash, never the number.
 *
 * <p>
 * The resulting event list is fully built and verified before it is returned, so
 * a failure never leaves half a reorg published.
 */
public class ReorgResolver {

    private static final Logger logger = LoggerFactory.getLogger(ReorgResolver.class);

    private final int maxReorg;

    public ReorgResolver(int maxReorg) {
        if (maxReorg < 1) {
            throw new IllegalArgumentException("maxReorg must be at least 1");
        }
        this.maxReorg = maxReorg;
    }

    @FunctionalInterface
    public interface HeaderLookup {

        /**
         * Returns the header or throws {@link WatcherException.Reason#NOT_FOUND}.
         */
        BlockHeader fetch(BlockId id) throws WatcherException, InterruptedException;
    }

    public record Resolution(List<HeaderEvent> events, BlockHeader head, int rewound) {

        public boolean isReorg() {
            return rewound > 0;
        }
    }

    /**
     * Resolves {@code latest} against {@code last}. The caller guarantees that
     * {@code latest.number() > last.number()}.
     */
    public Resolution resolve(BlockHeader last, BlockHeader latest, HeaderLookup lookup)
            throws WatcherException, InterruptedException {
        checkWellFormed(last);
        checkWellFormed(latest);
        if (latest.number() <= last.number()) {
            throw new IllegalArgumentException("header " + latest + " is not newer than " + last);
        }

        Deque<BlockHeader> pending = new ArrayDeque<>();
        pending.addFirst(latest);
        BlockHeader base = last;
        int rewound = 0;

        while (true) {
            if (pending.size() > maxReorg) {
                throw new WatcherException(WatcherException.Reason.REORG_OVERFLOW,
                        "no common ancestor within " + maxReorg + " blocks of " + latest);
            }
            BlockHeader tip = pending.peekFirst();
            if (tip.number() == base.number() + 1) {
                if (tip.parentHash() != null && tip.parentHash().equals(base.hash())) {
                    break;
                }
                base = lookupParent(base, lookup);
                rewound++;
            }
            pending.addFirst(lookupParent(tip, lookup));
        }

        List<HeaderEvent> events = new ArrayList<>(pending.size() + 1);
        if (rewound > 0) {
            logger.info("Reorg detected: {} header(s) rewound, restarting at #{} for new head {}",
                    rewound, base.number() + 1, latest);
            events.add(new HeaderEvent.ReorgDetected(base.number() + 1));
        }
        for (BlockHeader header : pending) {
            if (header.number() != base.number() + 1) {
                throw new WatcherException(WatcherException.Reason.INSANE_NUMBER,
                        "header " + header + " does not follow " + base);
            }
            if (header.parentHash() == null || !header.parentHash().equals(base.hash())) {
                throw new WatcherException(WatcherException.Reason.INSANE_PARENT_HASH,
                        "header " + header + " does not link to " + base);
            }
            events.add(new HeaderEvent.HeaderAccepted(header));
            base = header;
        }
        return new Resolution(List.copyOf(events), base, rewound);
    }

    public static void checkWellFormed(BlockHeader header) throws WatcherException {
        if (header == null) {
            throw new WatcherException(WatcherException.Reason.NOT_FOUND, "header missing");
        }
        if (header.number() == null) {
            throw new WatcherException(WatcherException.Reason.NUMBER_MISSING, "header " + header.hash() + " has no number");
        }
        if (header.hash() == null) {
            throw new WatcherException(WatcherException.Reason.HASH_MISSING, "header #" + header.number() + " has no hash");
        }
    }

    private static BlockHeader lookupParent(BlockHeader child, HeaderLookup lookup)
            throws WatcherException, InterruptedException {
        if (child.parentHash() == null) {
            throw new WatcherException(WatcherException.Reason.HASH_MISSING, "header " + child + " has no parent hash");
        }
        BlockHeader parent = lookup.fetch(BlockId.hash(child.parentHash()));
        checkWellFormed(parent);
        return parent;
    }
}
