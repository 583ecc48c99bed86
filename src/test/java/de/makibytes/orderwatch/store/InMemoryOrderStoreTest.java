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
package de.makibytes.orderwatch.store;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

import de.makibytes.orderwatch.order.OrderMetadata;
import de.makibytes.orderwatch.order.OrderStatus;
import de.makibytes.orderwatch.order.SignedOrderState;
import de.makibytes.orderwatch.order.SignedOrderWithMetadata;
import de.makibytes.orderwatch.order.TestOrders;

class InMemoryOrderStoreTest {

    private final InMemoryOrderStore store = new InMemoryOrderStore();

    @Test
    void insertIsIdempotentPerHash() {
        assertTrue(store.insert(order(1, 20)));
        assertFalse(store.insert(order(1, 30)));

        assertEquals(1, store.count());
        assertEquals(Instant.ofEpochSecond(20), store.get(TestOrders.hash(1)).orElseThrow().metadata().createdAt());
    }

    @Test
    void ordersAreListedOldestFirst() {
        store.insert(order(1, 30));
        store.insert(order(2, 10));
        store.insert(order(3, 20));

        List<String> hashes = store.getOrders().stream().map(SignedOrderWithMetadata::hash).toList();

        assertEquals(List.of(TestOrders.hash(2), TestOrders.hash(3), TestOrders.hash(1)), hashes);
    }

    @Test
    void invalidateAndRestore() {
        store.insert(order(1, 10));
        SignedOrderState cancelled = TestOrders.state(1, OrderStatus.CANCELLED, 0);

        OrderMetadata invalid = store.invalidate(TestOrders.hash(1), 50, cancelled).orElseThrow().metadata();
        assertEquals(Long.valueOf(50), invalid.invalidatedAtBlock());
        assertEquals(0, store.countValid());

        OrderMetadata valid = store.update(TestOrders.hash(1), TestOrders.state(1, OrderStatus.FILLABLE, 7))
                .orElseThrow().metadata();
        assertFalse(valid.isInvalid());
        assertEquals(OrderStatus.FILLABLE, valid.status());
        assertEquals(1, store.countValid());
        assertTrue(store.update(TestOrders.hash(9), cancelled).isEmpty());
    }

    @Test
    void deletesOnlyOrdersInvalidatedAtOrBelowBlock() {
        store.insert(order(1, 10));
        store.insert(order(2, 10));
        store.insert(order(3, 10));
        store.invalidate(TestOrders.hash(1), 40, TestOrders.state(1, OrderStatus.EXPIRED, 0));
        store.invalidate(TestOrders.hash(2), 41, TestOrders.state(2, OrderStatus.EXPIRED, 0));

        assertEquals(1, store.deleteInvalidAtOrBelow(40));

        assertFalse(store.get(TestOrders.hash(1)).isPresent());
        assertTrue(store.get(TestOrders.hash(2)).isPresent());
        assertTrue(store.get(TestOrders.hash(3)).isPresent());
    }

    private static SignedOrderWithMetadata order(long salt, long createdAtSeconds) {
        return new SignedOrderWithMetadata(TestOrders.signedOrder(salt),
                OrderMetadata.added(TestOrders.state(salt, OrderStatus.FILLABLE, 100), Instant.ofEpochSecond(createdAtSeconds)));
    }
}
