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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import de.makibytes.orderwatch.order.OrderMetadata;
import de.makibytes.orderwatch.order.SignedOrderState;
import de.makibytes.orderwatch.order.SignedOrderWithMetadata;

/**
 * Order store keyed by order hash. Invalid orders are kept, tagged with the block
 * that invalidated them, until they are older than the maximum reorg depth.
 */
@Component
public class InMemoryOrderStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryOrderStore.class);

    private final Map<String, SignedOrderWithMetadata> orders = new ConcurrentHashMap<>();

    /**
     * Stores a new order. Returns {@code false} if the hash is already known.
     */
    public boolean insert(SignedOrderWithMetadata order) {
        return orders.putIfAbsent(order.hash(), order) == null;
    }

    public Optional<SignedOrderWithMetadata> get(String hash) {
        return Optional.ofNullable(orders.get(hash));
    }

    /**
     * Snapshot of all orders, oldest first.
     */
    public List<SignedOrderWithMetadata> getOrders() {
        List<SignedOrderWithMetadata> snapshot = new ArrayList<>(orders.values());
        snapshot.sort(Comparator.comparing((SignedOrderWithMetadata order) -> order.metadata().createdAt(),
                Comparator.nullsFirst(Comparator.naturalOrder())));
        return snapshot;
    }

    /**
     * Marks the order valid again with the given state.
     */
    public Optional<SignedOrderWithMetadata> update(String hash, SignedOrderState state) {
        return Optional.ofNullable(orders.computeIfPresent(hash,
                (key, existing) -> existing.withMetadata(existing.metadata().withState(state))));
    }

    /**
     * Tags the order as invalid since {@code blockNumber} with the given state.
     */
    public Optional<SignedOrderWithMetadata> invalidate(String hash, long blockNumber, SignedOrderState state) {
        return Optional.ofNullable(orders.computeIfPresent(hash,
                (key, existing) -> existing.withMetadata(existing.metadata().invalidatedAt(blockNumber, state))));
    }

    /**
     * Removes orders invalidated at or below {@code blockNumber}.
     */
    public int deleteInvalidAtOrBelow(long blockNumber) {
        int removed = 0;
        for (SignedOrderWithMetadata order : orders.values()) {
            OrderMetadata metadata = order.metadata();
            if (metadata.isInvalid() && metadata.invalidatedAtBlock() <= blockNumber && orders.remove(order.hash(), order)) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.debug("Deleted {} order(s) invalidated at or below block {}", removed, blockNumber);
        }
        return removed;
    }

    public int count() {
        return orders.size();
    }

    public long countValid() {
        return orders.values().stream().filter(order -> !order.metadata().isInvalid()).count();
    }
}
