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
package de.makibytes.orderwatch.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.makibytes.orderwatch.batch.StateBatcher;
import de.makibytes.orderwatch.batch.StateFetchException;
import de.makibytes.orderwatch.model.HeaderEvent;
import de.makibytes.orderwatch.order.OrderMetadata;
import de.makibytes.orderwatch.order.OrderStatus;
import de.makibytes.orderwatch.order.SignedOrder;
import de.makibytes.orderwatch.order.SignedOrderState;
import de.makibytes.orderwatch.order.SignedOrderWithMetadata;
import de.makibytes.orderwatch.store.InMemoryOrderStore;
import de.makibytes.orderwatch.util.DaemonThreadFactory;
import de.makibytes.orderwatch.watcher.ChainTipWatcher;
import de.makibytes.orderwatch.watcher.HeaderEventBroadcaster;

/**
 * Re-evaluates every stored order on each accepted block header.
 *
 * <p>
 * Per block: orders invalidated more than {@code maxReorg} blocks ago are
 * deleted, the rest are re-fetched through the batcher at normal priority. An
 * order event is published when an order changed, unless it only moved between
 * two unfillable states. A failed block is logged and the next block retries.
 */
public class OrderRevalidationService {

    private static final Logger logger = LoggerFactory.getLogger(OrderRevalidationService.class);

    private final ChainTipWatcher watcher;
    private final StateBatcher<SignedOrder, SignedOrderState> batcher;
    private final InMemoryOrderStore store;
    private final OrderEventPublisher publisher;
    private final int maxReorg;
    private final Duration requestTimeout;
    private final Duration blockTimeout;

    private final AtomicLong blocksProcessed = new AtomicLong();
    private final AtomicLong blocksFailed = new AtomicLong();
    private final AtomicLong reorgsSeen = new AtomicLong();
    private final AtomicLong eventsPublished = new AtomicLong();
    private volatile Long lastRevalidatedBlock;
    private volatile boolean running;
    private volatile HeaderEventBroadcaster.Subscription subscription;
    private volatile Thread consumer;

    public OrderRevalidationService(ChainTipWatcher watcher,
            StateBatcher<SignedOrder, SignedOrderState> batcher,
            InMemoryOrderStore store,
            OrderEventPublisher publisher,
            int maxReorg,
            Duration requestTimeout,
            Duration blockTimeout) {
        this.watcher = watcher;
        this.batcher = batcher;
        this.store = store;
        this.publisher = publisher;
        this.maxReorg = maxReorg;
        this.requestTimeout = requestTimeout;
        this.blockTimeout = blockTimeout;
    }

    /**
     * Starts the watcher and the consumer thread.
     */
    public void start() {
        running = true;
        subscription = watcher.start();
        Thread thread = new DaemonThreadFactory("order-revalidation").newThread(this::consume);
        consumer = thread;
        thread.start();
    }

    public void stop() {
        running = false;
        watcher.stop();
        HeaderEventBroadcaster.Subscription current = subscription;
        if (current != null) {
            current.close();
        }
        Thread thread = consumer;
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void consume() {
        HeaderEventBroadcaster.Subscription events = subscription;
        try {
            while (running) {
                HeaderEvent event = events.poll(blockTimeout);
                if (event == null) {
                    if (events.isClosed()) {
                        break;
                    }
                    logger.warn("No block header received for {} s", blockTimeout.toSeconds());
                    continue;
                }
                handle(event);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        logger.info("Order revalidation stopped");
    }

    void handle(HeaderEvent event) throws InterruptedException {
        if (event instanceof HeaderEvent.ReorgDetected reorg) {
            reorgsSeen.incrementAndGet();
            logger.info("Chain reorganized, state from block {} on is provisional", reorg.restartHeight());
            return;
        }
        long blockNumber = event.blockHeight();
        logger.info("Received block header #{}", blockNumber);
        try {
            revalidate(blockNumber);
        } catch (StateFetchException | TimeoutException | OrderEventPublisher.OrderPublishException ex) {
            blocksFailed.incrementAndGet();
            logger.error("Error revalidating orders at block {}: {}", blockNumber, ex.getMessage());
        } catch (RuntimeException ex) {
            blocksFailed.incrementAndGet();
            logger.error("Unexpected error revalidating orders at block {}", blockNumber, ex);
        }
    }

    /**
     * Revalidates all stored orders against the state at {@code blockNumber}.
     *
     * @return number of order events published
     */
    public int revalidate(long blockNumber)
            throws StateFetchException, TimeoutException, InterruptedException, OrderEventPublisher.OrderPublishException {
        store.deleteInvalidAtOrBelow(blockNumber - maxReorg);
        List<SignedOrderWithMetadata> orders = store.getOrders();
        List<CompletableFuture<SignedOrderState>> states = new ArrayList<>(orders.size());
        for (SignedOrderWithMetadata order : orders) {
            states.add(batcher.fetchState(order.order(), false));
        }

        long deadline = System.nanoTime() + requestTimeout.toNanos();
        int published = 0;
        for (int i = 0; i < orders.size(); i++) {
            SignedOrderState state = await(states.get(i), deadline);
            if (apply(orders.get(i), state, blockNumber)) {
                published++;
            }
        }
        blocksProcessed.incrementAndGet();
        lastRevalidatedBlock = blockNumber;
        logger.debug("Revalidated {} order(s) at block {}, {} event(s)", orders.size(), blockNumber, published);
        return published;
    }

    private boolean apply(SignedOrderWithMetadata order, SignedOrderState state, long blockNumber)
            throws OrderEventPublisher.OrderPublishException {
        OrderMetadata previous = order.metadata();
        boolean wasInvalid = previous.isInvalid();
        boolean remainingChanged = !previous.remaining().equals(state.takerTokenFillableAmount());
        boolean changed = remainingChanged || previous.status() != state.status();

        SignedOrderWithMetadata updated;
        if (state.isValid()) {
            updated = wasInvalid || changed
                    ? store.update(order.hash(), state).orElse(null)
                    : order;
        } else if (!wasInvalid) {
            updated = store.invalidate(order.hash(), blockNumber, state).orElse(null);
        } else {
            updated = changed
                    ? store.invalidate(order.hash(), previous.invalidatedAtBlock(), state).orElse(null)
                    : order;
        }
        if (updated == null) {
            // removed concurrently
            return false;
        }
        if (changed && (!wasInvalid || state.status() == OrderStatus.FILLABLE)) {
            publisher.publish(updated);
            eventsPublished.incrementAndGet();
            return true;
        }
        return false;
    }

    private static SignedOrderState await(CompletableFuture<SignedOrderState> future, long deadline)
            throws StateFetchException, TimeoutException, InterruptedException {
        try {
            return future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof StateFetchException stateFetchException) {
                throw stateFetchException;
            }
            throw new StateFetchException(StateFetchException.Reason.QUERY_FAILED, String.valueOf(ex.getCause().getMessage()), ex.getCause());
        }
    }

    public long getBlocksProcessed() {
        return blocksProcessed.get();
    }

    public long getBlocksFailed() {
        return blocksFailed.get();
    }

    public long getReorgsSeen() {
        return reorgsSeen.get();
    }

    public long getEventsPublished() {
        return eventsPublished.get();
    }

    public Long getLastRevalidatedBlock() {
        return lastRevalidatedBlock;
    }
}
