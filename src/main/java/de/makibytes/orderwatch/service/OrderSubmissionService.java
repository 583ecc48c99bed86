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

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.makibytes.orderwatch.batch.StateBatcher;
import de.makibytes.orderwatch.order.ChainInfo;
import de.makibytes.orderwatch.order.OrderMetadata;
import de.makibytes.orderwatch.order.OrderValidationException;
import de.makibytes.orderwatch.order.SignedOrder;
import de.makibytes.orderwatch.order.SignedOrderState;
import de.makibytes.orderwatch.order.SignedOrderWithMetadata;
import de.makibytes.orderwatch.store.InMemoryOrderStore;
import de.makibytes.orderwatch.util.DaemonThreadFactory;

/**
 * Accepts new orders: static checks, a priority state fetch, state checks,
 * storage and an order event.
 */
public class OrderSubmissionService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(OrderSubmissionService.class);

    private final ChainInfo chainInfo;
    private final StateBatcher<SignedOrder, SignedOrderState> batcher;
    private final InMemoryOrderStore store;
    private final OrderEventPublisher publisher;
    private final Duration requestTimeout;
    private final Clock clock;
    private final ExecutorService submitExecutor;

    public OrderSubmissionService(ChainInfo chainInfo,
            StateBatcher<SignedOrder, SignedOrderState> batcher,
            InMemoryOrderStore store,
            OrderEventPublisher publisher,
            Duration requestTimeout,
            int concurrency,
            Clock clock) {
        this.chainInfo = chainInfo;
        this.batcher = batcher;
        this.store = store;
        this.publisher = publisher;
        this.requestTimeout = requestTimeout;
        this.clock = clock;
        this.submitExecutor = Executors.newFixedThreadPool(concurrency, new DaemonThreadFactory("order-submit"));
    }

    /**
     * Validates and stores one order. Submitting an order that is already
     * stored returns the stored copy without a new event.
     *
     * @throws OrderValidationException if the order or its on-chain state is not acceptable
     * @throws OrderSubmissionException if the state could not be fetched or the event not published
     */
    public SignedOrderWithMetadata submit(SignedOrder order) throws OrderValidationException, OrderSubmissionException {
        chainInfo.validate(order.order());
        SignedOrderState state = fetchState(order);
        state.validate();

        SignedOrderWithMetadata stored = new SignedOrderWithMetadata(order, OrderMetadata.added(state, clock.instant()));
        if (!store.insert(stored)) {
            logger.debug("Order {} already stored", state.hash());
            return store.get(state.hash()).orElse(stored);
        }
        try {
            publisher.publish(stored);
        } catch (OrderEventPublisher.OrderPublishException ex) {
            logger.error("Error emitting order event for {}: {}", stored.hash(), ex.getMessage());
            throw new OrderSubmissionException("order event could not be published", ex);
        }
        logger.info("Accepted order {} (fillable {})", stored.hash(), state.takerTokenFillableAmount());
        return stored;
    }

    /**
     * Submits many orders concurrently. Validation rejections are collected and
     * reported together; any internal failure aborts with that failure.
     */
    public List<SignedOrderWithMetadata> submitAll(List<SignedOrder> orders) throws OrderSubmissionException {
        List<Future<SignedOrderWithMetadata>> futures = new ArrayList<>(orders.size());
        for (SignedOrder order : orders) {
            futures.add(submitExecutor.submit(() -> submit(order)));
        }
        List<SignedOrderWithMetadata> accepted = new ArrayList<>(orders.size());
        List<OrderValidationException.Reason> rejections = new ArrayList<>();
        try {
            for (Future<SignedOrderWithMetadata> future : futures) {
                try {
                    accepted.add(future.get());
                } catch (ExecutionException ex) {
                    Throwable cause = ex.getCause();
                    if (cause instanceof OrderValidationException validation) {
                        rejections.add(validation.getReason());
                    } else if (cause instanceof OrderSubmissionException submission) {
                        throw submission;
                    } else {
                        throw new OrderSubmissionException("internal error when validating orders", cause);
                    }
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new OrderSubmissionException("interrupted while validating orders", ex);
        } finally {
            futures.forEach(future -> future.cancel(false));
        }
        if (!rejections.isEmpty()) {
            throw new OrderSubmissionException(rejections);
        }
        return accepted;
    }

    @Override
    public void close() {
        submitExecutor.shutdownNow();
    }

    private SignedOrderState fetchState(SignedOrder order) throws OrderSubmissionException {
        try {
            return batcher.fetchState(order, true).get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException ex) {
            logger.error("Error fetching order state: {}", ex.getCause().getMessage());
            throw new OrderSubmissionException("order state could not be fetched", ex.getCause());
        } catch (TimeoutException | CancellationException ex) {
            logger.error("Fetching order state timed out after {} ms", requestTimeout.toMillis());
            throw new OrderSubmissionException("order state request timed out", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new OrderSubmissionException("interrupted while fetching order state", ex);
        }
    }
}
