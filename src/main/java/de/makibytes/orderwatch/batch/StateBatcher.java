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
package de.makibytes.orderwatch.batch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.makibytes.orderwatch.util.DaemonThreadFactory;

/**
 * Coalesces single-item state requests from many callers into batch queries.
 *
 * <p>
 * Requests for an item that is already queued share the queued job. A lane opens
 * a batching window ("cork") on its first insert and is dispatched when the
 * window closes or the queue reaches the batch size. At most {@code concurrent}
 * queries run at the same time; the permit is returned as soon as the query
 * returns, before results are handed out.
 *
 * <p>
 * Threads: one dispatcher, a scheduler for cork timers and a pool for the
 * queries. The queue lock is never held across a query or while waiting for a
 * permit.
 */
public class StateBatcher<K, R> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(StateBatcher.class);

    public record Settings(int batchSize, int concurrent, Duration priorityCork, Duration queueCork) {

        public Settings {
            if (batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be positive");
            }
            if (concurrent < 1) {
                throw new IllegalArgumentException("concurrent must be positive");
            }
            Objects.requireNonNull(priorityCork, "priorityCork");
            Objects.requireNonNull(queueCork, "queueCork");
        }
    }

    private final BatchQuery<K, R> query;
    private final Settings settings;
    private final BatcherStatistics statistics = new BatcherStatistics();

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeUp = lock.newCondition();
    private final BatchQueue<K, R> queue = new BatchQueue<>();
    private boolean signalled;
    private boolean closed;

    private final Semaphore permits;
    private final ScheduledExecutorService corkTimer;
    private final ExecutorService callExecutor;
    private final Thread dispatcher;

    public StateBatcher(String name, BatchQuery<K, R> query, Settings settings) {
        this.query = query;
        this.settings = settings;
        this.permits = new Semaphore(settings.concurrent());
        this.corkTimer = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory(name + "-cork"));
        this.callExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory(name + "-call"));
        this.dispatcher = new DaemonThreadFactory(name + "-dispatch").newThread(this::dispatchLoop);
        this.dispatcher.start();
    }

    /**
     * Requests the state of {@code item}. The future completes with the item's
     * result, or exceptionally with a {@link StateFetchException}. Cancelling the
     * future does not cancel the batch.
     */
    public CompletableFuture<R> fetchState(K item, boolean priority) {
        Objects.requireNonNull(item, "item");
        CompletableFuture<R> result = new CompletableFuture<>();
        lock.lock();
        try {
            if (closed) {
                result.completeExceptionally(new StateFetchException(StateFetchException.Reason.UNAVAILABLE, "batcher is closed"));
                return result;
            }
            BatchQueue.Admission admission = queue.insert(item, result, priority);
            statistics.onAdmission(admission);
            if (queue.size() >= settings.batchSize()) {
                signalLocked();
            } else if (admission.startsCork()) {
                Duration cork = admission.priorityLane() ? settings.priorityCork() : settings.queueCork();
                corkTimer.schedule(this::signal, cork.toNanos(), TimeUnit.NANOSECONDS);
            }
        } finally {
            lock.unlock();
        }
        return result;
    }

    public BatcherStatistics getStatistics() {
        return statistics;
    }

    public int queuedJobs() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops dispatching. Jobs still queued fail with
     * {@link StateFetchException.Reason#UNAVAILABLE}; running queries finish.
     */
    @Override
    public void close() {
        List<BatchQueue.PendingJob<K, R>> abandoned;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            abandoned = queue.drainAll();
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }
        dispatcher.interrupt();
        corkTimer.shutdownNow();
        callExecutor.shutdown();
        StateFetchException unavailable = new StateFetchException(StateFetchException.Reason.UNAVAILABLE, "batcher is closed");
        for (BatchQueue.PendingJob<K, R> job : abandoned) {
            job.waiters().forEach(waiter -> waiter.completeExceptionally(unavailable));
        }
        if (!abandoned.isEmpty()) {
            logger.info("State batcher closed with {} queued job(s)", abandoned.size());
        }
    }

    private void signal() {
        lock.lock();
        try {
            signalLocked();
        } finally {
            lock.unlock();
        }
    }

    private void signalLocked() {
        signalled = true;
        wakeUp.signal();
    }

    private void dispatchLoop() {
        try {
            while (awaitSignal()) {
                dispatchQueued();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        logger.debug("State batcher dispatcher finished");
    }

    private boolean awaitSignal() throws InterruptedException {
        lock.lock();
        try {
            while (!signalled && !closed) {
                wakeUp.await();
            }
            signalled = false;
            return !closed;
        } finally {
            lock.unlock();
        }
    }

    private void dispatchQueued() throws InterruptedException {
        while (true) {
            permits.acquire();
            List<BatchQueue.PendingJob<K, R>> batch;
            lock.lock();
            try {
                batch = closed ? List.of() : queue.takeBatch(settings.batchSize());
            } finally {
                lock.unlock();
            }
            if (batch.isEmpty()) {
                permits.release();
                return;
            }
            try {
                callExecutor.execute(() -> call(batch));
            } catch (RejectedExecutionException ex) {
                permits.release();
                deliverFailure(batch, new StateFetchException(StateFetchException.Reason.UNAVAILABLE, "batcher is closed", ex));
                return;
            }
        }
    }

    private void call(List<BatchQueue.PendingJob<K, R>> batch) {
        List<K> items = new ArrayList<>(batch.size());
        for (BatchQueue.PendingJob<K, R> job : batch) {
            items.add(job.key());
        }
        statistics.onCallStarted(items.size());
        List<R> results;
        try {
            results = query.query(items);
        } catch (BatchQueryException | RuntimeException ex) {
            permits.release();
            statistics.onCallReturned();
            statistics.onCallFailed();
            logger.warn("Batch query for {} item(s) failed: {}", items.size(), ex.getMessage());
            deliverFailure(batch, new StateFetchException(StateFetchException.Reason.QUERY_FAILED, "batch query failed: " + ex.getMessage(), ex));
            return;
        }
        permits.release();
        statistics.onCallReturned();

        if (results == null || results.size() != batch.size()) {
            statistics.onCallFailed();
            int actual = results == null ? 0 : results.size();
            logger.warn("Batch query returned {} result(s) for {} item(s)", actual, batch.size());
            deliverFailure(batch, new StateFetchException(StateFetchException.Reason.INVALID_OUTPUT_LENGTH,
                    "expected " + batch.size() + " results but got " + actual));
            return;
        }
        statistics.onCallCompleted(items.size());
        for (int i = 0; i < batch.size(); i++) {
            R value = results.get(i);
            for (CompletableFuture<R> waiter : batch.get(i).waiters()) {
                waiter.complete(value);
            }
        }
    }

    private static <K, R> void deliverFailure(List<BatchQueue.PendingJob<K, R>> batch, StateFetchException error) {
        for (BatchQueue.PendingJob<K, R> job : batch) {
            for (CompletableFuture<R> waiter : job.waiters()) {
                waiter.completeExceptionally(error);
            }
        }
    }
}
