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

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.makibytes.orderwatch.model.BlockHeader;
import de.makibytes.orderwatch.model.BlockId;
import de.makibytes.orderwatch.model.HeaderEvent;
import de.makibytes.orderwatch.util.DaemonThreadFactory;

/**
 * Turns the head stream of an unreliable node into a gap-free, hash-linked
 * sequence of {@link HeaderEvent}s.
 *
 * <p>
 * A single daemon thread owns the connection state: the last accepted header
 * and the consecutive failure counter. Each connection cycle seeds the chain
 * with the current tip if nothing was accepted yet, then waits for new heads,
 * falling back to polling {@code latest} when the subscription is silent for
 * the poll delay. Any failure ends the cycle; the loop reconnects after the
 * retry delay and gives up once more than {@code maxTries} retries pass without
 * an accepted header.
 */
public class ChainTipWatcher {

    private static final Logger logger = LoggerFactory.getLogger(ChainTipWatcher.class);

    public record Settings(Duration pollDelay, Duration fetchTimeout, int maxTries, Duration retryDelay) {

        public Settings {
            Objects.requireNonNull(pollDelay, "pollDelay");
            Objects.requireNonNull(fetchTimeout, "fetchTimeout");
            Objects.requireNonNull(retryDelay, "retryDelay");
            if (maxTries < 0) {
                throw new IllegalArgumentException("maxTries must not be negative");
            }
        }
    }

    private final HeaderSource source;
    private final HeaderEventBroadcaster broadcaster;
    private final ReorgResolver resolver;
    private final Settings settings;
    private final WatcherConnectionTracker tracker;
    private final FatalErrorHandler fatalErrorHandler;

    private final AtomicBoolean started = new AtomicBoolean();
    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private volatile boolean stopping;
    private volatile Thread worker;
    private volatile HeaderConnection liveConnection;
    private volatile BlockHeader lastAccepted;
    private volatile int consecutiveFailures;

    public ChainTipWatcher(HeaderSource source,
            HeaderEventBroadcaster broadcaster,
            ReorgResolver resolver,
            Settings settings,
            WatcherConnectionTracker tracker,
            FatalErrorHandler fatalErrorHandler) {
        this.source = source;
        this.broadcaster = broadcaster;
        this.resolver = resolver;
        this.settings = settings;
        this.tracker = tracker;
        this.fatalErrorHandler = fatalErrorHandler;
    }

    /**
     * Starts the background task and returns a first subscription, created
     * before any event can be published.
     */
    public HeaderEventBroadcaster.Subscription start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("chain tip watcher already started");
        }
        HeaderEventBroadcaster.Subscription subscription = broadcaster.subscribe();
        Thread thread = new DaemonThreadFactory("chain-tip-watcher").newThread(this::run);
        worker = thread;
        logger.info("Starting chain tip watcher on {}", source.describe());
        thread.start();
        return subscription;
    }

    public HeaderEventBroadcaster.Subscription subscribe() {
        return broadcaster.subscribe();
    }

    /**
     * Requests shutdown and waits briefly for the background task to end.
     */
    public void stop() {
        stopping = true;
        HeaderConnection connection = liveConnection;
        if (connection != null) {
            connection.close();
        }
        Thread thread = worker;
        if (thread != null && thread != Thread.currentThread()) {
            thread.interrupt();
            try {
                thread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Completes normally after {@link #stop()}, exceptionally when the retry
     * budget ran out.
     */
    public CompletableFuture<Void> termination() {
        return termination;
    }

    public BlockHeader getLastAccepted() {
        return lastAccepted;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public WatcherConnectionTracker getTracker() {
        return tracker;
    }

    private void run() {
        int failures = 0;
        Throwable lastFailure = null;
        try {
            while (!stopping) {
                BlockHeader first = lastAccepted;
                try {
                    runOnce();
                } catch (WatcherException ex) {
                    lastFailure = ex;
                    tracker.onError(ex);
                    if (!stopping) {
                        logger.error("Chain tip watcher connection to {} failed: {}", source.describe(), ex.getMessage());
                    }
                }
                if (stopping) {
                    break;
                }
                if (lastAccepted != first) {
                    failures = 0;
                }
                if (failures > settings.maxTries()) {
                    fail(new WatcherException(WatcherException.Reason.RETRIES_EXHAUSTED,
                            "no progress after " + failures + " retries", lastFailure));
                    return;
                }
                Thread.sleep(settings.retryDelay().toMillis());
                failures++;
                consecutiveFailures = failures;
            }
            logger.info("Chain tip watcher stopped");
            termination.complete(null);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            if (stopping) {
                logger.info("Chain tip watcher stopped");
                termination.complete(null);
            } else {
                fail(ex);
            }
        } catch (RuntimeException ex) {
            fail(ex);
        } finally {
            broadcaster.close();
        }
    }

    private void fail(Throwable error) {
        logger.error("Chain tip watcher terminated: {}", error.getMessage());
        // the watchdog hears about it before anyone waiting on termination wakes up
        try {
            fatalErrorHandler.onFatalError("chain tip watcher", error);
        } finally {
            termination.completeExceptionally(error);
        }
    }

    /**
     * One connection cycle. Returns normally only when stopping.
     */
    private void runOnce() throws WatcherException, InterruptedException {
        tracker.onConnectAttempt();
        HeaderConnection connection;
        try {
            connection = source.connect();
        } catch (WatcherException ex) {
            tracker.onConnectFailure(ex);
            throw ex;
        }
        liveConnection = connection;
        tracker.onConnect();
        try {
            streamHeaders(connection);
        } finally {
            liveConnection = null;
            connection.close();
            tracker.onDisconnect();
        }
    }

    private void streamHeaders(HeaderConnection connection) throws WatcherException, InterruptedException {
        HeaderFeed push = new SubscriptionHeaderFeed(connection.subscription(), tracker);
        HeaderFeed poll = new LatestHeaderPoller(connection, settings.fetchTimeout());

        if (lastAccepted == null && !stopping) {
            BlockHeader initial = await(poll.next());
            ReorgResolver.checkWellFormed(initial);
            logger.info("Initial chain tip {}", initial);
            accept(new ReorgResolver.Resolution(List.of(new HeaderEvent.HeaderAccepted(initial)), initial, 0));
        }

        CompletableFuture<BlockHeader> pushed = null;
        while (!stopping) {
            if (pushed == null) {
                pushed = push.next();
            }
            BlockHeader candidate;
            try {
                candidate = pushed.get(settings.pollDelay().toMillis(), TimeUnit.MILLISECONDS);
                pushed = null;
            } catch (TimeoutException ex) {
                CompletableFuture<BlockHeader> polled = poll.next();
                awaitEither(pushed, polled);
                if (pushed.isDone() && !pushed.isCompletedExceptionally()) {
                    candidate = pushed.join();
                    pushed = null;
                } else if (polled.isDone() && !polled.isCompletedExceptionally()) {
                    candidate = polled.join();
                } else {
                    throw failureOf(pushed.isCompletedExceptionally() ? pushed : polled);
                }
            } catch (ExecutionException ex) {
                throw LatestHeaderPoller.translate(ex.getCause());
            }
            handleCandidate(connection, candidate);
        }
    }

    private void handleCandidate(HeaderConnection connection, BlockHeader candidate)
            throws WatcherException, InterruptedException {
        ReorgResolver.checkWellFormed(candidate);
        BlockHeader last = lastAccepted;
        if (candidate.number() <= last.number()) {
            logger.debug("Ignoring stale header {} (last accepted {})", candidate, last);
            return;
        }
        ReorgResolver.Resolution resolution = resolver.resolve(last, candidate, id -> fetch(connection, id));
        if (resolution.isReorg()) {
            tracker.onReorg(resolution.rewound());
        }
        accept(resolution);
    }

    private void accept(ReorgResolver.Resolution resolution) {
        broadcaster.publishAll(resolution.events());
        for (HeaderEvent event : resolution.events()) {
            if (event instanceof HeaderEvent.HeaderAccepted) {
                tracker.onHeaderAccepted();
            }
        }
        lastAccepted = resolution.head();
    }

    private BlockHeader fetch(HeaderConnection connection, BlockId id) throws WatcherException, InterruptedException {
        BlockHeader header;
        try {
            header = connection.fetchHeader(id).get(settings.fetchTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            throw new WatcherException(WatcherException.Reason.TIMEOUT, "fetching header " + id + " timed out", ex);
        } catch (ExecutionException ex) {
            throw LatestHeaderPoller.translate(ex.getCause());
        }
        if (header == null) {
            throw new WatcherException(WatcherException.Reason.NOT_FOUND, "header " + id + " not found");
        }
        return header;
    }

    private static void awaitEither(CompletableFuture<BlockHeader> first, CompletableFuture<BlockHeader> second)
            throws InterruptedException {
        try {
            CompletableFuture.anyOf(first, second).get();
        } catch (ExecutionException ex) {
            // inspected by the caller through the individual futures
            logger.trace("Header race completed exceptionally: {}", ex.getMessage());
        }
    }

    private static BlockHeader await(CompletableFuture<BlockHeader> future) throws WatcherException, InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            throw LatestHeaderPoller.translate(ex.getCause());
        }
    }

    private static WatcherException failureOf(CompletableFuture<BlockHeader> future) {
        try {
            future.join();
            return new WatcherException(WatcherException.Reason.TRANSPORT, "header feed failed");
        } catch (RuntimeException ex) {
            return LatestHeaderPoller.translate(ex);
        }
    }
}
