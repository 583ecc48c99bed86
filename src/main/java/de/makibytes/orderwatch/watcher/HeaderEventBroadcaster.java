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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.makibytes.orderwatch.model.HeaderEvent;

/**
 * Fans watcher events out to any number of subscribers.
 *
 * <p>
 * Each subscriber owns a bounded backlog. Publishing never blocks: when a
 * backlog is full its oldest event is dropped and counted, so a slow subscriber
 * skips events instead of stalling the watcher.
 */
public class HeaderEventBroadcaster {

    private static final Logger logger = LoggerFactory.getLogger(HeaderEventBroadcaster.class);

    private final int capacity;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public HeaderEventBroadcaster(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    public Subscription subscribe() {
        Subscription subscription = new Subscription();
        subscriptions.add(subscription);
        if (closed) {
            subscription.close();
        }
        return subscription;
    }

    public void publish(HeaderEvent event) {
        for (Subscription subscription : subscriptions) {
            subscription.offer(event);
        }
    }

    public void publishAll(List<HeaderEvent> events) {
        for (HeaderEvent event : events) {
            publish(event);
        }
    }

    /**
     * Closes every subscription. Subscribers drain what is already queued and
     * then see the end of the stream.
     */
    public void close() {
        closed = true;
        for (Subscription subscription : subscriptions) {
            subscription.close();
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    public final class Subscription implements AutoCloseable {

        private final ReentrantLock lock = new ReentrantLock();
        private final Condition notEmpty = lock.newCondition();
        private final Deque<HeaderEvent> backlog = new ArrayDeque<>();
        private long skipped;
        private boolean subscriptionClosed;

        private Subscription() {
        }

        private void offer(HeaderEvent event) {
            lock.lock();
            try {
                if (subscriptionClosed) {
                    return;
                }
                if (backlog.size() >= capacity) {
                    backlog.pollFirst();
                    skipped++;
                    if (skipped == 1 || skipped % 100 == 0) {
                        logger.warn("Slow header event subscriber, {} event(s) skipped so far", skipped);
                    }
                }
                backlog.addLast(event);
                notEmpty.signal();
            } finally {
                lock.unlock();
            }
        }

        /**
         * Blocks for the next event. Returns {@code null} once the subscription
         * is closed and drained.
         */
        public HeaderEvent take() throws InterruptedException {
            lock.lockInterruptibly();
            try {
                while (backlog.isEmpty()) {
                    if (subscriptionClosed) {
                        return null;
                    }
                    notEmpty.await();
                }
                return backlog.pollFirst();
            } finally {
                lock.unlock();
            }
        }

        /**
         * Waits up to {@code timeout} for the next event, {@code null} if none arrived.
         */
        public HeaderEvent poll(Duration timeout) throws InterruptedException {
            long remaining = timeout.toNanos();
            lock.lockInterruptibly();
            try {
                while (backlog.isEmpty()) {
                    if (subscriptionClosed || remaining <= 0) {
                        return null;
                    }
                    remaining = notEmpty.awaitNanos(remaining);
                }
                return backlog.pollFirst();
            } finally {
                lock.unlock();
            }
        }

        public long skippedEvents() {
            lock.lock();
            try {
                return skipped;
            } finally {
                lock.unlock();
            }
        }

        public int queuedEvents() {
            lock.lock();
            try {
                return backlog.size();
            } finally {
                lock.unlock();
            }
        }

        public boolean isClosed() {
            lock.lock();
            try {
                return subscriptionClosed;
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void close() {
            lock.lock();
            try {
                subscriptionClosed = true;
                notEmpty.signalAll();
            } finally {
                lock.unlock();
            }
            subscriptions.remove(this);
        }
    }
}
