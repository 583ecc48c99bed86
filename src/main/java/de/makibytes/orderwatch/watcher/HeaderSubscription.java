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
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

import de.makibytes.orderwatch.model.BlockHeader;

/**
 * Push side of a header connection. The transport calls {@link #offer} for
 * every new head and {@link #close} when the stream ends; the watcher pulls
 * with {@link #next()}.
 *
 * <p>
 * Heads arriving while nobody waits are kept in a small backlog. When the
 * backlog is full the oldest head is dropped, the watcher only needs the newest
 * one to detect progress.
 */
public class HeaderSubscription {

    static final int BACKLOG_LIMIT = 64;

    private final Deque<BlockHeader> backlog = new ArrayDeque<>();
    private CompletableFuture<BlockHeader> pending;
    private boolean closed;
    private Throwable closeCause;

    public CompletableFuture<BlockHeader> next() {
        synchronized (this) {
            if (pending != null && !pending.isDone()) {
                return pending;
            }
            BlockHeader buffered = backlog.pollFirst();
            if (buffered != null) {
                return CompletableFuture.completedFuture(buffered);
            }
            if (closed) {
                return CompletableFuture.failedFuture(endOfStream());
            }
            pending = new CompletableFuture<>();
            return pending;
        }
    }

    public void offer(BlockHeader header) {
        if (header == null) {
            return;
        }
        CompletableFuture<BlockHeader> waiter;
        synchronized (this) {
            if (closed) {
                return;
            }
            waiter = pending != null && !pending.isDone() ? pending : null;
            pending = null;
            if (waiter == null) {
                enqueue(header);
                return;
            }
        }
        if (!waiter.complete(header)) {
            // waiter was cancelled concurrently
            synchronized (this) {
                enqueue(header);
            }
        }
    }

    public void close(Throwable cause) {
        CompletableFuture<BlockHeader> waiter;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            closeCause = cause;
            waiter = pending;
            pending = null;
        }
        if (waiter != null) {
            waiter.completeExceptionally(endOfStream());
        }
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    synchronized int backlogSize() {
        return backlog.size();
    }

    private void enqueue(BlockHeader header) {
        if (backlog.size() >= BACKLOG_LIMIT) {
            backlog.pollFirst();
        }
        backlog.addLast(header);
    }

    private WatcherException endOfStream() {
        String message = closeCause == null ? "header subscription closed" : "header subscription closed: " + closeCause.getMessage();
        return new WatcherException(WatcherException.Reason.END_OF_STREAM, message, closeCause);
    }
}
