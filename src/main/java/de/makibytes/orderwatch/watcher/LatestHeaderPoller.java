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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import de.makibytes.orderwatch.model.BlockHeader;
import de.makibytes.orderwatch.model.BlockId;

/**
 * Poll feed: asks the node for its latest header, bounded by the fetch timeout.
 * Used when the push subscription has been silent for a while.
 */
public class LatestHeaderPoller implements HeaderFeed {

    private final HeaderConnection connection;
    private final Duration fetchTimeout;

    public LatestHeaderPoller(HeaderConnection connection, Duration fetchTimeout) {
        this.connection = connection;
        this.fetchTimeout = fetchTimeout;
    }

    @Override
    public CompletableFuture<BlockHeader> next() {
        return connection.fetchHeader(BlockId.latest())
                .orTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((header, error) -> {
                    if (error != null) {
                        throw new CompletionException(translate(error));
                    }
                    if (header == null) {
                        throw new CompletionException(
                                new WatcherException(WatcherException.Reason.NOT_FOUND, "node returned no latest header"));
                    }
                    return header;
                });
    }

    static WatcherException translate(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof WatcherException watcherException) {
            return watcherException;
        }
        if (cause instanceof TimeoutException) {
            return new WatcherException(WatcherException.Reason.TIMEOUT, "header fetch timed out", cause);
        }
        return new WatcherException(WatcherException.Reason.TRANSPORT, String.valueOf(cause.getMessage()), cause);
    }
}
