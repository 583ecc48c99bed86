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

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

public class WatcherConnectionTracker {

    private final AtomicLong connectAttemptCount = new AtomicLong();
    private final AtomicLong connectCount = new AtomicLong();
    private final AtomicLong disconnectCount = new AtomicLong();
    private final AtomicLong connectFailureCount = new AtomicLong();
    private final AtomicLong headsReceived = new AtomicLong();
    private final AtomicLong headersAccepted = new AtomicLong();
    private final AtomicLong headersRewound = new AtomicLong();
    private final AtomicLong reorgCount = new AtomicLong();
    private final AtomicReference<Instant> connectedSince = new AtomicReference<>();
    private final AtomicReference<Instant> lastDisconnectedAt = new AtomicReference<>();
    private final AtomicReference<String> lastError = new AtomicReference<>();

    public void onConnectAttempt() {
        connectAttemptCount.incrementAndGet();
    }

    public void onConnect() {
        connectCount.incrementAndGet();
        connectedSince.set(Instant.now());
        lastError.set(null);
    }

    public void onDisconnect() {
        if (connectedSince.getAndSet(null) != null) {
            disconnectCount.incrementAndGet();
            lastDisconnectedAt.set(Instant.now());
        }
    }

    public void onConnectFailure(Throwable error) {
        connectFailureCount.incrementAndGet();
        onError(error);
    }

    public void onError(Throwable error) {
        if (error != null) {
            String message = error.getMessage();
            lastError.set(message == null || message.isBlank() ? error.getClass().getSimpleName() : message);
        }
    }

    public void onHeadReceived() {
        headsReceived.incrementAndGet();
    }

    public void onHeaderAccepted() {
        headersAccepted.incrementAndGet();
    }

    public void onReorg(int rewoundHeaders) {
        reorgCount.incrementAndGet();
        headersRewound.addAndGet(rewoundHeaders);
    }

    public long getConnectAttemptCount() {
        return connectAttemptCount.get();
    }

    public long getConnectCount() {
        return connectCount.get();
    }

    public long getDisconnectCount() {
        return disconnectCount.get();
    }

    public long getConnectFailureCount() {
        return connectFailureCount.get();
    }

    public long getHeadsReceived() {
        return headsReceived.get();
    }

    public long getHeadersAccepted() {
        return headersAccepted.get();
    }

    public long getHeadersRewound() {
        return headersRewound.get();
    }

    public long getReorgCount() {
        return reorgCount.get();
    }

    public Instant getConnectedSince() {
        return connectedSince.get();
    }

    public Instant getLastDisconnectedAt() {
        return lastDisconnectedAt.get();
    }

    public String getLastError() {
        return lastError.get();
    }
}
