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

/**
 * Failure of one connection cycle of the chain tip watcher.
 *
 * <p>
 * Every reason except {@link Reason#RETRIES_EXHAUSTED} is retryable: it ends the
 * current connection and consumes one unit of the failure budget.
 */
public class WatcherException extends Exception {

    public enum Reason {
        TRANSPORT,
        TIMEOUT,
        END_OF_STREAM,
        NOT_FOUND,
        NUMBER_MISSING,
        HASH_MISSING,
        REORG_OVERFLOW,
        INSANE_PARENT_HASH,
        INSANE_NUMBER,
        RETRIES_EXHAUSTED
    }

    private final Reason reason;

    public WatcherException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public WatcherException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String getMessage() {
        return reason + ": " + super.getMessage();
    }
}
