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

/**
 * Outcome of a failed state request. Every waiter of a failed batch receives
 * the same instance.
 */
public class StateFetchException extends Exception {

    public enum Reason {
        QUERY_FAILED,
        INVALID_OUTPUT_LENGTH,
        UNAVAILABLE
    }

    private final Reason reason;

    public StateFetchException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public StateFetchException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
