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

import java.util.List;

import de.makibytes.orderwatch.order.OrderValidationException;

/**
 * Submission failed. Either some orders were rejected by validation
 * ({@link #getRejections()} is non-empty) or an internal step failed.
 */
public class OrderSubmissionException extends Exception {

    private final List<OrderValidationException.Reason> rejections;

    public OrderSubmissionException(List<OrderValidationException.Reason> rejections) {
        super("Validation failed: " + rejections);
        this.rejections = List.copyOf(rejections);
    }

    public OrderSubmissionException(String message, Throwable cause) {
        super(message, cause);
        this.rejections = List.of();
    }

    public List<OrderValidationException.Reason> getRejections() {
        return rejections;
    }

    public boolean isRejected() {
        return !rejections.isEmpty();
    }
}
