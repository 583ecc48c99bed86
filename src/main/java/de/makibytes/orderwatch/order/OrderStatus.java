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
package de.makibytes.orderwatch.order;

/**
 * Order status. {@link #ADDED} is local only; the other values mirror the
 * exchange's {@code OrderStatus} codes.
 */
public enum OrderStatus {
    ADDED(-1),
    INVALID(0),
    FILLABLE(1),
    FULLY_FILLED(2),
    CANCELLED(3),
    EXPIRED(4);

    private final int contractCode;

    OrderStatus(int contractCode) {
        this.contractCode = contractCode;
    }

    public int contractCode() {
        return contractCode;
    }

    public static OrderStatus fromContractCode(int code) {
        for (OrderStatus status : values()) {
            if (status.contractCode == code && code >= 0) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown order status code " + code);
    }
}
