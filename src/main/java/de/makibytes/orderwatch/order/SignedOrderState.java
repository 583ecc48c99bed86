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

import java.math.BigInteger;
import java.util.Objects;

/**
 * On-chain state of one order as reported by the exchange.
 */
public record SignedOrderState(
        String hash,
        OrderStatus status,
        BigInteger takerTokenFilledAmount,
        BigInteger takerTokenFillableAmount,
        boolean signatureValid) {

    public SignedOrderState {
        hash = Addresses.normalizeBytes32(hash, "hash");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(takerTokenFilledAmount, "takerTokenFilledAmount");
        Objects.requireNonNull(takerTokenFillableAmount, "takerTokenFillableAmount");
    }

    public void validate() throws OrderValidationException {
        if (!signatureValid) {
            throw new OrderValidationException(OrderValidationException.Reason.INVALID_SIGNATURE);
        }
        OrderValidationException.Reason rejection = switch (status) {
            case ADDED, FILLABLE -> null;
            case INVALID -> OrderValidationException.Reason.UNFUNDED;
            case FULLY_FILLED -> OrderValidationException.Reason.FULLY_FILLED;
            case CANCELLED -> OrderValidationException.Reason.CANCELLED;
            case EXPIRED -> OrderValidationException.Reason.EXPIRED;
        };
        if (rejection != null) {
            throw new OrderValidationException(rejection);
        }
    }

    public boolean isValid() {
        try {
            validate();
            return true;
        } catch (OrderValidationException ex) {
            return false;
        }
    }
}
