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
 * The chain this instance serves: orders for another chain or exchange are
 * rejected before any RPC call is made.
 */
public record ChainInfo(long chainId, String exchange, String flashWallet, int maxReorg) {

    public ChainInfo {
        exchange = Addresses.normalize(exchange, "exchange");
        flashWallet = Addresses.normalize(flashWallet, "flashWallet");
    }

    public void validate(LimitOrder order) throws OrderValidationException {
        if (order.makerAmount().signum() == 0) {
            throw new OrderValidationException(OrderValidationException.Reason.ZERO_MAKER_AMOUNT);
        }
        if (order.takerAmount().signum() == 0) {
            throw new OrderValidationException(OrderValidationException.Reason.ZERO_TAKER_AMOUNT);
        }
        if (Addresses.isZero(order.maker())) {
            throw new OrderValidationException(OrderValidationException.Reason.INVALID_MAKER_ADDRESS);
        }
        if (order.taker().equals(flashWallet)) {
            throw new OrderValidationException(OrderValidationException.Reason.INVALID_TAKER_ADDRESS);
        }
        if (order.chainId() != chainId) {
            throw new OrderValidationException(OrderValidationException.Reason.INVALID_VERIFYING_CONTRACT);
        }
        if (!order.verifyingContract().equals(exchange)) {
            throw new OrderValidationException(OrderValidationException.Reason.INVALID_VERIFYING_CONTRACT);
        }
    }
}
