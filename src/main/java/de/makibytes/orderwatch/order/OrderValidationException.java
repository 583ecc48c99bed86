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

public class OrderValidationException extends Exception {

    public enum Reason {
        ZERO_MAKER_AMOUNT("ORDER_HAS_INVALID_MAKER_ASSET_AMOUNT: order makerAssetAmount cannot be 0"),
        ZERO_TAKER_AMOUNT("ORDER_HAS_INVALID_TAKER_ASSET_AMOUNT: order takerAssetAmount cannot be 0"),
        INVALID_MAKER_ADDRESS("ORDER_HAS_INVALID_MAKER_ASSET_DATA: order makerAssetData must encode a supported assetData type"),
        INVALID_TAKER_ADDRESS("ORDER_HAS_INVALID_TAKER_ASSET_DATA: order takerAssetData must encode a supported assetData type"),
        INVALID_VERIFYING_CONTRACT("INCORRECT_EXCHANGE_ADDRESS: the exchange address for the order does not match the chain ID/network ID"),
        INVALID_SIGNATURE("ORDER_HAS_INVALID_SIGNATURE: order signature must be valid"),
        CANCELLED("ORDER_CANCELLED: order cancelled"),
        EXPIRED("ORDER_EXPIRED: order expired according to latest block timestamp"),
        UNFUNDED("ORDER_UNFUNDED: maker has insufficient balance or allowance for this order to be filled"),
        FULLY_FILLED("ORDER_FULLY_FILLED: order already fully filled");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }

        /**
         * The stable code before the colon, e.g. {@code ORDER_CANCELLED}.
         */
        public String code() {
            return message.substring(0, message.indexOf(':'));
        }
    }

    private final Reason reason;

    public OrderValidationException(Reason reason) {
        super(reason.message());
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
