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

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * An off-chain limit order of the exchange. Amounts are unsigned integers sent
 * as decimal strings on the wire.
 *
 * <p>
 * Record equality covers every field, which makes the order usable as a
 * deduplication key for state requests.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LimitOrder(
        String makerToken,
        String takerToken,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigInteger makerAmount,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigInteger takerAmount,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigInteger takerTokenFeeAmount,
        String maker,
        String taker,
        String sender,
        String feeRecipient,
        String pool,
        long expiry,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigInteger salt,
        long chainId,
        String verifyingContract) {

    private static final BigInteger UINT128_LIMIT = BigInteger.ONE.shiftLeft(128);
    private static final BigInteger UINT256_LIMIT = BigInteger.ONE.shiftLeft(256);

    public LimitOrder {
        makerToken = Addresses.normalize(makerToken, "makerToken");
        takerToken = Addresses.normalize(takerToken, "takerToken");
        maker = Addresses.normalize(maker, "maker");
        taker = Addresses.normalize(taker, "taker");
        sender = Addresses.normalize(sender, "sender");
        feeRecipient = Addresses.normalize(feeRecipient, "feeRecipient");
        verifyingContract = Addresses.normalize(verifyingContract, "verifyingContract");
        pool = Addresses.normalizeBytes32(pool, "pool");
        checkRange(makerAmount, UINT128_LIMIT, "makerAmount");
        checkRange(takerAmount, UINT128_LIMIT, "takerAmount");
        checkRange(takerTokenFeeAmount, UINT128_LIMIT, "takerTokenFeeAmount");
        checkRange(salt, UINT256_LIMIT, "salt");
        if (expiry < 0) {
            throw new IllegalArgumentException("expiry must not be negative");
        }
    }

    private static void checkRange(BigInteger value, BigInteger limit, String field) {
        Objects.requireNonNull(value, field);
        if (value.signum() < 0 || value.compareTo(limit) >= 0) {
            throw new IllegalArgumentException(field + " is out of range");
        }
    }
}
