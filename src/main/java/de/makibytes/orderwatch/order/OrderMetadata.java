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
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Local bookkeeping for a stored order.
 *
 * @param invalidatedAtBlock block at which the order was last found invalid, {@code null} while valid
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderMetadata(
        @JsonProperty("orderHash") String hash,
        @JsonProperty("remainingFillableTakerAmount") @JsonFormat(shape = JsonFormat.Shape.STRING) BigInteger remaining,
        @JsonProperty("state") OrderStatus status,
        Instant createdAt,
        Long invalidatedAtBlock) {

    public static OrderMetadata added(SignedOrderState state, Instant createdAt) {
        return new OrderMetadata(state.hash(), state.takerTokenFillableAmount(), OrderStatus.ADDED, createdAt, null);
    }

    public OrderMetadata withState(SignedOrderState state) {
        return new OrderMetadata(hash, state.takerTokenFillableAmount(), state.status(), createdAt, null);
    }

    public OrderMetadata invalidatedAt(long blockNumber, SignedOrderState state) {
        return new OrderMetadata(hash, state.takerTokenFillableAmount(), state.status(), createdAt, blockNumber);
    }

    public boolean isInvalid() {
        return invalidatedAtBlock != null;
    }
}
