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

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ChainInfo Tests")
class ChainInfoTest {

    private final ChainInfo chainInfo = TestOrders.chainInfo();

    @Test
    @DisplayName("well formed order for this exchange passes")
    void validOrder() {
        assertDoesNotThrow(() -> chainInfo.validate(TestOrders.limitOrder(1)));
    }

    @Test
    @DisplayName("zero amounts are rejected")
    void zeroAmounts() {
        assertRejected(OrderValidationException.Reason.ZERO_MAKER_AMOUNT,
                withAmounts(BigInteger.ZERO, BigInteger.TEN));
        assertRejected(OrderValidationException.Reason.ZERO_TAKER_AMOUNT,
                withAmounts(BigInteger.TEN, BigInteger.ZERO));
    }

    @Test
    @DisplayName("zero maker and flash wallet taker are rejected")
    void invalidParties() {
        LimitOrder base = TestOrders.limitOrder(1);
        LimitOrder zeroMaker = new LimitOrder(base.makerToken(), base.takerToken(), base.makerAmount(),
                base.takerAmount(), base.takerTokenFeeAmount(), Addresses.ZERO, base.taker(), base.sender(),
                base.feeRecipient(), base.pool(), base.expiry(), base.salt(), base.chainId(), base.verifyingContract());
        LimitOrder flashTaker = new LimitOrder(base.makerToken(), base.takerToken(), base.makerAmount(),
                base.takerAmount(), base.takerTokenFeeAmount(), base.maker(), TestOrders.FLASH_WALLET.toUpperCase().replace("0X", "0x"),
                base.sender(), base.feeRecipient(), base.pool(), base.expiry(), base.salt(), base.chainId(),
                base.verifyingContract());

        assertRejected(OrderValidationException.Reason.INVALID_MAKER_ADDRESS, zeroMaker);
        assertRejected(OrderValidationException.Reason.INVALID_TAKER_ADDRESS, flashTaker);
    }

    @Test
    @DisplayName("other chain or exchange is rejected")
    void wrongDeployment() {
        LimitOrder base = TestOrders.limitOrder(1);
        LimitOrder otherChain = new LimitOrder(base.makerToken(), base.takerToken(), base.makerAmount(),
                base.takerAmount(), base.takerTokenFeeAmount(), base.maker(), base.taker(), base.sender(),
                base.feeRecipient(), base.pool(), base.expiry(), base.salt(), 137, base.verifyingContract());
        LimitOrder otherExchange = new LimitOrder(base.makerToken(), base.takerToken(), base.makerAmount(),
                base.takerAmount(), base.takerTokenFeeAmount(), base.maker(), base.taker(), base.sender(),
                base.feeRecipient(), base.pool(), base.expiry(), base.salt(), base.chainId(), TestOrders.MAKER);

        assertRejected(OrderValidationException.Reason.INVALID_VERIFYING_CONTRACT, otherChain);
        assertRejected(OrderValidationException.Reason.INVALID_VERIFYING_CONTRACT, otherExchange);
    }

    private LimitOrder withAmounts(BigInteger makerAmount, BigInteger takerAmount) {
        LimitOrder base = TestOrders.limitOrder(1);
        return new LimitOrder(base.makerToken(), base.takerToken(), makerAmount, takerAmount,
                base.takerTokenFeeAmount(), base.maker(), base.taker(), base.sender(), base.feeRecipient(),
                base.pool(), base.expiry(), base.salt(), base.chainId(), base.verifyingContract());
    }

    private void assertRejected(OrderValidationException.Reason reason, LimitOrder order) {
        OrderValidationException ex = assertThrows(OrderValidationException.class, () -> chainInfo.validate(order));
        assertEquals(reason, ex.getReason());
    }
}
