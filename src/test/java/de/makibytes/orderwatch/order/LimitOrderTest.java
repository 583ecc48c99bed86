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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

@DisplayName("LimitOrder Tests")
class LimitOrderTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    @Test
    @DisplayName("signed order is read from the wire format")
    void deserializeSignedOrder() throws Exception {
        String json = """
                {
                  "order": {
                    "makerToken": "0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2",
                    "takerToken": "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48",
                    "makerAmount": "1000000000000000000",
                    "takerAmount": "1500000000",
                    "takerTokenFeeAmount": "0",
                    "maker": "0x56178a0d5f301baf6cf3e1cd53d9863437345bf9",
                    "taker": "0x0000000000000000000000000000000000000000",
                    "sender": "0x0000000000000000000000000000000000000000",
                    "feeRecipient": "0x0000000000000000000000000000000000000000",
                    "pool": "0x0000000000000000000000000000000000000000000000000000000000000000",
                    "expiry": 1900000000,
                    "salt": "7",
                    "chainId": 1,
                    "verifyingContract": "0xDef1C0ded9bec7F1a1670819833240f027b25EfF",
                    "signature": "ignored"
                  },
                  "signature": {
                    "signatureType": 2,
                    "v": 27,
                    "r": "0x1111111111111111111111111111111111111111111111111111111111111111",
                    "s": "0x2222222222222222222222222222222222222222222222222222222222222222"
                  }
                }
                """;

        SignedOrder signed = mapper.readValue(json, SignedOrder.class);

        assertEquals(TestOrders.signedOrder(7), signed);
        assertEquals(SignatureType.EIP712, signed.signature().signatureType());
    }

    @Test
    @DisplayName("amounts are written as decimal strings")
    void serializeAmountsAsStrings() throws Exception {
        JsonNode node = mapper.valueToTree(TestOrders.limitOrder(7));

        assertTrue(node.get("makerAmount").isTextual());
        assertEquals("1000000000000000000", node.get("makerAmount").asText());
        assertEquals(TestOrders.EXCHANGE, node.get("verifyingContract").asText());
    }

    @Test
    @DisplayName("unsupported signature type is rejected")
    void unsupportedSignatureType() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> SignatureType.fromCode(4));
        assertTrue(ex.getMessage().contains("Unsupported signature type 4"));
    }

    @Test
    @DisplayName("amounts outside uint128 and malformed addresses are rejected")
    void rangeAndFormatChecks() {
        LimitOrder base = TestOrders.limitOrder(1);
        BigInteger tooLarge = BigInteger.ONE.shiftLeft(128);

        assertThrows(IllegalArgumentException.class, () -> new LimitOrder(base.makerToken(), base.takerToken(),
                tooLarge, base.takerAmount(), base.takerTokenFeeAmount(), base.maker(), base.taker(),
                base.sender(), base.feeRecipient(), base.pool(), base.expiry(), base.salt(), base.chainId(),
                base.verifyingContract()));
        assertThrows(IllegalArgumentException.class, () -> new LimitOrder(base.makerToken(), base.takerToken(),
                base.makerAmount(), BigInteger.ONE.negate(), base.takerTokenFeeAmount(), base.maker(), base.taker(),
                base.sender(), base.feeRecipient(), base.pool(), base.expiry(), base.salt(), base.chainId(),
                base.verifyingContract()));
        assertThrows(IllegalArgumentException.class, () -> new LimitOrder("0x1234", base.takerToken(),
                base.makerAmount(), base.takerAmount(), base.takerTokenFeeAmount(), base.maker(), base.taker(),
                base.sender(), base.feeRecipient(), base.pool(), base.expiry(), base.salt(), base.chainId(),
                base.verifyingContract()));
        assertThrows(IllegalArgumentException.class, () -> Addresses.normalize("0x" + "zz".repeat(20), "maker"));
    }
}
