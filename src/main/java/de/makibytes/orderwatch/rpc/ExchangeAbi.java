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
package de.makibytes.orderwatch.rpc;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.StaticStruct;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint128;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint64;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.crypto.Hash;

import de.makibytes.orderwatch.order.LimitOrder;
import de.makibytes.orderwatch.order.OrderStatus;
import de.makibytes.orderwatch.order.Signature;
import de.makibytes.orderwatch.order.SignedOrder;
import de.makibytes.orderwatch.order.SignedOrderState;

/**
 * ABI coding of the exchange's
 * {@code batchGetLimitOrderRelevantStates(LimitOrder[], Signature[])}.
 *
 * <p>
 * Both input tuples are static, so every order adds exactly 512 bytes
 * (12 words of order, 4 words of signature) to a fixed 132 byte frame.
 */
public final class ExchangeAbi {

    public static final String FUNCTION_SIGNATURE = "batchGetLimitOrderRelevantStates("
            + "(address,address,uint128,uint128,uint128,address,address,address,address,bytes32,uint64,uint256)[],"
            + "(uint8,uint8,bytes32,bytes32)[])";

    public static final String SELECTOR = Hash.sha3String(FUNCTION_SIGNATURE).substring(0, 10);

    @SuppressWarnings({"rawtypes", "unchecked"})
    private static final List<TypeReference<Type>> RESULT_TYPES = (List) List.of(
            new TypeReference<DynamicArray<OrderInfo>>() {},
            new TypeReference<DynamicArray<Uint128>>() {},
            new TypeReference<DynamicArray<Bool>>() {});

    private ExchangeAbi() {}

    public static final class LimitOrderTuple extends StaticStruct {

        public LimitOrderTuple(LimitOrder order) {
            super(new Address(order.makerToken()),
                    new Address(order.takerToken()),
                    new Uint128(order.makerAmount()),
                    new Uint128(order.takerAmount()),
                    new Uint128(order.takerTokenFeeAmount()),
                    new Address(order.maker()),
                    new Address(order.taker()),
                    new Address(order.sender()),
                    new Address(order.feeRecipient()),
                    new Bytes32(EthHex.decodeHex(order.pool())),
                    new Uint64(BigInteger.valueOf(order.expiry())),
                    new Uint256(order.salt()));
        }
    }

    /**
     * {@code (bytes32 orderHash, uint8 status, uint128 takerTokenFilledAmount)}.
     * The decoder sizes array elements by the public fields, so each component has one.
     */
    public static final class OrderInfo extends StaticStruct {

        public final byte[] orderHash;
        public final BigInteger status;
        public final BigInteger takerTokenFilledAmount;

        public OrderInfo(Bytes32 orderHash, Uint8 status, Uint128 takerTokenFilledAmount) {
            super(orderHash, status, takerTokenFilledAmount);
            this.orderHash = orderHash.getValue();
            this.status = status.getValue();
            this.takerTokenFilledAmount = takerTokenFilledAmount.getValue();
        }
    }

    public static final class SignatureTuple extends StaticStruct {

        public SignatureTuple(Signature signature) {
            super(new Uint8(BigInteger.valueOf(signature.signatureType().code())),
                    new Uint8(BigInteger.valueOf(signature.v())),
                    new Bytes32(EthHex.decodeHex(signature.r())),
                    new Bytes32(EthHex.decodeHex(signature.s())));
        }
    }

    /**
     * Full call data: selector followed by the encoded arguments.
     */
    public static String encodeCall(List<SignedOrder> orders) {
        List<LimitOrderTuple> orderTuples = new ArrayList<>(orders.size());
        List<SignatureTuple> signatureTuples = new ArrayList<>(orders.size());
        for (SignedOrder signed : orders) {
            orderTuples.add(new LimitOrderTuple(signed.order()));
            signatureTuples.add(new SignatureTuple(signed.signature()));
        }
        @SuppressWarnings("rawtypes")
        List<Type> arguments = List.of(
                new DynamicArray<>(LimitOrderTuple.class, orderTuples),
                new DynamicArray<>(SignatureTuple.class, signatureTuples));
        return SELECTOR + FunctionEncoder.encodeConstructor(arguments);
    }

    /**
     * Decodes {@code (OrderInfo[], uint128[], bool[])} into one state per order.
     *
     * @throws IllegalArgumentException when the return data is malformed
     */
    public static List<SignedOrderState> decodeResult(String hex) {
        List<Type> decoded;
        try {
            decoded = FunctionReturnDecoder.decode(hex, RESULT_TYPES);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("malformed return data: " + e.getMessage(), e);
        }
        if (decoded.size() != RESULT_TYPES.size()) {
            throw new IllegalArgumentException("expected " + RESULT_TYPES.size() + " outputs, got " + decoded.size());
        }
        @SuppressWarnings("unchecked")
        List<OrderInfo> infos = ((DynamicArray<OrderInfo>) decoded.get(0)).getValue();
        @SuppressWarnings("unchecked")
        List<Uint128> fillables = ((DynamicArray<Uint128>) decoded.get(1)).getValue();
        @SuppressWarnings("unchecked")
        List<Bool> validities = ((DynamicArray<Bool>) decoded.get(2)).getValue();
        if (fillables.size() != infos.size() || validities.size() != infos.size()) {
            throw new IllegalArgumentException("inconsistent array lengths in return data");
        }

        List<SignedOrderState> states = new ArrayList<>(infos.size());
        for (int i = 0; i < infos.size(); i++) {
            OrderInfo info = infos.get(i);
            OrderStatus status = OrderStatus.fromContractCode(info.status.intValueExact());
            states.add(new SignedOrderState(EthHex.encodeHex(info.orderHash, 0, info.orderHash.length), status,
                    info.takerTokenFilledAmount, fillables.get(i).getValue(), validities.get(i).getValue()));
        }
        return states;
    }
}
