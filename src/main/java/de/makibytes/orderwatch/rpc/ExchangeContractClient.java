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

import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.makibytes.orderwatch.batch.BatchQuery;
import de.makibytes.orderwatch.batch.BatchQueryException;
import de.makibytes.orderwatch.order.SignedOrder;
import de.makibytes.orderwatch.order.SignedOrderState;

/**
 * Reads order states from the exchange contract with one {@code eth_call} per batch.
 */
public class ExchangeContractClient implements BatchQuery<SignedOrder, SignedOrderState> {

    private static final Logger logger = LoggerFactory.getLogger(ExchangeContractClient.class);

    private final JsonRpcHttpClient rpcClient;
    private final String exchange;

    public ExchangeContractClient(JsonRpcHttpClient rpcClient, String exchange) {
        this.rpcClient = rpcClient;
        this.exchange = exchange;
    }

    @Override
    public List<SignedOrderState> query(List<SignedOrder> orders) throws BatchQueryException {
        if (orders.isEmpty()) {
            return List.of();
        }
        String callData = ExchangeAbi.encodeCall(orders);
        long start = System.nanoTime();
        String returnData;
        try {
            returnData = rpcClient.ethCall(exchange, callData);
        } catch (IOException ex) {
            throw new BatchQueryException("eth_call batchGetLimitOrderRelevantStates failed: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new BatchQueryException("eth_call batchGetLimitOrderRelevantStates interrupted", ex);
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        logger.debug("batchGetLimitOrderRelevantStates for {} order(s) took {} ms", orders.size(), elapsedMs);
        try {
            return ExchangeAbi.decodeResult(returnData);
        } catch (IllegalArgumentException | ArithmeticException ex) {
            throw new BatchQueryException("undecodable batchGetLimitOrderRelevantStates result: " + ex.getMessage(), ex);
        }
    }
}
