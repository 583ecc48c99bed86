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
package de.makibytes.orderwatch.service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import de.makibytes.orderwatch.batch.BatchQuery;
import de.makibytes.orderwatch.batch.BatchQueryException;
import de.makibytes.orderwatch.order.OrderStatus;
import de.makibytes.orderwatch.order.SignedOrder;
import de.makibytes.orderwatch.order.SignedOrderState;
import de.makibytes.orderwatch.order.TestOrders;

/**
 * Exchange contract stand-in: the state of an order is looked up by its salt,
 * which also determines the order hash.
 */
class FakeExchange implements BatchQuery<SignedOrder, SignedOrderState> {

    private final Map<Long, SignedOrderState> states = new ConcurrentHashMap<>();
    final List<List<SignedOrder>> calls = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    void set(long salt, OrderStatus status, long fillable) {
        states.put(salt, TestOrders.state(salt, status, fillable));
    }

    void setSignatureInvalid(long salt) {
        states.put(salt, new SignedOrderState(TestOrders.hash(salt), OrderStatus.FILLABLE,
                BigInteger.ZERO, BigInteger.ONE, false));
    }

    void fail(boolean failing) {
        this.failing = failing;
    }

    @Override
    public List<SignedOrderState> query(List<SignedOrder> orders) throws BatchQueryException {
        calls.add(List.copyOf(orders));
        if (failing) {
            throw new BatchQueryException("execution reverted");
        }
        List<SignedOrderState> result = new ArrayList<>(orders.size());
        for (SignedOrder order : orders) {
            long salt = order.order().salt().longValueExact();
            SignedOrderState state = states.get(salt);
            result.add(state != null ? state : TestOrders.state(salt, OrderStatus.FILLABLE, 1000));
        }
        return result;
    }
}
