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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import de.makibytes.orderwatch.order.SignedOrderWithMetadata;

/**
 * Writes every order event as one JSON line to the {@code order-events} logger.
 */
public class LoggingOrderEventPublisher implements OrderEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger("order-events");

    private final ObjectMapper mapper;

    public LoggingOrderEventPublisher(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void publish(SignedOrderWithMetadata order) throws OrderPublishException {
        try {
            logger.info(mapper.writeValueAsString(order));
        } catch (JsonProcessingException ex) {
            throw new OrderPublishException("cannot serialize order " + order.hash(), ex);
        }
    }
}
