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

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import de.makibytes.orderwatch.order.OrderMetadata;
import de.makibytes.orderwatch.order.OrderStatus;
import de.makibytes.orderwatch.order.SignedOrderWithMetadata;
import de.makibytes.orderwatch.order.TestOrders;

@ExtendWith(OutputCaptureExtension.class)
@DisplayName("LoggingOrderEventPublisher Tests")
class LoggingOrderEventPublisherTest {

    @Test
    @DisplayName("order event is logged as JSON with its metadata")
    void logsOrderEvent(CapturedOutput output) throws Exception {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        SignedOrderWithMetadata order = new SignedOrderWithMetadata(TestOrders.signedOrder(3),
                OrderMetadata.added(TestOrders.state(3, OrderStatus.FILLABLE, 250), Instant.parse("2026-01-01T00:00:00Z")));

        new LoggingOrderEventPublisher(mapper).publish(order);

        assertTrue(output.getOut().contains("\"orderHash\":\"" + TestOrders.hash(3) + "\""));
        assertTrue(output.getOut().contains("\"remainingFillableTakerAmount\":\"250\""));
        assertTrue(output.getOut().contains("\"state\":\"ADDED\""));
        assertTrue(output.getOut().contains("\"createdAt\":\"2026-01-01T00:00:00Z\""));
    }
}
