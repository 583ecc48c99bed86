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
package de.makibytes.orderwatch.web;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import de.makibytes.orderwatch.batch.StateBatcher;
import de.makibytes.orderwatch.order.SignedOrder;
import de.makibytes.orderwatch.order.SignedOrderState;
import de.makibytes.orderwatch.service.OrderRevalidationService;
import de.makibytes.orderwatch.store.InMemoryOrderStore;
import de.makibytes.orderwatch.watcher.ChainTipWatcher;

@RestController
public class StatusController {

    private final ChainTipWatcher watcher;
    private final StateBatcher<SignedOrder, SignedOrderState> batcher;
    private final InMemoryOrderStore store;
    private final OrderRevalidationService revalidation;

    public StatusController(ChainTipWatcher watcher,
            StateBatcher<SignedOrder, SignedOrderState> batcher,
            InMemoryOrderStore store,
            OrderRevalidationService revalidation) {
        this.watcher = watcher;
        this.batcher = batcher;
        this.store = store;
        this.revalidation = revalidation;
    }

    @GetMapping("/api/status")
    public StatusView status() {
        return new StatusView(
                StatusView.WatcherStatus.of(watcher.getLastAccepted(), watcher.getConsecutiveFailures(), watcher.getTracker()),
                StatusView.BatcherStatus.of(batcher.queuedJobs(), batcher.getStatistics()),
                StatusView.OrderSummary.of(store.count(), store.countValid(), revalidation));
    }
}
