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

import java.time.Instant;

import de.makibytes.orderwatch.batch.BatcherStatistics;
import de.makibytes.orderwatch.model.BlockHeader;
import de.makibytes.orderwatch.service.OrderRevalidationService;
import de.makibytes.orderwatch.watcher.WatcherConnectionTracker;

public record StatusView(WatcherStatus watcher, BatcherStatus batcher, OrderSummary orders) {

    public record WatcherStatus(
            Long headNumber,
            String headHash,
            int consecutiveFailures,
            Instant connectedSince,
            long connectAttempts,
            long connects,
            long disconnects,
            long connectFailures,
            long headsReceived,
            long headersAccepted,
            long headersRewound,
            long reorgs,
            String lastError) {

        static WatcherStatus of(BlockHeader head, int consecutiveFailures, WatcherConnectionTracker tracker) {
            return new WatcherStatus(
                    head == null ? null : head.number(),
                    head == null ? null : head.hash(),
                    consecutiveFailures,
                    tracker.getConnectedSince(),
                    tracker.getConnectAttemptCount(),
                    tracker.getConnectCount(),
                    tracker.getDisconnectCount(),
                    tracker.getConnectFailureCount(),
                    tracker.getHeadsReceived(),
                    tracker.getHeadersAccepted(),
                    tracker.getHeadersRewound(),
                    tracker.getReorgCount(),
                    tracker.getLastError());
        }
    }

    public record BatcherStatus(
            int queuedJobs,
            long queuedPriority,
            long queuedNormal,
            long merged,
            long promoted,
            long calls,
            long completedCalls,
            long failedCalls,
            long calledItems,
            long fetchedItems,
            int inFlight,
            int peakInFlight) {

        static BatcherStatus of(int queuedJobs, BatcherStatistics statistics) {
            return new BatcherStatus(
                    queuedJobs,
                    statistics.getQueuedPriority(),
                    statistics.getQueuedNormal(),
                    statistics.getMerged(),
                    statistics.getPromoted(),
                    statistics.getCalls(),
                    statistics.getCompletedCalls(),
                    statistics.getFailedCalls(),
                    statistics.getCalledItems(),
                    statistics.getFetchedItems(),
                    statistics.getInFlight(),
                    statistics.getPeakInFlight());
        }
    }

    public record OrderSummary(
            int stored,
            long valid,
            Long lastRevalidatedBlock,
            long blocksProcessed,
            long blocksFailed,
            long eventsPublished) {

        static OrderSummary of(int stored, long valid, OrderRevalidationService revalidation) {
            return new OrderSummary(stored, valid,
                    revalidation.getLastRevalidatedBlock(),
                    revalidation.getBlocksProcessed(),
                    revalidation.getBlocksFailed(),
                    revalidation.getEventsPublished());
        }
    }
}
