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
package de.makibytes.orderwatch.batch;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public class BatcherStatistics {

    private final AtomicLong queuedPriority = new AtomicLong();
    private final AtomicLong queuedNormal = new AtomicLong();
    private final AtomicLong merged = new AtomicLong();
    private final AtomicLong promoted = new AtomicLong();
    private final AtomicLong calledItems = new AtomicLong();
    private final AtomicLong fetchedItems = new AtomicLong();
    private final AtomicLong calls = new AtomicLong();
    private final AtomicLong completedCalls = new AtomicLong();
    private final AtomicLong failedCalls = new AtomicLong();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();

    void onAdmission(BatchQueue.Admission admission) {
        if (admission.merged()) {
            merged.incrementAndGet();
        } else if (admission.priorityLane()) {
            queuedPriority.incrementAndGet();
        } else {
            queuedNormal.incrementAndGet();
        }
        if (admission.promoted()) {
            promoted.incrementAndGet();
        }
    }

    void onCallStarted(int items) {
        calls.incrementAndGet();
        calledItems.addAndGet(items);
        int current = inFlight.incrementAndGet();
        peakInFlight.accumulateAndGet(current, Math::max);
    }

    void onCallReturned() {
        inFlight.decrementAndGet();
    }

    void onCallCompleted(int items) {
        completedCalls.incrementAndGet();
        fetchedItems.addAndGet(items);
    }

    void onCallFailed() {
        failedCalls.incrementAndGet();
    }

    public long getQueuedPriority() {
        return queuedPriority.get();
    }

    public long getQueuedNormal() {
        return queuedNormal.get();
    }

    public long getMerged() {
        return merged.get();
    }

    public long getPromoted() {
        return promoted.get();
    }

    public long getCalledItems() {
        return calledItems.get();
    }

    public long getFetchedItems() {
        return fetchedItems.get();
    }

    public long getCalls() {
        return calls.get();
    }

    public long getCompletedCalls() {
        return completedCalls.get();
    }

    public long getFailedCalls() {
        return failedCalls.get();
    }

    public int getInFlight() {
        return inFlight.get();
    }

    public int getPeakInFlight() {
        return peakInFlight.get();
    }
}
