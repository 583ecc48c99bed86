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

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class BatchQueueTest {

    private final BatchQueue<String, Integer> queue = new BatchQueue<>();

    @Test
    void firstInsertIntoEmptyLaneStartsCork() {
        BatchQueue.Admission first = queue.insert("a", new CompletableFuture<>(), false);
        BatchQueue.Admission second = queue.insert("b", new CompletableFuture<>(), false);

        assertTrue(first.startsCork());
        assertFalse(first.priorityLane());
        assertFalse(second.startsCork());
        assertEquals(2, queue.normalSize());
    }

    @Test
    void duplicateKeyMergesIntoExistingJob() {
        queue.insert("a", new CompletableFuture<>(), false);

        BatchQueue.Admission merged = queue.insert("a", new CompletableFuture<>(), false);

        assertTrue(merged.merged());
        assertEquals(1, queue.size());
        assertEquals(2, queue.drainAll().get(0).waiters().size());
    }

    @Test
    void urgentDuplicateIsPromotedWithAllWaiters() {
        queue.insert("a", new CompletableFuture<>(), false);
        queue.insert("b", new CompletableFuture<>(), false);

        BatchQueue.Admission promoted = queue.insert("b", new CompletableFuture<>(), true);

        assertTrue(promoted.promoted());
        assertTrue(promoted.startsCork());
        assertEquals(1, queue.prioritySize());
        assertEquals(1, queue.normalSize());
        List<BatchQueue.PendingJob<String, Integer>> batch = queue.takeBatch(1);
        assertEquals("b", batch.get(0).key());
        assertEquals(2, batch.get(0).waiters().size());
    }

    @Test
    void priorityJobAbsorbsLaterNormalRequests() {
        queue.insert("a", new CompletableFuture<>(), true);

        BatchQueue.Admission admission = queue.insert("a", new CompletableFuture<>(), false);

        assertTrue(admission.merged());
        assertTrue(admission.priorityLane());
        assertEquals(0, queue.normalSize());
    }

    @Test
    void takeBatchDrainsPriorityFirstUpToMax() {
        queue.insert("n1", new CompletableFuture<>(), false);
        queue.insert("n2", new CompletableFuture<>(), false);
        queue.insert("p1", new CompletableFuture<>(), true);

        List<BatchQueue.PendingJob<String, Integer>> batch = queue.takeBatch(2);

        assertEquals(List.of("p1", "n1"), batch.stream().map(BatchQueue.PendingJob::key).toList());
        assertTrue(queue.contains("n2"));
        assertFalse(queue.contains("p1"));
        assertEquals(1, queue.size());
    }
}
