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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Two FIFO lanes of pending jobs keyed by the requested item. A key lives in at
 * most one lane at a time.
 *
 * <p>
 * Not thread safe, the owning batcher guards every call with its lock.
 */
public class BatchQueue<K, R> {

    public static final class PendingJob<K, R> {

        private final K key;
        private final List<CompletableFuture<R>> waiters = new ArrayList<>(1);

        PendingJob(K key) {
            this.key = key;
        }

        public K key() {
            return key;
        }

        public List<CompletableFuture<R>> waiters() {
            return waiters;
        }

        void addWaiter(CompletableFuture<R> waiter) {
            waiters.add(waiter);
        }
    }

    /**
     * What an insert did. {@code startsCork} is set when the job landed in a
     * lane that was empty before, which opens a new batching window.
     */
    public record Admission(boolean merged, boolean promoted, boolean priorityLane, boolean startsCork) {
    }

    private final Map<K, PendingJob<K, R>> priority = new LinkedHashMap<>();
    private final Map<K, PendingJob<K, R>> normal = new LinkedHashMap<>();

    public Admission insert(K key, CompletableFuture<R> waiter, boolean urgent) {
        PendingJob<K, R> job = priority.get(key);
        if (job != null) {
            job.addWaiter(waiter);
            return new Admission(true, false, true, false);
        }
        job = normal.get(key);
        if (job != null) {
            job.addWaiter(waiter);
            if (!urgent) {
                return new Admission(true, false, false, false);
            }
            normal.remove(key);
            boolean wasEmpty = priority.isEmpty();
            priority.put(key, job);
            return new Admission(true, true, true, wasEmpty);
        }
        Map<K, PendingJob<K, R>> lane = urgent ? priority : normal;
        boolean wasEmpty = lane.isEmpty();
        job = new PendingJob<>(key);
        job.addWaiter(waiter);
        lane.put(key, job);
        return new Admission(false, false, urgent, wasEmpty);
    }

    /**
     * Removes up to {@code max} jobs, priority lane first.
     */
    public List<PendingJob<K, R>> takeBatch(int max) {
        List<PendingJob<K, R>> batch = new ArrayList<>(Math.min(max, size()));
        drainInto(priority, batch, max);
        drainInto(normal, batch, max);
        return batch;
    }

    public List<PendingJob<K, R>> drainAll() {
        return takeBatch(Integer.MAX_VALUE);
    }

    public int size() {
        return priority.size() + normal.size();
    }

    public int prioritySize() {
        return priority.size();
    }

    public int normalSize() {
        return normal.size();
    }

    public boolean isEmpty() {
        return priority.isEmpty() && normal.isEmpty();
    }

    public boolean contains(K key) {
        return priority.containsKey(key) || normal.containsKey(key);
    }

    private static <K, R> void drainInto(Map<K, PendingJob<K, R>> lane, List<PendingJob<K, R>> batch, int max) {
        Iterator<PendingJob<K, R>> iterator = lane.values().iterator();
        while (batch.size() < max && iterator.hasNext()) {
            batch.add(iterator.next());
            iterator.remove();
        }
    }
}
