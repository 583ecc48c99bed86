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
package de.makibytes.orderwatch.model;

import java.util.Objects;

/**
 * Event published by the chain tip watcher.
 *
 * <p>
 * A {@link ReorgDetected} always precedes the replacement headers of the range
 * it invalidates: every cached state derived from blocks at or above
 * {@link ReorgDetected#restartHeight()} is provisional after it.
 */
public sealed interface HeaderEvent permits HeaderEvent.HeaderAccepted, HeaderEvent.ReorgDetected {

    /**
     * Height the event derives from. Monotonically increasing except after a reorg.
     */
    long blockHeight();

    record HeaderAccepted(BlockHeader header) implements HeaderEvent {

        public HeaderAccepted {
            Objects.requireNonNull(header, "header");
        }

        @Override
        public long blockHeight() {
            return header.number();
        }
    }

    record ReorgDetected(long restartHeight) implements HeaderEvent {

        @Override
        public long blockHeight() {
            return restartHeight;
        }
    }
}
