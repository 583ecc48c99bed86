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
package de.makibytes.orderwatch.watcher;

import java.util.concurrent.CompletableFuture;

import de.makibytes.orderwatch.model.BlockHeader;

/**
 * One way of obtaining the next candidate header.
 */
public interface HeaderFeed {

    /**
     * Future for the next header. Implementations may hand out the same
     * future again until it completes, so abandoning it loses nothing.
     */
    CompletableFuture<BlockHeader> next();
}
