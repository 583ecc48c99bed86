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

import java.util.Locale;
import java.util.Objects;

/**
 * Identifies a block for an RPC lookup: the {@code latest} tag, a number or a hash.
 */
public record BlockId(Long number, String hash) {

    private static final BlockId LATEST = new BlockId(null, null);

    public BlockId {
        if (number != null && hash != null) {
            throw new IllegalArgumentException("BlockId is either a number or a hash");
        }
        if (hash != null) {
            hash = hash.toLowerCase(Locale.ROOT);
        }
    }

    public static BlockId latest() {
        return LATEST;
    }

    public static BlockId number(long number) {
        return new BlockId(number, null);
    }

    public static BlockId hash(String hash) {
        return new BlockId(null, Objects.requireNonNull(hash, "hash"));
    }

    public boolean isLatest() {
        return number == null && hash == null;
    }

    public boolean isHash() {
        return hash != null;
    }

    @Override
    public String toString() {
        if (isLatest()) {
            return "latest";
        }
        return isHash() ? hash : "#" + number;
    }
}
