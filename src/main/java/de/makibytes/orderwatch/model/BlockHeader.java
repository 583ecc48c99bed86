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

import java.time.Instant;
import java.util.Locale;

/**
 * A block header as delivered by a header source.
 *
 * <p>
 * Number and hash are nullable because nodes occasionally deliver pending
 * blocks without them. Hashes are normalized to lower case so that linkage
 * checks can use plain string equality.
 */
public record BlockHeader(
        Long number,
        String hash,
        String parentHash,
        Instant timestamp,
        String miner,
        Long gasUsed,
        Long gasLimit,
        Long baseFeePerGas) {

    public BlockHeader {
        hash = normalize(hash);
        parentHash = normalize(parentHash);
        miner = normalize(miner);
    }

    public static BlockHeader of(long number, String hash, String parentHash) {
        return new BlockHeader(number, hash, parentHash, null, null, null, null, null);
    }

    public static BlockHeader of(long number, String hash, String parentHash, Instant timestamp) {
        return new BlockHeader(number, hash, parentHash, timestamp, null, null, null, null);
    }

    public boolean isComplete() {
        return number != null && hash != null;
    }

    /**
     * Whether this header directly extends {@code parent}: consecutive number and
     * matching parent hash.
     */
    public boolean extendsFrom(BlockHeader parent) {
        return parent != null
                && number != null
                && parent.number() != null
                && number == parent.number() + 1
                && parentHash != null
                && parentHash.equals(parent.hash());
    }

    @Override
    public String toString() {
        return "#" + number + " " + hash;
    }

    private static String normalize(String hex) {
        if (hex == null || hex.isBlank()) {
            return null;
        }
        return hex.trim().toLowerCase(Locale.ROOT);
    }
}
