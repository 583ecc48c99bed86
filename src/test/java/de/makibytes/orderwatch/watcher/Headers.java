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

import de.makibytes.orderwatch.model.BlockHeader;

/**
 * Readable header fixtures: hashes are derived from a branch label and the
 * block number, e.g. {@code 0x...a100}.
 */
final class Headers {

    private Headers() {}

    static String hash(String branch, long number) {
        String label = branch + number;
        StringBuilder hex = new StringBuilder();
        for (char c : label.toCharArray()) {
            hex.append(Integer.toHexString(c));
        }
        return "0x" + "0".repeat(64 - hex.length()) + hex;
    }

    static BlockHeader header(String branch, long number, String parentBranch) {
        return BlockHeader.of(number, hash(branch, number), hash(parentBranch, number - 1));
    }

    static BlockHeader header(String branch, long number) {
        return header(branch, number, branch);
    }
}
