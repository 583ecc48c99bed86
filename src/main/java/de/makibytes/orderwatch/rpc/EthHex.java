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
package de.makibytes.orderwatch.rpc;

import java.math.BigInteger;
import java.time.Instant;

import com.fasterxml.jackson.databind.JsonNode;

import de.makibytes.orderwatch.model.BlockHeader;

public final class EthHex {

    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private EthHex() {}

    public static Long parseLong(String hex) {
        BigInteger value = parseBigInteger(hex);
        return value == null ? null : value.longValueExact();
    }

    public static BigInteger parseBigInteger(String hex) {
        if (hex == null) {
            return null;
        }
        String normalized = strip(hex.trim());
        if (normalized.isBlank()) {
            return null;
        }
        return new BigInteger(normalized, 16);
    }

    public static Instant parseTimestamp(String hex) {
        Long seconds = parseLong(hex);
        return seconds == null ? null : Instant.ofEpochSecond(seconds);
    }

    public static String toQuantity(long value) {
        return "0x" + Long.toHexString(value);
    }

    public static byte[] decodeHex(String hex) {
        if (hex == null || hex.isBlank()) {
            return new byte[0];
        }
        String normalized = strip(hex.trim());
        if (normalized.length() % 2 != 0) {
            throw new IllegalArgumentException("odd length hex string");
        }
        byte[] bytes = new byte[normalized.length() / 2];
        for (int i = 0; i < bytes.length; i++) {
            int high = Character.digit(normalized.charAt(i * 2), 16);
            int low = Character.digit(normalized.charAt(i * 2 + 1), 16);
            if (high < 0 || low < 0) {
                throw new IllegalArgumentException("invalid hex character at " + (i * 2));
            }
            bytes[i] = (byte) ((high << 4) | low);
        }
        return bytes;
    }

    public static String encodeHex(byte[] bytes, int offset, int length) {
        StringBuilder builder = new StringBuilder(2 + length * 2).append("0x");
        for (int i = offset; i < offset + length; i++) {
            builder.append(DIGITS[(bytes[i] >> 4) & 0xf]).append(DIGITS[bytes[i] & 0xf]);
        }
        return builder.toString();
    }

    /**
     * Reads a block object as returned by {@code eth_getBlockBy*} and the
     * {@code newHeads} subscription. Returns {@code null} for a JSON null.
     */
    public static BlockHeader parseHeader(JsonNode result) {
        if (result == null || result.isNull() || result.isMissingNode()) {
            return null;
        }
        return new BlockHeader(
                parseLong(result.path("number").asText(null)),
                result.path("hash").asText(null),
                result.path("parentHash").asText(null),
                parseTimestamp(result.path("timestamp").asText(null)),
                result.path("miner").asText(null),
                parseLong(result.path("gasUsed").asText(null)),
                parseLong(result.path("gasLimit").asText(null)),
                parseLong(result.path("baseFeePerGas").asText(null)));
    }

    private static String strip(String hex) {
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }
}
