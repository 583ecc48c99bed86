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
package de.makibytes.orderwatch.order;

import java.util.Locale;

/**
 * Normalization of hex encoded addresses and 32 byte words.
 */
public final class Addresses {

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    private Addresses() {}

    public static String normalize(String address, String field) {
        return normalizeHex(address, 20, field);
    }

    public static String normalizeBytes32(String word, String field) {
        return normalizeHex(word, 32, field);
    }

    public static boolean isZero(String address) {
        return ZERO.equals(address);
    }

    private static String normalizeHex(String value, int bytes, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (!normalized.startsWith("0x") || normalized.length() != 2 + bytes * 2) {
            throw new IllegalArgumentException(field + " must be a 0x prefixed " + bytes + " byte hex string");
        }
        for (int i = 2; i < normalized.length(); i++) {
            if (Character.digit(normalized.charAt(i), 16) < 0) {
                throw new IllegalArgumentException(field + " contains non hex characters");
            }
        }
        return normalized;
    }
}
