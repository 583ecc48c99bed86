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

import java.util.Objects;

public record Signature(SignatureType signatureType, int v, String r, String s) {

    public Signature {
        Objects.requireNonNull(signatureType, "signatureType");
        if (v < 0 || v > 255) {
            throw new IllegalArgumentException("v must fit in a uint8");
        }
        r = Addresses.normalizeBytes32(r, "r");
        s = Addresses.normalizeBytes32(s, "s");
    }
}
