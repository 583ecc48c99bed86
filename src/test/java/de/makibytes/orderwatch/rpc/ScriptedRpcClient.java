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

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON-RPC client answering from a script of canned response bodies and
 * recording every request body.
 */
class ScriptedRpcClient extends JsonRpcHttpClient {

    final List<String> requests = new ArrayList<>();
    private final Deque<Object> responses = new ArrayDeque<>();

    ScriptedRpcClient() {
        super("http://localhost:8545", Map.of(), Duration.ofSeconds(1), null, new ObjectMapper());
    }

    ScriptedRpcClient respondResult(String resultJson) {
        responses.add("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":" + resultJson + "}");
        return this;
    }

    ScriptedRpcClient respondError(int code, String message) {
        responses.add("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":" + code + ",\"message\":\"" + message + "\"}}");
        return this;
    }

    ScriptedRpcClient respondFailure(IOException failure) {
        responses.add(failure);
        return this;
    }

    @Override
    protected synchronized String send(String body) throws IOException {
        requests.add(body);
        Object next = responses.poll();
        if (next == null) {
            throw new IOException("no scripted response");
        }
        if (next instanceof IOException failure) {
            throw failure;
        }
        return (String) next;
    }
}
