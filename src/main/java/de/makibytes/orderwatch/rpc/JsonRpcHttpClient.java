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
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * Minimal JSON-RPC 2.0 client over HTTP POST.
 */
public class JsonRpcHttpClient {

    private static final String JSONRPC_VERSION = "2.0";

    private final String httpUrl;
    private final Map<String, String> headers;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final AtomicLong ids = new AtomicLong();

    public JsonRpcHttpClient(String httpUrl, Map<String, String> headers, Duration requestTimeout, HttpClient httpClient, ObjectMapper mapper) {
        this.httpUrl = httpUrl;
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
        this.requestTimeout = requestTimeout;
        this.httpClient = httpClient;
        this.mapper = mapper;
    }

    public long chainId() throws IOException, InterruptedException {
        JsonNode result = call("eth_chainId", mapper.createArrayNode());
        Long chainId = EthHex.parseLong(result.asText(null));
        if (chainId == null) {
            throw new IOException("eth_chainId returned no value");
        }
        return chainId;
    }

    /**
     * Executes {@code eth_call} against the latest block and returns the raw
     * hex encoded return data.
     */
    public String ethCall(String to, String data) throws IOException, InterruptedException {
        ArrayNode params = mapper.createArrayNode();
        params.addObject()
                .put("to", to)
                .put("data", data);
        params.add("latest");
        JsonNode result = call("eth_call", params);
        if (result.isNull() || !result.isTextual()) {
            throw new IOException("eth_call returned no data");
        }
        return result.asText();
    }

    /**
     * Sends one request and returns its {@code result} member.
     */
    public JsonNode call(String method, JsonNode params) throws IOException, InterruptedException {
        JsonNode body = mapper.createObjectNode()
                .put("jsonrpc", JSONRPC_VERSION)
                .put("id", ids.incrementAndGet())
                .put("method", method)
                .set("params", params);
        JsonNode response = mapper.readTree(send(body.toString()));
        if (response.has("error")) {
            throw new RpcErrorException(method, response.get("error"));
        }
        JsonNode result = response.get("result");
        return result == null ? mapper.nullNode() : result;
    }

    protected String send(String body) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(httpUrl))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (requestTimeout != null && !requestTimeout.isZero()) {
            builder.timeout(requestTimeout);
        }
        headers.forEach(builder::header);
        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new HttpStatusException(response.statusCode(), httpUrl);
        }
        return response.body();
    }

    public static class HttpStatusException extends IOException {
        private final int statusCode;

        HttpStatusException(int statusCode, String url) {
            super("HTTP " + statusCode + " from " + url);
            this.statusCode = statusCode;
        }

        public int getStatusCode() {
            return statusCode;
        }
    }

    public static class RpcErrorException extends IOException {
        private final int code;

        RpcErrorException(String method, JsonNode error) {
            super(method + " failed: " + error.path("message").asText(error.toString()));
            this.code = error.path("code").asInt();
        }

        public int getCode() {
            return code;
        }
    }
}
