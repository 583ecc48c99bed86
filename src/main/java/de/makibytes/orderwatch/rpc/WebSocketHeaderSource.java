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
import java.net.http.WebSocket;
import java.net.http.WebSocketHandshakeException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

import de.makibytes.orderwatch.model.BlockHeader;
import de.makibytes.orderwatch.model.BlockId;
import de.makibytes.orderwatch.watcher.HeaderConnection;
import de.makibytes.orderwatch.watcher.HeaderSource;
import de.makibytes.orderwatch.watcher.HeaderSubscription;
import de.makibytes.orderwatch.watcher.WatcherException;

/**
 * Header source speaking Ethereum JSON-RPC over a WebSocket: {@code eth_subscribe}
 * to {@code newHeads} for the push stream, {@code eth_getBlockByNumber} and
 * {@code eth_getBlockByHash} for lookups on the same socket.
 */
public class WebSocketHeaderSource implements HeaderSource {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketHeaderSource.class);

    private final URI uri;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Duration connectTimeout;

    public WebSocketHeaderSource(String wsUrl, HttpClient httpClient, ObjectMapper mapper, Duration connectTimeout) {
        this.uri = URI.create(wsUrl);
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("ws") && !scheme.equals("wss")) {
            throw new IllegalArgumentException("Unsupported header source scheme '" + scheme + "', expected ws or wss");
        }
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public HeaderConnection connect() throws WatcherException {
        WsHeaderConnection connection = new WsHeaderConnection(describe(), mapper);
        try {
            httpClient.newWebSocketBuilder()
                    .connectTimeout(connectTimeout)
                    .buildAsync(uri, connection)
                    .get(connectTimeout.toMillis() * 2, TimeUnit.MILLISECONDS);
            String subscriptionId = connection.subscribeNewHeads()
                    .get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            logger.info("Subscribed to newHeads on {} ({})", describe(), subscriptionId);
            return connection;
        } catch (ExecutionException ex) {
            connection.close();
            Throwable cause = ex.getCause();
            if (cause instanceof WatcherException watcherException) {
                throw watcherException;
            }
            String message = cause instanceof WebSocketHandshakeException handshake
                    ? "handshake failed with HTTP " + handshake.getResponse().statusCode()
                    : String.valueOf(cause.getMessage());
            throw new WatcherException(WatcherException.Reason.TRANSPORT, "connecting to " + describe() + ": " + message, cause);
        } catch (TimeoutException ex) {
            connection.close();
            throw new WatcherException(WatcherException.Reason.TIMEOUT, "connecting to " + describe() + " timed out", ex);
        } catch (InterruptedException ex) {
            connection.close();
            Thread.currentThread().interrupt();
            throw new WatcherException(WatcherException.Reason.TRANSPORT, "interrupted while connecting to " + describe(), ex);
        }
    }

    @Override
    public String describe() {
        return uri.getScheme() + "://" + uri.getHost() + (uri.getPort() > 0 ? ":" + uri.getPort() : "");
    }

    /**
     * One socket: matches responses to requests by JSON-RPC id and feeds
     * subscription notifications into a {@link HeaderSubscription}.
     */
    static class WsHeaderConnection implements HeaderConnection, WebSocket.Listener {

        private final String endpoint;
        private final ObjectMapper mapper;
        private final HeaderSubscription subscription = new HeaderSubscription();
        private final Map<Long, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();
        private final AtomicLong ids = new AtomicLong();
        private final AtomicBoolean closed = new AtomicBoolean();
        private final StringBuilder buffer = new StringBuilder();
        private volatile WebSocket webSocket;
        private volatile String subscriptionId;
        private CompletableFuture<WebSocket> sendChain;

        WsHeaderConnection(String endpoint, ObjectMapper mapper) {
            this.endpoint = endpoint;
            this.mapper = mapper;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            attach(webSocket);
            WebSocket.Listener.super.onOpen(webSocket);
        }

        synchronized void attach(WebSocket webSocket) {
            this.webSocket = webSocket;
            this.sendChain = CompletableFuture.completedFuture(webSocket);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buffer.append(data);
            if (last) {
                String payload = buffer.toString();
                buffer.setLength(0);
                handleMessage(payload);
            }
            return WebSocket.Listener.super.onText(webSocket, data, last);
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            logger.error("WebSocket error ({}): {}", endpoint, error.getMessage());
            shutdown(error);
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            logger.info("WebSocket closed by {} with status {} {}", endpoint, statusCode, reason);
            shutdown(new IOException("closed by peer with status " + statusCode));
            return WebSocket.Listener.super.onClose(webSocket, statusCode, reason);
        }

        @Override
        public HeaderSubscription subscription() {
            return subscription;
        }

        @Override
        public CompletableFuture<BlockHeader> fetchHeader(BlockId id) {
            ArrayNode params = mapper.createArrayNode();
            String method;
            if (id.isHash()) {
                method = "eth_getBlockByHash";
                params.add(id.hash());
            } else {
                method = "eth_getBlockByNumber";
                params.add(id.isLatest() ? "latest" : EthHex.toQuantity(id.number()));
            }
            params.add(false);
            return request(method, params).thenApply(EthHex::parseHeader);
        }

        CompletableFuture<String> subscribeNewHeads() {
            ArrayNode params = mapper.createArrayNode().add("newHeads");
            return request("eth_subscribe", params).thenApply(result -> {
                subscriptionId = result.asText(null);
                return subscriptionId;
            });
        }

        CompletableFuture<JsonNode> request(String method, JsonNode params) {
            long id = ids.incrementAndGet();
            CompletableFuture<JsonNode> response = new CompletableFuture<>();
            String body = mapper.createObjectNode()
                    .put("jsonrpc", "2.0")
                    .put("id", id)
                    .put("method", method)
                    .set("params", params)
                    .toString();
            synchronized (this) {
                if (closed.get() || sendChain == null) {
                    response.completeExceptionally(new WatcherException(WatcherException.Reason.END_OF_STREAM,
                            method + " on closed connection to " + endpoint));
                    return response;
                }
                pending.put(id, response);
                sendChain = sendChain.thenCompose(socket -> socket.sendText(body, true));
                sendChain.whenComplete((socket, error) -> {
                    if (error != null && pending.remove(id) != null) {
                        response.completeExceptionally(new WatcherException(WatcherException.Reason.TRANSPORT,
                                "sending " + method + " to " + endpoint + " failed", error));
                    }
                });
            }
            return response;
        }

        void handleMessage(String payload) {
            JsonNode root;
            try {
                root = mapper.readTree(payload);
            } catch (IOException ex) {
                logger.error("Unparseable WebSocket message from {}: {}", endpoint, ex.getMessage());
                return;
            }
            if ("eth_subscription".equals(root.path("method").asText())) {
                JsonNode params = root.path("params");
                String id = params.path("subscription").asText(null);
                if (subscriptionId != null && id != null && !subscriptionId.equals(id)) {
                    logger.debug("Ignoring notification for foreign subscription {}", id);
                    return;
                }
                subscription.offer(EthHex.parseHeader(params.path("result")));
                return;
            }
            JsonNode idNode = root.get("id");
            if (idNode == null || idNode.isNull()) {
                return;
            }
            CompletableFuture<JsonNode> waiter = pending.remove(idNode.asLong());
            if (waiter == null) {
                logger.debug("Response for unknown request id {} from {}", idNode, endpoint);
                return;
            }
            JsonNode error = root.get("error");
            if (error != null && !error.isNull()) {
                waiter.completeExceptionally(new WatcherException(WatcherException.Reason.TRANSPORT,
                        "RPC error from " + endpoint + ": " + error.path("message").asText(error.toString())));
            } else {
                waiter.complete(root.path("result"));
            }
        }

        int pendingRequests() {
            return pending.size();
        }

        @Override
        public void close() {
            WebSocket socket = webSocket;
            if (socket != null && !closed.get()) {
                try {
                    socket.sendClose(WebSocket.NORMAL_CLOSURE, "shutdown");
                } catch (RuntimeException ex) {
                    logger.debug("WebSocket close failed ({}): {}", endpoint, ex.getMessage());
                    socket.abort();
                }
            }
            shutdown(null);
        }

        private void shutdown(Throwable cause) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            subscription.close(cause);
            WatcherException failure = new WatcherException(WatcherException.Reason.END_OF_STREAM,
                    "connection to " + endpoint + " closed", cause);
            pending.values().forEach(waiter -> waiter.completeExceptionally(failure));
            pending.clear();
        }
    }
}
