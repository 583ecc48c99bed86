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
package de.makibytes.orderwatch.config;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;

import de.makibytes.orderwatch.batch.StateBatcher;
import de.makibytes.orderwatch.order.ChainInfo;
import de.makibytes.orderwatch.order.SignedOrder;
import de.makibytes.orderwatch.order.SignedOrderState;
import de.makibytes.orderwatch.rpc.ExchangeContractClient;
import de.makibytes.orderwatch.rpc.JsonRpcHttpClient;
import de.makibytes.orderwatch.rpc.WebSocketHeaderSource;
import de.makibytes.orderwatch.service.LoggingOrderEventPublisher;
import de.makibytes.orderwatch.service.OrderEventPublisher;
import de.makibytes.orderwatch.service.OrderRevalidationService;
import de.makibytes.orderwatch.service.OrderSubmissionService;
import de.makibytes.orderwatch.store.InMemoryOrderStore;
import de.makibytes.orderwatch.watcher.ChainTipWatcher;
import de.makibytes.orderwatch.watcher.FatalErrorHandler;
import de.makibytes.orderwatch.watcher.HeaderEventBroadcaster;
import de.makibytes.orderwatch.watcher.ReorgResolver;
import de.makibytes.orderwatch.watcher.WatcherConnectionTracker;

@Configuration
public class OrderWatchConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(OrderWatchConfiguration.class);

    @Bean
    public HttpClient rpcHttpClient(OrderWatchProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(1, properties.getEthereum().getConnectTimeoutMs())))
                .build();
    }

    @Bean
    public JsonRpcHttpClient jsonRpcHttpClient(OrderWatchProperties properties, HttpClient rpcHttpClient, ObjectMapper objectMapper) {
        OrderWatchProperties.Ethereum ethereum = properties.getEthereum();
        return new JsonRpcHttpClient(ethereum.getHttp(), ethereum.getHeaders(),
                Duration.ofMillis(properties.getBatcher().getRequestTimeoutMs()), rpcHttpClient, objectMapper);
    }

    @Bean
    public ChainInfo chainInfo(OrderWatchProperties properties, JsonRpcHttpClient jsonRpcHttpClient) {
        long chainId;
        try {
            chainId = jsonRpcHttpClient.chainId();
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot read chain id from " + properties.getEthereum().getHttp() + ": " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while reading chain id", ex);
        }
        logger.info("Connected to Ethereum with chain id {}", chainId);
        OrderWatchProperties.Ethereum ethereum = properties.getEthereum();
        return new ChainInfo(chainId, ethereum.getExchange(), ethereum.getFlashWallet(), properties.getWatcher().getMaxReorg());
    }

    @Bean(destroyMethod = "close")
    public StateBatcher<SignedOrder, SignedOrderState> stateBatcher(OrderWatchProperties properties, JsonRpcHttpClient jsonRpcHttpClient, ChainInfo chainInfo) {
        OrderWatchProperties.Batcher batcher = properties.getBatcher();
        StateBatcher.Settings settings = new StateBatcher.Settings(
                batcher.getBatchSize(),
                batcher.getConcurrent(),
                Duration.ofMillis(batcher.getPriorityCorkMs()),
                Duration.ofMillis(batcher.getQueueCorkMs()));
        return new StateBatcher<>("order-state", new ExchangeContractClient(jsonRpcHttpClient, chainInfo.exchange()), settings);
    }

    @Bean
    public WatcherConnectionTracker watcherConnectionTracker() {
        return new WatcherConnectionTracker();
    }

    @Bean
    public FatalErrorHandler fatalErrorHandler(ConfigurableApplicationContext context, OrderWatchProperties properties) {
        return new ApplicationExitFatalErrorHandler(context, properties.getWatcher().isExitOnFatal());
    }

    @Bean
    public ChainTipWatcher chainTipWatcher(OrderWatchProperties properties,
            HttpClient rpcHttpClient,
            ObjectMapper objectMapper,
            WatcherConnectionTracker watcherConnectionTracker,
            FatalErrorHandler fatalErrorHandler) {
        OrderWatchProperties.Watcher watcher = properties.getWatcher();
        WebSocketHeaderSource source = new WebSocketHeaderSource(properties.getEthereum().getWs(), rpcHttpClient,
                objectMapper, Duration.ofMillis(properties.getEthereum().getConnectTimeoutMs()));
        ChainTipWatcher.Settings settings = new ChainTipWatcher.Settings(
                Duration.ofMillis(watcher.getPollDelayMs()),
                Duration.ofMillis(watcher.getFetchTimeoutMs()),
                watcher.getMaxTries(),
                Duration.ofMillis(watcher.getRetryDelayMs()));
        return new ChainTipWatcher(source,
                new HeaderEventBroadcaster(watcher.getQueueCapacity()),
                new ReorgResolver(watcher.getMaxReorg()),
                settings,
                watcherConnectionTracker,
                fatalErrorHandler);
    }

    @Bean
    public OrderEventPublisher orderEventPublisher(ObjectMapper objectMapper) {
        return new LoggingOrderEventPublisher(objectMapper);
    }

    @Bean(destroyMethod = "close")
    public OrderSubmissionService orderSubmissionService(OrderWatchProperties properties,
            ChainInfo chainInfo,
            StateBatcher<SignedOrder, SignedOrderState> stateBatcher,
            InMemoryOrderStore orderStore,
            OrderEventPublisher orderEventPublisher) {
        return new OrderSubmissionService(chainInfo, stateBatcher, orderStore, orderEventPublisher,
                Duration.ofMillis(properties.getBatcher().getRequestTimeoutMs()),
                properties.getRevalidation().getSubmitConcurrency(),
                Clock.systemUTC());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public OrderRevalidationService orderRevalidationService(OrderWatchProperties properties,
            ChainTipWatcher chainTipWatcher,
            StateBatcher<SignedOrder, SignedOrderState> stateBatcher,
            InMemoryOrderStore orderStore,
            OrderEventPublisher orderEventPublisher,
            ChainInfo chainInfo) {
        return new OrderRevalidationService(chainTipWatcher, stateBatcher, orderStore, orderEventPublisher,
                chainInfo.maxReorg(),
                Duration.ofMillis(properties.getBatcher().getRequestTimeoutMs()),
                Duration.ofMillis(properties.getRevalidation().getBlockTimeoutMs()));
    }
}
