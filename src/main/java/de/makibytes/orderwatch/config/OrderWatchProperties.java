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

import java.util.HashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "orderwatch")
public class OrderWatchProperties {

    private Ethereum ethereum = new Ethereum();
    private Watcher watcher = new Watcher();
    private Batcher batcher = new Batcher();
    private Revalidation revalidation = new Revalidation();

    public Ethereum getEthereum() {
        return ethereum;
    }

    public void setEthereum(Ethereum ethereum) {
        this.ethereum = ethereum;
    }

    public Watcher getWatcher() {
        return watcher;
    }

    public void setWatcher(Watcher watcher) {
        this.watcher = watcher;
    }

    public Batcher getBatcher() {
        return batcher;
    }

    public void setBatcher(Batcher batcher) {
        this.batcher = batcher;
    }

    public Revalidation getRevalidation() {
        return revalidation;
    }

    public void setRevalidation(Revalidation revalidation) {
        this.revalidation = revalidation;
    }

    public static class Ethereum {

        private String ws = "ws://localhost:8546";
        private String http = "http://localhost:8545";
        private String exchange = "0xdef1c0ded9bec7f1a1670819833240f027b25eff";
        private String flashWallet = "0x22f9dcf4647084d6c31b2765f6910cd85c178c18";
        private long connectTimeoutMs = 5000;
        private Map<String, String> headers = new HashMap<>();

        public String getWs() {
            return ws;
        }

        public void setWs(String ws) {
            this.ws = ws;
        }

        public String getHttp() {
            return http;
        }

        public void setHttp(String http) {
            this.http = http;
        }

        public String getExchange() {
            return exchange;
        }

        public void setExchange(String exchange) {
            this.exchange = exchange;
        }

        public String getFlashWallet() {
            return flashWallet;
        }

        public void setFlashWallet(String flashWallet) {
            this.flashWallet = flashWallet;
        }

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers;
        }
    }

    public static class Watcher {

        private long pollDelayMs = 5000;
        private long fetchTimeoutMs = 5000;
        private int maxTries = 10;
        private long retryDelayMs = 1000;
        private int maxReorg = 10;
        private int queueCapacity = 20;
        private boolean exitOnFatal = true;

        public long getPollDelayMs() {
            return pollDelayMs;
        }

        public void setPollDelayMs(long pollDelayMs) {
            this.pollDelayMs = pollDelayMs;
        }

        public long getFetchTimeoutMs() {
            return fetchTimeoutMs;
        }

        public void setFetchTimeoutMs(long fetchTimeoutMs) {
            this.fetchTimeoutMs = fetchTimeoutMs;
        }

        public int getMaxTries() {
            return maxTries;
        }

        public void setMaxTries(int maxTries) {
            this.maxTries = maxTries;
        }

        public long getRetryDelayMs() {
            return retryDelayMs;
        }

        public void setRetryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
        }

        public int getMaxReorg() {
            return maxReorg;
        }

        public void setMaxReorg(int maxReorg) {
            this.maxReorg = maxReorg;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public boolean isExitOnFatal() {
            return exitOnFatal;
        }

        public void setExitOnFatal(boolean exitOnFatal) {
            this.exitOnFatal = exitOnFatal;
        }
    }

    public static class Batcher {

        private int batchSize = 512;
        private int concurrent = 16;
        private long priorityCorkMs = 5;
        private long queueCorkMs = 100;
        private long requestTimeoutMs = 30000;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getConcurrent() {
            return concurrent;
        }

        public void setConcurrent(int concurrent) {
            this.concurrent = concurrent;
        }

        public long getPriorityCorkMs() {
            return priorityCorkMs;
        }

        public void setPriorityCorkMs(long priorityCorkMs) {
            this.priorityCorkMs = priorityCorkMs;
        }

        public long getQueueCorkMs() {
            return queueCorkMs;
        }

        public void setQueueCorkMs(long queueCorkMs) {
            this.queueCorkMs = queueCorkMs;
        }

        public long getRequestTimeoutMs() {
            return requestTimeoutMs;
        }

        public void setRequestTimeoutMs(long requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
        }
    }

    public static class Revalidation {

        private int submitConcurrency = 32;
        private long blockTimeoutMs = 300000;

        public int getSubmitConcurrency() {
            return submitConcurrency;
        }

        public void setSubmitConcurrency(int submitConcurrency) {
            this.submitConcurrency = submitConcurrency;
        }

        public long getBlockTimeoutMs() {
            return blockTimeoutMs;
        }

        public void setBlockTimeoutMs(long blockTimeoutMs) {
            this.blockTimeoutMs = blockTimeoutMs;
        }
    }
}
