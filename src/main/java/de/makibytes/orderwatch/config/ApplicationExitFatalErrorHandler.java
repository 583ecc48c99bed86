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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;

import de.makibytes.orderwatch.util.DaemonThreadFactory;
import de.makibytes.orderwatch.watcher.FatalErrorHandler;

/**
 * Shuts the application down with exit code 1 when a background component
 * gives up, so that a supervisor can restart it.
 */
public class ApplicationExitFatalErrorHandler implements FatalErrorHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationExitFatalErrorHandler.class);

    private final ConfigurableApplicationContext context;
    private final boolean exitOnFatal;

    public ApplicationExitFatalErrorHandler(ConfigurableApplicationContext context, boolean exitOnFatal) {
        this.context = context;
        this.exitOnFatal = exitOnFatal;
    }

    @Override
    public void onFatalError(String component, Throwable error) {
        logger.error("Fatal error in {}: {}", component, error.getMessage(), error);
        if (!exitOnFatal) {
            return;
        }
        // exit from a fresh thread, the failing component is stopped during context close
        new DaemonThreadFactory("fatal-exit").newThread(() -> System.exit(SpringApplication.exit(context, () -> 1))).start();
    }
}
