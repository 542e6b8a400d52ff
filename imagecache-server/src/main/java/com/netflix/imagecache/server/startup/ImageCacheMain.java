/*
 * Copyright 2026 Netflix, Inc.
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
 */

package com.netflix.imagecache.server.startup;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;

import com.google.common.io.Files;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.netflix.archaius.api.Config;
import com.netflix.imagecache.api.policy.model.CachePolicy;
import com.netflix.imagecache.api.pull.service.PullOrchestrator;
import com.netflix.imagecache.common.runtime.internal.DefaultImageCacheRuntime;
import com.netflix.imagecache.common.util.ExceptionExt;
import com.netflix.imagecache.common.util.archaius2.Archaius2Ext;
import com.netflix.imagecache.server.controller.ControllerRegistry;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the image cache controller. Each argument is a file with a cache policy definition in JSON
 * format, started once the process is up.
 */
public class ImageCacheMain {

    private static final Logger logger = LoggerFactory.getLogger(ImageCacheMain.class);

    public static final String CONFIG_RESOURCE = "imagecache.properties";

    public static void main(String[] args) throws Exception {
        Config config = Archaius2Ext.loadConfig(CONFIG_RESOURCE);
        logger.info("Starting image cache with configuration: {}", Archaius2Ext.toString(config));

        Injector injector = Guice.createInjector(new ImageCacheModule(config));
        ControllerRegistry controllerRegistry = injector.getInstance(ControllerRegistry.class);

        CountDownLatch terminated = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down image cache");
            ExceptionExt.doCatchAndLog(controllerRegistry::shutdown, logger, "Controller registry shutdown failed");
            ExceptionExt.doCatchAndLog(() -> injector.getInstance(DefaultImageCacheRuntime.class).shutdown(), logger, "Runtime shutdown failed");
            ExceptionExt.doCatchAndLog(() -> injector.getInstance(KubernetesClient.class).close(), logger, "Kubernetes client shutdown failed");
            terminated.countDown();
        }, "imagecache-shutdown"));

        ExceptionExt.doCatchAndLog(
                () -> logger.info("Removed {} orphaned pull workloads", injector.getInstance(PullOrchestrator.class).cleanupOrphanedWorkloads()),
                logger,
                "Orphaned pull workload cleanup failed"
        );

        for (String fileName : args) {
            CachePolicy policy = controllerRegistry.createPolicy(readPolicyDefinition(fileName));
            logger.info("Loaded cache policy {} from {}", policy.getName(), fileName);
        }

        terminated.await();
    }

    private static String readPolicyDefinition(String fileName) throws IOException {
        return Files.asCharSource(new File(fileName), StandardCharsets.UTF_8).read();
    }
}
