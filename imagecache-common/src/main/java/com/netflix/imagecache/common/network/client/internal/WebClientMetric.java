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
package com.netflix.imagecache.common.network.client.internal;

import java.time.Duration;
import java.util.function.Function;

import com.netflix.imagecache.common.network.client.ClientMetrics;
import com.netflix.spectator.api.Registry;
import org.springframework.http.HttpMethod;
import reactor.netty.Connection;
import reactor.netty.http.client.HttpClientResponse;

/**
 * Adapts Reactor Netty response callbacks to {@link ClientMetrics}.
 */
public class WebClientMetric {

    private static final String WEB_CLIENT_METRICS = "imagecache.webClient.";

    private final ClientMetrics delegate;
    private final Function<String, String> operationResolver;

    /**
     * @param operationResolver maps a request path to the operation name used as a metric tag
     */
    public WebClientMetric(String endpointName, Registry registry, Function<String, String> operationResolver) {
        this.delegate = new ClientMetrics(WEB_CLIENT_METRICS, endpointName, registry);
        this.operationResolver = operationResolver;
    }

    public void registerOnSuccessLatency(HttpMethod method, Duration elapsed) {
        delegate.recordLatency(method.name(), true, elapsed);
    }

    public void registerOnErrorLatency(HttpMethod method, Duration elapsed) {
        delegate.recordLatency(method.name(), false, elapsed);
    }

    public void incrementOnSuccess(HttpClientResponse response, Connection connection) {
        delegate.incrementOnResponse(response.method().name(), operationResolver.apply(response.path()), response.status().code());
    }

    public void incrementOnError(HttpClientResponse response, Throwable throwable) {
        delegate.incrementOnError(response.method().name(), operationResolver.apply(response.path()), throwable);
    }
}
