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
package com.netflix.imagecache.common.network.client;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import com.netflix.imagecache.common.util.StringExt;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;

/**
 * Request counters and latency timers of an outbound client. Requests are tagged with a low cardinality
 * operation name, never with the raw request path.
 */
public class ClientMetrics {

    private static final String METRIC_REQUEST = "request";
    private static final String METRIC_LATENCY = "latency";

    private static final String TAG_ENDPOINT = "endpoint";
    private static final String TAG_METHOD = "method";
    private static final String TAG_OPERATION = "operation";
    private static final String TAG_OUTCOME = "outcome";
    private static final String TAG_STATUS_CLASS = "statusClass";
    private static final String TAG_ERROR = "error";

    private final Registry registry;
    private final Id requestId;
    private final Id latencyId;

    public ClientMetrics(String metricNamePrefix, String endpointName, Registry registry) {
        String prefix = StringExt.appendToEndIfMissing(metricNamePrefix, ".");
        this.registry = registry;
        this.requestId = registry.createId(prefix + METRIC_REQUEST).withTag(TAG_ENDPOINT, endpointName);
        this.latencyId = registry.createId(prefix + METRIC_LATENCY).withTag(TAG_ENDPOINT, endpointName);
    }

    public void recordLatency(String method, boolean success, Duration elapsed) {
        Id id = latencyId.withTag(TAG_METHOD, method).withTag(TAG_OUTCOME, success ? "success" : "failure");
        registry.timer(id).record(elapsed.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Counts a request which received a response. Status codes are grouped into classes (2xx, 4xx, ...).
     */
    public void incrementOnResponse(String method, String operation, int statusCode) {
        registry.counter(requestId
                .withTag(TAG_METHOD, method)
                .withTag(TAG_OPERATION, operation)
                .withTag(TAG_STATUS_CLASS, (statusCode / 100) + "xx")
        ).increment();
    }

    public void incrementOnError(String method, String operation, Throwable error) {
        registry.counter(requestId
                .withTag(TAG_METHOD, method)
                .withTag(TAG_OPERATION, operation)
                .withTag(TAG_ERROR, error.getClass().getSimpleName())
        ).increment();
    }
}
