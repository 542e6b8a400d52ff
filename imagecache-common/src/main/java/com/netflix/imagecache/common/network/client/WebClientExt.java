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
import java.util.function.Function;

import com.netflix.imagecache.common.network.client.internal.WebClientMetric;
import com.netflix.imagecache.common.util.time.Clock;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Mono;

public final class WebClientExt {

    private WebClientExt() {
    }

    /**
     * A {@link Mono} operator that records latency of completion (success or error), use with
     * {@link Mono#transformDeferred(Function)}.
     */
    public static <T> Function<Mono<T>, Mono<T>> latencyMonoOperator(Clock clock, WebClientMetric metrics, HttpMethod method) {
        return source -> Mono.defer(() -> {
            long startTime = clock.wallTime();
            return source
                    .doOnSuccess(value -> metrics.registerOnSuccessLatency(method, Duration.ofMillis(clock.wallTime() - startTime)))
                    .doOnError(error -> metrics.registerOnErrorLatency(method, Duration.ofMillis(clock.wallTime() - startTime)));
        });
    }
}
