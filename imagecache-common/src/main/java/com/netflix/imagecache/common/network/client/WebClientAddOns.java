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
import java.util.function.Predicate;
import javax.net.ssl.SSLException;

import com.netflix.imagecache.common.network.client.internal.WebClientMetric;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.HttpClientResponse;
import reactor.util.retry.Retry;

/**
 * A collection of add-ons for Spring {@link WebClient}.
 */
public final class WebClientAddOns {

    private static final Logger logger = LoggerFactory.getLogger(WebClientAddOns.class);

    private static final Logger requestLogger = LoggerFactory.getLogger("WebClientRequestLogger");

    private WebClientAddOns() {
    }

    public static WebClient.Builder addDefaults(WebClient.Builder clientBuilder,
                                                HttpClient httpClient,
                                                WebClientMetric webClientMetric) {
        HttpClient updatedHttpClient = addMetricCallbacks(
                addLoggingCallbacks(httpClient),
                webClientMetric
        );

        return clientBuilder.clientConnector(new ReactorClientHttpConnector(updatedHttpClient));
    }

    public static WebClient.Builder addDefaults(WebClient.Builder clientBuilder,
                                                boolean secure,
                                                WebClientMetric webClientMetric) {
        HttpClient httpClient = HttpClient.create();
        if (secure) {
            try {
                SslContext sslContext = SslContextBuilder.forClient().build();
                httpClient = httpClient.secure(spec -> spec.sslContext(sslContext));
            } catch (SSLException e) {
                logger.error("Unable configure HTTP client SSL context: {}", e.getMessage());
                throw new IllegalStateException("Error configuring SSL context", e);
            }
        }

        return addDefaults(clientBuilder, httpClient, webClientMetric);
    }

    /**
     * Fixed delay retry strategy, limited to errors accepted by the retry predicate. When the retry limit
     * is reached, the last error is returned to the caller.
     */
    public static Retry retryer(Duration interval,
                                int retryLimit,
                                Predicate<Throwable> retryPredicate,
                                Logger callerLogger) {
        return Retry.fixedDelay(retryLimit, interval)
                .filter(retryPredicate)
                .doBeforeRetry(signal -> logger.info("Retrying failed HTTP request in {}ms (attempt {})", interval.toMillis(), signal.totalRetries() + 1))
                .onRetryExhaustedThrow((spec, signal) -> {
                    callerLogger.warn("Retry limit reached. Returning error to the client", signal.failure());
                    return signal.failure();
                });
    }

    private static HttpClient addLoggingCallbacks(HttpClient httpClient) {
        return httpClient
                .doOnRequestError((request, error) -> requestLogger.info(String.format(
                        "%10s %10s %64s %8s %s", request.method(), "NOT_SENT", request.uri(), 0, error.getMessage()
                )))
                .doOnResponse((response, connection) -> requestLogger.info(String.format(
                        "%10s %10s %64s", response.method(), response.status().reasonPhrase(), buildFullUri(response)
                )))
                .doOnResponseError((response, error) -> requestLogger.info(String.format(
                        "%10s %10s %64s %s", response.method(), response.status().reasonPhrase(), buildFullUri(response), error.getMessage()
                )));
    }

    private static String buildFullUri(HttpClientResponse response) {
        String resourceUrl = response.resourceUrl();
        return resourceUrl != null ? resourceUrl : response.path();
    }

    private static HttpClient addMetricCallbacks(HttpClient httpClient, WebClientMetric webClientMetric) {
        return httpClient
                .doAfterResponseSuccess(webClientMetric::incrementOnSuccess)
                .doOnResponseError(webClientMetric::incrementOnError);
    }
}
