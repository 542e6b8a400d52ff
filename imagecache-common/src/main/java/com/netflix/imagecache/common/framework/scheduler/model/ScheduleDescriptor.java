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

package com.netflix.imagecache.common.framework.scheduler.model;

import java.time.Duration;
import java.util.function.BiConsumer;

import com.google.common.base.Preconditions;
import com.netflix.imagecache.common.framework.scheduler.ExecutionContext;

/**
 * Periodic action settings. The interval is measured from the end of one execution to the start of the next,
 * so executions of the same schedule never overlap.
 */
public class ScheduleDescriptor {

    private final String name;
    private final String description;
    private final Duration initialDelay;
    private final Duration interval;
    private final Duration timeout;
    private final BiConsumer<ExecutionContext, Throwable> onErrorHandler;

    private ScheduleDescriptor(String name,
                               String description,
                               Duration initialDelay,
                               Duration interval,
                               Duration timeout,
                               BiConsumer<ExecutionContext, Throwable> onErrorHandler) {
        this.name = name;
        this.description = description;
        this.initialDelay = initialDelay;
        this.interval = interval;
        this.timeout = timeout;
        this.onErrorHandler = onErrorHandler;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getInterval() {
        return interval;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public BiConsumer<ExecutionContext, Throwable> getOnErrorHandler() {
        return onErrorHandler;
    }

    @Override
    public String toString() {
        return "ScheduleDescriptor{" +
                "name='" + name + '\'' +
                ", description='" + description + '\'' +
                ", initialDelay=" + initialDelay +
                ", interval=" + interval +
                ", timeout=" + timeout +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withName(name)
                .withDescription(description)
                .withInitialDelay(initialDelay)
                .withInterval(interval)
                .withTimeout(timeout)
                .withOnErrorHandler(onErrorHandler);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String description;
        private Duration initialDelay = Duration.ZERO;
        private Duration interval;
        private Duration timeout;

        // No-op unless set
        private BiConsumer<ExecutionContext, Throwable> onErrorHandler = (context, error) -> {
        };

        private Builder() {
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withDescription(String description) {
            this.description = description;
            return this;
        }

        public Builder withInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder withInterval(Duration interval) {
            this.interval = interval;
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withOnErrorHandler(BiConsumer<ExecutionContext, Throwable> onErrorHandler) {
            this.onErrorHandler = onErrorHandler;
            return this;
        }

        public ScheduleDescriptor build() {
            Preconditions.checkNotNull(name, "name cannot be null");
            Preconditions.checkNotNull(description, "description cannot be null");
            Preconditions.checkNotNull(initialDelay, "initialDelay cannot be null");
            Preconditions.checkArgument(interval != null && !interval.isNegative() && !interval.isZero(), "interval must be positive: %s", interval);
            Preconditions.checkArgument(timeout != null && !timeout.isNegative() && !timeout.isZero(), "timeout must be positive: %s", timeout);
            Preconditions.checkNotNull(onErrorHandler, "onErrorHandler cannot be null");

            return new ScheduleDescriptor(name, description, initialDelay, interval, timeout, onErrorHandler);
        }
    }
}
