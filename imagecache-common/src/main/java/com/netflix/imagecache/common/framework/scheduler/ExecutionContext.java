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

package com.netflix.imagecache.common.framework.scheduler;

import java.util.Optional;

/**
 * Information about the current execution of a scheduled action.
 */
public class ExecutionContext {

    private final long iteration;
    private final Optional<Throwable> previousError;

    private ExecutionContext(long iteration, Optional<Throwable> previousError) {
        this.iteration = iteration;
        this.previousError = previousError;
    }

    /**
     * Execution number, starting from 1.
     */
    public long getIteration() {
        return iteration;
    }

    /**
     * Error of the previous execution, or empty if it succeeded or this is the first one.
     */
    public Optional<Throwable> getPreviousError() {
        return previousError;
    }

    @Override
    public String toString() {
        return "ExecutionContext{" +
                "iteration=" + iteration +
                ", previousError=" + previousError.map(Throwable::getMessage).orElse("none") +
                '}';
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private long iteration;
        private Throwable previousError;

        private Builder() {
        }

        public Builder withIteration(long iteration) {
            this.iteration = iteration;
            return this;
        }

        public Builder withPreviousError(Throwable previousError) {
            this.previousError = previousError;
            return this;
        }

        public ExecutionContext build() {
            return new ExecutionContext(iteration, Optional.ofNullable(previousError));
        }
    }
}
