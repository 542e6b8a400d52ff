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

import java.io.Closeable;
import java.util.Optional;

public interface ScheduleReference extends Closeable {

    String getId();

    /**
     * Number of completed (successfully or not) action executions.
     */
    long getCompletedIterations();

    /**
     * Error of the most recent execution, or empty if it succeeded.
     */
    Optional<Throwable> getLastError();

    boolean isClosed();

    @Override
    void close();
}
