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

import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

import com.netflix.imagecache.common.framework.scheduler.model.ScheduleDescriptor;

/**
 * Simple scheduler for running periodic actions. An action execution is never run concurrently with another
 * execution of the same schedule. The next execution starts after the configured interval, counting from the
 * completion of the previous one.
 */
public interface LocalScheduler {

    /**
     * Schedules an action to be run on the provided executor. The executor is owned by the caller.
     */
    ScheduleReference schedule(ScheduleDescriptor scheduleDescriptor, Consumer<ExecutionContext> action, ExecutorService executorService);
}
