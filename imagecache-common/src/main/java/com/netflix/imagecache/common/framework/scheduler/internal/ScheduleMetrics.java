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

package com.netflix.imagecache.common.framework.scheduler.internal;

import java.util.concurrent.TimeUnit;

import com.netflix.imagecache.common.framework.scheduler.model.ScheduleDescriptor;
import com.netflix.spectator.api.Counter;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import com.netflix.spectator.api.Timer;
import com.netflix.spectator.api.patterns.PolledMeter;

/**
 * Single schedule metrics.
 */
class ScheduleMetrics {

    static final String ROOT_NAME = "imagecache.localScheduler.";

    private final Registry registry;

    private final Counter successes;
    private final Counter failures;
    private final Timer executionTime;
    private final Id runningId;

    private volatile long runningSince = -1;

    ScheduleMetrics(ScheduleDescriptor descriptor, Registry registry) {
        this.registry = registry;

        this.successes = registry.counter(ROOT_NAME + "executions",
                "name", descriptor.getName(),
                "status", "succeeded"
        );
        this.failures = registry.counter(ROOT_NAME + "executions",
                "name", descriptor.getName(),
                "status", "failed"
        );
        this.executionTime = registry.timer(ROOT_NAME + "executionTime", "name", descriptor.getName());

        this.runningId = registry.createId(ROOT_NAME + "runningTimeMs", "name", descriptor.getName());
        PolledMeter.using(registry)
                .withId(runningId)
                .monitorValue(this, self -> self.runningSince < 0 ? 0 : registry.clock().wallTime() - self.runningSince);
    }

    void onStart() {
        runningSince = registry.clock().wallTime();
    }

    void onCompleted(boolean succeeded) {
        if (runningSince >= 0) {
            executionTime.record(registry.clock().wallTime() - runningSince, TimeUnit.MILLISECONDS);
        }
        runningSince = -1;
        if (succeeded) {
            successes.increment();
        } else {
            failures.increment();
        }
    }

    void onScheduleRemoved() {
        PolledMeter.remove(registry, runningId);
    }
}
