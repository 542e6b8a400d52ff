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

package com.netflix.imagecache.common.util.time;

public interface Clock {

    /**
     * Monotonic time source, to be used for measuring elapsed time only.
     */
    long nanoTime();

    /**
     * Time in milliseconds since the epoch.
     */
    long wallTime();

    default boolean isPast(long timestamp) {
        return wallTime() > timestamp;
    }
}
