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

package com.netflix.imagecache.server.controller;

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "imagecache.controller")
public interface CachePolicyControllerConfiguration {

    /**
     * Set to false to pause reconciliation of all policies without deleting them.
     */
    @DefaultValue("true")
    boolean isControllerEnabled();

    @DefaultValue("0")
    long getControllerInitialDelayMs();

    @DefaultValue("60000")
    long getControllerIntervalMs();

    /**
     * Upper bound on a single reconciliation iteration, including all pulls it waits for.
     */
    @DefaultValue("3600000")
    long getControllerTimeoutMs();
}
