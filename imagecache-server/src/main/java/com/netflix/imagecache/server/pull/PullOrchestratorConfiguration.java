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

package com.netflix.imagecache.server.pull;

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "imagecache.pull")
public interface PullOrchestratorConfiguration {

    /**
     * Image pull secret referenced by the pull workloads. Not set if empty.
     */
    @DefaultValue("")
    String getPullSecretName();

    @DefaultValue("5000")
    long getPollIntervalMs();

    /**
     * Maximum time for all targeted nodes to report the pull workload available.
     */
    @DefaultValue("1200000")
    long getPullTimeoutMs();

    /**
     * How long the pull container sleeps. It must outlive the pull timeout, as the workload is deleted once
     * the pull completes.
     */
    @DefaultValue("1200")
    int getSleepSeconds();

    @DefaultValue("1000")
    long getRunAsUser();

    @DefaultValue("1000")
    long getRunAsGroup();
}
