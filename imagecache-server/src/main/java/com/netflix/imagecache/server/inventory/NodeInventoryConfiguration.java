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

package com.netflix.imagecache.server.inventory;

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "imagecache.inventory")
public interface NodeInventoryConfiguration {

    /**
     * Refresh requests arriving within this interval from the previous refresh reuse the current snapshot.
     */
    @DefaultValue("10000")
    long getMinRefreshIntervalMs();

    /**
     * If set, cordoned nodes and nodes with NoSchedule/NoExecute taints are not targeted.
     */
    @DefaultValue("true")
    boolean isSchedulableOnly();
}
