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

package com.netflix.imagecache.server.connector.artifactregistry;

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "imagecache.artifactRegistry")
public interface ArtifactRegistryClientConfiguration {

    @DefaultValue("https://artifactregistry.googleapis.com")
    String getApiUrl();

    /**
     * GCE metadata server endpoint issuing access tokens of the instance service account.
     */
    @DefaultValue("http://metadata.google.internal/computeMetadata/v1/instance/service-accounts/default/token")
    String getTokenUrl();

    @DefaultValue("10000")
    int getRequestTimeoutMs();

    @DefaultValue("3")
    int getRetryCount();

    @DefaultValue("500")
    int getRetryDelayMs();

    @DefaultValue("500")
    int getPageSize();

    @DefaultValue("100")
    int getMaxPages();

    /**
     * Access tokens are refreshed this long before they expire.
     */
    @DefaultValue("60000")
    long getTokenRefreshMarginMs();
}
