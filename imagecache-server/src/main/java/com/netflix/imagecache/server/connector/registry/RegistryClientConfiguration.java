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

package com.netflix.imagecache.server.connector.registry;

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "imagecache.registry")
public interface RegistryClientConfiguration {

    @DefaultValue("registry.hub.docker.com")
    String getDefaultRegistryHost();

    /**
     * Use https when talking to registries given as plain host names.
     */
    @DefaultValue("true")
    boolean isSecure();

    @DefaultValue("10000")
    int getRegistryTimeoutMs();

    @DefaultValue("3")
    int getRegistryRetryCount();

    @DefaultValue("500")
    int getRegistryRetryDelayMs();

    /**
     * Docker config.json formatted file with registry credentials. Anonymous access is used if the file is missing.
     */
    @DefaultValue("/etc/secrets/.dockerconfigjson")
    String getCredentialsFile();

    /**
     * Upper bound on the number of tag list pages read for a single repository.
     */
    @DefaultValue("100")
    int getMaxTagPages();
}
