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

import java.util.List;

import reactor.core.publisher.Mono;

/**
 * Docker Registry HTTP API V2 client.
 */
public interface RegistryClient {

    /**
     * Host used when an image source does not name its registry.
     */
    String getDefaultRegistryHost();

    /**
     * Lists all tags of a repository, following the registry pagination.
     */
    Mono<List<String>> getTags(String registryHost, String repository);

    /**
     * Resolves a tag (or digest) to the content digest of its manifest.
     */
    Mono<String> getImageDigest(String registryHost, String repository, String reference);
}
