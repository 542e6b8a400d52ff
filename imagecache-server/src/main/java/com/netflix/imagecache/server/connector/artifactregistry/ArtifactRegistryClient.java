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

import java.util.List;

import reactor.core.publisher.Mono;

/**
 * Google Artifact Registry REST API client.
 */
public interface ArtifactRegistryClient {

    /**
     * Lists all Docker images of a repository with their tags, following the API pagination.
     */
    Mono<List<ArtifactRegistryImage>> listDockerImages(String projectId, String location, String repository);
}
