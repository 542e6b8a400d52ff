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

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Docker image entry of an Artifact Registry repository. The uri has the form
 * 'LOCATION-docker.pkg.dev/PROJECT/REPOSITORY/IMAGE@sha256:...'.
 */
public class ArtifactRegistryImage {

    private final String uri;
    private final List<String> tags;

    public ArtifactRegistryImage(String uri, List<String> tags) {
        this.uri = uri;
        this.tags = tags == null ? Collections.emptyList() : Collections.unmodifiableList(tags);
    }

    public String getUri() {
        return uri;
    }

    public List<String> getTags() {
        return tags;
    }

    /**
     * Image path without the digest.
     */
    public String getImageBase() {
        int idx = uri.indexOf('@');
        return idx < 0 ? uri : uri.substring(0, idx);
    }

    public Optional<String> getDigest() {
        int idx = uri.indexOf('@');
        return idx < 0 || idx == uri.length() - 1 ? Optional.empty() : Optional.of(uri.substring(idx + 1));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ArtifactRegistryImage that = (ArtifactRegistryImage) o;
        return Objects.equals(uri, that.uri) && Objects.equals(tags, that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uri, tags);
    }

    @Override
    public String toString() {
        return "ArtifactRegistryImage{" +
                "uri='" + uri + '\'' +
                ", tags=" + tags +
                '}';
    }
}
