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

package com.netflix.imagecache.api.policy.model.source;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Google Artifact Registry backed image source. Tags are classified the same way as for
 * {@link TagClassifyingSourceConfig}, but the images and their digests are listed in a single
 * Artifact Registry API call instead of per tag registry requests.
 */
public class ArtifactRegistrySourceConfig extends ImageSourceConfig {

    private final String projectId;
    private final String location;
    private final String repository;
    private final String image;
    private final Optional<String> recommendedTag;
    private final int numReleases;
    private final int numWeeklies;
    private final int numDailies;
    private final Optional<Integer> cycle;
    private final List<String> aliasTags;

    public ArtifactRegistrySourceConfig(String projectId,
                                        String location,
                                        String repository,
                                        String image,
                                        String recommendedTag,
                                        int numReleases,
                                        int numWeeklies,
                                        int numDailies,
                                        Integer cycle,
                                        List<String> aliasTags) {
        this.projectId = projectId;
        this.location = location;
        this.repository = repository;
        this.image = image;
        this.recommendedTag = Optional.ofNullable(recommendedTag);
        this.numReleases = numReleases;
        this.numWeeklies = numWeeklies;
        this.numDailies = numDailies;
        this.cycle = Optional.ofNullable(cycle);
        this.aliasTags = aliasTags == null ? Collections.emptyList() : Collections.unmodifiableList(aliasTags);
    }

    @Override
    public String getType() {
        return ARTIFACT_REGISTRY_STRATEGY;
    }

    /**
     * Google Cloud project hosting the repository.
     */
    public String getProjectId() {
        return projectId;
    }

    /**
     * Repository region, for example 'us-central1'.
     */
    public String getLocation() {
        return location;
    }

    /**
     * Artifact Registry repository id.
     */
    public String getRepository() {
        return repository;
    }

    /**
     * Image name within the repository, for example 'sciplat-lab'.
     */
    public String getImage() {
        return image;
    }

    public Optional<String> getRecommendedTag() {
        return recommendedTag;
    }

    public int getNumReleases() {
        return numReleases;
    }

    public int getNumWeeklies() {
        return numWeeklies;
    }

    public int getNumDailies() {
        return numDailies;
    }

    public Optional<Integer> getCycle() {
        return cycle;
    }

    public List<String> getAliasTags() {
        return aliasTags;
    }

    /**
     * Host and path of the image, without a tag or digest.
     */
    public String getImageBase() {
        return location + "-docker.pkg.dev/" + projectId + '/' + repository + '/' + image;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ArtifactRegistrySourceConfig that = (ArtifactRegistrySourceConfig) o;
        return numReleases == that.numReleases &&
                numWeeklies == that.numWeeklies &&
                numDailies == that.numDailies &&
                Objects.equals(projectId, that.projectId) &&
                Objects.equals(location, that.location) &&
                Objects.equals(repository, that.repository) &&
                Objects.equals(image, that.image) &&
                Objects.equals(recommendedTag, that.recommendedTag) &&
                Objects.equals(cycle, that.cycle) &&
                Objects.equals(aliasTags, that.aliasTags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectId, location, repository, image, recommendedTag, numReleases, numWeeklies, numDailies, cycle, aliasTags);
    }

    @Override
    public String toString() {
        return "ArtifactRegistrySourceConfig{" +
                "projectId='" + projectId + '\'' +
                ", location='" + location + '\'' +
                ", repository='" + repository + '\'' +
                ", image='" + image + '\'' +
                ", recommendedTag=" + recommendedTag +
                ", numReleases=" + numReleases +
                ", numWeeklies=" + numWeeklies +
                ", numDailies=" + numDailies +
                ", cycle=" + cycle +
                ", aliasTags=" + aliasTags +
                '}';
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String projectId;
        private String location;
        private String repository;
        private String image;
        private String recommendedTag;
        private int numReleases;
        private int numWeeklies;
        private int numDailies;
        private Integer cycle;
        private List<String> aliasTags;

        private Builder() {
        }

        public Builder withProjectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder withLocation(String location) {
            this.location = location;
            return this;
        }

        public Builder withRepository(String repository) {
            this.repository = repository;
            return this;
        }

        public Builder withImage(String image) {
            this.image = image;
            return this;
        }

        public Builder withRecommendedTag(String recommendedTag) {
            this.recommendedTag = recommendedTag;
            return this;
        }

        public Builder withNumReleases(int numReleases) {
            this.numReleases = numReleases;
            return this;
        }

        public Builder withNumWeeklies(int numWeeklies) {
            this.numWeeklies = numWeeklies;
            return this;
        }

        public Builder withNumDailies(int numDailies) {
            this.numDailies = numDailies;
            return this;
        }

        public Builder withCycle(Integer cycle) {
            this.cycle = cycle;
            return this;
        }

        public Builder withAliasTags(List<String> aliasTags) {
            this.aliasTags = aliasTags;
            return this;
        }

        public ArtifactRegistrySourceConfig build() {
            return new ArtifactRegistrySourceConfig(projectId, location, repository, image, recommendedTag,
                    numReleases, numWeeklies, numDailies, cycle, aliasTags);
        }
    }
}
