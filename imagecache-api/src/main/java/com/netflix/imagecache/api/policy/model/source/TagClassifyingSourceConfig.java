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
 * Registry backed image source, which classifies repository tags into releases, weeklies and dailies, and
 * selects the most recent ones of each kind.
 */
public class TagClassifyingSourceConfig extends ImageSourceConfig {

    private final String repo;
    private final Optional<String> registryUrl;
    private final Optional<String> recommendedTag;
    private final int numReleases;
    private final int numWeeklies;
    private final int numDailies;
    private final Optional<Integer> cycle;
    private final List<String> aliasTags;

    public TagClassifyingSourceConfig(String repo,
                                      String registryUrl,
                                      String recommendedTag,
                                      int numReleases,
                                      int numWeeklies,
                                      int numDailies,
                                      Integer cycle,
                                      List<String> aliasTags) {
        this.repo = repo;
        this.registryUrl = Optional.ofNullable(registryUrl);
        this.recommendedTag = Optional.ofNullable(recommendedTag);
        this.numReleases = numReleases;
        this.numWeeklies = numWeeklies;
        this.numDailies = numDailies;
        this.cycle = Optional.ofNullable(cycle);
        this.aliasTags = aliasTags == null ? Collections.emptyList() : Collections.unmodifiableList(aliasTags);
    }

    @Override
    public String getType() {
        return TAG_CLASSIFYING_STRATEGY;
    }

    /**
     * Repository name within the registry, for example 'lsstsqre/sciplat-lab'.
     */
    public String getRepo() {
        return repo;
    }

    /**
     * Registry host. If not set, the configured default registry is used.
     */
    public Optional<String> getRegistryUrl() {
        return registryUrl;
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

    /**
     * If set, only tags built for this cycle are considered.
     */
    public Optional<Integer> getCycle() {
        return cycle;
    }

    /**
     * Tags which are pointers to other images, and are never enumerated.
     */
    public List<String> getAliasTags() {
        return aliasTags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TagClassifyingSourceConfig that = (TagClassifyingSourceConfig) o;
        return numReleases == that.numReleases &&
                numWeeklies == that.numWeeklies &&
                numDailies == that.numDailies &&
                Objects.equals(repo, that.repo) &&
                Objects.equals(registryUrl, that.registryUrl) &&
                Objects.equals(recommendedTag, that.recommendedTag) &&
                Objects.equals(cycle, that.cycle) &&
                Objects.equals(aliasTags, that.aliasTags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(repo, registryUrl, recommendedTag, numReleases, numWeeklies, numDailies, cycle, aliasTags);
    }

    @Override
    public String toString() {
        return "TagClassifyingSourceConfig{" +
                "repo='" + repo + '\'' +
                ", registryUrl=" + registryUrl +
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
        private String repo;
        private String registryUrl;
        private String recommendedTag;
        private int numReleases;
        private int numWeeklies;
        private int numDailies;
        private Integer cycle;
        private List<String> aliasTags;

        private Builder() {
        }

        public Builder withRepo(String repo) {
            this.repo = repo;
            return this;
        }

        public Builder withRegistryUrl(String registryUrl) {
            this.registryUrl = registryUrl;
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

        public TagClassifyingSourceConfig build() {
            return new TagClassifyingSourceConfig(repo, registryUrl, recommendedTag, numReleases, numWeeklies, numDailies, cycle, aliasTags);
        }
    }
}
