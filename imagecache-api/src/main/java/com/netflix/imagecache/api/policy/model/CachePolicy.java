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

package com.netflix.imagecache.api.policy.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.netflix.imagecache.api.policy.model.source.ImageSourceConfig;

/**
 * Named binding of a node label selector to an ordered list of image sources. The order of sources defines the
 * order in which their images are reported, but images of all sources are pulled.
 */
public class CachePolicy {

    private final String name;
    private final LabelSelector labelSelector;
    private final List<ImageSourceConfig> strategies;

    public CachePolicy(String name, LabelSelector labelSelector, List<ImageSourceConfig> strategies) {
        this.name = name;
        this.labelSelector = labelSelector == null ? LabelSelector.empty() : labelSelector;
        this.strategies = strategies == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(strategies));
    }

    public String getName() {
        return name;
    }

    public LabelSelector getLabelSelector() {
        return labelSelector;
    }

    public List<ImageSourceConfig> getStrategies() {
        return strategies;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CachePolicy that = (CachePolicy) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(labelSelector, that.labelSelector) &&
                Objects.equals(strategies, that.strategies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, labelSelector, strategies);
    }

    @Override
    public String toString() {
        return "CachePolicy{" +
                "name='" + name + '\'' +
                ", labelSelector=" + labelSelector +
                ", strategies=" + strategies +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder().withName(name).withLabelSelector(labelSelector).withStrategies(strategies);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private LabelSelector labelSelector = LabelSelector.empty();
        private List<ImageSourceConfig> strategies = new ArrayList<>();

        private Builder() {
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withLabelSelector(LabelSelector labelSelector) {
            this.labelSelector = labelSelector;
            return this;
        }

        public Builder withStrategies(List<ImageSourceConfig> strategies) {
            this.strategies = new ArrayList<>(strategies);
            return this;
        }

        public Builder withStrategy(ImageSourceConfig strategy) {
            this.strategies.add(strategy);
            return this;
        }

        public CachePolicy build() {
            Preconditions.checkNotNull(labelSelector, "labelSelector cannot be null");
            return new CachePolicy(name, labelSelector, strategies);
        }
    }
}
