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

package com.netflix.imagecache.api.node.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.google.common.base.Preconditions;

/**
 * Point in time view of a cluster node, and the images its container runtime reports as present.
 */
public class NodeRecord {

    private final String nodeName;
    private final Map<String, String> labels;
    private final Set<String> presentImages;
    private final boolean schedulable;

    public NodeRecord(String nodeName, Map<String, String> labels, Set<String> presentImages, boolean schedulable) {
        this.nodeName = nodeName;
        this.labels = Collections.unmodifiableMap(new HashMap<>(labels));
        this.presentImages = Collections.unmodifiableSet(new HashSet<>(presentImages));
        this.schedulable = schedulable;
    }

    public String getNodeName() {
        return nodeName;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    /**
     * All names (tag and digest forms) of images present on the node.
     */
    public Set<String> getPresentImages() {
        return presentImages;
    }

    /**
     * False if the node is cordoned, or has a taint preventing new pods from running on it.
     */
    public boolean isSchedulable() {
        return schedulable;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NodeRecord that = (NodeRecord) o;
        return schedulable == that.schedulable &&
                Objects.equals(nodeName, that.nodeName) &&
                Objects.equals(labels, that.labels) &&
                Objects.equals(presentImages, that.presentImages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeName, labels, presentImages, schedulable);
    }

    @Override
    public String toString() {
        return "NodeRecord{" +
                "nodeName='" + nodeName + '\'' +
                ", labels=" + labels +
                ", presentImages=" + presentImages.size() +
                ", schedulable=" + schedulable +
                '}';
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String nodeName;
        private Map<String, String> labels = Collections.emptyMap();
        private Set<String> presentImages = Collections.emptySet();
        private boolean schedulable = true;

        private Builder() {
        }

        public Builder withNodeName(String nodeName) {
            this.nodeName = nodeName;
            return this;
        }

        public Builder withLabels(Map<String, String> labels) {
            this.labels = labels;
            return this;
        }

        public Builder withPresentImages(Set<String> presentImages) {
            this.presentImages = presentImages;
            return this;
        }

        public Builder withSchedulable(boolean schedulable) {
            this.schedulable = schedulable;
            return this;
        }

        public NodeRecord build() {
            Preconditions.checkNotNull(nodeName, "nodeName cannot be null");
            Preconditions.checkNotNull(labels, "labels cannot be null");
            Preconditions.checkNotNull(presentImages, "presentImages cannot be null");
            return new NodeRecord(nodeName, labels, presentImages, schedulable);
        }
    }
}
