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

package com.netflix.imagecache.api.pull.model;

import java.util.Objects;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.netflix.imagecache.api.policy.model.LabelSelector;

/**
 * Immutable snapshot of a single image pull attempt. The id is the name of the pull workload in the cluster.
 */
public class PullJob {

    private final String id;
    private final String policyName;
    private final String imageReference;
    private final LabelSelector labelSelector;
    private final PullJobState state;
    private final int targetNodeCount;
    private final int completedNodeCount;
    private final Optional<String> lastError;
    private final long createdTimestamp;
    private final long stateTimestamp;

    public PullJob(String id,
                   String policyName,
                   String imageReference,
                   LabelSelector labelSelector,
                   PullJobState state,
                   int targetNodeCount,
                   int completedNodeCount,
                   Optional<String> lastError,
                   long createdTimestamp,
                   long stateTimestamp) {
        this.id = id;
        this.policyName = policyName;
        this.imageReference = imageReference;
        this.labelSelector = labelSelector;
        this.state = state;
        this.targetNodeCount = targetNodeCount;
        this.completedNodeCount = completedNodeCount;
        this.lastError = lastError;
        this.createdTimestamp = createdTimestamp;
        this.stateTimestamp = stateTimestamp;
    }

    public String getId() {
        return id;
    }

    public String getPolicyName() {
        return policyName;
    }

    public String getImageReference() {
        return imageReference;
    }

    public LabelSelector getLabelSelector() {
        return labelSelector;
    }

    public PullJobState getState() {
        return state;
    }

    public int getTargetNodeCount() {
        return targetNodeCount;
    }

    public int getCompletedNodeCount() {
        return completedNodeCount;
    }

    public Optional<String> getLastError() {
        return lastError;
    }

    public long getCreatedTimestamp() {
        return createdTimestamp;
    }

    public long getStateTimestamp() {
        return stateTimestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PullJob pullJob = (PullJob) o;
        return targetNodeCount == pullJob.targetNodeCount &&
                completedNodeCount == pullJob.completedNodeCount &&
                createdTimestamp == pullJob.createdTimestamp &&
                stateTimestamp == pullJob.stateTimestamp &&
                Objects.equals(id, pullJob.id) &&
                Objects.equals(policyName, pullJob.policyName) &&
                Objects.equals(imageReference, pullJob.imageReference) &&
                Objects.equals(labelSelector, pullJob.labelSelector) &&
                state == pullJob.state &&
                Objects.equals(lastError, pullJob.lastError);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, policyName, imageReference, labelSelector, state, targetNodeCount, completedNodeCount, lastError, createdTimestamp, stateTimestamp);
    }

    @Override
    public String toString() {
        return "PullJob{" +
                "id='" + id + '\'' +
                ", policyName='" + policyName + '\'' +
                ", imageReference='" + imageReference + '\'' +
                ", labelSelector=" + labelSelector +
                ", state=" + state +
                ", targetNodeCount=" + targetNodeCount +
                ", completedNodeCount=" + completedNodeCount +
                ", lastError=" + lastError +
                ", createdTimestamp=" + createdTimestamp +
                ", stateTimestamp=" + stateTimestamp +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withId(id)
                .withPolicyName(policyName)
                .withImageReference(imageReference)
                .withLabelSelector(labelSelector)
                .withState(state)
                .withTargetNodeCount(targetNodeCount)
                .withCompletedNodeCount(completedNodeCount)
                .withLastError(lastError.orElse(null))
                .withCreatedTimestamp(createdTimestamp)
                .withStateTimestamp(stateTimestamp);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String policyName;
        private String imageReference;
        private LabelSelector labelSelector;
        private PullJobState state = PullJobState.Pending;
        private int targetNodeCount;
        private int completedNodeCount;
        private String lastError;
        private long createdTimestamp;
        private long stateTimestamp;

        private Builder() {
        }

        public Builder withId(String id) {
            this.id = id;
            return this;
        }

        public Builder withPolicyName(String policyName) {
            this.policyName = policyName;
            return this;
        }

        public Builder withImageReference(String imageReference) {
            this.imageReference = imageReference;
            return this;
        }

        public Builder withLabelSelector(LabelSelector labelSelector) {
            this.labelSelector = labelSelector;
            return this;
        }

        public Builder withState(PullJobState state) {
            this.state = state;
            return this;
        }

        public Builder withTargetNodeCount(int targetNodeCount) {
            this.targetNodeCount = targetNodeCount;
            return this;
        }

        public Builder withCompletedNodeCount(int completedNodeCount) {
            this.completedNodeCount = completedNodeCount;
            return this;
        }

        public Builder withLastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder withCreatedTimestamp(long createdTimestamp) {
            this.createdTimestamp = createdTimestamp;
            return this;
        }

        public Builder withStateTimestamp(long stateTimestamp) {
            this.stateTimestamp = stateTimestamp;
            return this;
        }

        public PullJob build() {
            Preconditions.checkNotNull(id, "id cannot be null");
            Preconditions.checkNotNull(policyName, "policyName cannot be null");
            Preconditions.checkNotNull(imageReference, "imageReference cannot be null");
            Preconditions.checkNotNull(labelSelector, "labelSelector cannot be null");
            Preconditions.checkNotNull(state, "state cannot be null");
            return new PullJob(id, policyName, imageReference, labelSelector, state, targetNodeCount, completedNodeCount,
                    Optional.ofNullable(lastError), createdTimestamp, stateTimestamp);
        }
    }
}
