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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import com.google.common.base.Preconditions;
import com.netflix.imagecache.api.pull.model.PullJob;

/**
 * Derived state of a cache policy, recomputed on each reconciliation iteration.
 */
public class CachePolicyStatus {

    private final String policyName;
    private final LabelSelector labelSelector;
    private final List<DesiredImage> desired;
    private final List<PullJob> pulling;
    private final List<DesiredImage> available;
    private final Set<String> commonImages;
    private final int targetNodeCount;
    private final Map<String, String> sourceErrors;
    private final long lastReconciledTimestamp;

    public CachePolicyStatus(String policyName,
                             LabelSelector labelSelector,
                             List<DesiredImage> desired,
                             List<PullJob> pulling,
                             List<DesiredImage> available,
                             Set<String> commonImages,
                             int targetNodeCount,
                             Map<String, String> sourceErrors,
                             long lastReconciledTimestamp) {
        this.policyName = policyName;
        this.labelSelector = labelSelector;
        this.desired = Collections.unmodifiableList(desired);
        this.pulling = Collections.unmodifiableList(pulling);
        this.available = Collections.unmodifiableList(available);
        this.commonImages = Collections.unmodifiableSet(new TreeSet<>(commonImages));
        this.targetNodeCount = targetNodeCount;
        this.sourceErrors = Collections.unmodifiableMap(new LinkedHashMap<>(sourceErrors));
        this.lastReconciledTimestamp = lastReconciledTimestamp;
    }

    public String getPolicyName() {
        return policyName;
    }

    public LabelSelector getLabelSelector() {
        return labelSelector;
    }

    /**
     * Images computed by the policy sources in the last iteration, in source order.
     */
    public List<DesiredImage> getDesired() {
        return desired;
    }

    /**
     * Active pull jobs, and the last failed attempts of images that are not available yet.
     */
    public List<PullJob> getPulling() {
        return pulling;
    }

    /**
     * Desired images present on every node targeted by the policy.
     */
    public List<DesiredImage> getAvailable() {
        return available;
    }

    /**
     * All image names present on every targeted node, desired or not.
     */
    public Set<String> getCommonImages() {
        return commonImages;
    }

    public int getTargetNodeCount() {
        return targetNodeCount;
    }

    public Map<String, String> getSourceErrors() {
        return sourceErrors;
    }

    /**
     * Completion time of the last reconciliation iteration, or 0 if none completed yet.
     */
    public long getLastReconciledTimestamp() {
        return lastReconciledTimestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CachePolicyStatus that = (CachePolicyStatus) o;
        return targetNodeCount == that.targetNodeCount &&
                lastReconciledTimestamp == that.lastReconciledTimestamp &&
                Objects.equals(policyName, that.policyName) &&
                Objects.equals(labelSelector, that.labelSelector) &&
                Objects.equals(desired, that.desired) &&
                Objects.equals(pulling, that.pulling) &&
                Objects.equals(available, that.available) &&
                Objects.equals(commonImages, that.commonImages) &&
                Objects.equals(sourceErrors, that.sourceErrors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(policyName, labelSelector, desired, pulling, available, commonImages, targetNodeCount, sourceErrors, lastReconciledTimestamp);
    }

    @Override
    public String toString() {
        return "CachePolicyStatus{" +
                "policyName='" + policyName + '\'' +
                ", labelSelector=" + labelSelector +
                ", desired=" + desired +
                ", pulling=" + pulling +
                ", available=" + available +
                ", commonImages=" + commonImages.size() +
                ", targetNodeCount=" + targetNodeCount +
                ", sourceErrors=" + sourceErrors +
                ", lastReconciledTimestamp=" + lastReconciledTimestamp +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withPolicyName(policyName)
                .withLabelSelector(labelSelector)
                .withDesired(desired)
                .withPulling(pulling)
                .withAvailable(available)
                .withCommonImages(commonImages)
                .withTargetNodeCount(targetNodeCount)
                .withSourceErrors(sourceErrors)
                .withLastReconciledTimestamp(lastReconciledTimestamp);
    }

    /**
     * Status of a policy that has not completed any reconciliation yet.
     */
    public static CachePolicyStatus initial(String policyName, LabelSelector labelSelector) {
        return newBuilder().withPolicyName(policyName).withLabelSelector(labelSelector).build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String policyName;
        private LabelSelector labelSelector;
        private List<DesiredImage> desired = Collections.emptyList();
        private List<PullJob> pulling = Collections.emptyList();
        private List<DesiredImage> available = Collections.emptyList();
        private Set<String> commonImages = Collections.emptySet();
        private int targetNodeCount;
        private Map<String, String> sourceErrors = Collections.emptyMap();
        private long lastReconciledTimestamp;

        private Builder() {
        }

        public Builder withPolicyName(String policyName) {
            this.policyName = policyName;
            return this;
        }

        public Builder withLabelSelector(LabelSelector labelSelector) {
            this.labelSelector = labelSelector;
            return this;
        }

        public Builder withDesired(List<DesiredImage> desired) {
            this.desired = desired;
            return this;
        }

        public Builder withPulling(List<PullJob> pulling) {
            this.pulling = pulling;
            return this;
        }

        public Builder withAvailable(List<DesiredImage> available) {
            this.available = available;
            return this;
        }

        public Builder withCommonImages(Set<String> commonImages) {
            this.commonImages = commonImages;
            return this;
        }

        public Builder withTargetNodeCount(int targetNodeCount) {
            this.targetNodeCount = targetNodeCount;
            return this;
        }

        public Builder withSourceErrors(Map<String, String> sourceErrors) {
            this.sourceErrors = sourceErrors;
            return this;
        }

        public Builder withLastReconciledTimestamp(long lastReconciledTimestamp) {
            this.lastReconciledTimestamp = lastReconciledTimestamp;
            return this;
        }

        public CachePolicyStatus build() {
            Preconditions.checkNotNull(policyName, "policyName cannot be null");
            Preconditions.checkNotNull(labelSelector, "labelSelector cannot be null");
            return new CachePolicyStatus(policyName, labelSelector, desired, pulling, available, commonImages,
                    targetNodeCount, sourceErrors, lastReconciledTimestamp);
        }
    }
}
