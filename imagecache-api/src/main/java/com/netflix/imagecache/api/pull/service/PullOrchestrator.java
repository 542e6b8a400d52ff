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

package com.netflix.imagecache.api.pull.service;

import java.util.List;
import java.util.Optional;

import com.netflix.imagecache.api.policy.model.LabelSelector;
import com.netflix.imagecache.api.pull.model.PullJob;

/**
 * Forces images onto nodes by running short lived, node selector scoped workloads.
 */
public interface PullOrchestrator {

    /**
     * Starts a pull of the image on all nodes matching the selector. If a pull for the same image and selector
     * is already in progress, the policy is attached to it and its handle is returned instead.
     *
     * @param targetNodeCount number of nodes the workload is expected to land on, used until the cluster reports
     *                        its own count
     */
    PullJobHandle ensurePulled(String policyName, String imageReference, LabelSelector labelSelector, int targetNodeCount);

    Optional<PullJobHandle> findActivePull(String imageReference, LabelSelector labelSelector);

    /**
     * Active pulls the given policy is attached to, including pulls started by another policy. The job's
     * policy name is the one of the policy that started it.
     */
    List<PullJob> getActivePulls(String policyName);

    /**
     * Detaches the policy from its active pulls. Pulls no other policy is attached to are stopped, and their
     * workloads are removed on a best effort basis.
     */
    void abandon(String policyName);

    /**
     * Removes pull workloads left over by a previous process instance. Returns the number of removed workloads.
     */
    int cleanupOrphanedWorkloads();
}
