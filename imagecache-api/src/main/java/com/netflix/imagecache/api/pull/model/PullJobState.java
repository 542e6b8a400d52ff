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

public enum PullJobState {
    /**
     * Accepted, not acted on yet.
     */
    Pending(false),

    /**
     * Pull workload is being created in the cluster.
     */
    Creating(false),

    /**
     * Waiting for the workload pods to become available on all targeted nodes.
     */
    Waiting(false),

    /**
     * Pull confirmed, workload is being removed.
     */
    Deleting(false),

    Done(true),

    Failed(true);

    private final boolean terminal;

    PullJobState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
