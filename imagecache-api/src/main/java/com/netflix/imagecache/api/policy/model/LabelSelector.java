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
import java.util.Map;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * Node label selector. A node is matched when it has all labels of the selector with the same values. An empty
 * selector matches all nodes.
 */
public class LabelSelector {

    private static final LabelSelector EMPTY = new LabelSelector(Collections.emptyMap());

    private final Map<String, String> labels;

    public LabelSelector(Map<String, String> labels) {
        Preconditions.checkNotNull(labels, "labels cannot be null");
        this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    public boolean matches(Map<String, String> nodeLabels) {
        if (nodeLabels == null) {
            return labels.isEmpty();
        }
        for (Map.Entry<String, String> entry : labels.entrySet()) {
            if (!entry.getValue().equals(nodeLabels.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LabelSelector that = (LabelSelector) o;
        return Objects.equals(labels, that.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(labels);
    }

    @Override
    public String toString() {
        return "LabelSelector" + labels;
    }

    public static LabelSelector empty() {
        return EMPTY;
    }

    public static LabelSelector of(String... keyValuePairs) {
        Preconditions.checkArgument(keyValuePairs.length % 2 == 0, "Expected even number of arguments");
        Map<String, String> labels = new LinkedHashMap<>();
        for (int i = 0; i < keyValuePairs.length; i += 2) {
            labels.put(keyValuePairs[i], keyValuePairs[i + 1]);
        }
        return new LabelSelector(labels);
    }
}
