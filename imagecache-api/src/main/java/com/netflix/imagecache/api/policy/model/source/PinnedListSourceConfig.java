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

/**
 * Static, ordered image list.
 */
public class PinnedListSourceConfig extends ImageSourceConfig {

    private final List<PinnedImage> images;

    public PinnedListSourceConfig(List<PinnedImage> images) {
        this.images = images == null ? Collections.emptyList() : Collections.unmodifiableList(images);
    }

    @Override
    public String getType() {
        return PINNED_LIST_STRATEGY;
    }

    public List<PinnedImage> getImages() {
        return images;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PinnedListSourceConfig that = (PinnedListSourceConfig) o;
        return Objects.equals(images, that.images);
    }

    @Override
    public int hashCode() {
        return Objects.hash(images);
    }

    @Override
    public String toString() {
        return "PinnedListSourceConfig{images=" + images + '}';
    }
}
