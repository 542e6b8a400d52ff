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

package com.netflix.imagecache.server.source;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A classified registry tag.
 */
public class ImageTag {

    /**
     * Orders tags of the same type from the most to the least recent.
     */
    public static final Comparator<ImageTag> MOST_RECENT_FIRST = ImageTag::compareRecency;

    private final String tag;
    private final ImageTagType type;
    private final String displayName;
    private final List<Integer> version;
    private final Optional<Integer> cycle;
    private final Optional<String> rest;

    public ImageTag(String tag,
                    ImageTagType type,
                    String displayName,
                    List<Integer> version,
                    Optional<Integer> cycle,
                    Optional<String> rest) {
        this.tag = tag;
        this.type = type;
        this.displayName = displayName;
        this.version = Collections.unmodifiableList(version);
        this.cycle = cycle;
        this.rest = rest;
    }

    public String getTag() {
        return tag;
    }

    public ImageTagType getType() {
        return type;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Numeric components used for ranking: (major, minor, patch) for releases, (year, week) for weeklies and
     * (year, month, day) for dailies.
     */
    public List<Integer> getVersion() {
        return version;
    }

    public Optional<Integer> getCycle() {
        return cycle;
    }

    public Optional<String> getRest() {
        return rest;
    }

    private static int compareRecency(ImageTag first, ImageTag second) {
        int size = Math.max(first.version.size(), second.version.size());
        for (int i = 0; i < size; i++) {
            int a = i < first.version.size() ? first.version.get(i) : 0;
            int b = i < second.version.size() ? second.version.get(i) : 0;
            if (a != b) {
                return Integer.compare(b, a);
            }
        }
        int byRest = second.rest.orElse("").compareTo(first.rest.orElse(""));
        if (byRest != 0) {
            return byRest;
        }
        return second.tag.compareTo(first.tag);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ImageTag imageTag = (ImageTag) o;
        return Objects.equals(tag, imageTag.tag) &&
                type == imageTag.type &&
                Objects.equals(displayName, imageTag.displayName) &&
                Objects.equals(version, imageTag.version) &&
                Objects.equals(cycle, imageTag.cycle) &&
                Objects.equals(rest, imageTag.rest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, type, displayName, version, cycle, rest);
    }

    @Override
    public String toString() {
        return "ImageTag{" +
                "tag='" + tag + '\'' +
                ", type=" + type +
                ", displayName='" + displayName + '\'' +
                ", version=" + version +
                ", cycle=" + cycle +
                ", rest=" + rest +
                '}';
    }
}
