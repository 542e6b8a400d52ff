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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import com.netflix.imagecache.api.policy.model.DesiredImage;
import com.netflix.imagecache.api.policy.model.ImageCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tag classification and selection shared by the registry backed strategies. Tags are classified, filtered by
 * cycle, and the configured number of the most recent release, weekly and daily tags is kept.
 */
final class TagSelector {

    private static final Logger logger = LoggerFactory.getLogger(TagSelector.class);

    private final String owner;
    private final Set<String> aliasTags;
    private final Optional<Integer> cycle;
    private final Map<ImageTagType, Integer> counts = new EnumMap<>(ImageTagType.class);

    TagSelector(String owner,
                Collection<String> aliasTags,
                Optional<String> recommendedTag,
                Optional<Integer> cycle,
                int numReleases,
                int numWeeklies,
                int numDailies) {
        this.owner = owner;
        Set<String> aliases = new HashSet<>(aliasTags);
        recommendedTag.ifPresent(aliases::add);
        this.aliasTags = Collections.unmodifiableSet(aliases);
        this.cycle = cycle;
        counts.put(ImageTagType.Release, numReleases);
        counts.put(ImageTagType.Weekly, numWeeklies);
        counts.put(ImageTagType.Daily, numDailies);
    }

    /**
     * Returns the selected tags, releases first, then weeklies and dailies, each group most recent first.
     */
    List<ImageTag> select(Collection<String> tags) {
        Map<ImageTagType, List<ImageTag>> byType = new EnumMap<>(ImageTagType.class);
        for (ImageTagType type : ImageTagType.values()) {
            byType.put(type, new ArrayList<>());
        }
        for (String tag : tags) {
            ImageTag imageTag = ImageTagParser.parse(tag, aliasTags);
            if (imageTag.getType() == ImageTagType.Unrecognized) {
                logger.debug("[{}] Ignoring unrecognized tag {}", owner, tag);
                continue;
            }
            if (imageTag.getType() != ImageTagType.Alias && cycle.isPresent() && !cycle.equals(imageTag.getCycle())) {
                continue;
            }
            byType.get(imageTag.getType()).add(imageTag);
        }

        List<ImageTag> ordered = new ArrayList<>();
        ordered.addAll(mostRecent(byType.get(ImageTagType.Release), counts.get(ImageTagType.Release)));
        ordered.addAll(mostRecent(byType.get(ImageTagType.Weekly), counts.get(ImageTagType.Weekly)));
        ordered.addAll(mostRecent(byType.get(ImageTagType.Daily), counts.get(ImageTagType.Daily)));
        return ordered;
    }

    /**
     * Builds the desired images of the selected tags, followed by the recommended image if there is one.
     * The recommended image is named after the selected images sharing its digest.
     */
    static List<DesiredImage> toDesiredImages(List<ImageTag> selected,
                                              Optional<String> recommendedTag,
                                              Map<String, String> digests,
                                              ImageReferenceFormatter formatter) {
        List<DesiredImage> result = new ArrayList<>();
        for (ImageTag tag : selected) {
            result.add(DesiredImage.newBuilder()
                    .withDisplayName(tag.getDisplayName())
                    .withImageReference(formatter.toImageReference(tag.getTag()))
                    .withCategory(toCategory(tag.getType()))
                    .withDigest(digests.get(tag.getTag()))
                    .build()
            );
        }
        recommendedTag.ifPresent(recommended -> {
            String digest = digests.get(recommended);
            List<String> sameImage = selected.stream()
                    .filter(tag -> digest != null && digest.equals(digests.get(tag.getTag())))
                    .map(ImageTag::getDisplayName)
                    .collect(Collectors.toList());
            result.add(DesiredImage.newBuilder()
                    .withDisplayName(sameImage.isEmpty() ? "Recommended" : "Recommended (" + String.join(", ", sameImage) + ')')
                    .withImageReference(formatter.toImageReference(recommended))
                    .withCategory(ImageCategory.Recommended)
                    .withDigest(digest)
                    .build()
            );
        });
        return result;
    }

    private static List<ImageTag> mostRecent(List<ImageTag> tags, int count) {
        return tags.stream()
                .sorted(ImageTag.MOST_RECENT_FIRST)
                .limit(count)
                .collect(Collectors.toList());
    }

    private static ImageCategory toCategory(ImageTagType type) {
        switch (type) {
            case Release:
                return ImageCategory.Release;
            case Weekly:
                return ImageCategory.Weekly;
            case Daily:
                return ImageCategory.Daily;
            default:
                throw new IllegalArgumentException("No image category for tag type " + type);
        }
    }

    @FunctionalInterface
    interface ImageReferenceFormatter {
        String toImageReference(String tag);
    }
}
