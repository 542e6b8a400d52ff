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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Strings;

/**
 * Classifies registry tags following the release/weekly/daily naming convention:
 * <ul>
 *     <li>release: <code>r22_0_1</code>, legacy <code>r170</code></li>
 *     <li>weekly: <code>w_2021_13</code></li>
 *     <li>daily: <code>d_2021_05_13</code></li>
 * </ul>
 * Each may be followed by a cycle suffix (<code>_c0020.001</code>, <code>_csal0020.001</code>) and a free form
 * build suffix (<code>_&lt;rest&gt;</code>). A cycle without a fractional part is read as a build suffix.
 * Tags that are not all lower case are never classified.
 */
public final class ImageTagParser {

    private static final String SUFFIX = "(?:_(c|csal)(\\d+\\.\\d+))?(?:_(.*))?";

    private static final Pattern RELEASE = Pattern.compile("^r(\\d+)_(\\d+)_(\\d+)" + SUFFIX + "$");
    private static final Pattern LEGACY_RELEASE = Pattern.compile("^r(\\d\\d)(\\d)$");
    private static final Pattern RELEASE_CANDIDATE = Pattern.compile("^r\\d+_\\d+_\\d+_rc\\d+(?:_.*)?$");
    private static final Pattern WEEKLY = Pattern.compile("^w_(\\d+)_(\\d+)" + SUFFIX + "$");
    private static final Pattern DAILY = Pattern.compile("^d_(\\d+)_(\\d+)_(\\d+)" + SUFFIX + "$");

    private ImageTagParser() {
    }

    public static ImageTag parse(String tag, Set<String> aliasTags) {
        try {
            return classify(tag, aliasTags);
        } catch (NumberFormatException e) {
            // Version component out of int range
            return unrecognized(tag);
        }
    }

    private static ImageTag classify(String tag, Set<String> aliasTags) {
        if (aliasTags.contains(tag)) {
            return new ImageTag(tag, ImageTagType.Alias, tag, Collections.emptyList(), Optional.empty(), Optional.empty());
        }
        if (!tag.equals(tag.toLowerCase(Locale.ROOT)) || RELEASE_CANDIDATE.matcher(tag).matches()) {
            return unrecognized(tag);
        }

        Matcher matcher = RELEASE.matcher(tag);
        if (matcher.matches()) {
            String base = String.format("Release r%s.%s.%s", matcher.group(1), matcher.group(2), matcher.group(3));
            return withSuffix(tag, ImageTagType.Release, base, matcher, 4, toInts(matcher.group(1), matcher.group(2), matcher.group(3)));
        }
        matcher = LEGACY_RELEASE.matcher(tag);
        if (matcher.matches()) {
            String base = String.format("Release r%s.%s", matcher.group(1), matcher.group(2));
            return new ImageTag(tag, ImageTagType.Release, base, toInts(matcher.group(1), matcher.group(2), "0"), Optional.empty(), Optional.empty());
        }
        matcher = WEEKLY.matcher(tag);
        if (matcher.matches()) {
            String base = String.format("Weekly %s_%s", matcher.group(1), matcher.group(2));
            return withSuffix(tag, ImageTagType.Weekly, base, matcher, 3, toInts(matcher.group(1), matcher.group(2)));
        }
        matcher = DAILY.matcher(tag);
        if (matcher.matches()) {
            String base = String.format("Daily %s_%s_%s", matcher.group(1), matcher.group(2), matcher.group(3));
            return withSuffix(tag, ImageTagType.Daily, base, matcher, 4, toInts(matcher.group(1), matcher.group(2), matcher.group(3)));
        }
        return unrecognized(tag);
    }

    /**
     * Converts cycle text to its integer value, for example '0020.001' to 20.
     */
    public static int parseCycle(String cycleText) {
        return (int) Double.parseDouble(cycleText);
    }

    private static ImageTag withSuffix(String tag,
                                       ImageTagType type,
                                       String base,
                                       Matcher matcher,
                                       int suffixGroup,
                                       List<Integer> version) {
        String cycleKind = matcher.group(suffixGroup);
        String cycleText = matcher.group(suffixGroup + 1);
        String rest = Strings.emptyToNull(matcher.group(suffixGroup + 2));

        StringBuilder displayName = new StringBuilder(base);
        Optional<Integer> cycle = Optional.empty();
        if (cycleText != null) {
            displayName.append('_').append(cycleKind).append(cycleText);
            cycle = Optional.of(parseCycle(cycleText));
        }
        if (rest != null) {
            displayName.append('_').append(rest);
        }
        return new ImageTag(tag, type, displayName.toString(), version, cycle, Optional.ofNullable(rest));
    }

    private static ImageTag unrecognized(String tag) {
        return new ImageTag(tag, ImageTagType.Unrecognized, tag, Collections.emptyList(), Optional.empty(), Optional.empty());
    }

    private static List<Integer> toInts(String... values) {
        Integer[] result = new Integer[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = Integer.parseInt(values[i]);
        }
        return Arrays.asList(result);
    }
}
