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

package com.netflix.imagecache.common.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A set of string manipulation related functions.
 */
public final class StringExt {

    private static final Pattern COMMA_SPLIT_RE = Pattern.compile("\\s*,\\s*");

    private StringExt() {
    }

    public static boolean isNotEmpty(String s) {
        return s != null && !s.isEmpty();
    }

    public static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }

    /**
     * Trim string value if not null, otherwise return empty string.
     */
    public static String safeTrim(String s) {
        return s == null ? "" : s.trim();
    }

    /**
     * Parses text in format 'key1=value1,key2=value2' into a map, preserving the entry order. Entries without
     * a separator map to an empty value.
     */
    public static Map<String, String> parseKeyValueList(String text) {
        String trimmed = safeTrim(text);
        if (trimmed.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (String keyValuePair : COMMA_SPLIT_RE.split(trimmed)) {
            int idx = keyValuePair.indexOf('=');
            if (idx == -1) {
                result.put(keyValuePair.trim(), "");
            } else {
                result.put(keyValuePair.substring(0, idx).trim(), keyValuePair.substring(idx + 1).trim());
            }
        }
        return result;
    }

    public static String appendToEndIfMissing(String text, String value) {
        return text.endsWith(value) ? text : text + value;
    }
}
