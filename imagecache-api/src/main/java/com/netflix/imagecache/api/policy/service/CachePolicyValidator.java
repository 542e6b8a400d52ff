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

package com.netflix.imagecache.api.policy.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.netflix.imagecache.api.policy.model.CachePolicy;
import com.netflix.imagecache.api.policy.model.LabelSelector;
import com.netflix.imagecache.api.policy.model.source.ArtifactRegistrySourceConfig;
import com.netflix.imagecache.api.policy.model.source.ImageSourceConfig;
import com.netflix.imagecache.api.policy.model.source.PinnedImage;
import com.netflix.imagecache.api.policy.model.source.PinnedListSourceConfig;
import com.netflix.imagecache.api.policy.model.source.TagClassifyingSourceConfig;
import com.netflix.imagecache.common.util.StringExt;

/**
 * Validation rules of cache policy definitions. All methods throw {@link ImageCacheException} with
 * {@link ImageCacheException.ErrorCode#ConfigError} listing every violation found.
 */
public final class CachePolicyValidator {

    private static final int MAX_NAME_LENGTH = 63;
    private static final int MAX_LABEL_PREFIX_LENGTH = 253;

    /**
     * Policy names are used in cluster object names and label values, so they must be DNS-1123 labels.
     */
    private static final Pattern POLICY_NAME_RE = Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?");
    private static final Pattern LABEL_NAME_RE = Pattern.compile("([A-Za-z0-9][-A-Za-z0-9_.]*)?[A-Za-z0-9]");
    private static final Pattern DNS_SUBDOMAIN_RE = Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?(\\.[a-z0-9]([-a-z0-9]*[a-z0-9])?)*");

    private CachePolicyValidator() {
    }

    public static void validate(CachePolicy policy) {
        List<String> violations = new ArrayList<>();
        if (StringExt.isEmpty(policy.getName())) {
            violations.add("policy name is empty");
        } else if (policy.getName().length() > MAX_NAME_LENGTH || !POLICY_NAME_RE.matcher(policy.getName()).matches()) {
            violations.add("policy name must be a lowercase DNS label of at most 63 characters: " + policy.getName());
        }
        violations.addAll(labelSelectorViolations(policy.getLabelSelector()));
        for (ImageSourceConfig strategy : policy.getStrategies()) {
            if (strategy == null) {
                violations.add("null strategy");
            } else {
                violations.addAll(strategyViolations(strategy));
            }
        }
        throwIfViolations("Invalid cache policy " + policy.getName(), violations);
    }

    public static void validateLabelSelector(LabelSelector labelSelector) {
        throwIfViolations("Invalid label selector", labelSelectorViolations(labelSelector));
    }

    public static void validateStrategy(ImageSourceConfig strategy) {
        throwIfViolations("Invalid " + strategy.getType() + " configuration", strategyViolations(strategy));
    }

    /**
     * Parses label selector in the 'key1=value1,key2=value2' format.
     */
    public static LabelSelector parseLabelSelector(String text) {
        LabelSelector selector;
        try {
            selector = new LabelSelector(StringExt.parseKeyValueList(text));
        } catch (RuntimeException e) {
            throw ImageCacheException.configError(e, "Cannot parse label selector '%s'", text);
        }
        validateLabelSelector(selector);
        return selector;
    }

    private static List<String> labelSelectorViolations(LabelSelector labelSelector) {
        List<String> violations = new ArrayList<>();
        if (labelSelector == null) {
            violations.add("label selector is missing");
            return violations;
        }
        for (Map.Entry<String, String> entry : labelSelector.getLabels().entrySet()) {
            if (!isValidLabelKey(entry.getKey())) {
                violations.add("invalid label key: '" + entry.getKey() + "'");
            }
            if (entry.getValue() == null || !(entry.getValue().isEmpty() || isValidLabelName(entry.getValue()))) {
                violations.add("invalid value of label " + entry.getKey() + ": '" + entry.getValue() + "'");
            }
        }
        return violations;
    }

    private static boolean isValidLabelKey(String key) {
        if (StringExt.isEmpty(key)) {
            return false;
        }
        int slashIdx = key.indexOf('/');
        if (slashIdx < 0) {
            return isValidLabelName(key);
        }
        String prefix = key.substring(0, slashIdx);
        return !prefix.isEmpty()
                && prefix.length() <= MAX_LABEL_PREFIX_LENGTH
                && DNS_SUBDOMAIN_RE.matcher(prefix).matches()
                && isValidLabelName(key.substring(slashIdx + 1));
    }

    private static boolean isValidLabelName(String name) {
        return name.length() <= MAX_NAME_LENGTH && LABEL_NAME_RE.matcher(name).matches();
    }

    private static List<String> strategyViolations(ImageSourceConfig strategy) {
        List<String> violations = new ArrayList<>();
        if (strategy instanceof PinnedListSourceConfig) {
            List<PinnedImage> images = ((PinnedListSourceConfig) strategy).getImages();
            if (images.isEmpty()) {
                violations.add("PinnedListStrategy image list is empty");
            }
            for (int i = 0; i < images.size(); i++) {
                PinnedImage image = images.get(i);
                if (image == null || StringExt.isEmpty(StringExt.safeTrim(image.getName()))) {
                    violations.add("PinnedListStrategy image #" + i + " has no name");
                }
                if (image == null || StringExt.isEmpty(StringExt.safeTrim(image.getImageUrl()))) {
                    violations.add("PinnedListStrategy image #" + i + " has no imageUrl");
                }
            }
        } else if (strategy instanceof TagClassifyingSourceConfig) {
            TagClassifyingSourceConfig config = (TagClassifyingSourceConfig) strategy;
            if (StringExt.isEmpty(StringExt.safeTrim(config.getRepo()))) {
                violations.add("TagClassifyingStrategy repo is empty");
            }
            if (config.getNumReleases() < 0 || config.getNumWeeklies() < 0 || config.getNumDailies() < 0) {
                violations.add("TagClassifyingStrategy image counts must not be negative");
            }
            config.getCycle().filter(cycle -> cycle < 0).ifPresent(cycle -> violations.add("TagClassifyingStrategy cycle must not be negative"));
            config.getRegistryUrl().filter(url -> url.trim().isEmpty()).ifPresent(url -> violations.add("TagClassifyingStrategy registryUrl is empty"));
            config.getRecommendedTag().filter(tag -> tag.trim().isEmpty()).ifPresent(tag -> violations.add("TagClassifyingStrategy recommendedTag is empty"));
        } else if (strategy instanceof ArtifactRegistrySourceConfig) {
            ArtifactRegistrySourceConfig config = (ArtifactRegistrySourceConfig) strategy;
            requireNotBlank(violations, "ArtifactRegistryStrategy projectId", config.getProjectId());
            requireNotBlank(violations, "ArtifactRegistryStrategy location", config.getLocation());
            requireNotBlank(violations, "ArtifactRegistryStrategy repository", config.getRepository());
            requireNotBlank(violations, "ArtifactRegistryStrategy image", config.getImage());
            if (config.getNumReleases() < 0 || config.getNumWeeklies() < 0 || config.getNumDailies() < 0) {
                violations.add("ArtifactRegistryStrategy image counts must not be negative");
            }
            config.getCycle().filter(cycle -> cycle < 0).ifPresent(cycle -> violations.add("ArtifactRegistryStrategy cycle must not be negative"));
            config.getRecommendedTag().filter(tag -> tag.trim().isEmpty()).ifPresent(tag -> violations.add("ArtifactRegistryStrategy recommendedTag is empty"));
        } else {
            violations.add("unsupported strategy type: " + strategy.getType());
        }
        return violations;
    }

    private static void requireNotBlank(List<String> violations, String field, String value) {
        if (StringExt.isEmpty(StringExt.safeTrim(value))) {
            violations.add(field + " is empty");
        }
    }

    private static void throwIfViolations(String message, List<String> violations) {
        if (!violations.isEmpty()) {
            throw ImageCacheException.configError("%s: %s", message, String.join("; ", violations));
        }
    }
}
