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

import java.util.Objects;
import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * Image that should be present on all nodes targeted by a cache policy.
 */
public class DesiredImage {

    private final String displayName;
    private final String imageReference;
    private final Optional<ImageCategory> category;
    private final Optional<String> digest;

    public DesiredImage(String displayName, String imageReference, Optional<ImageCategory> category, Optional<String> digest) {
        this.displayName = displayName;
        this.imageReference = imageReference;
        this.category = category;
        this.digest = digest;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Pull string, for example 'registry.hub.docker.com/lsstsqre/sciplat-lab:w_2021_13'.
     */
    public String getImageReference() {
        return imageReference;
    }

    public Optional<ImageCategory> getCategory() {
        return category;
    }

    /**
     * Content digest ('sha256:...') the tag pointed to when the image was resolved. If set, the image is
     * counted as available only if nodes hold this exact content.
     */
    public Optional<String> getDigest() {
        return digest;
    }

    /**
     * Returns the 'repository@digest' form of this image, if the digest is known.
     */
    public Optional<String> getDigestReference() {
        return digest.map(d -> getRepository() + '@' + d);
    }

    /**
     * Image reference without the tag or digest part.
     */
    public String getRepository() {
        int digestIdx = imageReference.indexOf('@');
        if (digestIdx >= 0) {
            return imageReference.substring(0, digestIdx);
        }
        int lastSlash = imageReference.lastIndexOf('/');
        int tagIdx = imageReference.lastIndexOf(':');
        return tagIdx > lastSlash ? imageReference.substring(0, tagIdx) : imageReference;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DesiredImage that = (DesiredImage) o;
        return Objects.equals(displayName, that.displayName) &&
                Objects.equals(imageReference, that.imageReference) &&
                Objects.equals(category, that.category) &&
                Objects.equals(digest, that.digest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(displayName, imageReference, category, digest);
    }

    @Override
    public String toString() {
        return "DesiredImage{" +
                "displayName='" + displayName + '\'' +
                ", imageReference='" + imageReference + '\'' +
                ", category=" + category +
                ", digest=" + digest +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withDisplayName(displayName)
                .withImageReference(imageReference)
                .withCategory(category.orElse(null))
                .withDigest(digest.orElse(null));
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String displayName;
        private String imageReference;
        private ImageCategory category;
        private String digest;

        private Builder() {
        }

        public Builder withDisplayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder withImageReference(String imageReference) {
            this.imageReference = imageReference;
            return this;
        }

        public Builder withCategory(ImageCategory category) {
            this.category = category;
            return this;
        }

        public Builder withDigest(String digest) {
            this.digest = digest;
            return this;
        }

        public DesiredImage build() {
            Preconditions.checkNotNull(displayName, "displayName cannot be null");
            Preconditions.checkNotNull(imageReference, "imageReference cannot be null");
            return new DesiredImage(displayName, imageReference, Optional.ofNullable(category), Optional.ofNullable(digest));
        }
    }
}
