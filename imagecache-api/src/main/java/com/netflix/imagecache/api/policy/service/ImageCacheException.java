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

import static java.lang.String.format;

public class ImageCacheException extends RuntimeException {

    public enum ErrorCode {
        /**
         * Malformed policy or strategy definition. Rejected at creation time, never stored.
         */
        ConfigError,
        /**
         * An image source could not produce its images in the current reconciliation iteration.
         */
        SourceUnavailable,
        /**
         * Pull workload could not be created, or the pull did not complete in time.
         */
        PullFailed,
        /**
         * Transient failure of the cluster API.
         */
        ClusterApiError,
        PolicyNotFound,
        PolicyAlreadyExists
    }

    private final ErrorCode errorCode;

    private ImageCacheException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    private ImageCacheException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static boolean hasErrorCode(Throwable error, ErrorCode errorCode) {
        return (error instanceof ImageCacheException) && ((ImageCacheException) error).getErrorCode() == errorCode;
    }

    public static ImageCacheException configError(String message, Object... args) {
        return new ImageCacheException(ErrorCode.ConfigError, format(message, args));
    }

    public static ImageCacheException configError(Throwable cause, String message, Object... args) {
        return new ImageCacheException(ErrorCode.ConfigError, format(message, args), cause);
    }

    public static ImageCacheException sourceUnavailable(String sourceName, Throwable cause) {
        return new ImageCacheException(ErrorCode.SourceUnavailable,
                format("Image source %s unavailable: %s", sourceName, cause.getMessage()), cause);
    }

    public static ImageCacheException pullFailed(String imageReference, String reason) {
        return new ImageCacheException(ErrorCode.PullFailed, format("Pull of image %s failed: %s", imageReference, reason));
    }

    public static ImageCacheException clusterApiError(String operation, Throwable cause) {
        return new ImageCacheException(ErrorCode.ClusterApiError,
                format("Cluster API call failed (%s): %s", operation, cause.getMessage()), cause);
    }

    public static ImageCacheException policyNotFound(String policyName) {
        return new ImageCacheException(ErrorCode.PolicyNotFound, format("Cache policy %s does not exist", policyName));
    }

    public static ImageCacheException policyAlreadyExists(String policyName) {
        return new ImageCacheException(ErrorCode.PolicyAlreadyExists, format("Cache policy %s already exists", policyName));
    }
}
