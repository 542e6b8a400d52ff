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

package com.netflix.imagecache.server.connector.kubernetes;

import io.fabric8.kubernetes.client.KubernetesClientException;

public class KubeApiException extends RuntimeException {

    public enum ErrorCode {
        CONFLICT_ALREADY_EXISTS,
        INTERNAL,
        NOT_FOUND,
    }

    private final ErrorCode errorCode;

    public KubeApiException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = cause instanceof KubernetesClientException ? toErrorCode((KubernetesClientException) cause) : ErrorCode.INTERNAL;
    }

    public KubeApiException(String operation, KubernetesClientException cause) {
        this(String.format("%s: %s, httpStatus=%s", operation, cause.getMessage(), cause.getCode()), (Throwable) cause);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static boolean hasErrorCode(Throwable error, ErrorCode errorCode) {
        return (error instanceof KubeApiException) && ((KubeApiException) error).getErrorCode() == errorCode;
    }

    private static ErrorCode toErrorCode(KubernetesClientException e) {
        if (e.getCode() == 404) {
            return ErrorCode.NOT_FOUND;
        }
        if (e.getCode() == 409) {
            return ErrorCode.CONFLICT_ALREADY_EXISTS;
        }
        return ErrorCode.INTERNAL;
    }
}
