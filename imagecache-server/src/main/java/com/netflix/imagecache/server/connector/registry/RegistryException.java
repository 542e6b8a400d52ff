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

package com.netflix.imagecache.server.connector.registry;

import org.springframework.http.HttpStatus;

/**
 * Indicates an error communicating with a container image registry. Transport level errors are not wrapped,
 * and are subject to retries.
 */
public class RegistryException extends RuntimeException {

    public enum ErrorCode {
        INTERNAL,
        MISSING_HEADER,
        IMAGE_NOT_FOUND,
        AUTHENTICATION_FAILED,
        INVALID_RESPONSE,
    }

    private final ErrorCode errorCode;
    private final String repository;
    private final String reference;

    private RegistryException(ErrorCode errorCode, String repository, String reference, String message) {
        super(message);
        this.errorCode = errorCode;
        this.repository = repository;
        this.reference = reference;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getRepository() {
        return repository;
    }

    public String getReference() {
        return reference;
    }

    public static RegistryException imageNotFound(String repository, String reference) {
        return new RegistryException(
                ErrorCode.IMAGE_NOT_FOUND,
                repository,
                reference,
                String.format("Image %s:%s does not exist in registry", repository, reference)
        );
    }

    public static RegistryException internalError(String repository, String reference, HttpStatus statusCode) {
        return new RegistryException(ErrorCode.INTERNAL,
                repository,
                reference,
                String.format("Cannot fetch image %s:%s metadata: statusCode=%s", repository, reference, statusCode));
    }

    public static RegistryException headerMissing(String repository, String reference, String missingHeader) {
        return new RegistryException(ErrorCode.MISSING_HEADER,
                repository,
                reference,
                "Missing required header " + missingHeader);
    }

    public static RegistryException authenticationFailed(String registryHost, String repository, String reason) {
        return new RegistryException(ErrorCode.AUTHENTICATION_FAILED,
                repository,
                null,
                String.format("Cannot authenticate to registry %s for repository %s: %s", registryHost, repository, reason));
    }

    public static RegistryException invalidResponse(String repository, String reference, String reason) {
        return new RegistryException(ErrorCode.INVALID_RESPONSE,
                repository,
                reference,
                String.format("Invalid registry response for %s:%s: %s", repository, reference, reason));
    }
}
