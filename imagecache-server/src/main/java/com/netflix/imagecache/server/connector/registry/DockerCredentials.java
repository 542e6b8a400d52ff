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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.netflix.imagecache.api.json.ObjectMappers;
import com.netflix.imagecache.common.util.StringExt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry credentials read from a Docker <code>config.json</code> formatted file:
 * <pre>
 * {"auths": {"registry.example.com": {"auth": "base64(user:password)"}}}
 * </pre>
 * Entries may instead provide explicit <code>username</code> and <code>password</code> fields.
 */
public class DockerCredentials {

    private static final Logger logger = LoggerFactory.getLogger(DockerCredentials.class);

    private static final DockerCredentials NONE = new DockerCredentials(Collections.emptyMap());

    private final Map<String, String> authByHost;

    public DockerCredentials(Map<String, String> authByHost) {
        this.authByHost = Collections.unmodifiableMap(new HashMap<>(authByHost));
    }

    /**
     * Returns the <code>Authorization</code> header value for HTTP Basic authentication to the given host.
     */
    public Optional<String> getBasicAuthorization(String registryHost) {
        String auth = authByHost.get(registryHost);
        if (auth == null) {
            auth = authByHost.get("https://" + registryHost);
        }
        return Optional.ofNullable(auth).map(value -> "Basic " + value);
    }

    public boolean isEmpty() {
        return authByHost.isEmpty();
    }

    public static DockerCredentials none() {
        return NONE;
    }

    public static DockerCredentials parse(String dockerConfigJson) {
        JsonNode root;
        try {
            root = ObjectMappers.defaultMapper().readTree(dockerConfigJson);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid docker credentials file content: " + e.getMessage(), e);
        }
        JsonNode auths = root.path("auths");
        Map<String, String> authByHost = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = auths.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode value = entry.getValue();
            String auth = value.path("auth").asText("");
            if (StringExt.isEmpty(auth)) {
                String username = value.path("username").asText("");
                String password = value.path("password").asText("");
                if (StringExt.isNotEmpty(username)) {
                    auth = Base64.getEncoder().encodeToString((username + ':' + password).getBytes(StandardCharsets.UTF_8));
                }
            }
            if (StringExt.isNotEmpty(auth)) {
                authByHost.put(entry.getKey(), auth);
            }
        }
        return new DockerCredentials(authByHost);
    }

    /**
     * Loads credentials from a file. A missing or unreadable file results in anonymous registry access.
     */
    public static DockerCredentials load(String fileName) {
        if (StringExt.isEmpty(fileName)) {
            return NONE;
        }
        File file = new File(fileName);
        if (!file.exists()) {
            logger.info("Docker credentials file {} not found; using anonymous registry access", fileName);
            return NONE;
        }
        try {
            String content = com.google.common.io.Files.asCharSource(file, StandardCharsets.UTF_8).read();
            DockerCredentials credentials = parse(content);
            logger.info("Loaded docker credentials for registries: {}", credentials.authByHost.keySet());
            return credentials;
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Cannot read docker credentials file {}; using anonymous registry access: {}", fileName, e.getMessage());
            return NONE;
        }
    }
}
