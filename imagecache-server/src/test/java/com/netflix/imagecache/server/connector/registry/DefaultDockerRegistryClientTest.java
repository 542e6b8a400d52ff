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

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Collections;
import java.util.List;

import com.netflix.imagecache.common.runtime.ImageCacheRuntime;
import com.netflix.imagecache.common.runtime.ImageCacheRuntimes;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockserver.integration.ClientAndServer;
import org.mockserver.model.Header;
import org.mockserver.model.HttpRequest;
import org.mockserver.model.HttpResponse;
import org.mockserver.verify.VerificationTimes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.mockserver.integration.ClientAndServer.startClientAndServer;

public class DefaultDockerRegistryClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private static final String REPO = "lsstsqre/sciplat-lab";
    private static final String DIGEST = "sha256:f9f5bb506406b80454a4255b33ed2e4383b9e4a32fb94d6f7e51922704e818fa";

    private final ImageCacheRuntime runtime = ImageCacheRuntimes.internal();

    private final RegistryClientConfiguration configuration = mock(RegistryClientConfiguration.class);

    private ClientAndServer mockServer;
    private String registryHost;

    @Before
    public void setUp() {
        mockServer = startClientAndServer(0);
        registryHost = "localhost:" + mockServer.getPort();

        when(configuration.getDefaultRegistryHost()).thenReturn(registryHost);
        when(configuration.isSecure()).thenReturn(false);
        when(configuration.getRegistryTimeoutMs()).thenReturn(500);
        when(configuration.getRegistryRetryCount()).thenReturn(2);
        when(configuration.getRegistryRetryDelayMs()).thenReturn(5);
        when(configuration.getMaxTagPages()).thenReturn(10);
    }

    @After
    public void tearDown() {
        mockServer.stop();
    }

    @Test
    public void testGetImageDigest() {
        mockServer
                .when(HttpRequest.request()
                        .withMethod("HEAD")
                        .withPath("/v2/" + REPO + "/manifests/w_2021_13")
                )
                .respond(HttpResponse.response()
                        .withStatusCode(HttpResponseStatus.OK.code())
                        .withHeader(new Header("Docker-Content-Digest", DIGEST))
                );

        String digest = newClient(DockerCredentials.none()).getImageDigest(registryHost, REPO, "w_2021_13").timeout(TIMEOUT).block();
        assertThat(digest).isEqualTo(DIGEST);
    }

    @Test
    public void testMissingImage() {
        mockServer
                .when(HttpRequest.request().withPath("/v2/" + REPO + "/manifests/doesnotexist"))
                .respond(HttpResponse.response().withStatusCode(HttpResponseStatus.NOT_FOUND.code()));

        assertThatThrownBy(() -> newClient(DockerCredentials.none()).getImageDigest(registryHost, REPO, "doesnotexist").timeout(TIMEOUT).block())
                .isInstanceOf(RegistryException.class)
                .matches(e -> ((RegistryException) e).getErrorCode() == RegistryException.ErrorCode.IMAGE_NOT_FOUND);
    }

    @Test
    public void testMissingDigestHeader() {
        mockServer
                .when(HttpRequest.request().withPath("/v2/" + REPO + "/manifests/recommended"))
                .respond(HttpResponse.response().withStatusCode(HttpResponseStatus.OK.code()));

        assertThatThrownBy(() -> newClient(DockerCredentials.none()).getImageDigest(registryHost, REPO, "recommended").timeout(TIMEOUT).block())
                .isInstanceOf(RegistryException.class)
                .matches(e -> ((RegistryException) e).getErrorCode() == RegistryException.ErrorCode.MISSING_HEADER);
    }

    @Test
    public void testGetTagsFollowsPagination() {
        mockServer
                .when(HttpRequest.request()
                        .withMethod("GET")
                        .withPath("/v2/" + REPO + "/tags/list")
                        .withQueryStringParameter("last", "r22_0_1")
                )
                .respond(HttpResponse.response()
                        .withStatusCode(HttpResponseStatus.OK.code())
                        .withBody("{\"name\": \"" + REPO + "\", \"tags\": [\"w_2021_13\", \"d_2021_05_13\"]}")
                );
        mockServer
                .when(HttpRequest.request()
                        .withMethod("GET")
                        .withPath("/v2/" + REPO + "/tags/list")
                )
                .respond(HttpResponse.response()
                        .withStatusCode(HttpResponseStatus.OK.code())
                        .withHeader(new Header("Link", "</v2/" + REPO + "/tags/list?last=r22_0_1&n=2>; rel=\"next\""))
                        .withBody("{\"name\": \"" + REPO + "\", \"tags\": [\"recommended\", \"r22_0_1\"]}")
                );

        List<String> tags = newClient(DockerCredentials.none()).getTags(registryHost, REPO).timeout(TIMEOUT).block();
        assertThat(tags).containsExactly("recommended", "r22_0_1", "w_2021_13", "d_2021_05_13");
    }

    @Test
    public void testBearerTokenAuthentication() {
        mockServer
                .when(HttpRequest.request()
                        .withMethod("GET")
                        .withPath("/token")
                        .withQueryStringParameter("service", "registry.test")
                        .withQueryStringParameter("scope", "repository:" + REPO + ":pull")
                )
                .respond(HttpResponse.response()
                        .withStatusCode(HttpResponseStatus.OK.code())
                        .withBody("{\"token\": \"secret-token\"}")
                );
        mockServer
                .when(HttpRequest.request()
                        .withPath("/v2/" + REPO + "/tags/list")
                        .withHeader("Authorization", "Bearer secret-token")
                )
                .respond(HttpResponse.response()
                        .withStatusCode(HttpResponseStatus.OK.code())
                        .withBody("{\"tags\": [\"w_2021_13\"]}")
                );
        mockServer
                .when(HttpRequest.request().withPath("/v2/" + REPO + "/tags/list"))
                .respond(HttpResponse.response()
                        .withStatusCode(HttpResponseStatus.UNAUTHORIZED.code())
                        .withHeader(new Header("WWW-Authenticate", String.format(
                                "Bearer realm=\"http://%s/token\",service=\"registry.test\",scope=\"repository:%s:pull\"", registryHost, REPO
                        )))
                );

        RegistryClient client = newClient(DockerCredentials.none());
        assertThat(client.getTags(registryHost, REPO).timeout(TIMEOUT).block()).containsExactly("w_2021_13");

        // The token is cached, so the second call goes straight to the registry
        assertThat(client.getTags(registryHost, REPO).timeout(TIMEOUT).block()).containsExactly("w_2021_13");
        mockServer.verify(HttpRequest.request().withPath("/token"), VerificationTimes.exactly(1));
    }

    @Test
    public void testBasicAuthentication() {
        String auth = Base64.getEncoder().encodeToString("user:password".getBytes(StandardCharsets.UTF_8));
        mockServer
                .when(HttpRequest.request()
                        .withPath("/v2/" + REPO + "/manifests/r22_0_1")
                        .withHeader("Authorization", "Basic " + auth)
                )
                .respond(HttpResponse.response()
                        .withStatusCode(HttpResponseStatus.OK.code())
                        .withHeader(new Header("Docker-Content-Digest", DIGEST))
                );
        mockServer
                .when(HttpRequest.request().withPath("/v2/" + REPO + "/manifests/r22_0_1"))
                .respond(HttpResponse.response()
                        .withStatusCode(HttpResponseStatus.UNAUTHORIZED.code())
                        .withHeader(new Header("WWW-Authenticate", "Basic realm=\"registry\""))
                );

        RegistryClient client = newClient(new DockerCredentials(Collections.singletonMap(registryHost, auth)));
        assertThat(client.getImageDigest(registryHost, REPO, "r22_0_1").timeout(TIMEOUT).block()).isEqualTo(DIGEST);
    }

    @Test
    public void testBasicAuthenticationWithoutCredentials() {
        mockServer
                .when(HttpRequest.request().withPath("/v2/" + REPO + "/manifests/r22_0_1"))
                .respond(HttpResponse.response()
                        .withStatusCode(HttpResponseStatus.UNAUTHORIZED.code())
                        .withHeader(new Header("WWW-Authenticate", "Basic realm=\"registry\""))
                );

        assertThatThrownBy(() -> newClient(DockerCredentials.none()).getImageDigest(registryHost, REPO, "r22_0_1").timeout(TIMEOUT).block())
                .isInstanceOf(RegistryException.class)
                .matches(e -> ((RegistryException) e).getErrorCode() == RegistryException.ErrorCode.AUTHENTICATION_FAILED);
    }

    @Test
    public void testParseNextLink() {
        assertThat(DefaultDockerRegistryClient.TagPage.parseNextLink("</v2/a/b/tags/list?last=x&n=100>; rel=\"next\""))
                .contains("/v2/a/b/tags/list?last=x&n=100");
        assertThat(DefaultDockerRegistryClient.TagPage.parseNextLink("<https://registry.example.com/v2/a/tags/list?last=y>; rel=\"next\""))
                .contains("/v2/a/tags/list?last=y");
        assertThat(DefaultDockerRegistryClient.TagPage.parseNextLink(null)).isEmpty();
    }

    @Test
    public void testParseChallengeParams() {
        assertThat(DefaultDockerRegistryClient.parseChallengeParams(
                "realm=\"https://auth.docker.io/token\",service=\"registry.docker.io\",scope=\"repository:lsstsqre/sciplat-lab:pull\""
        ))
                .containsEntry("realm", "https://auth.docker.io/token")
                .containsEntry("service", "registry.docker.io")
                .containsEntry("scope", "repository:lsstsqre/sciplat-lab:pull");
    }

    @Test
    public void testMetricOperationNames() {
        assertThat(DefaultDockerRegistryClient.toOperation("v2/lsstsqre/sciplat-lab/manifests/w_2021_13")).isEqualTo("manifests");
        assertThat(DefaultDockerRegistryClient.toOperation("v2/lsstsqre/sciplat-lab/tags/list")).isEqualTo("tags");
        assertThat(DefaultDockerRegistryClient.toOperation("token")).isEqualTo("auth");
    }

    private RegistryClient newClient(DockerCredentials credentials) {
        return new DefaultDockerRegistryClient(configuration, credentials, runtime);
    }
}
