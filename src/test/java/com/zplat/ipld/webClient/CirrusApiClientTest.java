package com.zplat.ipld.webClient;

import com.zplat.ipld.exception.AppException;
import com.zplat.ipld.exception.ErrorCode;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CirrusApiClientTest {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    private CirrusApiClient client(HttpStatus policyStatus) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            if (request.url().getPath().endsWith("/identity/token")) {
                return Mono.just(json(HttpStatus.OK, "{\"access_token\":\"tok-1\"}"));
            }
            return Mono.just(json(policyStatus, "{\"egress\":[]}"));
        });
        return new CirrusApiClient(builder, "http://cirrus.local", "v1", "identity/token", "svc", "secret", 30);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body(body)
                .build();
    }

    @Test
    void fetchesTokenOnceAndSendsItAsBearer() {
        CirrusApiClient cirrus = client(HttpStatus.OK);

        assertThat(cirrus.callApi(HttpMethod.GET, "/v1/proj/clu", null)).isEqualTo("{\"egress\":[]}");
        cirrus.callApi(HttpMethod.GET, "/v1/proj/clu", null);

        assertThat(requests).hasSize(3);
        ClientRequest token = requests.get(0);
        assertThat(token.method()).isEqualTo(HttpMethod.POST);
        assertThat(token.headers().getFirst("x-api-key")).isEqualTo(
                Base64.getEncoder().encodeToString("svc:secret".getBytes(StandardCharsets.UTF_8)));
        assertThat(requests.subList(1, 3)).allSatisfy(r -> {
            assertThat(r.url().getPath()).isEqualTo("/v1/proj/clu");
            assertThat(r.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer tok-1");
        });
    }

    @Test
    void errorStatusBecomesNetworkPolicyError() {
        CirrusApiClient cirrus = client(HttpStatus.FORBIDDEN);

        assertThatThrownBy(() -> cirrus.callApi(HttpMethod.GET, "/v1/proj/clu", null))
                .isInstanceOfSatisfying(AppException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.NETWORK_POLICY_ERROR))
                .hasMessageContaining("403");
    }
}
