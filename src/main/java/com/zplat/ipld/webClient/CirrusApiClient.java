package com.zplat.ipld.webClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zplat.ipld.common.Constants;
import com.zplat.ipld.exception.AppException;
import com.zplat.ipld.exception.ErrorCode;
import lombok.AccessLevel;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

/**
 * Network-policy API. Requests carry a bearer token obtained with the basic api key and
 * cached until {@code cirrus.token-ttl-minutes} elapse.
 */
@Component
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class CirrusApiClient {

    WebClient webClient;
    ObjectMapper om = new ObjectMapper();
    String tokenPath;
    String apiKey;
    Duration tokenTtl;
    Duration callTimeout = Duration.ofSeconds(10);

    static final class TokenCache {
        volatile String token;
        volatile Instant expiry = Instant.EPOCH;
    }

    TokenCache tokenCache = new TokenCache();

    public CirrusApiClient(WebClient.Builder builder,
                           @Value("${cirrus.api-url}") String apiUrl,
                           @Value("${cirrus.api-version:v1}") String apiVersion,
                           @Value("${cirrus.endpoint-token:identity/token}") String tokenEndpoint,
                           @Value("${cirrus.user}") String user,
                           @Value("${cirrus.password}") String password,
                           @Value("${cirrus.token-ttl-minutes:30}") long tokenTtlMinutes) {
        this.webClient = builder.baseUrl(apiUrl).build();
        this.tokenPath = "/" + apiVersion + "/" + tokenEndpoint;
        this.apiKey = Base64.getEncoder()
                .encodeToString((user + ":" + password).getBytes(StandardCharsets.UTF_8));
        this.tokenTtl = Duration.ofMinutes(tokenTtlMinutes);
    }

    /** Calls {@code endpoint} relative to {@code cirrus.api-url} and returns the raw body. */
    public String callApi(HttpMethod method, String endpoint, Object requestBody) {
        WebClient.RequestBodySpec spec = webClient
                .method(method)
                .uri(endpoint)
                .headers(h -> {
                    h.setContentType(MediaType.APPLICATION_JSON);
                    h.setBearerAuth(getValidToken());
                });

        WebClient.ResponseSpec response = (method == HttpMethod.GET || requestBody == null)
                ? spec.retrieve()
                : spec.bodyValue(requestBody).retrieve();

        try {
            String result = response
                    .onStatus(HttpStatusCode::isError, res -> res.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(err -> Mono.error(new AppException(ErrorCode.NETWORK_POLICY_ERROR,
                                    method + " " + endpoint + " -> " + res.statusCode() + " " + err))))
                    .bodyToMono(String.class)
                    .block(callTimeout);
            log.info("Cirrus [{} {}] success", method, endpoint);
            return result;
        } catch (AppException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Cirrus call failed [{} {}]: {}", method, endpoint, e.getMessage());
            throw new AppException(ErrorCode.NETWORK_POLICY_ERROR, endpoint, e);
        }
    }

    private String getValidToken() {
        Instant now = Instant.now();
        if (tokenCache.token == null || now.isAfter(tokenCache.expiry)) {
            synchronized (tokenCache) {
                if (tokenCache.token == null || now.isAfter(tokenCache.expiry)) {
                    log.info("Cirrus token expired or not found. Requesting new token...");
                    tokenCache.token = fetchToken();
                    tokenCache.expiry = now.plus(tokenTtl);
                }
            }
        }
        return tokenCache.token;
    }

    private String fetchToken() {
        String body = webClient.post()
                .uri(tokenPath)
                .header(Constants.CIRRUS.HEADER_API_KEY, apiKey)
                .retrieve()
                .onStatus(HttpStatusCode::isError, res -> res.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(err -> Mono.error(new AppException(ErrorCode.NETWORK_POLICY_ERROR,
                                "token request -> " + res.statusCode() + " " + err))))
                .bodyToMono(String.class)
                .block(callTimeout);
        try {
            JsonNode node = om.readTree(body);
            String token = node.path("access_token").asText(null);
            if (token == null || token.isBlank()) {
                throw new AppException(ErrorCode.NETWORK_POLICY_ERROR, "token response has no access_token");
            }
            return token;
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new AppException(ErrorCode.NETWORK_POLICY_ERROR, "bad token response", e);
        }
    }
}
