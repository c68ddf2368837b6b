package com.brandmetrics.backend.client;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Minimal client for the Upstash Redis REST API.
 * Responses look like {@code {"result": ...}} or {@code {"error": "..."}}.
 */
@Component
@ConditionalOnProperty(name = "refresher.cache.backend", havingValue = "upstash-rest")
public class UpstashRestClient {

        private static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE = new ParameterizedTypeReference<>() {
        };

        private final WebClient webClient;
        private final Duration timeout;

        public UpstashRestClient(WebClient.Builder webClientBuilder,
                        @Value("${refresher.cache.upstash.rest-url}") String restUrl,
                        @Value("${refresher.cache.upstash.token}") String token,
                        @Value("${refresher.cache.upstash.timeout-seconds:10}") long timeoutSeconds) {
                if (restUrl == null || restUrl.isBlank() || token == null || token.isBlank()) {
                        throw new IllegalStateException(
                                        "UPSTASH_REDIS_REST_URL and UPSTASH_REDIS_REST_TOKEN are required for the upstash-rest cache backend");
                }
                this.timeout = Duration.ofSeconds(timeoutSeconds);
                this.webClient = webClientBuilder
                                .baseUrl(stripTrailingSlash(restUrl))
                                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                                .build();
        }

        public String get(String key) {
                Map<String, Object> response = webClient.get()
                                .uri(uriBuilder -> uriBuilder
                                                .path("/get/{key}")
                                                .build(key))
                                .retrieve()
                                .bodyToMono(RESPONSE_TYPE)
                                .timeout(timeout)
                                .block();
                Object result = checked(response, "GET", key).get("result");
                return result != null ? result.toString() : null;
        }

        public void set(String key, String value, long ttlSeconds) {
                Map<String, Object> response = webClient.post()
                                .uri(uriBuilder -> {
                                        uriBuilder.path("/set/{key}");
                                        if (ttlSeconds > 0) {
                                                uriBuilder.queryParam("EX", ttlSeconds);
                                        }
                                        return uriBuilder.build(key);
                                })
                                .contentType(MediaType.TEXT_PLAIN)
                                .bodyValue(value)
                                .retrieve()
                                .bodyToMono(RESPONSE_TYPE)
                                .timeout(timeout)
                                .block();
                Object result = checked(response, "SET", key).get("result");
                if (!"OK".equals(result)) {
                        throw new IllegalStateException("Upstash SET " + key + " was not acknowledged: " + result);
                }
        }

        private static Map<String, Object> checked(Map<String, Object> response, String command, String key) {
                if (response == null) {
                        throw new IllegalStateException("Empty Upstash response for " + command + " " + key);
                }
                if (response.get("error") != null) {
                        throw new IllegalStateException(
                                        "Upstash " + command + " " + key + " failed: " + response.get("error"));
                }
                return response;
        }

        private static String stripTrailingSlash(String url) {
                String trimmed = url.trim();
                return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }
}
