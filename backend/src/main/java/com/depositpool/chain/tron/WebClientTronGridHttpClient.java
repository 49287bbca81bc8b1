package com.depositpool.chain.tron;

import com.depositpool.chain.ChainUnavailableException;
import com.depositpool.chain.config.ChainProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;

/**
 * TronGrid client on WebClient. Each request takes a permit from the shared local rate limiter, is bounded by
 * the configured request timeout, and maps every error to ChainUnavailableException (429 carries Retry-After).
 */
@Slf4j
public class WebClientTronGridHttpClient implements TronGridHttpClient {

    static final String API_KEY_HEADER = "TRON-PRO-API-KEY";

    private final WebClient webClient;
    private final RateLimiter rateLimiter;
    private final Duration requestTimeout;
    private final Duration defaultRetryAfter;

    public WebClientTronGridHttpClient(WebClient.Builder builder, ChainProperties properties, RateLimiter rateLimiter) {
        WebClient.Builder configured = builder.baseUrl(properties.getBaseUrl());
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            configured = configured.defaultHeader(API_KEY_HEADER, properties.getApiKey());
        }
        this.webClient = configured.build();
        this.rateLimiter = rateLimiter;
        this.requestTimeout = properties.getRequestTimeout();
        this.defaultRetryAfter = properties.getDefaultRetryAfter();
    }

    @Override
    public Mono<String> get(String path, Map<String, Object> queryParams) {
        return limited(() -> webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path(path);
                    if (queryParams != null) {
                        queryParams.forEach((name, value) -> {
                            if (value != null) {
                                uriBuilder.queryParam(name, value);
                            }
                        });
                    }
                    return uriBuilder.build();
                })
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class), path);
    }

    @Override
    public Mono<String> post(String path, Object body) {
        return limited(() -> webClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body != null ? body : Map.of())
                .retrieve()
                .bodyToMono(String.class), path);
    }

    private Mono<String> limited(Supplier<Mono<String>> request, String path) {
        return Mono.defer(() -> {
                    if (!rateLimiter.acquirePermission()) {
                        return Mono.error(new ChainUnavailableException(
                                "TronGrid local rate limit exceeded for " + path));
                    }
                    return request.get();
                })
                .timeout(requestTimeout)
                .onErrorMap(e -> mapError(e, path));
    }

    private Throwable mapError(Throwable e, String path) {
        if (e instanceof ChainUnavailableException) {
            return e;
        }
        if (e instanceof WebClientResponseException wre) {
            if (wre.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                Duration retryAfter = parseRetryAfter(wre.getHeaders());
                log.warn("TronGrid rate limited on {}; retry after {}", path, retryAfter);
                return new ChainUnavailableException("TronGrid rate limited on " + path, retryAfter, wre);
            }
            return new ChainUnavailableException(
                    "TronGrid HTTP " + wre.getStatusCode().value() + " on " + path, wre);
        }
        return new ChainUnavailableException("TronGrid request failed on " + path + ": " + e.getMessage(), e);
    }

    Duration parseRetryAfter(HttpHeaders headers) {
        String value = headers != null ? headers.getFirst(HttpHeaders.RETRY_AFTER) : null;
        if (value == null || value.isBlank()) {
            return defaultRetryAfter;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : defaultRetryAfter;
        } catch (NumberFormatException e) {
            // HTTP-date form is not used by TronGrid
            return defaultRetryAfter;
        }
    }
}
