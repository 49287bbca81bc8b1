package com.depositpool.chain.tron;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Raw TronGrid HTTP access, kept behind an interface so the adapter can be tested without a network.
 * Every failure surfaces as {@link com.depositpool.chain.ChainUnavailableException}.
 */
public interface TronGridHttpClient {

    /**
     * GET {@code path} relative to the configured base URL.
     *
     * @param queryParams appended as query parameters; null values are skipped
     * @return response body (JSON)
     */
    Mono<String> get(String path, Map<String, Object> queryParams);

    /**
     * POST a JSON body to {@code path} relative to the configured base URL.
     *
     * @return response body (JSON)
     */
    Mono<String> post(String path, Object body);
}
