package com.depositpool.chain.config;

import com.depositpool.chain.tron.TronGridHttpClient;
import com.depositpool.chain.tron.WebClientTronGridHttpClient;
import com.depositpool.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the TronGrid HTTP client with its local rate limiter and the caller-side retry policy.
 */
@Configuration
@EnableConfigurationProperties(ChainProperties.class)
public class ChainClientConfig {

    public static final String TRONGRID_RATE_LIMITER = "tronGridRateLimiter";

    @Bean(name = TRONGRID_RATE_LIMITER)
    public RateLimiter tronGridRateLimiter(ChainProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .timeoutDuration(properties.getLimiterTimeout())
                .build();
        return RateLimiter.of("trongrid", config);
    }

    @Bean
    public TronGridHttpClient tronGridHttpClient(WebClient.Builder webClientBuilder,
                                                 ChainProperties properties,
                                                 @Qualifier(TRONGRID_RATE_LIMITER) RateLimiter rateLimiter) {
        return new WebClientTronGridHttpClient(webClientBuilder, properties, rateLimiter);
    }

    @Bean
    public RetryPolicy chainRetryPolicy(ChainProperties properties) {
        ChainProperties.RetryEntry retry = properties.getRetry();
        return new RetryPolicy(
                retry.getBaseDelay().toMillis(),
                retry.getMaxDelay().toMillis(),
                retry.getJitterFactor(),
                retry.getMaxAttempts());
    }
}
