package com.depositpool.chain.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * TronGrid provider settings. Every value comes from application.yml / environment; nothing is defaulted here.
 */
@ConfigurationProperties(prefix = "depositpool.chain")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ChainProperties {

    @NotBlank
    private String baseUrl;

    /** Sent as TRON-PRO-API-KEY when non-blank. */
    private String apiKey;

    @NotNull
    private Duration requestTimeout;

    /** Local request budget for this instance. */
    @Min(1)
    private int maxRequestsPerSecond;

    /** How long a call may wait for a local limiter permit before failing as unavailable. */
    @NotNull
    private Duration limiterTimeout;

    /** Hint used for HTTP 429 responses without a parseable Retry-After header. */
    @NotNull
    private Duration defaultRetryAfter;

    @Min(1)
    @Max(200)
    private int pageSize;

    /**
     * Accepted assets keyed by symbol (e.g. USDT, TRX). A blank contract means the native coin.
     */
    @NotEmpty
    @Valid
    private Map<String, AssetEntry> assets = new LinkedHashMap<>();

    @NotNull
    @Valid
    private RetryEntry retry;

    public void setAssets(Map<String, AssetEntry> assets) {
        this.assets = assets != null ? assets : new LinkedHashMap<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class AssetEntry {

        /** TRC-20 contract address; blank for native TRX. */
        private String contract;

        @Min(0)
        private int decimals;

        public boolean isNative() {
            return contract == null || contract.isBlank();
        }
    }

    /**
     * Caller-side retry for ChainUnavailableException (exponential backoff ± jitter).
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class RetryEntry {

        @NotNull
        private Duration baseDelay;

        @NotNull
        private Duration maxDelay;

        /** 0..1, e.g. 0.2 = ±20%. */
        private double jitterFactor;

        @Min(1)
        private int maxAttempts;
    }
}
