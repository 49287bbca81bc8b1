package com.depositpool.pool.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Address pool sizing and cooldown. No defaults; values are required in application.yml.
 */
@ConfigurationProperties(prefix = "depositpool.pool")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class PoolProperties {

    /** Replenish tops AVAILABLE up to this count. */
    @Min(1)
    private int minSize;

    /** Pool health is WARNING at or below this many AVAILABLE addresses. */
    @Min(0)
    private int lowWaterMark;

    /** Quarantine after confirmation or expiry before an address is reusable. */
    @NotNull
    private Duration cooldown;

    /** How long an ASSIGNED address may exist without a persisted deposit before it is reclaimed. */
    @NotNull
    private Duration orphanGrace;

    @NotNull
    private Duration replenishInterval;
}
