package com.depositpool.monitor.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Deposit monitoring settings. Every value is required; start-up fails on a missing or invalid one.
 */
@ConfigurationProperties(prefix = "depositpool.monitor")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class MonitorProperties {

    /** Confirmations every credited transfer needs before the deposit is CONFIRMED. */
    @Min(1)
    private int confirmationThreshold;

    /** Deposit lifetime from creation. */
    @NotNull
    private Duration expiry;

    @NotNull
    private Duration pollInterval;

    /** Upper bound for one deposit's poll, retries included. */
    @NotNull
    private Duration perAddressTimeout;

    @Min(1)
    private int workerThreads;

    @Min(1)
    private int shardCount;

    @Min(0)
    private int shardIndex;

    /** Received amount may fall short of the requested amount by at most this much. */
    @NotNull
    @DecimalMin("0")
    private BigDecimal amountTolerance;

    @AssertTrue(message = "shard-index must be lower than shard-count")
    public boolean isShardIndexInRange() {
        return shardIndex < shardCount;
    }

    /** True when this instance's shard is responsible for the address. */
    public boolean owns(String address) {
        return address != null && Math.floorMod(address.hashCode(), shardCount) == shardIndex;
    }
}
