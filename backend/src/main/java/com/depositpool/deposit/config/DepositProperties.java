package com.depositpool.deposit.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Accepted deposit amount range (inclusive), in units of the requested asset.
 */
@ConfigurationProperties(prefix = "depositpool.deposit")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class DepositProperties {

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal minAmount;

    @NotNull
    private BigDecimal maxAmount;

    @AssertTrue(message = "max-amount must not be lower than min-amount")
    public boolean isRangeValid() {
        return minAmount == null || maxAmount == null || maxAmount.compareTo(minAmount) >= 0;
    }
}
