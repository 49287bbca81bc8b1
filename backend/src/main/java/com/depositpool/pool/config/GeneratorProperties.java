package com.depositpool.pool.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Wallet service used to mint new pool addresses.
 */
@ConfigurationProperties(prefix = "depositpool.generator")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class GeneratorProperties {

    @NotBlank
    private String baseUrl;

    @NotNull
    private Duration timeout;
}
