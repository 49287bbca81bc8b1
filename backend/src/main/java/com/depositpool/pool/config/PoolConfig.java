package com.depositpool.pool.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.depositpool.pool.AddressGenerator;
import com.depositpool.pool.HttpAddressGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties({PoolProperties.class, GeneratorProperties.class})
public class PoolConfig {

    @Bean
    @ConditionalOnMissingBean(AddressGenerator.class)
    public AddressGenerator addressGenerator(WebClient.Builder webClientBuilder,
                                             GeneratorProperties properties,
                                             ObjectMapper objectMapper) {
        return new HttpAddressGenerator(webClientBuilder, properties, objectMapper);
    }
}
