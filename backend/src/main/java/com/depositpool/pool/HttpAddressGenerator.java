package com.depositpool.pool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.depositpool.pool.config.GeneratorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;

/**
 * Calls the wallet service: {@code POST {base-url}/addresses?count=n}. Accepts either a JSON array of addresses
 * or an object with an {@code addresses} array.
 */
@Slf4j
public class HttpAddressGenerator implements AddressGenerator {

    private final WebClient webClient;
    private final GeneratorProperties properties;
    private final ObjectMapper objectMapper;

    public HttpAddressGenerator(WebClient.Builder builder, GeneratorProperties properties, ObjectMapper objectMapper) {
        this.webClient = builder.baseUrl(properties.getBaseUrl()).build();
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<String> generate(int count) {
        if (count <= 0) {
            return List.of();
        }
        String json;
        try {
            json = webClient.post()
                    .uri(uriBuilder -> uriBuilder.path("/addresses").queryParam("count", count).build())
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(properties.getTimeout())
                    .block();
        } catch (Exception e) {
            throw new AddressGenerationException("Address generator call failed: " + e.getMessage(), e);
        }
        if (json == null) {
            throw new AddressGenerationException("Address generator returned empty body");
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            JsonNode list = root.isArray() ? root : root.path("addresses");
            if (!list.isArray()) {
                throw new AddressGenerationException("Address generator response has no addresses array");
            }
            List<String> addresses = new ArrayList<>();
            for (JsonNode node : list) {
                if (node.isTextual()) {
                    addresses.add(node.asText());
                }
            }
            log.debug("Address generator returned {} of {} requested", addresses.size(), count);
            return addresses;
        } catch (AddressGenerationException e) {
            throw e;
        } catch (Exception e) {
            throw new AddressGenerationException("Failed to parse address generator response", e);
        }
    }
}
