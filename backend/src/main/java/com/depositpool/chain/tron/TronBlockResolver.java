package com.depositpool.chain.tron;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.depositpool.chain.ChainUnavailableException;
import com.depositpool.config.CaffeineConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Chain head and per-transaction block lookups. Head is cached for a few seconds so one monitor cycle shares it;
 * a mined transaction's block number is cached for a day. Unmined transactions are not cached.
 */
@Component
@RequiredArgsConstructor
public class TronBlockResolver {

    static final String NOW_BLOCK_PATH = "/wallet/getnowblock";
    static final String TX_INFO_PATH = "/wallet/gettransactioninfobyid";

    private final TronGridHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Cacheable(cacheNames = CaffeineConfig.CHAIN_HEAD_CACHE, key = "'head'")
    public long headBlock() {
        JsonNode root = readTree(httpClient.post(NOW_BLOCK_PATH, Map.of()).block(), NOW_BLOCK_PATH);
        JsonNode number = root.path("block_header").path("raw_data").path("number");
        if (!number.canConvertToLong()) {
            throw new ChainUnavailableException("getnowblock returned no block number");
        }
        return number.asLong();
    }

    /**
     * @return block number of a mined transaction, or null while it is unconfirmed or unknown
     */
    @Cacheable(cacheNames = CaffeineConfig.TX_BLOCK_CACHE, key = "#txId", unless = "#result == null")
    public Long blockOf(String txId) {
        JsonNode root = readTree(httpClient.post(TX_INFO_PATH, Map.of("value", txId)).block(), TX_INFO_PATH);
        JsonNode blockNumber = root.path("blockNumber");
        return blockNumber.canConvertToLong() ? blockNumber.asLong() : null;
    }

    private JsonNode readTree(String json, String path) {
        if (json == null) {
            throw new ChainUnavailableException(path + " returned empty body");
        }
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            throw new ChainUnavailableException("Failed to parse " + path + " response", e);
        }
    }
}
