package com.depositpool.chain.tron;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.depositpool.chain.ChainClient;
import com.depositpool.chain.ChainTransactionObservation;
import com.depositpool.chain.ChainUnavailableException;
import com.depositpool.chain.config.ChainProperties;
import com.depositpool.common.TronAddressCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * TRON adapter over TronGrid v1. Reads incoming TRC-20 transfers for every configured token contract and incoming
 * native TRX transfers, then derives confirmations from the chain head.
 * <p>
 * TRC-20 listings carry no block number, so each transfer's block is resolved via gettransactioninfobyid
 * (cached once mined). Transfers without a block are reported with 0 confirmations.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TronGridChainClient implements ChainClient {

    static final String TRC20_PATH = "/v1/accounts/%s/transactions/trc20";
    static final String NATIVE_PATH = "/v1/accounts/%s/transactions";
    static final String TRANSFER_CONTRACT = "TransferContract";
    static final String SUCCESS = "SUCCESS";

    private final TronGridHttpClient httpClient;
    private final TronBlockResolver blockResolver;
    private final ChainProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public List<ChainTransactionObservation> fetchTransactions(String address, Long sinceBlockHeight) {
        long head = blockResolver.headBlock();
        List<ChainTransactionObservation> result = new ArrayList<>();
        for (Map.Entry<String, ChainProperties.AssetEntry> asset : properties.getAssets().entrySet()) {
            List<ChainTransactionObservation> observed = asset.getValue().isNative()
                    ? fetchNative(address, asset.getKey(), asset.getValue(), head)
                    : fetchTrc20(address, asset.getKey(), asset.getValue(), head);
            for (ChainTransactionObservation o : observed) {
                if (sinceBlockHeight != null && o.blockHeight() != null && o.blockHeight() < sinceBlockHeight) {
                    continue;
                }
                result.add(o);
            }
        }
        log.debug("Fetched {} incoming transfers for {} (since block {}, head {})",
                result.size(), address, sinceBlockHeight, head);
        return result;
    }

    private List<ChainTransactionObservation> fetchTrc20(String address, String symbol,
                                                         ChainProperties.AssetEntry asset, long head) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("only_to", true);
        params.put("limit", properties.getPageSize());
        params.put("contract_address", asset.getContract());
        String path = String.format(TRC20_PATH, address);
        JsonNode data = dataOf(httpClient.get(path, params).block(), path);

        List<ChainTransactionObservation> out = new ArrayList<>();
        for (JsonNode tx : data) {
            if (!"Transfer".equals(tx.path("type").asText())) {
                continue;
            }
            String to = tx.path("to").asText(null);
            if (!address.equals(to)) {
                continue;
            }
            String contract = tx.path("token_info").path("address").asText(null);
            if (contract != null && !contract.equals(asset.getContract())) {
                continue;
            }
            String txId = tx.path("transaction_id").asText(null);
            BigDecimal amount = scaled(tx.path("value").asText(null), asset.getDecimals());
            if (txId == null || amount == null) {
                log.warn("Skipping malformed TRC-20 entry for {}: {}", address, tx);
                continue;
            }
            Long block = blockResolver.blockOf(txId);
            out.add(new ChainTransactionObservation(txId, to, symbol, amount, block,
                    confirmations(head, block), timestampOf(tx)));
        }
        return out;
    }

    private List<ChainTransactionObservation> fetchNative(String address, String symbol,
                                                          ChainProperties.AssetEntry asset, long head) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("only_to", true);
        params.put("limit", properties.getPageSize());
        String path = String.format(NATIVE_PATH, address);
        JsonNode data = dataOf(httpClient.get(path, params).block(), path);

        List<ChainTransactionObservation> out = new ArrayList<>();
        for (JsonNode tx : data) {
            JsonNode contract = tx.path("raw_data").path("contract").path(0);
            if (!TRANSFER_CONTRACT.equals(contract.path("type").asText())) {
                continue;
            }
            JsonNode ret = tx.path("ret").path(0).path("contractRet");
            if (!ret.isMissingNode() && !SUCCESS.equals(ret.asText())) {
                continue;
            }
            JsonNode value = contract.path("parameter").path("value");
            String to = toBase58(value.path("to_address").asText(null));
            if (!address.equals(to)) {
                continue;
            }
            String txId = tx.path("txID").asText(null);
            BigDecimal amount = scaled(value.path("amount").asText(null), asset.getDecimals());
            if (txId == null || amount == null) {
                log.warn("Skipping malformed TRX entry for {}: {}", address, tx);
                continue;
            }
            JsonNode blockNode = tx.path("blockNumber");
            Long block = blockNode.canConvertToLong() ? blockNode.asLong() : null;
            out.add(new ChainTransactionObservation(txId, to, symbol, amount, block,
                    confirmations(head, block), timestampOf(tx)));
        }
        return out;
    }

    private JsonNode dataOf(String json, String path) {
        if (json == null) {
            throw new ChainUnavailableException(path + " returned empty body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new ChainUnavailableException("Failed to parse " + path + " response", e);
        }
        if (root.has("success") && !root.path("success").asBoolean()) {
            throw new ChainUnavailableException("TronGrid reported failure on " + path + ": "
                    + root.path("error").asText(""));
        }
        JsonNode data = root.path("data");
        if (!data.isArray()) {
            throw new ChainUnavailableException(path + " response has no data array");
        }
        return data;
    }

    static long confirmations(long head, Long block) {
        if (block == null) {
            return 0;
        }
        return Math.max(1, head - block + 1);
    }

    private static BigDecimal scaled(String raw, int decimals) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(raw).movePointLeft(decimals);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Instant timestampOf(JsonNode tx) {
        JsonNode ts = tx.path("block_timestamp");
        return ts.canConvertToLong() ? Instant.ofEpochMilli(ts.asLong()) : null;
    }

    private static String toBase58(String hex) {
        if (hex == null) {
            return null;
        }
        try {
            return TronAddressCodec.hexToBase58(hex);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
