package com.fhestream.ingestion.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The three RPC reads the indexer needs (getSlot, getSignaturesForAddress, getTransaction), each run through
 * the rate-limited executor against a single endpoint.
 */
@Slf4j
public class SolanaProgramRpc {

    /** Max signatures per getSignaturesForAddress call (Solana RPC limit 1–1000). */
    public static final int MAX_SIGNATURES_LIMIT = 1000;

    private final SolanaRpcClient rpcClient;
    private final RateLimitedRpcExecutor executor;
    private final ObjectMapper objectMapper;
    private final String endpoint;
    private final String commitment;

    public SolanaProgramRpc(SolanaRpcClient rpcClient, RateLimitedRpcExecutor executor, ObjectMapper objectMapper,
                            String endpoint, String commitment) {
        this.rpcClient = rpcClient;
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
        this.commitment = commitment;
    }

    public long getSlot() {
        return executor.execute("getSlot", () -> {
            JsonNode result = call("getSlot", List.of(Map.of("commitment", commitment)));
            if (!result.canConvertToLong()) {
                throw new RpcException("getSlot returned " + result);
            }
            return result.asLong();
        });
    }

    /** Newest first, as returned by the node. */
    public List<SignatureInfo> getSignaturesPage(String address, String before, int limit) {
        Map<String, Object> config = new HashMap<>();
        config.put("limit", Math.min(Math.max(1, limit), MAX_SIGNATURES_LIMIT));
        config.put("commitment", commitment);
        if (before != null) {
            config.put("before", before);
        }
        return executor.execute("getSignaturesForAddress", () -> {
            JsonNode result = call("getSignaturesForAddress", List.of(address, config));
            List<SignatureInfo> page = new ArrayList<>();
            if (!result.isArray()) {
                return page;
            }
            for (JsonNode info : result) {
                JsonNode blockTime = info.path("blockTime");
                JsonNode err = info.path("err");
                page.add(new SignatureInfo(
                        info.path("signature").asText(),
                        info.path("slot").asLong(),
                        blockTime.isNumber() ? blockTime.asLong() : null,
                        !err.isMissingNode() && !err.isNull()));
            }
            return page;
        });
    }

    /** Empty when the node does not know the transaction (yet). */
    public Optional<FetchedTransaction> getTransaction(String signature) {
        Map<String, Object> config = Map.of(
                "encoding", "json",
                "commitment", commitment,
                "maxSupportedTransactionVersion", 0);
        return executor.execute("getTransaction", () -> {
            JsonNode result = call("getTransaction", List.of(signature, config));
            if (result.isMissingNode() || result.isNull()) {
                return Optional.empty();
            }
            List<String> logs = null;
            JsonNode logMessages = result.path("meta").path("logMessages");
            if (logMessages.isArray()) {
                logs = new ArrayList<>();
                for (JsonNode line : logMessages) {
                    logs.add(line.asText());
                }
            }
            JsonNode blockTime = result.path("blockTime");
            return Optional.of(new FetchedTransaction(
                    signature,
                    result.path("slot").asLong(),
                    blockTime.isNumber() ? blockTime.asLong() : null,
                    logs,
                    firstAccountKey(result.path("transaction").path("message").path("accountKeys"))));
        });
    }

    public String getEndpoint() {
        return endpoint;
    }

    private JsonNode call(String method, Object params) {
        String json = rpcClient.call(endpoint, method, params).block();
        if (json == null) {
            throw new RpcException(method + " returned an empty body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException(method + " returned invalid JSON", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            Integer code = error.path("code").isInt() ? error.path("code").asInt() : null;
            throw new RpcException(method + " error: " + error, code, null);
        }
        return root.path("result");
    }

    private static String firstAccountKey(JsonNode accountKeys) {
        if (!accountKeys.isArray() || accountKeys.isEmpty()) {
            return null;
        }
        JsonNode first = accountKeys.get(0);
        if (first.isTextual()) {
            return first.asText();
        }
        JsonNode pubkey = first.path("pubkey");
        return pubkey.isTextual() ? pubkey.asText() : null;
    }
}
