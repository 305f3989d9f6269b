package com.fhestream.ingestion.rpc;

import reactor.core.publisher.Mono;

/**
 * Solana JSON-RPC transport. Returns the raw response body; retries are handled by RateLimitedRpcExecutor.
 */
public interface SolanaRpcClient {

    Mono<String> call(String endpointUrl, String method, Object params);
}
