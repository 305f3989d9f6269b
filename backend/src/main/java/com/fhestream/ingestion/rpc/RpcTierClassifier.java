package com.fhestream.ingestion.rpc;

import java.util.List;
import java.util.Locale;

/**
 * Classifies an RPC endpoint URL into a tier. Unknown providers get the public (most conservative) tier.
 */
public final class RpcTierClassifier {

    private static final List<String> LOCAL_MARKERS = List.of("127.0.0.1", "localhost");
    private static final List<String> PUBLIC_HOSTS = List.of(
            "api.devnet.solana.com", "api.mainnet-beta.solana.com", "api.testnet.solana.com");
    private static final List<String> PRIVATE_PROVIDERS = List.of(
            "helius", "quicknode", "alchemy", "triton", "genesysgo", "rpcpool");

    private RpcTierClassifier() {
    }

    public static RpcTier classify(String endpoint) {
        String url = endpoint == null ? "" : endpoint.toLowerCase(Locale.ROOT);
        if (LOCAL_MARKERS.stream().anyMatch(url::contains)) {
            return RpcTier.LOCAL;
        }
        if (PUBLIC_HOSTS.stream().anyMatch(url::contains)) {
            return RpcTier.PUBLIC;
        }
        if (PRIVATE_PROVIDERS.stream().anyMatch(url::contains)) {
            return RpcTier.PRIVATE;
        }
        return RpcTier.PUBLIC;
    }

    /**
     * Tier defaults for the endpoint with configured overrides applied; a null or non-positive override is ignored.
     */
    public static RpcTierPolicy policyFor(String endpoint, Long pollIntervalOverrideMs, Integer maxPagesOverride) {
        RpcTierPolicy policy = RpcTierPolicy.defaultsFor(classify(endpoint));
        if (pollIntervalOverrideMs != null && pollIntervalOverrideMs > 0) {
            policy = policy.withPollIntervalMs(pollIntervalOverrideMs);
        }
        if (maxPagesOverride != null && maxPagesOverride > 0) {
            policy = policy.withMaxPagesPerCycle(maxPagesOverride);
        }
        return policy;
    }
}
