package com.fhestream.ingestion.rpc;

/**
 * Polling and backoff limits for one RPC tier. Computed once when the indexer is built.
 *
 * @param pollIntervalMs             delay between polling cycles
 * @param maxPagesPerCycle           signature pages fetched per cycle before deferring the rest
 * @param interRequestDelayMs        minimum spacing between RPC requests
 * @param rateLimitBackoffMultiplier factor applied to the poll interval per consecutive rate-limit error
 * @param maxRetries                 retries after the first attempt of one RPC call
 */
public record RpcTierPolicy(RpcTier tier, long pollIntervalMs, int maxPagesPerCycle, long interRequestDelayMs,
                            int rateLimitBackoffMultiplier, int maxRetries) {

    public static final RpcTierPolicy LOCAL = new RpcTierPolicy(RpcTier.LOCAL, 500, 10, 0, 2, 3);
    public static final RpcTierPolicy PUBLIC = new RpcTierPolicy(RpcTier.PUBLIC, 3000, 3, 200, 5, 5);
    public static final RpcTierPolicy PRIVATE = new RpcTierPolicy(RpcTier.PRIVATE, 1000, 10, 50, 3, 3);

    public static RpcTierPolicy defaultsFor(RpcTier tier) {
        return switch (tier) {
            case LOCAL -> LOCAL;
            case PUBLIC -> PUBLIC;
            case PRIVATE -> PRIVATE;
        };
    }

    public RpcTierPolicy withPollIntervalMs(long pollIntervalMs) {
        return new RpcTierPolicy(tier, pollIntervalMs, maxPagesPerCycle, interRequestDelayMs, rateLimitBackoffMultiplier, maxRetries);
    }

    public RpcTierPolicy withMaxPagesPerCycle(int maxPagesPerCycle) {
        return new RpcTierPolicy(tier, pollIntervalMs, maxPagesPerCycle, interRequestDelayMs, rateLimitBackoffMultiplier, maxRetries);
    }
}
