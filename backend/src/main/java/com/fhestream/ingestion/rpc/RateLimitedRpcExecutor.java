package com.fhestream.ingestion.rpc;

import com.fhestream.common.Sleeper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Runs every indexer RPC call under the tier policy: requests are spaced by the inter-request delay, rate-limit
 * errors back off by {@code pollInterval * multiplier * consecutiveErrors} (capped at ten poll intervals), other
 * errors by one second per attempt. A success resets the consecutive error count.
 */
@Slf4j
public class RateLimitedRpcExecutor {

    static final long OTHER_ERROR_BACKOFF_MS = 1000L;
    static final int MAX_BACKOFF_POLL_INTERVALS = 10;

    private final RpcTierPolicy policy;
    private final RateLimiter requestPacer;
    private final Sleeper sleeper;
    private int consecutiveRateLimitErrors;

    public RateLimitedRpcExecutor(RpcTierPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
        this.requestPacer = RateLimiter.of("solana-rpc-" + policy.tier().name().toLowerCase(Locale.ROOT), pacing(policy));
    }

    /**
     * Calls {@code call} with retries.
     *
     * @throws TransientRpcException when the last allowed attempt fails
     */
    public <T> T execute(String operation, Supplier<T> call) {
        Supplier<T> paced = RateLimiter.decorateSupplier(requestPacer, call);
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                T result = paced.get();
                consecutiveRateLimitErrors = 0;
                return result;
            } catch (RuntimeException e) {
                if (attempt > policy.maxRetries()) {
                    throw new TransientRpcException(operation + " failed after " + attempt + " attempts", e);
                }
                long backoffMs;
                if (isRateLimited(e)) {
                    consecutiveRateLimitErrors++;
                    backoffMs = rateLimitBackoffMs(consecutiveRateLimitErrors);
                    log.warn("{} rate limited ({} in a row), backing off {} ms", operation, consecutiveRateLimitErrors, backoffMs);
                } else {
                    backoffMs = OTHER_ERROR_BACKOFF_MS * attempt;
                    log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}", operation, attempt, policy.maxRetries() + 1, backoffMs, e.getMessage());
                }
                pause(backoffMs);
            }
        }
    }

    /** Backoff for the n-th consecutive rate-limit error. */
    public long rateLimitBackoffMs(int consecutiveErrors) {
        long backoff = policy.pollIntervalMs() * policy.rateLimitBackoffMultiplier() * (long) consecutiveErrors;
        return Math.min(backoff, policy.pollIntervalMs() * MAX_BACKOFF_POLL_INTERVALS);
    }

    public int getConsecutiveRateLimitErrors() {
        return consecutiveRateLimitErrors;
    }

    public RpcTierPolicy getPolicy() {
        return policy;
    }

    /** True when the error or one of its causes reads like HTTP 429 or a provider rate-limit message. */
    public static boolean isRateLimited(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof RpcException rpc && Integer.valueOf(RpcException.TOO_MANY_REQUESTS).equals(rpc.getCode())) {
                return true;
            }
            String message = t.getMessage();
            if (message == null) {
                continue;
            }
            String lower = message.toLowerCase(Locale.ROOT);
            if (lower.contains("429") || lower.contains("rate limit") || lower.contains("too many requests")) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private void pause(long millis) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during retry backoff", e);
        }
    }

    private static RateLimiterConfig pacing(RpcTierPolicy policy) {
        if (policy.interRequestDelayMs() <= 0) {
            return RateLimiterConfig.custom()
                    .limitRefreshPeriod(Duration.ofSeconds(1))
                    .limitForPeriod(Integer.MAX_VALUE)
                    .timeoutDuration(Duration.ZERO)
                    .build();
        }
        return RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMillis(policy.interRequestDelayMs()))
                .limitForPeriod(1)
                .timeoutDuration(Duration.ofMillis(policy.interRequestDelayMs() * 2))
                .build();
    }
}
