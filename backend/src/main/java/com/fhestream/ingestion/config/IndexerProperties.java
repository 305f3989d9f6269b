package com.fhestream.ingestion.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Indexer config: which program to follow, where, and how hard to poll. Poll interval and page cap default to the
 * endpoint's tier policy; set them to override it.
 */
@ConfigurationProperties(prefix = "fhestream.indexer")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class IndexerProperties {

    /** Start the indexer when the application is ready. */
    private boolean enabled = true;

    /** Base58 id of the program whose events are indexed. */
    @NotBlank
    private String programId;

    /** Cluster used for default endpoints: localnet, devnet, testnet, mainnet-beta. */
    private String cluster = "devnet";

    /** HTTP RPC endpoint; blank means the cluster default. */
    private String rpcEndpoint;

    /** WebSocket endpoint for push mode; blank means the cluster default. */
    private String wsEndpoint;

    /** Commitment for all reads. */
    @Pattern(regexp = "processed|confirmed|finalized")
    private String commitment = "confirmed";

    private IndexerMode mode = IndexerMode.POLLING;

    /** Overrides the tier's poll interval when set (INDEXER_POLL_INTERVAL). */
    private Long pollIntervalMs;

    /** Overrides the tier's page cap per cycle when set (INDEXER_MAX_BATCHES). */
    private Integer maxPagesPerCycle;

    /** Signatures requested per getSignaturesForAddress page (1–1000). */
    private int signaturesPageSize = 1000;

    /** Per-request HTTP timeout. */
    private long rpcTimeoutMs = 30_000;

    public String resolvedRpcEndpoint() {
        return isBlank(rpcEndpoint) ? SolanaCluster.fromId(cluster).rpcEndpoint() : rpcEndpoint;
    }

    public String resolvedWsEndpoint() {
        if (!isBlank(wsEndpoint)) {
            return wsEndpoint;
        }
        if (!isBlank(rpcEndpoint)) {
            // solana-test-validator serves WebSocket on the RPC port + 1
            return rpcEndpoint.replaceFirst("^http", "ws").replace(":8899", ":8900");
        }
        return SolanaCluster.fromId(cluster).wsEndpoint();
    }

    /** Signature and transaction reads do not support processed; they use confirmed instead. */
    public String readCommitment() {
        return "processed".equals(commitment) ? "confirmed" : commitment;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
