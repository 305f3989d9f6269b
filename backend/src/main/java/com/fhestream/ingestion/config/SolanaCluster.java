package com.fhestream.ingestion.config;

import java.util.Arrays;
import java.util.Locale;

/**
 * Known clusters and their default HTTP and WebSocket endpoints.
 */
public enum SolanaCluster {
    LOCALNET("localnet", "http://127.0.0.1:8899", "ws://127.0.0.1:8900"),
    DEVNET("devnet", "https://api.devnet.solana.com", "wss://api.devnet.solana.com"),
    TESTNET("testnet", "https://api.testnet.solana.com", "wss://api.testnet.solana.com"),
    MAINNET_BETA("mainnet-beta", "https://api.mainnet-beta.solana.com", "wss://api.mainnet-beta.solana.com");

    private final String id;
    private final String rpcEndpoint;
    private final String wsEndpoint;

    SolanaCluster(String id, String rpcEndpoint, String wsEndpoint) {
        this.id = id;
        this.rpcEndpoint = rpcEndpoint;
        this.wsEndpoint = wsEndpoint;
    }

    public String id() {
        return id;
    }

    public String rpcEndpoint() {
        return rpcEndpoint;
    }

    public String wsEndpoint() {
        return wsEndpoint;
    }

    public static SolanaCluster fromId(String id) {
        String key = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.id.equals(key) || c.name().equalsIgnoreCase(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown Solana cluster '" + id + "'"));
    }
}
