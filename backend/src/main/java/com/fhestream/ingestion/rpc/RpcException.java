package com.fhestream.ingestion.rpc;

/**
 * Failed Solana RPC call. {@code code} is the HTTP status for transport failures, the JSON-RPC error code
 * when the node answered with an error object, and null otherwise.
 */
public class RpcException extends RuntimeException {

    /** Status some providers answer with when the per-key request quota is exceeded. */
    public static final int TOO_MANY_REQUESTS = 429;

    private final Integer code;

    public RpcException(String message) {
        this(message, null, null);
    }

    public RpcException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public RpcException(String message, Integer code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public Integer getCode() {
        return code;
    }
}
