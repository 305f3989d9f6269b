package com.fhestream.ingestion.rpc;

/**
 * An RPC call still failed after all retries allowed by the tier policy.
 */
public class TransientRpcException extends RpcException {

    public TransientRpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
