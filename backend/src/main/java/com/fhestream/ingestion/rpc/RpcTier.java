package com.fhestream.ingestion.rpc;

/**
 * Class of RPC provider, deciding how hard the indexer may poll it.
 */
public enum RpcTier {
    LOCAL,
    PUBLIC,
    PRIVATE
}
