package com.fhestream.ingestion.rpc;

import com.fhestream.domain.SignatureRef;

/**
 * One entry of getSignaturesForAddress. {@code failed} is set when the transaction carries an error.
 */
public record SignatureInfo(String signature, long slot, Long blockTime, boolean failed) {

    public SignatureRef toRef() {
        return new SignatureRef(signature, slot, blockTime);
    }
}
