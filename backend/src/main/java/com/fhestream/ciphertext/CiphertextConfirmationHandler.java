package com.fhestream.ciphertext;

import com.fhestream.domain.InputHandleRegistered;
import com.fhestream.ingestion.handler.IndexedEventHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Confirms tracked ciphertexts when their registration is indexed. Runs before the publishing handler.
 */
@Component
@Order(20)
@RequiredArgsConstructor
public class CiphertextConfirmationHandler implements IndexedEventHandler {

    private final CiphertextService ciphertextService;

    @Override
    public void onInputHandleRegistered(InputHandleRegistered event) {
        ciphertextService.confirm(event);
    }
}
