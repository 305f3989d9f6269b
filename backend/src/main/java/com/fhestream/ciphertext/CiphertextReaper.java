package com.fhestream.ciphertext;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically fails ciphertext registrations that never confirmed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CiphertextReaper {

    private final CiphertextService ciphertextService;

    @Scheduled(fixedDelayString = "${fhestream.ciphertext.reap-interval-ms:60000}",
            initialDelayString = "${fhestream.ciphertext.reap-interval-ms:60000}")
    public void reap() {
        try {
            ciphertextService.reapStale();
        } catch (DataAccessException e) {
            log.error("Ciphertext reaper run failed", e);
        }
    }
}
