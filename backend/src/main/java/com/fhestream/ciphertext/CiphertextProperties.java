package com.fhestream.ciphertext;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "fhestream.ciphertext")
@NoArgsConstructor
@Getter
@Setter
public class CiphertextProperties {

    /** Registrations not confirmed on chain within this window are marked FAILED. */
    private Duration pendingTtl = Duration.ofSeconds(180);

    /** Reaper run interval in ms. */
    private long reapIntervalMs = 60_000;
}
