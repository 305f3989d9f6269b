package com.fhestream.gateway;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Streaming gateway timing and replay limits.
 */
@ConfigurationProperties(prefix = "fhestream.gateway")
@NoArgsConstructor
@Getter
@Setter
public class GatewayProperties {

    /** Interval between keep-alive comments on an idle connection. */
    private Duration keepAliveInterval = Duration.ofSeconds(30);

    /** History polling interval when the publish bus is unavailable. */
    private Duration fallbackPollInterval = Duration.ofSeconds(5);

    /** Page size for gap replay on connect and for each fallback poll; replay pages until the gap is closed. */
    private int gapFillLimit = 100;
}
