package com.fhestream.ciphertext;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CiphertextProperties.class)
public class CiphertextConfig {
}
