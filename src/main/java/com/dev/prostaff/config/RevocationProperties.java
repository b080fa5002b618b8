package com.dev.prostaff.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "prostaff.revocation")
public record RevocationProperties(
        @DefaultValue("memory") String store,
        @DefaultValue("revoked-token:") String keyPrefix,
        @DefaultValue("15m") Duration cleanupInterval
) {
}
