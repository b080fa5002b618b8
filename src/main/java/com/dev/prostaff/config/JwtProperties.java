package com.dev.prostaff.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "security.jwt")
public record JwtProperties(
        String secret,
        @DefaultValue("prostaff-api") String issuer,
        @DefaultValue("24h") Duration accessTokenTtl,
        @DefaultValue("7d") Duration refreshTokenTtl
) {
}
