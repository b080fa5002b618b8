package com.dev.prostaff.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

@ConfigurationProperties(prefix = "prostaff.realtime")
public record RealtimeProperties(
        @DefaultValue("/cable") String endpoint,
        @DefaultValue("*") List<String> allowedOrigins
) {
}
