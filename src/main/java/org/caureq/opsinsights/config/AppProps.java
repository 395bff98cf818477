package org.caureq.opsinsights.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app")
public record AppProps(String apiKey) {
    /** Write endpoints are open when no key is configured (local/dev). */
    public boolean apiKeyRequired() { return apiKey != null && !apiKey.isBlank(); }
}
