package org.caureq.opsinsights.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/** Proxmox API access used by the snapshot provider. Disabled unless {@code proxmox.enabled=true}. */
@ConfigurationProperties(prefix = "proxmox")
public record ProxmoxProps(boolean enabled, String baseUrl, String tokenId, String tokenSecret,
                           Duration timeout, boolean insecureTls) {
    public ProxmoxProps {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) timeout = Duration.ofSeconds(15);
    }
}
