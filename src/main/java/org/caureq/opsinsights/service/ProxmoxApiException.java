package org.caureq.opsinsights.service;

import java.util.Map;

/** Non-2xx answer from the Proxmox API. Snapshot callers treat it like any other source failure. */
public class ProxmoxApiException extends RuntimeException {
    private final int status;
    private final String path;
    private final Map<String, Object> payload;

    public ProxmoxApiException(int status, String path, String body) {
        super("Proxmox API error %d on %s%s".formatted(status, path, body == null || body.isBlank() ? "" : " -> " + body));
        this.status = status;
        this.path = path;
        this.payload = Map.of("status", status, "path", path, "raw", body == null ? "" : body);
    }

    public int status() { return status; }
    public String path() { return path; }
    public Map<String, Object> payload() { return payload; }

    /** 5xx and the PVE proxy's 596 are worth one more try; 4xx are not. */
    public boolean retryable() { return status >= 500; }
}
