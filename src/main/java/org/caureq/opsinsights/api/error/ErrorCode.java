package org.caureq.opsinsights.api.error;

public enum ErrorCode {
    BAD_REQUEST, NOT_FOUND, INSUFFICIENT_DATA, UPSTREAM_ERROR, AUTH_REQUIRED, INTERNAL_ERROR
}
