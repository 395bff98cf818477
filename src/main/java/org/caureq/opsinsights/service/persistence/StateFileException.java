package org.caureq.opsinsights.service.persistence;

public class StateFileException extends RuntimeException {
    public StateFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
