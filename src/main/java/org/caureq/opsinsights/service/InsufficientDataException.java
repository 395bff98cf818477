package org.caureq.opsinsights.service;

/** Not enough samples to produce a result. An expected outcome, mapped to 422 at the API edge. */
public class InsufficientDataException extends RuntimeException {
    private final int available;
    private final int required;

    public InsufficientDataException(String message, int available, int required) {
        super(message);
        this.available = available;
        this.required = required;
    }

    public int available() { return available; }
    public int required() { return required; }
}
