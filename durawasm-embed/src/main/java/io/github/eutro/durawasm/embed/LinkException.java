package io.github.eutro.durawasm.embed;

/**
 * Thrown when instantiation of a valid module fails: its imports do not match, a segment does not fit, or
 * the start function does not return.
 * <p>
 * Allocations made before the failure stay in the store.
 */
public class LinkException extends RuntimeException {
    public LinkException(String message) {
        super(message);
    }

    public LinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
