package io.github.eutro.durawasm.embed.exec;

/**
 * Thrown when the engine finds its own state inconsistent, such as a value of the wrong type where validation
 * guarantees the right one. This indicates a bug, or a state that was tampered with, never a trap.
 */
public class EngineStateException extends RuntimeException {
    public EngineStateException(String message) {
        super(message);
    }
}
