package io.github.eutro.durawasm.embed.snapshot;

/**
 * Thrown when a snapshot or store image cannot be restored: it is corrupt, from another format version, or does
 * not match the modules and addresses of the target store.
 */
public class SnapshotMismatchException extends RuntimeException {
    public SnapshotMismatchException(String message) {
        super(message);
    }

    public SnapshotMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
