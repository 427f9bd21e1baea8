package io.github.eutro.durawasm.binary;

/**
 * Thrown when a byte stream does not decode as a well-formed binary module.
 */
public class MalformedModuleException extends RuntimeException {
    private final int offset;

    public MalformedModuleException(String message, int offset) {
        super(message + " (at byte offset " + offset + ")");
        this.offset = offset;
    }

    /**
     * @return The byte offset in the module at which decoding failed.
     */
    public int getOffset() {
        return offset;
    }
}
