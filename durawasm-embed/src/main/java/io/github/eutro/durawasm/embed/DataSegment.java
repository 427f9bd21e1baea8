package io.github.eutro.durawasm.embed;

/**
 * A data segment instance. Dropping it empties it.
 */
public final class DataSegment {
    private static final byte[] EMPTY = new byte[0];

    private byte[] bytes;

    DataSegment(byte[] bytes) {
        this.bytes = bytes;
    }

    public byte[] getBytes() {
        return bytes;
    }

    public boolean isDropped() {
        return bytes.length == 0;
    }

    public void drop() {
        bytes = EMPTY;
    }
}
