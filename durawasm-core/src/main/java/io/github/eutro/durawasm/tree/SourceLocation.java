package io.github.eutro.durawasm.tree;

/**
 * The span of bytes a node was decoded from.
 */
public final class SourceLocation {
    public final int offset;
    public final int length;

    public SourceLocation(int offset, int length) {
        this.offset = offset;
        this.length = length;
    }

    @Override
    public String toString() {
        return "@" + offset + "+" + length;
    }
}
