package io.github.eutro.durawasm.tree;

public class ExportNode {
    public final String name;
    /**
     * One of the {@code IMPORTS_*} kind constants.
     */
    public final byte type;
    public final int index;

    public ExportNode(String name, byte type, int index) {
        this.name = name;
        this.type = type;
        this.index = index;
    }
}
