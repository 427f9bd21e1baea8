package io.github.eutro.durawasm.tree;

import org.jetbrains.annotations.Nullable;

public class DataNode {
    public final boolean active;
    public final int memory;
    public final @Nullable ExprNode offset;
    public final byte[] init;

    public DataNode(boolean active, int memory, @Nullable ExprNode offset, byte[] init) {
        this.active = active;
        this.memory = memory;
        this.offset = offset;
        this.init = init;
    }
}
