package io.github.eutro.durawasm.tree;

import io.github.eutro.durawasm.Opcodes;

public class CallIndirectInsnNode extends AbstractInsnNode {
    public final int type;
    public final int table;

    public CallIndirectInsnNode(int type, int table) {
        super(Opcodes.CALL_INDIRECT);
        this.type = type;
        this.table = table;
    }
}
