package io.github.eutro.durawasm.tree;

import io.github.eutro.durawasm.Opcodes;

/**
 * A {@code br_table} instruction.
 */
public class TableBreakInsnNode extends AbstractInsnNode {
    public final int[] labels;
    public final int defaultLabel;

    public TableBreakInsnNode(int[] labels, int defaultLabel) {
        super(Opcodes.BR_TABLE);
        this.labels = labels;
        this.defaultLabel = defaultLabel;
    }
}
