package io.github.eutro.durawasm.tree;

/**
 * A {@code table.get} or {@code table.set} instruction.
 */
public class TableInsnNode extends AbstractInsnNode {
    public final int table;

    public TableInsnNode(byte opcode, int table) {
        super(opcode);
        this.table = table;
    }
}
