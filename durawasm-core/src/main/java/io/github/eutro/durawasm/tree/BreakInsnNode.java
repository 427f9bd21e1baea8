package io.github.eutro.durawasm.tree;

/**
 * A {@code br} or {@code br_if} instruction.
 */
public class BreakInsnNode extends AbstractInsnNode {
    public final int label;

    public BreakInsnNode(byte opcode, int label) {
        super(opcode);
        this.label = label;
    }
}
