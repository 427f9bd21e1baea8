package io.github.eutro.durawasm.tree;

/**
 * A {@code local.*} or {@code global.*} instruction.
 */
public class VariableInsnNode extends AbstractInsnNode {
    public final int variable;

    public VariableInsnNode(byte opcode, int variable) {
        super(opcode);
        this.variable = variable;
    }
}
