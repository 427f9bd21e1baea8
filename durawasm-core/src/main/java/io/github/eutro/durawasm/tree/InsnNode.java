package io.github.eutro.durawasm.tree;

/**
 * An instruction with no immediates.
 */
public class InsnNode extends AbstractInsnNode {
    public InsnNode(byte opcode) {
        super(opcode);
    }
}
