package io.github.eutro.durawasm.tree;

/**
 * A {@code *.const} instruction. The constant is kept as raw bits, so float payloads survive untouched.
 */
public class ConstInsnNode extends AbstractInsnNode {
    public final long bits;

    public ConstInsnNode(byte opcode, long bits) {
        super(opcode);
        this.bits = bits;
    }
}
