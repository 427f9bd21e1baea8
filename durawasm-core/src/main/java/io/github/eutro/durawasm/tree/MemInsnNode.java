package io.github.eutro.durawasm.tree;

/**
 * A load or store, with its alignment hint (as a power of two) and its unsigned static offset.
 */
public class MemInsnNode extends AbstractInsnNode {
    public final int align;
    public final int offset;

    public MemInsnNode(byte opcode, int align, int offset) {
        super(opcode);
        this.align = align;
        this.offset = offset;
    }
}
