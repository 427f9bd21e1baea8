package io.github.eutro.durawasm.tree;

import org.jetbrains.annotations.Nullable;

/**
 * A single instruction in an {@link ExprNode}.
 */
public abstract class AbstractInsnNode {
    /**
     * The first byte of the opcode of this instruction.
     */
    public final byte opcode;
    /**
     * Where this instruction was decoded from, or null if it was constructed directly.
     */
    public @Nullable SourceLocation location;

    protected AbstractInsnNode(byte opcode) {
        this.opcode = opcode;
    }
}
