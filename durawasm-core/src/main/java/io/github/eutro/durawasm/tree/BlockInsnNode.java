package io.github.eutro.durawasm.tree;

import io.github.eutro.durawasm.BlockType;
import org.jetbrains.annotations.Nullable;

/**
 * A {@code block}, {@code loop} or {@code if} instruction, which owns its nested bodies.
 */
public class BlockInsnNode extends AbstractInsnNode {
    public final BlockType blockType;
    /**
     * The body, or the then-branch of an {@code if}.
     */
    public final ExprNode body;
    /**
     * The else-branch of an {@code if}, or null if there is none.
     */
    public final @Nullable ExprNode elseBody;

    public BlockInsnNode(byte opcode, BlockType blockType, ExprNode body, @Nullable ExprNode elseBody) {
        super(opcode);
        this.blockType = blockType;
        this.body = body;
        this.elseBody = elseBody;
    }
}
