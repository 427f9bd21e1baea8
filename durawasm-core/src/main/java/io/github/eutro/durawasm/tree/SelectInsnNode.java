package io.github.eutro.durawasm.tree;

import io.github.eutro.durawasm.Opcodes;
import io.github.eutro.durawasm.ValType;
import org.jetbrains.annotations.Nullable;

/**
 * A {@code select}, optionally with an explicit result type.
 */
public class SelectInsnNode extends AbstractInsnNode {
    public final @Nullable ValType type;

    public SelectInsnNode(@Nullable ValType type) {
        super(type == null ? Opcodes.SELECT : Opcodes.SELECTT);
        this.type = type;
    }
}
