package io.github.eutro.durawasm.tree;

import io.github.eutro.durawasm.Opcodes;
import io.github.eutro.durawasm.ValType;

public class NullInsnNode extends AbstractInsnNode {
    public final ValType type;

    public NullInsnNode(ValType type) {
        super(Opcodes.REF_NULL);
        this.type = type;
    }
}
