package io.github.eutro.durawasm.tree;

import io.github.eutro.durawasm.Opcodes;

public class FuncRefInsnNode extends AbstractInsnNode {
    public final int function;

    public FuncRefInsnNode(int function) {
        super(Opcodes.REF_FUNC);
        this.function = function;
    }
}
