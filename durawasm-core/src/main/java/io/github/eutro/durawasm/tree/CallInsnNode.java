package io.github.eutro.durawasm.tree;

import io.github.eutro.durawasm.Opcodes;

public class CallInsnNode extends AbstractInsnNode {
    public final int function;

    public CallInsnNode(int function) {
        super(Opcodes.CALL);
        this.function = function;
    }
}
