package io.github.eutro.durawasm.embed;

import io.github.eutro.durawasm.Opcodes;
import io.github.eutro.durawasm.embed.exec.EngineStateException;
import io.github.eutro.durawasm.tree.*;

/**
 * Evaluates the constant expressions of a module being instantiated: global initialisers and segment offsets
 * and elements.
 */
final class ConstantEvaluator {
    private final Store store;
    private final ModuleInstance instance;

    ConstantEvaluator(Store store, ModuleInstance instance) {
        this.store = store;
        this.instance = instance;
    }

    Value evaluate(ExprNode expr) {
        Value result = null;
        for (AbstractInsnNode insn : expr) {
            switch (insn.opcode) {
                case Opcodes.I32_CONST:
                    result = Value.i32((int) ((ConstInsnNode) insn).bits);
                    break;
                case Opcodes.I64_CONST:
                    result = Value.i64(((ConstInsnNode) insn).bits);
                    break;
                case Opcodes.F32_CONST:
                    result = Value.f32Bits((int) ((ConstInsnNode) insn).bits);
                    break;
                case Opcodes.F64_CONST:
                    result = Value.f64Bits(((ConstInsnNode) insn).bits);
                    break;
                case Opcodes.REF_NULL:
                    result = Value.nullRef(((NullInsnNode) insn).type);
                    break;
                case Opcodes.REF_FUNC:
                    result = Value.funcRef(instance.funcAddr(((FuncRefInsnNode) insn).function));
                    break;
                case Opcodes.GLOBAL_GET:
                    result = store.global(instance.globalAddr(((VariableInsnNode) insn).variable)).get();
                    break;
                default:
                    throw new EngineStateException(String.format("Not a constant instruction: 0x%02x", insn.opcode));
            }
        }
        if (result == null) throw new EngineStateException("Empty constant expression");
        return result;
    }
}
