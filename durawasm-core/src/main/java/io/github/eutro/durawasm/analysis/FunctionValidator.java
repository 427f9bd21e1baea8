package io.github.eutro.durawasm.analysis;

import io.github.eutro.durawasm.MemoryAccess;
import io.github.eutro.durawasm.ValType;
import io.github.eutro.durawasm.tree.*;
import io.github.eutro.durawasm.util.InsnMap;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static io.github.eutro.durawasm.Opcodes.*;
import static io.github.eutro.durawasm.analysis.ValidationException.Failure.*;

/**
 * Type checks one function body by simulating its operand stack.
 * <p>
 * Operand types are {@link ValType}s, with {@code null} standing for the unknown type of operands
 * popped from the polymorphic stack of unreachable code.
 */
class FunctionValidator {
    @FunctionalInterface
    interface InsnValidator {
        void validate(FunctionValidator fv, AbstractInsnNode node);
    }

    static class CtrlFrame {
        byte opcode;
        ValType[] startTypes;
        ValType[] endTypes;
        int height;
        boolean unreachable;
    }

    private static final InsnMap<InsnValidator> VALIDATORS = new InsnMap<>();

    private final ModuleNode module;
    private final Set<Integer> declaredRefs;
    private final int funcIndex;
    private final ValType[] locals;
    private final ValType[] returns;

    private final List<ValType> vals = new ArrayList<>();
    private final List<CtrlFrame> ctrls = new ArrayList<>();
    private int insnIndex = -1;

    FunctionValidator(ModuleNode module, Set<Integer> declaredRefs, int funcIndex, TypeNode type, CodeNode code) {
        this.module = module;
        this.declaredRefs = declaredRefs;
        this.funcIndex = funcIndex;
        this.locals = new ValType[type.params.length + code.locals.length];
        System.arraycopy(type.params, 0, locals, 0, type.params.length);
        System.arraycopy(code.locals, 0, locals, type.params.length, code.locals.length);
        this.returns = type.results;
    }

    void validate(ExprNode body) {
        pushC(BLOCK, new ValType[0], returns);
        validateExpr(body);
        popC();
    }

    private void validateExpr(ExprNode expr) {
        for (AbstractInsnNode insn : expr) {
            insnIndex++;
            InsnValidator validator = VALIDATORS.get(insn);
            if (validator == null) {
                throw error(INVALID, "unsupported instruction");
            }
            validator.validate(this, insn);
        }
    }

    ValidationException error(ValidationException.Failure failure, String message) {
        return new ValidationException(failure, message, funcIndex, insnIndex);
    }

    // region Operand and control stacks
    CtrlFrame ctrlsRef(int idx) {
        return ctrls.get(ctrls.size() - idx - 1);
    }

    void pushV(@Nullable ValType type) {
        vals.add(type);
    }

    void pushVs(ValType[] types) {
        for (ValType type : types) pushV(type);
    }

    @Nullable ValType popV() {
        CtrlFrame frame = ctrlsRef(0);
        if (vals.size() == frame.height) {
            if (frame.unreachable) return null;
            throw error(TYPE_MISMATCH, "type mismatch: operand stack underflow");
        }
        return vals.remove(vals.size() - 1);
    }

    @Nullable ValType popV(@Nullable ValType expected) {
        ValType actual = popV();
        if (actual != null && expected != null && actual != expected) {
            throw error(TYPE_MISMATCH, "type mismatch: expected " + expected + ", got " + actual);
        }
        return actual == null ? expected : actual;
    }

    void popVs(ValType[] types) {
        for (int i = types.length - 1; i >= 0; i--) popV(types[i]);
    }

    void pushC(byte opcode, ValType[] in, ValType[] out) {
        CtrlFrame frame = new CtrlFrame();
        frame.opcode = opcode;
        frame.startTypes = in;
        frame.endTypes = out;
        frame.height = vals.size();
        frame.unreachable = false;
        ctrls.add(frame);
        pushVs(in);
    }

    CtrlFrame popC() {
        CtrlFrame frame = ctrlsRef(0);
        popVs(frame.endTypes);
        if (vals.size() != frame.height) {
            throw error(TYPE_MISMATCH, "type mismatch: values remaining on stack at end of block");
        }
        ctrls.remove(ctrls.size() - 1);
        return frame;
    }

    ValType[] labelTypes(CtrlFrame frame) {
        return frame.opcode == LOOP ? frame.startTypes : frame.endTypes;
    }

    CtrlFrame label(int depth) {
        if (depth < 0 || depth >= ctrls.size()) throw error(UNKNOWN_INDEX, "unknown label " + Integer.toUnsignedString(depth));
        return ctrlsRef(depth);
    }

    void unreachable() {
        CtrlFrame frame = ctrlsRef(0);
        while (vals.size() > frame.height) vals.remove(vals.size() - 1);
        frame.unreachable = true;
    }
    // endregion

    // region Index spaces
    TypeNode type(int index) {
        if (index < 0 || index >= module.types.size()) throw error(UNKNOWN_INDEX, "unknown type " + Integer.toUnsignedString(index));
        return module.types.get(index);
    }

    TypeNode funcType(int index) {
        if (index < 0 || index >= module.funcCount()) throw error(UNKNOWN_INDEX, "unknown function " + Integer.toUnsignedString(index));
        return module.funcType(index);
    }

    TableNode table(int index) {
        if (index < 0 || index >= module.tableCount()) throw error(UNKNOWN_INDEX, "unknown table " + Integer.toUnsignedString(index));
        return module.tableType(index);
    }

    void memory(int index) {
        if (index != 0 || module.memCount() == 0) throw error(UNKNOWN_INDEX, "unknown memory " + Integer.toUnsignedString(index));
    }

    ValType elem(int index) {
        if (index < 0 || index >= module.elems.size()) throw error(UNKNOWN_INDEX, "unknown elem segment " + Integer.toUnsignedString(index));
        return module.elems.get(index).type;
    }

    void data(int index) {
        if (module.dataCount == null) throw error(INVALID, "data count section required");
        if (index < 0 || index >= module.dataCount) throw error(UNKNOWN_INDEX, "unknown data segment " + Integer.toUnsignedString(index));
    }

    ValType local(int index) {
        if (index < 0 || index >= locals.length) throw error(UNKNOWN_INDEX, "unknown local " + Integer.toUnsignedString(index));
        return locals[index];
    }

    GlobalTypeNode global(int index) {
        if (index < 0 || index >= module.globalCount()) throw error(UNKNOWN_INDEX, "unknown global " + Integer.toUnsignedString(index));
        return module.globalType(index);
    }
    // endregion

    private static void putSig(ValType[] params, ValType[] results, byte... opcodes) {
        VALIDATORS.putByte(opcodes, (fv, node) -> {
            fv.popVs(params);
            fv.pushVs(results);
        });
    }

    private static void putPrefixSig(ValType[] params, ValType[] results, int... opcodes) {
        VALIDATORS.putInt(opcodes, (fv, node) -> {
            fv.popVs(params);
            fv.pushVs(results);
        });
    }

    private static ValType[] types(ValType... types) {
        return types;
    }

    private static final ValType[] NONE = new ValType[0];
    private static final ValType[] I = types(ValType.I32);
    private static final ValType[] II = types(ValType.I32, ValType.I32);
    private static final ValType[] III = types(ValType.I32, ValType.I32, ValType.I32);
    private static final ValType[] L = types(ValType.I64);
    private static final ValType[] LL = types(ValType.I64, ValType.I64);
    private static final ValType[] F = types(ValType.F32);
    private static final ValType[] FF = types(ValType.F32, ValType.F32);
    private static final ValType[] D = types(ValType.F64);
    private static final ValType[] DD = types(ValType.F64, ValType.F64);

    static {
        putSig(NONE, I, I32_CONST);
        putSig(NONE, L, I64_CONST);
        putSig(NONE, F, F32_CONST);
        putSig(NONE, D, F64_CONST);

        putSig(I, I, I32_EQZ, I32_CLZ, I32_CTZ, I32_POPCNT, I32_EXTEND8_S, I32_EXTEND16_S);
        putSig(II, I, I32_EQ, I32_NE, I32_LT_S, I32_LT_U, I32_GT_S, I32_GT_U, I32_LE_S, I32_LE_U, I32_GE_S, I32_GE_U,
                I32_ADD, I32_SUB, I32_MUL, I32_DIV_S, I32_DIV_U, I32_REM_S, I32_REM_U,
                I32_AND, I32_OR, I32_XOR, I32_SHL, I32_SHR_S, I32_SHR_U, I32_ROTL, I32_ROTR);
        putSig(L, I, I64_EQZ);
        putSig(LL, I, I64_EQ, I64_NE, I64_LT_S, I64_LT_U, I64_GT_S, I64_GT_U, I64_LE_S, I64_LE_U, I64_GE_S, I64_GE_U);
        putSig(L, L, I64_CLZ, I64_CTZ, I64_POPCNT, I64_EXTEND8_S, I64_EXTEND16_S, I64_EXTEND32_S);
        putSig(LL, L, I64_ADD, I64_SUB, I64_MUL, I64_DIV_S, I64_DIV_U, I64_REM_S, I64_REM_U,
                I64_AND, I64_OR, I64_XOR, I64_SHL, I64_SHR_S, I64_SHR_U, I64_ROTL, I64_ROTR);
        putSig(FF, I, F32_EQ, F32_NE, F32_LT, F32_GT, F32_LE, F32_GE);
        putSig(DD, I, F64_EQ, F64_NE, F64_LT, F64_GT, F64_LE, F64_GE);
        putSig(F, F, F32_ABS, F32_NEG, F32_CEIL, F32_FLOOR, F32_TRUNC, F32_NEAREST, F32_SQRT);
        putSig(FF, F, F32_ADD, F32_SUB, F32_MUL, F32_DIV, F32_MIN, F32_MAX, F32_COPYSIGN);
        putSig(D, D, F64_ABS, F64_NEG, F64_CEIL, F64_FLOOR, F64_TRUNC, F64_NEAREST, F64_SQRT);
        putSig(DD, D, F64_ADD, F64_SUB, F64_MUL, F64_DIV, F64_MIN, F64_MAX, F64_COPYSIGN);

        putSig(L, I, I32_WRAP_I64);
        putSig(F, I, I32_TRUNC_F32_S, I32_TRUNC_F32_U, I32_REINTERPRET_F32);
        putSig(D, I, I32_TRUNC_F64_S, I32_TRUNC_F64_U);
        putSig(I, L, I64_EXTEND_I32_S, I64_EXTEND_I32_U);
        putSig(F, L, I64_TRUNC_F32_S, I64_TRUNC_F32_U);
        putSig(D, L, I64_TRUNC_F64_S, I64_TRUNC_F64_U, I64_REINTERPRET_F64);
        putSig(I, F, F32_CONVERT_I32_S, F32_CONVERT_I32_U, F32_REINTERPRET_I32);
        putSig(L, F, F32_CONVERT_I64_S, F32_CONVERT_I64_U);
        putSig(D, F, F32_DEMOTE_F64);
        putSig(I, D, F64_CONVERT_I32_S, F64_CONVERT_I32_U);
        putSig(L, D, F64_CONVERT_I64_S, F64_CONVERT_I64_U, F64_REINTERPRET_I64);
        putSig(F, D, F64_PROMOTE_F32);

        putPrefixSig(F, I, I32_TRUNC_SAT_F32_S, I32_TRUNC_SAT_F32_U);
        putPrefixSig(D, I, I32_TRUNC_SAT_F64_S, I32_TRUNC_SAT_F64_U);
        putPrefixSig(F, L, I64_TRUNC_SAT_F32_S, I64_TRUNC_SAT_F32_U);
        putPrefixSig(D, L, I64_TRUNC_SAT_F64_S, I64_TRUNC_SAT_F64_U);
    }

    static {
        VALIDATORS.putByte(UNREACHABLE, (fv, node) -> fv.unreachable());
        VALIDATORS.putByte(NOP, (fv, node) -> {
        });
        VALIDATORS.putByte(new byte[]{
                BLOCK,
                LOOP
        }, (fv, node) -> {
            BlockInsnNode block = (BlockInsnNode) node;
            TypeNode type = fv.blockType(block);
            fv.popVs(type.params);
            fv.pushC(node.opcode, type.params, type.results);
            fv.validateExpr(block.body);
            fv.pushVs(fv.popC().endTypes);
        });
        VALIDATORS.putByte(IF, (fv, node) -> {
            BlockInsnNode block = (BlockInsnNode) node;
            TypeNode type = fv.blockType(block);
            fv.popV(ValType.I32);
            fv.popVs(type.params);
            fv.pushC(IF, type.params, type.results);
            fv.validateExpr(block.body);
            CtrlFrame frame = fv.popC();
            if (block.elseBody != null) {
                fv.pushC(ELSE, frame.startTypes, frame.endTypes);
                fv.validateExpr(block.elseBody);
                fv.popC();
            } else if (!Arrays.equals(type.params, type.results)) {
                throw fv.error(TYPE_MISMATCH, "type mismatch: if without else must leave its parameters unchanged");
            }
            fv.pushVs(frame.endTypes);
        });
        VALIDATORS.putByte(BR, (fv, node) -> {
            fv.popVs(fv.labelTypes(fv.label(((BreakInsnNode) node).label)));
            fv.unreachable();
        });
        VALIDATORS.putByte(BR_IF, (fv, node) -> {
            fv.popV(ValType.I32);
            ValType[] types = fv.labelTypes(fv.label(((BreakInsnNode) node).label));
            fv.popVs(types);
            fv.pushVs(types);
        });
        VALIDATORS.putByte(BR_TABLE, (fv, node) -> {
            TableBreakInsnNode brTable = (TableBreakInsnNode) node;
            fv.popV(ValType.I32);
            ValType[] defaultTypes = fv.labelTypes(fv.label(brTable.defaultLabel));
            int arity = defaultTypes.length;
            for (int label : brTable.labels) {
                ValType[] types = fv.labelTypes(fv.label(label));
                if (types.length != arity) {
                    throw fv.error(TYPE_MISMATCH, "type mismatch: br_table targets have different arities");
                }
                ValType[] popped = new ValType[arity];
                for (int i = arity - 1; i >= 0; i--) popped[i] = fv.popV(types[i]);
                fv.pushVs(popped);
            }
            fv.popVs(defaultTypes);
            fv.unreachable();
        });
        VALIDATORS.putByte(RETURN, (fv, node) -> {
            fv.popVs(fv.returns);
            fv.unreachable();
        });
        VALIDATORS.putByte(CALL, (fv, node) -> {
            TypeNode type = fv.funcType(((CallInsnNode) node).function);
            fv.popVs(type.params);
            fv.pushVs(type.results);
        });
        VALIDATORS.putByte(CALL_INDIRECT, (fv, node) -> {
            CallIndirectInsnNode call = (CallIndirectInsnNode) node;
            TableNode table = fv.table(call.table);
            if (table.type != ValType.FUNCREF) {
                throw fv.error(TYPE_MISMATCH, "type mismatch: call_indirect on a table of " + table.type);
            }
            TypeNode type = fv.type(call.type);
            fv.popV(ValType.I32);
            fv.popVs(type.params);
            fv.pushVs(type.results);
        });
    }

    static {
        VALIDATORS.putByte(REF_NULL, (fv, node) -> fv.pushV(((NullInsnNode) node).type));
        VALIDATORS.putByte(REF_IS_NULL, (fv, node) -> {
            ValType type = fv.popV();
            if (type != null && !type.isReference()) {
                throw fv.error(TYPE_MISMATCH, "type mismatch: ref.is_null on " + type);
            }
            fv.pushV(ValType.I32);
        });
        VALIDATORS.putByte(REF_FUNC, (fv, node) -> {
            int function = ((FuncRefInsnNode) node).function;
            fv.funcType(function);
            if (!fv.declaredRefs.contains(function)) {
                throw fv.error(INVALID, "undeclared function reference");
            }
            fv.pushV(ValType.FUNCREF);
        });
    }

    static {
        VALIDATORS.putByte(DROP, (fv, node) -> fv.popV());
        VALIDATORS.putByte(new byte[]{
                SELECT,
                SELECTT
        }, (fv, node) -> {
            ValType explicit = ((SelectInsnNode) node).type;
            fv.popV(ValType.I32);
            if (explicit != null) {
                fv.popV(explicit);
                fv.popV(explicit);
                fv.pushV(explicit);
                return;
            }
            ValType t1 = fv.popV();
            ValType t2 = fv.popV();
            if ((t1 != null && t1.isReference()) || (t2 != null && t2.isReference())) {
                throw fv.error(TYPE_MISMATCH, "type mismatch: select without a type on reference operands");
            }
            if (t1 != null && t2 != null && t1 != t2) {
                throw fv.error(TYPE_MISMATCH, "type mismatch: select operands " + t1 + " and " + t2);
            }
            fv.pushV(t1 == null ? t2 : t1);
        });
    }

    static {
        VALIDATORS.putByte(LOCAL_GET, (fv, node) -> fv.pushV(fv.local(((VariableInsnNode) node).variable)));
        VALIDATORS.putByte(LOCAL_SET, (fv, node) -> fv.popV(fv.local(((VariableInsnNode) node).variable)));
        VALIDATORS.putByte(LOCAL_TEE, (fv, node) -> {
            ValType type = fv.local(((VariableInsnNode) node).variable);
            fv.popV(type);
            fv.pushV(type);
        });
        VALIDATORS.putByte(GLOBAL_GET, (fv, node) -> fv.pushV(fv.global(((VariableInsnNode) node).variable).type));
        VALIDATORS.putByte(GLOBAL_SET, (fv, node) -> {
            GlobalTypeNode global = fv.global(((VariableInsnNode) node).variable);
            if (!global.mutable) throw fv.error(INVALID, "global is immutable");
            fv.popV(global.type);
        });
    }

    static {
        VALIDATORS.putByte(TABLE_GET, (fv, node) -> {
            TableNode table = fv.table(((TableInsnNode) node).table);
            fv.popV(ValType.I32);
            fv.pushV(table.type);
        });
        VALIDATORS.putByte(TABLE_SET, (fv, node) -> {
            TableNode table = fv.table(((TableInsnNode) node).table);
            fv.popV(table.type);
            fv.popV(ValType.I32);
        });
        VALIDATORS.putInt(TABLE_INIT, (fv, node) -> {
            PrefixInsnNode insn = (PrefixInsnNode) node;
            ValType elemType = fv.elem(insn.firstIndex);
            TableNode table = fv.table(insn.secondIndex);
            if (elemType != table.type) {
                throw fv.error(TYPE_MISMATCH, "type mismatch: table.init of " + elemType + " into " + table.type);
            }
            fv.popVs(III);
        });
        VALIDATORS.putInt(ELEM_DROP, (fv, node) -> fv.elem(((PrefixInsnNode) node).firstIndex));
        VALIDATORS.putInt(TABLE_COPY, (fv, node) -> {
            PrefixInsnNode insn = (PrefixInsnNode) node;
            TableNode dst = fv.table(insn.firstIndex);
            TableNode src = fv.table(insn.secondIndex);
            if (dst.type != src.type) {
                throw fv.error(TYPE_MISMATCH, "type mismatch: table.copy from " + src.type + " into " + dst.type);
            }
            fv.popVs(III);
        });
        VALIDATORS.putInt(TABLE_GROW, (fv, node) -> {
            TableNode table = fv.table(((PrefixInsnNode) node).firstIndex);
            fv.popV(ValType.I32);
            fv.popV(table.type);
            fv.pushV(ValType.I32);
        });
        VALIDATORS.putInt(TABLE_SIZE, (fv, node) -> {
            fv.table(((PrefixInsnNode) node).firstIndex);
            fv.pushV(ValType.I32);
        });
        VALIDATORS.putInt(TABLE_FILL, (fv, node) -> {
            TableNode table = fv.table(((PrefixInsnNode) node).firstIndex);
            fv.popV(ValType.I32);
            fv.popV(table.type);
            fv.popV(ValType.I32);
        });
    }

    static {
        for (MemoryAccess access : MemoryAccess.values()) {
            VALIDATORS.putByte(access.opcode, (fv, node) -> {
                fv.memory(0);
                if (Integer.compareUnsigned(((MemInsnNode) node).align, access.naturalAlignment()) > 0) {
                    throw fv.error(INVALID, "alignment must not be larger than natural");
                }
                if (access.store) {
                    fv.popV(access.type);
                    fv.popV(ValType.I32);
                } else {
                    fv.popV(ValType.I32);
                    fv.pushV(access.type);
                }
            });
        }
        VALIDATORS.putByte(MEMORY_SIZE, (fv, node) -> {
            fv.memory(0);
            fv.pushV(ValType.I32);
        });
        VALIDATORS.putByte(MEMORY_GROW, (fv, node) -> {
            fv.memory(0);
            fv.popV(ValType.I32);
            fv.pushV(ValType.I32);
        });
        VALIDATORS.putInt(MEMORY_INIT, (fv, node) -> {
            fv.memory(((PrefixInsnNode) node).secondIndex);
            fv.data(((PrefixInsnNode) node).firstIndex);
            fv.popVs(III);
        });
        VALIDATORS.putInt(DATA_DROP, (fv, node) -> fv.data(((PrefixInsnNode) node).firstIndex));
        VALIDATORS.putInt(new int[]{
                MEMORY_COPY,
                MEMORY_FILL
        }, (fv, node) -> {
            fv.memory(0);
            fv.popVs(III);
        });
    }

    private TypeNode blockType(BlockInsnNode block) {
        if (!block.blockType.isValtype() && !block.blockType.isEmpty()) {
            type(block.blockType.getTypeIndex());
        }
        return block.blockType.expand(module.types);
    }
}
