package io.github.eutro.durawasm.analysis;

import io.github.eutro.durawasm.Opcodes;
import io.github.eutro.durawasm.ValType;
import io.github.eutro.durawasm.tree.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static io.github.eutro.durawasm.analysis.ValidationException.Failure.*;

/**
 * Checks that a decoded module is valid, producing a {@link ValidatedModule}.
 */
public final class ModuleValidator {
    private static final Logger LOGGER = LogManager.getLogger();

    private ModuleValidator() {
    }

    /**
     * Validate a module.
     *
     * @param module The decoded module.
     * @return The validated module.
     * @throws ValidationException If the module is invalid.
     */
    public static ValidatedModule validate(ModuleNode module) {
        for (ImportNode in : module.imports) {
            switch (in.importType()) {
                case Opcodes.IMPORTS_FUNC:
                    checkType(module, ((ImportNode.Func) in).type);
                    break;
                case Opcodes.IMPORTS_TABLE:
                    checkTable(((ImportNode.Table) in).table);
                    break;
                case Opcodes.IMPORTS_MEM:
                    checkMemory(((ImportNode.Memory) in).memory);
                    break;
                default:
                    break;
            }
        }
        for (FuncNode func : module.funcs) checkType(module, func.type);
        for (TableNode table : module.tables) checkTable(table);
        for (MemoryNode memory : module.mems) checkMemory(memory);
        if (module.memCount() > 1) throw new ValidationException(INVALID, "multiple memories");

        Set<Integer> declaredRefs = new HashSet<>();
        int importedGlobals = module.importCount(Opcodes.IMPORTS_GLOBAL);
        for (int i = 0; i < module.globals.size(); i++) {
            GlobalNode global = module.globals.get(i);
            checkConstant(module, global.init, global.type.type, importedGlobals + i, declaredRefs);
        }

        Set<String> exportNames = new HashSet<>();
        for (ExportNode export : module.exports) {
            if (!exportNames.add(export.name)) {
                throw new ValidationException(INVALID, "duplicate export name '" + export.name + "'");
            }
            int bound;
            switch (export.type) {
                case Opcodes.IMPORTS_FUNC:
                    bound = module.funcCount();
                    break;
                case Opcodes.IMPORTS_TABLE:
                    bound = module.tableCount();
                    break;
                case Opcodes.IMPORTS_MEM:
                    bound = module.memCount();
                    break;
                default:
                    bound = module.globalCount();
                    break;
            }
            if (export.index < 0 || export.index >= bound) {
                throw new ValidationException(UNKNOWN_INDEX, "unknown export index " + Integer.toUnsignedString(export.index));
            }
            if (export.type == Opcodes.IMPORTS_FUNC) declaredRefs.add(export.index);
        }

        if (module.start != null) {
            int start = module.start;
            if (start < 0 || start >= module.funcCount()) {
                throw new ValidationException(UNKNOWN_INDEX, "unknown start function " + Integer.toUnsignedString(start));
            }
            TypeNode type = module.funcType(start);
            if (type.params.length != 0 || type.results.length != 0) {
                throw new ValidationException(INVALID, "start function must have type [] -> []");
            }
        }

        int allGlobals = module.globalCount();
        for (ElementNode elem : module.elems) {
            if (elem.mode == ElementNode.Mode.ACTIVE) {
                if (elem.table < 0 || elem.table >= module.tableCount()) {
                    throw new ValidationException(UNKNOWN_INDEX, "unknown table " + Integer.toUnsignedString(elem.table));
                }
                ValType tableType = module.tableType(elem.table).type;
                if (tableType != elem.type) {
                    throw new ValidationException(TYPE_MISMATCH, "type mismatch: element segment of " + elem.type
                            + " for a table of " + tableType);
                }
                checkConstant(module, elem.offset, ValType.I32, allGlobals, declaredRefs);
            }
            for (ExprNode init : elem.init) {
                checkConstant(module, init, elem.type, allGlobals, declaredRefs);
            }
        }

        for (DataNode data : module.datas) {
            if (data.active) {
                if (data.memory != 0 || module.memCount() == 0) {
                    throw new ValidationException(UNKNOWN_INDEX, "unknown memory " + Integer.toUnsignedString(data.memory));
                }
                checkConstant(module, data.offset, ValType.I32, allGlobals, declaredRefs);
            }
        }

        int importedFuncs = module.importCount(Opcodes.IMPORTS_FUNC);
        for (int i = 0; i < module.codes.size(); i++) {
            int funcIndex = importedFuncs + i;
            new FunctionValidator(module, declaredRefs, funcIndex, module.funcType(funcIndex), module.codes.get(i))
                    .validate(module.codes.get(i).expr);
        }

        LOGGER.debug("Validated module with {} functions", module.funcCount());
        return new ValidatedModule(module);
    }

    private static void checkType(ModuleNode module, int type) {
        if (type < 0 || type >= module.types.size()) {
            throw new ValidationException(UNKNOWN_INDEX, "unknown type " + Integer.toUnsignedString(type));
        }
    }

    private static void checkLimits(Limits limits, long bound, String what) {
        if (Integer.toUnsignedLong(limits.min) > bound
                || (limits.max != null && Integer.toUnsignedLong(limits.max) > bound)) {
            throw new ValidationException(INVALID, what + " size must be at most " + bound);
        }
        if (limits.max != null && Integer.compareUnsigned(limits.min, limits.max) > 0) {
            throw new ValidationException(INVALID, "size minimum must not be greater than maximum");
        }
    }

    private static void checkTable(TableNode table) {
        checkLimits(table.limits, 0xFFFFFFFFL, "table");
    }

    private static void checkMemory(MemoryNode memory) {
        checkLimits(memory.limits, Opcodes.MAX_PAGES, "memory");
    }

    /**
     * Check that an expression is constant, and produces exactly one value of the expected type.
     *
     * @param visibleGlobals Only globals with a lower index may be read.
     */
    private static void checkConstant(ModuleNode module,
                                      ExprNode expr,
                                      ValType expected,
                                      int visibleGlobals,
                                      Set<Integer> declaredRefs) {
        List<ValType> stack = new ArrayList<>();
        for (AbstractInsnNode insn : expr) {
            switch (insn.opcode) {
                case Opcodes.I32_CONST:
                    stack.add(ValType.I32);
                    break;
                case Opcodes.I64_CONST:
                    stack.add(ValType.I64);
                    break;
                case Opcodes.F32_CONST:
                    stack.add(ValType.F32);
                    break;
                case Opcodes.F64_CONST:
                    stack.add(ValType.F64);
                    break;
                case Opcodes.REF_NULL:
                    stack.add(((NullInsnNode) insn).type);
                    break;
                case Opcodes.REF_FUNC: {
                    int function = ((FuncRefInsnNode) insn).function;
                    if (function < 0 || function >= module.funcCount()) {
                        throw new ValidationException(UNKNOWN_INDEX, "unknown function " + Integer.toUnsignedString(function));
                    }
                    declaredRefs.add(function);
                    stack.add(ValType.FUNCREF);
                    break;
                }
                case Opcodes.GLOBAL_GET: {
                    int global = ((VariableInsnNode) insn).variable;
                    if (global < 0 || global >= visibleGlobals) {
                        throw new ValidationException(UNKNOWN_INDEX, "unknown global " + Integer.toUnsignedString(global));
                    }
                    GlobalTypeNode type = module.globalType(global);
                    if (type.mutable) throw new ValidationException(INVALID, "constant expression required");
                    stack.add(type.type);
                    break;
                }
                default:
                    throw new ValidationException(INVALID, "constant expression required");
            }
        }
        if (stack.size() != 1 || stack.get(0) != expected) {
            throw new ValidationException(TYPE_MISMATCH, "type mismatch: constant expression must produce one " + expected);
        }
    }
}
