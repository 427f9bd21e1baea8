package io.github.eutro.durawasm.tree;

import io.github.eutro.durawasm.Opcodes;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A decoded WebAssembly module.
 * <p>
 * In every index space, imported items come before the items defined by the module.
 * The helpers on this class resolve an index in such a space to its declared type.
 */
public class ModuleNode {
    public final List<TypeNode> types = new ArrayList<>();
    public final List<ImportNode> imports = new ArrayList<>();
    public final List<FuncNode> funcs = new ArrayList<>();
    public final List<TableNode> tables = new ArrayList<>();
    public final List<MemoryNode> mems = new ArrayList<>();
    public final List<GlobalNode> globals = new ArrayList<>();
    public final List<ExportNode> exports = new ArrayList<>();
    public @Nullable Integer start;
    public final List<ElementNode> elems = new ArrayList<>();
    public @Nullable Integer dataCount;
    public final List<CodeNode> codes = new ArrayList<>();
    public final List<DataNode> datas = new ArrayList<>();
    public final List<CustomNode> customs = new ArrayList<>();

    /**
     * Count the imports of a kind.
     *
     * @param kind One of the {@code IMPORTS_*} constants of {@link Opcodes}.
     * @return The number of imports of that kind.
     */
    public int importCount(byte kind) {
        int count = 0;
        for (ImportNode in : imports) {
            if (in.importType() == kind) count++;
        }
        return count;
    }

    private <T extends ImportNode> List<T> importsOf(byte kind, Class<T> clazz) {
        List<T> ret = new ArrayList<>();
        for (ImportNode in : imports) {
            if (in.importType() == kind) ret.add(clazz.cast(in));
        }
        return ret;
    }

    public int funcCount() {
        return importCount(Opcodes.IMPORTS_FUNC) + funcs.size();
    }

    public int tableCount() {
        return importCount(Opcodes.IMPORTS_TABLE) + tables.size();
    }

    public int memCount() {
        return importCount(Opcodes.IMPORTS_MEM) + mems.size();
    }

    public int globalCount() {
        return importCount(Opcodes.IMPORTS_GLOBAL) + globals.size();
    }

    /**
     * Get the type index of a function in the function index space.
     *
     * @param func The function index, which must be in bounds.
     * @return The index of its type.
     */
    public int funcTypeIndex(int func) {
        List<ImportNode.Func> imported = importsOf(Opcodes.IMPORTS_FUNC, ImportNode.Func.class);
        if (func < imported.size()) return imported.get(func).type;
        return funcs.get(func - imported.size()).type;
    }

    public TypeNode funcType(int func) {
        return types.get(funcTypeIndex(func));
    }

    public TableNode tableType(int table) {
        List<ImportNode.Table> imported = importsOf(Opcodes.IMPORTS_TABLE, ImportNode.Table.class);
        if (table < imported.size()) return imported.get(table).table;
        return tables.get(table - imported.size());
    }

    public MemoryNode memType(int mem) {
        List<ImportNode.Memory> imported = importsOf(Opcodes.IMPORTS_MEM, ImportNode.Memory.class);
        if (mem < imported.size()) return imported.get(mem).memory;
        return mems.get(mem - imported.size());
    }

    public GlobalTypeNode globalType(int global) {
        List<ImportNode.Global> imported = importsOf(Opcodes.IMPORTS_GLOBAL, ImportNode.Global.class);
        if (global < imported.size()) return imported.get(global).type;
        return globals.get(global - imported.size()).type;
    }
}
