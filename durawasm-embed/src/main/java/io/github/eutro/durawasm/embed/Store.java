package io.github.eutro.durawasm.embed;

import io.github.eutro.durawasm.tree.TypeNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * The store owns every function, table, memory, global and segment instance, and every module instance,
 * of a set of modules. Everything else refers to them by address, their index in the store.
 * <p>
 * The store only ever grows. Addresses are allocated in order, so two stores that see the same sequence of
 * allocations give out the same addresses.
 */
public final class Store {
    private static final Logger LOGGER = LogManager.getLogger();

    /**
     * The default maximum number of nested WebAssembly frames.
     */
    public static final int DEFAULT_MAX_CALL_DEPTH = 2048;

    private final List<Func> funcs = new ArrayList<>();
    private final List<Table> tables = new ArrayList<>();
    private final List<Memory> mems = new ArrayList<>();
    private final List<Global> globals = new ArrayList<>();
    private final List<ElemSegment> elems = new ArrayList<>();
    private final List<DataSegment> datas = new ArrayList<>();
    private final List<ModuleInstance> instances = new ArrayList<>();
    private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;

    private Store() {
    }

    @Embedding("store_init")
    public static Store init() {
        return new Store();
    }

    public int getMaxCallDepth() {
        return maxCallDepth;
    }

    /**
     * Set the maximum number of nested WebAssembly frames. Calls that would go deeper trap.
     *
     * @param maxCallDepth The new maximum, at least 1.
     */
    public void setMaxCallDepth(int maxCallDepth) {
        if (maxCallDepth < 1) throw new IllegalArgumentException("Max call depth must be positive");
        this.maxCallDepth = maxCallDepth;
    }

    private static <T> T lookup(List<T> list, int addr, String what) {
        if (addr < 0 || addr >= list.size()) {
            throw new IllegalArgumentException("Unknown " + what + " address " + addr);
        }
        return list.get(addr);
    }

    public Func func(int addr) {
        return lookup(funcs, addr, "function");
    }

    public Table table(int addr) {
        return lookup(tables, addr, "table");
    }

    public Memory memory(int addr) {
        return lookup(mems, addr, "memory");
    }

    public Global global(int addr) {
        return lookup(globals, addr, "global");
    }

    public ElemSegment elem(int addr) {
        return lookup(elems, addr, "element segment");
    }

    public DataSegment data(int addr) {
        return lookup(datas, addr, "data segment");
    }

    public ModuleInstance instance(int id) {
        return lookup(instances, id, "module instance");
    }

    public int funcCount() {
        return funcs.size();
    }

    public int tableCount() {
        return tables.size();
    }

    public int memCount() {
        return mems.size();
    }

    public int globalCount() {
        return globals.size();
    }

    public int elemCount() {
        return elems.size();
    }

    public int dataCount() {
        return datas.size();
    }

    public int instanceCount() {
        return instances.size();
    }

    int allocFunc(Func func) {
        funcs.add(func);
        return funcs.size() - 1;
    }

    int allocTable(Table table) {
        tables.add(table);
        return tables.size() - 1;
    }

    int allocMemory(Memory memory) {
        mems.add(memory);
        return mems.size() - 1;
    }

    int allocGlobal(Global global) {
        globals.add(global);
        return globals.size() - 1;
    }

    int allocElem(ElemSegment elem) {
        elems.add(elem);
        return elems.size() - 1;
    }

    int allocData(DataSegment data) {
        datas.add(data);
        return datas.size() - 1;
    }

    ModuleInstance allocInstance(Module module) {
        ModuleInstance instance = new ModuleInstance(instances.size(), module);
        instances.add(instance);
        LOGGER.debug("Allocated module instance {}", instance.getId());
        return instance;
    }

    /**
     * Allocate a host function.
     *
     * @param module The module name it is reported under when it suspends execution.
     * @param name   The name it is reported under when it suspends execution.
     * @param type   The function type.
     * @param impl   The implementation, or null to suspend execution whenever it is called.
     * @return The new function.
     */
    @Embedding("func_alloc")
    public ExternVal allocHostFunc(String module, String name, TypeNode type, @Nullable HostFunction impl) {
        return ExternVal.func(allocFunc(new Func.HostFunc(module, name, type, impl)));
    }

    public ExternVal allocHostFunc(TypeNode type, @NotNull HostFunction impl) {
        return allocHostFunc("", "", type, impl);
    }

    @Embedding("table_alloc")
    public ExternVal allocTable(ExternType.Table type, Value init) {
        return ExternVal.table(allocTable(new Table(type, init)));
    }

    @Embedding("mem_alloc")
    public ExternVal allocMemory(ExternType.Mem type) {
        return ExternVal.mem(allocMemory(new Memory(type)));
    }

    @Embedding("global_alloc")
    public ExternVal allocGlobal(ExternType.Global type, Value value) {
        return ExternVal.global(allocGlobal(new Global(type, value)));
    }

    /**
     * Get the current type of an external value.
     *
     * @param val The external value.
     * @return Its type.
     * @throws IllegalArgumentException If the address is not in this store.
     */
    public ExternType typeOf(ExternVal val) {
        switch (val.getKind()) {
            case FUNC:
                return new ExternType.Func(func(val.getAddr()).getType());
            case TABLE:
                return table(val.getAddr()).getType();
            case MEM:
                return memory(val.getAddr()).getType();
            case GLOBAL:
                return global(val.getAddr()).getType();
            default:
                throw new AssertionError();
        }
    }
}
