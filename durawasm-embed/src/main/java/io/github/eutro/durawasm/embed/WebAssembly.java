package io.github.eutro.durawasm.embed;

import io.github.eutro.durawasm.Opcodes;
import io.github.eutro.durawasm.embed.exec.ExecutionState;
import io.github.eutro.durawasm.embed.exec.Interpreter;
import io.github.eutro.durawasm.embed.exec.StepResult;
import io.github.eutro.durawasm.tree.TypeNode;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A direct implementation of the WebAssembly embedding entry-points as defined in the
 * <a href="https://webassembly.github.io/spec/core/appendix/embedding.html">embedding section</a>
 * of the specification.
 * <p>
 * Externs are passed around as {@link ExternVal addresses} into the {@link Store}, which is why every operation
 * takes the store.
 * <p>
 * Clients do <em>not</em> need to use this class, and are free to directly invoke
 * the more convenient and granular methods and constructors of the relevant classes themselves.
 */
public class WebAssembly {
    private int maxCallDepth = Store.DEFAULT_MAX_CALL_DEPTH;

    /**
     * Set the call depth limit of stores created by this embedding instance.
     *
     * @param maxCallDepth The most frames an execution may hold.
     * @see Store#setMaxCallDepth(int)
     */
    public void setMaxCallDepth(int maxCallDepth) {
        if (maxCallDepth < 1) throw new IllegalArgumentException("Call depth limit must be positive");
        this.maxCallDepth = maxCallDepth;
    }

    /**
     * Returns a new empty store.
     *
     * @return The new store.
     * @see Store#init()
     */
    @Embedding("store_init")
    public Store storeInit() {
        Store store = Store.init();
        store.setMaxCallDepth(maxCallDepth);
        return store;
    }

    /**
     * Decode a binary module from a byte array.
     *
     * @param bytes The byte array.
     * @return The decoded module
     * @see Module#decode(byte[])
     */
    @Embedding("module_decode")
    public Module moduleDecode(byte[] bytes) {
        return Module.decode(bytes);
    }

    /**
     * Validate the module, throwing an exception if the module is invalid.
     * <p>
     * This is idempotent, and will not run validation again if the module has already been validated.
     *
     * @param module The module to validate.
     * @see Module#validate()
     */
    @Embedding("module_validate")
    public void moduleValidate(Module module) {
        module.validate();
    }

    /**
     * Instantiate the module in the given store with the provided values for imports.
     * <p>
     * The imports must be in the same order as those returned for {@link Module#imports()}.
     *
     * @param store   The store.
     * @param module  The module to instantiate.
     * @param imports The supplied imports.
     * @return The instantiated module.
     * @see Module#instantiate(Store, ExternVal[])
     */
    @Embedding("module_instantiate")
    public ModuleInstance moduleInstantiate(Store store, Module module, ExternVal[] imports) {
        return module.instantiate(store, imports);
    }

    /**
     * Get the imports that the module requires.
     *
     * @param module The module.
     * @return The list of imports.
     * @see Module#imports()
     */
    @Embedding("module_imports")
    public List<Import> moduleImports(Module module) {
        return module.imports();
    }

    /**
     * Get the exports that this module supplies.
     *
     * @param module The module.
     * @return The list of exports.
     * @see Module#exports()
     */
    @Embedding("module_exports")
    public List<Export> moduleExports(Module module) {
        return module.exports();
    }

    /**
     * Get a named export of the module instance.
     *
     * @param inst The module instance.
     * @param name The name of the export.
     * @return The export, or null if there is none by that name.
     * @see ModuleInstance#getExport(String)
     */
    @Embedding("instance_export")
    public @Nullable ExternVal instanceExport(ModuleInstance inst, String name) {
        return inst.getExport(name);
    }

    /**
     * Allocate a host function.
     *
     * @param store The store.
     * @param type  The function type.
     * @param impl  The implementation.
     * @return The allocated function.
     * @see Store#allocHostFunc(TypeNode, HostFunction)
     */
    @Embedding("func_alloc")
    public ExternVal funcAlloc(Store store, TypeNode type, HostFunction impl) {
        return store.allocHostFunc(type, impl);
    }

    /**
     * Get the type of a function extern.
     *
     * @param store The store.
     * @param func  The function.
     * @return The type of the function.
     */
    @Embedding("func_type")
    public TypeNode funcType(Store store, ExternVal func) {
        return store.func(addr(func, ExternType.Kind.FUNC)).getType();
    }

    /**
     * Invoke a function, running it until it returns, traps or waits on a host function.
     * <p>
     * Use {@link ExecutionState#invoke(Store, int, Value...)} directly to step or snapshot the execution.
     *
     * @param store The store.
     * @param func  The function.
     * @param args  The function arguments.
     * @return The outcome.
     * @see Interpreter#run(ExecutionState, Store)
     */
    @Embedding("func_invoke")
    public StepResult funcInvoke(Store store, ExternVal func, Value... args) {
        return Interpreter.run(ExecutionState.invoke(store, addr(func, ExternType.Kind.FUNC), args), store);
    }

    /**
     * Allocate a new table with the given type.
     *
     * @param store The store.
     * @param type  The table type.
     * @param init  The initial value of every element.
     * @return A new table.
     * @see Store#allocTable(ExternType.Table, Value)
     */
    @Embedding("table_alloc")
    public ExternVal tableAlloc(Store store, ExternType.Table type, Value init) {
        return store.allocTable(type, init);
    }

    /**
     * Get the type of a table extern.
     *
     * @param store The store.
     * @param table The table.
     * @return The table's type.
     * @see Table#getType()
     */
    @Embedding("table_type")
    public ExternType.Table tableType(Store store, ExternVal table) {
        return store.table(addr(table, ExternType.Kind.TABLE)).getType();
    }

    /**
     * Get an element of the table.
     *
     * @param store The store.
     * @param table The table.
     * @param i     The element index.
     * @return The element.
     * @see Table#get(int)
     */
    @Embedding("table_read")
    public Value tableRead(Store store, ExternVal table, int i) {
        return store.table(addr(table, ExternType.Kind.TABLE)).get(i);
    }

    /**
     * Set an element of the table.
     *
     * @param store The store.
     * @param table The table.
     * @param i     The element index.
     * @param value The element.
     * @see Table#set(int, Value)
     */
    @Embedding("table_write")
    public void tableWrite(Store store, ExternVal table, int i, Value value) {
        store.table(addr(table, ExternType.Kind.TABLE)).set(i, value);
    }

    /**
     * Get the size of a table.
     *
     * @param store The store.
     * @param table The table.
     * @return The size of the table.
     * @see Table#size()
     */
    @Embedding("table_size")
    public int tableSize(Store store, ExternVal table) {
        return store.table(addr(table, ExternType.Kind.TABLE)).size();
    }

    /**
     * Grow the table by a number of elements, filling it with the given value.
     * <p>
     * This operation is allowed to fail (and must fail if the upper limit is exceeded),
     * in which case -1 should be returned.
     *
     * @param store    The store.
     * @param table    The table.
     * @param growBy   The number of elements to grow by.
     * @param fillWith The value to fill new elements with.
     * @return The old size of the table.
     * @see Table#grow(int, Value)
     */
    @Embedding("table_grow")
    public int tableGrow(Store store, ExternVal table, int growBy, Value fillWith) {
        return store.table(addr(table, ExternType.Kind.TABLE)).grow(growBy, fillWith);
    }

    /**
     * Allocate a new memory with the given type.
     *
     * @param store The store.
     * @param type  The type.
     * @return The new memory.
     * @see Store#allocMemory(ExternType.Mem)
     */
    @Embedding("mem_alloc")
    public ExternVal memAlloc(Store store, ExternType.Mem type) {
        return store.allocMemory(type);
    }

    /**
     * Get the type of a memory.
     *
     * @param store  The store.
     * @param memory The memory.
     * @return The memory type.
     * @see Memory#getType()
     */
    @Embedding("mem_type")
    public ExternType.Mem memType(Store store, ExternVal memory) {
        return store.memory(addr(memory, ExternType.Kind.MEM)).getType();
    }

    /**
     * Read a single byte from a memory.
     *
     * @param store  The store.
     * @param memory The memory.
     * @param addr   The memory address.
     * @return The byte.
     * @see Memory#read(int)
     */
    @Embedding("mem_read")
    public byte memRead(Store store, ExternVal memory, int addr) {
        return store.memory(addr(memory, ExternType.Kind.MEM)).read(addr);
    }

    /**
     * Write a single byte to a memory.
     *
     * @param store  The store.
     * @param memory The memory.
     * @param addr   The memory address.
     * @param value  The byte.
     * @see Memory#write(int, byte)
     */
    @Embedding("mem_write")
    public void memWrite(Store store, ExternVal memory, int addr, byte value) {
        store.memory(addr(memory, ExternType.Kind.MEM)).write(addr, value);
    }

    /**
     * Get the size of the memory, in pages.
     *
     * @param store  The store.
     * @param memory The memory.
     * @return The size of the memory, in pages.
     * @see Memory#size()
     * @see Opcodes#PAGE_SIZE
     */
    @Embedding("mem_size")
    public int memSize(Store store, ExternVal memory) {
        return store.memory(addr(memory, ExternType.Kind.MEM)).size();
    }

    /**
     * Grow the memory by a number of pages, filling new pages with 0.
     * <p>
     * This operation is allowed to fail (and must fail if the upper limit is exceeded),
     * in which case -1 should be returned.
     *
     * @param store       The store.
     * @param memory      The memory.
     * @param growByPages The number of pages to grow by, interpreted as an unsigned integer.
     * @return The old size, or -1 if the memory was not grown.
     * @see Memory#grow(int)
     */
    @Embedding("mem_grow")
    public int memGrow(Store store, ExternVal memory, int growByPages) {
        return store.memory(addr(memory, ExternType.Kind.MEM)).grow(growByPages);
    }

    /**
     * Allocate a new global with the given type and value.
     *
     * @param store The store.
     * @param type  The type.
     * @param value The initial value.
     * @return The global.
     * @see Store#allocGlobal(ExternType.Global, Value)
     */
    @Embedding("global_alloc")
    public ExternVal globalAlloc(Store store, ExternType.Global type, Value value) {
        return store.allocGlobal(type, value);
    }

    /**
     * Get the type of a global.
     *
     * @param store  The store.
     * @param global The global.
     * @return The global type.
     * @see Global#getType()
     */
    @Embedding("global_type")
    public ExternType.Global globalType(Store store, ExternVal global) {
        return store.global(addr(global, ExternType.Kind.GLOBAL)).getType();
    }

    /**
     * Read the value of a global.
     *
     * @param store  The store.
     * @param global The global.
     * @return The value of the global.
     * @see Global#get()
     */
    @Embedding("global_read")
    public Value globalRead(Store store, ExternVal global) {
        return store.global(addr(global, ExternType.Kind.GLOBAL)).get();
    }

    /**
     * Write the value of a global.
     * <p>
     * Fails if the global is immutable.
     *
     * @param store  The store.
     * @param global The global.
     * @param value  The new value of the global.
     * @see Global#set(Value)
     */
    @Embedding("global_write")
    public void globalWrite(Store store, ExternVal global, Value value) {
        store.global(addr(global, ExternType.Kind.GLOBAL)).set(value);
    }

    private static int addr(ExternVal val, ExternType.Kind kind) {
        if (val.getKind() != kind) {
            throw new IllegalArgumentException("Expected a " + kind + " extern, got " + val);
        }
        return val.getAddr();
    }
}
