package io.github.eutro.durawasm.embed;

import io.github.eutro.durawasm.analysis.ModuleValidator;
import io.github.eutro.durawasm.binary.ModuleReader;
import io.github.eutro.durawasm.embed.exec.ExecutionState;
import io.github.eutro.durawasm.embed.exec.Interpreter;
import io.github.eutro.durawasm.embed.exec.StepResult;
import io.github.eutro.durawasm.embed.exec.TrapException;
import io.github.eutro.durawasm.tree.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * A decoded WebAssembly module.
 * <p>
 * A module remembers the bytes it was decoded from, and is identified across processes by their SHA-256
 * {@link #getFingerprint() fingerprint}.
 */
public class Module {
    private static final Logger LOGGER = LogManager.getLogger();

    private final ModuleNode node;
    private final byte[] bytes;
    private boolean validated = false;
    private @Nullable String fingerprint;

    Module(ModuleNode node, byte[] bytes) {
        this.node = node;
        this.bytes = bytes;
    }

    /**
     * Decode a binary module from a byte array.
     *
     * @param bytes The byte array.
     * @return The decoded module
     * @throws io.github.eutro.durawasm.binary.MalformedModuleException If the bytes are not a well-formed module.
     */
    @Embedding("module_decode")
    public static Module decode(byte[] bytes) {
        byte[] copy = bytes.clone();
        ModuleNode node = ModuleReader.fromBytes(copy).read();
        return new Module(node, copy);
    }

    /**
     * Get the decoded module. It must not be mutated.
     *
     * @return The module node.
     */
    public ModuleNode getNode() {
        return node;
    }

    /**
     * Validate the module, throwing an exception if the module is invalid.
     * <p>
     * This is idempotent, and will not run validation again if the module has already been validated.
     *
     * @throws io.github.eutro.durawasm.analysis.ValidationException If the module is invalid.
     */
    @Embedding("module_validate")
    public void validate() {
        if (!validated) {
            ModuleValidator.validate(node);
            validated = true;
        }
    }

    /**
     * @return The lowercase hex SHA-256 digest of the module's bytes.
     */
    public String getFingerprint() {
        if (fingerprint == null) {
            byte[] digest;
            try {
                digest = MessageDigest.getInstance("SHA-256").digest(bytes);
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("SHA-256 is unavailable", e);
            }
            Formatter fmt = new Formatter(Locale.ROOT);
            for (byte b : digest) {
                fmt.format("%02x", b);
            }
            fingerprint = fmt.toString();
        }
        return fingerprint;
    }

    /**
     * Instantiate the module in the given store with the provided values for imports.
     * <p>
     * The imports must be in the same order as those returned for {@link #imports()}.
     *
     * @param store   The store.
     * @param imports The supplied imports.
     * @return The instantiated module.
     * @throws LinkException If the imports do not match, a segment does not fit, or the start function fails.
     */
    @Embedding("module_instantiate")
    public ModuleInstance instantiate(Store store, ExternVal[] imports) {
        validate();

        List<Import> declaredImports = imports();
        if (declaredImports.size() != imports.length) {
            throw new LinkException(String.format("Import lengths mismatch, got: %d, expected: %s",
                    imports.length,
                    declaredImports));
        }
        for (int i = 0; i < imports.length; i++) {
            Import declared = declaredImports.get(i);
            if (imports[i] == null) {
                throw new LinkException("Import " + declared + " was not provided");
            }
            ExternType actual;
            try {
                actual = store.typeOf(imports[i]);
            } catch (IllegalArgumentException e) {
                throw new LinkException("Import " + declared + " is not in the store", e);
            }
            if (!declared.type.assignableFrom(actual)) {
                throw new LinkException(String.format("Import type mismatch for %s, got: %s", declared, actual));
            }
        }

        ModuleInstance instance = store.allocInstance(this);
        int funcs = 0, tables = 0, mems = 0, globals = 0;
        for (ExternVal im : imports) {
            switch (im.getKind()) {
                case FUNC:
                    instance.funcAddrs[funcs++] = im.getAddr();
                    break;
                case TABLE:
                    instance.tableAddrs[tables++] = im.getAddr();
                    break;
                case MEM:
                    instance.memAddrs[mems++] = im.getAddr();
                    break;
                case GLOBAL:
                    instance.globalAddrs[globals++] = im.getAddr();
                    break;
            }
        }

        for (int i = 0; i < node.funcs.size(); i++) {
            int index = funcs + i;
            instance.funcAddrs[index] = store.allocFunc(
                    new Func.ModuleFunc(instance, index, node.funcType(index), node.codes.get(i)));
        }
        try {
            for (TableNode table : node.tables) {
                instance.tableAddrs[tables++] = store.allocTable(
                        new Table(new ExternType.Table(table), Value.nullRef(table.type)));
            }
            for (MemoryNode memory : node.mems) {
                instance.memAddrs[mems++] = store.allocMemory(new Memory(memory.limits.min, memory.limits.max));
            }
        } catch (IllegalArgumentException | OutOfMemoryError e) {
            throw new LinkException("Could not allocate module state: " + e.getMessage(), e);
        }

        ConstantEvaluator evaluator = new ConstantEvaluator(store, instance);
        for (GlobalNode global : node.globals) {
            instance.globalAddrs[globals++] = store.allocGlobal(
                    new Global(new ExternType.Global(global.type), evaluator.evaluate(global.init)));
        }

        for (ExportNode export : node.exports) {
            ExternType.Kind kind = ExternType.Kind.fromByte(export.type);
            int addr;
            switch (kind) {
                case FUNC:
                    addr = instance.funcAddrs[export.index];
                    break;
                case TABLE:
                    addr = instance.tableAddrs[export.index];
                    break;
                case MEM:
                    addr = instance.memAddrs[export.index];
                    break;
                default:
                    addr = instance.globalAddrs[export.index];
                    break;
            }
            instance.exports.put(export.name, new ExternVal(kind, addr));
        }

        for (int i = 0; i < node.elems.size(); i++) {
            ElementNode elem = node.elems.get(i);
            Value[] elements = new Value[elem.init.size()];
            for (int j = 0; j < elements.length; j++) {
                elements[j] = evaluator.evaluate(elem.init.get(j));
            }
            instance.elemAddrs[i] = store.allocElem(new ElemSegment(elem.type, elements));
        }
        for (int i = 0; i < node.datas.size(); i++) {
            instance.dataAddrs[i] = store.allocData(new DataSegment(node.datas.get(i).init));
        }

        for (int i = 0; i < node.elems.size(); i++) {
            ElementNode elem = node.elems.get(i);
            ElemSegment segment = store.elem(instance.elemAddrs[i]);
            if (elem.mode == ElementNode.Mode.ACTIVE) {
                int offset = evaluator.evaluate(Objects.requireNonNull(elem.offset)).asI32();
                Value[] elements = segment.getElements();
                try {
                    store.table(instance.tableAddrs[elem.table]).init(offset, elements, 0, elements.length);
                } catch (TrapException e) {
                    throw new LinkException("Element segment " + i + " does not fit its table: " + e.getMessage(), e);
                }
            }
            if (elem.mode != ElementNode.Mode.PASSIVE) segment.drop();
        }
        for (int i = 0; i < node.datas.size(); i++) {
            DataNode data = node.datas.get(i);
            if (!data.active) continue;
            DataSegment segment = store.data(instance.dataAddrs[i]);
            int offset = evaluator.evaluate(Objects.requireNonNull(data.offset)).asI32();
            byte[] init = segment.getBytes();
            try {
                store.memory(instance.memAddrs[data.memory]).init(offset, init, 0, init.length);
            } catch (TrapException e) {
                throw new LinkException("Data segment " + i + " does not fit its memory: " + e.getMessage(), e);
            }
            segment.drop();
        }

        if (node.start != null) {
            ExecutionState state = ExecutionState.invoke(store, instance.funcAddr(node.start));
            StepResult result = Interpreter.run(state, store);
            if (result instanceof StepResult.Trap) {
                throw new LinkException("Start function trapped: " + ((StepResult.Trap) result).getMessage());
            } else if (result instanceof StepResult.AwaitHost) {
                throw new LinkException("Start function may not suspend, it called "
                        + ((StepResult.AwaitHost) result).getCall());
            }
        }

        LOGGER.debug("Instantiated module {} as instance {}", getFingerprint(), instance.getId());
        return instance;
    }

    /**
     * Instantiate the module in the given store with the provided function for looking up imports.
     *
     * @param store   The store.
     * @param imports The import resolving function.
     * @return The instantiated module.
     */
    public ModuleInstance instantiate(Store store, BiFunction<String, String, ExternVal> imports) {
        List<Import> myImports = imports();
        ExternVal[] importList = new ExternVal[myImports.size()];
        int i = 0;
        for (Import theImport : myImports) {
            importList[i++] = imports.apply(theImport.module, theImport.name);
        }
        return instantiate(store, importList);
    }

    /**
     * Instantiate the module in the given store with the provided function for looking up modules to import from.
     *
     * @param store   The store.
     * @param modules The function for looking up module instances.
     * @return The instantiated module.
     */
    public ModuleInstance instantiate(Store store, Function<String, ModuleInstance> modules) {
        return instantiate(store, (module, name) -> {
            ModuleInstance instance = modules.apply(module);
            if (instance == null) throw new LinkException(String.format("Module '%s' not provided", module));
            ExternVal value = instance.getExport(name);
            if (value == null) {
                throw new LinkException(String.format("Module '%s' does not provide anything named '%s'", module, name));
            }
            return value;
        });
    }

    /**
     * Get the imports that this module requires.
     *
     * @return The list of imports.
     */
    @Embedding("module_imports")
    public List<Import> imports() {
        validate();
        List<Import> ims = new ArrayList<>();
        for (ImportNode iNode : node.imports) {
            ims.add(new Import(
                    iNode.module,
                    iNode.name,
                    ExternType.fromImport(iNode, node)
            ));
        }
        return ims;
    }

    /**
     * Get the exports that this module supplies.
     *
     * @return The list of exports.
     */
    @Embedding("module_exports")
    public List<Export> exports() {
        validate();
        List<Export> exs = new ArrayList<>();
        for (ExportNode export : node.exports) {
            ExternType.Kind kind = ExternType.Kind.fromByte(export.type);
            exs.add(new Export(export.name, ExternType.getLocal(node, kind, export.index)));
        }
        return exs;
    }
}
