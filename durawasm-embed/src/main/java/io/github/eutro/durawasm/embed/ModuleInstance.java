package io.github.eutro.durawasm.embed;

import io.github.eutro.durawasm.tree.TypeNode;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An instance of a module: the store addresses its index spaces resolve to, and its exports.
 */
public final class ModuleInstance {
    private final int id;
    private final Module module;
    final int[] funcAddrs;
    final int[] tableAddrs;
    final int[] memAddrs;
    final int[] globalAddrs;
    final int[] elemAddrs;
    final int[] dataAddrs;
    final Map<String, ExternVal> exports = new LinkedHashMap<>();

    ModuleInstance(int id, Module module) {
        this.id = id;
        this.module = module;
        funcAddrs = new int[module.getNode().funcCount()];
        tableAddrs = new int[module.getNode().tableCount()];
        memAddrs = new int[module.getNode().memCount()];
        globalAddrs = new int[module.getNode().globalCount()];
        elemAddrs = new int[module.getNode().elems.size()];
        dataAddrs = new int[module.getNode().datas.size()];
    }

    /**
     * @return The index of this instance in its store.
     */
    public int getId() {
        return id;
    }

    public Module getModule() {
        return module;
    }

    /**
     * Get a named export of the module instance.
     *
     * @param name The name of the export.
     * @return The export, or null if there is none with that name.
     */
    @Embedding("instance_export")
    @Nullable
    public ExternVal getExport(String name) {
        return exports.get(name);
    }

    public Map<String, ExternVal> getExports() {
        return Collections.unmodifiableMap(exports);
    }

    public TypeNode type(int index) {
        return module.getNode().types.get(index);
    }

    public int funcAddr(int index) {
        return funcAddrs[index];
    }

    public int tableAddr(int index) {
        return tableAddrs[index];
    }

    public int memAddr(int index) {
        return memAddrs[index];
    }

    public int globalAddr(int index) {
        return globalAddrs[index];
    }

    public int elemAddr(int index) {
        return elemAddrs[index];
    }

    public int dataAddr(int index) {
        return dataAddrs[index];
    }

    @Override
    public String toString() {
        return "instance " + id;
    }
}
