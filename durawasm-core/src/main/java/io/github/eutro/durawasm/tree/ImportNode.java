package io.github.eutro.durawasm.tree;

import io.github.eutro.durawasm.Opcodes;

/**
 * An import, one of the nested subclasses depending on its kind.
 */
public abstract class ImportNode {
    public final String module;
    public final String name;

    protected ImportNode(String module, String name) {
        this.module = module;
        this.name = name;
    }

    /**
     * @return One of the {@code IMPORTS_*} constants of {@link Opcodes}.
     */
    public abstract byte importType();

    public static class Func extends ImportNode {
        public final int type;

        public Func(String module, String name, int type) {
            super(module, name);
            this.type = type;
        }

        @Override
        public byte importType() {
            return Opcodes.IMPORTS_FUNC;
        }
    }

    public static class Table extends ImportNode {
        public final TableNode table;

        public Table(String module, String name, TableNode table) {
            super(module, name);
            this.table = table;
        }

        @Override
        public byte importType() {
            return Opcodes.IMPORTS_TABLE;
        }
    }

    public static class Memory extends ImportNode {
        public final MemoryNode memory;

        public Memory(String module, String name, MemoryNode memory) {
            super(module, name);
            this.memory = memory;
        }

        @Override
        public byte importType() {
            return Opcodes.IMPORTS_MEM;
        }
    }

    public static class Global extends ImportNode {
        public final GlobalTypeNode type;

        public Global(String module, String name, GlobalTypeNode type) {
            super(module, name);
            this.type = type;
        }

        @Override
        public byte importType() {
            return Opcodes.IMPORTS_GLOBAL;
        }
    }
}
