package io.github.eutro.durawasm.embed;

import io.github.eutro.durawasm.Opcodes;
import io.github.eutro.durawasm.ValType;
import io.github.eutro.durawasm.tree.*;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * The type of an external value: something a module can import or export.
 */
public interface ExternType {
    /**
     * Whether a value of type {@code other} may be supplied where this type is expected.
     *
     * @param other The type of the supplied value.
     * @return Whether it matches.
     */
    boolean assignableFrom(ExternType other);

    Kind getKind();

    static ExternType getLocal(ModuleNode module, Kind kind, int index) {
        switch (kind) {
            case FUNC:
                return new Func(module.funcType(index));
            case TABLE:
                return new Table(module.tableType(index));
            case MEM:
                return new Mem(module.memType(index).limits);
            case GLOBAL:
                return new Global(module.globalType(index));
            default:
                throw new AssertionError();
        }
    }

    static ExternType fromImport(ImportNode in, ModuleNode module) {
        Kind kind = Kind.fromByte(in.importType());
        switch (kind) {
            case FUNC:
                return new Func(module.types.get(((ImportNode.Func) in).type));
            case TABLE:
                return new Table(((ImportNode.Table) in).table);
            case MEM:
                return new Mem(((ImportNode.Memory) in).memory.limits);
            case GLOBAL:
                return new Global(((ImportNode.Global) in).type);
            default:
                throw new AssertionError();
        }
    }

    final class Func implements ExternType {
        @NotNull
        public final TypeNode type;

        public Func(@NotNull TypeNode type) {
            this.type = type;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return type.equals(((Func) o).type);
        }

        @Override
        public int hashCode() {
            return type.hashCode();
        }

        @Override
        public String toString() {
            return "(func " + type + ")";
        }

        @Override
        public boolean assignableFrom(ExternType other) {
            return equals(other);
        }

        @Override
        public Kind getKind() {
            return Kind.FUNC;
        }
    }

    final class Table implements ExternType {
        @NotNull
        public final Limits limits;
        public final ValType refType;

        public Table(@NotNull Limits limits, ValType refType) {
            this.limits = limits;
            this.refType = refType;
        }

        public Table(TableNode tableNode) {
            this(tableNode.limits, tableNode.type);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Table table = (Table) o;
            return refType == table.refType && limits.equals(table.limits);
        }

        @Override
        public int hashCode() {
            return Objects.hash(limits, refType);
        }

        @Override
        public boolean assignableFrom(ExternType other) {
            if (!(other instanceof Table)) return false;
            Table oTable = (Table) other;
            return refType == oTable.refType
                    && limits.assignableFrom(oTable.limits);
        }

        @Override
        public Kind getKind() {
            return Kind.TABLE;
        }

        @Override
        public String toString() {
            return "(table " + limits + " " + refType + ")";
        }
    }

    final class Mem implements ExternType {
        @NotNull
        public final Limits limits;

        public Mem(@NotNull Limits limits) {
            this.limits = limits;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return limits.equals(((Mem) o).limits);
        }

        @Override
        public int hashCode() {
            return limits.hashCode();
        }

        @Override
        public String toString() {
            return "(memory " + limits + ")";
        }

        @Override
        public boolean assignableFrom(ExternType other) {
            return other instanceof Mem
                    && limits.assignableFrom(((Mem) other).limits);
        }

        @Override
        public Kind getKind() {
            return Kind.MEM;
        }
    }

    final class Global implements ExternType {
        @NotNull
        public final GlobalTypeNode type;

        public Global(@NotNull GlobalTypeNode type) {
            this.type = type;
        }

        public Global(boolean isMut, ValType type) {
            this(new GlobalTypeNode(isMut, type));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return type.equals(((Global) o).type);
        }

        @Override
        public int hashCode() {
            return type.hashCode();
        }

        @Override
        public String toString() {
            return "(global " + type + ")";
        }

        @Override
        public boolean assignableFrom(ExternType other) {
            return equals(other);
        }

        @Override
        public Kind getKind() {
            return Kind.GLOBAL;
        }
    }

    enum Kind {
        FUNC,
        TABLE,
        MEM,
        GLOBAL,
        ;

        public static Kind fromByte(byte id) {
            switch (id) {
                case Opcodes.IMPORTS_FUNC:
                    return FUNC;
                case Opcodes.IMPORTS_TABLE:
                    return TABLE;
                case Opcodes.IMPORTS_MEM:
                    return MEM;
                case Opcodes.IMPORTS_GLOBAL:
                    return GLOBAL;
                default:
                    throw new IllegalArgumentException(String.format("Unknown extern kind 0x%02x", id));
            }
        }
    }
}
