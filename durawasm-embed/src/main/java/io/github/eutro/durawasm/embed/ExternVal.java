package io.github.eutro.durawasm.embed;

import java.util.Locale;

/**
 * A reference to a function, table, memory or global in a {@link Store}, by address.
 * <p>
 * External values are only meaningful for the store they were allocated in.
 */
public final class ExternVal {
    private final ExternType.Kind kind;
    private final int addr;

    public ExternVal(ExternType.Kind kind, int addr) {
        this.kind = kind;
        this.addr = addr;
    }

    public static ExternVal func(int addr) {
        return new ExternVal(ExternType.Kind.FUNC, addr);
    }

    public static ExternVal table(int addr) {
        return new ExternVal(ExternType.Kind.TABLE, addr);
    }

    public static ExternVal mem(int addr) {
        return new ExternVal(ExternType.Kind.MEM, addr);
    }

    public static ExternVal global(int addr) {
        return new ExternVal(ExternType.Kind.GLOBAL, addr);
    }

    public ExternType.Kind getKind() {
        return kind;
    }

    public int getAddr() {
        return addr;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExternVal that = (ExternVal) o;
        return addr == that.addr && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + addr;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + "@" + addr;
    }
}
