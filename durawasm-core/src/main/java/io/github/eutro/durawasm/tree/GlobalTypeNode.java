package io.github.eutro.durawasm.tree;

import io.github.eutro.durawasm.ValType;

import java.util.Objects;

public class GlobalTypeNode {
    public final boolean mutable;
    public final ValType type;

    public GlobalTypeNode(boolean mutable, ValType type) {
        this.mutable = mutable;
        this.type = type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GlobalTypeNode that = (GlobalTypeNode) o;
        return mutable == that.mutable && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mutable, type);
    }

    @Override
    public String toString() {
        return (mutable ? "mut" : "const") + " " + type;
    }
}
