package io.github.eutro.durawasm.tree;

import io.github.eutro.durawasm.ValType;

import java.util.Arrays;

/**
 * A function type. Two types are equal when their parameter and result types are equal, which is what
 * {@code call_indirect} checks at run time.
 */
public class TypeNode {
    public final ValType[] params;
    public final ValType[] results;

    public TypeNode(ValType[] params, ValType[] results) {
        this.params = params;
        this.results = results;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypeNode typeNode = (TypeNode) o;
        return Arrays.equals(params, typeNode.params) && Arrays.equals(results, typeNode.results);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(params);
        result = 31 * result + Arrays.hashCode(results);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(func (param");
        for (ValType param : params) sb.append(' ').append(param);
        sb.append(") (result");
        for (ValType result : results) sb.append(' ').append(result);
        return sb.append("))").toString();
    }
}
