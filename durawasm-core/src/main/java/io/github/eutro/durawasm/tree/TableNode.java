package io.github.eutro.durawasm.tree;

import io.github.eutro.durawasm.ValType;

public class TableNode {
    public final Limits limits;
    public final ValType type;

    public TableNode(Limits limits, ValType type) {
        this.limits = limits;
        this.type = type;
    }
}
