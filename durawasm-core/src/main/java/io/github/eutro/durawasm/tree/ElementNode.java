package io.github.eutro.durawasm.tree;

import io.github.eutro.durawasm.ValType;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * An element segment. Segments encoded as plain function index vectors are normalised to
 * {@code ref.func} expressions.
 */
public class ElementNode {
    public enum Mode {
        PASSIVE,
        ACTIVE,
        DECLARATIVE,
    }

    public final Mode mode;
    public final int table;
    public final @Nullable ExprNode offset;
    public final ValType type;
    public final List<ExprNode> init;

    public ElementNode(Mode mode, int table, @Nullable ExprNode offset, ValType type, List<ExprNode> init) {
        this.mode = mode;
        this.table = table;
        this.offset = offset;
        this.type = type;
        this.init = init;
    }
}
