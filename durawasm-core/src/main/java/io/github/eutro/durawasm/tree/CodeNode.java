package io.github.eutro.durawasm.tree;

import io.github.eutro.durawasm.ValType;

/**
 * An entry of the code section: declared locals, parameters excluded, and the body.
 */
public class CodeNode {
    public final ValType[] locals;
    public final ExprNode expr;
    public SourceLocation location;

    public CodeNode(ValType[] locals, ExprNode expr) {
        this.locals = locals;
        this.expr = expr;
    }
}
