package io.github.eutro.durawasm.embed.exec;

import io.github.eutro.durawasm.tree.ExprNode;

/**
 * An entered structured instruction, or a function body: the instruction sequence being executed and how far
 * through it execution is.
 * <p>
 * A label other than the function body records where it was entered from: the index of its block instruction
 * in the enclosing label's body, and which arm of an {@code if} it runs. This path from the function body is
 * what lets a snapshot find the body again.
 */
public final class Label {
    public enum Kind {
        FUNCTION,
        BLOCK,
        LOOP,
        IF,
    }

    private final Kind kind;
    private final int arity;
    private final int height;
    private final ExprNode body;
    private final int origin;
    private final boolean elseBranch;
    int cursor;

    /**
     * @param kind       What kind of label this is.
     * @param arity      The number of values a branch to this label carries. For loops these are the parameters.
     * @param height     The value stack height below the label's operands.
     * @param body       The instruction sequence.
     * @param origin     The index of the block instruction in the enclosing body, or -1 for a function body.
     * @param elseBranch Whether this is the else arm of an {@code if}.
     * @param cursor     The index of the next instruction to execute.
     */
    public Label(Kind kind, int arity, int height, ExprNode body, int origin, boolean elseBranch, int cursor) {
        this.kind = kind;
        this.arity = arity;
        this.height = height;
        this.body = body;
        this.origin = origin;
        this.elseBranch = elseBranch;
        this.cursor = cursor;
    }

    public Kind getKind() {
        return kind;
    }

    public int getArity() {
        return arity;
    }

    public int getHeight() {
        return height;
    }

    public ExprNode getBody() {
        return body;
    }

    public int getOrigin() {
        return origin;
    }

    public boolean isElseBranch() {
        return elseBranch;
    }

    public int getCursor() {
        return cursor;
    }

    @Override
    public String toString() {
        return kind + "@" + origin + (elseBranch ? "(else)" : "") + "[" + cursor + "/" + body.size() + "]";
    }
}
