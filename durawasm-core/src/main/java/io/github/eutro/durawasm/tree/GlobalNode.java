package io.github.eutro.durawasm.tree;

public class GlobalNode {
    public final GlobalTypeNode type;
    public final ExprNode init;

    public GlobalNode(GlobalTypeNode type, ExprNode init) {
        this.type = type;
        this.init = init;
    }
}
