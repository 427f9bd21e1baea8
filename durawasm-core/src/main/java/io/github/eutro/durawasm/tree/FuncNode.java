package io.github.eutro.durawasm.tree;

/**
 * An entry of the function section: the type index of a module-defined function.
 */
public class FuncNode {
    public final int type;

    public FuncNode(int type) {
        this.type = type;
    }
}
