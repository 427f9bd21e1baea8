package io.github.eutro.durawasm.tree;

public class MemoryNode {
    public final Limits limits;

    public MemoryNode(Limits limits) {
        this.limits = limits;
    }
}
