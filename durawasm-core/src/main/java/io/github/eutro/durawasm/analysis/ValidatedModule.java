package io.github.eutro.durawasm.analysis;

import io.github.eutro.durawasm.tree.ModuleNode;

/**
 * A module that has passed {@link ModuleValidator validation}, and so is safe to instantiate.
 */
public final class ValidatedModule {
    private final ModuleNode node;

    ValidatedModule(ModuleNode node) {
        this.node = node;
    }

    public ModuleNode getNode() {
        return node;
    }
}
