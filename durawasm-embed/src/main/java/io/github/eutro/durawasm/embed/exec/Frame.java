package io.github.eutro.durawasm.embed.exec;

import io.github.eutro.durawasm.embed.ModuleInstance;
import io.github.eutro.durawasm.embed.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An activation of a module function: its locals, and its stack of labels, the function body at the bottom.
 */
public final class Frame {
    private final int funcAddr;
    private final ModuleInstance instance;
    final Value[] locals;
    private final int arity;
    final ArrayList<Label> labels;

    public Frame(int funcAddr, ModuleInstance instance, Value[] locals, int arity, List<Label> labels) {
        this.funcAddr = funcAddr;
        this.instance = instance;
        this.locals = locals;
        this.arity = arity;
        this.labels = new ArrayList<>(labels);
    }

    public int getFuncAddr() {
        return funcAddr;
    }

    public ModuleInstance getInstance() {
        return instance;
    }

    public Value[] getLocals() {
        return locals.clone();
    }

    /**
     * @return The number of results of the function.
     */
    public int getArity() {
        return arity;
    }

    public List<Label> getLabels() {
        return Collections.unmodifiableList(labels);
    }

    Label topLabel() {
        return labels.get(labels.size() - 1);
    }
}
