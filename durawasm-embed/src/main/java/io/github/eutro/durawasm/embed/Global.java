package io.github.eutro.durawasm.embed;

import io.github.eutro.durawasm.tree.GlobalTypeNode;
import org.jetbrains.annotations.NotNull;

/**
 * A global instance, which stores its value directly.
 */
public final class Global {
    private final GlobalTypeNode type;
    private Value value;

    /**
     * Construct a global with the given type and initial value.
     *
     * @param type  The global type.
     * @param value The initial value.
     */
    public Global(ExternType.Global type, Value value) {
        this.type = type.type;
        this.value = checkValue(value);
    }

    private Value checkValue(Value value) {
        if (value.getType() != type.type) {
            throw new IllegalArgumentException("Expected a " + type.type + ", got " + value);
        }
        return value;
    }

    public Value get() {
        return value;
    }

    /**
     * Set the value of this global, if it is mutable.
     *
     * @param value The value.
     */
    public void set(Value value) {
        if (!type.mutable) throw new UnsupportedOperationException("Global is immutable");
        this.value = checkValue(value);
    }

    /**
     * Set the value regardless of mutability, as when restoring an image of a store.
     *
     * @param value The value.
     */
    public void overwrite(Value value) {
        this.value = checkValue(value);
    }

    @NotNull
    public ExternType.Global getType() {
        return new ExternType.Global(type);
    }
}
