package io.github.eutro.durawasm.embed;

import io.github.eutro.durawasm.ValType;

/**
 * An element segment instance. Dropping it empties it.
 */
public final class ElemSegment {
    private static final Value[] EMPTY = new Value[0];

    private final ValType type;
    private Value[] elements;

    ElemSegment(ValType type, Value[] elements) {
        this.type = type;
        this.elements = elements;
    }

    public ValType getType() {
        return type;
    }

    public Value[] getElements() {
        return elements;
    }

    public boolean isDropped() {
        return elements.length == 0;
    }

    public void drop() {
        elements = EMPTY;
    }
}
