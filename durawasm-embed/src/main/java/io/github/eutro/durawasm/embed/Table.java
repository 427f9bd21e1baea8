package io.github.eutro.durawasm.embed;

import io.github.eutro.durawasm.ValType;
import io.github.eutro.durawasm.embed.exec.TrapException;
import io.github.eutro.durawasm.embed.exec.TrapKind;
import io.github.eutro.durawasm.tree.Limits;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * A table instance, holding references in an array.
 * <p>
 * Indices are unsigned. Any access outside the table traps.
 */
public final class Table {
    /**
     * The maximum number of elements in the table, or null if unbounded.
     */
    private final @Nullable Integer max;
    /**
     * The component type of the table.
     */
    private final ValType componentType;
    private Value[] values;

    /**
     * Construct a table with the given limits and component type, filled with an initial value.
     *
     * @param min           The minimum number of elements in the table.
     * @param max           The maximum number of elements in the table, or null if unbounded.
     * @param componentType The component type of the table.
     * @param init          The initial value of every element.
     */
    public Table(int min, @Nullable Integer max, ValType componentType, Value init) {
        if (!componentType.isReference()) throw new IllegalArgumentException("Not a reference type: " + componentType);
        if (min < 0) throw new IllegalArgumentException("Cannot allocate " + Integer.toUnsignedString(min) + " elements");
        this.max = max;
        this.componentType = componentType;
        this.values = new Value[min];
        Arrays.fill(values, checkValue(init));
    }

    public Table(ExternType.Table type, Value init) {
        this(type.limits.min, type.limits.max, type.refType, init);
    }

    private Value checkValue(Value value) {
        if (value.getType() != componentType) {
            throw new IllegalArgumentException("Expected a " + componentType + ", got " + value);
        }
        return value;
    }

    private void checkRange(int start, int len, int size) {
        if (Integer.toUnsignedLong(start) + Integer.toUnsignedLong(len) > size) {
            throw new TrapException(TrapKind.TABLE_OUT_OF_BOUNDS);
        }
    }

    public Value get(int index) {
        checkRange(index, 1, values.length);
        return values[index];
    }

    public void set(int index, Value value) {
        checkValue(value);
        checkRange(index, 1, values.length);
        values[index] = value;
    }

    public int size() {
        return values.length;
    }

    public ValType getComponentType() {
        return componentType;
    }

    public @Nullable Integer getMax() {
        return max;
    }

    /**
     * Grow the table by a number of elements, filling it with the given value.
     * <p>
     * Fails, returning -1, if the maximum would be exceeded or memory is short.
     *
     * @param growBy   The unsigned number of elements to grow by.
     * @param fillWith The value to fill new elements with.
     * @return The old size of the table, or -1.
     */
    public int grow(int growBy, Value fillWith) {
        checkValue(fillWith);
        if (growBy < 0) {
            return -1;
        }
        int sz = values.length;
        long newSize = (long) sz + growBy;
        if (newSize > Integer.MAX_VALUE || (max != null && newSize > Integer.toUnsignedLong(max))) {
            return -1;
        }
        Value[] newValues;
        try {
            newValues = Arrays.copyOf(values, (int) newSize);
        } catch (OutOfMemoryError ignored) {
            return -1;
        }
        Arrays.fill(newValues, sz, (int) newSize, fillWith);
        values = newValues;
        return sz;
    }

    public void fill(int dstIdx, Value value, int len) {
        checkValue(value);
        checkRange(dstIdx, len, values.length);
        Arrays.fill(values, dstIdx, dstIdx + len, value);
    }

    /**
     * Copy elements between tables, which may be the same table with overlapping ranges.
     */
    public static void copy(Table dst, int dstIdx, Table src, int srcIdx, int len) {
        src.checkRange(srcIdx, len, src.values.length);
        dst.checkRange(dstIdx, len, dst.values.length);
        System.arraycopy(src.values, srcIdx, dst.values, dstIdx, len);
    }

    /**
     * Initialise a range of the table from an element segment.
     *
     * @param dstIdx The index in the table to start at.
     * @param data   The segment's elements.
     * @param srcIdx The index in the segment to start at.
     * @param len    The number of elements to copy.
     */
    public void init(int dstIdx, Value[] data, int srcIdx, int len) {
        checkRange(srcIdx, len, data.length);
        checkRange(dstIdx, len, values.length);
        System.arraycopy(data, srcIdx, values, dstIdx, len);
    }

    /**
     * @return A copy of the elements.
     */
    public Value[] elements() {
        return values.clone();
    }

    /**
     * Replace every element, resizing the table, as when restoring an image of a store.
     *
     * @param elements The new elements.
     */
    public void overwrite(Value[] elements) {
        if (max != null && Integer.toUnsignedLong(elements.length) > Integer.toUnsignedLong(max)) {
            throw new IllegalArgumentException("Table image exceeds maximum size");
        }
        for (Value element : elements) checkValue(element);
        values = elements.clone();
    }

    @NotNull
    public ExternType.Table getType() {
        return new ExternType.Table(new Limits(size(), max), componentType);
    }
}
