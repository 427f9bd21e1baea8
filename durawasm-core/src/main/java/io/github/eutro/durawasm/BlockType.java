package io.github.eutro.durawasm;

import io.github.eutro.durawasm.tree.TypeNode;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * The type of a structured instruction: empty, a single result type, or an index into the type section.
 */
public final class BlockType {
    public static final BlockType EMPTY = new BlockType(null, -1);

    private final @Nullable ValType valType;
    private final int typeIndex;

    private BlockType(@Nullable ValType valType, int typeIndex) {
        this.valType = valType;
        this.typeIndex = typeIndex;
    }

    public static BlockType valtype(ValType type) {
        return new BlockType(Objects.requireNonNull(type), -1);
    }

    public static BlockType functype(int typeIndex) {
        return new BlockType(null, typeIndex);
    }

    public boolean isEmpty() {
        return valType == null && typeIndex < 0;
    }

    public boolean isValtype() {
        return valType != null;
    }

    public @Nullable ValType getValType() {
        return valType;
    }

    public int getTypeIndex() {
        return typeIndex;
    }

    /**
     * Expand this block type into a function type against a module's type table.
     *
     * @param types The type table.
     * @return The function type.
     * @throws IndexOutOfBoundsException If the type index is out of bounds.
     */
    public TypeNode expand(List<TypeNode> types) {
        if (valType != null) return new TypeNode(new ValType[0], new ValType[]{valType});
        if (typeIndex < 0) return new TypeNode(new ValType[0], new ValType[0]);
        return types.get(typeIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BlockType that = (BlockType) o;
        return typeIndex == that.typeIndex && valType == that.valType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(valType, typeIndex);
    }

    @Override
    public String toString() {
        if (valType != null) return "(result " + valType + ")";
        if (typeIndex >= 0) return "(type " + typeIndex + ")";
        return "()";
    }
}
