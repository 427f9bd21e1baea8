package io.github.eutro.durawasm.util;

import io.github.eutro.durawasm.Opcodes;
import io.github.eutro.durawasm.tree.AbstractInsnNode;
import io.github.eutro.durawasm.tree.PrefixInsnNode;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;

/**
 * A map from WebAssembly opcodes to values.
 * <p>
 * Values should not be null.
 *
 * @param <T> The type of value in the map.
 */
public class InsnMap<T> {
    /**
     * The mappings for single-byte opcodes.
     */
    @SuppressWarnings("unchecked")
    private final T[] singleOpcode = (T[]) new Object[256];
    /**
     * The mappings for {@link Opcodes#INSN_PREFIX}-prefixed instructions.
     */
    private final HashMap<Integer, T> prefixOpcode = new HashMap<>();

    /**
     * Get the mapping for the opcode of the given instruction.
     *
     * @param insn The instruction.
     * @return The mapping, or null if not present.
     */
    public T get(AbstractInsnNode insn) {
        if (insn instanceof PrefixInsnNode) {
            return getInt(((PrefixInsnNode) insn).intOpcode);
        } else {
            return getByte(insn.opcode);
        }
    }

    /**
     * Look up the mapping for a single-byte opcode.
     *
     * @param opcode The opcode.
     * @return The mapping, or null if not present.
     */
    public T getByte(byte opcode) {
        return singleOpcode[Byte.toUnsignedInt(opcode)];
    }

    /**
     * Look up the mapping for a {@link Opcodes#INSN_PREFIX}-prefixed opcode.
     *
     * @param opcode The tail of the opcode.
     * @return The mapping, or null if not present.
     */
    public T getInt(int opcode) {
        return prefixOpcode.get(opcode);
    }

    /**
     * Insert a mapping for the given single-byte opcode.
     *
     * @param opcode The opcode.
     * @param value  The mapping.
     */
    public void putByte(byte opcode, @NotNull T value) {
        singleOpcode[Byte.toUnsignedInt(opcode)] = value;
    }

    /**
     * Insert the same mapping for an array of opcodes.
     *
     * @param opcodes The opcodes.
     * @param value   The mapping.
     */
    public void putByte(byte[] opcodes, @NotNull T value) {
        for (byte opcode : opcodes) {
            putByte(opcode, value);
        }
    }

    /**
     * Insert a mapping for a {@link Opcodes#INSN_PREFIX}-prefixed opcode.
     *
     * @param opcode The tail of the opcode.
     * @param value  The mapping.
     */
    public void putInt(int opcode, @NotNull T value) {
        prefixOpcode.put(opcode, value);
    }

    /**
     * Insert the same mapping for an array of {@link Opcodes#INSN_PREFIX}-prefixed opcodes.
     *
     * @param opcodes The tails of the opcodes.
     * @param value   The mapping.
     */
    public void putInt(int[] opcodes, @NotNull T value) {
        for (int opcode : opcodes) {
            putInt(opcode, value);
        }
    }
}
