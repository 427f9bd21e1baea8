package io.github.eutro.durawasm;

import java.util.Locale;

/**
 * An enum that represents a WebAssembly value type, and gives its binary encoding.
 * <p>
 * The SIMD {@code v128} type is not supported.
 */
public enum ValType {
    I32(Opcodes.I32),
    I64(Opcodes.I64),
    F32(Opcodes.F32),
    F64(Opcodes.F64),
    FUNCREF(Opcodes.FUNCREF),
    EXTERNREF(Opcodes.EXTERNREF),
    ;

    private final byte opcode;

    ValType(byte opcode) {
        this.opcode = opcode;
    }

    /**
     * Look up a value type by its binary encoding.
     *
     * @param opcode The type byte.
     * @return The value type.
     * @throws IllegalArgumentException If the byte does not encode a supported value type.
     */
    public static ValType fromOpcode(byte opcode) {
        switch (opcode) {
            case Opcodes.I32:
                return I32;
            case Opcodes.I64:
                return I64;
            case Opcodes.F32:
                return F32;
            case Opcodes.F64:
                return F64;
            case Opcodes.FUNCREF:
                return FUNCREF;
            case Opcodes.EXTERNREF:
                return EXTERNREF;
            default:
                throw new IllegalArgumentException(String.format("Unknown value type 0x%02x", opcode));
        }
    }

    public byte getOpcode() {
        return opcode;
    }

    public boolean isReference() {
        return this == FUNCREF || this == EXTERNREF;
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
