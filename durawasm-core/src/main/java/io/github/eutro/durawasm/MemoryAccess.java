package io.github.eutro.durawasm;

/**
 * The shape of each load and store instruction: the value type on the stack, how many bytes it touches,
 * and whether a narrow load sign-extends.
 */
public enum MemoryAccess {
    I32_LOAD(Opcodes.I32_LOAD, ValType.I32, 4, false, false),
    I64_LOAD(Opcodes.I64_LOAD, ValType.I64, 8, false, false),
    F32_LOAD(Opcodes.F32_LOAD, ValType.F32, 4, false, false),
    F64_LOAD(Opcodes.F64_LOAD, ValType.F64, 8, false, false),
    I32_LOAD8_S(Opcodes.I32_LOAD8_S, ValType.I32, 1, true, false),
    I32_LOAD8_U(Opcodes.I32_LOAD8_U, ValType.I32, 1, false, false),
    I32_LOAD16_S(Opcodes.I32_LOAD16_S, ValType.I32, 2, true, false),
    I32_LOAD16_U(Opcodes.I32_LOAD16_U, ValType.I32, 2, false, false),
    I64_LOAD8_S(Opcodes.I64_LOAD8_S, ValType.I64, 1, true, false),
    I64_LOAD8_U(Opcodes.I64_LOAD8_U, ValType.I64, 1, false, false),
    I64_LOAD16_S(Opcodes.I64_LOAD16_S, ValType.I64, 2, true, false),
    I64_LOAD16_U(Opcodes.I64_LOAD16_U, ValType.I64, 2, false, false),
    I64_LOAD32_S(Opcodes.I64_LOAD32_S, ValType.I64, 4, true, false),
    I64_LOAD32_U(Opcodes.I64_LOAD32_U, ValType.I64, 4, false, false),
    I32_STORE(Opcodes.I32_STORE, ValType.I32, 4, false, true),
    I64_STORE(Opcodes.I64_STORE, ValType.I64, 8, false, true),
    F32_STORE(Opcodes.F32_STORE, ValType.F32, 4, false, true),
    F64_STORE(Opcodes.F64_STORE, ValType.F64, 8, false, true),
    I32_STORE8(Opcodes.I32_STORE8, ValType.I32, 1, false, true),
    I32_STORE16(Opcodes.I32_STORE16, ValType.I32, 2, false, true),
    I64_STORE8(Opcodes.I64_STORE8, ValType.I64, 1, false, true),
    I64_STORE16(Opcodes.I64_STORE16, ValType.I64, 2, false, true),
    I64_STORE32(Opcodes.I64_STORE32, ValType.I64, 4, false, true),
    ;

    public final byte opcode;
    public final ValType type;
    public final int width;
    public final boolean signed;
    public final boolean store;

    MemoryAccess(byte opcode, ValType type, int width, boolean signed, boolean store) {
        this.opcode = opcode;
        this.type = type;
        this.width = width;
        this.signed = signed;
        this.store = store;
    }

    private static final MemoryAccess[] BY_OPCODE = new MemoryAccess[256];

    static {
        for (MemoryAccess access : values()) {
            BY_OPCODE[Byte.toUnsignedInt(access.opcode)] = access;
        }
    }

    public static MemoryAccess fromOpcode(byte opcode) {
        MemoryAccess access = BY_OPCODE[Byte.toUnsignedInt(opcode)];
        if (access == null) throw new IllegalArgumentException(String.format("Not a memory access: 0x%02x", opcode));
        return access;
    }

    /**
     * @return The log2 of the natural alignment, the largest alignment immediate allowed.
     */
    public int naturalAlignment() {
        return Integer.numberOfTrailingZeros(width);
    }
}
