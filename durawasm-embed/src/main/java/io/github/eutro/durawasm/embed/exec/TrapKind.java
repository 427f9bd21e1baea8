package io.github.eutro.durawasm.embed.exec;

/**
 * The reasons execution can trap.
 */
public enum TrapKind {
    UNREACHABLE("unreachable"),
    INTEGER_DIVIDE_BY_ZERO("integer divide by zero"),
    INTEGER_OVERFLOW("integer overflow"),
    INVALID_CONVERSION_TO_INTEGER("invalid conversion to integer"),
    MEMORY_OUT_OF_BOUNDS("out of bounds memory access"),
    TABLE_OUT_OF_BOUNDS("out of bounds table access"),
    UNINITIALIZED_ELEMENT("uninitialized element"),
    INDIRECT_CALL_TYPE_MISMATCH("indirect call type mismatch"),
    CALL_STACK_EXHAUSTED("call stack exhausted"),
    /**
     * The host failed a call, or a host function misbehaved.
     */
    HOST("host trap"),
    ;

    private final String message;

    TrapKind(String message) {
        this.message = message;
    }

    /**
     * @return The standard message for this kind of trap.
     */
    public String getMessage() {
        return message;
    }
}
