package io.github.eutro.durawasm.analysis;

/**
 * Thrown when a well-formed module violates a static rule of WebAssembly.
 */
public class ValidationException extends RuntimeException {
    /**
     * The kind of rule that was violated.
     */
    public enum Failure {
        TYPE_MISMATCH,
        UNKNOWN_INDEX,
        INVALID,
    }

    private final Failure failure;
    private final int funcIndex;
    private final int insnIndex;

    public ValidationException(Failure failure, String message, int funcIndex, int insnIndex) {
        super(describe(failure, message, funcIndex, insnIndex));
        this.failure = failure;
        this.funcIndex = funcIndex;
        this.insnIndex = insnIndex;
    }

    public ValidationException(Failure failure, String message) {
        this(failure, message, -1, -1);
    }

    private static String describe(Failure failure, String message, int funcIndex, int insnIndex) {
        StringBuilder sb = new StringBuilder(message).append(" [").append(failure);
        if (funcIndex >= 0) sb.append(", func ").append(funcIndex);
        if (insnIndex >= 0) sb.append(", insn ").append(insnIndex);
        return sb.append(']').toString();
    }

    public Failure getFailure() {
        return failure;
    }

    /**
     * @return The index in the function index space of the offending function, or -1 if the failure is not in a
     * function body.
     */
    public int getFuncIndex() {
        return funcIndex;
    }

    /**
     * @return The pre-order index of the offending instruction in its function body, or -1.
     */
    public int getInsnIndex() {
        return insnIndex;
    }
}
