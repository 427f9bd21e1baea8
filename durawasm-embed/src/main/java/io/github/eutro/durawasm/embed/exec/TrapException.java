package io.github.eutro.durawasm.embed.exec;

/**
 * Thrown inside the engine when an instruction traps.
 * <p>
 * It never escapes {@link Interpreter#step}, which turns it into a {@link StepResult.Trap}. Host functions may
 * throw it to trap the calling code.
 */
public class TrapException extends RuntimeException {
    private final TrapKind kind;

    public TrapException(TrapKind kind) {
        this(kind, kind.getMessage());
    }

    public TrapException(TrapKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TrapKind getKind() {
        return kind;
    }
}
