package io.github.eutro.durawasm.embed.exec;

import io.github.eutro.durawasm.embed.Value;

import java.util.Arrays;

/**
 * The outcome of advancing an {@link ExecutionState}.
 */
public abstract class StepResult {
    /**
     * Execution can go on.
     */
    public static final Continue CONTINUE = new Continue();

    private StepResult() {
    }

    public static final class Continue extends StepResult {
        private Continue() {
        }

        @Override
        public String toString() {
            return "Continue";
        }
    }

    /**
     * The invoked function returned. The state is finished.
     */
    public static final class Return extends StepResult {
        private final Value[] values;

        Return(Value[] values) {
            this.values = values;
        }

        public Value[] getValues() {
            return values.clone();
        }

        @Override
        public String toString() {
            return "Return" + Arrays.toString(values);
        }
    }

    /**
     * Execution trapped. The state is finished.
     */
    public static final class Trap extends StepResult {
        private final TrapKind kind;
        private final String message;

        Trap(TrapKind kind, String message) {
            this.kind = kind;
            this.message = message;
        }

        public TrapKind getKind() {
            return kind;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return "Trap(" + kind + ": " + message + ")";
        }
    }

    /**
     * Execution is suspended on a call to a host function, until the host
     * {@link Interpreter#resume(ExecutionState, Value...) resumes} or {@link Interpreter#fail fails} it.
     */
    public static final class AwaitHost extends StepResult {
        private final HostCall call;
        private final ExecutionState state;

        AwaitHost(HostCall call, ExecutionState state) {
            this.call = call;
            this.state = state;
        }

        public HostCall getCall() {
            return call;
        }

        /**
         * @return The suspended state, to resume or capture.
         */
        public ExecutionState getState() {
            return state;
        }

        @Override
        public String toString() {
            return "AwaitHost(" + call + ")";
        }
    }
}
