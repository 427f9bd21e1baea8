package io.github.eutro.durawasm.embed;

import io.github.eutro.durawasm.embed.exec.TrapException;

/**
 * A host function that answers calls synchronously.
 * <p>
 * Host imports without an implementation suspend execution instead, see
 * {@link io.github.eutro.durawasm.embed.exec.StepResult.AwaitHost}.
 */
@FunctionalInterface
public interface HostFunction {
    /**
     * Call the function.
     *
     * @param args The arguments, matching the parameters of the function's type.
     * @return The results, which must match the results of the function's type.
     * @throws TrapException To trap the calling code.
     */
    Value[] call(Value[] args);
}
