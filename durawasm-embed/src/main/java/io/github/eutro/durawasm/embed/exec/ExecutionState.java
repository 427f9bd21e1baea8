package io.github.eutro.durawasm.embed.exec;

import io.github.eutro.durawasm.ValType;
import io.github.eutro.durawasm.embed.Func;
import io.github.eutro.durawasm.embed.Store;
import io.github.eutro.durawasm.embed.Value;
import io.github.eutro.durawasm.tree.TypeNode;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The whole state of one invocation: the value stack and the call stack, held as data so that it can be
 * stepped, suspended and snapshotted.
 * <p>
 * Frames and values only refer to the {@link Store} by address.
 */
public final class ExecutionState {
    public enum Status {
        RUNNING,
        /**
         * Waiting on a {@link HostCall}.
         */
        SUSPENDED,
        RETURNED,
        TRAPPED,
    }

    final ArrayList<Value> stack;
    final ArrayList<Frame> frames;
    int entry;
    @Nullable HostCall pending;
    Status status;

    private ExecutionState(List<Value> stack, List<Frame> frames, int entry, @Nullable HostCall pending, Status status) {
        this.stack = new ArrayList<>(stack);
        this.frames = new ArrayList<>(frames);
        this.entry = entry;
        this.pending = pending;
        this.status = status;
    }

    /**
     * Prepare to invoke a function. Nothing runs until the state is stepped.
     *
     * @param store    The store.
     * @param funcAddr The address of the function.
     * @param args     The arguments.
     * @return The new state.
     * @throws IllegalArgumentException If the function does not exist or the arguments do not match its type.
     */
    public static ExecutionState invoke(Store store, int funcAddr, Value... args) {
        Func func = store.func(funcAddr);
        checkValues(func.getType().params, args, "argument");
        return new ExecutionState(Arrays.asList(args), Collections.emptyList(), funcAddr, null, Status.RUNNING);
    }

    /**
     * Rebuild a state from its parts, as captured from {@link #getStack()}, {@link #getFrames()} and friends.
     */
    public static ExecutionState restore(List<Value> stack,
                                         List<Frame> frames,
                                         int entry,
                                         @Nullable HostCall pending,
                                         Status status) {
        if ((status == Status.SUSPENDED) != (pending != null)) {
            throw new IllegalArgumentException("A state is suspended exactly when it has a pending host call");
        }
        return new ExecutionState(stack, frames, entry, pending, status);
    }

    static void checkValues(ValType[] types, Value[] values, String what) {
        if (types.length != values.length) {
            throw new IllegalArgumentException(String.format("Expected %d %ss, got %d", types.length, what, values.length));
        }
        for (int i = 0; i < types.length; i++) {
            if (values[i] == null || values[i].getType() != types[i]) {
                throw new IllegalArgumentException(String.format("Expected %s %s %d, got %s",
                        types[i], what, i, values[i]));
            }
        }
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFinished() {
        return status == Status.RETURNED || status == Status.TRAPPED;
    }

    public List<Value> getStack() {
        return Collections.unmodifiableList(stack);
    }

    public List<Frame> getFrames() {
        return Collections.unmodifiableList(frames);
    }

    /**
     * @return The address of the function still to be called, or -1 once it has been.
     */
    public int getEntry() {
        return entry;
    }

    public @Nullable HostCall getPendingCall() {
        return pending;
    }

    public int getCallDepth() {
        return frames.size();
    }

    void push(Value value) {
        stack.add(value);
    }

    Value pop() {
        if (stack.isEmpty()) throw new EngineStateException("Value stack underflow");
        return stack.remove(stack.size() - 1);
    }

    Value peek() {
        if (stack.isEmpty()) throw new EngineStateException("Value stack underflow");
        return stack.get(stack.size() - 1);
    }

    int popI32() {
        return pop().asI32();
    }

    Value[] popN(int n) {
        if (stack.size() < n) throw new EngineStateException("Value stack underflow");
        List<Value> top = stack.subList(stack.size() - n, stack.size());
        Value[] values = top.toArray(new Value[0]);
        top.clear();
        return values;
    }

    /**
     * Keep the top {@code arity} values, dropping everything between them and {@code height}.
     */
    void unwind(int height, int arity) {
        if (stack.size() < height + arity) throw new EngineStateException("Value stack underflow");
        Value[] top = popN(arity);
        stack.subList(height, stack.size()).clear();
        stack.addAll(Arrays.asList(top));
    }

    Frame topFrame() {
        return frames.get(frames.size() - 1);
    }

    TypeNode pendingType() {
        if (pending == null) throw new EngineStateException("No pending host call");
        return pending.getType();
    }
}
