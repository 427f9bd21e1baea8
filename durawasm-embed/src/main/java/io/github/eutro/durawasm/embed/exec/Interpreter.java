package io.github.eutro.durawasm.embed.exec;

import io.github.eutro.durawasm.MemoryAccess;
import io.github.eutro.durawasm.ValType;
import io.github.eutro.durawasm.embed.*;
import io.github.eutro.durawasm.tree.*;
import io.github.eutro.durawasm.util.InsnMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;

import static io.github.eutro.durawasm.Opcodes.*;
import static io.github.eutro.durawasm.embed.Value.*;
import static io.github.eutro.durawasm.embed.exec.Operators.*;

/**
 * Executes an {@link ExecutionState} one instruction at a time.
 * <p>
 * Every call, block and branch is a change to the state's frames and labels, never a Java call, so execution
 * can stop after any instruction and the state can be captured as data.
 */
public final class Interpreter {
    private static final Logger LOGGER = LogManager.getLogger();

    private Interpreter() {
    }

    @FunctionalInterface
    private interface Executor {
        StepResult execute(ExecutionState state, Store store, Frame frame, AbstractInsnNode insn);
    }

    private static final InsnMap<Executor> EXECUTORS = new InsnMap<>();

    /**
     * Execute one instruction, or one structural transition such as leaving a block or returning.
     *
     * @param state The state to advance.
     * @param store The store its addresses refer to.
     * @return The outcome.
     * @throws IllegalStateException If the state is suspended or finished.
     */
    public static StepResult step(ExecutionState state, Store store) {
        checkRunnable(state);
        try {
            return advance(state, store);
        } catch (TrapException e) {
            state.status = ExecutionState.Status.TRAPPED;
            state.pending = null;
            LOGGER.debug("Trapped at depth {}: {}", state.frames.size(), e.getMessage());
            return new StepResult.Trap(e.getKind(), e.getMessage());
        }
    }

    /**
     * Step until the state returns, traps or suspends.
     *
     * @param state The state to advance.
     * @param store The store its addresses refer to.
     * @return The outcome, never {@link StepResult.Continue}.
     */
    public static StepResult run(ExecutionState state, Store store) {
        StepResult result;
        do {
            result = step(state, store);
        } while (result instanceof StepResult.Continue);
        return result;
    }

    /**
     * Step at most {@code fuel} times, stopping early if the state returns, traps or suspends.
     *
     * @param state The state to advance.
     * @param store The store its addresses refer to.
     * @param fuel  The most steps to take.
     * @return The last outcome, which is {@link StepResult#CONTINUE} if the fuel ran out.
     */
    public static StepResult run(ExecutionState state, Store store, long fuel) {
        StepResult result = StepResult.CONTINUE;
        for (long i = 0; i < fuel && result instanceof StepResult.Continue; i++) {
            result = step(state, store);
        }
        return result;
    }

    /**
     * Supply the results of the pending host call, so that the state can be stepped again.
     *
     * @param state   The suspended state.
     * @param results The results, matching the result types of the host function.
     * @return The state.
     * @throws IllegalStateException    If the state is not suspended.
     * @throws IllegalArgumentException If the results do not match.
     */
    public static ExecutionState resume(ExecutionState state, Value... results) {
        checkSuspended(state);
        ExecutionState.checkValues(state.pendingType().results, results, "result");
        for (Value result : results) state.push(result);
        LOGGER.debug("Resumed host call {}", state.pending);
        state.pending = null;
        state.status = ExecutionState.Status.RUNNING;
        return state;
    }

    /**
     * Supply the results of the pending host call, and {@link #run(ExecutionState, Store) run} on.
     */
    public static StepResult resume(ExecutionState state, Store store, Value... results) {
        return run(resume(state, results), store);
    }

    /**
     * Fail the pending host call, trapping the state.
     *
     * @param state   The suspended state.
     * @param message The reason.
     * @return The trap.
     * @throws IllegalStateException If the state is not suspended.
     */
    public static StepResult fail(ExecutionState state, String message) {
        checkSuspended(state);
        LOGGER.debug("Host call {} failed: {}", state.pending, message);
        state.pending = null;
        state.status = ExecutionState.Status.TRAPPED;
        return new StepResult.Trap(TrapKind.HOST, message);
    }

    private static void checkRunnable(ExecutionState state) {
        switch (state.status) {
            case RUNNING:
                return;
            case SUSPENDED:
                throw new IllegalStateException("Execution is waiting on host call " + state.pending);
            default:
                throw new IllegalStateException("Execution has already finished: " + state.status);
        }
    }

    private static void checkSuspended(ExecutionState state) {
        if (state.status != ExecutionState.Status.SUSPENDED) {
            throw new IllegalStateException("Execution is not waiting on a host call: " + state.status);
        }
    }

    private static StepResult advance(ExecutionState state, Store store) {
        if (state.frames.isEmpty()) {
            if (state.entry >= 0) {
                int entry = state.entry;
                state.entry = -1;
                return call(state, store, entry);
            }
            return finish(state);
        }
        Frame frame = state.topFrame();
        Label label = frame.topLabel();
        if (label.cursor >= label.getBody().size()) {
            frame.labels.remove(frame.labels.size() - 1);
            if (label.getKind() == Label.Kind.FUNCTION) return exitFrame(state);
            return StepResult.CONTINUE;
        }
        AbstractInsnNode insn = label.getBody().get(label.cursor++);
        Executor executor = EXECUTORS.get(insn);
        if (executor == null) {
            throw new EngineStateException(String.format("No executor for opcode 0x%02x", insn.opcode));
        }
        return executor.execute(state, store, frame, insn);
    }

    private static StepResult finish(ExecutionState state) {
        Value[] results = state.stack.toArray(new Value[0]);
        state.stack.clear();
        state.status = ExecutionState.Status.RETURNED;
        return new StepResult.Return(results);
    }

    private static StepResult exitFrame(ExecutionState state) {
        state.frames.remove(state.frames.size() - 1);
        if (state.frames.isEmpty() && state.entry < 0) return finish(state);
        return StepResult.CONTINUE;
    }

    private static StepResult branch(ExecutionState state, Frame frame, int depth) {
        int targetIndex = frame.labels.size() - 1 - depth;
        Label target = frame.labels.get(targetIndex);
        state.unwind(target.getHeight(), target.getArity());
        if (target.getKind() == Label.Kind.LOOP) {
            frame.labels.subList(targetIndex + 1, frame.labels.size()).clear();
            target.cursor = 0;
            return StepResult.CONTINUE;
        }
        frame.labels.subList(targetIndex, frame.labels.size()).clear();
        if (target.getKind() == Label.Kind.FUNCTION) return exitFrame(state);
        return StepResult.CONTINUE;
    }

    private static StepResult call(ExecutionState state, Store store, int funcAddr) {
        Func func = store.func(funcAddr);
        TypeNode type = func.getType();
        if (func instanceof Func.ModuleFunc) {
            if (state.frames.size() >= store.getMaxCallDepth()) {
                throw new TrapException(TrapKind.CALL_STACK_EXHAUSTED);
            }
            Func.ModuleFunc moduleFunc = (Func.ModuleFunc) func;
            ValType[] declared = moduleFunc.getCode().locals;
            Value[] args = state.popN(type.params.length);
            Value[] locals = new Value[args.length + declared.length];
            System.arraycopy(args, 0, locals, 0, args.length);
            for (int i = 0; i < declared.length; i++) {
                locals[args.length + i] = zero(declared[i]);
            }
            LOGGER.trace("Calling function {} at depth {}", funcAddr, state.frames.size());
            Label body = new Label(Label.Kind.FUNCTION, type.results.length, state.stack.size(),
                    moduleFunc.getCode().expr, -1, false, 0);
            state.frames.add(new Frame(funcAddr, moduleFunc.getInstance(), locals, type.results.length,
                    Collections.singletonList(body)));
            return StepResult.CONTINUE;
        }

        Func.HostFunc hostFunc = (Func.HostFunc) func;
        Value[] args = state.popN(type.params.length);
        HostFunction impl = hostFunc.getImpl();
        if (impl == null) {
            HostCall call = new HostCall(hostFunc.getModule(), hostFunc.getName(), funcAddr, type, args);
            state.pending = call;
            state.status = ExecutionState.Status.SUSPENDED;
            LOGGER.debug("Suspended on host call {}", call);
            return new StepResult.AwaitHost(call, state);
        }
        Value[] results = impl.call(args);
        if (results == null) {
            throw new TrapException(TrapKind.HOST, hostFunc + " returned null");
        }
        try {
            ExecutionState.checkValues(type.results, results, "result");
        } catch (IllegalArgumentException e) {
            throw new TrapException(TrapKind.HOST, hostFunc + " returned bad results: " + e.getMessage());
        }
        for (Value result : results) state.push(result);
        return StepResult.CONTINUE;
    }

    private static Memory memory(Store store, Frame frame) {
        return store.memory(frame.getInstance().memAddr(0));
    }

    private static Table table(Store store, Frame frame, int index) {
        return store.table(frame.getInstance().tableAddr(index));
    }

    private static long effectiveAddress(int base, MemInsnNode insn) {
        return Integer.toUnsignedLong(base) + Integer.toUnsignedLong(insn.offset);
    }

    private static void put(byte opcode, Executor executor) {
        EXECUTORS.putByte(opcode, executor);
    }

    private static void unop(byte opcode, UnaryOperator<Value> op) {
        put(opcode, (st, s, fr, insn) -> {
            st.push(op.apply(st.pop()));
            return StepResult.CONTINUE;
        });
    }

    private static void binop(byte opcode, BinaryOperator<Value> op) {
        put(opcode, (st, s, fr, insn) -> {
            Value y = st.pop();
            Value x = st.pop();
            st.push(op.apply(x, y));
            return StepResult.CONTINUE;
        });
    }

    private static void prefixUnop(int opcode, UnaryOperator<Value> op) {
        EXECUTORS.putInt(opcode, (st, s, fr, insn) -> {
            st.push(op.apply(st.pop()));
            return StepResult.CONTINUE;
        });
    }

    // region Control
    static {
        put(UNREACHABLE, (st, s, fr, insn) -> {
            throw new TrapException(TrapKind.UNREACHABLE);
        });
        put(NOP, (st, s, fr, insn) -> StepResult.CONTINUE);
        Executor enter = (st, s, fr, insn) -> {
            BlockInsnNode block = (BlockInsnNode) insn;
            Label parent = fr.topLabel();
            int origin = parent.cursor - 1;
            boolean condition = block.opcode != IF || st.popI32() != 0;
            TypeNode type = block.blockType.expand(fr.getInstance().getModule().getNode().types);
            int height = st.stack.size() - type.params.length;
            switch (block.opcode) {
                case BLOCK:
                    fr.labels.add(new Label(Label.Kind.BLOCK, type.results.length, height, block.body, origin, false, 0));
                    break;
                case LOOP:
                    fr.labels.add(new Label(Label.Kind.LOOP, type.params.length, height, block.body, origin, false, 0));
                    break;
                default:
                    if (condition) {
                        fr.labels.add(new Label(Label.Kind.IF, type.results.length, height, block.body, origin, false, 0));
                    } else if (block.elseBody != null) {
                        fr.labels.add(new Label(Label.Kind.IF, type.results.length, height, block.elseBody, origin, true, 0));
                    }
                    break;
            }
            return StepResult.CONTINUE;
        };
        put(new byte[]{BLOCK, LOOP, IF}, enter);
        put(BR, (st, s, fr, insn) -> branch(st, fr, ((BreakInsnNode) insn).label));
        put(BR_IF, (st, s, fr, insn) -> st.popI32() != 0
                ? branch(st, fr, ((BreakInsnNode) insn).label)
                : StepResult.CONTINUE);
        put(BR_TABLE, (st, s, fr, insn) -> {
            TableBreakInsnNode tbl = (TableBreakInsnNode) insn;
            int index = st.popI32();
            int depth = Integer.compareUnsigned(index, tbl.labels.length) < 0 ? tbl.labels[index] : tbl.defaultLabel;
            return branch(st, fr, depth);
        });
        put(RETURN, (st, s, fr, insn) -> branch(st, fr, fr.labels.size() - 1));
        put(CALL, (st, s, fr, insn) -> call(st, s, fr.getInstance().funcAddr(((CallInsnNode) insn).function)));
        put(CALL_INDIRECT, (st, s, fr, insn) -> {
            CallIndirectInsnNode ci = (CallIndirectInsnNode) insn;
            Table table = table(s, fr, ci.table);
            int index = st.popI32();
            if (Integer.toUnsignedLong(index) >= table.size()) {
                throw new TrapException(TrapKind.TABLE_OUT_OF_BOUNDS, "undefined element " + Integer.toUnsignedString(index));
            }
            Value ref = table.get(index);
            if (ref.isNull()) throw new TrapException(TrapKind.UNINITIALIZED_ELEMENT);
            int funcAddr = ref.asFuncAddr();
            TypeNode expected = fr.getInstance().type(ci.type);
            TypeNode actual = s.func(funcAddr).getType();
            if (!expected.equals(actual)) {
                throw new TrapException(TrapKind.INDIRECT_CALL_TYPE_MISMATCH,
                        "indirect call type mismatch: expected " + expected + ", got " + actual);
            }
            return call(st, s, funcAddr);
        });
    }
    // endregion

    private static void put(byte[] opcodes, Executor executor) {
        EXECUTORS.putByte(opcodes, executor);
    }

    // region Reference, parametric and variable
    static {
        put(REF_NULL, (st, s, fr, insn) -> {
            st.push(nullRef(((NullInsnNode) insn).type));
            return StepResult.CONTINUE;
        });
        unop(REF_IS_NULL, x -> i32(x.isNull() ? 1 : 0));
        put(REF_FUNC, (st, s, fr, insn) -> {
            st.push(funcRef(fr.getInstance().funcAddr(((FuncRefInsnNode) insn).function)));
            return StepResult.CONTINUE;
        });
        put(DROP, (st, s, fr, insn) -> {
            st.pop();
            return StepResult.CONTINUE;
        });
        put(new byte[]{SELECT, SELECTT}, (st, s, fr, insn) -> {
            int condition = st.popI32();
            Value y = st.pop();
            Value x = st.pop();
            st.push(condition != 0 ? x : y);
            return StepResult.CONTINUE;
        });
        put(LOCAL_GET, (st, s, fr, insn) -> {
            st.push(fr.locals[((VariableInsnNode) insn).variable]);
            return StepResult.CONTINUE;
        });
        put(LOCAL_SET, (st, s, fr, insn) -> {
            fr.locals[((VariableInsnNode) insn).variable] = st.pop();
            return StepResult.CONTINUE;
        });
        put(LOCAL_TEE, (st, s, fr, insn) -> {
            fr.locals[((VariableInsnNode) insn).variable] = st.peek();
            return StepResult.CONTINUE;
        });
        put(GLOBAL_GET, (st, s, fr, insn) -> {
            st.push(s.global(fr.getInstance().globalAddr(((VariableInsnNode) insn).variable)).get());
            return StepResult.CONTINUE;
        });
        put(GLOBAL_SET, (st, s, fr, insn) -> {
            s.global(fr.getInstance().globalAddr(((VariableInsnNode) insn).variable)).set(st.pop());
            return StepResult.CONTINUE;
        });
        put(TABLE_GET, (st, s, fr, insn) -> {
            int index = st.popI32();
            st.push(table(s, fr, ((TableInsnNode) insn).table).get(index));
            return StepResult.CONTINUE;
        });
        put(TABLE_SET, (st, s, fr, insn) -> {
            Value value = st.pop();
            int index = st.popI32();
            table(s, fr, ((TableInsnNode) insn).table).set(index, value);
            return StepResult.CONTINUE;
        });
    }
    // endregion

    // region Memory
    static {
        for (MemoryAccess access : MemoryAccess.values()) {
            if (access.store) {
                put(access.opcode, (st, s, fr, insn) -> {
                    Value value = st.pop();
                    int base = st.popI32();
                    memory(s, fr).store(effectiveAddress(base, (MemInsnNode) insn), access.width, value.getBits());
                    return StepResult.CONTINUE;
                });
            } else {
                put(access.opcode, (st, s, fr, insn) -> {
                    int base = st.popI32();
                    long bits = memory(s, fr).load(effectiveAddress(base, (MemInsnNode) insn), access.width, access.signed);
                    st.push(fromBits(access.type, bits));
                    return StepResult.CONTINUE;
                });
            }
        }
        put(MEMORY_SIZE, (st, s, fr, insn) -> {
            st.push(i32(memory(s, fr).size()));
            return StepResult.CONTINUE;
        });
        put(MEMORY_GROW, (st, s, fr, insn) -> {
            int pages = st.popI32();
            st.push(i32(memory(s, fr).grow(pages)));
            return StepResult.CONTINUE;
        });
        EXECUTORS.putInt(MEMORY_INIT, (st, s, fr, insn) -> {
            DataSegment data = s.data(fr.getInstance().dataAddr(((PrefixInsnNode) insn).firstIndex));
            int n = st.popI32();
            int src = st.popI32();
            int dst = st.popI32();
            memory(s, fr).init(dst, data.getBytes(), src, n);
            return StepResult.CONTINUE;
        });
        EXECUTORS.putInt(DATA_DROP, (st, s, fr, insn) -> {
            s.data(fr.getInstance().dataAddr(((PrefixInsnNode) insn).firstIndex)).drop();
            return StepResult.CONTINUE;
        });
        EXECUTORS.putInt(MEMORY_COPY, (st, s, fr, insn) -> {
            int n = st.popI32();
            int src = st.popI32();
            int dst = st.popI32();
            memory(s, fr).copy(dst, src, n);
            return StepResult.CONTINUE;
        });
        EXECUTORS.putInt(MEMORY_FILL, (st, s, fr, insn) -> {
            int n = st.popI32();
            int value = st.popI32();
            int dst = st.popI32();
            memory(s, fr).fill(dst, (byte) value, n);
            return StepResult.CONTINUE;
        });
    }
    // endregion

    // region Table
    static {
        EXECUTORS.putInt(TABLE_INIT, (st, s, fr, insn) -> {
            PrefixInsnNode pi = (PrefixInsnNode) insn;
            ElemSegment elem = s.elem(fr.getInstance().elemAddr(pi.firstIndex));
            int n = st.popI32();
            int src = st.popI32();
            int dst = st.popI32();
            table(s, fr, pi.secondIndex).init(dst, elem.getElements(), src, n);
            return StepResult.CONTINUE;
        });
        EXECUTORS.putInt(ELEM_DROP, (st, s, fr, insn) -> {
            s.elem(fr.getInstance().elemAddr(((PrefixInsnNode) insn).firstIndex)).drop();
            return StepResult.CONTINUE;
        });
        EXECUTORS.putInt(TABLE_COPY, (st, s, fr, insn) -> {
            PrefixInsnNode pi = (PrefixInsnNode) insn;
            int n = st.popI32();
            int src = st.popI32();
            int dst = st.popI32();
            Table.copy(table(s, fr, pi.firstIndex), dst, table(s, fr, pi.secondIndex), src, n);
            return StepResult.CONTINUE;
        });
        EXECUTORS.putInt(TABLE_GROW, (st, s, fr, insn) -> {
            int n = st.popI32();
            Value init = st.pop();
            st.push(i32(table(s, fr, ((PrefixInsnNode) insn).firstIndex).grow(n, init)));
            return StepResult.CONTINUE;
        });
        EXECUTORS.putInt(TABLE_SIZE, (st, s, fr, insn) -> {
            st.push(i32(table(s, fr, ((PrefixInsnNode) insn).firstIndex).size()));
            return StepResult.CONTINUE;
        });
        EXECUTORS.putInt(TABLE_FILL, (st, s, fr, insn) -> {
            int n = st.popI32();
            Value value = st.pop();
            int dst = st.popI32();
            table(s, fr, ((PrefixInsnNode) insn).firstIndex).fill(dst, value, n);
            return StepResult.CONTINUE;
        });
    }
    // endregion

    // region Numeric
    static {
        put(I32_CONST, (st, s, fr, insn) -> {
            st.push(i32((int) ((ConstInsnNode) insn).bits));
            return StepResult.CONTINUE;
        });
        put(I64_CONST, (st, s, fr, insn) -> {
            st.push(i64(((ConstInsnNode) insn).bits));
            return StepResult.CONTINUE;
        });
        put(F32_CONST, (st, s, fr, insn) -> {
            st.push(f32Bits((int) ((ConstInsnNode) insn).bits));
            return StepResult.CONTINUE;
        });
        put(F64_CONST, (st, s, fr, insn) -> {
            st.push(f64Bits(((ConstInsnNode) insn).bits));
            return StepResult.CONTINUE;
        });

        // @formatter:off
        unop(I32_EQZ, x -> i32(i32Eqz(x.asI32())));
        binop(I32_EQ, (x, y) -> i32(i32Eq(x.asI32(), y.asI32())));
        binop(I32_NE, (x, y) -> i32(i32Ne(x.asI32(), y.asI32())));
        binop(I32_LT_S, (x, y) -> i32(i32LtS(x.asI32(), y.asI32())));
        binop(I32_LT_U, (x, y) -> i32(i32LtU(x.asI32(), y.asI32())));
        binop(I32_GT_S, (x, y) -> i32(i32GtS(x.asI32(), y.asI32())));
        binop(I32_GT_U, (x, y) -> i32(i32GtU(x.asI32(), y.asI32())));
        binop(I32_LE_S, (x, y) -> i32(i32LeS(x.asI32(), y.asI32())));
        binop(I32_LE_U, (x, y) -> i32(i32LeU(x.asI32(), y.asI32())));
        binop(I32_GE_S, (x, y) -> i32(i32GeS(x.asI32(), y.asI32())));
        binop(I32_GE_U, (x, y) -> i32(i32GeU(x.asI32(), y.asI32())));

        unop(I64_EQZ, x -> i32(i64Eqz(x.asI64())));
        binop(I64_EQ, (x, y) -> i32(i64Eq(x.asI64(), y.asI64())));
        binop(I64_NE, (x, y) -> i32(i64Ne(x.asI64(), y.asI64())));
        binop(I64_LT_S, (x, y) -> i32(i64LtS(x.asI64(), y.asI64())));
        binop(I64_LT_U, (x, y) -> i32(i64LtU(x.asI64(), y.asI64())));
        binop(I64_GT_S, (x, y) -> i32(i64GtS(x.asI64(), y.asI64())));
        binop(I64_GT_U, (x, y) -> i32(i64GtU(x.asI64(), y.asI64())));
        binop(I64_LE_S, (x, y) -> i32(i64LeS(x.asI64(), y.asI64())));
        binop(I64_LE_U, (x, y) -> i32(i64LeU(x.asI64(), y.asI64())));
        binop(I64_GE_S, (x, y) -> i32(i64GeS(x.asI64(), y.asI64())));
        binop(I64_GE_U, (x, y) -> i32(i64GeU(x.asI64(), y.asI64())));

        binop(F32_EQ, (x, y) -> i32(f32Eq(x.asF32(), y.asF32())));
        binop(F32_NE, (x, y) -> i32(f32Ne(x.asF32(), y.asF32())));
        binop(F32_LT, (x, y) -> i32(f32Lt(x.asF32(), y.asF32())));
        binop(F32_GT, (x, y) -> i32(f32Gt(x.asF32(), y.asF32())));
        binop(F32_LE, (x, y) -> i32(f32Le(x.asF32(), y.asF32())));
        binop(F32_GE, (x, y) -> i32(f32Ge(x.asF32(), y.asF32())));

        binop(F64_EQ, (x, y) -> i32(f64Eq(x.asF64(), y.asF64())));
        binop(F64_NE, (x, y) -> i32(f64Ne(x.asF64(), y.asF64())));
        binop(F64_LT, (x, y) -> i32(f64Lt(x.asF64(), y.asF64())));
        binop(F64_GT, (x, y) -> i32(f64Gt(x.asF64(), y.asF64())));
        binop(F64_LE, (x, y) -> i32(f64Le(x.asF64(), y.asF64())));
        binop(F64_GE, (x, y) -> i32(f64Ge(x.asF64(), y.asF64())));

        unop(I32_CLZ, x -> i32(i32Clz(x.asI32())));
        unop(I32_CTZ, x -> i32(i32Ctz(x.asI32())));
        unop(I32_POPCNT, x -> i32(i32Popcnt(x.asI32())));
        binop(I32_ADD, (x, y) -> i32(i32Add(x.asI32(), y.asI32())));
        binop(I32_SUB, (x, y) -> i32(i32Sub(x.asI32(), y.asI32())));
        binop(I32_MUL, (x, y) -> i32(i32Mul(x.asI32(), y.asI32())));
        binop(I32_DIV_S, (x, y) -> i32(i32DivS(x.asI32(), y.asI32())));
        binop(I32_DIV_U, (x, y) -> i32(i32DivU(x.asI32(), y.asI32())));
        binop(I32_REM_S, (x, y) -> i32(i32RemS(x.asI32(), y.asI32())));
        binop(I32_REM_U, (x, y) -> i32(i32RemU(x.asI32(), y.asI32())));
        binop(I32_AND, (x, y) -> i32(i32And(x.asI32(), y.asI32())));
        binop(I32_OR, (x, y) -> i32(i32Or(x.asI32(), y.asI32())));
        binop(I32_XOR, (x, y) -> i32(i32Xor(x.asI32(), y.asI32())));
        binop(I32_SHL, (x, y) -> i32(i32Shl(x.asI32(), y.asI32())));
        binop(I32_SHR_S, (x, y) -> i32(i32ShrS(x.asI32(), y.asI32())));
        binop(I32_SHR_U, (x, y) -> i32(i32ShrU(x.asI32(), y.asI32())));
        binop(I32_ROTL, (x, y) -> i32(i32Rotl(x.asI32(), y.asI32())));
        binop(I32_ROTR, (x, y) -> i32(i32Rotr(x.asI32(), y.asI32())));

        unop(I64_CLZ, x -> i64(i64Clz(x.asI64())));
        unop(I64_CTZ, x -> i64(i64Ctz(x.asI64())));
        unop(I64_POPCNT, x -> i64(i64Popcnt(x.asI64())));
        binop(I64_ADD, (x, y) -> i64(i64Add(x.asI64(), y.asI64())));
        binop(I64_SUB, (x, y) -> i64(i64Sub(x.asI64(), y.asI64())));
        binop(I64_MUL, (x, y) -> i64(i64Mul(x.asI64(), y.asI64())));
        binop(I64_DIV_S, (x, y) -> i64(i64DivS(x.asI64(), y.asI64())));
        binop(I64_DIV_U, (x, y) -> i64(i64DivU(x.asI64(), y.asI64())));
        binop(I64_REM_S, (x, y) -> i64(i64RemS(x.asI64(), y.asI64())));
        binop(I64_REM_U, (x, y) -> i64(i64RemU(x.asI64(), y.asI64())));
        binop(I64_AND, (x, y) -> i64(i64And(x.asI64(), y.asI64())));
        binop(I64_OR, (x, y) -> i64(i64Or(x.asI64(), y.asI64())));
        binop(I64_XOR, (x, y) -> i64(i64Xor(x.asI64(), y.asI64())));
        binop(I64_SHL, (x, y) -> i64(i64Shl(x.asI64(), y.asI64())));
        binop(I64_SHR_S, (x, y) -> i64(i64ShrS(x.asI64(), y.asI64())));
        binop(I64_SHR_U, (x, y) -> i64(i64ShrU(x.asI64(), y.asI64())));
        binop(I64_ROTL, (x, y) -> i64(i64Rotl(x.asI64(), y.asI64())));
        binop(I64_ROTR, (x, y) -> i64(i64Rotr(x.asI64(), y.asI64())));

        unop(F32_ABS, x -> f32(f32Abs(x.asF32())));
        unop(F32_NEG, x -> f32(f32Neg(x.asF32())));
        unop(F32_CEIL, x -> f32(f32Ceil(x.asF32())));
        unop(F32_FLOOR, x -> f32(f32Floor(x.asF32())));
        unop(F32_TRUNC, x -> f32(f32Trunc(x.asF32())));
        unop(F32_NEAREST, x -> f32(f32Nearest(x.asF32())));
        unop(F32_SQRT, x -> f32(f32Sqrt(x.asF32())));
        binop(F32_ADD, (x, y) -> f32(f32Add(x.asF32(), y.asF32())));
        binop(F32_SUB, (x, y) -> f32(f32Sub(x.asF32(), y.asF32())));
        binop(F32_MUL, (x, y) -> f32(f32Mul(x.asF32(), y.asF32())));
        binop(F32_DIV, (x, y) -> f32(f32Div(x.asF32(), y.asF32())));
        binop(F32_MIN, (x, y) -> f32(f32Min(x.asF32(), y.asF32())));
        binop(F32_MAX, (x, y) -> f32(f32Max(x.asF32(), y.asF32())));
        binop(F32_COPYSIGN, (x, y) -> f32(f32Copysign(x.asF32(), y.asF32())));

        unop(F64_ABS, x -> f64(f64Abs(x.asF64())));
        unop(F64_NEG, x -> f64(f64Neg(x.asF64())));
        unop(F64_CEIL, x -> f64(f64Ceil(x.asF64())));
        unop(F64_FLOOR, x -> f64(f64Floor(x.asF64())));
        unop(F64_TRUNC, x -> f64(f64Trunc(x.asF64())));
        unop(F64_NEAREST, x -> f64(f64Nearest(x.asF64())));
        unop(F64_SQRT, x -> f64(f64Sqrt(x.asF64())));
        binop(F64_ADD, (x, y) -> f64(f64Add(x.asF64(), y.asF64())));
        binop(F64_SUB, (x, y) -> f64(f64Sub(x.asF64(), y.asF64())));
        binop(F64_MUL, (x, y) -> f64(f64Mul(x.asF64(), y.asF64())));
        binop(F64_DIV, (x, y) -> f64(f64Div(x.asF64(), y.asF64())));
        binop(F64_MIN, (x, y) -> f64(f64Min(x.asF64(), y.asF64())));
        binop(F64_MAX, (x, y) -> f64(f64Max(x.asF64(), y.asF64())));
        binop(F64_COPYSIGN, (x, y) -> f64(f64Copysign(x.asF64(), y.asF64())));

        unop(I32_WRAP_I64, x -> i32(i32WrapI64(x.asI64())));
        unop(I32_TRUNC_F32_S, x -> i32(i32TruncF32S(x.asF32())));
        unop(I32_TRUNC_F32_U, x -> i32(i32TruncF32U(x.asF32())));
        unop(I32_TRUNC_F64_S, x -> i32(i32TruncF64S(x.asF64())));
        unop(I32_TRUNC_F64_U, x -> i32(i32TruncF64U(x.asF64())));
        unop(I64_EXTEND_I32_S, x -> i64(i64ExtendI32S(x.asI32())));
        unop(I64_EXTEND_I32_U, x -> i64(i64ExtendI32U(x.asI32())));
        unop(I64_TRUNC_F32_S, x -> i64(i64TruncF32S(x.asF32())));
        unop(I64_TRUNC_F32_U, x -> i64(i64TruncF32U(x.asF32())));
        unop(I64_TRUNC_F64_S, x -> i64(i64TruncF64S(x.asF64())));
        unop(I64_TRUNC_F64_U, x -> i64(i64TruncF64U(x.asF64())));
        unop(F32_CONVERT_I32_S, x -> f32(f32ConvertI32S(x.asI32())));
        unop(F32_CONVERT_I32_U, x -> f32(f32ConvertI32U(x.asI32())));
        unop(F32_CONVERT_I64_S, x -> f32(f32ConvertI64S(x.asI64())));
        unop(F32_CONVERT_I64_U, x -> f32(f32ConvertI64U(x.asI64())));
        unop(F32_DEMOTE_F64, x -> f32(f32DemoteF64(x.asF64())));
        unop(F64_CONVERT_I32_S, x -> f64(f64ConvertI32S(x.asI32())));
        unop(F64_CONVERT_I32_U, x -> f64(f64ConvertI32U(x.asI32())));
        unop(F64_CONVERT_I64_S, x -> f64(f64ConvertI64S(x.asI64())));
        unop(F64_CONVERT_I64_U, x -> f64(f64ConvertI64U(x.asI64())));
        unop(F64_PROMOTE_F32, x -> f64(f64PromoteF32(x.asF32())));
        // reinterpretations keep the bits, including NaN payloads
        unop(I32_REINTERPRET_F32, x -> fromBits(ValType.I32, x.getBits()));
        unop(I64_REINTERPRET_F64, x -> fromBits(ValType.I64, x.getBits()));
        unop(F32_REINTERPRET_I32, x -> fromBits(ValType.F32, x.getBits()));
        unop(F64_REINTERPRET_I64, x -> fromBits(ValType.F64, x.getBits()));

        unop(I32_EXTEND8_S, x -> i32(i32Extend8S(x.asI32())));
        unop(I32_EXTEND16_S, x -> i32(i32Extend16S(x.asI32())));
        unop(I64_EXTEND8_S, x -> i64(i64Extend8S(x.asI64())));
        unop(I64_EXTEND16_S, x -> i64(i64Extend16S(x.asI64())));
        unop(I64_EXTEND32_S, x -> i64(i64Extend32S(x.asI64())));

        prefixUnop(I32_TRUNC_SAT_F32_S, x -> i32(i32TruncSatF32S(x.asF32())));
        prefixUnop(I32_TRUNC_SAT_F32_U, x -> i32(i32TruncSatF32U(x.asF32())));
        prefixUnop(I32_TRUNC_SAT_F64_S, x -> i32(i32TruncSatF64S(x.asF64())));
        prefixUnop(I32_TRUNC_SAT_F64_U, x -> i32(i32TruncSatF64U(x.asF64())));
        prefixUnop(I64_TRUNC_SAT_F32_S, x -> i64(i64TruncSatF32S(x.asF32())));
        prefixUnop(I64_TRUNC_SAT_F32_U, x -> i64(i64TruncSatF32U(x.asF32())));
        prefixUnop(I64_TRUNC_SAT_F64_S, x -> i64(i64TruncSatF64S(x.asF64())));
        prefixUnop(I64_TRUNC_SAT_F64_U, x -> i64(i64TruncSatF64U(x.asF64())));
        // @formatter:on
    }
    // endregion
}
