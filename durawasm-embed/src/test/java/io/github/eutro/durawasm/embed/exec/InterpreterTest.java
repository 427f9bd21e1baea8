package io.github.eutro.durawasm.embed.exec;

import io.github.eutro.durawasm.Opcodes;
import io.github.eutro.durawasm.ValType;
import io.github.eutro.durawasm.embed.ExternVal;
import io.github.eutro.durawasm.embed.Module;
import io.github.eutro.durawasm.embed.ModuleInstance;
import io.github.eutro.durawasm.embed.Store;
import io.github.eutro.durawasm.embed.Value;
import io.github.eutro.durawasm.test.WasmBuilder;
import io.github.eutro.durawasm.tree.TypeNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.github.eutro.durawasm.test.WasmBuilder.*;
import static org.junit.jupiter.api.Assertions.*;

class InterpreterTest {
    private static final byte[] NONE = new byte[0];
    private static final byte[] I32 = {Opcodes.I32};
    private static final byte[] I32_I32 = {Opcodes.I32, Opcodes.I32};
    private static final byte[] I64 = {Opcodes.I64};

    private Store store;

    @BeforeEach
    void setUp() {
        store = Store.init();
    }

    private ModuleInstance instantiate(WasmBuilder b, ExternVal... imports) {
        return Module.decode(b.build()).instantiate(store, imports);
    }

    private ExecutionState start(ModuleInstance inst, String name, Value... args) {
        return ExecutionState.invoke(store, inst.getExport(name).getAddr(), args);
    }

    private StepResult invoke(ModuleInstance inst, String name, Value... args) {
        return Interpreter.run(start(inst, name, args), store);
    }

    private static Value[] returned(StepResult result) {
        return assertInstanceOf(StepResult.Return.class, result).getValues();
    }

    private static TrapKind trapped(StepResult result) {
        return assertInstanceOf(StepResult.Trap.class, result).getKind();
    }

    private static WasmBuilder single(byte[] params, byte[] results, byte[] locals, byte[] body) {
        WasmBuilder b = new WasmBuilder();
        b.export("f", Opcodes.IMPORTS_FUNC, b.func(b.type(params, results), locals, body));
        return b;
    }

    @Test
    void testArithmetic() {
        ModuleInstance inst = instantiate(single(NONE, I32, NONE, code(i32(40), i32(2), Opcodes.I32_ADD)));
        ExecutionState state = start(inst, "f");
        assertArrayEquals(new Value[]{Value.i32(42)}, returned(Interpreter.run(state, store)));
        assertTrue(state.getStack().isEmpty());
        assertEquals(0, state.getCallDepth());
    }

    @Test
    void testWrappingAdd() {
        ModuleInstance inst = instantiate(single(NONE, I32, NONE,
                code(i32(Integer.MAX_VALUE), i32(1), Opcodes.I32_ADD)));
        assertArrayEquals(new Value[]{Value.i32(Integer.MIN_VALUE)}, returned(invoke(inst, "f")));
    }

    @Test
    void testConstantMain() {
        WasmBuilder b = new WasmBuilder();
        b.export("main", Opcodes.IMPORTS_FUNC, b.func(b.type(NONE, I32), code(i32(42))));
        assertArrayEquals(new Value[]{Value.i32(42)}, returned(invoke(instantiate(b), "main")));
    }

    @Test
    void testDivisionTraps() {
        ModuleInstance inst = instantiate(single(I32_I32, I32, NONE, code(
                Opcodes.LOCAL_GET, 0,
                Opcodes.LOCAL_GET, 1,
                Opcodes.I32_DIV_S)));
        assertArrayEquals(new Value[]{Value.i32(3)}, returned(invoke(inst, "f", Value.i32(7), Value.i32(2))));
        assertEquals(TrapKind.INTEGER_DIVIDE_BY_ZERO, trapped(invoke(inst, "f", Value.i32(7), Value.i32(0))));
        assertEquals(TrapKind.INTEGER_OVERFLOW,
                trapped(invoke(inst, "f", Value.i32(Integer.MIN_VALUE), Value.i32(-1))));
    }

    @Test
    void testFinishedStateCannotStep() {
        ModuleInstance inst = instantiate(single(NONE, NONE, NONE, code(Opcodes.UNREACHABLE)));
        ExecutionState state = start(inst, "f");
        assertEquals(TrapKind.UNREACHABLE, trapped(Interpreter.run(state, store)));
        assertEquals(ExecutionState.Status.TRAPPED, state.getStatus());
        assertTrue(state.isFinished());
        assertThrows(IllegalStateException.class, () -> Interpreter.step(state, store));

        ModuleInstance nop = instantiate(single(NONE, NONE, NONE, NONE));
        ExecutionState done = start(nop, "f");
        assertArrayEquals(new Value[0], returned(Interpreter.run(done, store)));
        assertEquals(ExecutionState.Status.RETURNED, done.getStatus());
        assertThrows(IllegalStateException.class, () -> Interpreter.run(done, store));
    }

    @Test
    void testBadArguments() {
        ModuleInstance inst = instantiate(single(I32_I32, I32, NONE, code(Opcodes.LOCAL_GET, 0)));
        int addr = inst.getExport("f").getAddr();
        assertThrows(IllegalArgumentException.class, () -> ExecutionState.invoke(store, addr, Value.i32(1)));
        assertThrows(IllegalArgumentException.class,
                () -> ExecutionState.invoke(store, addr, Value.i32(1), Value.i64(2)));
    }

    @Test
    void testLoop() {
        // factorial, counting down
        ModuleInstance inst = instantiate(single(I64, I64, I64, code(
                i64(1), Opcodes.LOCAL_SET, 1,
                Opcodes.BLOCK, Opcodes.EMPTY_TYPE,
                Opcodes.LOOP, Opcodes.EMPTY_TYPE,
                Opcodes.LOCAL_GET, 0, Opcodes.I64_EQZ, Opcodes.BR_IF, 1,
                Opcodes.LOCAL_GET, 1, Opcodes.LOCAL_GET, 0, Opcodes.I64_MUL, Opcodes.LOCAL_SET, 1,
                Opcodes.LOCAL_GET, 0, i64(1), Opcodes.I64_SUB, Opcodes.LOCAL_SET, 0,
                Opcodes.BR, 0,
                Opcodes.END,
                Opcodes.END,
                Opcodes.LOCAL_GET, 1)));
        assertArrayEquals(new Value[]{Value.i64(2432902008176640000L)}, returned(invoke(inst, "f", Value.i64(20))));
        assertArrayEquals(new Value[]{Value.i64(1)}, returned(invoke(inst, "f", Value.i64(0))));
    }

    @Test
    void testBlockResults() {
        ModuleInstance inst = instantiate(single(I32, I32, NONE, code(
                Opcodes.BLOCK, Opcodes.I32,
                i32(7),
                i32(100),
                Opcodes.LOCAL_GET, 0,
                Opcodes.BR_IF, 0,
                Opcodes.DROP,
                Opcodes.DROP,
                i32(8),
                Opcodes.END)));
        assertArrayEquals(new Value[]{Value.i32(100)}, returned(invoke(inst, "f", Value.i32(1))));
        assertArrayEquals(new Value[]{Value.i32(8)}, returned(invoke(inst, "f", Value.i32(0))));
    }

    @Test
    void testRecursion() {
        WasmBuilder b = new WasmBuilder();
        int fib = b.func(b.type(I32, I32), code(
                Opcodes.LOCAL_GET, 0, i32(2), Opcodes.I32_LT_S,
                Opcodes.IF, Opcodes.I32,
                Opcodes.LOCAL_GET, 0,
                Opcodes.ELSE,
                Opcodes.LOCAL_GET, 0, i32(1), Opcodes.I32_SUB, Opcodes.CALL, 0,
                Opcodes.LOCAL_GET, 0, i32(2), Opcodes.I32_SUB, Opcodes.CALL, 0,
                Opcodes.I32_ADD,
                Opcodes.END));
        b.export("fib", Opcodes.IMPORTS_FUNC, fib);
        ModuleInstance inst = instantiate(b);

        ExecutionState state = start(inst, "fib", Value.i32(15));
        int maxDepth = 0;
        StepResult result;
        do {
            result = Interpreter.run(state, store, 1);
            maxDepth = Math.max(maxDepth, state.getCallDepth());
        } while (result instanceof StepResult.Continue);
        assertArrayEquals(new Value[]{Value.i32(610)}, returned(result));
        assertEquals(15, maxDepth);
        assertEquals(0, state.getCallDepth());
    }

    @Test
    void testCallStackExhausted() {
        store.setMaxCallDepth(100);
        ModuleInstance inst = instantiate(single(NONE, NONE, NONE, code(Opcodes.CALL, 0)));
        ExecutionState state = start(inst, "f");
        assertEquals(TrapKind.CALL_STACK_EXHAUSTED, trapped(Interpreter.run(state, store)));
        assertEquals(100, state.getCallDepth());
    }

    @Test
    void testCallIndirect() {
        WasmBuilder b = new WasmBuilder();
        int unit = b.type(NONE, I32);
        int unary = b.type(I32, I32);
        int one = b.func(unit, i32(1));
        int id = b.func(unary, code(Opcodes.LOCAL_GET, 0));
        b.table(Opcodes.FUNCREF, 3, null);
        b.activeElem(i32(0), one, id);
        b.export("f", Opcodes.IMPORTS_FUNC, b.func(unary, code(
                i32(99),
                Opcodes.LOCAL_GET, 0,
                Opcodes.CALL_INDIRECT, unit, 0,
                Opcodes.I32_ADD)));
        ModuleInstance inst = instantiate(b);

        assertArrayEquals(new Value[]{Value.i32(100)}, returned(invoke(inst, "f", Value.i32(0))));
        assertEquals(TrapKind.UNINITIALIZED_ELEMENT, trapped(invoke(inst, "f", Value.i32(2))));
        assertEquals(TrapKind.TABLE_OUT_OF_BOUNDS, trapped(invoke(inst, "f", Value.i32(3))));

        ExecutionState state = start(inst, "f", Value.i32(1));
        assertEquals(TrapKind.INDIRECT_CALL_TYPE_MISMATCH, trapped(Interpreter.run(state, store)));
        // only the table index was consumed
        assertEquals(1, state.getStack().size());
        assertEquals(Value.i32(99), state.getStack().get(0));
        assertEquals(1, state.getCallDepth());
    }

    @Test
    void testGlobals() {
        WasmBuilder b = new WasmBuilder();
        b.global(Opcodes.I32, true, i32(0));
        b.export("inc", Opcodes.IMPORTS_FUNC, b.func(b.type(NONE, I32), code(
                Opcodes.GLOBAL_GET, 0, i32(1), Opcodes.I32_ADD, Opcodes.GLOBAL_SET, 0,
                Opcodes.GLOBAL_GET, 0)));
        b.export("counter", Opcodes.IMPORTS_GLOBAL, 0);
        ModuleInstance inst = instantiate(b);
        assertArrayEquals(new Value[]{Value.i32(1)}, returned(invoke(inst, "inc")));
        assertArrayEquals(new Value[]{Value.i32(2)}, returned(invoke(inst, "inc")));
        assertEquals(Value.i32(2), store.global(inst.getExport("counter").getAddr()).get());
    }

    @Test
    void testMemory() {
        WasmBuilder b = new WasmBuilder();
        b.memory(1, 3);
        b.export("mem", Opcodes.IMPORTS_MEM, 0);
        b.export("roundtrip", Opcodes.IMPORTS_FUNC, b.func(b.type(I32_I32, I32), code(
                Opcodes.LOCAL_GET, 0, Opcodes.LOCAL_GET, 1, Opcodes.I32_STORE, 2, 0,
                Opcodes.LOCAL_GET, 0, Opcodes.I32_LOAD, 2, 0)));
        b.export("grow", Opcodes.IMPORTS_FUNC, b.func(b.type(NONE, I32), code(i32(1), Opcodes.MEMORY_GROW, 0)));
        ModuleInstance inst = instantiate(b);

        assertArrayEquals(new Value[]{Value.i32(0x01020304)},
                returned(invoke(inst, "roundtrip", Value.i32(8), Value.i32(0x01020304))));
        assertEquals(4, store.memory(inst.getExport("mem").getAddr()).read(8));
        assertEquals(TrapKind.MEMORY_OUT_OF_BOUNDS,
                trapped(invoke(inst, "roundtrip", Value.i32(65534), Value.i32(1))));

        assertArrayEquals(new Value[]{Value.i32(1)}, returned(invoke(inst, "grow")));
        assertArrayEquals(new Value[]{Value.i32(2)}, returned(invoke(inst, "grow")));
        assertArrayEquals(new Value[]{Value.i32(-1)}, returned(invoke(inst, "grow")));
        assertEquals(3, store.memory(inst.getExport("mem").getAddr()).size());
        assertArrayEquals(new Value[]{Value.i32(1)},
                returned(invoke(inst, "roundtrip", Value.i32(65534), Value.i32(1))));
    }

    @Test
    void testBulkMemory() {
        WasmBuilder b = new WasmBuilder();
        b.memory(1, null);
        b.passiveData(new byte[]{1, 2, 3});
        b.export("mem", Opcodes.IMPORTS_MEM, 0);
        b.export("fill", Opcodes.IMPORTS_FUNC, b.func(b.type(NONE, NONE), code(
                i32(16), i32(0xAB), i32(4), Opcodes.INSN_PREFIX, Opcodes.MEMORY_FILL, 0,
                i32(32), i32(16), i32(4), Opcodes.INSN_PREFIX, Opcodes.MEMORY_COPY, 0, 0)));
        b.export("init", Opcodes.IMPORTS_FUNC, b.func(b.type(NONE, NONE), code(
                i32(100), i32(0), i32(3), Opcodes.INSN_PREFIX, Opcodes.MEMORY_INIT, 0, 0,
                Opcodes.INSN_PREFIX, Opcodes.DATA_DROP, 0)));
        ModuleInstance inst = instantiate(b);

        returned(invoke(inst, "fill"));
        returned(invoke(inst, "init"));
        io.github.eutro.durawasm.embed.Memory memory = store.memory(inst.getExport("mem").getAddr());
        assertArrayEquals(new byte[]{(byte) 0xAB, (byte) 0xAB, (byte) 0xAB, (byte) 0xAB}, memory.read(32, 4));
        assertArrayEquals(new byte[]{1, 2, 3}, memory.read(100, 3));
        assertEquals(TrapKind.MEMORY_OUT_OF_BOUNDS, trapped(invoke(inst, "init")));
    }

    @Test
    void testTables() {
        WasmBuilder b = new WasmBuilder();
        int f = b.func(b.type(NONE, NONE), NONE);
        b.table(Opcodes.FUNCREF, 1, null);
        b.passiveElem(f);
        b.export("grow", Opcodes.IMPORTS_FUNC, b.func(b.type(NONE, I32), code(
                Opcodes.REF_NULL, Opcodes.FUNCREF, i32(2), Opcodes.INSN_PREFIX, Opcodes.TABLE_GROW, 0)));
        b.export("size", Opcodes.IMPORTS_FUNC, b.func(b.type(NONE, I32), code(
                Opcodes.INSN_PREFIX, Opcodes.TABLE_SIZE, 0)));
        b.export("init", Opcodes.IMPORTS_FUNC, b.func(b.type(NONE, NONE), code(
                i32(1), i32(0), i32(1), Opcodes.INSN_PREFIX, Opcodes.TABLE_INIT, 0, 0,
                Opcodes.INSN_PREFIX, Opcodes.ELEM_DROP, 0)));
        b.export("isNull", Opcodes.IMPORTS_FUNC, b.func(b.type(I32, I32), code(
                Opcodes.LOCAL_GET, 0, Opcodes.TABLE_GET, 0, Opcodes.REF_IS_NULL)));
        ModuleInstance inst = instantiate(b);

        assertArrayEquals(new Value[]{Value.i32(1)}, returned(invoke(inst, "isNull", Value.i32(0))));
        assertEquals(TrapKind.TABLE_OUT_OF_BOUNDS, trapped(invoke(inst, "init")));
        assertArrayEquals(new Value[]{Value.i32(1)}, returned(invoke(inst, "grow")));
        assertArrayEquals(new Value[]{Value.i32(3)}, returned(invoke(inst, "size")));
        returned(invoke(inst, "init"));
        assertArrayEquals(new Value[]{Value.i32(0)}, returned(invoke(inst, "isNull", Value.i32(1))));
        assertEquals(TrapKind.TABLE_OUT_OF_BOUNDS, trapped(invoke(inst, "init")));
        assertEquals(TrapKind.TABLE_OUT_OF_BOUNDS, trapped(invoke(inst, "isNull", Value.i32(5))));
    }

    @Test
    void testAwaitHost() {
        TypeNode unary = new TypeNode(new ValType[]{ValType.I32}, new ValType[]{ValType.I32});
        WasmBuilder b = new WasmBuilder();
        int typeIdx = b.type(I32, I32);
        int host = b.importFunc("env", "ask", typeIdx);
        b.export("f", Opcodes.IMPORTS_FUNC, b.func(typeIdx, code(
                Opcodes.LOCAL_GET, 0, Opcodes.CALL, host, i32(1), Opcodes.I32_ADD)));
        ModuleInstance inst = instantiate(b, store.allocHostFunc("env", "ask", unary, null));

        ExecutionState state = start(inst, "f", Value.i32(5));
        StepResult.AwaitHost suspended = assertInstanceOf(StepResult.AwaitHost.class, Interpreter.run(state, store));
        assertSame(state, suspended.getState());
        HostCall call = suspended.getCall();
        assertEquals("env", call.getModule());
        assertEquals("ask", call.getName());
        assertArrayEquals(new Value[]{Value.i32(5)}, call.getArgs());
        assertEquals(ExecutionState.Status.SUSPENDED, state.getStatus());
        assertSame(call, state.getPendingCall());
        assertThrows(IllegalStateException.class, () -> Interpreter.step(state, store));
        assertThrows(IllegalArgumentException.class, () -> Interpreter.resume(state, Value.i64(41)));

        assertArrayEquals(new Value[]{Value.i32(42)}, returned(Interpreter.resume(state, store, Value.i32(41))));
        assertThrows(IllegalStateException.class, () -> Interpreter.resume(state, Value.i32(41)));

        ExecutionState failing = start(inst, "f", Value.i32(5));
        assertInstanceOf(StepResult.AwaitHost.class, Interpreter.run(failing, store));
        StepResult.Trap trap = assertInstanceOf(StepResult.Trap.class, Interpreter.fail(failing, "no answer"));
        assertEquals(TrapKind.HOST, trap.getKind());
        assertEquals(ExecutionState.Status.TRAPPED, failing.getStatus());
    }

    @Test
    void testHostImplementation() {
        TypeNode unary = new TypeNode(new ValType[]{ValType.I32}, new ValType[]{ValType.I32});
        WasmBuilder b = new WasmBuilder();
        int typeIdx = b.type(I32, I32);
        int host = b.importFunc("env", "double", typeIdx);
        b.export("f", Opcodes.IMPORTS_FUNC, b.func(typeIdx, code(Opcodes.LOCAL_GET, 0, Opcodes.CALL, host)));

        ModuleInstance good = instantiate(b, store.allocHostFunc(unary, args -> new Value[]{Value.i32(args[0].asI32() * 2)}));
        assertArrayEquals(new Value[]{Value.i32(10)}, returned(invoke(good, "f", Value.i32(5))));

        ModuleInstance bad = instantiate(b, store.allocHostFunc(unary, args -> new Value[]{Value.i64(0)}));
        assertEquals(TrapKind.HOST, trapped(invoke(bad, "f", Value.i32(5))));
    }
}
