package io.github.eutro.durawasm.embed.snapshot;

import io.github.eutro.durawasm.Opcodes;
import io.github.eutro.durawasm.ValType;
import io.github.eutro.durawasm.embed.ExternVal;
import io.github.eutro.durawasm.embed.Module;
import io.github.eutro.durawasm.embed.ModuleInstance;
import io.github.eutro.durawasm.embed.Store;
import io.github.eutro.durawasm.embed.Value;
import io.github.eutro.durawasm.embed.exec.ExecutionState;
import io.github.eutro.durawasm.embed.exec.Interpreter;
import io.github.eutro.durawasm.embed.exec.Label;
import io.github.eutro.durawasm.embed.exec.StepResult;
import io.github.eutro.durawasm.test.WasmBuilder;
import io.github.eutro.durawasm.tree.TypeNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.github.eutro.durawasm.test.WasmBuilder.*;
import static org.junit.jupiter.api.Assertions.*;

class SnapshotTest {
    private static final byte[] NONE = new byte[0];
    private static final byte[] I32 = {Opcodes.I32};
    private static final byte[] I32_I32 = {Opcodes.I32, Opcodes.I32};

    /**
     * Sums 1..n through a helper function, keeping the running total in memory and a step count in a global.
     */
    private static byte[] summingModule() {
        WasmBuilder b = new WasmBuilder();
        b.memory(1, null);
        b.global(Opcodes.I32, true, i32(0));
        int add = b.func(b.type(I32_I32, I32), code(Opcodes.LOCAL_GET, 0, Opcodes.LOCAL_GET, 1, Opcodes.I32_ADD));
        b.export("sum", Opcodes.IMPORTS_FUNC, b.func(b.type(I32, I32), I32, code(
                Opcodes.BLOCK, Opcodes.EMPTY_TYPE,
                Opcodes.LOOP, Opcodes.EMPTY_TYPE,
                Opcodes.LOCAL_GET, 0, Opcodes.I32_EQZ, Opcodes.BR_IF, 1,
                Opcodes.LOCAL_GET, 1, Opcodes.LOCAL_GET, 0, Opcodes.CALL, add, Opcodes.LOCAL_SET, 1,
                i32(0), Opcodes.LOCAL_GET, 1, Opcodes.I32_STORE, 2, 0,
                Opcodes.GLOBAL_GET, 0, i32(1), Opcodes.I32_ADD, Opcodes.GLOBAL_SET, 0,
                Opcodes.LOCAL_GET, 0, i32(1), Opcodes.I32_SUB, Opcodes.LOCAL_SET, 0,
                Opcodes.BR, 0,
                Opcodes.END,
                Opcodes.END,
                Opcodes.LOCAL_GET, 1)));
        return b.build();
    }

    private static ExecutionState invoke(Store store, ModuleInstance inst, String name, Value... args) {
        return ExecutionState.invoke(store, inst.getExport(name).getAddr(), args);
    }

    private static ExecutionState stepIntoHelper(Store store, ExecutionState state, int loops) {
        int entered = 0;
        while (true) {
            int depth = state.getCallDepth();
            assertInstanceOf(StepResult.Continue.class, Interpreter.step(state, store));
            if (depth == 1 && state.getCallDepth() == 2 && ++entered == loops) return state;
        }
    }

    @Test
    void testResumeInFreshStore() {
        byte[] bytes = summingModule();
        Store original = Store.init();
        ModuleInstance inst = Module.decode(bytes).instantiate(original, new ExternVal[0]);
        ExecutionState state = stepIntoHelper(original, invoke(original, inst, "sum", Value.i32(100)), 40);

        Snapshot snapshot = SnapshotCodec.capture(state);
        assertEquals(2, snapshot.getFrames().size());
        assertEquals(ExecutionState.Status.RUNNING, snapshot.getStatus());
        List<Snapshot.LabelImage> labels = snapshot.getFrames().get(0).getLabels();
        assertEquals(Label.Kind.FUNCTION, labels.get(0).getKind());
        assertEquals(Label.Kind.BLOCK, labels.get(1).getKind());
        assertEquals(Label.Kind.LOOP, labels.get(2).getKind());

        byte[] snapshotBytes = SnapshotSerializer.serialize(snapshot);
        byte[] imageBytes = SnapshotSerializer.serialize(StoreImage.capture(original));
        assertEquals(snapshot, SnapshotSerializer.deserializeSnapshot(snapshotBytes));

        Store fresh = Store.init();
        Module.decode(bytes).instantiate(fresh, new ExternVal[0]);
        SnapshotSerializer.deserializeStoreImage(imageBytes).applyTo(fresh);
        assertEquals(Value.i32(39), fresh.global(0).get());
        ExecutionState restored = SnapshotCodec.restore(SnapshotSerializer.deserializeSnapshot(snapshotBytes), fresh);
        assertEquals(2, restored.getCallDepth());

        StepResult expected = Interpreter.run(state, original);
        StepResult actual = Interpreter.run(restored, fresh);
        assertArrayEquals(new Value[]{Value.i32(5050)}, ((StepResult.Return) expected).getValues());
        assertArrayEquals(((StepResult.Return) expected).getValues(),
                assertInstanceOf(StepResult.Return.class, actual).getValues());
        assertEquals(StoreImage.capture(original), StoreImage.capture(fresh));
        assertEquals(Value.i32(100), fresh.global(0).get());
    }

    @Test
    void testSuspendedHostCall() {
        TypeNode unary = new TypeNode(new ValType[]{ValType.I32}, new ValType[]{ValType.I32});
        WasmBuilder b = new WasmBuilder();
        int typeIdx = b.type(I32, I32);
        int host = b.importFunc("env", "ask", typeIdx);
        b.memory(1, null);
        b.global(Opcodes.I32, true, i32(0));
        // writes the argument and a global before the host call, the answer after it
        b.export("f", Opcodes.IMPORTS_FUNC, b.func(typeIdx, I32, code(
                i32(0), Opcodes.LOCAL_GET, 0, Opcodes.I32_STORE, 2, 0,
                Opcodes.GLOBAL_GET, 0, i32(1), Opcodes.I32_ADD, Opcodes.GLOBAL_SET, 0,
                Opcodes.LOCAL_GET, 0, Opcodes.CALL, host, Opcodes.LOCAL_SET, 1,
                i32(4), Opcodes.LOCAL_GET, 1, Opcodes.I32_STORE, 2, 0,
                Opcodes.GLOBAL_GET, 0, Opcodes.LOCAL_GET, 1, Opcodes.I32_ADD, Opcodes.GLOBAL_SET, 0,
                Opcodes.LOCAL_GET, 1, i32(1), Opcodes.I32_ADD)));
        byte[] bytes = b.build();

        Store store = Store.init();
        ModuleInstance inst = Module.decode(bytes).instantiate(store, new ExternVal[]{
                store.allocHostFunc("env", "ask", unary, null)});
        ExecutionState state = invoke(store, inst, "f", Value.i32(5));
        assertInstanceOf(StepResult.AwaitHost.class, Interpreter.run(state, store));
        assertEquals(Value.i32(1), store.global(0).get());
        byte[] snapshotBytes = SnapshotSerializer.serialize(SnapshotCodec.capture(state));
        byte[] imageBytes = SnapshotSerializer.serialize(StoreImage.capture(store));

        Store fresh = Store.init();
        Module.decode(bytes).instantiate(fresh, new ExternVal[]{
                fresh.allocHostFunc("env", "ask", unary, null)});
        SnapshotSerializer.deserializeStoreImage(imageBytes).applyTo(fresh);
        assertEquals(Value.i32(1), fresh.global(0).get());
        ExecutionState restored = SnapshotCodec.restore(SnapshotSerializer.deserializeSnapshot(snapshotBytes), fresh);
        assertEquals(ExecutionState.Status.SUSPENDED, restored.getStatus());
        assertNotNull(restored.getPendingCall());
        assertEquals("ask", restored.getPendingCall().getName());
        assertArrayEquals(new Value[]{Value.i32(5)}, restored.getPendingCall().getArgs());

        StepResult expected = Interpreter.resume(state, store, Value.i32(41));
        StepResult actual = Interpreter.resume(restored, fresh, Value.i32(41));
        assertArrayEquals(new Value[]{Value.i32(42)}, assertInstanceOf(StepResult.Return.class, expected).getValues());
        assertArrayEquals(((StepResult.Return) expected).getValues(),
                assertInstanceOf(StepResult.Return.class, actual).getValues());
        assertEquals(StoreImage.capture(store), StoreImage.capture(fresh));
        assertEquals(Value.i32(42), fresh.global(0).get());

        Store renamed = Store.init();
        Module.decode(bytes).instantiate(renamed, new ExternVal[]{
                renamed.allocHostFunc("env", "tell", unary, null)});
        assertThrows(SnapshotMismatchException.class,
                () -> SnapshotCodec.restore(SnapshotSerializer.deserializeSnapshot(snapshotBytes), renamed));
    }

    @Test
    void testEntrySnapshot() {
        byte[] bytes = summingModule();
        Store store = Store.init();
        ModuleInstance inst = Module.decode(bytes).instantiate(store, new ExternVal[0]);
        Snapshot snapshot = SnapshotCodec.capture(invoke(store, inst, "sum", Value.i32(3)));
        assertEquals(0, snapshot.getFrames().size());
        assertEquals(inst.getExport("sum").getAddr(), snapshot.getEntry());

        ExecutionState restored = SnapshotCodec.restore(snapshot, store);
        StepResult result = Interpreter.run(restored, store);
        assertArrayEquals(new Value[]{Value.i32(6)}, assertInstanceOf(StepResult.Return.class, result).getValues());
    }

    @Test
    void testFinishedStateCannotBeCaptured() {
        Store store = Store.init();
        ModuleInstance inst = Module.decode(summingModule()).instantiate(store, new ExternVal[0]);
        ExecutionState state = invoke(store, inst, "sum", Value.i32(1));
        Interpreter.run(state, store);
        assertThrows(IllegalStateException.class, () -> SnapshotCodec.capture(state));
    }

    @Test
    void testFingerprintMismatch() {
        Store store = Store.init();
        ModuleInstance inst = Module.decode(summingModule()).instantiate(store, new ExternVal[0]);
        ExecutionState state = stepIntoHelper(store, invoke(store, inst, "sum", Value.i32(10)), 2);
        Snapshot snapshot = SnapshotCodec.capture(state);
        StoreImage image = StoreImage.capture(store);

        WasmBuilder other = new WasmBuilder();
        other.memory(1, null);
        other.global(Opcodes.I32, true, i32(0));
        other.func(other.type(I32_I32, I32), code(Opcodes.LOCAL_GET, 1));
        other.func(other.type(I32, I32), code(Opcodes.LOCAL_GET, 0));
        Store wrong = Store.init();
        Module.decode(other.build()).instantiate(wrong, new ExternVal[0]);
        assertThrows(SnapshotMismatchException.class, () -> SnapshotCodec.restore(snapshot, wrong));
        assertThrows(SnapshotMismatchException.class, () -> image.applyTo(wrong));

        assertThrows(SnapshotMismatchException.class, () -> SnapshotCodec.restore(snapshot, Store.init()));
        assertThrows(SnapshotMismatchException.class, () -> image.applyTo(Store.init()));
    }

    @Test
    void testInconsistentFrames() {
        Store store = Store.init();
        ModuleInstance inst = Module.decode(summingModule()).instantiate(store, new ExternVal[0]);
        ExecutionState state = stepIntoHelper(store, invoke(store, inst, "sum", Value.i32(10)), 1);
        Snapshot snapshot = SnapshotCodec.capture(state);
        Snapshot.FrameImage caller = snapshot.getFrames().get(0);

        List<Snapshot.LabelImage> labels = new ArrayList<>(caller.getLabels());
        Snapshot.LabelImage loop = labels.get(2);
        labels.set(2, new Snapshot.LabelImage(Label.Kind.BLOCK, loop.getArity(), loop.getHeight(),
                loop.getCursor(), loop.getOrigin(), false));
        assertThrows(SnapshotMismatchException.class, () -> SnapshotCodec.restore(withCaller(snapshot,
                new Snapshot.FrameImage(caller.getFuncAddr(), caller.getInstanceId(), caller.getArity(),
                        caller.getLocals(), labels)), store));

        List<Value> locals = new ArrayList<>(caller.getLocals());
        locals.set(1, Value.i64(0));
        assertThrows(SnapshotMismatchException.class, () -> SnapshotCodec.restore(withCaller(snapshot,
                new Snapshot.FrameImage(caller.getFuncAddr(), caller.getInstanceId(), caller.getArity(),
                        locals, caller.getLabels())), store));

        Snapshot unknownVersion = new Snapshot(Snapshot.FORMAT_VERSION + 1, snapshot.getStatus(), snapshot.getEntry(),
                snapshot.getFingerprints(), snapshot.getStack(), snapshot.getFrames(), snapshot.getPending());
        assertThrows(SnapshotMismatchException.class, () -> SnapshotCodec.restore(unknownVersion, store));
        byte[] unknownBytes = SnapshotSerializer.serialize(unknownVersion);
        assertThrows(SnapshotMismatchException.class, () -> SnapshotSerializer.deserializeSnapshot(unknownBytes));
    }

    private static Snapshot withCaller(Snapshot snapshot, Snapshot.FrameImage caller) {
        List<Snapshot.FrameImage> frames = new ArrayList<>(snapshot.getFrames());
        frames.set(0, caller);
        return new Snapshot(snapshot.getVersion(), snapshot.getStatus(), snapshot.getEntry(),
                snapshot.getFingerprints(), snapshot.getStack(), frames, snapshot.getPending());
    }

    @Test
    void testCorruptBytes() {
        assertThrows(SnapshotMismatchException.class, () -> SnapshotSerializer.deserializeSnapshot(new byte[]{1, 2, 3}));
        assertThrows(SnapshotMismatchException.class, () -> SnapshotSerializer.deserializeSnapshot(new byte[0]));
        assertThrows(SnapshotMismatchException.class, () -> SnapshotSerializer.deserializeStoreImage(new byte[]{1}));

        Store store = Store.init();
        ModuleInstance inst = Module.decode(summingModule()).instantiate(store, new ExternVal[0]);
        byte[] bytes = SnapshotSerializer.serialize(SnapshotCodec.capture(invoke(store, inst, "sum", Value.i32(3))));
        byte[] truncated = new byte[bytes.length / 2];
        System.arraycopy(bytes, 0, truncated, 0, truncated.length);
        assertThrows(SnapshotMismatchException.class, () -> SnapshotSerializer.deserializeSnapshot(truncated));
        assertThrows(SnapshotMismatchException.class, () -> SnapshotSerializer.deserializeStoreImage(bytes));
    }
}
