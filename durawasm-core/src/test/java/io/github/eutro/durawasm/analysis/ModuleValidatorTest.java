package io.github.eutro.durawasm.analysis;

import io.github.eutro.durawasm.Opcodes;
import io.github.eutro.durawasm.binary.ModuleReader;
import io.github.eutro.durawasm.test.WasmBuilder;
import org.junit.jupiter.api.Test;

import static io.github.eutro.durawasm.test.WasmBuilder.*;
import static org.junit.jupiter.api.Assertions.*;

class ModuleValidatorTest {
    private static final byte[] NONE = new byte[0];
    private static final byte[] I32 = {Opcodes.I32};

    private static ValidatedModule validate(WasmBuilder b) {
        return ModuleValidator.validate(ModuleReader.fromBytes(b.build()).read());
    }

    private static ValidationException invalid(WasmBuilder b) {
        return assertThrows(ValidationException.class, () -> validate(b));
    }

    private static WasmBuilder single(byte[] params, byte[] results, byte[] locals, byte[] body) {
        WasmBuilder b = new WasmBuilder();
        b.func(b.type(params, results), locals, body);
        return b;
    }

    @Test
    void testResultType() {
        assertNotNull(validate(single(NONE, I32, NONE, i32(1))));
        ValidationException e = invalid(single(NONE, I32, NONE, i64(1)));
        assertEquals(ValidationException.Failure.TYPE_MISMATCH, e.getFailure());
        assertEquals(0, e.getFuncIndex());
    }

    @Test
    void testStackUnderflow() {
        ValidationException e = invalid(single(NONE, I32, NONE, code(i32(1), Opcodes.I32_ADD)));
        assertEquals(ValidationException.Failure.TYPE_MISMATCH, e.getFailure());
        assertEquals(1, e.getInsnIndex());
    }

    @Test
    void testLeftoverValues() {
        assertEquals(ValidationException.Failure.TYPE_MISMATCH,
                invalid(single(NONE, NONE, NONE, i32(1))).getFailure());
    }

    @Test
    void testUnreachableIsPolymorphic() {
        validate(single(NONE, I32, NONE, code(Opcodes.UNREACHABLE)));
        validate(single(NONE, I32, NONE, code(Opcodes.UNREACHABLE, Opcodes.I32_ADD)));
        validate(single(NONE, I32, NONE, code(i32(3), Opcodes.RETURN, Opcodes.I64_ADD, Opcodes.DROP, i32(0))));
        invalid(single(NONE, I32, NONE, code(Opcodes.UNREACHABLE, i64(0))));
    }

    @Test
    void testBranches() {
        validate(single(I32, I32, NONE, code(
                Opcodes.BLOCK, Opcodes.I32,
                i32(7),
                Opcodes.LOCAL_GET, 0,
                Opcodes.BR_IF, 0,
                Opcodes.DROP,
                i32(8),
                Opcodes.END)));
        validate(single(I32, I32, NONE, code(
                Opcodes.BLOCK, Opcodes.EMPTY_TYPE,
                Opcodes.LOCAL_GET, 0,
                Opcodes.BR_TABLE, 1, 0, 0,
                Opcodes.END,
                i32(1))));
        assertEquals(ValidationException.Failure.UNKNOWN_INDEX,
                invalid(single(NONE, NONE, NONE, code(Opcodes.BR, 1))).getFailure());
        // a loop label takes the loop's parameters, not its results
        validate(single(NONE, I32, NONE, code(Opcodes.LOOP, Opcodes.I32, Opcodes.BR, 0, Opcodes.END)));
        invalid(single(NONE, I32, NONE, code(Opcodes.BLOCK, Opcodes.I32, Opcodes.BR, 0, Opcodes.END)));
    }

    @Test
    void testIfWithoutElse() {
        validate(single(I32, NONE, NONE, code(Opcodes.LOCAL_GET, 0, Opcodes.IF, Opcodes.EMPTY_TYPE, Opcodes.END)));
        invalid(single(I32, I32, NONE, code(Opcodes.LOCAL_GET, 0, Opcodes.IF, Opcodes.I32, i32(1), Opcodes.END)));
    }

    @Test
    void testUnknownIndices() {
        assertEquals(ValidationException.Failure.UNKNOWN_INDEX,
                invalid(single(NONE, NONE, NONE, code(Opcodes.LOCAL_GET, 0, Opcodes.DROP))).getFailure());
        assertEquals(ValidationException.Failure.UNKNOWN_INDEX,
                invalid(single(NONE, NONE, NONE, code(Opcodes.CALL, 5))).getFailure());
        assertEquals(ValidationException.Failure.UNKNOWN_INDEX,
                invalid(single(NONE, NONE, NONE, code(Opcodes.GLOBAL_GET, 0, Opcodes.DROP))).getFailure());
        assertEquals(ValidationException.Failure.UNKNOWN_INDEX,
                invalid(single(NONE, NONE, NONE, code(i32(0), Opcodes.I32_LOAD, 2, 0, Opcodes.DROP))).getFailure());
    }

    @Test
    void testCallIndirectChecksOnlyStatically() {
        WasmBuilder b = new WasmBuilder();
        int takesI32 = b.type(I32, NONE);
        int givesI32 = b.type(NONE, I32);
        b.table(Opcodes.FUNCREF, 1, null);
        b.func(givesI32, code(i32(0), Opcodes.CALL_INDIRECT, givesI32, 0));
        b.func(takesI32, NONE);
        validate(b);

        WasmBuilder noType = new WasmBuilder();
        noType.table(Opcodes.FUNCREF, 1, null);
        noType.func(noType.type(NONE, NONE), code(i32(0), Opcodes.CALL_INDIRECT, 9, 0));
        assertEquals(ValidationException.Failure.UNKNOWN_INDEX, invalid(noType).getFailure());
    }

    @Test
    void testImmutableGlobal() {
        WasmBuilder b = new WasmBuilder();
        b.global(Opcodes.I32, false, i32(0));
        b.func(b.type(NONE, NONE), code(i32(1), Opcodes.GLOBAL_SET, 0));
        assertEquals(ValidationException.Failure.INVALID, invalid(b).getFailure());
    }

    @Test
    void testConstantExpressions() {
        WasmBuilder ok = new WasmBuilder();
        int imported = ok.importGlobal("env", "base", Opcodes.I32, false);
        ok.global(Opcodes.I32, false, code(Opcodes.GLOBAL_GET, imported));
        validate(ok);

        WasmBuilder nonConst = new WasmBuilder();
        nonConst.global(Opcodes.I32, false, code(i32(1), i32(2), Opcodes.I32_ADD));
        assertEquals(ValidationException.Failure.INVALID, invalid(nonConst).getFailure());

        WasmBuilder mutableRead = new WasmBuilder();
        int g = mutableRead.importGlobal("env", "g", Opcodes.I32, true);
        mutableRead.global(Opcodes.I32, false, code(Opcodes.GLOBAL_GET, g));
        assertEquals(ValidationException.Failure.INVALID, invalid(mutableRead).getFailure());

        WasmBuilder wrongType = new WasmBuilder();
        wrongType.global(Opcodes.I32, false, i64(1));
        assertEquals(ValidationException.Failure.TYPE_MISMATCH, invalid(wrongType).getFailure());

        WasmBuilder forward = new WasmBuilder();
        forward.global(Opcodes.I32, false, code(Opcodes.GLOBAL_GET, 1));
        forward.global(Opcodes.I32, false, i32(0));
        assertEquals(ValidationException.Failure.UNKNOWN_INDEX, invalid(forward).getFailure());
    }

    @Test
    void testAlignment() {
        WasmBuilder b = new WasmBuilder();
        b.memory(1, null);
        b.func(b.type(NONE, NONE), code(i32(0), Opcodes.I32_LOAD8_U, 1, 0, Opcodes.DROP));
        assertEquals(ValidationException.Failure.INVALID, invalid(b).getFailure());
    }

    @Test
    void testFunctionReferences() {
        WasmBuilder undeclared = new WasmBuilder();
        int t = undeclared.type(NONE, NONE);
        undeclared.func(t, code(Opcodes.REF_FUNC, 0, Opcodes.DROP));
        assertEquals(ValidationException.Failure.INVALID, invalid(undeclared).getFailure());

        WasmBuilder declared = new WasmBuilder();
        int t2 = declared.type(NONE, NONE);
        int f = declared.func(t2, code(Opcodes.REF_FUNC, 0, Opcodes.DROP));
        declared.declareElem(f);
        validate(declared);
    }

    @Test
    void testModuleLevelRules() {
        WasmBuilder start = new WasmBuilder();
        start.start(start.func(start.type(I32, NONE), NONE));
        assertEquals(ValidationException.Failure.INVALID, invalid(start).getFailure());

        WasmBuilder dupExport = new WasmBuilder();
        int f = dupExport.func(dupExport.type(NONE, NONE), NONE);
        dupExport.export("a", Opcodes.IMPORTS_FUNC, f);
        dupExport.export("a", Opcodes.IMPORTS_FUNC, f);
        assertEquals(ValidationException.Failure.INVALID, invalid(dupExport).getFailure());

        WasmBuilder bigMemory = new WasmBuilder();
        bigMemory.memory(65537, null);
        assertEquals(ValidationException.Failure.INVALID, invalid(bigMemory).getFailure());

        WasmBuilder twoMemories = new WasmBuilder();
        twoMemories.memory(1, null);
        twoMemories.memory(1, null);
        assertEquals(ValidationException.Failure.INVALID, invalid(twoMemories).getFailure());
    }

    @Test
    void testDataCountRequired() {
        WasmBuilder b = new WasmBuilder();
        b.memory(1, null);
        b.func(b.type(NONE, NONE), code(Opcodes.INSN_PREFIX, Opcodes.DATA_DROP, 0));
        assertEquals(ValidationException.Failure.INVALID, invalid(b).getFailure());
    }
}
