package io.github.eutro.durawasm.binary;

import io.github.eutro.durawasm.Opcodes;
import io.github.eutro.durawasm.ValType;
import io.github.eutro.durawasm.test.WasmBuilder;
import io.github.eutro.durawasm.tree.*;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.github.eutro.durawasm.test.WasmBuilder.*;
import static org.junit.jupiter.api.Assertions.*;

class ModuleReaderTest {
    private static ModuleNode read(byte[] bytes) {
        return ModuleReader.fromBytes(bytes).read();
    }

    private static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) out.writeBytes(part);
        return out.toByteArray();
    }

    @Test
    void testEmptyModule() {
        ModuleNode module = read(header());
        assertTrue(module.types.isEmpty());
        assertTrue(module.funcs.isEmpty());
        assertTrue(module.customs.isEmpty());
        assertNull(module.start);
    }

    @Test
    void testTruncatedHeader() {
        byte[] header = header();
        for (int len = 0; len < header.length; len++) {
            byte[] truncated = Arrays.copyOf(header, len);
            assertThrows(MalformedModuleException.class, () -> read(truncated), "length " + len);
        }
    }

    @Test
    void testAlteredHeader() {
        byte[] header = header();
        for (int i = 0; i < header.length; i++) {
            byte[] altered = header.clone();
            altered[i] ^= 0x01;
            MalformedModuleException e = assertThrows(MalformedModuleException.class, () -> read(altered));
            assertEquals(i < 4 ? 0 : 4, e.getOffset());
        }
    }

    private static byte[] withLocals(int... counts) {
        List<byte[]> groups = new ArrayList<>();
        for (int count : counts) groups.add(code(count, Opcodes.I32));
        byte[] entry = code(vec(groups), Opcodes.END);
        return concat(header(),
                section(Opcodes.SECTION_TYPE, code(1, Opcodes.TYPES_FUNCTION, 0, 0)),
                section(Opcodes.SECTION_FUNCTION, code(1, 0)),
                section(Opcodes.SECTION_CODE, code(1, entry.length, entry)));
    }

    @Test
    void testLocalsLimit() {
        assertEquals(ModuleReader.MAX_LOCALS,
                read(withLocals(ModuleReader.MAX_LOCALS - 1, 1)).codes.get(0).locals.length);
        MalformedModuleException e = assertThrows(MalformedModuleException.class,
                () -> read(withLocals(ModuleReader.MAX_LOCALS, 1)));
        assertTrue(e.getMessage().startsWith("too many locals"));
        assertThrows(MalformedModuleException.class, () -> read(withLocals(-1)));
    }

    @Test
    void testCustomSectionsBetweenSections() {
        WasmBuilder b = new WasmBuilder();
        int t = b.type(new byte[0], new byte[]{Opcodes.I32});
        b.func(t, i32(42));
        byte[] plain = b.build();
        byte[] custom = section(Opcodes.SECTION_CUSTOM, concat(name("meta"), new byte[]{1, 2, 3}));
        // header, type section (7 bytes), function section, code section
        int typeEnd = 8 + 7;
        int funcEnd = typeEnd + 4;
        byte[] bytes = concat(
                Arrays.copyOfRange(plain, 0, 8), custom,
                Arrays.copyOfRange(plain, 8, typeEnd), custom,
                Arrays.copyOfRange(plain, typeEnd, funcEnd), custom,
                Arrays.copyOfRange(plain, funcEnd, plain.length), custom);
        ModuleNode module = read(bytes);
        assertEquals(4, module.customs.size());
        assertEquals("meta", module.customs.get(0).name);
        assertNull(module.customs.get(0).payload);
        assertEquals(8, module.customs.get(0).location.offset);
        assertEquals(1, module.funcs.size());
        assertEquals(1, module.codes.size());
    }

    @Test
    void testNameSectionPayloadKept() {
        byte[] bytes = concat(header(), section(Opcodes.SECTION_CUSTOM, concat(name("name"), new byte[]{9, 8})));
        CustomNode custom = read(bytes).customs.get(0);
        assertArrayEquals(new byte[]{9, 8}, custom.payload);
    }

    @Test
    void testGlobalBeforeType() {
        byte[] global = section(Opcodes.SECTION_GLOBAL, code(1, Opcodes.I32, Opcodes.MUT_CONST, i32(0), Opcodes.END));
        byte[] type = section(Opcodes.SECTION_TYPE, code(1, Opcodes.TYPES_FUNCTION, 0, 0));
        assertEquals(1, read(concat(header(), type, global)).globals.size());
        MalformedModuleException e = assertThrows(MalformedModuleException.class,
                () -> read(concat(header(), global, type)));
        assertEquals(8 + global.length, e.getOffset());
    }

    @Test
    void testDuplicateSection() {
        byte[] type = section(Opcodes.SECTION_TYPE, code(0));
        assertThrows(MalformedModuleException.class, () -> read(concat(header(), type, type)));
    }

    @Test
    void testUnknownSection() {
        assertThrows(MalformedModuleException.class, () -> read(concat(header(), section((byte) 13, new byte[0]))));
    }

    @Test
    void testSectionSizeMismatch() {
        // one type declared, but the section claims an extra byte
        byte[] body = code(1, Opcodes.TYPES_FUNCTION, 0, 0, (byte) 0);
        assertThrows(MalformedModuleException.class,
                () -> read(concat(header(), section(Opcodes.SECTION_TYPE, body))));
        // the section is shorter than its contents
        byte[] cut = concat(header(), code(Opcodes.SECTION_TYPE, 2, 1, Opcodes.TYPES_FUNCTION, 0, 0));
        assertThrows(MalformedModuleException.class, () -> read(cut));
    }

    @Test
    void testFunctionCodeCountMismatch() {
        byte[] type = section(Opcodes.SECTION_TYPE, code(1, Opcodes.TYPES_FUNCTION, 0, 0));
        byte[] funcs = section(Opcodes.SECTION_FUNCTION, code(2, 0, 0));
        byte[] codes = section(Opcodes.SECTION_CODE, code(1, 2, 0, Opcodes.END));
        assertThrows(MalformedModuleException.class, () -> read(concat(header(), type, funcs, codes)));
        assertThrows(MalformedModuleException.class, () -> read(concat(header(), type, funcs)));
    }

    @Test
    void testNestedBlocks() {
        WasmBuilder b = new WasmBuilder();
        int t = b.type(new byte[]{Opcodes.I32}, new byte[]{Opcodes.I32});
        b.func(t, code(
                Opcodes.BLOCK, Opcodes.I32,
                Opcodes.LOOP, Opcodes.EMPTY_TYPE,
                Opcodes.BR, 1,
                Opcodes.END,
                Opcodes.LOCAL_GET, 0,
                Opcodes.IF, Opcodes.I32,
                i32(1),
                Opcodes.ELSE,
                i32(2),
                Opcodes.END,
                Opcodes.END));
        ModuleNode module = read(b.build());
        ExprNode expr = module.codes.get(0).expr;
        assertEquals(1, expr.size());
        BlockInsnNode block = (BlockInsnNode) expr.get(0);
        assertEquals(Opcodes.BLOCK, block.opcode);
        assertEquals(ValType.I32, block.blockType.getValType());
        assertEquals(3, block.body.size());
        BlockInsnNode loop = (BlockInsnNode) block.body.get(0);
        assertTrue(loop.blockType.isEmpty());
        assertEquals(1, loop.body.size());
        assertEquals(1, ((BreakInsnNode) loop.body.get(0)).label);
        BlockInsnNode ifInsn = (BlockInsnNode) block.body.get(2);
        assertNotNull(ifInsn.elseBody);
        assertEquals(1, ifInsn.body.size());
        assertEquals(2, ((ConstInsnNode) ifInsn.elseBody.get(0)).bits);

        SourceLocation loc = loop.location;
        assertNotNull(loc);
        // loop, empty type, br, 1, end
        assertEquals(5, loc.length);
    }

    @Test
    void testMissingEnd() {
        byte[] type = section(Opcodes.SECTION_TYPE, code(1, Opcodes.TYPES_FUNCTION, 0, 0));
        byte[] funcs = section(Opcodes.SECTION_FUNCTION, code(1, 0));
        byte[] codes = section(Opcodes.SECTION_CODE, code(1, 3, 0, Opcodes.BLOCK, Opcodes.EMPTY_TYPE));
        assertThrows(MalformedModuleException.class, () -> read(concat(header(), type, funcs, codes)));
    }

    @Test
    void testElseOutsideIf() {
        byte[] type = section(Opcodes.SECTION_TYPE, code(1, Opcodes.TYPES_FUNCTION, 0, 0));
        byte[] funcs = section(Opcodes.SECTION_FUNCTION, code(1, 0));
        byte[] codes = section(Opcodes.SECTION_CODE, code(1, 3, 0, Opcodes.ELSE, Opcodes.END));
        assertThrows(MalformedModuleException.class, () -> read(concat(header(), type, funcs, codes)));
    }

    @Test
    void testUnknownOpcodes() {
        WasmBuilder b = new WasmBuilder();
        int t = b.type(new byte[0], new byte[0]);
        b.func(t, code((byte) 0xC5));
        assertThrows(MalformedModuleException.class, () -> read(b.build()));

        WasmBuilder simd = new WasmBuilder();
        simd.func(simd.type(new byte[0], new byte[0]), code(Opcodes.VECTOR_PREFIX, 12));
        assertThrows(MalformedModuleException.class, () -> read(simd.build()));
    }

    @Test
    void testSegmentsAndImports() {
        WasmBuilder b = new WasmBuilder();
        int t = b.type(new byte[0], new byte[0]);
        b.importFunc("env", "f", t);
        b.importMemory("env", "mem", 1, 2);
        int g = b.importGlobal("env", "g", Opcodes.I32, false);
        int f = b.func(t, new byte[0]);
        b.table(Opcodes.FUNCREF, 2, null);
        b.export("f", Opcodes.IMPORTS_FUNC, f);
        b.activeElem(i32(0), 0, f);
        b.declareElem(f);
        b.activeData(code(Opcodes.GLOBAL_GET, g), new byte[]{1, 2, 3});
        b.passiveData(new byte[]{4});
        ModuleNode module = read(b.build());

        assertEquals(3, module.imports.size());
        assertEquals(2, module.funcCount());
        assertEquals(Integer.valueOf(2), module.memType(0).limits.max);
        assertEquals(2, module.elems.size());
        assertEquals(ElementNode.Mode.ACTIVE, module.elems.get(0).mode);
        assertEquals(ElementNode.Mode.DECLARATIVE, module.elems.get(1).mode);
        assertEquals(f, ((FuncRefInsnNode) module.elems.get(0).init.get(1).get(0)).function);
        assertEquals(Integer.valueOf(2), module.dataCount);
        assertTrue(module.datas.get(0).active);
        assertFalse(module.datas.get(1).active);
        assertArrayEquals(new byte[]{4}, module.datas.get(1).init);
    }

    @Test
    void testInvalidUtf8Name() {
        byte[] custom = section(Opcodes.SECTION_CUSTOM, code(2, (byte) 0xC3, (byte) 0x28));
        assertThrows(MalformedModuleException.class, () -> read(concat(header(), custom)));
    }
}
