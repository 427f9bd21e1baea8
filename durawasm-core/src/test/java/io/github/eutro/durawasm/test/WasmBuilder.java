package io.github.eutro.durawasm.test;

import io.github.eutro.durawasm.Opcodes;
import io.github.eutro.durawasm.binary.Leb128;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes small binary modules for tests.
 * <p>
 * Imports must be added before the functions that index past them.
 */
public class WasmBuilder {
    private final List<byte[]> types = new ArrayList<>();
    private final List<byte[]> imports = new ArrayList<>();
    private final List<byte[]> funcs = new ArrayList<>();
    private final List<byte[]> tables = new ArrayList<>();
    private final List<byte[]> mems = new ArrayList<>();
    private final List<byte[]> globals = new ArrayList<>();
    private final List<byte[]> exports = new ArrayList<>();
    private final List<byte[]> elems = new ArrayList<>();
    private final List<byte[]> codes = new ArrayList<>();
    private final List<byte[]> datas = new ArrayList<>();
    private Integer start;
    private boolean dataCount;
    private int importedFuncs;
    private int importedGlobals;

    /**
     * Concatenate instruction bytes. {@link Byte}s are written as is, {@link Integer}s as unsigned LEB128, and
     * {@code byte[]}s are copied.
     *
     * @param parts The parts.
     * @return The bytes.
     */
    public static byte[] code(Object... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Object part : parts) {
            if (part instanceof Byte) {
                out.write((Byte) part);
            } else if (part instanceof Integer) {
                out.writeBytes(Leb128.encodeUnsigned(Integer.toUnsignedLong((Integer) part)));
            } else if (part instanceof byte[]) {
                out.writeBytes((byte[]) part);
            } else {
                throw new IllegalArgumentException("Can't write " + part);
            }
        }
        return out.toByteArray();
    }

    public static byte[] i32(int value) {
        return code(Opcodes.I32_CONST, Leb128.encodeSigned(value));
    }

    public static byte[] i64(long value) {
        return code(Opcodes.I64_CONST, Leb128.encodeSigned(value));
    }

    public static byte[] name(String name) {
        byte[] bytes = name.getBytes(StandardCharsets.UTF_8);
        return code(bytes.length, bytes);
    }

    public static byte[] vec(List<byte[]> items) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(Leb128.encodeUnsigned(items.size()));
        for (byte[] item : items) out.writeBytes(item);
        return out.toByteArray();
    }

    public static byte[] section(byte id, byte[] payload) {
        return code(id, payload.length, payload);
    }

    public static byte[] header() {
        return new byte[]{0, 'a', 's', 'm', 1, 0, 0, 0};
    }

    private static byte[] types(byte[] types) {
        return code(types.length, types);
    }

    private static byte[] limits(int min, Integer max) {
        return max == null ? code(Opcodes.LIMITS_NOMAX, min) : code(Opcodes.LIMITS_MAX, min, max);
    }

    public int type(byte[] params, byte[] results) {
        types.add(code(Opcodes.TYPES_FUNCTION, types(params), types(results)));
        return types.size() - 1;
    }

    public int importFunc(String module, String name, int type) {
        imports.add(code(name(module), name(name), Opcodes.IMPORTS_FUNC, type));
        return importedFuncs++;
    }

    public void importMemory(String module, String name, int min, Integer max) {
        imports.add(code(name(module), name(name), Opcodes.IMPORTS_MEM, limits(min, max)));
    }

    public void importTable(String module, String name, byte type, int min, Integer max) {
        imports.add(code(name(module), name(name), Opcodes.IMPORTS_TABLE, type, limits(min, max)));
    }

    public int importGlobal(String module, String name, byte type, boolean mutable) {
        imports.add(code(name(module), name(name), Opcodes.IMPORTS_GLOBAL, type, mutable ? Opcodes.MUT_VAR : Opcodes.MUT_CONST));
        return importedGlobals++;
    }

    /**
     * Define a function. The terminating {@code end} is appended to the body.
     *
     * @param type   The type index.
     * @param locals The declared locals, one type byte each.
     * @param body   The body.
     * @return The index of the function.
     */
    public int func(int type, byte[] locals, byte[] body) {
        funcs.add(code(type));
        List<byte[]> groups = new ArrayList<>();
        for (byte local : locals) groups.add(code(1, local));
        byte[] entry = code(vec(groups), body, Opcodes.END);
        codes.add(code(entry.length, entry));
        return importedFuncs + funcs.size() - 1;
    }

    public int func(int type, byte[] body) {
        return func(type, new byte[0], body);
    }

    public void table(byte type, int min, Integer max) {
        tables.add(code(type, limits(min, max)));
    }

    public void memory(int min, Integer max) {
        mems.add(code(limits(min, max)));
    }

    public int global(byte type, boolean mutable, byte[] init) {
        globals.add(code(type, mutable ? Opcodes.MUT_VAR : Opcodes.MUT_CONST, init, Opcodes.END));
        return importedGlobals + globals.size() - 1;
    }

    public void export(String name, byte kind, int index) {
        exports.add(code(name(name), kind, index));
    }

    public void start(int func) {
        start = func;
    }

    /**
     * Add an active element segment for table 0 holding the given functions.
     */
    public void activeElem(byte[] offset, int... funcIndices) {
        List<byte[]> indices = new ArrayList<>();
        for (int funcIndex : funcIndices) indices.add(code(funcIndex));
        elems.add(code(0, offset, Opcodes.END, vec(indices)));
    }

    public void passiveElem(int... funcIndices) {
        List<byte[]> indices = new ArrayList<>();
        for (int funcIndex : funcIndices) indices.add(code(funcIndex));
        elems.add(code(1, Opcodes.ELEMKIND_FUNCREF, vec(indices)));
    }

    public void declareElem(int... funcIndices) {
        List<byte[]> indices = new ArrayList<>();
        for (int funcIndex : funcIndices) indices.add(code(funcIndex));
        elems.add(code(3, Opcodes.ELEMKIND_FUNCREF, vec(indices)));
    }

    public void activeData(byte[] offset, byte[] bytes) {
        datas.add(code(0, offset, Opcodes.END, bytes.length, bytes));
        dataCount = true;
    }

    public void passiveData(byte[] bytes) {
        datas.add(code(1, bytes.length, bytes));
        dataCount = true;
    }

    public byte[] build() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(header());
        writeSection(out, Opcodes.SECTION_TYPE, types);
        writeSection(out, Opcodes.SECTION_IMPORT, imports);
        writeSection(out, Opcodes.SECTION_FUNCTION, funcs);
        writeSection(out, Opcodes.SECTION_TABLE, tables);
        writeSection(out, Opcodes.SECTION_MEMORY, mems);
        writeSection(out, Opcodes.SECTION_GLOBAL, globals);
        writeSection(out, Opcodes.SECTION_EXPORT, exports);
        if (start != null) out.writeBytes(section(Opcodes.SECTION_START, code(start)));
        writeSection(out, Opcodes.SECTION_ELEMENT, elems);
        if (dataCount) out.writeBytes(section(Opcodes.SECTION_DATA_COUNT, code(datas.size())));
        writeSection(out, Opcodes.SECTION_CODE, codes);
        writeSection(out, Opcodes.SECTION_DATA, datas);
        return out.toByteArray();
    }

    private static void writeSection(ByteArrayOutputStream out, byte id, List<byte[]> items) {
        if (items.isEmpty()) return;
        out.writeBytes(section(id, vec(items)));
    }
}
