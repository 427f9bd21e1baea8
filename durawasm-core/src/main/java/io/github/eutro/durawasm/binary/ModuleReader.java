package io.github.eutro.durawasm.binary;

import io.github.eutro.durawasm.BlockType;
import io.github.eutro.durawasm.ValType;
import io.github.eutro.durawasm.tree.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.durawasm.Opcodes.*;

/**
 * Decodes a module in the WebAssembly binary format into a {@link ModuleNode}.
 * <p>
 * Nested instruction sequences are read recursively, so decoding recursion is bounded by the nesting depth of the
 * input. Every instruction, code entry and custom section records the span of bytes it was read from.
 */
public class ModuleReader {
    private static final Logger LOGGER = LogManager.getLogger();

    /**
     * An implementation limit on the number of declared locals in one function.
     */
    public static final int MAX_LOCALS = 50000;

    private final byte[] bytes;

    private ModuleReader(byte[] bytes) {
        this.bytes = bytes;
    }

    public static ModuleReader fromBytes(byte[] bytes) {
        return new ModuleReader(bytes);
    }

    /**
     * Decode the module.
     *
     * @return The decoded module.
     * @throws MalformedModuleException If the bytes are not a well-formed module.
     */
    public ModuleNode read() {
        ByteInput in = new ByteInput(bytes);
        int magicStart = in.position();
        if (in.remaining() < 4 || in.readFixed32() != MAGIC) {
            throw new MalformedModuleException("magic header not detected", magicStart);
        }
        int versionStart = in.position();
        if (in.remaining() < 4 || in.readFixed32() != VERSION) {
            throw new MalformedModuleException("unknown binary version", versionStart);
        }

        ModuleNode module = new ModuleNode();
        int lastRank = 0;
        while (in.hasMore()) {
            int sectionStart = in.position();
            byte id = in.readByte();
            int size = in.readU32();
            ByteInput section = in.slice(size);
            if (id == SECTION_CUSTOM) {
                readCustom(module, section, sectionStart);
            } else {
                int rank = sectionRank(id, sectionStart);
                if (rank <= lastRank) {
                    throw new MalformedModuleException("section out of order or duplicated", sectionStart);
                }
                lastRank = rank;
                readSection(module, id, section);
            }
            if (section.hasMore()) {
                throw new MalformedModuleException("section size mismatch", section.position());
            }
        }

        if (module.funcs.size() != module.codes.size()) {
            throw new MalformedModuleException("function and code section have inconsistent lengths", bytes.length);
        }
        if (module.dataCount != null && module.dataCount != module.datas.size()) {
            throw new MalformedModuleException("data count and data section have inconsistent lengths", bytes.length);
        }
        LOGGER.debug("Decoded module of {} bytes: {} types, {} imports, {} functions, {} exports",
                bytes.length, module.types.size(), module.imports.size(), module.funcs.size(), module.exports.size());
        return module;
    }

    // the data count section sits between the element and code sections
    private static int sectionRank(byte id, int offset) {
        switch (id) {
            // @formatter:off
            case SECTION_TYPE: return 1;
            case SECTION_IMPORT: return 2;
            case SECTION_FUNCTION: return 3;
            case SECTION_TABLE: return 4;
            case SECTION_MEMORY: return 5;
            case SECTION_GLOBAL: return 6;
            case SECTION_EXPORT: return 7;
            case SECTION_START: return 8;
            case SECTION_ELEMENT: return 9;
            case SECTION_DATA_COUNT: return 10;
            case SECTION_CODE: return 11;
            case SECTION_DATA: return 12;
            // @formatter:on
            default:
                throw new MalformedModuleException("malformed section id " + Byte.toUnsignedInt(id), offset);
        }
    }

    private void readCustom(ModuleNode module, ByteInput section, int sectionStart) {
        String name = section.readName();
        byte[] payload = section.readBytes(section.remaining());
        module.customs.add(new CustomNode(name,
                "name".equals(name) ? payload : null,
                new SourceLocation(sectionStart, section.position() - sectionStart)));
    }

    private void readSection(ModuleNode module, byte id, ByteInput in) {
        switch (id) {
            case SECTION_TYPE: {
                int count = in.readU32();
                for (int i = 0; i < count; i++) {
                    int start = in.position();
                    if (in.readByte() != TYPES_FUNCTION) {
                        throw new MalformedModuleException("malformed function type", start);
                    }
                    ValType[] params = readValTypes(in);
                    ValType[] results = readValTypes(in);
                    module.types.add(new TypeNode(params, results));
                }
                break;
            }
            case SECTION_IMPORT: {
                int count = in.readU32();
                for (int i = 0; i < count; i++) {
                    String mod = in.readName();
                    String name = in.readName();
                    int kindStart = in.position();
                    byte kind = in.readByte();
                    switch (kind) {
                        case IMPORTS_FUNC:
                            module.imports.add(new ImportNode.Func(mod, name, in.readU32()));
                            break;
                        case IMPORTS_TABLE:
                            module.imports.add(new ImportNode.Table(mod, name, readTable(in)));
                            break;
                        case IMPORTS_MEM:
                            module.imports.add(new ImportNode.Memory(mod, name, new MemoryNode(readLimits(in))));
                            break;
                        case IMPORTS_GLOBAL:
                            module.imports.add(new ImportNode.Global(mod, name, readGlobalType(in)));
                            break;
                        default:
                            throw new MalformedModuleException("malformed import kind", kindStart);
                    }
                }
                break;
            }
            case SECTION_FUNCTION: {
                int count = in.readU32();
                for (int i = 0; i < count; i++) {
                    module.funcs.add(new FuncNode(in.readU32()));
                }
                break;
            }
            case SECTION_TABLE: {
                int count = in.readU32();
                for (int i = 0; i < count; i++) {
                    module.tables.add(readTable(in));
                }
                break;
            }
            case SECTION_MEMORY: {
                int count = in.readU32();
                for (int i = 0; i < count; i++) {
                    module.mems.add(new MemoryNode(readLimits(in)));
                }
                break;
            }
            case SECTION_GLOBAL: {
                int count = in.readU32();
                for (int i = 0; i < count; i++) {
                    GlobalTypeNode type = readGlobalType(in);
                    module.globals.add(new GlobalNode(type, readExpr(in)));
                }
                break;
            }
            case SECTION_EXPORT: {
                int count = in.readU32();
                for (int i = 0; i < count; i++) {
                    String name = in.readName();
                    int kindStart = in.position();
                    byte kind = in.readByte();
                    if (kind < IMPORTS_FUNC || kind > IMPORTS_GLOBAL) {
                        throw new MalformedModuleException("malformed export kind", kindStart);
                    }
                    module.exports.add(new ExportNode(name, kind, in.readU32()));
                }
                break;
            }
            case SECTION_START:
                module.start = in.readU32();
                break;
            case SECTION_ELEMENT: {
                int count = in.readU32();
                for (int i = 0; i < count; i++) {
                    module.elems.add(readElement(in));
                }
                break;
            }
            case SECTION_DATA_COUNT:
                module.dataCount = in.readU32();
                break;
            case SECTION_CODE: {
                int count = in.readU32();
                for (int i = 0; i < count; i++) {
                    module.codes.add(readCode(in));
                }
                break;
            }
            case SECTION_DATA: {
                int count = in.readU32();
                for (int i = 0; i < count; i++) {
                    module.datas.add(readData(in));
                }
                break;
            }
            default:
                throw new AssertionError();
        }
    }

    private static ValType readValType(ByteInput in) {
        int start = in.position();
        byte b = in.readByte();
        try {
            return ValType.fromOpcode(b);
        } catch (IllegalArgumentException e) {
            throw new MalformedModuleException("malformed value type", start);
        }
    }

    private static ValType readRefType(ByteInput in) {
        int start = in.position();
        ValType type = readValType(in);
        if (!type.isReference()) throw new MalformedModuleException("malformed reference type", start);
        return type;
    }

    private static ValType[] readValTypes(ByteInput in) {
        int count = in.readU32();
        if (count < 0 || count > in.remaining()) {
            throw new MalformedModuleException("unexpected end", in.position());
        }
        ValType[] types = new ValType[count];
        for (int i = 0; i < count; i++) {
            types[i] = readValType(in);
        }
        return types;
    }

    private static Limits readLimits(ByteInput in) {
        int start = in.position();
        byte flag = in.readByte();
        switch (flag) {
            case LIMITS_NOMAX:
                return new Limits(in.readU32(), null);
            case LIMITS_MAX: {
                int min = in.readU32();
                return new Limits(min, in.readU32());
            }
            default:
                throw new MalformedModuleException("integer too large", start);
        }
    }

    private static TableNode readTable(ByteInput in) {
        ValType type = readRefType(in);
        return new TableNode(readLimits(in), type);
    }

    private static GlobalTypeNode readGlobalType(ByteInput in) {
        ValType type = readValType(in);
        int start = in.position();
        byte mut = in.readByte();
        if (mut != MUT_CONST && mut != MUT_VAR) throw new MalformedModuleException("malformed mutability", start);
        return new GlobalTypeNode(mut == MUT_VAR, type);
    }

    private static ElementNode readElement(ByteInput in) {
        int start = in.position();
        int flags = in.readU32();
        if (flags < 0 || flags > 7) throw new MalformedModuleException("malformed elements segment kind", start);
        boolean passiveOrDeclarative = (flags & 1) != 0;
        boolean explicitTable = (flags & 2) != 0;
        boolean usesExprs = (flags & 4) != 0;

        ElementNode.Mode mode;
        int table = 0;
        ExprNode offset = null;
        if (passiveOrDeclarative) {
            mode = explicitTable ? ElementNode.Mode.DECLARATIVE : ElementNode.Mode.PASSIVE;
        } else {
            mode = ElementNode.Mode.ACTIVE;
            if (explicitTable) table = in.readU32();
            offset = readExpr(in);
        }

        ValType type = ValType.FUNCREF;
        if (passiveOrDeclarative || explicitTable) {
            if (usesExprs) {
                type = readRefType(in);
            } else {
                int kindStart = in.position();
                if (in.readByte() != ELEMKIND_FUNCREF) {
                    throw new MalformedModuleException("malformed element kind", kindStart);
                }
            }
        }

        int count = in.readU32();
        List<ExprNode> init = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            if (usesExprs) {
                init.add(readExpr(in));
            } else {
                int funcStart = in.position();
                FuncRefInsnNode ref = new FuncRefInsnNode(in.readU32());
                ref.location = new SourceLocation(funcStart, in.position() - funcStart);
                ExprNode expr = new ExprNode(new ArrayList<>(Collections.singletonList(ref)));
                expr.location = ref.location;
                init.add(expr);
            }
        }
        return new ElementNode(mode, table, offset, type, init);
    }

    private static DataNode readData(ByteInput in) {
        int start = in.position();
        int flags = in.readU32();
        switch (flags) {
            case 0: {
                ExprNode offset = readExpr(in);
                return new DataNode(true, 0, offset, in.readBytes(in.readU32()));
            }
            case 1:
                return new DataNode(false, 0, null, in.readBytes(in.readU32()));
            case 2: {
                int memory = in.readU32();
                ExprNode offset = readExpr(in);
                return new DataNode(true, memory, offset, in.readBytes(in.readU32()));
            }
            default:
                throw new MalformedModuleException("malformed data segment kind", start);
        }
    }

    private static CodeNode readCode(ByteInput in) {
        int start = in.position();
        int size = in.readU32();
        ByteInput body = in.slice(size);

        int groups = body.readU32();
        long total = 0;
        List<ValType> locals = new ArrayList<>();
        for (int i = 0; i < groups; i++) {
            int groupStart = body.position();
            long count = Integer.toUnsignedLong(body.readU32());
            total += count;
            if (total > MAX_LOCALS) throw new MalformedModuleException("too many locals", groupStart);
            ValType type = readValType(body);
            for (long j = 0; j < count; j++) locals.add(type);
        }
        ExprNode expr = readExpr(body);
        if (body.hasMore()) {
            throw new MalformedModuleException("section size mismatch", body.position());
        }
        CodeNode code = new CodeNode(locals.toArray(new ValType[0]), expr);
        code.location = new SourceLocation(start, in.position() - start);
        return code;
    }

    /**
     * Read an expression terminated by {@code end}.
     *
     * @param in The input.
     * @return The expression.
     */
    static ExprNode readExpr(ByteInput in) {
        int start = in.position();
        ExprNode expr = new ExprNode();
        byte terminator = readInstructions(in, expr);
        if (terminator != END) throw new MalformedModuleException("else outside of if", in.position() - 1);
        expr.location = new SourceLocation(start, in.position() - start);
        return expr;
    }

    /**
     * Read instructions into {@code into} until an {@code end} or {@code else}, which is consumed.
     *
     * @return The terminating opcode.
     */
    private static byte readInstructions(ByteInput in, ExprNode into) {
        while (true) {
            int start = in.position();
            byte opcode = in.readByte();
            if (opcode == END || opcode == ELSE) return opcode;
            AbstractInsnNode insn = readInsn(in, opcode, start);
            insn.location = new SourceLocation(start, in.position() - start);
            into.instructions.add(insn);
        }
    }

    private static BlockType readBlockType(ByteInput in) {
        int start = in.position();
        byte b = in.peekByte();
        if (b == EMPTY_TYPE) {
            in.readByte();
            return BlockType.EMPTY;
        }
        if (b < 0x40 || b == V128) {
            if (b == V128) throw new MalformedModuleException("malformed value type", start);
            long index = Leb128.readSigned(in, 33);
            if (index < 0 || index > 0xFFFFFFFFL) throw new MalformedModuleException("malformed block type", start);
            return BlockType.functype((int) index);
        }
        return BlockType.valtype(readValType(in));
    }

    private static void readZeroByte(ByteInput in) {
        int start = in.position();
        if (in.readByte() != 0) throw new MalformedModuleException("zero byte expected", start);
    }

    private static AbstractInsnNode readInsn(ByteInput in, byte opcode, int start) {
        switch (opcode) {
            case BLOCK:
            case LOOP: {
                BlockType type = readBlockType(in);
                ExprNode body = new ExprNode();
                int bodyStart = in.position();
                if (readInstructions(in, body) != END) {
                    throw new MalformedModuleException("else outside of if", in.position() - 1);
                }
                body.location = new SourceLocation(bodyStart, in.position() - bodyStart);
                return new BlockInsnNode(opcode, type, body, null);
            }
            case IF: {
                BlockType type = readBlockType(in);
                ExprNode then = new ExprNode();
                int thenStart = in.position();
                byte terminator = readInstructions(in, then);
                then.location = new SourceLocation(thenStart, in.position() - thenStart);
                ExprNode otherwise = null;
                if (terminator == ELSE) {
                    otherwise = new ExprNode();
                    int elseStart = in.position();
                    if (readInstructions(in, otherwise) != END) {
                        throw new MalformedModuleException("duplicate else", in.position() - 1);
                    }
                    otherwise.location = new SourceLocation(elseStart, in.position() - elseStart);
                }
                return new BlockInsnNode(opcode, type, then, otherwise);
            }
            case BR:
            case BR_IF:
                return new BreakInsnNode(opcode, in.readU32());
            case BR_TABLE: {
                int count = in.readU32();
                if (count < 0 || count > in.remaining()) throw new MalformedModuleException("unexpected end", in.position());
                int[] labels = new int[count];
                for (int i = 0; i < count; i++) labels[i] = in.readU32();
                return new TableBreakInsnNode(labels, in.readU32());
            }
            case CALL:
                return new CallInsnNode(in.readU32());
            case CALL_INDIRECT: {
                int type = in.readU32();
                return new CallIndirectInsnNode(type, in.readU32());
            }
            case REF_NULL:
                return new NullInsnNode(readRefType(in));
            case REF_FUNC:
                return new FuncRefInsnNode(in.readU32());
            case SELECTT: {
                int countStart = in.position();
                if (in.readU32() != 1) throw new MalformedModuleException("invalid result arity", countStart);
                return new SelectInsnNode(readValType(in));
            }
            case SELECT:
                return new SelectInsnNode(null);
            case LOCAL_GET:
            case LOCAL_SET:
            case LOCAL_TEE:
            case GLOBAL_GET:
            case GLOBAL_SET:
                return new VariableInsnNode(opcode, in.readU32());
            case TABLE_GET:
            case TABLE_SET:
                return new TableInsnNode(opcode, in.readU32());
            case MEMORY_SIZE:
            case MEMORY_GROW:
                readZeroByte(in);
                return new InsnNode(opcode);
            case I32_CONST:
                return new ConstInsnNode(opcode, in.readS32());
            case I64_CONST:
                return new ConstInsnNode(opcode, in.readS64());
            case F32_CONST:
                return new ConstInsnNode(opcode, Integer.toUnsignedLong(in.readFixed32()));
            case F64_CONST:
                return new ConstInsnNode(opcode, in.readFixed64());
            case INSN_PREFIX:
                return readPrefixInsn(in, start);
            case VECTOR_PREFIX:
                throw new MalformedModuleException("SIMD instructions are not supported", start);
            default:
                break;
        }
        if (opcode >= I32_LOAD && opcode <= I64_STORE32) {
            int align = in.readU32();
            return new MemInsnNode(opcode, align, in.readU32());
        }
        if (opcode == UNREACHABLE
                || opcode == NOP
                || opcode == RETURN
                || opcode == DROP
                || opcode == REF_IS_NULL
                || (Byte.toUnsignedInt(opcode) >= Byte.toUnsignedInt(I32_EQZ)
                && Byte.toUnsignedInt(opcode) <= Byte.toUnsignedInt(I64_EXTEND32_S))) {
            return new InsnNode(opcode);
        }
        throw new MalformedModuleException(String.format("illegal opcode 0x%02x", Byte.toUnsignedInt(opcode)), start);
    }

    private static AbstractInsnNode readPrefixInsn(ByteInput in, int start) {
        int intOpcode = in.readU32();
        switch (intOpcode) {
            case I32_TRUNC_SAT_F32_S:
            case I32_TRUNC_SAT_F32_U:
            case I32_TRUNC_SAT_F64_S:
            case I32_TRUNC_SAT_F64_U:
            case I64_TRUNC_SAT_F32_S:
            case I64_TRUNC_SAT_F32_U:
            case I64_TRUNC_SAT_F64_S:
            case I64_TRUNC_SAT_F64_U:
                return new PrefixInsnNode(intOpcode);
            case MEMORY_INIT: {
                int data = in.readU32();
                readZeroByte(in);
                return new PrefixInsnNode(intOpcode, data, 0);
            }
            case DATA_DROP:
            case ELEM_DROP:
                return new PrefixInsnNode(intOpcode, in.readU32(), 0);
            case MEMORY_COPY:
                readZeroByte(in);
                readZeroByte(in);
                return new PrefixInsnNode(intOpcode);
            case MEMORY_FILL:
                readZeroByte(in);
                return new PrefixInsnNode(intOpcode);
            case TABLE_INIT:
            case TABLE_COPY: {
                int first = in.readU32();
                return new PrefixInsnNode(intOpcode, first, in.readU32());
            }
            case TABLE_GROW:
            case TABLE_SIZE:
            case TABLE_FILL:
                return new PrefixInsnNode(intOpcode, in.readU32(), 0);
            default:
                throw new MalformedModuleException("illegal opcode 0xfc " + Integer.toUnsignedString(intOpcode), start);
        }
    }
}
