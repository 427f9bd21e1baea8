package io.github.eutro.durawasm.binary;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * A bounded cursor over a module's bytes. Positions are absolute offsets into the whole module.
 */
public class ByteInput {
    private final byte[] bytes;
    private int pos;
    private final int limit;

    public ByteInput(byte[] bytes) {
        this(bytes, 0, bytes.length);
    }

    private ByteInput(byte[] bytes, int pos, int limit) {
        this.bytes = bytes;
        this.pos = pos;
        this.limit = limit;
    }

    public int position() {
        return pos;
    }

    public boolean hasMore() {
        return pos < limit;
    }

    public int remaining() {
        return limit - pos;
    }

    public byte peekByte() {
        if (pos >= limit) throw new MalformedModuleException("unexpected end", pos);
        return bytes[pos];
    }

    public byte readByte() {
        if (pos >= limit) throw new MalformedModuleException("unexpected end", pos);
        return bytes[pos++];
    }

    public byte[] readBytes(int len) {
        if (len < 0 || len > remaining()) throw new MalformedModuleException("unexpected end", pos);
        byte[] ret = new byte[len];
        System.arraycopy(bytes, pos, ret, 0, len);
        pos += len;
        return ret;
    }

    /**
     * Split off the next {@code len} bytes as their own input, and skip past them in this one.
     *
     * @param len The number of bytes.
     * @return The sub-input.
     */
    public ByteInput slice(int len) {
        if (len < 0 || len > remaining()) throw new MalformedModuleException("unexpected end of section or function", pos);
        ByteInput sub = new ByteInput(bytes, pos, pos + len);
        pos += len;
        return sub;
    }

    public int readU32() {
        return (int) Leb128.readUnsigned(this, 32);
    }

    public int readS32() {
        return (int) Leb128.readSigned(this, 32);
    }

    public long readS64() {
        return Leb128.readSigned(this, 64);
    }

    public int readFixed32() {
        int start = pos;
        if (remaining() < 4) throw new MalformedModuleException("unexpected end", start);
        int v = ByteBuffer.wrap(bytes, pos, 4).order(ByteOrder.LITTLE_ENDIAN).getInt();
        pos += 4;
        return v;
    }

    public long readFixed64() {
        int start = pos;
        if (remaining() < 8) throw new MalformedModuleException("unexpected end", start);
        long v = ByteBuffer.wrap(bytes, pos, 8).order(ByteOrder.LITTLE_ENDIAN).getLong();
        pos += 8;
        return v;
    }

    /**
     * Read a length-prefixed UTF-8 name.
     *
     * @return The name.
     */
    public String readName() {
        int len = readU32();
        int start = pos;
        byte[] raw = readBytes(len);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(raw)).toString();
        } catch (CharacterCodingException e) {
            throw new MalformedModuleException("malformed UTF-8 encoding", start);
        }
    }
}
