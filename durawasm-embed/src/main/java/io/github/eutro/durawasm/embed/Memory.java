package io.github.eutro.durawasm.embed;

import io.github.eutro.durawasm.embed.exec.TrapException;
import io.github.eutro.durawasm.embed.exec.TrapKind;
import io.github.eutro.durawasm.tree.Limits;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

import static io.github.eutro.durawasm.Opcodes.PAGE_SIZE;

/**
 * A linear memory instance, backed by a little-endian heap {@link ByteBuffer}.
 * <p>
 * Effective addresses are computed as unsigned longs, so an access past the end always traps instead of
 * wrapping around. A buffer can hold at most {@link #MAX_BUFFER_PAGES} pages, and growing past that fails.
 */
public final class Memory {
    /**
     * The most pages a single buffer can hold.
     */
    public static final int MAX_BUFFER_PAGES = Integer.MAX_VALUE / PAGE_SIZE;

    private ByteBuffer buf;
    private final @Nullable Integer max;

    public Memory(int min, @Nullable Integer max) {
        if (Integer.toUnsignedLong(min) > MAX_BUFFER_PAGES) {
            throw new IllegalArgumentException("Cannot allocate " + Integer.toUnsignedString(min) + " pages");
        }
        this.max = max;
        this.buf = ByteBuffer.allocate(min * PAGE_SIZE)
                .order(ByteOrder.LITTLE_ENDIAN);
    }

    public Memory(ExternType.Mem type) {
        this(type.limits.min, type.limits.max);
    }

    /**
     * @return The size of the memory, in pages.
     */
    public int size() {
        return buf.capacity() / PAGE_SIZE;
    }

    public int byteSize() {
        return buf.capacity();
    }

    public @Nullable Integer getMax() {
        return max;
    }

    /**
     * Grow the memory, zero filling the new pages.
     *
     * @param growByPages The unsigned number of pages to grow by.
     * @return The old size in pages, or -1 if the memory could not grow.
     */
    public int grow(int growByPages) {
        if (growByPages < 0) {
            return -1;
        }
        int sz = size();
        long newSize = (long) sz + growByPages;
        if (newSize > MAX_BUFFER_PAGES || (max != null && newSize > Integer.toUnsignedLong(max))) {
            return -1;
        }
        ByteBuffer newBuf;
        try {
            newBuf = ByteBuffer.allocate((int) newSize * PAGE_SIZE)
                    .order(ByteOrder.LITTLE_ENDIAN);
        } catch (OutOfMemoryError ignored) {
            return -1;
        }
        System.arraycopy(buf.array(), 0, newBuf.array(), 0, buf.capacity());
        buf = newBuf;
        return sz;
    }

    private int check(long ea, long len) {
        if (ea < 0 || ea + len > buf.capacity()) {
            throw new TrapException(TrapKind.MEMORY_OUT_OF_BOUNDS);
        }
        return (int) ea;
    }

    private static long unsigned(int x) {
        return Integer.toUnsignedLong(x);
    }

    /**
     * Load a little-endian integer of up to 8 bytes.
     *
     * @param ea     The effective address.
     * @param width  The number of bytes, 1, 2, 4 or 8.
     * @param signed Whether to sign extend a narrower integer, rather than zero extend it.
     * @return The loaded bits.
     */
    public long load(long ea, int width, boolean signed) {
        int addr = check(ea, width);
        switch (width) {
            case 1:
                return signed ? buf.get(addr) : Byte.toUnsignedLong(buf.get(addr));
            case 2:
                return signed ? buf.getShort(addr) : Short.toUnsignedLong(buf.getShort(addr));
            case 4:
                return signed ? buf.getInt(addr) : Integer.toUnsignedLong(buf.getInt(addr));
            case 8:
                return buf.getLong(addr);
            default:
                throw new IllegalArgumentException("Bad access width " + width);
        }
    }

    /**
     * Store the low bytes of a value, little-endian.
     *
     * @param ea    The effective address.
     * @param width The number of bytes, 1, 2, 4 or 8.
     * @param value The value to store.
     */
    public void store(long ea, int width, long value) {
        int addr = check(ea, width);
        switch (width) {
            case 1:
                buf.put(addr, (byte) value);
                break;
            case 2:
                buf.putShort(addr, (short) value);
                break;
            case 4:
                buf.putInt(addr, (int) value);
                break;
            case 8:
                buf.putLong(addr, value);
                break;
            default:
                throw new IllegalArgumentException("Bad access width " + width);
        }
    }

    public byte read(int addr) {
        return buf.get(check(unsigned(addr), 1));
    }

    public void write(int addr, byte value) {
        buf.put(check(unsigned(addr), 1), value);
    }

    public byte[] read(int addr, int len) {
        int start = check(unsigned(addr), unsigned(len));
        return Arrays.copyOfRange(buf.array(), start, start + len);
    }

    public void write(int addr, byte[] bytes) {
        int start = check(unsigned(addr), bytes.length);
        System.arraycopy(bytes, 0, buf.array(), start, bytes.length);
    }

    public void fill(int dstIdx, byte value, int len) {
        int start = check(unsigned(dstIdx), unsigned(len));
        Arrays.fill(buf.array(), start, start + len, value);
    }

    /**
     * Copy within the memory. The ranges may overlap.
     */
    public void copy(int dstIdx, int srcIdx, int len) {
        int src = check(unsigned(srcIdx), unsigned(len));
        int dst = check(unsigned(dstIdx), unsigned(len));
        System.arraycopy(buf.array(), src, buf.array(), dst, len);
    }

    /**
     * Initialise a range of the memory from a data segment.
     *
     * @param dstIdx The address to start at.
     * @param data   The segment's bytes.
     * @param srcIdx The index in the segment to start at.
     * @param len    The number of bytes to copy.
     */
    public void init(int dstIdx, byte[] data, int srcIdx, int len) {
        if (unsigned(srcIdx) + unsigned(len) > data.length) {
            throw new TrapException(TrapKind.MEMORY_OUT_OF_BOUNDS);
        }
        int dst = check(unsigned(dstIdx), unsigned(len));
        System.arraycopy(data, srcIdx, buf.array(), dst, len);
    }

    /**
     * @return A copy of the memory's contents.
     */
    public byte[] contents() {
        return buf.array().clone();
    }

    /**
     * Replace the memory's contents, resizing it, as when restoring an image of a store.
     *
     * @param contents The new contents, a whole number of pages.
     */
    public void overwrite(byte[] contents) {
        if (contents.length % PAGE_SIZE != 0) {
            throw new IllegalArgumentException("Memory image is not a whole number of pages");
        }
        if (max != null && contents.length / PAGE_SIZE > Integer.toUnsignedLong(max)) {
            throw new IllegalArgumentException("Memory image exceeds maximum size");
        }
        buf = ByteBuffer.wrap(contents.clone()).order(ByteOrder.LITTLE_ENDIAN);
    }

    @NotNull
    public ExternType.Mem getType() {
        return new ExternType.Mem(new Limits(size(), max));
    }
}
