package io.github.eutro.durawasm.binary;

import java.io.ByteArrayOutputStream;

/**
 * LEB128 variable-length integers.
 * <p>
 * Decoding accepts padded encodings, but never more than {@code ceil(bits / 7)} bytes, and the unused bits of a
 * final byte must be a zero extension (unsigned) or a sign extension (signed).
 */
public final class Leb128 {
    private Leb128() {
    }

    public static long readUnsigned(ByteInput in, int bits) {
        int maxBytes = (bits + 6) / 7;
        int start = in.position();
        long result = 0;
        int shift = 0;
        for (int i = 0; ; i++) {
            int b = in.readByte() & 0xFF;
            if (i == maxBytes - 1) {
                if ((b & 0x80) != 0) {
                    throw new MalformedModuleException("integer representation too long", start);
                }
                if ((b >>> (bits - shift)) != 0) {
                    throw new MalformedModuleException("integer too large", start);
                }
            }
            result |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) return result;
            shift += 7;
        }
    }

    public static long readSigned(ByteInput in, int bits) {
        int maxBytes = (bits + 6) / 7;
        int start = in.position();
        long result = 0;
        int shift = 0;
        for (int i = 0; ; i++) {
            int b = in.readByte() & 0xFF;
            if (i == maxBytes - 1) {
                if ((b & 0x80) != 0) {
                    throw new MalformedModuleException("integer representation too long", start);
                }
                int usable = bits - shift;
                int signAndUnused = b >> (usable - 1);
                if (signAndUnused != 0 && signAndUnused != (0x7F >> (usable - 1))) {
                    throw new MalformedModuleException("integer too large", start);
                }
            }
            result |= (long) (b & 0x7F) << shift;
            shift += 7;
            if ((b & 0x80) == 0) {
                if (shift < 64 && (b & 0x40) != 0) {
                    result |= -1L << shift;
                }
                return result;
            }
        }
    }

    public static long decodeUnsigned(byte[] bytes, int bits) {
        return readUnsigned(new ByteInput(bytes), bits);
    }

    public static long decodeSigned(byte[] bytes, int bits) {
        return readSigned(new ByteInput(bytes), bits);
    }

    /**
     * Minimally encode an unsigned integer.
     *
     * @param value The value, interpreted as unsigned.
     * @return The encoding.
     */
    public static byte[] encodeUnsigned(long value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        do {
            int b = (int) (value & 0x7F);
            value >>>= 7;
            if (value != 0) b |= 0x80;
            out.write(b);
        } while (value != 0);
        return out.toByteArray();
    }

    /**
     * Minimally encode a signed integer.
     *
     * @param value The value.
     * @return The encoding.
     */
    public static byte[] encodeSigned(long value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        while (true) {
            int b = (int) (value & 0x7F);
            value >>= 7;
            boolean done = (value == 0 && (b & 0x40) == 0) || (value == -1 && (b & 0x40) != 0);
            if (!done) b |= 0x80;
            out.write(b);
            if (done) return out.toByteArray();
        }
    }
}
