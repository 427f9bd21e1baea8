package io.github.eutro.durawasm.binary;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Leb128Test {
    private static final long[] SAMPLES = {
            0, 1, 63, 64, 127, 128, 255, 256, 624485, Integer.MAX_VALUE, -1, -64, -65, -123456,
            Integer.MIN_VALUE, Long.MAX_VALUE, Long.MIN_VALUE
    };

    @Test
    void testRoundTrip() {
        for (long sample : SAMPLES) {
            assertEquals(sample, Leb128.decodeSigned(Leb128.encodeSigned(sample), 64), "signed " + sample);
            assertEquals(sample, Leb128.decodeUnsigned(Leb128.encodeUnsigned(sample), 64), "unsigned " + sample);
            int narrow = (int) sample;
            assertEquals(narrow, (int) Leb128.decodeSigned(Leb128.encodeSigned(narrow), 32));
            assertEquals(Integer.toUnsignedLong(narrow),
                    Leb128.decodeUnsigned(Leb128.encodeUnsigned(Integer.toUnsignedLong(narrow)), 32));
        }
    }

    @Test
    void testKnownEncodings() {
        assertArrayEquals(new byte[]{(byte) 0xE5, (byte) 0x8E, 0x26}, Leb128.encodeUnsigned(624485));
        assertArrayEquals(new byte[]{(byte) 0xC0, (byte) 0xBB, 0x78}, Leb128.encodeSigned(-123456));
        assertArrayEquals(new byte[]{0x7F}, Leb128.encodeSigned(-1));
    }

    @Test
    void testPaddedEncodingsAccepted() {
        assertEquals(3, Leb128.decodeUnsigned(new byte[]{(byte) 0x83, (byte) 0x80, (byte) 0x80, (byte) 0x80, 0x00}, 32));
        assertEquals(-1, Leb128.decodeSigned(new byte[]{(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0x7F}, 32));
        assertEquals(5, Leb128.decodeSigned(new byte[]{(byte) 0x85, 0x00}, 32));
    }

    @Test
    void testTooLong() {
        assertThrows(MalformedModuleException.class, () -> Leb128.decodeUnsigned(
                new byte[]{(byte) 0x80, (byte) 0x80, (byte) 0x80, (byte) 0x80, (byte) 0x80, 0x00}, 32));
        assertThrows(MalformedModuleException.class, () -> Leb128.decodeSigned(
                new byte[]{(byte) 0x80, (byte) 0x80, (byte) 0x80, (byte) 0x80, (byte) 0x80, 0x00}, 32));
    }

    @Test
    void testUnusedBitsChecked() {
        // 2^32 does not fit in 32 bits
        assertThrows(MalformedModuleException.class, () -> Leb128.decodeUnsigned(
                new byte[]{(byte) 0x80, (byte) 0x80, (byte) 0x80, (byte) 0x80, 0x10}, 32));
        // the sign bit and the unused bits disagree
        assertThrows(MalformedModuleException.class, () -> Leb128.decodeSigned(
                new byte[]{(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0x4F}, 32));
        assertThrows(MalformedModuleException.class, () -> Leb128.decodeSigned(
                new byte[]{(byte) 0x80, (byte) 0x80, (byte) 0x80, (byte) 0x80, 0x70}, 32));
    }

    @Test
    void testTruncated() {
        MalformedModuleException e = assertThrows(MalformedModuleException.class,
                () -> Leb128.decodeUnsigned(new byte[]{(byte) 0x80, (byte) 0x80}, 32));
        assertEquals(2, e.getOffset());
    }
}
