package io.github.eutro.durawasm.embed;

import io.github.eutro.durawasm.ValType;
import io.github.eutro.durawasm.embed.exec.EngineStateException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValueTest {
    @Test
    void testBits() {
        assertEquals(0xFFFFFFFFL, Value.i32(-1).getBits());
        assertEquals(-1, Value.i32(-1).asI32());
        assertEquals(Value.f32(1.5f), Value.fromBits(ValType.F32, Value.f32(1.5f).getBits()));
        assertEquals(Double.doubleToRawLongBits(-0.0), Value.f64(-0.0).getBits());
        assertNotEquals(Value.f64(0.0), Value.f64(-0.0));
    }

    @Test
    void testNaNPayloadsArePreserved() {
        int payload = 0x7FA00001;
        assertEquals(Integer.toUnsignedLong(payload), Value.f32Bits(payload).getBits());
        assertEquals(Value.f32Bits(payload), Value.fromBits(ValType.F32, Integer.toUnsignedLong(payload)));
        assertNotEquals(Value.f32Bits(payload), Value.f32Bits(0x7FC00000));
    }

    @Test
    void testReferences() {
        assertTrue(Value.nullRef(ValType.FUNCREF).isNull());
        assertFalse(Value.funcRef(0).isNull());
        assertEquals(3, Value.externRef(3).asExternHandle());
        assertThrows(IllegalArgumentException.class, () -> Value.externRef(-1));
        assertThrows(IllegalArgumentException.class, () -> Value.fromBits(ValType.EXTERNREF, -2));
        assertNotEquals(Value.nullRef(ValType.FUNCREF), Value.nullRef(ValType.EXTERNREF));
        assertEquals(Value.zero(ValType.EXTERNREF), Value.nullRef(ValType.EXTERNREF));
    }

    @Test
    void testTypeMismatch() {
        assertThrows(EngineStateException.class, () -> Value.i64(1).asI32());
        assertThrows(EngineStateException.class, () -> Value.i32(1).asFuncAddr());
    }
}
