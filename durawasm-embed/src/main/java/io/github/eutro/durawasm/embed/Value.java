package io.github.eutro.durawasm.embed;

import io.github.eutro.durawasm.ValType;
import io.github.eutro.durawasm.embed.exec.EngineStateException;

/**
 * A WebAssembly value: a value type, and its bits.
 * <p>
 * Numbers keep their raw bit pattern, so NaN payloads are preserved. References hold a function address or
 * an opaque host handle, or {@link #NULL_BITS} when null.
 */
public final class Value {
    /**
     * The bits of a null reference. Addresses and handles are non-negative, so this never collides.
     */
    public static final long NULL_BITS = -1L;

    private final ValType type;
    private final long bits;

    private Value(ValType type, long bits) {
        this.type = type;
        this.bits = bits;
    }

    public static Value i32(int value) {
        return new Value(ValType.I32, Integer.toUnsignedLong(value));
    }

    public static Value i64(long value) {
        return new Value(ValType.I64, value);
    }

    public static Value f32(float value) {
        return f32Bits(Float.floatToRawIntBits(value));
    }

    public static Value f32Bits(int bits) {
        return new Value(ValType.F32, Integer.toUnsignedLong(bits));
    }

    public static Value f64(double value) {
        return f64Bits(Double.doubleToRawLongBits(value));
    }

    public static Value f64Bits(long bits) {
        return new Value(ValType.F64, bits);
    }

    /**
     * A reference to the function at an address in a store.
     *
     * @param addr The function address.
     * @return The reference.
     */
    public static Value funcRef(int addr) {
        if (addr < 0) throw new IllegalArgumentException("Negative function address " + addr);
        return new Value(ValType.FUNCREF, addr);
    }

    /**
     * A reference to a host object, identified by a handle of the host's choosing.
     *
     * @param handle The handle.
     * @return The reference.
     */
    public static Value externRef(int handle) {
        if (handle < 0) throw new IllegalArgumentException("Negative extern handle " + handle);
        return new Value(ValType.EXTERNREF, handle);
    }

    public static Value nullRef(ValType type) {
        if (!type.isReference()) throw new IllegalArgumentException("Not a reference type: " + type);
        return new Value(type, NULL_BITS);
    }

    /**
     * Rebuild a value from its type and bits, as returned by {@link #getBits()}.
     *
     * @param type The type.
     * @param bits The bits.
     * @return The value.
     */
    public static Value fromBits(ValType type, long bits) {
        switch (type) {
            case I32:
                return i32((int) bits);
            case F32:
                return f32Bits((int) bits);
            case FUNCREF:
            case EXTERNREF:
                if (bits != NULL_BITS && (bits < 0 || bits > Integer.MAX_VALUE)) {
                    throw new IllegalArgumentException("Bad reference bits " + bits);
                }
                return new Value(type, bits);
            default:
                return new Value(type, bits);
        }
    }

    /**
     * The default value of a type: zero, or a null reference.
     *
     * @param type The type.
     * @return The value.
     */
    public static Value zero(ValType type) {
        return type.isReference() ? nullRef(type) : new Value(type, 0);
    }

    public ValType getType() {
        return type;
    }

    public long getBits() {
        return bits;
    }

    private void expect(ValType expected) {
        if (type != expected) {
            throw new EngineStateException("Expected a value of type " + expected + ", got " + this);
        }
    }

    public int asI32() {
        expect(ValType.I32);
        return (int) bits;
    }

    public long asI64() {
        expect(ValType.I64);
        return bits;
    }

    public float asF32() {
        expect(ValType.F32);
        return Float.intBitsToFloat((int) bits);
    }

    public double asF64() {
        expect(ValType.F64);
        return Double.longBitsToDouble(bits);
    }

    public boolean isNull() {
        return type.isReference() && bits == NULL_BITS;
    }

    /**
     * @return The function address this references.
     * @throws EngineStateException If this is not a non-null function reference.
     */
    public int asFuncAddr() {
        expect(ValType.FUNCREF);
        if (isNull()) throw new EngineStateException("Null function reference");
        return (int) bits;
    }

    public int asExternHandle() {
        expect(ValType.EXTERNREF);
        if (isNull()) throw new EngineStateException("Null extern reference");
        return (int) bits;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Value value = (Value) o;
        return bits == value.bits && type == value.type;
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Long.hashCode(bits);
    }

    @Override
    public String toString() {
        switch (type) {
            case I32:
                return "i32:" + (int) bits;
            case I64:
                return "i64:" + bits;
            case F32:
                return "f32:" + Float.intBitsToFloat((int) bits);
            case F64:
                return "f64:" + Double.longBitsToDouble(bits);
            default:
                return type + ":" + (isNull() ? "null" : Long.toString(bits));
        }
    }
}
