package io.github.eutro.durawasm.embed.exec;

import static io.github.eutro.durawasm.embed.exec.TrapKind.*;

/**
 * Java implementations of the WebAssembly numeric primitives.
 * <p>
 * Comparisons return 1 or 0. Operations that trap throw {@link TrapException}.
 */
@SuppressWarnings("DuplicatedCode")
public final class Operators {
    private static final double MAX_ULONG = (double) Long.MAX_VALUE * 2d;
    private static final long MAX_UINT = 0xFFFFFFFFL;

    private Operators() {
    }

    private static TrapException trap(TrapKind kind) {
        return new TrapException(kind);
    }

    // @formatter:off

    // region Comparisons
    // region i32
    public static int i32Eqz(int x) { return x == 0 ? 1 : 0; }
    public static int i32Eq(int x, int y) { return x == y ? 1 : 0; }
    public static int i32Ne(int x, int y) { return x != y ? 1 : 0; }
    public static int i32LtS(int x, int y) { return x < y ? 1 : 0; }
    public static int i32LtU(int x, int y) { return Integer.compareUnsigned(x, y) < 0 ? 1 : 0; }
    public static int i32GtS(int x, int y) { return x > y ? 1 : 0; }
    public static int i32GtU(int x, int y) { return Integer.compareUnsigned(x, y) > 0 ? 1 : 0; }
    public static int i32LeS(int x, int y) { return x <= y ? 1 : 0; }
    public static int i32LeU(int x, int y) { return Integer.compareUnsigned(x, y) <= 0 ? 1 : 0; }
    public static int i32GeS(int x, int y) { return x >= y ? 1 : 0; }
    public static int i32GeU(int x, int y) { return Integer.compareUnsigned(x, y) >= 0 ? 1 : 0; }
    // endregion
    // region i64
    public static int i64Eqz(long x) { return x == 0 ? 1 : 0; }
    public static int i64Eq(long x, long y) { return x == y ? 1 : 0; }
    public static int i64Ne(long x, long y) { return x != y ? 1 : 0; }
    public static int i64LtS(long x, long y) { return x < y ? 1 : 0; }
    public static int i64LtU(long x, long y) { return Long.compareUnsigned(x, y) < 0 ? 1 : 0; }
    public static int i64GtS(long x, long y) { return x > y ? 1 : 0; }
    public static int i64GtU(long x, long y) { return Long.compareUnsigned(x, y) > 0 ? 1 : 0; }
    public static int i64LeS(long x, long y) { return x <= y ? 1 : 0; }
    public static int i64LeU(long x, long y) { return Long.compareUnsigned(x, y) <= 0 ? 1 : 0; }
    public static int i64GeS(long x, long y) { return x >= y ? 1 : 0; }
    public static int i64GeU(long x, long y) { return Long.compareUnsigned(x, y) >= 0 ? 1 : 0; }
    // endregion
    // region f32
    public static int f32Eq(float x, float y) { return x == y ? 1 : 0; }
    public static int f32Ne(float x, float y) { return x != y ? 1 : 0; }
    public static int f32Lt(float x, float y) { return x < y ? 1 : 0; }
    public static int f32Gt(float x, float y) { return x > y ? 1 : 0; }
    public static int f32Le(float x, float y) { return x <= y ? 1 : 0; }
    public static int f32Ge(float x, float y) { return x >= y ? 1 : 0; }
    // endregion
    // region f64
    public static int f64Eq(double x, double y) { return x == y ? 1 : 0; }
    public static int f64Ne(double x, double y) { return x != y ? 1 : 0; }
    public static int f64Lt(double x, double y) { return x < y ? 1 : 0; }
    public static int f64Gt(double x, double y) { return x > y ? 1 : 0; }
    public static int f64Le(double x, double y) { return x <= y ? 1 : 0; }
    public static int f64Ge(double x, double y) { return x >= y ? 1 : 0; }
    // endregion
    // endregion
    // region Mathematical
    // region i32
    public static int i32Clz(int x) { return Integer.numberOfLeadingZeros(x); }
    public static int i32Ctz(int x) { return Integer.numberOfTrailingZeros(x); }
    public static int i32Popcnt(int x) { return Integer.bitCount(x); }
    public static int i32Add(int x, int y) { return x + y; }
    public static int i32Sub(int x, int y) { return x - y; }
    public static int i32Mul(int x, int y) { return x * y; }
    public static int i32DivS(int x, int y) {
        if (y == 0) throw trap(INTEGER_DIVIDE_BY_ZERO);
        if (x == Integer.MIN_VALUE && y == -1) throw trap(INTEGER_OVERFLOW);
        return x / y;
    }
    public static int i32DivU(int x, int y) {
        if (y == 0) throw trap(INTEGER_DIVIDE_BY_ZERO);
        return Integer.divideUnsigned(x, y);
    }
    // MIN_VALUE % -1 is 0 in Java too
    public static int i32RemS(int x, int y) {
        if (y == 0) throw trap(INTEGER_DIVIDE_BY_ZERO);
        return x % y;
    }
    public static int i32RemU(int x, int y) {
        if (y == 0) throw trap(INTEGER_DIVIDE_BY_ZERO);
        return Integer.remainderUnsigned(x, y);
    }
    public static int i32And(int x, int y) { return x & y; }
    public static int i32Or(int x, int y) { return x | y; }
    public static int i32Xor(int x, int y) { return x ^ y; }
    public static int i32Shl(int x, int y) { return x << y; }
    public static int i32ShrS(int x, int y) { return x >> y; }
    public static int i32ShrU(int x, int y) { return x >>> y; }
    public static int i32Rotl(int x, int y) { return Integer.rotateLeft(x, y); }
    public static int i32Rotr(int x, int y) { return Integer.rotateRight(x, y); }
    // endregion
    // region i64
    public static long i64Clz(long x) { return Long.numberOfLeadingZeros(x); }
    public static long i64Ctz(long x) { return Long.numberOfTrailingZeros(x); }
    public static long i64Popcnt(long x) { return Long.bitCount(x); }
    public static long i64Add(long x, long y) { return x + y; }
    public static long i64Sub(long x, long y) { return x - y; }
    public static long i64Mul(long x, long y) { return x * y; }
    public static long i64DivS(long x, long y) {
        if (y == 0) throw trap(INTEGER_DIVIDE_BY_ZERO);
        if (x == Long.MIN_VALUE && y == -1) throw trap(INTEGER_OVERFLOW);
        return x / y;
    }
    public static long i64DivU(long x, long y) {
        if (y == 0) throw trap(INTEGER_DIVIDE_BY_ZERO);
        return Long.divideUnsigned(x, y);
    }
    public static long i64RemS(long x, long y) {
        if (y == 0) throw trap(INTEGER_DIVIDE_BY_ZERO);
        return x % y;
    }
    public static long i64RemU(long x, long y) {
        if (y == 0) throw trap(INTEGER_DIVIDE_BY_ZERO);
        return Long.remainderUnsigned(x, y);
    }
    public static long i64And(long x, long y) { return x & y; }
    public static long i64Or(long x, long y) { return x | y; }
    public static long i64Xor(long x, long y) { return x ^ y; }
    public static long i64Shl(long x, long y) { return x << y; }
    public static long i64ShrS(long x, long y) { return x >> y; }
    public static long i64ShrU(long x, long y) { return x >>> y; }
    public static long i64Rotl(long x, long y) { return Long.rotateLeft(x, (int) y); }
    public static long i64Rotr(long x, long y) { return Long.rotateRight(x, (int) y); }
    // endregion
    // region f32
    public static float f32Abs(float x) { return Math.abs(x); }
    public static float f32Neg(float x) { return -x; }
    public static float f32Ceil(float x) { return (float) Math.ceil(x); }
    public static float f32Floor(float x) { return (float) Math.floor(x); }
    public static float f32Trunc(float x) { return (float) (x < 0 ? Math.ceil(x) : Math.floor(x)); }
    public static float f32Nearest(float x) { return (float) Math.rint(x); }
    public static float f32Sqrt(float x) { return (float) Math.sqrt(x); }
    public static float f32Add(float x, float y) { return x + y; }
    public static float f32Sub(float x, float y) { return x - y; }
    public static float f32Mul(float x, float y) { return x * y; }
    public static float f32Div(float x, float y) { return x / y; }
    public static float f32Min(float x, float y) { return Math.min(x, y); }
    public static float f32Max(float x, float y) { return Math.max(x, y); }
    public static float f32Copysign(float x, float y) { return Math.copySign(x, y); }
    // endregion
    // region f64
    public static double f64Abs(double x) { return Math.abs(x); }
    public static double f64Neg(double x) { return -x; }
    public static double f64Ceil(double x) { return Math.ceil(x); }
    public static double f64Floor(double x) { return Math.floor(x); }
    public static double f64Trunc(double x) { return x < 0 ? Math.ceil(x) : Math.floor(x); }
    public static double f64Nearest(double x) { return Math.rint(x); }
    public static double f64Sqrt(double x) { return Math.sqrt(x); }
    public static double f64Add(double x, double y) { return x + y; }
    public static double f64Sub(double x, double y) { return x - y; }
    public static double f64Mul(double x, double y) { return x * y; }
    public static double f64Div(double x, double y) { return x / y; }
    public static double f64Min(double x, double y) { return Math.min(x, y); }
    public static double f64Max(double x, double y) { return Math.max(x, y); }
    public static double f64Copysign(double x, double y) { return Math.copySign(x, y); }
    // endregion
    // endregion
    // region Conversions
    public static int i32WrapI64(long x) { return (int) x; }
    public static int i32TruncF32S(float x) {
        if (Float.isNaN(x)) throw trap(INVALID_CONVERSION_TO_INTEGER);
        if (Float.isInfinite(x)
                // NB: some rounded ints are the first out-of-bounds, some are the last in-bounds
                || x < Integer.MIN_VALUE
                || x >= Integer.MAX_VALUE
        ) {
            throw trap(INTEGER_OVERFLOW);
        }
        float trunc = (float) (x < 0 ? Math.ceil(x) : Math.floor(x));
        return (int) trunc;
    }
    public static int i32TruncF32U(float x) {
        if (Float.isNaN(x)) throw trap(INVALID_CONVERSION_TO_INTEGER);
        if (Float.isInfinite(x)
                || x <= -1f
                || x >= MAX_UINT
        ) {
            throw trap(INTEGER_OVERFLOW);
        }
        float trunc = (float) (x < 0 ? Math.ceil(x) : Math.floor(x));
        return (int) (long) trunc;
    }
    public static int i32TruncF64S(double x) {
        if (Double.isNaN(x)) throw trap(INVALID_CONVERSION_TO_INTEGER);
        if (Double.isInfinite(x)
                || x <= Integer.MIN_VALUE - 1d
                || x >= Integer.MAX_VALUE + 1d
        ) {
            throw trap(INTEGER_OVERFLOW);
        }
        double trunc = x < 0 ? Math.ceil(x) : Math.floor(x);
        return (int) trunc;
    }
    public static int i32TruncF64U(double x) {
        if (Double.isNaN(x)) throw trap(INVALID_CONVERSION_TO_INTEGER);
        if (Double.isInfinite(x)
                || x <= -1
                || x >= MAX_UINT + 1d
        ) {
            throw trap(INTEGER_OVERFLOW);
        }
        double trunc = x < 0 ? Math.ceil(x) : Math.floor(x);
        return (int) (long) trunc;
    }
    public static long i64ExtendI32S(int x) { return x; }
    public static long i64ExtendI32U(int x) { return Integer.toUnsignedLong(x); }
    public static long i64TruncF32S(float x) {
        if (Float.isNaN(x)) throw trap(INVALID_CONVERSION_TO_INTEGER);
        if (Float.isInfinite(x)
                || x < Long.MIN_VALUE
                || x >= Long.MAX_VALUE
        ) {
            throw trap(INTEGER_OVERFLOW);
        }
        float trunc = (float) (x < 0 ? Math.ceil(x) : Math.floor(x));
        return (long) trunc;
    }
    public static long i64TruncF32U(float x) {
        if (Float.isNaN(x)) throw trap(INVALID_CONVERSION_TO_INTEGER);
        if (Float.isInfinite(x)
                || x <= -1f
                || x >= (float) MAX_ULONG
        ) {
            throw trap(INTEGER_OVERFLOW);
        }
        float trunc = (float) (x < 0 ? Math.ceil(x) : Math.floor(x));
        if (trunc >= Long.MAX_VALUE - 1) return (long) (trunc / 2F) * 2L;
        return (long) trunc;
    }
    public static long i64TruncF64S(double x) {
        if (Double.isNaN(x)) throw trap(INVALID_CONVERSION_TO_INTEGER);
        if (Double.isInfinite(x)
                || x < Long.MIN_VALUE
                || x >= Long.MAX_VALUE
        ) {
            throw trap(INTEGER_OVERFLOW);
        }
        double trunc = x < 0 ? Math.ceil(x) : Math.floor(x);
        return (long) trunc;
    }
    public static long i64TruncF64U(double x) {
        if (Double.isNaN(x)) throw trap(INVALID_CONVERSION_TO_INTEGER);
        if (Double.isInfinite(x)
                || x <= -1
                || x >= MAX_ULONG
        ) {
            throw trap(INTEGER_OVERFLOW);
        }
        double trunc = x < 0 ? Math.ceil(x) : Math.floor(x);
        if (trunc >= Long.MAX_VALUE - 1) return (long) (trunc / 2D) * 2L;
        return (long) trunc;
    }
    public static float f32ConvertI32S(int x) { return (float) x; }
    public static float f32ConvertI32U(int x) { return (float) Integer.toUnsignedLong(x); }
    public static float f32ConvertI64S(long x) { return (float) x; }
    // see Guava https://github.com/google/guava/blob/master/guava/src/com/google/common/primitives/UnsignedLong.java
    public static float f32ConvertI64U(long x) { return x >= 0 ? (float) x : (float) ((x >>> 1) | (x & 1)) * 2f; }
    public static float f32DemoteF64(double x) { return (float) x; }
    public static double f64ConvertI32S(int x) { return x; }
    public static double f64ConvertI32U(int x) { return Integer.toUnsignedLong(x); }
    public static double f64ConvertI64S(long x) { return (double) x; }
    public static double f64ConvertI64U(long x) { return x >= 0 ? x : ((x >>> 1) | (x & 1)) * 2d; }
    public static double f64PromoteF32(float x) { return x; }
    // endregion
    // region Extension
    public static int i32Extend8S(int x) { return (byte) x; }
    public static int i32Extend16S(int x) { return (short) x; }
    public static long i64Extend8S(long x) { return (byte) x; }
    public static long i64Extend16S(long x) { return (short) x; }
    public static long i64Extend32S(long x) { return (int) x; }
    // endregion
    // region Saturating Truncation
    public static int i32TruncSatF32S(float x) { return (int) x; }
    public static int i32TruncSatF32U(float x) {
        if (!(x >= 0)) return 0;
        if (x >= MAX_UINT) return -1;
        return (int) (long) x;
    }
    public static int i32TruncSatF64S(double x) { return (int) x; }
    public static int i32TruncSatF64U(double x) {
        if (!(x >= 0)) return 0;
        if (x >= MAX_UINT) return -1;
        return (int) (long) x;
    }
    public static long i64TruncSatF32S(float x) { return (long) x; }
    // see Kotlin https://github.com/JetBrains/kotlin/blob/master/libraries/stdlib/unsigned/src/kotlin/UnsignedUtils.kt
    public static long i64TruncSatF32U(float x) {
        if (!(x >= 0)) return 0;
        if (x >= MAX_ULONG) return -1;
        if (x >= Long.MAX_VALUE - 1) return (long) (x / 2F) * 2L;
        return (long) x;
    }
    public static long i64TruncSatF64S(double x) { return (long) x; }
    public static long i64TruncSatF64U(double x) {
        if (!(x >= 0)) return 0;
        if (x >= MAX_ULONG) return -1;
        if (x >= Long.MAX_VALUE - 1) return (long) (x / 2D) * 2L;
        return (long) x;
    }
    // endregion
}
// @formatter:on
