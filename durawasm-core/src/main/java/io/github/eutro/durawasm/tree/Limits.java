package io.github.eutro.durawasm.tree;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The limits of a table or memory. Both bounds are unsigned.
 */
public final class Limits {
    public final int min;
    public final @Nullable Integer max;

    public Limits(int min, @Nullable Integer max) {
        this.min = min;
        this.max = max;
    }

    /**
     * Whether an extern with limits {@code other} may be supplied where these limits are expected.
     *
     * @param other The supplied limits.
     * @return Whether they match.
     */
    public boolean assignableFrom(Limits other) {
        return Integer.compareUnsigned(other.min, min) >= 0
                && (max == null
                || (other.max != null && Integer.compareUnsigned(other.max, max) <= 0));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Limits limits = (Limits) o;
        return min == limits.min && Objects.equals(max, limits.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max);
    }

    @Override
    public String toString() {
        return "{" +
                "min " + Integer.toUnsignedString(min) +
                ", max " + (max == null ? "none" : Integer.toUnsignedString(max)) +
                '}';
    }
}
