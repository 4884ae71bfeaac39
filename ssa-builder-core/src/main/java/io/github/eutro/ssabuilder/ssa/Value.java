package io.github.eutro.ssabuilder.ssa;

import io.github.eutro.ssabuilder.ext.ExtHolder;

/**
 * Anything that can be an operand.
 * <p>
 * The set of kinds is closed: {@link Undef}, {@link Operation} and {@link Phi}.
 * Values are compared by identity, never structurally.
 */
public abstract class Value extends ExtHolder {
    public enum Kind {
        UNDEF,
        OPERATION,
        PHI,
    }

    Value() {
    }

    public abstract Kind kind();

    public final boolean isPhi() {
        return kind() == Kind.PHI;
    }

    /**
     * A short reference to this value, for printing operand lists.
     *
     * @return The reference.
     */
    public String toRefString() {
        return String.format("%%%08x", System.identityHashCode(this));
    }

    @Override
    public final boolean equals(Object obj) {
        return this == obj;
    }

    @Override
    public final int hashCode() {
        return System.identityHashCode(this);
    }
}
