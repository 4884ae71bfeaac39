package io.github.eutro.ssabuilder.ssa;

/**
 * The value of a variable that no definition reaches.
 * <p>
 * Each unresolvable read produces a fresh instance.
 */
public final class Undef extends Value {
    @Override
    public Kind kind() {
        return Kind.UNDEF;
    }

    @Override
    public String toString() {
        return toRefString() + " = undef";
    }
}
