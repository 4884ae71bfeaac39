package io.github.eutro.ssabuilder.ssa;

import java.util.Objects;

/**
 * A source-level variable name. Only ever used as a lookup key, never as an operand.
 */
public final class Variable {
    public final String name;

    public Variable(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable)) return false;
        return name.equals(((Variable) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return '$' + name;
    }
}
