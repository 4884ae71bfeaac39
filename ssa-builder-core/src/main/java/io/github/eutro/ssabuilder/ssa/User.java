package io.github.eutro.ssabuilder.ssa;

/**
 * Something that holds references to values and can have them rewritten.
 * <p>
 * Operations are users of their operands, and blocks are users of the
 * values in their definition maps.
 */
public interface User {
    /**
     * @param value The value.
     * @return Whether any slot of this user currently holds {@code value}.
     */
    boolean uses(Value value);

    /**
     * Overwrite every slot holding {@code value} with {@code replacement}.
     *
     * @param value       The value to replace.
     * @param replacement The value to replace it with.
     */
    void replaceUses(Value value, Value replacement);
}
