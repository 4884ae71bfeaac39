package io.github.eutro.ssabuilder.passes;

/**
 * A pass over some part of the IR.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
public interface IRPass<A, B> {
    B run(A a);

    default boolean isInPlace() {
        return false;
    }
}
