package io.github.eutro.cfgopt.passes;

import io.github.eutro.cfgopt.passes.misc.ChainedPass;

/**
 * A pass over some IR.
 *
 * @param <A> The type of the IR the pass consumes.
 * @param <B> The type of the IR the pass produces.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The input IR.
     * @return The output IR.
     */
    B run(A a);

    /**
     * Whether the pass mutates and returns its input, rather than producing new IR.
     *
     * @return Whether the pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Compose this pass with another, which is given this pass' output.
     *
     * @param next The pass to run after this one.
     * @param <C>  The output type of the next pass.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
