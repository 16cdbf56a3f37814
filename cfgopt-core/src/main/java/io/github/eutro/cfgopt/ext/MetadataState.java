package io.github.eutro.cfgopt.ext;

import io.github.eutro.cfgopt.cfg.ControlFlowGraph;
import io.github.eutro.cfgopt.passes.IRPass;
import io.github.eutro.cfgopt.passes.meta.ComputeDoms;
import io.github.eutro.cfgopt.passes.meta.ComputeLoopReachingVariables;
import io.github.eutro.cfgopt.passes.meta.ComputePreds;
import io.github.eutro.cfgopt.passes.meta.ComputeVisitingOrder;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks which analysis results attached to a {@link ControlFlowGraph} are up to date.
 */
public class MetadataState {
    /**
     * A kind of metadata whose validity can be tracked.
     */
    public static class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        final int id = COUNTER.getAndIncrement();
        final String name;

        MetaKind(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A kind of metadata that also knows which passes compute it.
     *
     * @param <T> The IR the passes run on.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final IRPass<T, T>[] passes;

        @SafeVarargs
        ComputableMetaKind(String name, IRPass<T, T>... passes) {
            super(name);
            this.passes = passes;
        }

        void computeFor(T t) {
            for (IRPass<T, T> pass : passes) {
                if (!pass.isInPlace()) throw new IllegalArgumentException("metadata pass is not in-place: " + pass);
                pass.run(t);
            }
        }
    }

    /**
     * Metadata that can be computed for control flow graphs.
     */
    public static final ComputableMetaKind<ControlFlowGraph>
            PREDS = new ComputableMetaKind<>("PREDS", ComputePreds.INSTANCE),
            DOMS = new ComputableMetaKind<>("DOMS", ComputeDoms.INSTANCE),
            VISITING_ORDER = new ComputableMetaKind<>("VISITING_ORDER", ComputeVisitingOrder.INSTANCE),
            LOOP_REACHING_VARIABLES = new ComputableMetaKind<>("LOOP_REACHING_VARIABLES",
                    ComputeLoopReachingVariables.INSTANCE);

    private final BitSet validSet = new BitSet();

    /**
     * Check whether the given metadata is valid.
     *
     * @param kind The kind of metadata.
     * @return Whether it is valid.
     */
    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    /**
     * Compute each of the given metadata that is not already valid, in order.
     *
     * @param t     The IR to compute metadata for.
     * @param first The first metadata kind.
     * @param kinds The other metadata kinds.
     * @param <T>   The type of {@code t}.
     */
    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T> first, ComputableMetaKind<T>... kinds) {
        ensureValid0(t, first);
        for (ComputableMetaKind<T> kind : kinds) {
            ensureValid0(t, kind);
        }
    }

    private <T> void ensureValid0(T t, ComputableMetaKind<T> kind) {
        if (!isValid(kind)) {
            kind.computeFor(t);
            validate(kind);
        }
    }

    /**
     * Mark metadata as valid, e.g. because the producer of a graph attached it itself.
     *
     * @param kinds The metadata kinds.
     */
    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id);
        }
    }

    /**
     * Mark metadata as invalid.
     *
     * @param kinds The metadata kinds.
     */
    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.clear(kind.id);
        }
    }

    /**
     * Invalidate everything that depends on the shape of the graph.
     */
    public void graphChanged() {
        invalidate(PREDS, DOMS, VISITING_ORDER);
        varsChanged();
    }

    /**
     * Invalidate everything that depends on which variables are assigned where.
     */
    public void varsChanged() {
        invalidate(LOOP_REACHING_VARIABLES);
    }
}
