package io.github.eutro.cfgopt.cse;

import io.github.eutro.cfgopt.cfg.BasicBlock;
import io.github.eutro.cfgopt.cfg.Instr;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * State shared by all the {@link AvailableExpressionSet}s of one walk over a graph:
 * the node id counter, the block being visited, and, while rewriting,
 * the definitions to insert before the current instruction.
 */
public final class AnalysisContext {
    private int nextId = 0;
    private @Nullable BasicBlock currentBlock;
    private final @Nullable CommonSubexpressionTracker tracker;
    final List<Instr> pending = new ArrayList<>();

    /**
     * Construct a context.
     *
     * @param tracker The tracker to report occurrences to, or null if none should be reported.
     */
    public AnalysisContext(@Nullable CommonSubexpressionTracker tracker) {
        this.tracker = tracker;
    }

    public AnalysisContext() {
        this(null);
    }

    int freshId() {
        return nextId++;
    }

    /**
     * Reserve an id, so that later fresh ids never collide with it.
     *
     * @param id The id.
     */
    void reserve(int id) {
        nextId = Math.max(nextId, id + 1);
    }

    public int peekNextId() {
        return nextId;
    }

    public BasicBlock getCurrentBlock() {
        if (currentBlock == null) throw new IllegalStateException("no current block");
        return currentBlock;
    }

    public void setCurrentBlock(BasicBlock currentBlock) {
        this.currentBlock = currentBlock;
    }

    public @Nullable CommonSubexpressionTracker getTracker() {
        return tracker;
    }

    /**
     * Take the definitions emitted since the last call.
     *
     * @return The definitions, in emission order.
     */
    public List<Instr> drainPending() {
        List<Instr> ret = new ArrayList<>(pending);
        pending.clear();
        return ret;
    }
}
