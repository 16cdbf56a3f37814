package io.github.eutro.cfgopt.cse;

import com.google.common.base.Preconditions;
import io.github.eutro.cfgopt.cfg.BasicBlock;
import io.github.eutro.cfgopt.cfg.Expression;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A value that may be computed once and shared through a temporary.
 * <p>
 * Entries start as {@link State#CANDIDATE candidates} when their first computation is seen,
 * become {@link State#DECLARED declared} once a second occurrence can be served from a single
 * computation, and are {@link State#MATERIALIZED materialized} when that computation is emitted.
 */
public final class CommonSubexpression {
    public enum State {
        CANDIDATE,
        DECLARED,
        MATERIALIZED,
    }

    private final ExpressionType key;
    private final Expression definition;
    private final BasicBlock origin;
    private final Map<Integer, Integer> leafIds;
    private final Set<BasicBlock> approved = new LinkedHashSet<>();
    private State state = State.CANDIDATE;
    private int occurrences = 0;
    private @Nullable BasicBlock hoistBlock;
    private int temp = -1;

    CommonSubexpression(ExpressionType key, Expression definition, BasicBlock origin, Map<Integer, Integer> leafIds) {
        this.key = key;
        this.definition = definition;
        this.origin = origin;
        this.leafIds = leafIds;
    }

    public ExpressionType getKey() {
        return key;
    }

    /**
     * Get the expression as first computed, which the temporary is defined as.
     *
     * @return The expression.
     */
    public Expression getDefinition() {
        return definition;
    }

    public BasicBlock getOrigin() {
        return origin;
    }

    /**
     * Get the node ids of the variables the value is computed from, by slot.
     *
     * @return The leaf ids.
     */
    public Map<Integer, Integer> getLeafIds() {
        return Collections.unmodifiableMap(leafIds);
    }

    public State getState() {
        return state;
    }

    public @Nullable BasicBlock getHoistBlock() {
        return hoistBlock;
    }

    public boolean isHoisted() {
        return hoistBlock != null;
    }

    /**
     * Get the block the single computation goes in.
     *
     * @return The hoist block if hoisted, otherwise the origin.
     */
    public BasicBlock placement() {
        return hoistBlock != null ? hoistBlock : origin;
    }

    /**
     * Get the blocks whose occurrences read the temporary.
     *
     * @return The approved blocks, in approval order.
     */
    public Set<BasicBlock> getApproved() {
        return Collections.unmodifiableSet(approved);
    }

    public boolean isApproved(BasicBlock block) {
        return approved.contains(block);
    }

    public int getOccurrences() {
        return occurrences;
    }

    public int getTemp() {
        Preconditions.checkState(temp >= 0, "no temporary for %s", this);
        return temp;
    }

    /**
     * Give this entry the slot of its temporary.
     *
     * @param temp The variable slot.
     */
    public void setTemp(int temp) {
        Preconditions.checkState(state != State.CANDIDATE, "candidate given a temporary: %s", this);
        this.temp = temp;
    }

    void approve(BasicBlock block) {
        approved.add(block);
        if (++occurrences >= 2 && state == State.CANDIDATE) {
            state = State.DECLARED;
        }
    }

    void hoistTo(BasicBlock block) {
        Preconditions.checkState(state != State.MATERIALIZED, "already materialized: %s", this);
        hoistBlock = block;
    }

    /**
     * Record that the definition of the temporary has been emitted.
     */
    public void materialize() {
        Preconditions.checkState(state == State.DECLARED, "cannot materialize %s", this);
        state = State.MATERIALIZED;
    }

    @Override
    public String toString() {
        return state + " " + definition + " at " + placement().toTargetString()
                + (isHoisted() ? " (hoisted)" : "") + " x" + occurrences;
    }
}
