package io.github.eutro.cfgopt.cse;

import com.google.common.base.Preconditions;
import io.github.eutro.cfgopt.cfg.BasicBlock;
import io.github.eutro.cfgopt.cfg.Expression;
import io.github.eutro.cfgopt.cfg.Instr;
import io.github.eutro.cfgopt.ext.MetadataState;
import io.github.eutro.cfgopt.passes.meta.ComputeDoms;
import org.apache.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Decides which values are computed once and shared, and where.
 * <p>
 * While the graph is first analysed, the tracker is told of every pure operation that is
 * computed ({@link #onCreated}) or found already available ({@link #onOccurrence}). An occurrence
 * in a block dominated by the entry's placement is approved. Otherwise the tracker tries to
 * hoist the placement to a common ancestor. When the graph is walked again to rewrite it,
 * {@link #substitute} replaces approved occurrences with reads of the entry's temporary.
 * <p>
 * Entries are keyed canonically: an operand that is itself an entry's value is keyed by the
 * node the entry was first seen as, so the same computation over independently computed
 * operands finds the same entry. Hoisted definitions are written with
 * {@link #hoistedDefinition}, which reads the temporaries already available in the hoist block.
 * <p>
 * Requires {@link MetadataState#DOMS}.
 */
public final class CommonSubexpressionTracker {
    private static final Logger LOGGER = Logger.getLogger(CommonSubexpressionTracker.class);

    private final CseConfig config;
    private final AnticipatedExpressions anticipated;
    private final Map<BasicBlock, AvailableExpressionSet> forwardExitSets;
    private final Map<ExpressionType, CommonSubexpression> entries = new LinkedHashMap<>();
    private final Map<Integer, Integer> canonicalIds = new HashMap<>();
    private final Map<ExpressionType, Integer> representatives = new HashMap<>();
    private boolean emitting;

    /**
     * Construct a tracker.
     *
     * @param config          The options.
     * @param anticipated     The anticipated expressions of the graph.
     * @param forwardExitSets The available expressions at the end of each block visited so far,
     *                        filled in by the caller as the analysis goes.
     */
    public CommonSubexpressionTracker(CseConfig config,
                                      AnticipatedExpressions anticipated,
                                      Map<BasicBlock, AvailableExpressionSet> forwardExitSets) {
        this.config = config;
        this.anticipated = anticipated;
        this.forwardExitSets = forwardExitSets;
    }

    /**
     * Get the entry for a key, also trying the swapped key for commutative operations.
     *
     * @param key The key.
     * @return The entry, or null if none was recorded.
     */
    public @Nullable CommonSubexpression getEntry(ExpressionType key) {
        CommonSubexpression entry = entries.get(key);
        if (entry == null && key instanceof ExpressionType.Binary
                && ((ExpressionType.Binary) key).op.op.isCommutative()) {
            entry = entries.get(((ExpressionType.Binary) key).swapped());
        }
        return entry;
    }

    /**
     * Get all entries, in the order they were first seen.
     *
     * @return The entries.
     */
    public Collection<CommonSubexpression> getEntries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    /**
     * Get the entries that will be given a temporary.
     *
     * @return The declared entries, in the order they were first seen.
     */
    public List<CommonSubexpression> getDeclared() {
        List<CommonSubexpression> ret = new ArrayList<>();
        for (CommonSubexpression entry : entries.values()) {
            if (entry.getState() != CommonSubexpression.State.CANDIDATE) ret.add(entry);
        }
        return ret;
    }

    /**
     * Called when a node for a pure operation is created.
     *
     * @param node  The new node.
     * @param set   The set it was created in.
     * @param block The block being analysed.
     */
    public void onCreated(GraphNode node, AvailableExpressionSet set, BasicBlock block) {
        CommonSubexpression entry = entryFor(node);
        if (entry == null) {
            ExpressionType key = canonicalKey(node.key);
            entry = new CommonSubexpression(key, node.expression, block, set.variableLeaves(node.id));
            entries.put(key, entry);
            representatives.put(key, node.id);
            canonicalIds.put(node.id, node.id);
            entry.approve(block);
            return;
        }
        checkPlacement(entry, block);
    }

    /**
     * Called when a pure operation is found already available.
     *
     * @param node  The node found.
     * @param set   The set it was found in.
     * @param block The block being analysed.
     */
    public void onOccurrence(GraphNode node, AvailableExpressionSet set, BasicBlock block) {
        CommonSubexpression entry = entryFor(node);
        if (entry == null) {
            onCreated(node, set, block);
            return;
        }
        checkPlacement(entry, block);
    }

    private ExpressionType canonicalKey(ExpressionType key) {
        List<Integer> operands = key.operands();
        if (operands.isEmpty()) return key;
        List<Integer> mapped = new ArrayList<>(operands.size());
        for (int operand : operands) {
            mapped.add(canonicalIds.getOrDefault(operand, operand));
        }
        return key.withOperands(mapped);
    }

    private @Nullable CommonSubexpression entryFor(GraphNode node) {
        CommonSubexpression entry = getEntry(canonicalKey(node.key));
        if (entry != null) canonicalIds.put(node.id, representatives.get(entry.getKey()));
        return entry;
    }

    private void checkPlacement(CommonSubexpression entry, BasicBlock block) {
        BasicBlock placement = entry.placement();
        if (ComputeDoms.dominates(placement, block) && !(entry.isHoisted() && placement == block)) {
            entry.approve(block);
            return;
        }
        BasicBlock ancestor = anticipated.findAncestor(block, placement, entry.getDefinition());
        if (ancestor != null && ancestor != placement && canHoistTo(entry, ancestor, block)) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("hoisting " + entry.getDefinition() + " from " + placement.toTargetString()
                        + " to " + ancestor.toTargetString() + " for " + block.toTargetString());
            }
            entry.hoistTo(ancestor);
            entry.approve(block);
        } else if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("not sharing " + entry.getDefinition() + " with " + block.toTargetString()
                    + (ancestor == null ? "" : ", rejected " + ancestor.toTargetString()));
        }
    }

    private boolean canHoistTo(CommonSubexpression entry, BasicBlock ancestor, BasicBlock block) {
        if (!config.hoistAcrossBranches()) return false;
        // hoisting makes evaluation speculative
        if (mayTrap(entry.getDefinition())) return false;
        if (!anticipated.isAnticipatedAt(ancestor, entry.getDefinition())) return false;
        AvailableExpressionSet exit = forwardExitSets.get(ancestor);
        if (exit == null) return false;
        for (Map.Entry<Integer, Integer> leaf : entry.getLeafIds().entrySet()) {
            if (!leaf.getValue().equals(exit.idOfVariable(leaf.getKey()))) return false;
        }
        if (entry.isApproved(ancestor) || !ComputeDoms.dominates(ancestor, block)) return false;
        for (BasicBlock approved : entry.getApproved()) {
            if (!ComputeDoms.dominates(ancestor, approved)) return false;
        }
        return true;
    }

    /**
     * Check whether evaluating an expression may abort execution.
     *
     * @param expr The expression.
     * @return Whether any operation in it may trap.
     */
    public static boolean mayTrap(Expression expr) {
        if (expr instanceof Expression.Binary) {
            Expression.Binary bin = (Expression.Binary) expr;
            if (bin.op.mayTrap(bin.checked)) return true;
        } else if (expr instanceof Expression.Unary) {
            if (((Expression.Unary) expr).op.mayTrap(false)) return true;
        }
        for (Expression child : expr.children()) {
            if (mayTrap(child)) return true;
        }
        return false;
    }

    /**
     * Called while rewriting, for each pure operation, after its operands have been rewritten.
     *
     * @param node    The node of the operation.
     * @param rebuilt The operation over its rewritten operands.
     * @param ctx     The analysis context, which receives any definition to insert.
     * @return A read of the temporary to use instead, or null to keep the operation.
     */
    public @Nullable Expression substitute(GraphNode node, Expression rebuilt, AnalysisContext ctx) {
        CommonSubexpression entry = entryFor(node);
        BasicBlock block = ctx.getCurrentBlock();
        if (entry == null || entry.getState() == CommonSubexpression.State.CANDIDATE) return null;
        Expression.Variable read = Expression.var(entry.getDefinition().getType(), entry.getTemp());
        if (emitting) {
            BasicBlock placement = entry.placement();
            boolean defined = placement == block
                    ? entry.getState() == CommonSubexpression.State.MATERIALIZED
                    : ComputeDoms.dominates(placement, block);
            return defined ? read : null;
        }
        if (!entry.isApproved(block)) return null;
        if (entry.isHoisted() || entry.getState() == CommonSubexpression.State.MATERIALIZED) {
            return read;
        }
        if (block != entry.getOrigin()) {
            throw new IllegalStateException(String.format("%s used before its definition" +
                    "\n  in block: %s", entry, block.toTargetString()));
        }
        ctx.pending.add(new Instr.Set(entry.getTemp(), rebuilt));
        entry.materialize();
        return read;
    }

    /**
     * Write the definition of a hoisted entry for the end of its hoist block, reading the
     * temporaries of any other entries already defined there.
     *
     * @param entry   The hoisted entry.
     * @param exitSet The available expressions at the end of the hoist block, as rewritten.
     * @param ctx     The context the graph was rewritten with.
     * @return The expression to assign to the entry's temporary.
     */
    public Expression hoistedDefinition(CommonSubexpression entry, AvailableExpressionSet exitSet, AnalysisContext ctx) {
        BasicBlock block = Preconditions.checkNotNull(entry.getHoistBlock(), "not hoisted: %s", entry);
        ctx.setCurrentBlock(block);
        emitting = true;
        try {
            return exitSet.regenerate(entry.getDefinition(), ctx).expr;
        } finally {
            emitting = false;
        }
    }
}
