package io.github.eutro.cfgopt.cse;

import com.google.common.collect.Lists;
import io.github.eutro.cfgopt.cfg.BasicBlock;
import io.github.eutro.cfgopt.cfg.ControlFlowGraph;
import io.github.eutro.cfgopt.cfg.Expression;
import io.github.eutro.cfgopt.cfg.Instr;
import io.github.eutro.cfgopt.ext.CommonExts;
import io.github.eutro.cfgopt.ext.CommonExts.OrderData;
import io.github.eutro.cfgopt.ext.MetadataState;
import org.apache.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The expressions anticipated at the end of each block: those some path onward computes
 * before any of their operands is reassigned.
 * <p>
 * Also answers where independent computations of a value could be merged, with
 * {@link #findAncestor(BasicBlock, BasicBlock, Expression)}.
 */
public final class AnticipatedExpressions {
    private static final Logger LOGGER = Logger.getLogger(AnticipatedExpressions.class);

    /**
     * The flow each of the two blocks given to {@link #findAncestor} starts with.
     */
    public static final double SOURCE_FLOW = 1000;
    private static final double TOLERANCE = 1e-6;

    private final List<BasicBlock> order;
    private final Map<BasicBlock, AvailableExpressionSet> exitSets = new HashMap<>();

    private AnticipatedExpressions(List<BasicBlock> order) {
        this.order = order;
    }

    /**
     * Compute the anticipated expressions of a graph.
     * <p>
     * Requires {@link MetadataState#VISITING_ORDER} and {@link MetadataState#LOOP_REACHING_VARIABLES}.
     *
     * @param cfg    The graph.
     * @param config The options, for consistency checks.
     * @return The anticipated expressions.
     */
    public static AnticipatedExpressions compute(ControlFlowGraph cfg, CseConfig config) {
        CommonExts.VisitingOrder vo = cfg.getExtOrThrow(CommonExts.VISITING_ORDER);
        AnticipatedExpressions ret = new AnticipatedExpressions(vo.order);
        AnalysisContext ctx = new AnalysisContext();
        Map<BasicBlock, AvailableExpressionSet> entrySets = new HashMap<>();
        for (BasicBlock block : Lists.reverse(vo.order)) {
            ctx.setCurrentBlock(block);
            OrderData od = block.getExtOrThrow(CommonExts.ORDER_DATA);
            AvailableExpressionSet set = null;
            for (BasicBlock succ : od.dagSuccs) {
                AvailableExpressionSet succSet = entrySets.get(succ);
                if (set == null) {
                    set = succSet.copy();
                } else {
                    set.union(succSet, ctx);
                }
            }
            if (set == null) set = new AvailableExpressionSet();
            if (od.cyclic) {
                for (int slot : block.getExtOrThrow(CommonExts.LOOP_REACHING_VARIABLES)) {
                    set.kill(slot);
                }
            }
            set.processInstructionBackward(block.getControl(), ctx);
            ret.exitSets.put(block, set.copy());

            List<Instr> instrs = block.getInstrs();
            for (int i = instrs.size() - 1; i >= 0; i--) {
                set.processInstructionBackward(instrs.get(i), ctx);
            }
            if (config.checkInvariants()) set.verifyConsistency();
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("anticipated at entry of " + block.toTargetString() + ": " + set);
            }
            entrySets.put(block, set);
        }
        return ret;
    }

    /**
     * Get the expressions anticipated just before a block's control instruction.
     *
     * @param block The block.
     * @return The set, or null if the block is unreachable.
     */
    public @Nullable AvailableExpressionSet getExitSet(BasicBlock block) {
        return exitSets.get(block);
    }

    public boolean isAnticipatedAt(BasicBlock block, Expression expr) {
        AvailableExpressionSet set = exitSets.get(block);
        return set != null && set.find(expr) != null;
    }

    /**
     * Find the deepest block that every acyclic path from the entry to either of two blocks
     * passes through, and at whose end an expression is anticipated.
     * <p>
     * Each of the two blocks sends {@link #SOURCE_FLOW} back along the acyclic edges, splitting
     * it evenly among predecessors. The blocks that all of the flow passes through are the
     * candidates; among those where the expression is anticipated, the deepest wins, and then
     * the one with the lowest index.
     *
     * @param b1   The first block.
     * @param b2   The second block.
     * @param expr The expression.
     * @return The block, or null if there is none.
     */
    public @Nullable BasicBlock findAncestor(BasicBlock b1, BasicBlock b2, Expression expr) {
        if (b1 == b2) return b1;
        Map<BasicBlock, Double> flow = new HashMap<>();
        flow.put(b1, SOURCE_FLOW);
        flow.merge(b2, SOURCE_FLOW, Double::sum);
        for (BasicBlock block : Lists.reverse(order)) {
            Double f = flow.get(block);
            if (f == null) continue;
            List<BasicBlock> preds = block.getExtOrThrow(CommonExts.ORDER_DATA).dagPreds;
            if (preds.isEmpty()) continue;
            double share = f / preds.size();
            for (BasicBlock pred : preds) {
                flow.merge(pred, share, Double::sum);
            }
        }

        BasicBlock best = null;
        int bestDepth = -1;
        for (BasicBlock block : order) {
            Double f = flow.get(block);
            if (f == null || Math.abs(f - 2 * SOURCE_FLOW) > TOLERANCE) continue;
            if (!isAnticipatedAt(block, expr)) continue;
            int depth = block.getExtOrThrow(CommonExts.ORDER_DATA).depth;
            if (depth > bestDepth || depth == bestDepth && block.getIndex() < best.getIndex()) {
                best = block;
                bestDepth = depth;
            }
        }
        return best;
    }
}
