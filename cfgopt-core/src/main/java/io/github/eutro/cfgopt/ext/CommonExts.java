package io.github.eutro.cfgopt.ext;

import io.github.eutro.cfgopt.cfg.BasicBlock;
import io.github.eutro.cfgopt.cfg.ControlFlowGraph;
import io.github.eutro.cfgopt.cfg.Instr;
import io.github.eutro.cfgopt.passes.meta.ComputeDoms;
import io.github.eutro.cfgopt.passes.meta.ComputeLoopReachingVariables;
import io.github.eutro.cfgopt.passes.meta.ComputePreds;
import io.github.eutro.cfgopt.passes.meta.ComputeVisitingOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The {@link Ext}s used by the passes in this library.
 */
public class CommonExts {
    /**
     * Attached to a {@link ControlFlowGraph}. Which of its metadata is valid.
     *
     * @see MetadataState
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * Attached to a {@link BasicBlock}. The graph the block is in.
     */
    public static final Ext<ControlFlowGraph> OWNING_GRAPH = Ext.create(ControlFlowGraph.class, "OWNING_GRAPH");
    /**
     * Attached to an {@link Instr}. The block the instruction is in.
     */
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");

    /**
     * Attached to a {@link BasicBlock}. The predecessors of the block, in block order.
     * <p>
     * Computed by {@link ComputePreds}.
     */
    public static final Ext<List<BasicBlock>> PREDS = Ext.create(List.class, "PREDS");
    /**
     * Attached to a {@link BasicBlock}. The immediate dominator of the block, absent for the entry
     * and for unreachable blocks.
     * <p>
     * Computed by {@link ComputeDoms}.
     */
    public static final Ext<BasicBlock> IDOM = Ext.create(BasicBlock.class, "IDOM");

    /**
     * Attached to a {@link ControlFlowGraph}. The acyclic visiting order of its blocks.
     * <p>
     * Computed by {@link ComputeVisitingOrder}.
     */
    public static final Ext<VisitingOrder> VISITING_ORDER = Ext.create(VisitingOrder.class, "VISITING_ORDER");
    /**
     * Attached to each reachable {@link BasicBlock}. Its place in the {@link #VISITING_ORDER}.
     * <p>
     * Computed by {@link ComputeVisitingOrder}.
     */
    public static final Ext<OrderData> ORDER_DATA = Ext.create(OrderData.class, "ORDER_DATA");

    /**
     * Attached to a {@link BasicBlock}. The variable slots a loop iteration may reassign before
     * control comes back to this block. Only meaningful for blocks that are the target of a back edge.
     * <p>
     * Either supplied by the producer of the graph, or computed by {@link ComputeLoopReachingVariables}.
     */
    public static final Ext<Set<Integer>> LOOP_REACHING_VARIABLES = Ext.create(Set.class, "LOOP_REACHING_VARIABLES");

    /**
     * The blocks of a graph in a topological order of its acyclic view.
     * <p>
     * The acyclic view is found by a depth-first walk from the entry, dropping every edge
     * that leads back to a block still on the walk's stack.
     */
    public static class VisitingOrder {
        /**
         * Reachable blocks, each after all of its acyclic predecessors. The entry is first.
         */
        public final List<BasicBlock> order = new ArrayList<>();
        /**
         * The dropped edges, as {@code {source, target}} pairs, in discovery order.
         */
        public final List<BasicBlock[]> backEdges = new ArrayList<>();
    }

    /**
     * The position of a block in the acyclic view of its graph.
     */
    public static class OrderData {
        /**
         * Whether the block is the target of a back edge.
         */
        public boolean cyclic;
        /**
         * The length of the shortest acyclic path from the entry.
         */
        public int depth;
        /**
         * Successors along acyclic edges, in target order.
         */
        public final List<BasicBlock> dagSuccs = new ArrayList<>();
        /**
         * Predecessors along acyclic edges, in discovery order.
         */
        public final List<BasicBlock> dagPreds = new ArrayList<>();
    }
}
