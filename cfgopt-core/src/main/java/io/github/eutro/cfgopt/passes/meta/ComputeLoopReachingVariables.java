package io.github.eutro.cfgopt.passes.meta;

import io.github.eutro.cfgopt.cfg.BasicBlock;
import io.github.eutro.cfgopt.cfg.ControlFlowGraph;
import io.github.eutro.cfgopt.cfg.Instr;
import io.github.eutro.cfgopt.ext.CommonExts;
import io.github.eutro.cfgopt.ext.MetadataState;
import io.github.eutro.cfgopt.passes.InPlaceIRPass;

import java.util.*;

/**
 * Computes {@link CommonExts#LOOP_REACHING_VARIABLES} for each block.
 * <p>
 * For every back edge found by {@link ComputeVisitingOrder}, the blocks of its natural loop
 * are those that reach the edge's source without going through its target. Every variable
 * assigned in any of them is recorded on the target. Blocks that are not the target of a
 * back edge get an empty set.
 */
public class ComputeLoopReachingVariables implements InPlaceIRPass<ControlFlowGraph> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeLoopReachingVariables INSTANCE = new ComputeLoopReachingVariables();

    @Override
    public void runInPlace(ControlFlowGraph cfg) {
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(cfg, MetadataState.PREDS, MetadataState.VISITING_ORDER);

        for (BasicBlock block : cfg.blocks) {
            block.attachExt(CommonExts.LOOP_REACHING_VARIABLES, new TreeSet<>());
        }

        CommonExts.VisitingOrder vo = cfg.getExtOrThrow(CommonExts.VISITING_ORDER);
        for (BasicBlock[] edge : vo.backEdges) {
            BasicBlock latch = edge[0];
            BasicBlock header = edge[1];
            Set<BasicBlock> body = new HashSet<>();
            body.add(header);
            Deque<BasicBlock> queue = new ArrayDeque<>();
            if (body.add(latch)) queue.add(latch);
            while (!queue.isEmpty()) {
                BasicBlock block = queue.poll();
                for (BasicBlock pred : block.getExtOrThrow(CommonExts.PREDS)) {
                    if (body.add(pred)) queue.add(pred);
                }
            }

            Set<Integer> vars = header.getExtOrThrow(CommonExts.LOOP_REACHING_VARIABLES);
            for (BasicBlock block : body) {
                for (Instr instr : block.getInstrs()) {
                    vars.addAll(instr.results());
                }
            }
        }

        ms.validate(MetadataState.LOOP_REACHING_VARIABLES);
    }
}
