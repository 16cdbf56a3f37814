package io.github.eutro.cfgopt.passes.meta;

import io.github.eutro.cfgopt.cfg.BasicBlock;
import io.github.eutro.cfgopt.cfg.ControlFlowGraph;
import io.github.eutro.cfgopt.ext.CommonExts;
import io.github.eutro.cfgopt.ext.CommonExts.OrderData;
import io.github.eutro.cfgopt.ext.CommonExts.VisitingOrder;
import io.github.eutro.cfgopt.ext.MetadataState;
import io.github.eutro.cfgopt.passes.InPlaceIRPass;

import java.util.*;

/**
 * Computes {@link CommonExts#VISITING_ORDER} for a graph, and {@link CommonExts#ORDER_DATA}
 * for each of its reachable blocks.
 * <p>
 * A depth-first walk from the entry drops every edge whose target is still on the walk's stack;
 * what remains is acyclic, and the blocks are then ordered topologically over it.
 */
public class ComputeVisitingOrder implements InPlaceIRPass<ControlFlowGraph> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeVisitingOrder INSTANCE = new ComputeVisitingOrder();

    private static class Frame {
        final BasicBlock block;
        final List<BasicBlock> succs;
        int next = 0;

        Frame(BasicBlock block) {
            this.block = block;
            succs = new ArrayList<>(new LinkedHashSet<>(block.successors()));
        }
    }

    @Override
    public void runInPlace(ControlFlowGraph cfg) {
        for (BasicBlock block : cfg.blocks) {
            block.removeExt(CommonExts.ORDER_DATA);
        }

        VisitingOrder vo = new VisitingOrder();
        BasicBlock entry = cfg.getEntry();
        Map<BasicBlock, OrderData> data = new HashMap<>();
        Set<BasicBlock> onStack = new HashSet<>();

        Deque<Frame> stack = new ArrayDeque<>();
        data.put(entry, new OrderData());
        stack.push(new Frame(entry));
        onStack.add(entry);
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.next == top.succs.size()) {
                stack.pop();
                onStack.remove(top.block);
                continue;
            }
            BasicBlock target = top.succs.get(top.next++);
            if (onStack.contains(target)) {
                vo.backEdges.add(new BasicBlock[]{top.block, target});
                data.get(target).cyclic = true;
                continue;
            }
            OrderData targetData = data.get(target);
            if (targetData == null) {
                data.put(target, targetData = new OrderData());
                stack.push(new Frame(target));
                onStack.add(target);
            }
            data.get(top.block).dagSuccs.add(target);
            targetData.dagPreds.add(top.block);
        }

        Map<BasicBlock, Integer> inDegree = new HashMap<>();
        for (Map.Entry<BasicBlock, OrderData> entry1 : data.entrySet()) {
            inDegree.put(entry1.getKey(), entry1.getValue().dagPreds.size());
            entry1.getValue().depth = Integer.MAX_VALUE;
        }
        data.get(entry).depth = 0;
        Deque<BasicBlock> ready = new ArrayDeque<>();
        ready.add(entry);
        while (!ready.isEmpty()) {
            BasicBlock block = ready.poll();
            vo.order.add(block);
            OrderData od = data.get(block);
            for (BasicBlock succ : od.dagSuccs) {
                OrderData succData = data.get(succ);
                succData.depth = Math.min(succData.depth, od.depth + 1);
                int degree = inDegree.get(succ) - 1;
                inDegree.put(succ, degree);
                if (degree == 0) ready.add(succ);
            }
        }
        if (vo.order.size() != data.size()) {
            throw new IllegalStateException("acyclic view of " + cfg.name + " still has a cycle");
        }

        for (Map.Entry<BasicBlock, OrderData> entry1 : data.entrySet()) {
            entry1.getKey().attachExt(CommonExts.ORDER_DATA, entry1.getValue());
        }
        cfg.attachExt(CommonExts.VISITING_ORDER, vo);

        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.validate(MetadataState.VISITING_ORDER);
    }
}
