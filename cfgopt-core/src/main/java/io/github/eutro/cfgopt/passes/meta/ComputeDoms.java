package io.github.eutro.cfgopt.passes.meta;

import io.github.eutro.cfgopt.cfg.BasicBlock;
import io.github.eutro.cfgopt.cfg.ControlFlowGraph;
import io.github.eutro.cfgopt.ext.CommonExts;
import io.github.eutro.cfgopt.ext.MetadataState;
import io.github.eutro.cfgopt.passes.InPlaceIRPass;
import io.github.eutro.cfgopt.util.GraphWalker;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/*
 Thomas Lengauer and Robert Endre Tarjan. A fast algorithm for finding dominators in a flow-graph.
 ACM Transactions on Programming Languages and Systems, 1(1):121-141, July 1979.
*/

/**
 * Computes {@link CommonExts#IDOM} for every block reachable from the entry.
 * <p>
 * Unlike most passes over blocks, this leaves the block order alone.
 */
public class ComputeDoms implements InPlaceIRPass<ControlFlowGraph> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeDoms INSTANCE = new ComputeDoms();

    @Override
    public void runInPlace(ControlFlowGraph cfg) {
        List<BasicBlock> reachable = GraphWalker.blockWalker(cfg).preOrder().toList();
        for (BasicBlock block : cfg.blocks) {
            block.removeExt(CommonExts.IDOM);
        }
        new Runner(reachable).run();

        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.validate(MetadataState.DOMS);
    }

    /**
     * Check whether one block dominates another, that is, whether every path from the
     * entry to {@code b} passes through {@code a}. Every block dominates itself.
     * <p>
     * Requires {@link MetadataState#DOMS}.
     *
     * @param a The candidate dominator.
     * @param b The dominated block.
     * @return Whether {@code a} dominates {@code b}.
     */
    public static boolean dominates(BasicBlock a, BasicBlock b) {
        for (BasicBlock cur = b; cur != null; cur = cur.getNullable(CommonExts.IDOM)) {
            if (cur == a) return true;
        }
        return false;
    }

    private static class Runner {
        final List<BasicBlock> blocks;
        int n;
        final int[][] succ;
        final int[] dom;
        final int[] parent;
        final int[] ancestor;
        final int[] child;
        final int[] vertex;
        final int[] label;
        final int[] semi;
        final int[] size;
        final List<Set<Integer>> pred = new ArrayList<>();
        final List<Set<Integer>> bucket = new ArrayList<>();

        Runner(List<BasicBlock> blocks) {
            this.blocks = blocks;
            n = blocks.size();
            succ = new int[n + 1][];
            dom = new int[n + 1];
            parent = new int[n + 1];
            ancestor = new int[n + 1];
            child = new int[n + 1];
            vertex = new int[n + 1];
            label = new int[n + 1];
            semi = new int[n + 1];
            size = new int[n + 1];
            for (int v = 0; v <= n; v++) {
                pred.add(new LinkedHashSet<>());
                bucket.add(new LinkedHashSet<>());
            }
        }

        void dfs(int root) {
            // iterative, so deep graphs don't overflow the stack
            List<int[]> stack = new ArrayList<>();
            semi[root] = ++n;
            vertex[n] = label[root] = root;
            size[root] = 1;
            stack.add(new int[]{root, 0});
            while (!stack.isEmpty()) {
                int[] frame = stack.get(stack.size() - 1);
                int v = frame[0];
                if (frame[1] == succ[v].length) {
                    stack.remove(stack.size() - 1);
                    continue;
                }
                int w = succ[v][frame[1]++];
                pred.get(w).add(v);
                if (semi[w] == 0) {
                    parent[w] = v;
                    semi[w] = ++n;
                    vertex[n] = label[w] = w;
                    size[w] = 1;
                    stack.add(new int[]{w, 0});
                }
            }
        }

        void compress(int v) {
            if (ancestor[ancestor[v]] != 0) {
                compress(ancestor[v]);
                if (semi[label[ancestor[v]]] < semi[label[v]]) {
                    label[v] = label[ancestor[v]];
                }
                ancestor[v] = ancestor[ancestor[v]];
            }
        }

        int eval(int v) {
            if (ancestor[v] == 0) {
                return label[v];
            }
            compress(v);
            return semi[label[ancestor[v]]] >= semi[label[v]]
                    ? label[v]
                    : label[ancestor[v]];
        }

        void link(int v, int w) {
            int s = w;
            while (semi[label[w]] < semi[label[child[s]]]) {
                if (size[s] + size[child[child[s]]] >= 2 * size[child[s]]) {
                    ancestor[child[s]] = s;
                    child[s] = child[child[s]];
                } else {
                    size[child[s]] = size[s];
                    s = ancestor[s] = child[s];
                }
            }
            label[s] = label[w];
            size[v] += size[w];
            if (size[v] < 2 * size[w]) {
                int t = s;
                s = child[v];
                child[v] = t;
            }
            while (s != 0) {
                ancestor[s] = v;
                s = child[s];
            }
        }

        void run() {
            Map<BasicBlock, Integer> indices = new HashMap<>();
            for (int i = 0; i < blocks.size(); i++) {
                indices.put(blocks.get(i), i + 1);
            }
            for (int i = 0; i < blocks.size(); i++) {
                List<BasicBlock> targets = new ArrayList<>(new LinkedHashSet<>(blocks.get(i).successors()));
                succ[i + 1] = new int[targets.size()];
                for (int j = 0; j < targets.size(); j++) {
                    succ[i + 1][j] = indices.get(targets.get(j));
                }
            }

            n = 0;
            dfs(1);
            size[0] = label[0] = semi[0] = 0;
            for (int i = n; i >= 2; i--) {
                int w = vertex[i];
                for (int v : pred.get(w)) {
                    int u = eval(v);
                    if (semi[u] < semi[w]) {
                        semi[w] = semi[u];
                    }
                }
                bucket.get(vertex[semi[w]]).add(w);
                link(parent[w], w);
                for (int v : bucket.get(parent[w])) {
                    int u = eval(v);
                    dom[v] = semi[u] < semi[v] ? u : parent[w];
                }
                bucket.get(parent[w]).clear();
            }
            for (int i = 2; i <= n; ++i) {
                int w = vertex[i];
                if (dom[w] != vertex[semi[w]]) {
                    dom[w] = dom[dom[w]];
                }
            }

            for (int i = 2; i <= blocks.size(); i++) {
                blocks.get(i - 1).attachExt(CommonExts.IDOM, blocks.get(dom[i] - 1));
            }
        }
    }
}
