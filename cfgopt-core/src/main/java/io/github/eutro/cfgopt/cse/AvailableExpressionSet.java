package io.github.eutro.cfgopt.cse;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import io.github.eutro.cfgopt.cfg.BasicBlock;
import io.github.eutro.cfgopt.cfg.Expression;
import io.github.eutro.cfgopt.cfg.Instr;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The expressions available at one program point, as an identity graph.
 * <p>
 * Each node stands for one value. Leaves are variables, arguments and literals; a pure
 * operation is keyed by its operator and the ids of its operands' nodes, so equal keys
 * mean equal values. Assigning a variable kills its node and, transitively, every node
 * computed from it.
 * <p>
 * Impure expressions are never nodes themselves: {@link #find(Expression)} and
 * {@link #gen(Expression, AnalysisContext)} return null for them, and for anything
 * built over them.
 */
public final class AvailableExpressionSet {
    private final Map<ExpressionType, Integer> exprMap = new HashMap<>();
    private final TreeMap<Integer, GraphNode> nodes = new TreeMap<>();

    public AvailableExpressionSet() {
    }

    /**
     * Deep copy this set. Nodes are copied, ids are kept.
     *
     * @return The copy.
     */
    public AvailableExpressionSet copy() {
        AvailableExpressionSet ret = new AvailableExpressionSet();
        ret.exprMap.putAll(exprMap);
        for (GraphNode node : nodes.values()) {
            ret.nodes.put(node.id, node.copy());
        }
        return ret;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public @Nullable GraphNode getNode(int id) {
        return nodes.get(id);
    }

    /**
     * Get the nodes of this set, in increasing id order.
     *
     * @return An unmodifiable view of the nodes.
     */
    public Collection<GraphNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /**
     * Look up a key, also trying the swapped key for commutative operations.
     *
     * @param key The key.
     * @return The id of the node, or null if there is none.
     */
    public @Nullable Integer lookup(ExpressionType key) {
        Integer id = exprMap.get(key);
        if (id == null && key instanceof ExpressionType.Binary
                && ((ExpressionType.Binary) key).op.op.isCommutative()) {
            id = exprMap.get(((ExpressionType.Binary) key).swapped());
        }
        return id;
    }

    public @Nullable Integer idOfVariable(int slot) {
        return exprMap.get(new ExpressionType.Variable(slot));
    }

    /**
     * Find the node of an expression, without adding anything.
     *
     * @param expr The expression.
     * @return The id of its node, or null if it is not available or cannot be tracked.
     */
    public @Nullable Integer find(Expression expr) {
        ExpressionType key = keyOf(expr);
        return key == null ? null : lookup(key);
    }

    /**
     * Compute the key an expression would have in this set, if all of its operands are present.
     *
     * @param expr The expression.
     * @return The key, or null if an operand is missing or the expression cannot be tracked.
     */
    public @Nullable ExpressionType keyOf(Expression expr) {
        if (expr.isLeaf()) {
            return ExpressionType.ofLeaf(expr);
        } else if (expr instanceof Expression.Binary) {
            Expression.Binary bin = (Expression.Binary) expr;
            Integer l = find(bin.left);
            if (l == null) return null;
            Integer r = find(bin.right);
            if (r == null) return null;
            return new ExpressionType.Binary(bin.opKey(), l, r);
        } else if (expr instanceof Expression.Unary) {
            Expression.Unary un = (Expression.Unary) expr;
            Integer o = find(un.operand);
            if (o == null) return null;
            return new ExpressionType.Unary(un.opKey(), o);
        }
        return null;
    }

    /**
     * Make an expression, and all of its pure subexpressions, available.
     * <p>
     * If the context has a tracker, it is told of every non-leaf node found or created.
     *
     * @param expr The expression.
     * @param ctx  The analysis context.
     * @return The id of the expression's node, or null if it cannot be tracked.
     */
    public @Nullable Integer gen(Expression expr, AnalysisContext ctx) {
        CommonSubexpressionTracker tracker = ctx.getTracker();
        Integer found = find(expr);
        if (found != null) {
            if (tracker != null && !expr.isLeaf()) {
                tracker.onOccurrence(nodes.get(found), this, ctx.getCurrentBlock());
            }
            return found;
        }
        if (expr.isLeaf()) {
            return create(ExpressionType.ofLeaf(expr), expr, ctx);
        }

        List<Integer> operands = new ArrayList<>();
        boolean tracked = true;
        for (Expression child : expr.children()) {
            Integer id = gen(child, ctx);
            if (id == null) tracked = false;
            operands.add(id);
        }
        ExpressionType key = tracked ? keyFor(expr, operands) : null;
        if (key == null) return null;

        Integer id = lookup(key);
        if (id != null) {
            if (tracker != null) tracker.onOccurrence(nodes.get(id), this, ctx.getCurrentBlock());
            return id;
        }
        id = create(key, expr, ctx);
        if (tracker != null) tracker.onCreated(nodes.get(id), this, ctx.getCurrentBlock());
        return id;
    }

    private static @Nullable ExpressionType keyFor(Expression expr, List<Integer> operands) {
        if (expr instanceof Expression.Binary) {
            return new ExpressionType.Binary(((Expression.Binary) expr).opKey(), operands.get(0), operands.get(1));
        } else if (expr instanceof Expression.Unary) {
            return new ExpressionType.Unary(((Expression.Unary) expr).opKey(), operands.get(0));
        }
        return null;
    }

    private int create(ExpressionType key, Expression expr, AnalysisContext ctx) {
        int id = ctx.freshId();
        GraphNode node = new GraphNode(id, key, expr, ctx.getCurrentBlock());
        for (int operand : key.operands()) {
            GraphNode opNode = nodes.get(operand);
            Verify.verifyNotNull(opNode, "operand #%s of %s missing", operand, key);
            opNode.children.add(id);
        }
        nodes.put(id, node);
        exprMap.put(key, id);
        return id;
    }

    /**
     * The outcome of {@link #regenerate(Expression, AnalysisContext)}.
     */
    public static final class Regenerated {
        public final @Nullable Integer id;
        public final Expression expr;

        Regenerated(@Nullable Integer id, Expression expr) {
            this.id = id;
            this.expr = expr;
        }
    }

    /**
     * Replay {@link #gen(Expression, AnalysisContext)} for an expression while rewriting it.
     * <p>
     * Nodes are created in the same order as by {@code gen}, so a walk that replays an earlier
     * one assigns the same ids. Each non-leaf node is offered to the context's tracker, which
     * may replace the (already rewritten) expression with a read of a temporary.
     *
     * @param expr The expression.
     * @param ctx  The analysis context.
     * @return The id of the expression's node and the rewritten expression.
     */
    public Regenerated regenerate(Expression expr, AnalysisContext ctx) {
        if (expr.isLeaf()) {
            Integer id = find(expr);
            if (id == null) id = create(ExpressionType.ofLeaf(expr), expr, ctx);
            return new Regenerated(id, expr);
        }

        List<Expression> children = expr.children();
        List<Expression> rewritten = new ArrayList<>(children.size());
        List<Integer> operands = new ArrayList<>(children.size());
        boolean tracked = true;
        for (Expression child : children) {
            Regenerated r = regenerate(child, ctx);
            if (r.id == null) tracked = false;
            operands.add(r.id);
            rewritten.add(r.expr);
        }
        Expression rebuilt = expr.withChildren(rewritten);
        ExpressionType key = tracked ? keyFor(expr, operands) : null;
        if (key == null) return new Regenerated(null, rebuilt);

        Integer id = lookup(key);
        if (id == null) id = create(key, expr, ctx);
        CommonSubexpressionTracker tracker = ctx.getTracker();
        if (tracker != null) {
            Expression replaced = tracker.substitute(nodes.get(id), rebuilt, ctx);
            if (replaced != null) return new Regenerated(id, replaced);
        }
        return new Regenerated(id, rebuilt);
    }

    /**
     * Kill a variable: its node and every node computed from it.
     *
     * @param slot The variable slot.
     */
    public void kill(int slot) {
        for (GraphNode node : nodes.values()) {
            if (node.availability.isIn(slot)) node.availability = Availability.NOT_AVAILABLE;
        }
        Integer id = idOfVariable(slot);
        if (id != null) killNode(id);
    }

    /**
     * Kill a node and every node computed from it.
     *
     * @param id The id of the node.
     */
    public void killNode(int id) {
        Preconditions.checkArgument(nodes.containsKey(id), "no node #%s", id);
        Deque<Integer> worklist = new ArrayDeque<>();
        Set<Integer> visited = new HashSet<>();
        worklist.add(id);
        while (!worklist.isEmpty()) {
            int cur = worklist.poll();
            if (!visited.add(cur)) continue;
            GraphNode node = nodes.remove(cur);
            if (node == null) continue;
            exprMap.remove(node.key);
            for (int operand : node.key.operands()) {
                GraphNode opNode = nodes.get(operand);
                if (opNode != null) opNode.children.remove(cur);
            }
            worklist.addAll(node.children);
        }
    }

    /**
     * Update this set as if the instruction had executed: its operands are generated,
     * then every variable it writes is killed.
     *
     * @param instr The instruction.
     * @param ctx   The analysis context.
     */
    public void processInstruction(Instr instr, AnalysisContext ctx) {
        List<Integer> ids = new ArrayList<>();
        for (Expression operand : instr.operands()) {
            ids.add(gen(operand, ctx));
        }
        afterOperands(instr, ids);
    }

    /**
     * Like {@link #processInstruction(Instr, AnalysisContext)}, but rewrite the operands with
     * {@link #regenerate(Expression, AnalysisContext)}. Definitions the tracker emits are left
     * in the context, to be inserted before the instruction.
     *
     * @param instr The instruction.
     * @param ctx   The analysis context.
     * @return Whether any operand was changed.
     */
    public boolean rewriteInstruction(Instr instr, AnalysisContext ctx) {
        boolean changed = false;
        List<Expression> operands = instr.operands();
        List<Integer> ids = new ArrayList<>();
        for (int i = 0; i < operands.size(); i++) {
            Expression operand = operands.get(i);
            Regenerated r = regenerate(operand, ctx);
            ids.add(r.id);
            if (r.expr != operand) {
                operands.set(i, r.expr);
                changed = true;
            }
        }
        afterOperands(instr, ids);
        return changed;
    }

    private void afterOperands(Instr instr, List<Integer> ids) {
        for (int slot : instr.results()) {
            kill(slot);
        }
        if (instr instanceof Instr.Set) {
            Integer id = ids.get(0);
            if (id != null && nodes.containsKey(id)) {
                nodes.get(id).availability = Availability.inVariable(((Instr.Set) instr).res);
            }
        }
    }

    /**
     * Update this set as if the instruction were executed backwards: every variable it writes
     * is killed, then its operands are generated.
     *
     * @param instr The instruction.
     * @param ctx   The analysis context.
     */
    public void processInstructionBackward(Instr instr, AnalysisContext ctx) {
        for (int slot : instr.results()) {
            kill(slot);
        }
        for (Expression operand : instr.operands()) {
            gen(operand, ctx);
        }
    }

    /**
     * Keep only what is available in both this set and the other.
     * <p>
     * Variables must hold the same value on both sides. A pure operation computed independently
     * on each side is kept under this set's id, provided the two computations can be placed in
     * a common block; otherwise it is dropped. Nodes whose operands are dropped go with them.
     *
     * @param other       The other set.
     * @param anticipated The anticipated expressions, for placing merged computations,
     *                    or null if none may be merged.
     */
    public void intersect(AvailableExpressionSet other, @Nullable AnticipatedExpressions anticipated) {
        Map<Integer, Integer> selfToOther = new HashMap<>();
        TreeMap<Integer, GraphNode> kept = new TreeMap<>();
        for (GraphNode node : nodes.values()) {
            List<Integer> operands = new ArrayList<>();
            boolean present = true;
            for (int operand : node.key.operands()) {
                Integer mapped = selfToOther.get(operand);
                if (mapped == null) {
                    present = false;
                    break;
                }
                operands.add(mapped);
            }
            if (!present) continue;
            Integer otherId = other.lookup(node.key.withOperands(operands));
            if (otherId == null) continue;
            GraphNode otherNode = other.nodes.get(otherId);

            if (otherId != node.id) {
                if (node.key instanceof ExpressionType.Variable) continue;
                if (!node.key.isLeaf()) {
                    BasicBlock hoist = anticipated == null
                            ? null
                            : anticipated.findAncestor(node.placement(), otherNode.placement(), node.expression);
                    if (hoist == null) continue;
                    node.origins.addAll(otherNode.origins);
                    node.hoistToBlock = hoist;
                }
            }
            if (!node.availability.equals(otherNode.availability)) {
                node.availability = Availability.INVALIDATED;
            }
            selfToOther.put(node.id, otherId);
            kept.put(node.id, node);
        }

        nodes.clear();
        nodes.putAll(kept);
        rebuildIndex();
    }

    private void rebuildIndex() {
        exprMap.clear();
        for (GraphNode node : nodes.values()) {
            node.children.clear();
        }
        for (GraphNode node : nodes.values()) {
            exprMap.put(node.key, node.id);
            for (int operand : node.key.operands()) {
                nodes.get(operand).children.add(node.id);
            }
        }
    }

    /**
     * Add everything available in the other set to this one.
     * <p>
     * Nodes of the other set with no counterpart here are copied, keeping their id where
     * this set does not already use it.
     *
     * @param other The other set.
     * @param ctx   The analysis context both sets belong to.
     */
    public void union(AvailableExpressionSet other, AnalysisContext ctx) {
        Map<Integer, Integer> otherToSelf = new HashMap<>();
        for (GraphNode otherNode : other.nodes.values()) {
            List<Integer> operands = new ArrayList<>();
            for (int operand : otherNode.key.operands()) {
                operands.add(Verify.verifyNotNull(otherToSelf.get(operand),
                        "operand #%s of #%s not merged", operand, otherNode.id));
            }
            ExpressionType key = otherNode.key.withOperands(operands);
            Integer existing = lookup(key);
            if (existing != null) {
                otherToSelf.put(otherNode.id, existing);
                continue;
            }
            // operands must keep smaller ids than their users
            boolean keepId = !nodes.containsKey(otherNode.id);
            for (int operand : operands) {
                if (operand >= otherNode.id) keepId = false;
            }
            int id = keepId ? otherNode.id : ctx.freshId();
            ctx.reserve(id);
            GraphNode node = otherNode.copyAs(id, key);
            nodes.put(id, node);
            exprMap.put(key, id);
            for (int operand : operands) {
                nodes.get(operand).children.add(id);
            }
            otherToSelf.put(otherNode.id, id);
        }
    }

    /**
     * Collect the variable leaves an expression node is computed from.
     *
     * @param id The id of the node.
     * @return A map from variable slot to the id of its node.
     */
    public SortedMap<Integer, Integer> variableLeaves(int id) {
        SortedMap<Integer, Integer> leaves = new TreeMap<>();
        Deque<Integer> worklist = new ArrayDeque<>();
        Set<Integer> visited = new HashSet<>();
        worklist.add(id);
        while (!worklist.isEmpty()) {
            int cur = worklist.poll();
            if (!visited.add(cur)) continue;
            GraphNode node = Verify.verifyNotNull(nodes.get(cur), "no node #%s", cur);
            if (node.key instanceof ExpressionType.Variable) {
                leaves.put(((ExpressionType.Variable) node.key).slot, node.id);
            }
            worklist.addAll(node.key.operands());
        }
        return leaves;
    }

    /**
     * Check that the identity graph is consistent, throwing if it is not.
     */
    public void verifyConsistency() {
        Verify.verify(exprMap.size() == nodes.size(), "%s keys for %s nodes", exprMap.size(), nodes.size());
        for (Map.Entry<ExpressionType, Integer> entry : exprMap.entrySet()) {
            GraphNode node = nodes.get(entry.getValue());
            Verify.verify(node != null, "key %s maps to missing node #%s", entry.getKey(), entry.getValue());
            Verify.verify(node.key.equals(entry.getKey()), "key %s maps to node %s", entry.getKey(), node);
        }
        for (GraphNode node : nodes.values()) {
            for (int operand : node.key.operands()) {
                GraphNode opNode = nodes.get(operand);
                Verify.verify(opNode != null, "operand #%s of %s missing", operand, node);
                Verify.verify(opNode.children.contains(node.id), "%s does not list child #%s", opNode, node.id);
                Verify.verify(operand < node.id, "operand #%s of %s is newer", operand, node);
            }
            for (int child : node.children) {
                GraphNode childNode = nodes.get(child);
                Verify.verify(childNode != null, "child #%s of %s missing", child, node);
                Verify.verify(childNode.key.operands().contains(node.id), "%s is not an operand of %s", node, childNode);
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (GraphNode node : nodes.values()) {
            sb.append("\n  ").append(node);
        }
        return sb.append(nodes.isEmpty() ? "}" : "\n}").toString();
    }
}
