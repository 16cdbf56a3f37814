package io.github.eutro.cfgopt.cse;

import io.github.eutro.cfgopt.cfg.BasicBlock;
import io.github.eutro.cfgopt.cfg.Expression;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * A node of the identity graph held by an {@link AvailableExpressionSet}.
 */
public final class GraphNode {
    /**
     * The id of the node, unique within one {@link AnalysisContext}.
     */
    public final int id;
    public final ExpressionType key;
    /**
     * The expression this node was created for.
     */
    public final Expression expression;
    /**
     * The ids of the nodes that use this one as an operand.
     */
    final TreeSet<Integer> children = new TreeSet<>();
    Availability availability = Availability.NOT_AVAILABLE;
    /**
     * The blocks in which the value was computed, on the paths this node has survived.
     */
    final Set<BasicBlock> origins = new LinkedHashSet<>();
    /**
     * Set when the node survives a merge of independent computations:
     * the block dominating all of them where the value can be computed once.
     */
    @Nullable BasicBlock hoistToBlock;

    GraphNode(int id, ExpressionType key, Expression expression, BasicBlock origin) {
        this.id = id;
        this.key = key;
        this.expression = expression;
        origins.add(origin);
    }

    private GraphNode(int id, ExpressionType key, GraphNode other) {
        this.id = id;
        this.key = key;
        expression = other.expression;
        availability = other.availability;
        origins.addAll(other.origins);
        hoistToBlock = other.hoistToBlock;
    }

    private GraphNode(GraphNode other) {
        id = other.id;
        key = other.key;
        expression = other.expression;
        children.addAll(other.children);
        availability = other.availability;
        origins.addAll(other.origins);
        hoistToBlock = other.hoistToBlock;
    }

    GraphNode copy() {
        return new GraphNode(this);
    }

    /**
     * Copy this node under another id and key, without its children.
     */
    GraphNode copyAs(int id, ExpressionType key) {
        return new GraphNode(id, key, this);
    }

    /**
     * Get the block a single computation of this value would be placed in.
     *
     * @return The hoist block if there is one, otherwise the first origin.
     */
    public BasicBlock placement() {
        return hoistToBlock != null ? hoistToBlock : origins.iterator().next();
    }

    public Availability getAvailability() {
        return availability;
    }

    public Set<Integer> getChildren() {
        return children;
    }

    public Set<BasicBlock> getOrigins() {
        return origins;
    }

    public @Nullable BasicBlock getHoistToBlock() {
        return hoistToBlock;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("#").append(id).append(' ').append(key)
                .append(" = ").append(expression)
                .append(" [").append(availability).append("] from");
        for (BasicBlock origin : origins) {
            sb.append(' ').append(origin.toTargetString());
        }
        if (hoistToBlock != null) {
            sb.append(" hoist ").append(hoistToBlock.toTargetString());
        }
        return sb.toString();
    }
}
