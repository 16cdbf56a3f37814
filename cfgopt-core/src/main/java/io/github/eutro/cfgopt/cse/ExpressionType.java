package io.github.eutro.cfgopt.cse;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.eutro.cfgopt.cfg.Expression;
import io.github.eutro.cfgopt.cfg.Type;
import io.github.eutro.cfgopt.ops.OpKey;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * The key of a node in an {@link AvailableExpressionSet}: the shape of an expression with its
 * operands replaced by the ids of their own nodes.
 * <p>
 * Two expressions with equal keys in the same set compute the same value.
 */
public abstract class ExpressionType {
    ExpressionType() {
    }

    /**
     * Get the node ids this key refers to, in operand order.
     *
     * @return The operand ids, empty for leaves.
     */
    public List<Integer> operands() {
        return ImmutableList.of();
    }

    /**
     * Rebuild this key over other operand ids.
     *
     * @param operands The new operand ids.
     * @return The new key.
     */
    public ExpressionType withOperands(List<Integer> operands) {
        Preconditions.checkArgument(operands.isEmpty());
        return this;
    }

    public boolean isLeaf() {
        return true;
    }

    /**
     * Get the key for an expression that is a leaf.
     *
     * @param expr The expression.
     * @return The key, or null if the expression is not a leaf.
     */
    static @Nullable ExpressionType ofLeaf(Expression expr) {
        if (expr instanceof Expression.Variable) {
            return new Variable(((Expression.Variable) expr).slot);
        } else if (expr instanceof Expression.FunctionArg) {
            return new FunctionArg(((Expression.FunctionArg) expr).index, expr.getType());
        } else if (expr.isLeaf()) {
            return new Literal(expr);
        }
        return null;
    }

    /**
     * A read of a local variable, keyed by slot.
     */
    public static final class Variable extends ExpressionType {
        public final int slot;

        public Variable(int slot) {
            this.slot = slot;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Variable && ((Variable) o).slot == slot;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(slot);
        }

        @Override
        public String toString() {
            return "%" + slot;
        }
    }

    public static final class FunctionArg extends ExpressionType {
        public final int index;
        public final Type type;

        public FunctionArg(int index, Type type) {
            this.index = index;
            this.type = type;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof FunctionArg)) return false;
            FunctionArg that = (FunctionArg) o;
            return index == that.index && type.equals(that.type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(index, type);
        }

        @Override
        public String toString() {
            return "arg" + index;
        }
    }

    /**
     * A constant, keyed by its value and type.
     */
    public static final class Literal extends ExpressionType {
        public final Expression value;

        public Literal(Expression value) {
            Preconditions.checkArgument(value.isLeaf()
                    && !(value instanceof Expression.Variable)
                    && !(value instanceof Expression.FunctionArg), "not a literal: %s", value);
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Literal && ((Literal) o).value.equals(value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    public static final class Binary extends ExpressionType {
        public final OpKey op;
        public final int left;
        public final int right;

        public Binary(OpKey op, int left, int right) {
            this.op = op;
            this.left = left;
            this.right = right;
        }

        /**
         * Get this key with its operands swapped, which names the same value
         * if the operator is commutative.
         *
         * @return The swapped key.
         */
        public Binary swapped() {
            return new Binary(op, right, left);
        }

        @Override
        public List<Integer> operands() {
            return ImmutableList.of(left, right);
        }

        @Override
        public ExpressionType withOperands(List<Integer> operands) {
            Preconditions.checkArgument(operands.size() == 2);
            return new Binary(op, operands.get(0), operands.get(1));
        }

        @Override
        public boolean isLeaf() {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Binary)) return false;
            Binary that = (Binary) o;
            return left == that.left && right == that.right && op.equals(that.op);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, left, right);
        }

        @Override
        public String toString() {
            return "(#" + left + " " + op + " #" + right + ")";
        }
    }

    public static final class Unary extends ExpressionType {
        public final OpKey op;
        public final int operand;

        public Unary(OpKey op, int operand) {
            this.op = op;
            this.operand = operand;
        }

        @Override
        public List<Integer> operands() {
            return ImmutableList.of(operand);
        }

        @Override
        public ExpressionType withOperands(List<Integer> operands) {
            Preconditions.checkArgument(operands.size() == 1);
            return new Unary(op, operands.get(0));
        }

        @Override
        public boolean isLeaf() {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Unary)) return false;
            Unary that = (Unary) o;
            return operand == that.operand && op.equals(that.op);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, operand);
        }

        @Override
        public String toString() {
            return "(" + op + " #" + operand + ")";
        }
    }
}
