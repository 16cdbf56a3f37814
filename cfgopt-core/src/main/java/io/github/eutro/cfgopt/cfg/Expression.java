package io.github.eutro.cfgopt.cfg;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.io.BaseEncoding;
import io.github.eutro.cfgopt.ops.OpKey;
import io.github.eutro.cfgopt.ops.Operator;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * An expression, as found in the operands of {@link Instr instructions}.
 * <p>
 * Expressions are immutable trees with structural equality. The pure forms are the leaves
 * ({@link Variable}, {@link FunctionArg} and the literals) and the {@link Binary} and {@link Unary}
 * operations over them. Every other form reads state or has effects, and is never deduplicated
 * itself, though its operands may be.
 */
public abstract class Expression {
    private final Type type;

    Expression(Type type) {
        this.type = Preconditions.checkNotNull(type);
    }

    /**
     * Get the type of value this expression produces.
     *
     * @return The type.
     */
    public Type getType() {
        return type;
    }

    /**
     * Get the direct subexpressions, in evaluation order.
     *
     * @return The children.
     */
    public List<Expression> children() {
        return ImmutableList.of();
    }

    /**
     * Rebuild this expression with new children, in the order given by {@link #children()}.
     *
     * @param children The new children.
     * @return The rebuilt expression, or this if the children are unchanged.
     */
    public Expression withChildren(List<Expression> children) {
        Preconditions.checkArgument(children.isEmpty(), "leaf expression given children");
        return this;
    }

    /**
     * Whether this is a variable, argument or literal.
     *
     * @return Whether this is a leaf.
     */
    public boolean isLeaf() {
        return false;
    }

    public static Variable var(Type type, int slot) {
        return new Variable(type, slot);
    }

    public static FunctionArg arg(Type type, int index) {
        return new FunctionArg(type, index);
    }

    public static NumberLiteral num(Type type, long value) {
        return new NumberLiteral(type, BigInteger.valueOf(value));
    }

    public static BoolLiteral bool(boolean value) {
        return new BoolLiteral(value);
    }

    public static Binary binary(Operator op, Type type, Expression left, Expression right) {
        return new Binary(type, op, false, left, right);
    }

    public static Binary checked(Operator op, Type type, Expression left, Expression right) {
        return new Binary(type, op, true, left, right);
    }

    public static Unary unary(Operator op, Type type, Expression operand) {
        return new Unary(type, op, operand);
    }

    /**
     * A read of a local variable.
     */
    public static final class Variable extends Expression {
        public final int slot;

        public Variable(Type type, int slot) {
            super(type);
            this.slot = slot;
        }

        @Override
        public boolean isLeaf() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Variable
                    && ((Variable) o).slot == slot
                    && ((Variable) o).getType().equals(getType());
        }

        @Override
        public int hashCode() {
            return Objects.hash(slot, getType());
        }

        @Override
        public String toString() {
            return "%" + slot;
        }
    }

    /**
     * A read of one of the function's parameters.
     */
    public static final class FunctionArg extends Expression {
        public final int index;

        public FunctionArg(Type type, int index) {
            super(type);
            this.index = index;
        }

        @Override
        public boolean isLeaf() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof FunctionArg
                    && ((FunctionArg) o).index == index
                    && ((FunctionArg) o).getType().equals(getType());
        }

        @Override
        public int hashCode() {
            return Objects.hash(index, getType());
        }

        @Override
        public String toString() {
            return "arg" + index;
        }
    }

    public static final class BoolLiteral extends Expression {
        public final boolean value;

        public BoolLiteral(boolean value) {
            super(Type.BOOL);
            this.value = value;
        }

        @Override
        public boolean isLeaf() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BoolLiteral && ((BoolLiteral) o).value == value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    public static final class NumberLiteral extends Expression {
        public final BigInteger value;

        public NumberLiteral(Type type, BigInteger value) {
            super(type);
            this.value = Preconditions.checkNotNull(value);
        }

        @Override
        public boolean isLeaf() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof NumberLiteral
                    && ((NumberLiteral) o).value.equals(value)
                    && ((NumberLiteral) o).getType().equals(getType());
        }

        @Override
        public int hashCode() {
            return Objects.hash(value, getType());
        }

        @Override
        public String toString() {
            return getType() + " " + value;
        }
    }

    public static final class BytesLiteral extends Expression {
        private final byte[] value;

        public BytesLiteral(Type type, byte[] value) {
            super(type);
            this.value = value.clone();
        }

        /**
         * Get a copy of the literal bytes.
         *
         * @return The bytes.
         */
        public byte[] getValue() {
            return value.clone();
        }

        @Override
        public boolean isLeaf() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BytesLiteral
                    && Arrays.equals(((BytesLiteral) o).value, value)
                    && ((BytesLiteral) o).getType().equals(getType());
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(value) + getType().hashCode();
        }

        @Override
        public String toString() {
            return getType() + " hex\"" + BaseEncoding.base16().lowerCase().encode(value) + "\"";
        }
    }

    /**
     * A pure binary operation.
     */
    public static final class Binary extends Expression {
        public final Operator op;
        public final boolean checked;
        public final Expression left;
        public final Expression right;

        public Binary(Type type, Operator op, boolean checked, Expression left, Expression right) {
            super(type);
            Preconditions.checkArgument(op.arity == 2, "not a binary operator: %s", op);
            this.op = op;
            this.checked = checked && op.isOverflowCapable();
            this.left = Preconditions.checkNotNull(left);
            this.right = Preconditions.checkNotNull(right);
        }

        /**
         * Get the key of this operation's operator.
         *
         * @return The operator key.
         */
        public OpKey opKey() {
            return new OpKey(op, checked, getType());
        }

        @Override
        public List<Expression> children() {
            return ImmutableList.of(left, right);
        }

        @Override
        public Expression withChildren(List<Expression> children) {
            Preconditions.checkArgument(children.size() == 2);
            if (children.get(0) == left && children.get(1) == right) return this;
            return new Binary(getType(), op, checked, children.get(0), children.get(1));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Binary)) return false;
            Binary that = (Binary) o;
            return checked == that.checked
                    && op == that.op
                    && getType().equals(that.getType())
                    && left.equals(that.left)
                    && right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, checked, getType(), left, right);
        }

        @Override
        public String toString() {
            return "(" + left + " " + (checked ? "checked " : "") + op.mnemonic + " " + right + ")";
        }
    }

    /**
     * A pure unary operation.
     */
    public static final class Unary extends Expression {
        public final Operator op;
        public final Expression operand;

        public Unary(Type type, Operator op, Expression operand) {
            super(type);
            Preconditions.checkArgument(op.arity == 1, "not a unary operator: %s", op);
            this.op = op;
            this.operand = Preconditions.checkNotNull(operand);
        }

        public OpKey opKey() {
            return new OpKey(op, false, getType());
        }

        @Override
        public List<Expression> children() {
            return ImmutableList.of(operand);
        }

        @Override
        public Expression withChildren(List<Expression> children) {
            Preconditions.checkArgument(children.size() == 1);
            if (children.get(0) == operand) return this;
            return new Unary(getType(), op, children.get(0));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Unary)) return false;
            Unary that = (Unary) o;
            return op == that.op && getType().equals(that.getType()) && operand.equals(that.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, getType(), operand);
        }

        @Override
        public String toString() {
            if (op.isConversion()) {
                return "(" + op.mnemonic + " " + getType() + " " + operand + ")";
            }
            return "(" + op.mnemonic + " " + operand + ")";
        }
    }

    /**
     * Base for the forms that are never deduplicated: they read mutable state, may have effects,
     * or build values with identity. Their children are still ordinary operands.
     */
    public abstract static class Impure extends Expression {
        private final String mnemonic;
        private final ImmutableList<Expression> children;

        Impure(Type type, String mnemonic, List<Expression> children) {
            super(type);
            this.mnemonic = mnemonic;
            this.children = ImmutableList.copyOf(children);
        }

        @Override
        public List<Expression> children() {
            return children;
        }

        @Override
        public Expression withChildren(List<Expression> children) {
            Preconditions.checkArgument(children.size() == this.children.size());
            if (children.equals(this.children)) return this;
            return rebuild(ImmutableList.copyOf(children));
        }

        abstract Expression rebuild(ImmutableList<Expression> children);

        String describe() {
            return mnemonic;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Impure that = (Impure) o;
            return describe().equals(that.describe())
                    && getType().equals(that.getType())
                    && children.equals(that.children);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getClass(), describe(), getType(), children);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(").append(describe());
            for (Expression child : children) {
                sb.append(' ').append(child);
            }
            return sb.append(')').toString();
        }
    }

    /**
     * A read from memory through a pointer.
     */
    public static final class Load extends Impure {
        public Load(Type type, Expression pointer) {
            super(type, "load", ImmutableList.of(pointer));
        }

        @Override
        Expression rebuild(ImmutableList<Expression> children) {
            return new Load(getType(), children.get(0));
        }
    }

    /**
     * A read from contract storage.
     */
    public static final class StorageLoad extends Impure {
        public StorageLoad(Type type, Expression slot) {
            super(type, "sload", ImmutableList.of(slot));
        }

        @Override
        Expression rebuild(ImmutableList<Expression> children) {
            return new StorageLoad(getType(), children.get(0));
        }
    }

    /**
     * A read of an element of an array in memory.
     */
    public static final class Subscript extends Impure {
        public Subscript(Type type, Expression array, Expression index) {
            super(type, "subscript", ImmutableList.of(array, index));
        }

        @Override
        Expression rebuild(ImmutableList<Expression> children) {
            return new Subscript(getType(), children.get(0), children.get(1));
        }
    }

    /**
     * A call to a runtime builtin, such as reading the block timestamp or hashing memory.
     */
    public static final class Builtin extends Impure {
        public final String name;

        public Builtin(Type type, String name, List<Expression> args) {
            super(type, "builtin", args);
            this.name = name;
        }

        @Override
        Expression rebuild(ImmutableList<Expression> children) {
            return new Builtin(getType(), name, children);
        }

        @Override
        String describe() {
            return "builtin " + name;
        }
    }

    /**
     * The data returned by the last external call.
     */
    public static final class ReturnData extends Impure {
        public ReturnData() {
            super(Type.DYNAMIC_BYTES, "returndata", ImmutableList.of());
        }

        @Override
        Expression rebuild(ImmutableList<Expression> children) {
            return this;
        }
    }

    /**
     * A freshly allocated list or struct.
     */
    public static final class Aggregate extends Impure {
        public Aggregate(Type type, List<Expression> values) {
            super(type, "aggregate", values);
        }

        @Override
        Expression rebuild(ImmutableList<Expression> children) {
            return new Aggregate(getType(), children);
        }
    }
}
