package io.github.eutro.cfgopt.ops;

import io.github.eutro.cfgopt.cfg.Type;

import java.util.Objects;

/**
 * The operator part of a deduplication key: the operator itself, whether it is the
 * overflow-checked variant, and the type it produces.
 * <p>
 * Two operations can only compute the same value if their keys are equal.
 */
public final class OpKey {
    public final Operator op;
    public final boolean checked;
    public final Type type;

    /**
     * Construct an operator key. The checked flag is dropped for operators
     * that are not {@link Operator#isOverflowCapable() overflow capable}.
     *
     * @param op      The operator.
     * @param checked Whether the operation is overflow-checked.
     * @param type    The type of the result.
     */
    public OpKey(Operator op, boolean checked, Type type) {
        this.op = op;
        this.checked = checked && op.isOverflowCapable();
        this.type = type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OpKey opKey = (OpKey) o;
        return checked == opKey.checked && op == opKey.op && type.equals(opKey.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, checked, type);
    }

    @Override
    public String toString() {
        return (checked ? "checked " : "") + op.mnemonic + ":" + type;
    }
}
