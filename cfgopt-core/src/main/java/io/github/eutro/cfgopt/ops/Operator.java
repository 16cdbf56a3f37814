package io.github.eutro.cfgopt.ops;

/**
 * The pure operators of the expression language.
 */
public enum Operator {
    ADD("+", 2, Flags.COMMUTATIVE | Flags.OVERFLOW),
    SUB("-", 2, Flags.OVERFLOW),
    MUL("*", 2, Flags.COMMUTATIVE | Flags.OVERFLOW),
    POW("**", 2, Flags.OVERFLOW),
    SDIV("s/", 2, Flags.TRAPS),
    UDIV("/", 2, Flags.TRAPS),
    SMOD("s%", 2, Flags.TRAPS),
    UMOD("%", 2, Flags.TRAPS),
    BIT_OR("|", 2, Flags.COMMUTATIVE),
    BIT_AND("&", 2, Flags.COMMUTATIVE),
    BIT_XOR("^", 2, Flags.COMMUTATIVE),
    SHL("<<", 2, 0),
    SHR_S("s>>", 2, 0),
    SHR_U(">>", 2, 0),
    LT_S("s<", 2, 0),
    LT_U("<", 2, 0),
    LE_S("s<=", 2, 0),
    LE_U("<=", 2, 0),
    GT_S("s>", 2, 0),
    GT_U(">", 2, 0),
    GE_S("s>=", 2, 0),
    GE_U(">=", 2, 0),
    EQ("==", 2, Flags.COMMUTATIVE),
    NE("!=", 2, Flags.COMMUTATIVE),
    STRING_CONCAT("concat", 2, 0),
    STRING_COMPARE("strcmp", 2, Flags.COMMUTATIVE),
    ADVANCE_POINTER("advance", 2, 0),

    NOT("!", 1, 0),
    NEG("neg", 1, Flags.OVERFLOW),
    BIT_NOT("~", 1, 0),
    ZERO_EXT("zext", 1, Flags.CONVERSION),
    SIGN_EXT("sext", 1, Flags.CONVERSION),
    TRUNC("trunc", 1, Flags.CONVERSION),
    CAST("cast", 1, Flags.CONVERSION),
    BYTES_CAST("bytes_cast", 1, Flags.CONVERSION),
    ;

    private static class Flags {
        static final int COMMUTATIVE = 1;
        static final int OVERFLOW = 2;
        static final int TRAPS = 4;
        static final int CONVERSION = 8;
    }

    /**
     * The printed form of the operator.
     */
    public final String mnemonic;
    /**
     * The number of operands, 1 or 2.
     */
    public final int arity;
    private final int flags;

    Operator(String mnemonic, int arity, int flags) {
        this.mnemonic = mnemonic;
        this.arity = arity;
        this.flags = flags;
    }

    /**
     * Whether swapping the operands leaves the result unchanged.
     *
     * @return Whether this is commutative.
     */
    public boolean isCommutative() {
        return (flags & Flags.COMMUTATIVE) != 0;
    }

    /**
     * Whether the operator has distinct overflow-checked and wrapping variants.
     *
     * @return Whether the checked flag matters for this operator.
     */
    public boolean isOverflowCapable() {
        return (flags & Flags.OVERFLOW) != 0;
    }

    /**
     * Whether the operator converts its operand to the expression's type.
     *
     * @return Whether this is a conversion.
     */
    public boolean isConversion() {
        return (flags & Flags.CONVERSION) != 0;
    }

    /**
     * Whether evaluating the operator may abort execution.
     *
     * @param checked Whether the overflow-checked variant is used.
     * @return Whether evaluation may trap.
     */
    public boolean mayTrap(boolean checked) {
        return (flags & Flags.TRAPS) != 0 || (checked && isOverflowCapable());
    }
}
