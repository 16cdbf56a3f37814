package io.github.eutro.cfgopt.cfg;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * The type of a value in the IR.
 */
public final class Type {
    /**
     * The different shapes of type.
     */
    public enum Kind {
        BOOL,
        INT,
        UINT,
        BYTES,
        DYNAMIC_BYTES,
        STRING,
        ADDRESS,
    }

    public static final Type BOOL = new Type(Kind.BOOL, 1);
    public static final Type DYNAMIC_BYTES = new Type(Kind.DYNAMIC_BYTES, 0);
    public static final Type STRING = new Type(Kind.STRING, 0);
    public static final Type ADDRESS = new Type(Kind.ADDRESS, 160);

    public static final Type UINT256 = uint(256);
    public static final Type INT256 = sint(256);

    private final Kind kind;
    private final int width;

    private Type(Kind kind, int width) {
        this.kind = kind;
        this.width = width;
    }

    /**
     * An unsigned integer type.
     *
     * @param bits The width in bits, a multiple of 8 between 8 and 256.
     * @return The type.
     */
    public static Type uint(int bits) {
        checkBits(bits);
        return new Type(Kind.UINT, bits);
    }

    /**
     * A signed integer type.
     *
     * @param bits The width in bits, a multiple of 8 between 8 and 256.
     * @return The type.
     */
    public static Type sint(int bits) {
        checkBits(bits);
        return new Type(Kind.INT, bits);
    }

    /**
     * A fixed-length byte array type.
     *
     * @param length The length in bytes, between 1 and 32.
     * @return The type.
     */
    public static Type bytes(int length) {
        Preconditions.checkArgument(length >= 1 && length <= 32, "bad fixed bytes length: %s", length);
        return new Type(Kind.BYTES, length * 8);
    }

    private static void checkBits(int bits) {
        Preconditions.checkArgument(bits >= 8 && bits <= 256 && bits % 8 == 0, "bad integer width: %s", bits);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Get the width of a value of this type in bits, or 0 for dynamically sized types.
     *
     * @return The width.
     */
    public int getBits() {
        return width;
    }

    public boolean isInteger() {
        return kind == Kind.INT || kind == Kind.UINT;
    }

    public boolean isSigned() {
        return kind == Kind.INT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Type type = (Type) o;
        return width == type.width && kind == type.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, width);
    }

    @Override
    public String toString() {
        switch (kind) {
            case BOOL:
                return "bool";
            case INT:
                return "int" + width;
            case UINT:
                return "uint" + width;
            case BYTES:
                return "bytes" + width / 8;
            case DYNAMIC_BYTES:
                return "bytes";
            case STRING:
                return "string";
            case ADDRESS:
                return "address";
            default:
                throw new AssertionError(kind);
        }
    }
}
