package io.github.eutro.cfgopt.cse;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * Whether the value of a node is known to be held in a user variable.
 * <p>
 * This is bookkeeping only: the transformation always introduces fresh temporaries.
 */
public final class Availability {
    public enum Kind {
        NOT_AVAILABLE,
        AVAILABLE_IN_VARIABLE,
        INVALIDATED,
    }

    public static final Availability NOT_AVAILABLE = new Availability(Kind.NOT_AVAILABLE, -1);
    public static final Availability INVALIDATED = new Availability(Kind.INVALIDATED, -1);

    private final Kind kind;
    private final int slot;

    private Availability(Kind kind, int slot) {
        this.kind = kind;
        this.slot = slot;
    }

    public static Availability inVariable(int slot) {
        Preconditions.checkArgument(slot >= 0, "bad slot %s", slot);
        return new Availability(Kind.AVAILABLE_IN_VARIABLE, slot);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Get the variable holding the value.
     *
     * @return The slot.
     * @throws IllegalStateException If the kind is not {@link Kind#AVAILABLE_IN_VARIABLE}.
     */
    public int getSlot() {
        Preconditions.checkState(kind == Kind.AVAILABLE_IN_VARIABLE, "not available in a variable");
        return slot;
    }

    public boolean isIn(int slot) {
        return kind == Kind.AVAILABLE_IN_VARIABLE && this.slot == slot;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Availability)) return false;
        Availability that = (Availability) o;
        return kind == that.kind && slot == that.slot;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, slot);
    }

    @Override
    public String toString() {
        return kind == Kind.AVAILABLE_IN_VARIABLE ? "in %" + slot : kind.toString();
    }
}
