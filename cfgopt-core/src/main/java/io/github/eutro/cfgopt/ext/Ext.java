package io.github.eutro.cfgopt.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key for attaching analysis results and other side data to IR objects
 * stored in an {@link ExtContainer}.
 * <p>
 * Exts are ordered by creation, which is only stable within one run of the program.
 *
 * @param <T> The type of the attached value.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<?> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<?> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * Since a {@link Class} cannot carry type arguments, the ext's type is only
     * bounded by {@code type}, which lets exts of generic types such as
     * {@code Ext<Set<Integer>>} be created from {@code Set.class}.
     *
     * @param type The erased type of the value, kept for debugging.
     * @param name The name of the ext, kept for debugging.
     * @param <T>  The erased type.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>(type, name);
    }

    /**
     * Get the erased type this ext was created with.
     *
     * @return The type.
     */
    public Class<?> getType() {
        return type;
    }

    /**
     * Look this ext up in a container.
     *
     * @param ec The container.
     * @return The attached value, if any.
     * @see ExtContainer#getExt(Ext)
     */
    public Optional<T> getIn(ExtContainer ec) {
        return ec.getExt(this);
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
