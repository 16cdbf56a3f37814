package io.github.eutro.cfgopt.ext;

import io.github.eutro.cfgopt.passes.IRPass;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Something {@link Ext}s can be attached to. See the {@link io.github.eutro.cfgopt.ext package documentation}.
 */
public interface ExtContainer {
    /**
     * Attach a value for {@code ext}, replacing any previous one.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the ext.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove the value for {@code ext}, if there is one.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value attached for {@code ext}.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value, or null if none is attached.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the value attached for {@code ext}.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value, if any is attached.
     */
    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the value attached for {@code ext}, failing if there is none.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     * @throws IllegalStateException If no value is attached.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value != null) return value;
        throw new IllegalStateException("Ext not present: " + ext + "\n  in: " + this);
    }

    /**
     * Get the value attached for {@code ext}, running {@code pass} on {@code o} first if there is none.
     *
     * @param ext  The ext.
     * @param o    The IR to run the pass on.
     * @param pass The pass that computes the ext.
     * @param <T>  The type of the ext.
     * @param <O>  The type the pass operates on.
     * @return The value.
     */
    default <T, O> T getExtOrRun(Ext<T> ext, O o, IRPass<O, ?> pass) {
        T value = getNullable(ext);
        if (value != null) return value;
        pass.run(o);
        return getExtOrThrow(ext);
    }
}
