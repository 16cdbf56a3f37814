package io.github.eutro.cfgopt.ext;

import java.util.*;

/**
 * A list view that reports every element entering or leaving it, used to keep
 * ownership exts such as {@link CommonExts#OWNING_BLOCK} up to date.
 *
 * @param <E> The element type.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> viewed;

    /**
     * Construct a tracked list over a backing list. Elements already in it are not reported.
     *
     * @param viewed The backing list.
     */
    public TrackedList(List<E> viewed) {
        this.viewed = viewed;
    }

    /**
     * Called before an element is added.
     *
     * @param elt The element.
     */
    protected abstract void onAdded(E elt);

    /**
     * Called after an element is removed.
     *
     * @param elt The element.
     */
    protected abstract void onRemoved(E elt);

    @Override
    public E get(int index) {
        return viewed.get(index);
    }

    @Override
    public int size() {
        return viewed.size();
    }

    @Override
    public E set(int index, E element) {
        onAdded(element);
        E removed = viewed.set(index, element);
        onRemoved(removed);
        return removed;
    }

    @Override
    public void add(int index, E element) {
        onAdded(element);
        viewed.add(index, element);
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        onRemoved(removed);
        return removed;
    }

    @Override
    public void clear() {
        List<E> old = new ArrayList<>(viewed);
        viewed.clear();
        for (E e : old) {
            onRemoved(e);
        }
    }
}
