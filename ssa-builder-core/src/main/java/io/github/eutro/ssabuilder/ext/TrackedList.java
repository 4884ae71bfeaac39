package io.github.eutro.ssabuilder.ext;

import java.util.*;

/**
 * A list view which is notified of every element entering and leaving it.
 * <p>
 * {@link #onRemoved(Object)} is always called after the element has left the backing list,
 * so implementations can check whether another slot still holds it.
 * Iterators go through {@link #set(int, Object)}, {@link #add(int, Object)} and
 * {@link #remove(int)}, and are notified the same way.
 *
 * @param <E> The element type.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> viewed;

    public TrackedList(List<E> viewed) {
        this.viewed = viewed;
    }

    protected abstract void onAdded(E elt);

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
    public boolean add(E e) {
        onAdded(e);
        modCount++;
        return viewed.add(e);
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
        modCount++;
        viewed.add(index, element);
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        modCount++;
        onRemoved(removed);
        return removed;
    }

    @Override
    public void clear() {
        List<E> old = new ArrayList<>(viewed);
        viewed.clear();
        modCount++;
        for (E e : old) {
            onRemoved(e);
        }
    }

    @Override
    public boolean addAll(int index, Collection<? extends E> c) {
        for (E e : c) {
            onAdded(e);
        }
        modCount++;
        return viewed.addAll(index, c);
    }
}
