package org.tamodel.arena;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.stream.Stream;

/**
 * Append-only storage that hands out {@link Handle}s instead of raw references.
 * Elements are never removed or moved, so a handle stays valid for the lifetime of
 * the arena. Dereferencing checks that the handle was issued by this arena; a copy
 * gets a fresh id, so handles have to be carried over with {@link #translate}.
 * <p>
 * Not thread-safe.
 *
 * @param <T> The element type.
 */
public final class Arena<T> implements Iterable<T> {

    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private final int id;
    private final String name;
    private final List<T> items;

    /**
     * Creates an empty arena with a fresh id.
     * @param name A name used in error messages, e.g. {@code "states"}.
     */
    public Arena(String name) {
        this(NEXT_ID.incrementAndGet(), name, new ArrayList<>());
    }

    private Arena(int id, String name, List<T> items) {
        this.id = id;
        this.name = name;
        this.items = items;
    }

    /**
     * Creates a copy of this arena with a fresh id. Handles issued by this arena are
     * refused by the copy.
     *
     * @param copier Creates the copy of an element, given the handle it gets in the copy.
     * @return The copy.
     */
    public Arena<T> copy(BiFunction<Handle<T>, T, T> copier) {
        Arena<T> copy = new Arena<>(NEXT_ID.incrementAndGet(), name, new ArrayList<>(items.size()));
        for (T item : items) {
            Handle<T> handle = copy.nextHandle();
            copy.items.add(copier.apply(handle, item));
        }
        return copy;
    }

    /**
     * Carries a handle of the arena this one was copied from over to this arena.
     *
     * @param handle A handle issued by {@code source}.
     * @param source The arena this one is a copy of.
     * @return The handle of the same slot in this arena.
     * @throws IllegalArgumentException if {@code source} did not issue the handle.
     */
    public Handle<T> translate(Handle<T> handle, Arena<T> source) {
        if (!source.owns(handle)) {
            throw new IllegalArgumentException("Handle " + handle + " was not issued by arena '" + source.name
                    + "' #" + source.id);
        }
        return new Handle<>(id, handle.index());
    }

    /**
     * @param index A slot index.
     * @return The handle of that slot, or empty if the slot is not filled.
     */
    public Optional<Handle<T>> handleAt(int index) {
        Handle<T> handle = new Handle<>(id, index);
        return owns(handle) ? Optional.of(handle) : Optional.empty();
    }

    /**
     * The handle the next {@link #add} will return.
     * @return The handle.
     */
    public Handle<T> nextHandle() {
        return new Handle<>(id, items.size());
    }

    /**
     * Appends an element.
     * @param item The element.
     * @return The handle of the new slot.
     */
    public Handle<T> add(T item) {
        Handle<T> handle = nextHandle();
        items.add(item);
        return handle;
    }

    /**
     * Resolves a handle.
     *
     * @param handle The handle.
     * @return The element.
     * @throws IllegalArgumentException if the handle belongs to another arena or points past the end.
     */
    public T get(Handle<T> handle) {
        if (!owns(handle)) {
            throw new IllegalArgumentException("Stale or foreign handle " + handle + " for arena '" + name + "' #" + id);
        }
        return items.get(handle.index());
    }

    public T get(int index) {
        return items.get(index);
    }

    /**
     * @param handle The handle to check.
     * @return {@code true} if the handle can be resolved against this arena.
     */
    public boolean owns(Handle<?> handle) {
        return handle != null && handle.arenaId() == id && handle.index() >= 0 && handle.index() < items.size();
    }

    /**
     * Finds the handle of an element by identity.
     * @param item The element.
     * @return The handle, or null if the element is not stored here.
     */
    public Handle<T> handleOf(T item) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) == item) return new Handle<>(id, i);
        }
        return null;
    }

    public int id() {
        return id;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public List<T> asList() {
        return Collections.unmodifiableList(items);
    }

    public Stream<T> stream() {
        return items.stream();
    }

    @Override
    public Iterator<T> iterator() {
        return asList().iterator();
    }
}
