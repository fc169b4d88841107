package org.tamodel.arena;

/**
 * A non-owning reference into an {@link Arena}. Handles are plain values bound to
 * the arena that issued them; a copied document carries its handles over with
 * {@link Arena#translate}.
 *
 * @param arenaId The id of the arena the handle was issued by.
 * @param index   The slot within that arena.
 * @param <T>     The element type of the arena.
 */
public record Handle<T>(int arenaId, int index) {

    @Override
    public String toString() {
        return "#" + arenaId + ":" + index;
    }
}
