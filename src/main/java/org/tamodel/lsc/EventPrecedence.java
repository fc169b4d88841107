package org.tamodel.lsc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Orders simregions that share a location. Each simregion is ranked by its
 * leading event kind, i.e. the present kind that comes first in this precedence.
 * The default is condition, then message, then update.
 */
public final class EventPrecedence {

    public static final EventPrecedence DEFAULT =
            new EventPrecedence(List.of(EventKind.CONDITION, EventKind.MESSAGE, EventKind.UPDATE));

    private final List<EventKind> order;

    private EventPrecedence(List<EventKind> order) {
        this.order = order;
    }

    /**
     * Creates a precedence from an ordering of all three event kinds.
     *
     * @param kinds The kinds, highest precedence first.
     * @return The precedence.
     * @throws IllegalArgumentException unless every kind appears exactly once.
     */
    public static EventPrecedence of(EventKind... kinds) {
        return of(List.of(kinds));
    }

    public static EventPrecedence of(List<EventKind> kinds) {
        Set<EventKind> seen = EnumSet.noneOf(EventKind.class);
        for (EventKind kind : kinds) {
            if (!seen.add(kind)) {
                throw new IllegalArgumentException("Event kind listed twice: " + kind);
            }
        }
        if (seen.size() != EventKind.values().length) {
            throw new IllegalArgumentException("Event precedence must list every event kind, got " + kinds);
        }
        return new EventPrecedence(List.copyOf(kinds));
    }

    /**
     * Parses kind names as they appear in configuration files, case-insensitively.
     * @param names The names, highest precedence first.
     * @return The precedence.
     */
    public static EventPrecedence parse(List<String> names) {
        List<EventKind> kinds = new ArrayList<>();
        for (String name : names) {
            kinds.add(EventKind.valueOf(name.trim().toUpperCase(Locale.ROOT)));
        }
        return of(kinds);
    }

    /**
     * @param kind The event kind.
     * @return The rank of the kind, 0 being the highest precedence.
     */
    public int rank(EventKind kind) {
        return order.indexOf(kind);
    }

    /**
     * @param simregion The simregion.
     * @return The rank of its leading event kind; empty simregions rank last.
     */
    public int rank(Simregion simregion) {
        for (int i = 0; i < order.size(); i++) {
            if (simregion.has(order.get(i))) return i;
        }
        return order.size();
    }

    /**
     * Orders simregions by location and then by the rank of their leading event.
     * @return The comparator.
     */
    public Comparator<Simregion> simregionOrder() {
        return Comparator.comparingInt(Simregion::getLoc).thenComparingInt(this::rank);
    }

    public List<EventKind> getOrder() {
        return Collections.unmodifiableList(order);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EventPrecedence other && order.equals(other.order);
    }

    @Override
    public int hashCode() {
        return order.hashCode();
    }

    @Override
    public String toString() {
        return order.toString();
    }
}
