package org.tamodel.lsc;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A set of simregions forming one antichain of the scenario's partial order, i.e.
 * one consistent snapshot of progress across all instance lines.
 * <p>
 * Membership and equality use simregion value equality; insertion order is kept
 * for printing only.
 */
public final class Cut {

    private final int number;
    private final Set<Simregion> simregions = new LinkedHashSet<>();

    public Cut(int number) {
        this.number = number;
    }

    /**
     * Creates a copy of another cut with a new number.
     * @param number The number of the copy.
     * @param other The cut to copy.
     */
    public Cut(int number, Cut other) {
        this.number = number;
        this.simregions.addAll(other.simregions);
    }

    public int getNumber() {
        return number;
    }

    public void add(Simregion simregion) {
        simregions.add(simregion);
    }

    /**
     * Removes a simregion equal to the given one.
     * @param simregion The simregion to remove.
     * @return {@code true} if the cut contained it.
     */
    public boolean erase(Simregion simregion) {
        return simregions.remove(simregion);
    }

    public boolean contains(Simregion simregion) {
        return simregions.contains(simregion);
    }

    public Set<Simregion> getSimregions() {
        return Collections.unmodifiableSet(simregions);
    }

    public int size() {
        return simregions.size();
    }

    public boolean isEmpty() {
        return simregions.isEmpty();
    }

    /**
     * Tells whether this cut still lies in the prechart, given one of the simregions
     * that follow it. Once a following simregion is outside the prechart, every later
     * simregion is too, so the cut is then on or past the prechart/mainchart limit even
     * if all its own simregions are prechart simregions.
     *
     * @param following A simregion that follows this cut.
     * @return {@code true} if the cut and {@code following} are in the prechart.
     */
    public boolean isInPrechart(Simregion following) {
        return following.isInPrechart() && isInPrechart();
    }

    /**
     * @return {@code true} if every simregion of this cut is in the prechart.
     */
    public boolean isInPrechart() {
        return simregions.stream().allMatch(Simregion::isInPrechart);
    }

    /**
     * Two cuts are equal when they hold equal simregions, regardless of insertion
     * order and of their numbers.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cut)) return false;
        return simregions.equals(((Cut) o).simregions);
    }

    @Override
    public int hashCode() {
        return simregions.hashCode();
    }

    @Override
    public String toString() {
        return simregions.stream().map(Simregion::toString).collect(Collectors.joining(" ", "CUT(", ")"));
    }
}
