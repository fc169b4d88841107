package org.tamodel.lsc;

import org.tamodel.arena.Handle;
import org.tamodel.symbols.Expression;

import java.util.List;

/**
 * An assignment executed on one instance line.
 *
 * @param number     The placement of the update in the input.
 * @param location   The vertical position of the update.
 * @param anchor     The instance line executing the update.
 * @param label      The assignment.
 * @param inPrechart Whether the update belongs to the prechart.
 */
public record Update(
        int number,
        int location,
        Handle<InstanceLine> anchor,
        Expression label,
        boolean inPrechart
) implements ScenarioEvent {

    private static final Update ABSENT_UPDATE = new Update(ABSENT, ABSENT, null, Expression.EMPTY, false);

    public Update {
        if (label == null) label = Expression.EMPTY;
    }

    public static Update absent() {
        return ABSENT_UPDATE;
    }

    @Override
    public EventKind kind() {
        return EventKind.UPDATE;
    }

    @Override
    public List<Handle<InstanceLine>> anchors() {
        return isPresent() ? List.of(anchor) : List.of();
    }

    @Override
    public String toString() {
        return isPresent() ? "u" + number + "(" + label + ")" : "u-";
    }
}
