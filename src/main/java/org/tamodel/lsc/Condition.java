package org.tamodel.lsc;

import org.tamodel.arena.Handle;
import org.tamodel.symbols.Expression;

import java.util.List;

/**
 * A condition spanning one or more instance lines. Hot conditions must hold when
 * reached; cold conditions only exit the chart when violated.
 *
 * @param number     The placement of the condition in the input.
 * @param location   The vertical position of the condition.
 * @param anchors    The instance lines the condition spans.
 * @param label      The predicate.
 * @param inPrechart Whether the condition belongs to the prechart.
 * @param hot        Whether the condition is hot.
 */
public record Condition(
        int number,
        int location,
        List<Handle<InstanceLine>> anchors,
        Expression label,
        boolean inPrechart,
        boolean hot
) implements ScenarioEvent {

    private static final Condition ABSENT_CONDITION =
            new Condition(ABSENT, ABSENT, List.of(), Expression.EMPTY, false, false);

    public Condition {
        anchors = anchors == null ? List.of() : List.copyOf(anchors);
        if (label == null) label = Expression.EMPTY;
    }

    public static Condition absent() {
        return ABSENT_CONDITION;
    }

    @Override
    public EventKind kind() {
        return EventKind.CONDITION;
    }

    @Override
    public String toString() {
        return isPresent() ? "c" + number + "(" + label + ")" : "c-";
    }
}
