package org.tamodel.lsc;

import org.tamodel.arena.Handle;
import org.tamodel.symbols.Expression;

import java.util.List;

/**
 * An event of a live sequence chart, anchored at one or more instance lines.
 * <p>
 * {@link #location()} is the event's vertical position in the chart; events on the
 * same instance line are ordered by it. An event with a negative {@link #number()}
 * is the "absent" placeholder used in simregion slots.
 */
public sealed interface ScenarioEvent permits Message, Condition, Update {

    /** Number used by absent events. */
    int ABSENT = -1;

    /** @return The placement of the event in the input. */
    int number();

    int location();

    Expression label();

    boolean inPrechart();

    EventKind kind();

    /** @return The instance lines the event is anchored at. */
    List<Handle<InstanceLine>> anchors();

    default boolean isPresent() {
        return number() != ABSENT;
    }

    default boolean isAnchoredAt(Handle<InstanceLine> line) {
        return anchors().contains(line);
    }
}
