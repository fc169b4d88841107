package org.tamodel.lsc;

import org.tamodel.arena.Handle;
import org.tamodel.symbols.Expression;

import java.util.List;

/**
 * A message sent from a source to a destination instance line.
 *
 * @param number      The placement of the message in the input.
 * @param location    The vertical position of the message.
 * @param source      The sending instance line.
 * @param destination The receiving instance line.
 * @param label       The label, usually a channel synchronisation.
 * @param inPrechart  Whether the message belongs to the prechart.
 */
public record Message(
        int number,
        int location,
        Handle<InstanceLine> source,
        Handle<InstanceLine> destination,
        Expression label,
        boolean inPrechart
) implements ScenarioEvent {

    private static final Message ABSENT_MESSAGE =
            new Message(ABSENT, ABSENT, null, null, Expression.EMPTY, false);

    public Message {
        if (label == null) label = Expression.EMPTY;
    }

    public static Message absent() {
        return ABSENT_MESSAGE;
    }

    @Override
    public EventKind kind() {
        return EventKind.MESSAGE;
    }

    @Override
    public List<Handle<InstanceLine>> anchors() {
        if (!isPresent()) return List.of();
        return List.of(source, destination);
    }

    @Override
    public String toString() {
        return isPresent() ? "m" + number + "(" + label + ")" : "m-";
    }
}
