package org.tamodel.lsc;

import org.tamodel.arena.Handle;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A group of at most one message, one condition and one update that happen at the
 * same step of a scenario. All three slots are always filled; a missing event is
 * represented by the kind's {@code absent()} placeholder.
 * <p>
 * Equality compares the three events by value and ignores {@link #getNumber()},
 * so simregions derived twice from the same chart are interchangeable.
 */
public final class Simregion {

    /** Location of a simregion without any event. */
    public static final int NO_LOCATION = -1;

    private final int number;
    private final Message message;
    private final Condition condition;
    private final Update update;

    public Simregion(int number, Message message, Condition condition, Update update) {
        this.number = number;
        this.message = message == null ? Message.absent() : message;
        this.condition = condition == null ? Condition.absent() : condition;
        this.update = update == null ? Update.absent() : update;
    }

    public static Simregion of(Message message) {
        return new Simregion(0, message, null, null);
    }

    public static Simregion of(Condition condition) {
        return new Simregion(0, null, condition, null);
    }

    public static Simregion of(Update update) {
        return new Simregion(0, null, null, update);
    }

    /**
     * @param number The new number.
     * @return A copy of this simregion carrying another number.
     */
    public Simregion withNumber(int number) {
        return new Simregion(number, message, condition, update);
    }

    public int getNumber() {
        return number;
    }

    public Message getMessage() {
        return message;
    }

    public Condition getCondition() {
        return condition;
    }

    public Update getUpdate() {
        return update;
    }

    public boolean has(EventKind kind) {
        return switch (kind) {
            case MESSAGE -> message.isPresent();
            case CONDITION -> condition.isPresent();
            case UPDATE -> update.isPresent();
        };
    }

    public boolean isEmpty() {
        return presentEvents().findAny().isEmpty();
    }

    /**
     * @return The present events of this simregion.
     */
    public Stream<ScenarioEvent> presentEvents() {
        return Stream.<ScenarioEvent>of(message, condition, update).filter(ScenarioEvent::isPresent);
    }

    /**
     * The location of this simregion in the partial order: the largest location of
     * its present events, or {@link #NO_LOCATION} if it holds none.
     *
     * @return The location.
     */
    public int getLoc() {
        return presentEvents().mapToInt(ScenarioEvent::location).max().orElse(NO_LOCATION);
    }

    /**
     * A simregion is in the prechart when it holds at least one event and all of its
     * events are prechart events.
     *
     * @return {@code true} if the simregion lies entirely in the prechart.
     */
    public boolean isInPrechart() {
        List<ScenarioEvent> events = presentEvents().toList();
        return !events.isEmpty() && events.stream().allMatch(ScenarioEvent::inPrechart);
    }

    /**
     * @return The instance lines touched by any event of this simregion, without duplicates.
     */
    public List<Handle<InstanceLine>> getInstanceLines() {
        Set<Handle<InstanceLine>> lines = new LinkedHashSet<>();
        presentEvents().forEach(event -> lines.addAll(event.anchors()));
        return new ArrayList<>(lines);
    }

    public boolean touches(Handle<InstanceLine> line) {
        return presentEvents().anyMatch(event -> event.isAnchoredAt(line));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Simregion)) return false;
        Simregion that = (Simregion) o;
        return message.equals(that.message)
                && condition.equals(that.condition)
                && update.equals(that.update);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, condition, update);
    }

    @Override
    public String toString() {
        return "s" + number + "(" + message + " " + condition + " " + update + ")";
    }
}
