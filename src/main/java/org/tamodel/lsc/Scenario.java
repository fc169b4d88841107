package org.tamodel.lsc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tamodel.arena.Arena;
import org.tamodel.arena.Handle;
import org.tamodel.symbols.Expression;
import org.tamodel.symbols.Symbol;
import org.tamodel.template.Template;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The live-sequence-chart part of a template: its instance lines and the messages,
 * conditions and updates anchored at them. Derives the simregions that the cut
 * based exploration of a scenario is built from.
 * <p>
 * Events on one instance line are ordered by their location. Events of different
 * kinds at the same location on a shared line happen together and form one
 * simregion.
 */
public final class Scenario {

    private static final Logger LOG = LoggerFactory.getLogger(Scenario.class);

    private final Arena<InstanceLine> instanceLines;
    private final Arena<Message> messages;
    private final Arena<Condition> conditions;
    private final Arena<Update> updates;
    private final EventPrecedence precedence;
    private boolean hasPrechart;

    public Scenario(EventPrecedence precedence) {
        this.instanceLines = new Arena<>("instance lines");
        this.messages = new Arena<>("messages");
        this.conditions = new Arena<>("conditions");
        this.updates = new Arena<>("updates");
        this.precedence = precedence;
    }

    private Scenario(Scenario other) {
        this.instanceLines = other.instanceLines.copy((handle, line) -> line.copy(handle));
        this.messages = other.messages.copy((handle, m) -> new Message(m.number(), m.location(),
                translate(m.source(), other), translate(m.destination(), other), m.label(), m.inPrechart()));
        this.conditions = other.conditions.copy((handle, c) -> new Condition(c.number(), c.location(),
                c.anchors().stream().map(anchor -> translate(anchor, other)).toList(),
                c.label(), c.inPrechart(), c.hot()));
        this.updates = other.updates.copy((handle, u) -> new Update(u.number(), u.location(),
                translate(u.anchor(), other), u.label(), u.inPrechart()));
        this.precedence = other.precedence;
        this.hasPrechart = other.hasPrechart;
    }

    private Handle<InstanceLine> translate(Handle<InstanceLine> line, Scenario source) {
        return instanceLines.translate(line, source.instanceLines);
    }

    /**
     * Copies this scenario. Instance lines and events are copied with their anchors
     * carried over to the copy's arenas; handles of this scenario are refused by the copy.
     *
     * @return The copy.
     */
    public Scenario copy() {
        return new Scenario(this);
    }

    /**
     * Points the instances of copied instance lines at copied templates.
     * @param copies Original templates mapped to their copies.
     */
    public void relink(Map<Template, Template> copies) {
        instanceLines.forEach(line -> line.relink(copies));
    }

    /**
     * Appends an instance line to the chart.
     *
     * @param symbol The symbol of the line.
     * @param chart  The template owning this scenario.
     * @return The new line.
     */
    public InstanceLine addInstanceLine(Symbol symbol, Template chart) {
        InstanceLine line = new InstanceLine(instanceLines.nextHandle(), symbol, chart);
        instanceLines.add(line);
        return line;
    }

    /**
     * Finds the instance line a symbol declares.
     * @param symbol The symbol.
     * @return The handle of the line, or empty if the symbol is not a line of this chart.
     */
    public Optional<Handle<InstanceLine>> resolveLine(Symbol symbol) {
        if (!(symbol.getUserData() instanceof InstanceLine line)) {
            return Optional.empty();
        }
        return instanceLines.handleAt(line.getNumber())
                .filter(handle -> instanceLines.get(handle).getSymbol() == symbol);
    }

    public Message addMessage(Handle<InstanceLine> source, Handle<InstanceLine> destination,
                              int location, boolean prechart, Expression label) {
        checkLine(source);
        checkLine(destination);
        Message message = new Message(messages.size(), location, source, destination, label, prechart);
        messages.add(message);
        hasPrechart |= prechart;
        return message;
    }

    public Condition addCondition(List<Handle<InstanceLine>> anchors, int location, boolean prechart,
                                  boolean hot, Expression label) {
        anchors.forEach(this::checkLine);
        Condition condition = new Condition(conditions.size(), location, anchors, label, prechart, hot);
        conditions.add(condition);
        hasPrechart |= prechart;
        return condition;
    }

    public Update addUpdate(Handle<InstanceLine> anchor, int location, boolean prechart, Expression label) {
        checkLine(anchor);
        Update update = new Update(updates.size(), location, anchor, label, prechart);
        updates.add(update);
        hasPrechart |= prechart;
        return update;
    }

    private void checkLine(Handle<InstanceLine> line) {
        instanceLines.get(line);
    }

    public InstanceLine getInstanceLine(Handle<InstanceLine> handle) {
        return instanceLines.get(handle);
    }

    public List<InstanceLine> getInstanceLines() {
        return instanceLines.asList();
    }

    public List<Message> getMessages() {
        return messages.asList();
    }

    public List<Condition> getConditions() {
        return conditions.asList();
    }

    public List<Update> getUpdates() {
        return updates.asList();
    }

    public boolean hasPrechart() {
        return hasPrechart;
    }

    public void setHasPrechart(boolean hasPrechart) {
        this.hasPrechart = hasPrechart;
    }

    public EventPrecedence getPrecedence() {
        return precedence;
    }

    /**
     * @param line The instance line.
     * @param y    The location.
     * @return The first condition anchored at {@code line} at location {@code y}.
     */
    public Optional<Condition> getCondition(Handle<InstanceLine> line, int y) {
        return conditions.stream()
                .filter(c -> c.location() == y && c.isAnchoredAt(line))
                .findFirst();
    }

    /**
     * @param line The instance line.
     * @param y    The location.
     * @return The first update anchored at {@code line} at location {@code y}.
     */
    public Optional<Update> getUpdate(Handle<InstanceLine> line, int y) {
        return updates.stream()
                .filter(u -> u.location() == y && u.isAnchoredAt(line))
                .findFirst();
    }

    /**
     * Searches the given lines in the chart's instance-line order.
     *
     * @param lines The instance lines.
     * @param y     The location.
     * @return The update found on the first line, in instance-line order, that has one at {@code y}.
     */
    public Optional<Update> getUpdate(List<Handle<InstanceLine>> lines, int y) {
        List<Handle<InstanceLine>> ordered = new ArrayList<>(lines);
        ordered.sort(Comparator.comparingInt(Handle::index));
        for (Handle<InstanceLine> line : ordered) {
            Optional<Update> update = getUpdate(line, y);
            if (update.isPresent()) return update;
        }
        return Optional.empty();
    }

    /**
     * Groups the chart's events into simregions. A message takes the condition and the
     * update found at its location on its source or destination line; a remaining
     * condition takes the first update at its location on one of its anchors; every
     * remaining update stands alone. The result is ordered by location and, for equal
     * locations, by the {@link EventPrecedence} of each simregion's leading event.
     *
     * @return The simregions, numbered in order.
     */
    public List<Simregion> getSimregions() {
        List<Simregion> simregions = new ArrayList<>();
        Set<Integer> usedConditions = new HashSet<>();
        Set<Integer> usedUpdates = new HashSet<>();

        for (Message message : messages) {
            int y = message.location();
            Condition condition = getCondition(message.source(), y)
                    .or(() -> getCondition(message.destination(), y))
                    .orElse(null);
            Update update = getUpdate(message.source(), y)
                    .or(() -> getUpdate(message.destination(), y))
                    .orElse(null);
            if (condition != null) usedConditions.add(condition.number());
            if (update != null) usedUpdates.add(update.number());
            simregions.add(new Simregion(0, message, condition, update));
        }

        for (Condition condition : conditions) {
            if (usedConditions.contains(condition.number())) continue;
            Update update = getUpdate(condition.anchors(), condition.location()).orElse(null);
            if (update != null) usedUpdates.add(update.number());
            simregions.add(new Simregion(0, null, condition, update));
        }

        for (Update update : updates) {
            if (usedUpdates.contains(update.number())) continue;
            simregions.add(new Simregion(0, null, null, update));
        }

        simregions.sort(precedence.simregionOrder());
        List<Simregion> numbered = new ArrayList<>(simregions.size());
        for (int i = 0; i < simregions.size(); i++) {
            numbered.add(simregions.get(i).withNumber(i));
        }
        LOG.debug("Derived {} simregions from {} messages, {} conditions, {} updates",
                numbered.size(), messages.size(), conditions.size(), updates.size());
        return numbered;
    }

    /**
     * Finds the prechart/mainchart limit in an ordered simregion sequence with a single
     * forward scan.
     *
     * @param simregions Simregions ordered as returned by {@link #getSimregions()}.
     * @return The index of the first simregion outside the prechart, or the size of the list.
     */
    public static int prechartBoundary(List<Simregion> simregions) {
        for (int i = 0; i < simregions.size(); i++) {
            if (!simregions.get(i).isInPrechart()) return i;
        }
        return simregions.size();
    }

    /**
     * Finds simregions that are in the prechart although an earlier simregion on one of
     * their instance lines is not. A well-formed chart has none.
     *
     * @return The offending simregions in order.
     */
    public List<Simregion> findPrechartViolations() {
        List<Simregion> simregions = getSimregions();
        Set<Simregion> violations = new LinkedHashSet<>();
        for (InstanceLine line : instanceLines) {
            int mainchartFrom = Integer.MAX_VALUE;
            for (Simregion simregion : line.getSimregions(simregions)) {
                if (!simregion.isInPrechart()) {
                    mainchartFrom = Math.min(mainchartFrom, simregion.getLoc());
                } else if (simregion.getLoc() > mainchartFrom) {
                    violations.add(simregion);
                }
            }
        }
        if (!violations.isEmpty()) {
            LOG.debug("Found {} prechart simregions after the mainchart started", violations.size());
        }
        return new ArrayList<>(violations);
    }
}
