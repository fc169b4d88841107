package org.tamodel.template;

import org.tamodel.symbols.Expression;
import org.tamodel.symbols.Frame;

import java.util.ArrayList;
import java.util.List;

/**
 * An edge of a timed automaton. The builder creates the edge with its endpoints and
 * fills in the labels afterwards.
 */
public final class Edge {

    private final int number;
    private final boolean controllable;
    private final String actionName;
    private final Endpoint source;
    private final Endpoint destination;
    private Frame select = new Frame();
    private Expression guard = Expression.EMPTY;
    private Expression assignment = Expression.EMPTY;
    private Expression sync = Expression.EMPTY;
    private Expression probability = Expression.EMPTY;
    private final List<Integer> selectValues = new ArrayList<>();

    public Edge(int number, boolean controllable, String actionName, Endpoint source, Endpoint destination) {
        this.number = number;
        this.controllable = controllable;
        this.actionName = actionName == null ? "" : actionName;
        this.source = source;
        this.destination = destination;
    }

    Edge(Edge other, Endpoint source, Endpoint destination) {
        this(other.number, other.controllable, other.actionName, source, destination);
        this.select = other.select;
        this.guard = other.guard;
        this.assignment = other.assignment;
        this.sync = other.sync;
        this.probability = other.probability;
        this.selectValues.addAll(other.selectValues);
    }

    /** @return The placement of the edge in the input. */
    public int getNumber() {
        return number;
    }

    public boolean isControllable() {
        return controllable;
    }

    public String getActionName() {
        return actionName;
    }

    public Endpoint getSource() {
        return source;
    }

    public Endpoint getDestination() {
        return destination;
    }

    public Frame getSelect() {
        return select;
    }

    public void setSelect(Frame select) {
        this.select = select;
    }

    public Expression getGuard() {
        return guard;
    }

    public void setGuard(Expression guard) {
        this.guard = guard;
    }

    public Expression getAssignment() {
        return assignment;
    }

    public void setAssignment(Expression assignment) {
        this.assignment = assignment;
    }

    public Expression getSync() {
        return sync;
    }

    public void setSync(Expression sync) {
        this.sync = sync;
    }

    public Expression getProbability() {
        return probability;
    }

    public void setProbability(Expression probability) {
        this.probability = probability;
    }

    /** @return The select values, filled in when the select frame is expanded. */
    public List<Integer> getSelectValues() {
        return selectValues;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("e").append(number).append(": ")
                .append(source).append(" -> ").append(destination);
        if (!select.isEmpty()) sb.append(" select ").append(select);
        if (!guard.isEmpty()) sb.append(" guard ").append(guard);
        if (!sync.isEmpty()) sb.append(" sync ").append(sync);
        if (!assignment.isEmpty()) sb.append(" assign ").append(assignment);
        if (!probability.isEmpty()) sb.append(" prob ").append(probability);
        return sb.toString();
    }
}
