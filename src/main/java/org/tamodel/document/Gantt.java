package org.tamodel.document;

import org.tamodel.symbols.Expression;
import org.tamodel.symbols.Frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A gantt chart row. Each mapping colours the row with an integer expression while
 * its predicate holds; rows and mappings may be expanded over select parameters.
 */
public final class Gantt {

    /**
     * One predicate/colour pair of a gantt row.
     *
     * @param parameters The select parameters of the mapping.
     * @param predicate  The boolean predicate.
     * @param mapping    The integer expression shown while the predicate holds.
     */
    public record Mapping(Frame parameters, Expression predicate, Expression mapping) {}

    private final String name;
    private final Frame parameters;
    private final List<Mapping> mappings = new ArrayList<>();

    public Gantt(String name, Frame parameters) {
        this.name = name;
        this.parameters = parameters == null ? new Frame() : parameters;
    }

    Gantt(Gantt other) {
        this(other.name, other.parameters);
        mappings.addAll(other.mappings);
    }

    public String getName() {
        return name;
    }

    public Frame getParameters() {
        return parameters;
    }

    public void addMapping(Frame parameters, Expression predicate, Expression mapping) {
        mappings.add(new Mapping(parameters == null ? new Frame() : parameters, predicate, mapping));
    }

    public List<Mapping> getMappings() {
        return Collections.unmodifiableList(mappings);
    }
}
