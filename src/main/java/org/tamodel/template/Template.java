package org.tamodel.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tamodel.arena.Arena;
import org.tamodel.arena.Handle;
import org.tamodel.diagnostics.Result;
import org.tamodel.diagnostics.TypeError;
import org.tamodel.document.Declarations;
import org.tamodel.lsc.Condition;
import org.tamodel.lsc.EventPrecedence;
import org.tamodel.lsc.InstanceLine;
import org.tamodel.lsc.Message;
import org.tamodel.lsc.Scenario;
import org.tamodel.lsc.Simregion;
import org.tamodel.lsc.Update;
import org.tamodel.position.Position;
import org.tamodel.symbols.Expression;
import org.tamodel.symbols.Frame;
import org.tamodel.symbols.Symbol;
import org.tamodel.symbols.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A template: a parameterised timed automaton or live sequence chart.
 * <p>
 * A template is its own instance with no bound parameters ({@link #getInstance()}).
 * Besides that it owns a declaration block whose frame holds the parameters, the
 * automaton body (locations, branchpoints, edges) and the LSC part ({@link #getScenario()}).
 * Entities of the body are stored in arenas; edges refer to their endpoints by handle.
 * <p>
 * The {@code add*} methods here return failed results without reporting them. A
 * builder goes through the {@link org.tamodel.document.Document} variants, which
 * report failures with a position to the document's diagnostics.
 */
public final class Template {

    private static final Logger LOG = LoggerFactory.getLogger(Template.class);

    private static final String INVARIANT_MODE = "invariant";

    private final Symbol symbol;
    private Instance instance;
    private final Declarations declarations;
    private final Arena<State> states;
    private final Arena<Branchpoint> branchpoints;
    private final Arena<Edge> edges;
    private final Scenario scenario;
    private final List<Expression> dynamicEvals = new ArrayList<>();
    private Frame templateSet = new Frame();
    private Symbol init;
    private final boolean isTA;
    private final String type;
    private final String mode;
    private boolean dynamic;
    private int dynamicIndex = -1;
    private boolean defined = true;

    /**
     * Creates a template.
     *
     * @param symbol     The template symbol.
     * @param parameters The formal parameters.
     * @param global     The frame the template is declared in.
     * @param precedence The tie-break of co-located scenario events.
     * @param isTA       {@code true} for a timed automaton, {@code false} for a chart.
     * @param type       The chart type, e.g. {@code "existential"}; empty for automata.
     * @param mode       The chart mode, e.g. {@code "invariant"}; empty for automata.
     */
    public Template(Symbol symbol, Frame parameters, Frame global, EventPrecedence precedence,
                    boolean isTA, String type, String mode) {
        this.symbol = symbol;
        this.declarations = new Declarations(new Frame(global));
        this.declarations.getFrame().addAll(parameters);
        this.instance = Instance.unbound(symbol, parameters, this);
        this.states = new Arena<>("locations of " + symbol.getName());
        this.branchpoints = new Arena<>("branchpoints of " + symbol.getName());
        this.edges = new Arena<>("edges of " + symbol.getName());
        this.scenario = new Scenario(precedence);
        this.isTA = isTA;
        this.type = type == null ? "" : type;
        this.mode = mode == null ? "" : mode;
    }

    private Template(Template other, Frame global) {
        this.symbol = other.symbol;
        this.declarations = new Declarations(other.declarations, global);
        this.instance = other.instance.copyFor(this);
        this.states = other.states.copy((handle, state) -> new State(state));
        this.branchpoints = other.branchpoints.copy((handle, branchpoint) -> branchpoint);
        this.edges = other.edges.copy((handle, edge) -> new Edge(edge,
                translate(edge.getSource(), other), translate(edge.getDestination(), other)));
        this.scenario = other.scenario.copy();
        this.dynamicEvals.addAll(other.dynamicEvals);
        this.templateSet = new Frame(other.templateSet, null);
        this.init = other.init;
        this.isTA = other.isTA;
        this.type = other.type;
        this.mode = other.mode;
        this.dynamic = other.dynamic;
        this.dynamicIndex = other.dynamicIndex;
        this.defined = other.defined;
    }

    private Endpoint translate(Endpoint endpoint, Template source) {
        if (endpoint instanceof Endpoint.Location location) {
            return new Endpoint.Location(states.translate(location.state(), source.states));
        }
        Endpoint.Branch branch = (Endpoint.Branch) endpoint;
        return new Endpoint.Branch(branchpoints.translate(branch.branchpoint(), source.branchpoints));
    }

    /**
     * Deep-copies this template. Symbols are shared with the original; handles of the
     * copy belong to the copy's own arenas. Instance lines of the copy still refer to
     * the original templates until {@link #relink} is called.
     *
     * @param global The global frame of the copied document.
     * @return The copy.
     */
    public Template copy(Frame global) {
        return new Template(this, global);
    }

    /**
     * Points everything that refers to other templates at their copies.
     * @param copies Original templates mapped to their copies.
     */
    public void relink(Map<Template, Template> copies) {
        scenario.relink(copies);
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public String getName() {
        return symbol.getName();
    }

    /** @return The template as an instance of itself. */
    public Instance getInstance() {
        return instance;
    }

    /** @return A copy of the formal parameters. */
    public Frame getParameters() {
        return instance.getParameters();
    }

    public Declarations getDeclarations() {
        return declarations;
    }

    public Frame getFrame() {
        return declarations.getFrame();
    }

    public Scenario getScenario() {
        return scenario;
    }

    // --- automaton body ---

    /**
     * Adds a location.
     *
     * @param name            The location name.
     * @param invariant       The invariant, may be {@link Expression#EMPTY}.
     * @param exponentialRate The exit rate, may be {@link Expression#EMPTY}.
     * @param position        The declaring position.
     * @return The location, or a duplicate-definition error if the name is taken in this template.
     */
    public Result<State> addLocation(String name, Expression invariant, Expression exponentialRate,
                                     Position position) {
        Optional<Symbol> declared = getFrame().add(name, Type.of(Type.Kind.LOCATION), position, null);
        if (declared.isEmpty()) {
            return Result.error(TypeError.duplicateDefinition(name));
        }
        State state = new State(declared.get(), states.size(), invariant, exponentialRate);
        declared.get().setUserData(state);
        states.add(state);
        return Result.ok(state);
    }

    public Result<Branchpoint> addBranchpoint(String name, Position position) {
        Optional<Symbol> declared = getFrame().add(name, Type.of(Type.Kind.BRANCHPOINT), position, null);
        if (declared.isEmpty()) {
            return Result.error(TypeError.duplicateDefinition(name));
        }
        Branchpoint branchpoint = new Branchpoint(declared.get(), branchpoints.size());
        declared.get().setUserData(branchpoint);
        branchpoints.add(branchpoint);
        return Result.ok(branchpoint);
    }

    /**
     * Adds an edge between two locations or branchpoints of this template.
     *
     * @param source       The source symbol.
     * @param destination  The destination symbol.
     * @param controllable Whether the edge is controllable.
     * @param actionName   The action name, may be empty.
     * @return The edge, or {@link TypeError.Kind#NOT_A_LOCATION} if an endpoint is neither.
     */
    public Result<Edge> addEdge(Symbol source, Symbol destination, boolean controllable, String actionName) {
        Optional<Endpoint> from = resolveEndpoint(source);
        if (from.isEmpty()) {
            return Result.error(TypeError.notALocation(source.getName()));
        }
        Optional<Endpoint> to = resolveEndpoint(destination);
        if (to.isEmpty()) {
            return Result.error(TypeError.notALocation(destination.getName()));
        }
        Edge edge = new Edge(edges.size(), controllable, actionName, from.get(), to.get());
        edges.add(edge);
        return Result.ok(edge);
    }

    private Optional<Endpoint> resolveEndpoint(Symbol symbol) {
        Object entity = symbol.getUserData();
        if (entity instanceof State state) {
            return states.handleAt(state.getNumber())
                    .filter(handle -> states.get(handle).getSymbol() == symbol)
                    .<Endpoint>map(Endpoint.Location::new);
        } else if (entity instanceof Branchpoint branchpoint) {
            return branchpoints.handleAt(branchpoint.number())
                    .filter(handle -> branchpoints.get(handle).symbol() == symbol)
                    .<Endpoint>map(Endpoint.Branch::new);
        }
        return Optional.empty();
    }

    public State getState(Handle<State> handle) {
        return states.get(handle);
    }

    public Branchpoint getBranchpoint(Handle<Branchpoint> handle) {
        return branchpoints.get(handle);
    }

    public List<State> getStates() {
        return states.asList();
    }

    public List<Branchpoint> getBranchpoints() {
        return branchpoints.asList();
    }

    public List<Edge> getEdges() {
        return edges.asList();
    }

    public Optional<Symbol> getInit() {
        return Optional.ofNullable(init);
    }

    public void setInit(Symbol init) {
        this.init = init;
    }

    /** @return The frame of template-set parameters. */
    public Frame getTemplateSet() {
        return templateSet;
    }

    public void setTemplateSet(Frame templateSet) {
        this.templateSet = templateSet == null ? new Frame() : templateSet;
    }

    /**
     * Registers an expression evaluated when a dynamic process is spawned.
     * @param expression The expression.
     * @return Its index.
     */
    public int addDynamicEval(Expression expression) {
        dynamicEvals.add(expression);
        return dynamicEvals.size() - 1;
    }

    public List<Expression> getDynamicEvals() {
        return Collections.unmodifiableList(dynamicEvals);
    }

    public boolean isTA() {
        return isTA;
    }

    public String getType() {
        return type;
    }

    public String getMode() {
        return mode;
    }

    /** @return {@code true} for a chart in invariant mode. */
    public boolean isInvariant() {
        return INVARIANT_MODE.equals(mode);
    }

    // --- dynamic templates ---

    public boolean isDynamic() {
        return dynamic;
    }

    public int getDynamicIndex() {
        return dynamicIndex;
    }

    public boolean isDefined() {
        return defined;
    }

    /**
     * Marks this template as a forward declared dynamic template.
     * @param index The position in the document's dynamic template list.
     */
    public void declareDynamic(int index) {
        this.dynamic = true;
        this.dynamicIndex = index;
        this.defined = false;
    }

    /**
     * Completes a forward declaration, replacing the declared parameters.
     * @param parameters The parameters of the definition.
     */
    public void define(Frame parameters) {
        Frame frame = getFrame();
        for (Symbol old : instance.getParameterSymbols()) {
            frame.remove(old);
        }
        frame.addAll(parameters);
        instance = Instance.unbound(symbol, parameters, this);
        defined = true;
        LOG.debug("Defined dynamic template {} with {} parameters", getName(), parameters.size());
    }

    // --- live sequence chart ---

    /**
     * Adds an instance line to the chart.
     *
     * @param name     The line name.
     * @param position The declaring position.
     * @return The line, or a duplicate-definition error if the name is taken in this template.
     */
    public Result<InstanceLine> addInstanceLine(String name, Position position) {
        Optional<Symbol> declared = getFrame().add(name, Type.of(Type.Kind.INSTANCE_LINE), position, null);
        if (declared.isEmpty()) {
            return Result.error(TypeError.duplicateDefinition(name));
        }
        InstanceLine line = scenario.addInstanceLine(declared.get(), this);
        declared.get().setUserData(line);
        return Result.ok(line);
    }

    public Result<Message> addMessage(Symbol source, Symbol destination, int location, boolean prechart) {
        return addMessage(source, destination, location, prechart, Expression.EMPTY);
    }

    /**
     * Adds a message between two instance lines of this chart.
     *
     * @param source      The sending line.
     * @param destination The receiving line.
     * @param location    The vertical position on the chart.
     * @param prechart    Whether the message is part of the prechart.
     * @param label       The synchronisation label.
     * @return The message, or {@link TypeError.Kind#NOT_AN_INSTANCE_LINE}.
     */
    public Result<Message> addMessage(Symbol source, Symbol destination, int location, boolean prechart,
                                      Expression label) {
        Optional<Handle<InstanceLine>> from = scenario.resolveLine(source);
        if (from.isEmpty()) return Result.error(TypeError.notAnInstanceLine(source.getName()));
        Optional<Handle<InstanceLine>> to = scenario.resolveLine(destination);
        if (to.isEmpty()) return Result.error(TypeError.notAnInstanceLine(destination.getName()));
        return Result.ok(scenario.addMessage(from.get(), to.get(), location, prechart, label));
    }

    public Result<Condition> addCondition(List<Symbol> anchors, int location, boolean prechart, boolean hot) {
        return addCondition(anchors, location, prechart, hot, Expression.EMPTY);
    }

    /**
     * Adds a condition spanning one or more instance lines.
     *
     * @param anchors  The lines the condition spans.
     * @param location The vertical position on the chart.
     * @param prechart Whether the condition is part of the prechart.
     * @param hot      Whether a violation is an error rather than an exit.
     * @param label    The predicate.
     * @return The condition, or {@link TypeError.Kind#NOT_AN_INSTANCE_LINE}.
     */
    public Result<Condition> addCondition(List<Symbol> anchors, int location, boolean prechart, boolean hot,
                                          Expression label) {
        List<Handle<InstanceLine>> lines = new ArrayList<>(anchors.size());
        for (Symbol anchor : anchors) {
            Optional<Handle<InstanceLine>> line = scenario.resolveLine(anchor);
            if (line.isEmpty()) return Result.error(TypeError.notAnInstanceLine(anchor.getName()));
            lines.add(line.get());
        }
        return Result.ok(scenario.addCondition(lines, location, prechart, hot, label));
    }

    public Result<Update> addUpdate(Symbol anchor, int location, boolean prechart) {
        return addUpdate(anchor, location, prechart, Expression.EMPTY);
    }

    public Result<Update> addUpdate(Symbol anchor, int location, boolean prechart, Expression label) {
        Optional<Handle<InstanceLine>> line = scenario.resolveLine(anchor);
        if (line.isEmpty()) return Result.error(TypeError.notAnInstanceLine(anchor.getName()));
        return Result.ok(scenario.addUpdate(line.get(), location, prechart, label));
    }

    public List<InstanceLine> getInstanceLines() {
        return scenario.getInstanceLines();
    }

    public List<Simregion> getSimregions() {
        return scenario.getSimregions();
    }

    public boolean hasPrechart() {
        return scenario.hasPrechart();
    }

    @Override
    public String toString() {
        return getName() + "(" + instance.writeParameters() + ")";
    }
}
