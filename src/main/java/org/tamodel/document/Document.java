package org.tamodel.document;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tamodel.config.ModelSettings;
import org.tamodel.diagnostics.Diagnostic;
import org.tamodel.diagnostics.DiagnosticsEngine;
import org.tamodel.diagnostics.Result;
import org.tamodel.diagnostics.TypeError;
import org.tamodel.document.query.Query;
import org.tamodel.document.query.QueryOption;
import org.tamodel.lsc.Condition;
import org.tamodel.lsc.InstanceLine;
import org.tamodel.lsc.Message;
import org.tamodel.lsc.Update;
import org.tamodel.position.Position;
import org.tamodel.position.PositionTable;
import org.tamodel.position.SourceLine;
import org.tamodel.symbols.Expression;
import org.tamodel.symbols.Frame;
import org.tamodel.symbols.Symbol;
import org.tamodel.symbols.Type;
import org.tamodel.template.Branchpoint;
import org.tamodel.template.Edge;
import org.tamodel.template.Instance;
import org.tamodel.template.Instantiator;
import org.tamodel.template.State;
import org.tamodel.template.Template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The root of a parsed model: global declarations, templates, instances, the system
 * line (processes and priorities), queries and the source position table.
 * <p>
 * A builder fills the document in source order through the {@code add*} methods.
 * Failed additions are reported to the {@link DiagnosticsEngine} and returned as a
 * failed {@link Result}; they leave the document unchanged. Later passes walk the
 * finished document with {@link #accept(SystemVisitor)}.
 * <p>
 * Not thread-safe.
 */
public final class Document {

    private static final Logger LOG = LoggerFactory.getLogger(Document.class);

    private final ModelSettings settings;
    private final DiagnosticsEngine diagnostics;
    private final Declarations globals;
    private final List<Template> templates = new ArrayList<>();
    private final List<Template> dynamicTemplates = new ArrayList<>();
    private final List<Instance> instances = new ArrayList<>();
    private final List<Instance> lscInstances = new ArrayList<>();
    private final List<Instance> processes = new ArrayList<>();
    private final Map<Symbol, Instance> instancesBySymbol = new HashMap<>();

    private final List<ChanPriority> chanPriorities = new ArrayList<>();
    private final Map<String, Integer> procPriorities = new HashMap<>();
    private boolean hasPriorities;

    private boolean hasStrictInvariants;
    private boolean hasStopWatch;
    private boolean hasStrictLowerBoundOnControllableEdges;
    private boolean hasClockGuardRecvBroadcast;
    private boolean hasUrgentTransition;
    private int syncUsed;

    private final List<Query> queries = new ArrayList<>();
    private final List<QueryOption> options = new ArrayList<>();
    private Expression beforeUpdate = Expression.EMPTY;
    private Expression afterUpdate = Expression.EMPTY;
    private String obsTA = "";
    private final List<String> strings = new ArrayList<>();
    private boolean modified;
    private SupportedMethods supportedMethods = SupportedMethods.ALL;

    private final PositionTable positions;

    /** Creates a document with the settings of {@code reference.conf}. */
    public Document() {
        this(ModelSettings.defaults());
    }

    public Document(ModelSettings settings) {
        this(settings, new DiagnosticsEngine(settings.logReports(), settings.locale()));
    }

    /**
     * Creates a document reporting to the given engine.
     * @param settings The model settings.
     * @param diagnostics The sink for errors and warnings.
     */
    public Document(ModelSettings settings, DiagnosticsEngine diagnostics) {
        this.settings = settings;
        this.diagnostics = diagnostics;
        this.globals = new Declarations(new Frame());
        this.positions = new PositionTable();
    }

    /**
     * Deep-copies a document. Templates, instances, declarations and lists are new
     * objects; symbols are shared, so entities are looked up through the copy's own
     * tables rather than through symbol user data. The copy gets its own diagnostics
     * engine holding the diagnostics collected so far.
     *
     * @param other The document to copy.
     */
    public Document(Document other) {
        this.settings = other.settings;
        this.diagnostics = new DiagnosticsEngine(other.diagnostics);
        this.globals = new Declarations(other.globals, null);
        this.positions = new PositionTable(other.positions);

        Map<Template, Template> templateCopies = new IdentityHashMap<>();
        Map<Instance, Instance> instanceCopies = new IdentityHashMap<>();
        for (Template template : other.templates) {
            Template copy = template.copy(globals.getFrame());
            templateCopies.put(template, copy);
            instanceCopies.put(template.getInstance(), copy.getInstance());
            templates.add(copy);
        }
        for (Template template : other.dynamicTemplates) {
            Template copy = template.copy(globals.getFrame());
            templateCopies.put(template, copy);
            instanceCopies.put(template.getInstance(), copy.getInstance());
            dynamicTemplates.add(copy);
        }
        templateCopies.values().forEach(copy -> copy.relink(templateCopies));

        for (Instance instance : other.instances) {
            instances.add(copyInstance(instance, templateCopies, instanceCopies));
        }
        for (Instance instance : other.lscInstances) {
            lscInstances.add(copyInstance(instance, templateCopies, instanceCopies));
        }
        for (Instance process : other.processes) {
            processes.add(copyInstance(process, templateCopies, instanceCopies));
        }
        instances.forEach(i -> instancesBySymbol.put(i.getSymbol(), i));
        lscInstances.forEach(i -> instancesBySymbol.put(i.getSymbol(), i));

        other.chanPriorities.forEach(p -> chanPriorities.add(new ChanPriority(p)));
        this.procPriorities.putAll(other.procPriorities);
        this.hasPriorities = other.hasPriorities;
        this.hasStrictInvariants = other.hasStrictInvariants;
        this.hasStopWatch = other.hasStopWatch;
        this.hasStrictLowerBoundOnControllableEdges = other.hasStrictLowerBoundOnControllableEdges;
        this.hasClockGuardRecvBroadcast = other.hasClockGuardRecvBroadcast;
        this.hasUrgentTransition = other.hasUrgentTransition;
        this.syncUsed = other.syncUsed;
        this.queries.addAll(other.queries);
        this.options.addAll(other.options);
        this.beforeUpdate = other.beforeUpdate;
        this.afterUpdate = other.afterUpdate;
        this.obsTA = other.obsTA;
        this.strings.addAll(other.strings);
        this.modified = other.modified;
        this.supportedMethods = other.supportedMethods;
        LOG.debug("Copied document with {} templates and {} processes", templates.size(), processes.size());
    }

    private static Instance copyInstance(Instance instance, Map<Template, Template> templateCopies,
                                         Map<Instance, Instance> instanceCopies) {
        return instanceCopies.computeIfAbsent(instance, original -> original.copyFor(
                templateCopies.getOrDefault(original.getTemplate(), original.getTemplate())));
    }

    private <T> Result<T> fail(Position position, TypeError error) {
        diagnostics.report(position, error);
        return Result.error(error);
    }

    private <T> Result<T> reported(Position position, Result<T> result) {
        result.error().ifPresent(error -> diagnostics.report(position, error));
        return result;
    }

    public ModelSettings getSettings() {
        return settings;
    }

    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    public Declarations getGlobals() {
        return globals;
    }

    // --- declarations ---

    /**
     * Declares a variable.
     *
     * @param declarations The block to declare it in.
     * @param type         The type.
     * @param name         The name.
     * @param initializer  The initialiser, may be {@link Expression#EMPTY}.
     * @param position     The declaring position.
     * @return The variable, or a reported duplicate-definition error.
     */
    public Result<Variable> addVariable(Declarations declarations, Type type, String name,
                                        Expression initializer, Position position) {
        return reported(position, declarations.addVariable(type, name, initializer, position));
    }

    /**
     * Declares a local variable of a function.
     *
     * @param function    The function.
     * @param frame       The frame of the enclosing block, usually {@link Function#getFrame()}.
     * @param type        The type.
     * @param name        The name.
     * @param initializer The initialiser.
     * @param position    The declaring position.
     * @return The variable, or a reported duplicate-definition error.
     */
    public Result<Variable> addVariableToFunction(Function function, Frame frame, Type type, String name,
                                                  Expression initializer, Position position) {
        Optional<Symbol> symbol = frame.add(name, type, position, null);
        if (symbol.isEmpty()) {
            return fail(position, TypeError.duplicateDefinition(name));
        }
        Variable variable = new Variable(symbol.get(), initializer);
        symbol.get().setUserData(variable);
        function.addVariable(variable);
        return Result.ok(variable);
    }

    public Result<Function> addFunction(Declarations declarations, Type type, String name, Position position) {
        return reported(position, declarations.addFunction(type, name, position));
    }

    /**
     * Declares a named type.
     *
     * @param declarations The block to declare it in.
     * @param type         The defined type.
     * @param name         The new type name.
     * @param position     The declaring position.
     * @return The type symbol, or a reported duplicate-definition error.
     */
    public Result<Symbol> addTypeDef(Declarations declarations, Type type, String name, Position position) {
        Optional<Symbol> symbol = declarations.getFrame()
                .add(name, new Type(Type.Kind.TYPEDEF, type.toString()), position, type);
        return symbol.map(Result::ok).orElseGet(() -> fail(position, TypeError.duplicateDefinition(name)));
    }

    public void addProgressMeasure(Declarations declarations, Expression guard, Expression measure) {
        declarations.addProgressMeasure(guard, measure);
    }

    /** @return A new global I/O declaration for the builder to fill in. */
    public IoDecl addIODecl() {
        return globals.addIoDecl();
    }

    public void addGantt(Declarations declarations, Gantt gantt) {
        declarations.addGantt(gantt);
    }

    // --- templates ---

    public Result<Template> addTemplate(String name, Frame parameters, Position position) {
        return addTemplate(name, parameters, position, true, "", "");
    }

    /**
     * Declares a template.
     *
     * @param name       The template name.
     * @param parameters The formal parameters.
     * @param position   The declaring position.
     * @param isTA       {@code true} for a timed automaton, {@code false} for a chart.
     * @param type       The chart type; empty for automata.
     * @param mode       The chart mode; empty for automata.
     * @return The template, or a reported duplicate-definition error.
     */
    public Result<Template> addTemplate(String name, Frame parameters, Position position,
                                        boolean isTA, String type, String mode) {
        Optional<Symbol> symbol = globals.getFrame().add(name, Type.of(Type.Kind.PROCESS), position, null);
        if (symbol.isEmpty()) {
            return fail(position, TypeError.duplicateDefinition(name));
        }
        Template template = new Template(symbol.get(), parameters, globals.getFrame(),
                settings.eventPrecedence(), isTA, type, mode);
        symbol.get().setUserData(template);
        templates.add(template);
        LOG.debug("Added template {} with {} parameters", name, parameters.size());
        return Result.ok(template);
    }

    /**
     * Declares or defines a dynamic template. The first call for a name is a forward
     * declaration; the second completes it with the parameters of the definition.
     *
     * @param name       The template name.
     * @param parameters The formal parameters.
     * @param position   The declaring position.
     * @return The template, or a reported duplicate-definition error for a second
     *         definition or a name taken by another global.
     */
    public Result<Template> addDynamicTemplate(String name, Frame parameters, Position position) {
        Optional<Template> declared = getDynamicTemplate(name);
        if (declared.isPresent()) {
            Template template = declared.get();
            if (template.isDefined()) {
                return fail(position, TypeError.duplicateDefinition(name));
            }
            template.define(parameters);
            return Result.ok(template);
        }
        Optional<Symbol> symbol = globals.getFrame().add(name, Type.of(Type.Kind.PROCESS), position, null);
        if (symbol.isEmpty()) {
            return fail(position, TypeError.duplicateDefinition(name));
        }
        Template template = new Template(symbol.get(), parameters, globals.getFrame(),
                settings.eventPrecedence(), true, "", "");
        template.declareDynamic(dynamicTemplates.size());
        symbol.get().setUserData(template);
        dynamicTemplates.add(template);
        LOG.debug("Declared dynamic template {}", name);
        return Result.ok(template);
    }

    public Optional<Template> getDynamicTemplate(String name) {
        return dynamicTemplates.stream().filter(t -> t.getName().equals(name)).findFirst();
    }

    /**
     * @param name The template name.
     * @return The dynamic template, or {@link TypeError.Kind#UNKNOWN_DYNAMIC_TEMPLATE}.
     */
    public Result<Template> lookupDynamicTemplate(String name) {
        return getDynamicTemplate(name)
                .map(Result::ok)
                .orElseGet(() -> Result.error(TypeError.unknownDynamicTemplate(name)));
    }

    /**
     * @param name The template name.
     * @return The static or dynamic template of that name.
     */
    public Optional<Template> findTemplate(String name) {
        return templates.stream().filter(t -> t.getName().equals(name)).findFirst()
                .or(() -> getDynamicTemplate(name));
    }

    public List<Template> getTemplates() {
        return Collections.unmodifiableList(templates);
    }

    public List<Template> getDynamicTemplates() {
        return Collections.unmodifiableList(dynamicTemplates);
    }

    public boolean hasDynamicTemplates() {
        return !dynamicTemplates.isEmpty();
    }

    // --- template bodies ---

    /**
     * Adds a location to a template.
     *
     * @param template        The template.
     * @param name            The location name.
     * @param invariant       The invariant, may be {@link Expression#EMPTY}.
     * @param exponentialRate The exit rate, may be {@link Expression#EMPTY}.
     * @param position        The declaring position.
     * @return The location, or a reported duplicate-definition error.
     */
    public Result<State> addLocation(Template template, String name, Expression invariant,
                                     Expression exponentialRate, Position position) {
        return reported(position, template.addLocation(name, invariant, exponentialRate, position));
    }

    public Result<Branchpoint> addBranchpoint(Template template, String name, Position position) {
        return reported(position, template.addBranchpoint(name, position));
    }

    /**
     * Adds an edge to a template.
     *
     * @param template     The template.
     * @param source       The source location or branchpoint.
     * @param destination  The destination location or branchpoint.
     * @param controllable Whether the edge is controllable.
     * @param actionName   The action name, may be empty.
     * @param position     The position of the edge.
     * @return The edge, or a reported error if an endpoint is not a location of the template.
     */
    public Result<Edge> addEdge(Template template, Symbol source, Symbol destination, boolean controllable,
                                String actionName, Position position) {
        return reported(position, template.addEdge(source, destination, controllable, actionName));
    }

    public Result<InstanceLine> addInstanceLine(Template template, String name, Position position) {
        return reported(position, template.addInstanceLine(name, position));
    }

    public Result<Message> addMessage(Template template, Symbol source, Symbol destination, int location,
                                      boolean prechart, Expression label, Position position) {
        return reported(position, template.addMessage(source, destination, location, prechart, label));
    }

    public Result<Condition> addCondition(Template template, List<Symbol> anchors, int location, boolean prechart,
                                          boolean hot, Expression label, Position position) {
        return reported(position, template.addCondition(anchors, location, prechart, hot, label));
    }

    public Result<Update> addUpdate(Template template, Symbol anchor, int location, boolean prechart,
                                    Expression label, Position position) {
        return reported(position, template.addUpdate(anchor, location, prechart, label));
    }

    /**
     * Binds an instance line to the instance it observes.
     *
     * @param line      The instance line.
     * @param base      The template or instance being instantiated; not modified.
     * @param params    Fresh parameters of the binding.
     * @param arguments The arguments, bound left to right to the free parameters of {@code base}.
     * @param position  The position of the binding.
     * @return The bound instance, or a reported too-many-arguments error.
     */
    public Result<Instance> bindInstanceLine(InstanceLine line, Instance base, Frame params,
                                             List<Expression> arguments, Position position) {
        return reported(position, line.addParameters(base, params, arguments));
    }

    // --- instances and processes ---

    public Result<Instance> addInstance(String name, Template base, Frame parameters,
                                        List<Expression> arguments, Position position) {
        return addInstance(name, base.getInstance(), parameters, arguments, position);
    }

    /**
     * Declares a partial instance, e.g. {@code P1 = P(1);}.
     *
     * @param name       The instance name.
     * @param base       The template or instance being instantiated; not modified.
     * @param parameters Fresh parameters of the new instance.
     * @param arguments  The arguments, bound left to right to the free parameters of {@code base}.
     * @param position   The declaring position.
     * @return The instance, or a reported error: duplicate definition or too many arguments.
     */
    public Result<Instance> addInstance(String name, Instance base, Frame parameters,
                                        List<Expression> arguments, Position position) {
        return declareInstance(name, Type.Kind.INSTANCE, base, parameters, arguments, position, instances);
    }

    public Result<Instance> addLscInstance(String name, Template base, Frame parameters,
                                           List<Expression> arguments, Position position) {
        return addLscInstance(name, base.getInstance(), parameters, arguments, position);
    }

    /**
     * Declares an instance of a live sequence chart. Works like
     * {@link #addInstance(String, Instance, Frame, List, Position)}.
     */
    public Result<Instance> addLscInstance(String name, Instance base, Frame parameters,
                                           List<Expression> arguments, Position position) {
        return declareInstance(name, Type.Kind.LSC_INSTANCE, base, parameters, arguments, position, lscInstances);
    }

    private Result<Instance> declareInstance(String name, Type.Kind kind, Instance base, Frame parameters,
                                             List<Expression> arguments, Position position,
                                             List<Instance> target) {
        Frame frame = globals.getFrame();
        if (frame.contains(name)) {
            return fail(position, TypeError.duplicateDefinition(name));
        }
        Symbol symbol = new Symbol(name, Type.of(kind), position);
        Result<Instance> result = Instantiator.instantiate(symbol, base, parameters, arguments);
        if (result.isError()) {
            return fail(position, result.error().orElseThrow());
        }
        Instance instance = result.get();
        frame.add(symbol);
        symbol.setUserData(instance);
        target.add(instance);
        instancesBySymbol.put(symbol, instance);
        return result;
    }

    public List<Instance> getInstances() {
        return Collections.unmodifiableList(instances);
    }

    public List<Instance> getLscInstances() {
        return Collections.unmodifiableList(lscInstances);
    }

    /**
     * Adds an instance to the system line. An instance with free parameters is
     * accepted as a process set, one process per parameter valuation.
     *
     * @param instance The instance.
     * @param position The position in the system line.
     */
    public void addProcess(Instance instance, Position position) {
        if (!instance.isClosed()) {
            LOG.warn("Process {} at {} has {} unbound parameters and is added as a process set",
                    instance.getName(), position, instance.getUnbound());
        }
        processes.add(instance);
    }

    /**
     * Removes a process from the system line.
     * @param instance The process.
     * @return {@code true} if a process with the same symbol was present.
     */
    public boolean removeProcess(Instance instance) {
        for (Iterator<Instance> it = processes.iterator(); it.hasNext(); ) {
            if (it.next().getSymbol() == instance.getSymbol()) {
                it.remove();
                return true;
            }
        }
        return false;
    }

    public List<Instance> getProcesses() {
        return Collections.unmodifiableList(processes);
    }

    /**
     * Copies the variables of one template into another. Each copy gets a fresh symbol
     * in the target's frame; names the target already declares are skipped.
     *
     * @param from The source template.
     * @param to   The target template.
     * @return The number of variables copied.
     */
    public int copyVariablesFromTo(Template from, Template to) {
        int copied = 0;
        for (Variable variable : from.getDeclarations().getVariables()) {
            Symbol symbol = variable.getSymbol();
            Result<Variable> result = to.getDeclarations().addVariable(symbol.getType(), symbol.getName(),
                    variable.getInitializer(), symbol.getPosition());
            if (result.isOk()) {
                copied++;
            } else {
                LOG.debug("Not copying variable {} into {}: name already declared", symbol.getName(), to.getName());
            }
        }
        return copied;
    }

    /**
     * Copies the functions of one template into another, together with their local
     * variables and change/depend sets. Names the target already declares are skipped.
     *
     * @param from The source template.
     * @param to   The target template.
     * @return The number of functions copied.
     */
    public int copyFunctionsFromTo(Template from, Template to) {
        int copied = 0;
        for (Function function : from.getDeclarations().getFunctions()) {
            if (to.getDeclarations().addFunctionCopy(function).isOk()) {
                copied++;
            } else {
                LOG.debug("Not copying function {} into {}: name already declared", function.getName(), to.getName());
            }
        }
        return copied;
    }

    // --- priorities ---

    /**
     * Starts a new channel priority declaration.
     * @param head The first channel expression.
     */
    public void beginChanPriority(Expression head) {
        chanPriorities.add(new ChanPriority(head));
        hasPriorities = true;
    }

    /**
     * Continues the current channel priority declaration.
     *
     * @param separator {@code ','} for equal priority, {@code '<'} for higher priority.
     * @param channel   The channel expression.
     * @throws IllegalStateException if no declaration was begun.
     */
    public void addChanPriority(char separator, Expression channel) {
        if (chanPriorities.isEmpty()) {
            throw new IllegalStateException("addChanPriority called before beginChanPriority");
        }
        chanPriorities.get(chanPriorities.size() - 1).add(separator, channel);
    }

    public List<ChanPriority> getChanPriorities() {
        return Collections.unmodifiableList(chanPriorities);
    }

    public void setProcPriority(String name, int priority) {
        procPriorities.put(name, priority);
        hasPriorities = true;
    }

    /**
     * @param name The process name.
     * @return Its priority, 0 if none was set.
     */
    public int getProcPriority(String name) {
        return procPriorities.getOrDefault(name, 0);
    }

    public boolean hasPriorityDeclaration() {
        return hasPriorities;
    }

    // --- feature flags ---

    public void recordStrictInvariant() {
        hasStrictInvariants = true;
    }

    public boolean hasStrictInvariants() {
        return hasStrictInvariants;
    }

    public void recordStopWatch() {
        hasStopWatch = true;
    }

    public boolean hasStopWatch() {
        return hasStopWatch;
    }

    public void recordStrictLowerBoundOnControllableEdges() {
        hasStrictLowerBoundOnControllableEdges = true;
    }

    public boolean hasStrictLowerBoundOnControllableEdges() {
        return hasStrictLowerBoundOnControllableEdges;
    }

    public void clockGuardRecvBroadcast() {
        hasClockGuardRecvBroadcast = true;
    }

    public boolean hasClockGuardRecvBroadcast() {
        return hasClockGuardRecvBroadcast;
    }

    public void recordUrgentTransition() {
        hasUrgentTransition = true;
    }

    public boolean hasUrgentTransition() {
        return hasUrgentTransition;
    }

    public void setSyncUsed(int syncUsed) {
        this.syncUsed = syncUsed;
    }

    public int getSyncUsed() {
        return syncUsed;
    }

    // --- queries, options and misc ---

    public void addQuery(Query query) {
        queries.add(query);
    }

    public List<Query> getQueries() {
        return Collections.unmodifiableList(queries);
    }

    public boolean queriesEmpty() {
        return queries.isEmpty();
    }

    public void setOptions(List<QueryOption> options) {
        this.options.clear();
        this.options.addAll(options);
    }

    public List<QueryOption> getOptions() {
        return Collections.unmodifiableList(options);
    }

    public Expression getBeforeUpdate() {
        return beforeUpdate;
    }

    public void setBeforeUpdate(Expression beforeUpdate) {
        this.beforeUpdate = beforeUpdate == null ? Expression.EMPTY : beforeUpdate;
    }

    public Expression getAfterUpdate() {
        return afterUpdate;
    }

    public void setAfterUpdate(Expression afterUpdate) {
        this.afterUpdate = afterUpdate == null ? Expression.EMPTY : afterUpdate;
    }

    /** @return The name of the observer automaton; empty if there is none. */
    public String getObsTA() {
        return obsTA;
    }

    public void setObsTA(String obsTA) {
        this.obsTA = obsTA == null ? "" : obsTA;
    }

    /**
     * Appends a string literal to the string table.
     * @param string The literal.
     * @return Its index.
     */
    public int addString(String string) {
        strings.add(string);
        return strings.size() - 1;
    }

    /**
     * @param string The literal.
     * @return The index of an equal literal already in the table, or of the appended one.
     */
    public int addStringIfNew(String string) {
        int index = strings.indexOf(string);
        return index >= 0 ? index : addString(string);
    }

    public List<String> getStrings() {
        return Collections.unmodifiableList(strings);
    }

    public boolean isModified() {
        return modified;
    }

    public void setModified(boolean modified) {
        this.modified = modified;
    }

    public SupportedMethods getSupportedMethods() {
        return supportedMethods;
    }

    public void setSupportedMethods(SupportedMethods supportedMethods) {
        this.supportedMethods = supportedMethods;
    }

    // --- positions and diagnostics ---

    /**
     * Registers the start of a source line.
     * @see PositionTable#add(int, int, int, String)
     */
    public void addPosition(int position, int offset, int line, String path) {
        positions.add(position, offset, line, path);
    }

    public Optional<SourceLine> findPosition(int position) {
        return positions.find(position);
    }

    public PositionTable getPositions() {
        return positions;
    }

    public void addError(Position position, String message, String context) {
        diagnostics.reportError(position, message, context);
    }

    public void addWarning(Position position, String message, String context) {
        diagnostics.reportWarning(position, message, context);
    }

    public boolean hasErrors() {
        return diagnostics.hasErrors();
    }

    public boolean hasWarnings() {
        return diagnostics.hasWarnings();
    }

    public List<Diagnostic> getErrors() {
        return diagnostics.getErrors();
    }

    public List<Diagnostic> getWarnings() {
        return diagnostics.getWarnings();
    }

    public void clearErrors() {
        diagnostics.clearErrors();
    }

    public void clearWarnings() {
        diagnostics.clearWarnings();
    }

    // --- traversal ---

    /**
     * Walks the document: the global declarations in declaration order, every
     * template and dynamic template, the processes, the global progress measures,
     * the I/O declarations and the gantt chart.
     *
     * @param visitor The visitor.
     */
    public void accept(SystemVisitor visitor) {
        visitor.visitSystemBefore(this);
        visitDeclarations(globals, visitor);
        templates.forEach(template -> visitTemplate(template, visitor));
        dynamicTemplates.forEach(template -> visitTemplate(template, visitor));
        processes.forEach(visitor::visitProcess);
        globals.getProgressMeasures().forEach(visitor::visitProgressMeasure);
        globals.getIoDecls().forEach(visitor::visitIoDecl);
        globals.getGanttChart().forEach(visitor::visitGanttChart);
        visitor.visitSystemAfter(this);
    }

    private void visitTemplate(Template template, SystemVisitor visitor) {
        if (!visitor.visitTemplateBefore(template)) {
            return;
        }
        visitDeclarations(template.getDeclarations(), visitor);
        for (State state : template.getStates()) {
            visitor.visitState(state);
        }
        for (Edge edge : template.getEdges()) {
            visitor.visitEdge(edge);
        }
        template.getDeclarations().getProgressMeasures().forEach(visitor::visitProgressMeasure);
        for (InstanceLine line : template.getInstanceLines()) {
            visitor.visitInstanceLine(line);
        }
        for (Message message : template.getScenario().getMessages()) {
            visitor.visitMessage(message);
        }
        for (Condition condition : template.getScenario().getConditions()) {
            visitor.visitCondition(condition);
        }
        for (Update update : template.getScenario().getUpdates()) {
            visitor.visitUpdate(update);
        }
        visitor.visitTemplateAfter(template);
    }

    private void visitDeclarations(Declarations declarations, SystemVisitor visitor) {
        for (Symbol symbol : declarations.getFrame()) {
            Optional<Variable> variable = declarations.findVariable(symbol);
            if (variable.isPresent()) {
                visitor.visitVariable(variable.get());
                continue;
            }
            Optional<Function> function = declarations.findFunction(symbol);
            if (function.isPresent()) {
                visitor.visitFunction(function.get());
                continue;
            }
            if (symbol.getType().is(Type.Kind.TYPEDEF)) {
                visitor.visitTypeDef(symbol);
                continue;
            }
            Instance instance = instancesBySymbol.get(symbol);
            if (instance != null) {
                visitor.visitInstance(instance);
            }
        }
    }
}
