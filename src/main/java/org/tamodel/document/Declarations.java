package org.tamodel.document;

import org.tamodel.diagnostics.Result;
import org.tamodel.diagnostics.TypeError;
import org.tamodel.position.Position;
import org.tamodel.symbols.Expression;
import org.tamodel.symbols.Frame;
import org.tamodel.symbols.Symbol;
import org.tamodel.symbols.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A declaration block: the global declarations of a document or the local
 * declarations of a template. Owns the declared variables and functions together
 * with progress measures, I/O declarations and gantt chart rows.
 */
public final class Declarations {

    private final Frame frame;
    private final List<Variable> variables = new ArrayList<>();
    private final List<Function> functions = new ArrayList<>();
    private final List<ProgressMeasure> progress = new ArrayList<>();
    private final List<IoDecl> ioDecls = new ArrayList<>();
    private final List<Gantt> ganttChart = new ArrayList<>();
    private final Map<Symbol, Variable> variablesBySymbol = new HashMap<>();
    private final Map<Symbol, Function> functionsBySymbol = new HashMap<>();

    public Declarations(Frame frame) {
        this.frame = frame;
    }

    /**
     * Deep-copies another block. Symbols are shared with the original; variables and
     * functions are new objects reachable through this block's lookups.
     *
     * @param other  The block to copy.
     * @param parent The parent frame of the copied frame.
     */
    public Declarations(Declarations other, Frame parent) {
        this.frame = new Frame(other.frame, parent);
        for (Variable variable : other.variables) {
            register(new Variable(variable.getSymbol(), variable.getInitializer()));
        }
        for (Function function : other.functions) {
            register(new Function(function.getSymbol(), frame, function));
        }
        progress.addAll(other.progress);
        other.ioDecls.forEach(decl -> ioDecls.add(new IoDecl(decl)));
        other.ganttChart.forEach(gantt -> ganttChart.add(new Gantt(gantt)));
    }

    public Frame getFrame() {
        return frame;
    }

    /**
     * Declares a variable in this block.
     *
     * @param type        The type.
     * @param name        The name.
     * @param initializer The initialiser, may be {@link Expression#EMPTY}.
     * @param position    The declaring position.
     * @return The variable, or a duplicate-definition error if the name is taken in this block.
     */
    public Result<Variable> addVariable(Type type, String name, Expression initializer, Position position) {
        Optional<Symbol> symbol = frame.add(name, type, position, null);
        if (symbol.isEmpty()) {
            return Result.error(TypeError.duplicateDefinition(name));
        }
        Variable variable = new Variable(symbol.get(), initializer);
        symbol.get().setUserData(variable);
        register(variable);
        return Result.ok(variable);
    }

    /**
     * Declares a function in this block.
     *
     * @param type     The function type.
     * @param name     The name.
     * @param position The declaring position.
     * @return The function, or a duplicate-definition error if the name is taken in this block.
     */
    public Result<Function> addFunction(Type type, String name, Position position) {
        Optional<Symbol> symbol = frame.add(name, type, position, null);
        if (symbol.isEmpty()) {
            return Result.error(TypeError.duplicateDefinition(name));
        }
        Function function = new Function(symbol.get(), frame);
        symbol.get().setUserData(function);
        register(function);
        return Result.ok(function);
    }

    /**
     * Declares a function in this block with the contents of a function of another block.
     *
     * @param other The function to copy.
     * @return The copy, or a duplicate-definition error if the name is taken in this block.
     */
    public Result<Function> addFunctionCopy(Function other) {
        Symbol original = other.getSymbol();
        Optional<Symbol> symbol = frame.add(original.getName(), original.getType(), original.getPosition(), null);
        if (symbol.isEmpty()) {
            return Result.error(TypeError.duplicateDefinition(original.getName()));
        }
        Function function = new Function(symbol.get(), frame, other);
        symbol.get().setUserData(function);
        register(function);
        return Result.ok(function);
    }

    private void register(Variable variable) {
        variables.add(variable);
        variablesBySymbol.put(variable.getSymbol(), variable);
    }

    private void register(Function function) {
        functions.add(function);
        functionsBySymbol.put(function.getSymbol(), function);
    }

    public void addProgressMeasure(Expression guard, Expression measure) {
        progress.add(new ProgressMeasure(guard, measure));
    }

    /**
     * Appends an empty I/O declaration for the builder to fill in.
     * @return The new declaration.
     */
    public IoDecl addIoDecl() {
        IoDecl decl = new IoDecl();
        ioDecls.add(decl);
        return decl;
    }

    public void addGantt(Gantt gantt) {
        ganttChart.add(gantt);
    }

    public List<Variable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public List<Function> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    public List<ProgressMeasure> getProgressMeasures() {
        return Collections.unmodifiableList(progress);
    }

    public List<IoDecl> getIoDecls() {
        return Collections.unmodifiableList(ioDecls);
    }

    public List<Gantt> getGanttChart() {
        return Collections.unmodifiableList(ganttChart);
    }

    public Optional<Variable> findVariable(Symbol symbol) {
        return Optional.ofNullable(variablesBySymbol.get(symbol));
    }

    public Optional<Variable> findVariable(String name) {
        return variables.stream().filter(v -> v.getName().equals(name)).findFirst();
    }

    public Optional<Function> findFunction(Symbol symbol) {
        return Optional.ofNullable(functionsBySymbol.get(symbol));
    }

    public Optional<Function> findFunction(String name) {
        return functions.stream().filter(f -> f.getName().equals(name)).findFirst();
    }

    /**
     * Renders the variable and function declarations, one per line.
     * @return The declarations as text.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        variables.forEach(v -> sb.append(v).append('\n'));
        functions.forEach(f -> sb.append(f).append('\n'));
        return sb.toString();
    }
}
