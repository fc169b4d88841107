package org.tamodel.document;

import org.tamodel.symbols.Expression;
import org.tamodel.symbols.Frame;
import org.tamodel.symbols.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A user function. The symbol's user data points to this object.
 * <p>
 * The sets of changed and read variables are filled in by the type checker after
 * construction; the builder only sets the local variables and the body.
 */
public final class Function {

    private final Symbol symbol;
    private final Frame frame;
    private final Set<Symbol> changes = new LinkedHashSet<>();
    private final Set<Symbol> depends = new LinkedHashSet<>();
    private final List<Variable> variables = new ArrayList<>();
    private Expression body = Expression.EMPTY;

    /**
     * Creates a function.
     * @param symbol The function symbol.
     * @param enclosing The frame the function is declared in; local variables go into a nested frame.
     */
    public Function(Symbol symbol, Frame enclosing) {
        this.symbol = symbol;
        this.frame = new Frame(enclosing);
    }

    /**
     * Copies the contents of another function into a function declared by {@code symbol}.
     * Local variables get fresh symbols in the new local frame.
     *
     * @param symbol    The symbol of the copy.
     * @param enclosing The frame the copy is declared in.
     * @param other     The function to copy.
     */
    public Function(Symbol symbol, Frame enclosing, Function other) {
        this(symbol, enclosing);
        this.changes.addAll(other.changes);
        this.depends.addAll(other.depends);
        this.body = other.body;
        for (Variable local : other.variables) {
            Symbol original = local.getSymbol();
            frame.add(original.getName(), original.getType(), original.getPosition(), null).ifPresent(copy -> {
                Variable variable = new Variable(copy, local.getInitializer());
                copy.setUserData(variable);
                variables.add(variable);
            });
        }
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public String getName() {
        return symbol.getName();
    }

    /** @return The frame of the function's local variables. */
    public Frame getFrame() {
        return frame;
    }

    /** @return The variables written by the function; mutated by the type checker. */
    public Set<Symbol> getChanges() {
        return changes;
    }

    /** @return The variables read by the function; mutated by the type checker. */
    public Set<Symbol> getDepends() {
        return depends;
    }

    public List<Variable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    void addVariable(Variable variable) {
        variables.add(variable);
    }

    public Expression getBody() {
        return body;
    }

    public void setBody(Expression body) {
        this.body = body == null ? Expression.EMPTY : body;
    }

    @Override
    public String toString() {
        return symbol.getType() + " " + symbol.getName() + " { " + body + " }";
    }
}
