package org.tamodel.template;

import org.tamodel.symbols.Expression;
import org.tamodel.symbols.Frame;
import org.tamodel.symbols.Symbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * A partial instance of a template. Every template is an instance of itself with no
 * bound parameters; a complete instance (a process) has no unbound parameters left.
 * <p>
 * Partial instances of partial instances are not stored hierarchically: all
 * parameters live in one frame. The first {@link #getUnbound()} symbols of
 * {@link #getParameters()} are the free parameters of this instance; the remaining
 * symbols are bound, in binding order, to the expressions in {@link #getMapping()}.
 * <p>
 * Restricted parameters are those used, directly or indirectly, in array sizes.
 * They must not be bound to expressions depending on free process parameters.
 */
public final class Instance {

    private final Symbol symbol;
    private final Frame parameters;
    private final Map<Symbol, Expression> mapping;
    private final int arguments;
    private final int unbound;
    private final Template template;
    private final Set<Symbol> restricted;

    /**
     * Creates an instance and checks the parameter layout.
     *
     * @param symbol     The name of the instance.
     * @param parameters Free parameters first, then bound ones in binding order. The
     *                   instance keeps its own copy of the frame.
     * @param mapping    The bound parameters and their arguments, in binding order.
     * @param arguments  The number of arguments supplied along the instantiation chain.
     * @param unbound    The number of free parameters.
     * @param template   The template this is an instance of.
     * @param restricted The restricted parameters.
     * @throws IllegalArgumentException if the layout is inconsistent.
     */
    public Instance(Symbol symbol, Frame parameters, Map<Symbol, Expression> mapping, int arguments,
                    int unbound, Template template, Set<Symbol> restricted) {
        this.symbol = symbol;
        this.parameters = new Frame(parameters, null);
        this.mapping = new LinkedHashMap<>(mapping);
        this.arguments = arguments;
        this.unbound = unbound;
        this.template = template;
        this.restricted = new LinkedHashSet<>(restricted);
        checkLayout();
    }

    /**
     * Creates an instance without bound parameters, e.g. the self instance of a template.
     * @param symbol The name.
     * @param parameters The free parameters.
     * @param template The template.
     * @return The instance.
     */
    public static Instance unbound(Symbol symbol, Frame parameters, Template template) {
        return new Instance(symbol, parameters, Map.of(), 0, parameters.size(), template, Set.of());
    }

    private void checkLayout() {
        if (unbound < 0 || unbound + mapping.size() != parameters.size()) {
            throw new IllegalArgumentException("Instance " + symbol + ": " + unbound + " unbound and "
                    + mapping.size() + " bound parameters do not fill a frame of " + parameters.size());
        }
        if (arguments > parameters.size()) {
            throw new IllegalArgumentException("Instance " + symbol + " has more arguments than parameters");
        }
        for (int i = unbound; i < parameters.size(); i++) {
            if (!mapping.containsKey(parameters.get(i))) {
                throw new IllegalArgumentException("Parameter " + parameters.get(i) + " of " + symbol
                        + " is in the bound suffix but has no argument");
            }
        }
    }

    /**
     * Creates a copy that belongs to another template, used when a document is copied.
     * @param owner The template of the copy.
     * @return The copy.
     */
    public Instance copyFor(Template owner) {
        return new Instance(symbol, parameters, mapping, arguments, unbound, owner, restricted);
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public String getName() {
        return symbol.getName();
    }

    /**
     * @return A copy of the parameter frame; changing it does not affect this instance.
     */
    public Frame getParameters() {
        return new Frame(parameters, null);
    }

    /** @return The parameter symbols in frame order, read-only. */
    public List<Symbol> getParameterSymbols() {
        return parameters.getSymbols();
    }

    public Map<Symbol, Expression> getMapping() {
        return Collections.unmodifiableMap(mapping);
    }

    public int getArguments() {
        return arguments;
    }

    public int getUnbound() {
        return unbound;
    }

    public Template getTemplate() {
        return template;
    }

    public Set<Symbol> getRestricted() {
        return Collections.unmodifiableSet(restricted);
    }

    /**
     * Marks a parameter or variable as restricted. Called by the type checker when it
     * finds the symbol in an array size.
     * @param variable The restricted symbol.
     */
    public void addRestricted(Symbol variable) {
        restricted.add(variable);
    }

    public boolean isRestricted(Symbol variable) {
        return restricted.contains(variable);
    }

    /**
     * @return {@code true} when no parameter is left unbound.
     */
    public boolean isClosed() {
        return unbound == 0;
    }

    /**
     * @param parameter A parameter symbol.
     * @return {@code true} if the symbol is one of the free parameters.
     */
    public boolean isUnboundParameter(Symbol parameter) {
        int index = parameters.indexOf(parameter);
        return index >= 0 && index < unbound;
    }

    /** @return The bindings as {@code p = e, ...} in binding order. */
    public String writeMapping() {
        StringJoiner joiner = new StringJoiner(", ");
        mapping.forEach((parameter, argument) -> joiner.add(parameter.getName() + " = " + argument));
        return joiner.toString();
    }

    /** @return The free parameters as {@code type name, ...}. */
    public String writeParameters() {
        StringJoiner joiner = new StringJoiner(", ");
        for (int i = 0; i < unbound; i++) {
            Symbol parameter = parameters.get(i);
            joiner.add(parameter.getType() + " " + parameter.getName());
        }
        return joiner.toString();
    }

    /** @return The arguments in binding order, comma separated. */
    public String writeArguments() {
        StringJoiner joiner = new StringJoiner(", ");
        mapping.values().forEach(argument -> joiner.add(argument.text()));
        return joiner.toString();
    }

    @Override
    public String toString() {
        return getName() + "(" + writeMapping() + ")";
    }
}
