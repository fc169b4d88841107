package org.tamodel.template;

import org.tamodel.symbols.Expression;
import org.tamodel.symbols.Symbol;

/**
 * A location of a timed automaton. The symbol's user data points to this object.
 * Until the type checker runs, rate expressions are still part of the invariant;
 * the checker moves them into {@link #setCostRate cost rate} and friends.
 */
public final class State {

    private final Symbol symbol;
    private final int number;
    private Expression name;
    private Expression invariant;
    private Expression exponentialRate;
    private Expression costRate = Expression.EMPTY;

    public State(Symbol symbol, int number, Expression invariant, Expression exponentialRate) {
        this.symbol = symbol;
        this.number = number;
        this.name = Expression.constant(symbol.getName());
        this.invariant = invariant == null ? Expression.EMPTY : invariant;
        this.exponentialRate = exponentialRate == null ? Expression.EMPTY : exponentialRate;
    }

    State(State other) {
        this.symbol = other.symbol;
        this.number = other.number;
        this.name = other.name;
        this.invariant = other.invariant;
        this.exponentialRate = other.exponentialRate;
        this.costRate = other.costRate;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    /** @return The location number within the template. */
    public int getNumber() {
        return number;
    }

    public Expression getName() {
        return name;
    }

    public void setName(Expression name) {
        this.name = name;
    }

    public Expression getInvariant() {
        return invariant;
    }

    public void setInvariant(Expression invariant) {
        this.invariant = invariant;
    }

    public Expression getExponentialRate() {
        return exponentialRate;
    }

    public void setExponentialRate(Expression exponentialRate) {
        this.exponentialRate = exponentialRate;
    }

    public Expression getCostRate() {
        return costRate;
    }

    public void setCostRate(Expression costRate) {
        this.costRate = costRate;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(symbol.getName());
        if (!invariant.isEmpty()) sb.append(" {").append(invariant).append('}');
        if (!exponentialRate.isEmpty()) sb.append(" rate ").append(exponentialRate);
        return sb.toString();
    }
}
