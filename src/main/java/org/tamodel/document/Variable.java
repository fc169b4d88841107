package org.tamodel.document;

import org.tamodel.symbols.Expression;
import org.tamodel.symbols.Symbol;

/**
 * A variable, clock, channel or constant declaration. The symbol's user data points
 * to this object.
 */
public final class Variable {

    private final Symbol symbol;
    private Expression initializer;

    public Variable(Symbol symbol, Expression initializer) {
        this.symbol = symbol;
        this.initializer = initializer == null ? Expression.EMPTY : initializer;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public String getName() {
        return symbol.getName();
    }

    public Expression getInitializer() {
        return initializer;
    }

    public void setInitializer(Expression initializer) {
        this.initializer = initializer == null ? Expression.EMPTY : initializer;
    }

    @Override
    public String toString() {
        String declaration = symbol.getType() + " " + symbol.getName();
        return initializer.isEmpty() ? declaration + ";" : declaration + " = " + initializer + ";";
    }
}
