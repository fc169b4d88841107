package org.tamodel.template;

import org.tamodel.symbols.Symbol;

/**
 * A zero-duration routing node. Branchpoints let probabilistic edges share a source,
 * guard and synchronisation; they disappear when the model is compiled.
 *
 * @param symbol The symbol, whose user data points to this branchpoint.
 * @param number The branchpoint number within the template.
 */
public record Branchpoint(Symbol symbol, int number) {

    @Override
    public String toString() {
        return symbol.getName();
    }
}
