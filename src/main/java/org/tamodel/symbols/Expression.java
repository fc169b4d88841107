package org.tamodel.symbols;

import org.tamodel.position.Position;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An opaque expression of the modelling language. The document only stores and
 * copies expressions; it never evaluates them. The parser supplies the source text
 * and the symbols the expression refers to.
 *
 * @param text     The source text.
 * @param position The source position.
 * @param symbols  The symbols referenced by the expression.
 */
public record Expression(String text, Position position, Set<Symbol> symbols) {

    /** The absent expression, e.g. a missing guard or initialiser. */
    public static final Expression EMPTY = new Expression("", Position.UNKNOWN, Set.of());

    public Expression {
        if (text == null) text = "";
        if (position == null) position = Position.UNKNOWN;
        symbols = symbols == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(symbols));
    }

    /**
     * Creates an expression that references no symbols, e.g. a literal.
     * @param text The source text.
     * @return The expression.
     */
    public static Expression constant(String text) {
        return new Expression(text, Position.UNKNOWN, Set.of());
    }

    /**
     * Creates an expression referencing the given symbols.
     * @param text The source text.
     * @param symbols The referenced symbols.
     * @return The expression.
     */
    public static Expression of(String text, Symbol... symbols) {
        Set<Symbol> refs = new LinkedHashSet<>();
        Collections.addAll(refs, symbols);
        return new Expression(text, Position.UNKNOWN, refs);
    }

    public boolean isEmpty() {
        return text.isEmpty() && symbols.isEmpty();
    }

    public boolean dependsOn(Symbol symbol) {
        return symbols.contains(symbol);
    }

    public boolean dependsOnAny(Collection<Symbol> candidates) {
        for (Symbol candidate : candidates) {
            if (symbols.contains(candidate)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return text;
    }
}
