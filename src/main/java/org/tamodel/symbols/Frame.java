package org.tamodel.symbols;

import org.tamodel.position.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * An ordered scope of symbols, used for declaration blocks, template parameters
 * and select quantifiers. Names are unique within one frame; lookups through
 * {@link #resolve(String)} continue in the parent frame.
 */
public final class Frame implements Iterable<Symbol> {

    private final Frame parent;
    private final List<Symbol> symbols = new ArrayList<>();

    /** Creates a root frame. */
    public Frame() {
        this(null);
    }

    /**
     * Creates a frame nested in {@code parent}.
     * @param parent The enclosing frame, may be null.
     */
    public Frame(Frame parent) {
        this.parent = parent;
    }

    /**
     * Creates a frame with the same symbols as {@code other} under another parent.
     * @param other The frame to copy.
     * @param parent The parent of the copy, may be null.
     */
    public Frame(Frame other, Frame parent) {
        this.parent = parent;
        this.symbols.addAll(other.symbols);
    }

    /**
     * Creates a root frame holding the given symbols in order.
     * @param symbols The symbols.
     * @return The frame.
     */
    public static Frame of(Symbol... symbols) {
        Frame frame = new Frame();
        for (Symbol symbol : symbols) {
            frame.add(symbol);
        }
        return frame;
    }

    public Optional<Frame> getParent() {
        return Optional.ofNullable(parent);
    }

    /**
     * Declares a new symbol in this frame.
     *
     * @param name     The name.
     * @param type     The type.
     * @param position The declaring position.
     * @param userData The declared entity.
     * @return The new symbol, or empty if this frame already declares {@code name}.
     */
    public Optional<Symbol> add(String name, Type type, Position position, Object userData) {
        if (contains(name)) {
            return Optional.empty();
        }
        Symbol symbol = new Symbol(name, type, position, userData);
        symbols.add(symbol);
        return Optional.of(symbol);
    }

    /**
     * Adds an existing symbol, e.g. a parameter declared in another frame. Unlike
     * {@link #add(String, Type, Position, Object)} this does not check names: the
     * parameter frame of an instance may hold equally named parameters of different
     * instantiation levels.
     *
     * @param symbol The symbol.
     * @return {@code false} if this very symbol is already present.
     */
    public boolean add(Symbol symbol) {
        if (contains(symbol)) {
            return false;
        }
        symbols.add(symbol);
        return true;
    }

    /**
     * Adds all symbols of another frame in order, skipping symbols already present.
     * @param other The frame to copy symbols from.
     */
    public void addAll(Frame other) {
        for (Symbol symbol : other) {
            add(symbol);
        }
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    public Symbol get(int index) {
        return symbols.get(index);
    }

    /**
     * @param name The name to look for.
     * @return The index of the symbol named {@code name} in this frame, or -1.
     */
    public int indexOf(String name) {
        for (int i = 0; i < symbols.size(); i++) {
            if (symbols.get(i).getName().equals(name)) return i;
        }
        return -1;
    }

    public int indexOf(Symbol symbol) {
        for (int i = 0; i < symbols.size(); i++) {
            if (symbols.get(i) == symbol) return i;
        }
        return -1;
    }

    public boolean contains(String name) {
        return indexOf(name) >= 0;
    }

    public boolean contains(Symbol symbol) {
        return indexOf(symbol) >= 0;
    }

    /**
     * Resolves a name in this frame and then in the enclosing frames.
     * @param name The name.
     * @return The symbol, or empty if no frame in the chain declares it.
     */
    public Optional<Symbol> resolve(String name) {
        for (Frame frame = this; frame != null; frame = frame.parent) {
            int index = frame.indexOf(name);
            if (index >= 0) return Optional.of(frame.symbols.get(index));
        }
        return Optional.empty();
    }

    /**
     * Removes a symbol from this frame.
     * @param symbol The symbol.
     * @return {@code true} if the symbol was present.
     */
    public boolean remove(Symbol symbol) {
        int index = indexOf(symbol);
        if (index < 0) return false;
        symbols.remove(index);
        return true;
    }

    public List<Symbol> getSymbols() {
        return Collections.unmodifiableList(symbols);
    }

    @Override
    public Iterator<Symbol> iterator() {
        return getSymbols().iterator();
    }

    @Override
    public String toString() {
        return symbols.toString();
    }
}
