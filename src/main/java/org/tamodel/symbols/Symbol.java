package org.tamodel.symbols;

import org.tamodel.position.Position;

/**
 * A named, typed identity. Two symbols are equal only if they are the same object.
 * <p>
 * The user data slot points back to the entity the symbol declares (a variable,
 * a location, a function, an instance, ...). It is set by whoever creates that
 * entity and is never owned by the symbol.
 */
public final class Symbol {

    private final String name;
    private final Type type;
    private final Position position;
    private Object userData;

    /**
     * Creates a symbol without user data.
     *
     * @param name     The name.
     * @param type     The type.
     * @param position The declaring position.
     */
    public Symbol(String name, Type type, Position position) {
        this(name, type, position, null);
    }

    /**
     * Creates a symbol.
     *
     * @param name     The name.
     * @param type     The type.
     * @param position The declaring position.
     * @param userData The declared entity, may be null.
     */
    public Symbol(String name, Type type, Position position, Object userData) {
        if (name == null) throw new IllegalArgumentException("name must not be null");
        this.name = name;
        this.type = type == null ? Type.of(Type.Kind.VOID) : type;
        this.position = position == null ? Position.UNKNOWN : position;
        this.userData = userData;
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public Position getPosition() {
        return position;
    }

    public Object getUserData() {
        return userData;
    }

    public void setUserData(Object userData) {
        this.userData = userData;
    }

    @Override
    public String toString() {
        return name;
    }
}
