package org.tamodel.symbols;

/**
 * The type of a {@link Symbol}. The full type system lives in the type checker;
 * the document model only needs to tell the kinds of declared entities apart.
 *
 * @param kind The kind of the type.
 * @param name A display name, e.g. {@code "int[0,5]"}; may be empty.
 */
public record Type(Kind kind, String name) {

    /**
     * The kinds of types the document model distinguishes.
     */
    public enum Kind {
        INT,
        BOOL,
        DOUBLE,
        CLOCK,
        CHANNEL,
        RECORD,
        ARRAY,
        /** A named type introduced with {@code typedef}. */
        TYPEDEF,
        FUNCTION,
        /** A template or a fully instantiated process. */
        PROCESS,
        /** A process with unbound parameters. */
        PROCESS_SET,
        /** A partial instance. */
        INSTANCE,
        LSC_INSTANCE,
        LOCATION,
        BRANCHPOINT,
        INSTANCE_LINE,
        VOID
    }

    public Type {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        if (name == null) name = "";
    }

    /**
     * Creates a type with an empty display name.
     * @param kind The kind.
     * @return The type.
     */
    public static Type of(Kind kind) {
        return new Type(kind, "");
    }

    public boolean is(Kind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return name.isEmpty() ? kind.name().toLowerCase() : name;
    }
}
