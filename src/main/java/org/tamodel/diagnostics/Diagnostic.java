package org.tamodel.diagnostics;

import org.tamodel.position.Position;

/**
 * Represents a single diagnostic message (error or warning) reported while a
 * document is built or checked.
 *
 * @param type     The type of the diagnostic.
 * @param position The source position the diagnostic refers to.
 * @param message  The diagnostic message.
 * @param context  Additional context, e.g. the offending source text; may be empty.
 */
public record Diagnostic(
        Type type,
        Position position,
        String message,
        String context
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error; the document should not be handed to a verifier. */
        ERROR,
        /** A warning that does not prevent further use of the document. */
        WARNING
    }

    public Diagnostic {
        if (position == null) position = Position.UNKNOWN;
        if (context == null) context = "";
    }

    @Override
    public String toString() {
        String base = String.format("[%s] %s: %s", type, position, message);
        return context.isEmpty() ? base : base + " (" + context + ")";
    }
}
