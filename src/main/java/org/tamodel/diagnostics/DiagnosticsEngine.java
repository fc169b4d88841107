package org.tamodel.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tamodel.internal.i18n.Messages;
import org.tamodel.position.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * An engine for collecting the errors and warnings reported while a document is
 * built or checked. Reporting never aborts construction; the caller decides
 * whether accumulated errors make the document unusable.
 * <p>
 * The engine is owned independently of the document it serves, so read-only
 * passes over a finished document can still report problems. It is not
 * thread-safe; concurrent reporters must serialize access themselves.
 */
public class DiagnosticsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final List<Diagnostic> errors = new ArrayList<>();
    private final List<Diagnostic> warnings = new ArrayList<>();
    private final boolean logReports;
    private final Messages messages;

    /** Creates an engine that echoes every report to the debug log. */
    public DiagnosticsEngine() {
        this(true);
    }

    /**
     * Creates an engine rendering type errors in English.
     * @param logReports Whether reports are echoed to the debug log.
     */
    public DiagnosticsEngine(boolean logReports) {
        this(logReports, Locale.ENGLISH);
    }

    /**
     * Creates an engine.
     * @param logReports Whether reports are echoed to the debug log.
     * @param locale The locale type errors are rendered in.
     */
    public DiagnosticsEngine(boolean logReports, Locale locale) {
        this.logReports = logReports;
        this.messages = Messages.forLocale(locale);
    }

    /**
     * Creates a copy of another engine, including its collected diagnostics.
     * @param other The engine to copy.
     */
    public DiagnosticsEngine(DiagnosticsEngine other) {
        this.logReports = other.logReports;
        this.messages = other.messages;
        this.errors.addAll(other.errors);
        this.warnings.addAll(other.warnings);
    }

    /**
     * Reports an error.
     *
     * @param position The position of the error.
     * @param message  The error message.
     * @param context  Additional context, may be empty.
     */
    public void reportError(Position position, String message, String context) {
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Type.ERROR, position, message, context);
        errors.add(diagnostic);
        if (logReports) LOG.debug("{}", diagnostic);
    }

    /**
     * Reports a warning.
     *
     * @param position The position of the warning.
     * @param message  The warning message.
     * @param context  Additional context, may be empty.
     */
    public void reportWarning(Position position, String message, String context) {
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Type.WARNING, position, message, context);
        warnings.add(diagnostic);
        if (logReports) LOG.debug("{}", diagnostic);
    }

    /**
     * Reports a type error as an error or a warning, depending on its kind.
     *
     * @param position The position of the problem.
     * @param error    The type error.
     */
    public void report(Position position, TypeError error) {
        String message = error.message(messages);
        if (error.isWarning()) {
            reportWarning(position, message, error.name());
        } else {
            reportError(position, message, error.name());
        }
    }

    /** @return The locale type errors are rendered in. */
    public Locale getLocale() {
        return messages.getLocale();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public List<Diagnostic> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<Diagnostic> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /** Discards all errors, e.g. before re-checking the same document. */
    public void clearErrors() {
        errors.clear();
    }

    /** Discards all warnings. */
    public void clearWarnings() {
        warnings.clear();
    }

    /**
     * Returns all collected diagnostics as a single, formatted string, errors first.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return Stream.concat(errors.stream(), warnings.stream())
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
