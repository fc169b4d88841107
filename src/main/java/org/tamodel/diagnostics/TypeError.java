package org.tamodel.diagnostics;

import org.tamodel.internal.i18n.Messages;

/**
 * A named error or warning condition of the modelling language, such as an unknown
 * identifier or a duplicate definition. Type errors are values: they are returned
 * inside a {@link Result} or reported to the {@link DiagnosticsEngine}, never thrown.
 *
 * @param kind The kind of the condition.
 * @param name The offending name substituted into the message.
 */
public record TypeError(Kind kind, String name) {

    /**
     * The catalogue of conditions, each bound to a message key of the
     * {@code model_messages} bundle.
     */
    public enum Kind {
        UNKNOWN_IDENTIFIER("unknown_identifier"),
        HAS_NO_MEMBER("has_no_member_named"),
        IS_NOT_A_STRUCT("is_not_a_structure"),
        DUPLICATE_DEFINITION("duplicate_definition"),
        INVALID_TYPE("invalid_type"),
        NO_SUCH_PROCESS("no_such_process"),
        NOT_A_TEMPLATE("not_a_template"),
        NOT_A_PROCESS("is_not_a_process"),
        STRATEGY_NOT_DECLARED("strategy_not_declared"),
        UNKNOWN_DYNAMIC_TEMPLATE("unknown_dynamic_template"),
        SHADOWS_A_VARIABLE("shadows_a_variable", true),
        COULD_NOT_LOAD_LIBRARY("could_not_load_library"),
        COULD_NOT_LOAD_FUNCTION("could_not_load_function"),
        /** More arguments than unbound parameters were supplied to an instantiation. */
        TOO_MANY_ARGUMENTS("too_many_arguments"),
        NOT_A_LOCATION("not_a_location"),
        NOT_AN_INSTANCE_LINE("not_an_instance_line");

        private final String messageKey;
        private final boolean warning;

        Kind(String messageKey) {
            this(messageKey, false);
        }

        Kind(String messageKey, boolean warning) {
            this.messageKey = messageKey;
            this.warning = warning;
        }

        public String messageKey() {
            return messageKey;
        }

        public boolean isWarning() {
            return warning;
        }
    }

    public TypeError {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        if (name == null) name = "";
    }

    /**
     * Renders the English catalogue message with {@link #name()} substituted.
     * @return The message.
     */
    public String message() {
        return message(Messages.english());
    }

    /**
     * Renders the message of a given catalogue.
     * @param messages The catalogue.
     * @return The message.
     */
    public String message(Messages messages) {
        return messages.format(kind.messageKey(), name);
    }

    public boolean isWarning() {
        return kind.isWarning();
    }

    public static TypeError unknownIdentifier(String name) {
        return new TypeError(Kind.UNKNOWN_IDENTIFIER, name);
    }

    public static TypeError hasNoMember(String name) {
        return new TypeError(Kind.HAS_NO_MEMBER, name);
    }

    public static TypeError isNotAStruct(String name) {
        return new TypeError(Kind.IS_NOT_A_STRUCT, name);
    }

    public static TypeError duplicateDefinition(String name) {
        return new TypeError(Kind.DUPLICATE_DEFINITION, name);
    }

    public static TypeError invalidType(String name) {
        return new TypeError(Kind.INVALID_TYPE, name);
    }

    public static TypeError noSuchProcess(String name) {
        return new TypeError(Kind.NO_SUCH_PROCESS, name);
    }

    public static TypeError notATemplate(String name) {
        return new TypeError(Kind.NOT_A_TEMPLATE, name);
    }

    public static TypeError notAProcess(String name) {
        return new TypeError(Kind.NOT_A_PROCESS, name);
    }

    public static TypeError strategyNotDeclared(String name) {
        return new TypeError(Kind.STRATEGY_NOT_DECLARED, name);
    }

    public static TypeError unknownDynamicTemplate(String name) {
        return new TypeError(Kind.UNKNOWN_DYNAMIC_TEMPLATE, name);
    }

    public static TypeError shadowsAVariable(String name) {
        return new TypeError(Kind.SHADOWS_A_VARIABLE, name);
    }

    public static TypeError couldNotLoadLibrary(String name) {
        return new TypeError(Kind.COULD_NOT_LOAD_LIBRARY, name);
    }

    public static TypeError couldNotLoadFunction(String name) {
        return new TypeError(Kind.COULD_NOT_LOAD_FUNCTION, name);
    }

    public static TypeError tooManyArguments(String name) {
        return new TypeError(Kind.TOO_MANY_ARGUMENTS, name);
    }

    public static TypeError notALocation(String name) {
        return new TypeError(Kind.NOT_A_LOCATION, name);
    }

    public static TypeError notAnInstanceLine(String name) {
        return new TypeError(Kind.NOT_AN_INSTANCE_LINE, name);
    }

    @Override
    public String toString() {
        return message();
    }
}
