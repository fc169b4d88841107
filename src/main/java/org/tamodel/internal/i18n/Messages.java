package org.tamodel.internal.i18n;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Message catalogue of the document model for one locale, backed by the
 * {@code model_messages} resource bundle. Catalogues are immutable and cached per
 * locale; there is no process-wide current locale. Each
 * {@link org.tamodel.diagnostics.DiagnosticsEngine} renders with its own catalogue.
 */
public final class Messages {

    private static final String BUNDLE_BASE_NAME = "model_messages";
    private static final ResourceBundle.Control NO_DEFAULT_LOCALE_FALLBACK =
            ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);
    private static final Map<Locale, Messages> CATALOGUES = new ConcurrentHashMap<>();

    private final Locale locale;
    private final ResourceBundle bundle;

    private Messages(Locale locale) {
        this.locale = locale;
        this.bundle = ResourceBundle.getBundle(BUNDLE_BASE_NAME, locale, NO_DEFAULT_LOCALE_FALLBACK);
    }

    /**
     * Returns the catalogue of a locale. Locales without a translation get the base bundle,
     * independent of the JVM default locale.
     * @param locale The locale.
     * @return The catalogue.
     */
    public static Messages forLocale(Locale locale) {
        return CATALOGUES.computeIfAbsent(locale, Messages::new);
    }

    /** @return The catalogue of the base bundle. */
    public static Messages english() {
        return forLocale(Locale.ENGLISH);
    }

    public Locale getLocale() {
        return locale;
    }

    /**
     * Gets a message for the given key.
     * @param key The key of the message.
     * @return The message, or "!key!" if not found.
     */
    public String get(String key) {
        try {
            return bundle.getString(key);
        } catch (MissingResourceException e) {
            return "!" + key + "!";
        }
    }

    /**
     * Gets a formatted message for the given key.
     * @param key The key of the message.
     * @param args The arguments for the message format.
     * @return The formatted message.
     */
    public String format(String key, Object... args) {
        return new MessageFormat(get(key), locale).format(args);
    }
}
