package org.tamodel.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.tamodel.lsc.EventPrecedence;

import java.util.Locale;

/**
 * Settings of a document, read from the {@code tamodel} block of the configuration.
 *
 * @param eventPrecedence The order of co-located scenario events within a simregion sequence.
 * @param logReports      Whether reported diagnostics are echoed to the debug log.
 * @param locale          The locale of diagnostic messages.
 */
public record ModelSettings(EventPrecedence eventPrecedence, boolean logReports, Locale locale) {

    private static final String ROOT = "tamodel";

    public ModelSettings {
        if (eventPrecedence == null) eventPrecedence = EventPrecedence.DEFAULT;
        if (locale == null) locale = Locale.ENGLISH;
    }

    /**
     * Reads the settings from a configuration.
     *
     * @param config A configuration with a {@code tamodel} block, usually from {@link ConfigLoader}.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a setting is missing or has the wrong type.
     * @throws IllegalArgumentException if the event precedence is not a permutation of the event kinds.
     */
    public static ModelSettings fromConfig(Config config) {
        Config model = config.getConfig(ROOT);
        return new ModelSettings(
                EventPrecedence.parse(model.getStringList("lsc.event-precedence")),
                model.getBoolean("diagnostics.log-reports"),
                Locale.forLanguageTag(model.getString("messages.locale")));
    }

    /**
     * @return The settings of {@code reference.conf}.
     */
    public static ModelSettings defaults() {
        return fromConfig(ConfigFactory.parseResources("reference.conf").resolve());
    }
}
