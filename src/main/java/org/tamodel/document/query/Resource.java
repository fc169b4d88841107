package org.tamodel.document.query;

import java.util.Optional;

/**
 * A resource usage expected of a query, e.g. memory or time.
 *
 * @param name  The resource name.
 * @param value The expected amount.
 * @param unit  The unit, if one was given.
 */
public record Resource(String name, String value, Optional<String> unit) {

    public Resource {
        unit = unit == null ? Optional.empty() : unit;
    }

    public static Resource of(String name, String value) {
        return new Resource(name, value, Optional.empty());
    }

    public static Resource of(String name, String value, String unit) {
        return new Resource(name, value, Optional.ofNullable(unit));
    }
}
