package org.tamodel.document.query;

/**
 * An engine option attached to a query or to the whole model.
 *
 * @param name  The option name.
 * @param value The option value as written.
 */
public record QueryOption(String name, String value) {

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
