package org.javai.restcore;

import java.util.Objects;

/**
 * One key/value pair of a form-encoded request body.
 *
 * @param name the field name
 * @param value the field value
 */
public record FormField(String name, String value) {

    public FormField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public static FormField of(String name, Object value) {
        return new FormField(name, String.valueOf(value));
    }
}
