package io.streamshub.tilde.config;

import java.util.Locale;

/**
 * How command-line arguments are turned into values.
 */
public enum ArgumentSyntax {
    /**
     * Lisp-style data: 42, 1/3, "text", #\c, (a b c)
     */
    DATUM,

    /**
     * YAML scalars and flow sequences: 42, text, [a, b, c]
     */
    YAML;

    /**
     * Case-insensitive lookup by name.
     *
     * @throws IllegalArgumentException if the name is not a known syntax
     */
    public static ArgumentSyntax parse(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown argument syntax: " + name + ". Valid values: datum, yaml", e);
        }
    }
}
