package io.streamshub.tilde.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ArgumentSyntaxTest {

    @Test
    void testParseIgnoresCase() {
        assertEquals(ArgumentSyntax.YAML, ArgumentSyntax.parse("yaml"));
        assertEquals(ArgumentSyntax.YAML, ArgumentSyntax.parse("YAML"));
        assertEquals(ArgumentSyntax.DATUM, ArgumentSyntax.parse(" Datum "));
    }

    @Test
    void testParseUnknown() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ArgumentSyntax.parse("xml"));
        assertEquals("Unknown argument syntax: xml. Valid values: datum, yaml", e.getMessage());
    }
}
