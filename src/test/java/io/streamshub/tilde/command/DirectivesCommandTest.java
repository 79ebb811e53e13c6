package io.streamshub.tilde.command;

import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.main.Launch;
import io.quarkus.test.junit.main.LaunchResult;
import io.quarkus.test.junit.main.QuarkusMainTest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@QuarkusMainTest
class DirectivesCommandTest {

    @Test
    @Launch({"directives"})
    void testListDirectivesTable(LaunchResult result) {
        assertEquals(0, result.exitCode());
        String output = result.getOutput();
        assertTrue(output.contains("DIRECTIVE"));
        assertTrue(output.contains("MNEMONIC"));
        assertTrue(output.contains("~? ~K"));
        assertTrue(output.contains("~w,dF"));
    }

    @Test
    @Launch({"directives", "-o", "text"})
    void testListDirectivesText(LaunchResult result) {
        assertEquals(0, result.exitCode());
        assertTrue(result.getOutput().startsWith("(format"));
        assertTrue(result.getOutput().contains("OPTION"));
    }

    @Test
    @Launch(value = {"directives", "-o", "xml"}, exitCode = 1)
    void testListDirectivesUnknownFormat(LaunchResult result) {
        assertTrue(result.getErrorOutput().contains("Unknown output format: xml"));
    }
}
