package io.streamshub.tilde.command;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.main.Launch;
import io.quarkus.test.junit.main.LaunchResult;
import io.quarkus.test.junit.main.QuarkusMainLauncher;
import io.quarkus.test.junit.main.QuarkusMainTest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@QuarkusMainTest
class FormatCommandTest {

    QuarkusMainLauncher launcher;

    @BeforeEach
    void setUp(QuarkusMainLauncher launcher) {
        this.launcher = launcher;
    }

    // ========== Rendering ==========

    @Test
    @Launch({"format", "-n", "Hello, ~a!", "\"world\""})
    void testFormatString(LaunchResult result) {
        assertEquals(0, result.exitCode());
        assertEquals("Hello, world!", result.getOutput().trim());
    }

    @Test
    @Launch({"format", "-n", "~8,2F|~6F|~8,3F", "1/3", "32", "\"foo\""})
    void testFormatFixed(LaunchResult result) {
        assertEquals(0, result.exitCode());
        assertEquals("    0.33|    32|     foo", result.getOutput().stripTrailing());
    }

    @Test
    @Launch({"format", "-n", "~a ~? ~a", "a", "\"~s\"", "(new)", "test"})
    void testFormatIndirection(LaunchResult result) {
        assertEquals(0, result.exitCode());
        assertEquals("a new test", result.getOutput().trim());
    }

    @Test
    @Launch({"format", "-n", "-s", "yaml", "~s ~s", "hello", "[1, 2]"})
    void testFormatYamlSyntax(LaunchResult result) {
        assertEquals(0, result.exitCode());
        assertEquals("\"hello\" (1 2)", result.getOutput().trim());
    }

    @Test
    @Launch({"format", "-n", "--syntax", "YAML", "~s", "[a]"})
    void testFormatSyntaxIgnoresCase(LaunchResult result) {
        assertEquals(0, result.exitCode());
        assertEquals("(\"a\")", result.getOutput().trim());
    }

    @Test
    @Launch({"format", "-w", "10", "~y", "(alpha beta gamma)"})
    void testFormatLineWidth(LaunchResult result) {
        assertEquals(0, result.exitCode());
        assertTrue(result.getOutput().contains("(alpha"));
        assertTrue(result.getOutput().contains(" beta"));
        assertTrue(result.getOutput().contains(" gamma)"));
    }

    @Test
    @Launch({"format", "~h"})
    void testFormatHelpDirective(LaunchResult result) {
        assertEquals(0, result.exitCode());
        assertTrue(result.getOutput().contains("~w,dF"));
    }

    @Test
    void testFormatArgsFile() throws IOException {
        Path file = Files.createTempFile("tilde-args", ".yaml");
        try {
            Files.writeString(file, "- 1\n- [a, b]\n");

            LaunchResult result = launcher.launch("format", "-n", "-f", file.toString(), "~a ~s ~a", "last");

            assertEquals(0, result.exitCode());
            assertEquals("1 (\"a\" \"b\") last", result.getOutput().trim());
        } finally {
            Files.deleteIfExists(file);
        }
    }

    // ========== Errors ==========

    @Test
    @Launch(value = {"format", "~a ~a", "1"}, exitCode = 1)
    void testFormatTooFewArguments(LaunchResult result) {
        assertTrue(result.getErrorOutput().contains("requires an argument"));
    }

    @Test
    @Launch(value = {"format", "~a", "1", "2"}, exitCode = 1)
    void testFormatTooManyArguments(LaunchResult result) {
        assertTrue(result.getErrorOutput().contains("1 left over"));
    }

    @Test
    @Launch(value = {"format", "~q"}, exitCode = 1)
    void testFormatUnknownDirective(LaunchResult result) {
        assertTrue(result.getErrorOutput().contains("Unknown directive: ~q"));
    }

    @Test
    @Launch(value = {"format", "~d", "1.5"}, exitCode = 1)
    void testFormatTypeMismatch(LaunchResult result) {
        assertTrue(result.getErrorOutput().contains("requires an exact integer"));
    }

    @Test
    @Launch(value = {"format", "~a", "(1 2"}, exitCode = 1)
    void testFormatInvalidArgument(LaunchResult result) {
        assertTrue(result.getErrorOutput().contains("Invalid argument: '(1 2'"));
    }

    @Test
    @Launch(value = {"format", "-f", "/nonexistent/args.yaml", "~a"}, exitCode = 1)
    void testFormatMissingArgsFile(LaunchResult result) {
        assertTrue(result.getErrorOutput().contains("Argument file not found"));
    }

    @Test
    @Launch(value = {"format", "-s", "xml", "~a", "1"}, exitCode = 2)
    void testFormatUnknownSyntax(LaunchResult result) {
        assertTrue(result.getErrorOutput().contains("Unknown argument syntax: xml"));
    }

    @Test
    @Launch(value = {"format", "-w", "0", "~y", "()"}, exitCode = 1)
    void testFormatInvalidLineWidth(LaunchResult result) {
        assertTrue(result.getErrorOutput().contains("--line-width must be positive"));
    }
}
