package io.streamshub.tilde;

import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.QuarkusTestProfile;
import io.quarkus.test.junit.TestProfile;
import io.quarkus.test.junit.main.Launch;
import io.quarkus.test.junit.main.LaunchResult;
import io.quarkus.test.junit.main.QuarkusMainTest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@QuarkusMainTest
@TestProfile(TildeTest.TestConfig.class)
class TildeTest {

    private static String generatedVersion = UUID.randomUUID().toString();

    public static class TestConfig implements QuarkusTestProfile {
        @Override
        public Map<String, String> getConfigOverrides() {
            return Map.of("quarkus.application.version", generatedVersion);
        }
    }

    @Test
    @Launch({"--version"})
    void testVersion(LaunchResult result) {
        assertEquals(0, result.exitCode());
        assertEquals(generatedVersion, result.getOutput().trim());
    }

    @Test
    @Launch({"--help"})
    void testHelpListsSubcommands(LaunchResult result) {
        assertEquals(0, result.exitCode());
        assertTrue(result.getOutput().contains("format"));
        assertTrue(result.getOutput().contains("directives"));
    }
}
