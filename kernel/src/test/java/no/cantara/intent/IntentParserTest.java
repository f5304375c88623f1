package no.cantara.intent;

import no.cantara.intent.model.Intent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IntentParserTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static Path fixture(String name) {
        URL url = IntentParserTest.class.getClassLoader().getResource("fixtures/" + name);
        assertNotNull(url, "fixture not found: " + name);
        return Paths.get(url.getPath());
    }

    @Test void parsesFixture() throws IOException {
        Intent intent = IntentParser.parse(fixture("auth-intent.yaml"));
        assertEquals("Create a user authentication system", intent.goal());
        assertEquals(3, intent.constraints().size());
        assertEquals("platform", intent.context().get("team"));
    }

    @Test void parsesGoalOnly() {
        Intent intent = IntentParser.parse(yaml("goal: Build a CLI\n"));
        assertEquals("Build a CLI", intent.goal());
        assertTrue(intent.constraints().isEmpty());
        assertTrue(intent.context().isEmpty());
    }

    @Test void singleConstraintStringBecomesList() {
        Intent intent = IntentParser.parse(yaml("goal: g\nconstraints: Must use Java\n"));
        assertEquals(List.of("Must use Java"), intent.constraints());
    }

    @Test void acceptsJson() {
        Intent intent = IntentParser.parse(yaml("{\"goal\": \"g\", \"constraints\": [\"a\", \"b\"]}"));
        assertEquals(List.of("a", "b"), intent.constraints());
    }

    @Test void timestampsInContextBecomeIsoStrings() {
        Intent intent = IntentParser.parse(yaml("goal: g\ncontext:\n  since: 2024-01-02\n"));
        assertEquals("2024-01-02T00:00:00Z", intent.context().get("since"));
    }

    @Test void rejectsNonMappingDocument() {
        assertThrows(IllegalArgumentException.class, () -> IntentParser.parse(yaml("- a\n- b\n")));
    }

    @Test void rejectsMissingGoal() {
        assertThrows(IllegalArgumentException.class, () -> IntentParser.parse(yaml("constraints: [a]\n")));
    }

    @Test void rejectsNonStringConstraint() {
        assertThrows(IllegalArgumentException.class, () -> IntentParser.parse(yaml("goal: g\nconstraints: [1]\n")));
    }

    @Test void rejectsFractionalContextValues() {
        assertThrows(IllegalArgumentException.class, () -> IntentParser.parse(yaml("goal: g\ncontext:\n  ratio: 0.5\n")));
    }

    @Test void fromMapAcceptsPlainMaps() {
        Intent intent = IntentParser.fromMap(Map.of("goal", "g", "constraints", List.of("c")));
        assertEquals(Intent.of("g", "c"), intent);
    }

    @Test void parsesFromPath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("intent.yaml");
        Files.writeString(file, "goal: From disk\n");
        assertEquals("From disk", IntentParser.parse(file).goal());
    }
}
