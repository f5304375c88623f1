package no.cantara.intent;

import no.cantara.intent.decompose.DecompositionConfig;
import no.cantara.intent.measure.TerminationConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class KernelConfigLoaderTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test void emptyDocumentGivesDefaults() {
        assertEquals(DecompositionConfig.DEFAULTS, KernelConfigLoader.load(yaml("")));
    }

    @Test void documentedDefaults() {
        assertEquals(12, DecompositionConfig.DEFAULTS.maxDepth());
        assertEquals(1024, DecompositionConfig.DEFAULTS.maxNodes());
    }

    @Test void missingKeysFallBackToDefaults() {
        DecompositionConfig config = KernelConfigLoader.load(yaml("max_depth: 4\n"));
        assertEquals(4, config.maxDepth());
        assertEquals(DecompositionConfig.DEFAULT_MAX_NODES, config.maxNodes());
        assertEquals(TerminationConfig.DEFAULTS, config.termination());
    }

    @Test void readsTerminationThresholds() {
        DecompositionConfig config = KernelConfigLoader.load(yaml("""
                termination:
                  min_density: 50
                  min_ratio: 3
                """));
        assertEquals(new TerminationConfig(50, 30, 3.0), config.termination());
    }

    @Test void rejectsNonIntegerBound() {
        assertThrows(IllegalArgumentException.class, () -> KernelConfigLoader.load(yaml("max_nodes: many\n")));
    }

    @Test void rejectsOutOfRangeThreshold() {
        assertThrows(IllegalArgumentException.class,
                () -> KernelConfigLoader.load(yaml("termination:\n  max_entropy: 150\n")));
    }

    @Test void rejectsNonMappingDocument() {
        assertThrows(IllegalArgumentException.class, () -> KernelConfigLoader.load(yaml("just text\n")));
    }

    @Test void loadsFromPath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("kernel.yaml");
        Files.writeString(file, "max_depth: 2\nmax_nodes: 64\n");
        DecompositionConfig config = KernelConfigLoader.load(file);
        assertEquals(2, config.maxDepth());
        assertEquals(64, config.maxNodes());
    }
}
