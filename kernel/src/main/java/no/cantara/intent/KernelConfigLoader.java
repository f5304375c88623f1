package no.cantara.intent;

import no.cantara.intent.decompose.DecompositionConfig;
import no.cantara.intent.measure.TerminationConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads decomposition settings from YAML. Every key is optional and falls back to
 * {@link DecompositionConfig#DEFAULTS}.
 *
 * <pre>
 * termination:
 *   min_density: 60
 *   max_entropy: 30
 *   min_ratio: 2.0
 * max_depth: 12
 * max_nodes: 1024
 * </pre>
 */
public final class KernelConfigLoader {

    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    private KernelConfigLoader() {}

    public static DecompositionConfig load(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        }
    }

    public static DecompositionConfig load(InputStream is) {
        Object data = YAML.load(is);
        if (data == null) {
            return DecompositionConfig.DEFAULTS;
        }
        if (!(data instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Kernel config must be a mapping");
        }
        return fromMap(map);
    }

    static DecompositionConfig fromMap(Map<?, ?> data) {
        TerminationConfig defaults = TerminationConfig.DEFAULTS;
        TerminationConfig termination = defaults;
        Object rawTermination = data.get("termination");
        if (rawTermination != null) {
            if (!(rawTermination instanceof Map<?, ?> t)) {
                throw new IllegalArgumentException("termination must be a mapping");
            }
            termination = new TerminationConfig(
                    intValue(t, "min_density", defaults.minDensity()),
                    intValue(t, "max_entropy", defaults.maxEntropy()),
                    doubleValue(t, "min_ratio", defaults.minRatio()));
        }
        return new DecompositionConfig(termination,
                intValue(data, "max_depth", DecompositionConfig.DEFAULT_MAX_DEPTH),
                intValue(data, "max_nodes", DecompositionConfig.DEFAULT_MAX_NODES));
    }

    private static int intValue(Map<?, ?> map, String key, int fallback) {
        Object value = map.get(key);
        if (value == null) return fallback;
        if (value instanceof Integer i) return i;
        throw new IllegalArgumentException(key + " must be an integer, got " + value);
    }

    private static double doubleValue(Map<?, ?> map, String key, double fallback) {
        Object value = map.get(key);
        if (value == null) return fallback;
        if (value instanceof Number n) return n.doubleValue();
        throw new IllegalArgumentException(key + " must be a number, got " + value);
    }
}
