package no.cantara.intent.canonical;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads untrusted JSON artifacts into plain maps, lists and scalars.
 *
 * <p>Integers stay integral ({@code Integer}, {@code Long} or {@code BigInteger})
 * and fractional numbers become {@code BigDecimal}, so the canonicalizer sees
 * exactly what was written. Duplicate keys are rejected.
 */
public final class ArtifactJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
            .build();

    private ArtifactJson() {}

    /**
     * Parse JSON text.
     *
     * @throws IllegalArgumentException if the text is not valid JSON
     */
    public static Object parse(String json) {
        try {
            return MAPPER.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Read and parse a JSON file.
     *
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the content is not valid JSON
     */
    public static Object read(Path path) throws IOException {
        return parse(Files.readString(path));
    }
}
