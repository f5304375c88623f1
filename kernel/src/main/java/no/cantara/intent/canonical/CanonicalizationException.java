package no.cantara.intent.canonical;

/**
 * Thrown when a value cannot be canonicalized: a cycle, a non-string map key,
 * a non-finite or fractional number, or a type outside the JSON-like model.
 */
public class CanonicalizationException extends RuntimeException {

    private final String path;

    public CanonicalizationException(String path, String message) {
        super(message);
        this.path = path;
    }

    /** JSON path ({@code $}-rooted) of the offending value. */
    public String path() {
        return path;
    }
}
