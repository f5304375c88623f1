package no.cantara.intent.canonical;

/**
 * A typed value with a JSON-like projection that {@link Canonicalizer} hashes.
 *
 * <p>Implementations return plain maps, lists, strings, booleans and integers,
 * using the wire field names. Optional fields that are absent are left out of
 * the map rather than written as {@code null}.
 */
public interface CanonicalValue {

    Object toCanonicalValue();
}
