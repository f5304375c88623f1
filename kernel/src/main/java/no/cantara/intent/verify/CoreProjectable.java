package no.cantara.intent.verify;

import java.util.Map;

/**
 * Splits an artifact into its hashed core. Ephemeral fields (timestamps, display
 * data, measurements) are dropped and arrays with a documented order are put in it.
 */
@FunctionalInterface
public interface CoreProjectable {

    Map<String, Object> computeCore(Map<String, Object> artifact);
}
