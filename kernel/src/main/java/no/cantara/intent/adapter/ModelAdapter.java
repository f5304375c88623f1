package no.cantara.intent.adapter;

/**
 * The only way model output reaches the kernel's surroundings. Implementations
 * may call a live model, a recording or a replay; none of them is ever called
 * from inside {@code IntentKernel.transform}.
 */
public interface ModelAdapter {

    /** Stable instance identifier, {@code <kind>_<8 hex>}. */
    String adapterId();

    /** Model name, e.g. {@code mock} or a provider model id. */
    String modelId();

    TransformResult transform(String prompt, TransformContext context) throws AdapterException;

    default boolean isReady() {
        return true;
    }
}
