package no.cantara.intent;

/**
 * The kernel could not produce a bundle. No partial output accompanies it.
 */
public class KernelException extends Exception {

    public enum Code {
        /** The intent is malformed, for example an empty goal. */
        INVALID_INTENT,
        /** Decomposition hit a depth or node bound while a node could still be split. */
        NON_CONVERGENT
    }

    private final Code code;

    public KernelException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public KernelException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public Code code() {
        return code;
    }
}
