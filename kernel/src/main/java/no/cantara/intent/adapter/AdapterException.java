package no.cantara.intent.adapter;

/**
 * Failure at the model adapter boundary. The kernel never retries; callers that
 * do use {@link #isRetryable()}.
 */
public class AdapterException extends Exception {

    public enum Code {
        RATE_LIMITED(true),
        CONTEXT_TOO_LONG(false),
        INVALID_REQUEST(false),
        MODEL_ERROR(false),
        NETWORK_ERROR(true),
        TIMEOUT(true),
        REPLAY_MISS(false),
        ADAPTER_ERROR(false);

        private final boolean retryableByDefault;

        Code(boolean retryableByDefault) {
            this.retryableByDefault = retryableByDefault;
        }

        public boolean retryableByDefault() {
            return retryableByDefault;
        }
    }

    private final Code code;
    private final boolean retryable;

    public AdapterException(Code code, String message) {
        this(code, message, code.retryableByDefault(), null);
    }

    public AdapterException(Code code, String message, boolean retryable) {
        this(code, message, retryable, null);
    }

    public AdapterException(Code code, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retryable = retryable;
    }

    public Code code() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }

    @Override
    public String toString() {
        return "AdapterException[" + code + (retryable ? ", retryable" : "") + "]: " + getMessage();
    }
}
