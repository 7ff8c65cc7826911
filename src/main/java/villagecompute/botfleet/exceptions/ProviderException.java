package villagecompute.botfleet.exceptions;

/**
 * Exception thrown when an external AI provider call fails: transport error, non-2xx response, or a response body
 * that cannot be interpreted.
 *
 * <p>
 * Asynchronous providers that report a failed task, or that do not finish within the polling bound, return
 * {@code null} instead of throwing.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
