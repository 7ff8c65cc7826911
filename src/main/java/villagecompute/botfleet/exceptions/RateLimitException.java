package villagecompute.botfleet.exceptions;

/**
 * Exception thrown when an AI provider answers with HTTP 429.
 *
 * <p>
 * The capability router treats it like any other provider failure (next fallback, or a queue-level retry with
 * backoff). It is kept distinct so logs and telemetry can tell throttling apart from outages.
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public class RateLimitException extends ProviderException {

    public RateLimitException(String message) {
        super(message);
    }

    public RateLimitException(String message, Throwable cause) {
        super(message, cause);
    }
}
