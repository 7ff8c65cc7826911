package villagecompute.botfleet.exceptions;

/**
 * Exception thrown by a job handler when it could not produce publishable content (empty caption, no media outside of
 * budget enforcement). The job queue converts it into a retry with backoff.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
