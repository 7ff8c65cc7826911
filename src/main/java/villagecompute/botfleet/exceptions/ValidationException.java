package villagecompute.botfleet.exceptions;

/**
 * Exception thrown when a job payload or method argument is malformed (missing bot id, missing comment text, etc.).
 *
 * <p>
 * Extends RuntimeException per project standards.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
