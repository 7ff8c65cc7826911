package villagecompute.botfleet.exceptions;

/**
 * Exception thrown when a job references an entity that no longer exists (e.g., a deleted bot).
 *
 * <p>
 * Extends RuntimeException per project standards. Inside a job handler it surfaces as the job's {@code last_error}.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
