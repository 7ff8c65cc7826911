package villagecompute.botfleet.api.types;

import java.util.List;

/**
 * Outcome of one worker poll.
 *
 * @param processed
 *            jobs claimed and dispatched
 * @param succeeded
 *            jobs marked SUCCEEDED
 * @param failed
 *            jobs sent to RETRY or FAILED
 * @param errors
 *            one {@code "Job <id>: <message>"} line per failure
 */
public record JobProcessResultType(int processed, int succeeded, int failed, List<String> errors) {

    public static final JobProcessResultType EMPTY = new JobProcessResultType(0, 0, 0, List.of());
}
