package villagecompute.botfleet.api.types;

import java.util.List;

/**
 * Outcome of one scheduler tick.
 *
 * @param due
 *            bots found due
 * @param enqueued
 *            post jobs enqueued
 * @param skipped
 *            due bots skipped because a post job was already pending
 * @param crewInteractionEnqueued
 *            whether the aggregate crew interaction job was enqueued
 * @param errors
 *            per-bot failures
 */
public record SchedulerTickResultType(int due, int enqueued, int skipped, boolean crewInteractionEnqueued,
        List<String> errors) {
}
