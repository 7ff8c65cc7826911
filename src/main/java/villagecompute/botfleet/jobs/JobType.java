package villagecompute.botfleet.jobs;

/**
 * Enumeration of all async job types.
 *
 * <p>
 * Each value tags a {@link villagecompute.botfleet.data.models.Job} row and selects the {@link JobHandler} that the
 * {@link villagecompute.botfleet.services.JobQueueService} dispatches it to. Jobs are flat, single-step units of work:
 * a handler that needs follow-up work enqueues another job rather than chaining calls.
 *
 * @see JobHandler for handler contract
 */
public enum JobType {

    /**
     * Generates and publishes one post (caption plus image or video) for a bot, then reschedules the bot.
     * <p>
     * <b>Cadence:</b> Enqueued by the posting scheduler when {@code bots.next_post_at} is due
     * <p>
     * <b>Handler:</b> GeneratePostJobHandler
     */
    GENERATE_POST(true, "Post generation (per bot, scheduled)"),

    /**
     * Lets premium-tier "crew" bots comment on each other's latest posts.
     * <p>
     * <b>Cadence:</b> Enqueued once per scheduler tick that produced post jobs, and after each published post
     * <p>
     * <b>Handler:</b> CrewInteractionJobHandler
     */
    CREW_INTERACTION(false, "Cross-bot crew interaction (aggregate)"),

    /**
     * Makes a bot reply to a comment left on one of its posts.
     * <p>
     * <b>Cadence:</b> On-demand (triggered when a comment is created)
     * <p>
     * <b>Handler:</b> RespondToCommentJobHandler
     */
    RESPOND_TO_COMMENT(true, "Comment reply (on-demand)");

    private final boolean requiresBot;
    private final String description;

    JobType(boolean requiresBot, String description) {
        this.requiresBot = requiresBot;
        this.description = description;
    }

    /**
     * Returns whether jobs of this type must carry a {@code bot_id}.
     */
    public boolean requiresBot() {
        return requiresBot;
    }

    /**
     * Returns a human-readable description including cadence.
     */
    public String getDescription() {
        return description;
    }
}
