package villagecompute.botfleet.data.models;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

/**
 * Panache entity for an autonomous content-generating bot, as seen by the scheduler and job handlers.
 *
 * <p>
 * Only the columns the task-execution core reads are mapped here; profile, persona and moderation data live with the
 * social app.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Primary identifier</li>
 * <li>{@code handle} (TEXT) - Public handle, used in logs</li>
 * <li>{@code owner_id} (UUID) - Owning user; bots of one owner form a crew</li>
 * <li>{@code owner_tier} (TEXT) - Owner subscription tier (FREE, BYOB_FREE, BYOB_PRO, SPARK, PULSE, GRID, ADMIN)</li>
 * <li>{@code trust_level} (DOUBLE) - 0..1 model-quality modifier</li>
 * <li>{@code posts_per_day} (INT) - Posting cadence</li>
 * <li>{@code is_scheduled} (BOOLEAN) - Whether the scheduler considers this bot</li>
 * <li>{@code is_byob} (BOOLEAN) - Bring-your-own-bot; never generated by the fleet</li>
 * <li>{@code next_post_at} (TIMESTAMPTZ) - Next due time</li>
 * <li>{@code video_duration_sec} (INT, nullable) - Preferred video length; null means image posts</li>
 * <li>{@code avatar_url} (TEXT, nullable) - Profile image, analyzed once to seed the character reference</li>
 * <li>{@code character_ref_url} (TEXT, nullable) - Reference image keeping the bot's subject consistent</li>
 * <li>{@code character_ref_description} (TEXT, nullable) - Vision-model description of the reference image</li>
 * <li>{@code daily_budget_cents}/{@code spent_today_cents} (INT) - Generation budget, maintained externally</li>
 * </ul>
 */
@Entity
@Table(
        name = "bots",
        indexes = @Index(
                name = "idx_bots_scheduled_next_post",
                columnList = "is_scheduled, next_post_at"))
public class Bot extends PanacheEntityBase {

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            nullable = false)
    public String handle;

    @Column(
            name = "owner_id")
    public UUID ownerId;

    @Column
    public String name;

    @Column
    public String bio;

    @Column
    public String niche;

    @Column
    public String aesthetic;

    @Column(
            name = "owner_tier",
            nullable = false)
    public String ownerTier;

    @Column(
            name = "trust_level",
            nullable = false)
    public double trustLevel = 1.0;

    @Column(
            name = "posts_per_day",
            nullable = false)
    public int postsPerDay = 1;

    @Column(
            name = "is_scheduled",
            nullable = false)
    public boolean scheduled;

    @Column(
            name = "is_byob",
            nullable = false)
    public boolean byob;

    @Column(
            name = "next_post_at")
    public Instant nextPostAt;

    @Column(
            name = "video_duration_sec")
    public Integer videoDurationSec;

    @Column(
            name = "avatar_url")
    public String avatarUrl;

    @Column(
            name = "character_ref_url")
    public String characterRefUrl;

    @Column(
            name = "character_ref_description",
            length = 2000)
    public String characterRefDescription;

    @Column(
            name = "daily_budget_cents")
    public Integer dailyBudgetCents;

    @Column(
            name = "spent_today_cents",
            nullable = false)
    public int spentTodayCents;

    @Column(
            name = "updated_at")
    public Instant updatedAt;

    /**
     * Finds bots eligible for posting whose next post time has passed.
     *
     * @param now
     *            reference time
     * @param tiers
     *            owner tiers that get AI generation
     * @return due bots, earliest first
     */
    public static List<Bot> findDue(Instant now, Collection<String> tiers) {
        return list("scheduled = true and byob = false and nextPostAt <= ?1 and ownerTier in ?2 order by nextPostAt",
                now, tiers);
    }

    /**
     * Finds fleet-generated (non-BYOB) bots of the given tiers, grouped by owner.
     *
     * @param tiers
     *            owner tiers
     * @return matching bots ordered by owner then handle
     */
    public static List<Bot> findGeneratedInTiers(Collection<String> tiers) {
        return list("byob = false and ownerTier in ?1 order by ownerId, handle", tiers);
    }
}
