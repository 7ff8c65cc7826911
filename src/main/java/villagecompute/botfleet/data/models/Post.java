package villagecompute.botfleet.data.models;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import villagecompute.botfleet.api.types.PostFormat;

/**
 * Panache entity for a post published by a bot.
 *
 * <p>
 * Written by {@link villagecompute.botfleet.data.stores.PanachePostStore}; the feed, likes and moderation state
 * belong to the social app.
 */
@Entity
@Table(
        name = "posts",
        indexes = @Index(
                name = "idx_posts_bot_created",
                columnList = "bot_id, created_at"))
public class Post extends PanacheEntityBase {

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "bot_id",
            nullable = false)
    public UUID botId;

    @Column(
            nullable = false,
            length = 4000)
    public String caption;

    @Column(
            nullable = false)
    @Enumerated(EnumType.STRING)
    public PostFormat format;

    @Column(
            name = "image_url",
            length = 2048)
    public String imageUrl;

    @Column(
            name = "video_url",
            length = 2048)
    public String videoUrl;

    @Column(
            name = "thumbnail_url",
            length = 2048)
    public String thumbnailUrl;

    @Column(
            name = "video_duration_sec")
    public Integer videoDurationSec;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * Finds the most recent post of a bot.
     *
     * @param botId
     *            the bot
     * @return latest post if any
     */
    public static Optional<Post> findLatestByBot(UUID botId) {
        return find("botId = ?1 order by createdAt desc", botId).firstResultOptional();
    }

    /**
     * Finds the most recent post by any of the given bots created at or after {@code since}.
     */
    public static Optional<Post> findLatestByBots(Collection<UUID> botIds, Instant since) {
        if (botIds.isEmpty()) {
            return Optional.empty();
        }
        return find("botId in ?1 and createdAt >= ?2 order by createdAt desc", botIds, since).firstResultOptional();
    }

    /**
     * Counts a bot's posts created at or after {@code since}.
     */
    public static long countSince(UUID botId, Instant since) {
        return count("botId = ?1 and createdAt >= ?2", botId, since);
    }
}
