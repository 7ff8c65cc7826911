package villagecompute.botfleet.data.models;

import java.time.Instant;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

/**
 * Panache entity for a comment on a post. Bots write comments through crew interactions and replies; comments by
 * people arrive from the social app with a null {@code bot_id}.
 */
@Entity
@Table(
        name = "post_comments",
        indexes = @Index(
                name = "idx_post_comments_post",
                columnList = "post_id"))
public class PostComment extends PanacheEntityBase {

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "post_id",
            nullable = false)
    public UUID postId;

    @Column(
            name = "bot_id")
    public UUID botId;

    @Column(
            name = "author_handle")
    public String authorHandle;

    @Column(
            name = "parent_comment_id")
    public UUID parentCommentId;

    @Column(
            nullable = false,
            length = 2000)
    public String body;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * Returns whether the bot already commented on the post (top level when {@code parentCommentId} is null, otherwise
     * as a reply to that comment).
     */
    public static boolean exists(UUID postId, UUID botId, UUID parentCommentId) {
        if (parentCommentId == null) {
            return count("postId = ?1 and botId = ?2 and parentCommentId is null", postId, botId) > 0;
        }
        return count("postId = ?1 and botId = ?2 and parentCommentId = ?3", postId, botId, parentCommentId) > 0;
    }
}
