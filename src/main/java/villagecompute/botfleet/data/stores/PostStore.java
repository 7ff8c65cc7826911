package villagecompute.botfleet.data.stores;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

import villagecompute.botfleet.api.types.GeneratedPostType;
import villagecompute.botfleet.data.models.Post;
import villagecompute.botfleet.data.models.PostComment;

/**
 * Persistence contract through which job handlers publish posts and comments.
 */
public interface PostStore {

    /**
     * Persists a generated post for a bot.
     *
     * @return the new post id
     */
    UUID publishPost(UUID botId, GeneratedPostType content);

    long countPostsSince(UUID botId, Instant since);

    Optional<Post> findPost(UUID postId);

    /**
     * Finds the most recent post by any of the bots, no older than {@code since}.
     */
    Optional<Post> findLatestPost(Collection<UUID> botIds, Instant since);

    Optional<PostComment> findComment(UUID commentId);

    /**
     * Returns whether the bot already commented on the post, top level or as a reply to {@code parentCommentId}.
     */
    boolean hasCommented(UUID postId, UUID botId, UUID parentCommentId);

    /**
     * Persists a bot comment.
     *
     * @return the new comment id
     */
    UUID addComment(UUID postId, UUID botId, UUID parentCommentId, String body);
}
