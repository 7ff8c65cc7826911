package villagecompute.botfleet.data.stores;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;

import org.jboss.logging.Logger;

import villagecompute.botfleet.api.types.GeneratedPostType;
import villagecompute.botfleet.data.models.Post;
import villagecompute.botfleet.data.models.PostComment;

/**
 * {@link PostStore} backed by the {@link Post} and {@link PostComment} Panache entities.
 */
@ApplicationScoped
public class PanachePostStore implements PostStore {

    private static final Logger LOG = Logger.getLogger(PanachePostStore.class);

    @Override
    @Transactional
    public UUID publishPost(UUID botId, GeneratedPostType content) {
        Post post = new Post();
        post.botId = botId;
        post.caption = content.caption();
        post.format = content.format();
        post.imageUrl = content.imageUrl();
        post.videoUrl = content.videoUrl();
        post.thumbnailUrl = content.videoUrl() != null ? content.imageUrl() : null;
        post.videoDurationSec = content.videoDurationSec();
        post.createdAt = Instant.now();
        post.persist();
        LOG.debugf("Persisted %s post %s for bot %s", post.format, post.id, botId);
        return post.id;
    }

    @Override
    @Transactional
    public long countPostsSince(UUID botId, Instant since) {
        return Post.countSince(botId, since);
    }

    @Override
    @Transactional
    public Optional<Post> findPost(UUID postId) {
        return Post.findByIdOptional(postId);
    }

    @Override
    @Transactional
    public Optional<Post> findLatestPost(Collection<UUID> botIds, Instant since) {
        return Post.findLatestByBots(botIds, since);
    }

    @Override
    @Transactional
    public Optional<PostComment> findComment(UUID commentId) {
        return PostComment.findByIdOptional(commentId);
    }

    @Override
    @Transactional
    public boolean hasCommented(UUID postId, UUID botId, UUID parentCommentId) {
        return PostComment.exists(postId, botId, parentCommentId);
    }

    @Override
    @Transactional
    public UUID addComment(UUID postId, UUID botId, UUID parentCommentId, String body) {
        PostComment comment = new PostComment();
        comment.postId = postId;
        comment.botId = botId;
        comment.parentCommentId = parentCommentId;
        comment.body = body;
        comment.createdAt = Instant.now();
        comment.persist();
        return comment.id;
    }
}
