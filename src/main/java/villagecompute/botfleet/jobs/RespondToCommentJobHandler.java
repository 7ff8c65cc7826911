package villagecompute.botfleet.jobs;

import java.util.Map;
import java.util.UUID;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.botfleet.api.types.CaptionRequestType;
import villagecompute.botfleet.api.types.PromptType;
import villagecompute.botfleet.api.types.ToolContextType;
import villagecompute.botfleet.data.models.Bot;
import villagecompute.botfleet.data.models.Post;
import villagecompute.botfleet.data.models.PostComment;
import villagecompute.botfleet.data.stores.BotStore;
import villagecompute.botfleet.data.stores.PostStore;
import villagecompute.botfleet.exceptions.GenerationException;
import villagecompute.botfleet.exceptions.ResourceNotFoundException;
import villagecompute.botfleet.exceptions.ValidationException;
import villagecompute.botfleet.services.CapabilityRouterService;
import villagecompute.botfleet.services.PromptComposer;

/**
 * Job handler that makes a bot reply, in character, to a comment left on one of its posts.
 *
 * <p>
 * <b>Payload:</b> {@code commentId} (UUID string, required). Replies are idempotent: if the bot already replied to the
 * comment the job succeeds without another call.
 */
@ApplicationScoped
public class RespondToCommentJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(RespondToCommentJobHandler.class);

    static final int REPLY_MAX_TOKENS = 150;

    @Inject
    BotStore botStore;

    @Inject
    PostStore postStore;

    @Inject
    CapabilityRouterService router;

    @Inject
    PromptComposer promptComposer;

    @Override
    public JobType handlesType() {
        return JobType.RESPOND_TO_COMMENT;
    }

    @Override
    public void execute(Long jobId, UUID botId, Map<String, Object> payload) throws Exception {
        Object rawCommentId = payload.get("commentId");
        if (rawCommentId == null) {
            throw new ValidationException("RESPOND_TO_COMMENT requires commentId in payload");
        }
        UUID commentId;
        try {
            commentId = UUID.fromString(rawCommentId.toString());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid commentId: " + rawCommentId, e);
        }

        Bot bot = botStore.findById(botId).orElseThrow(() -> new ResourceNotFoundException("Bot not found: " + botId));
        PostComment comment = postStore.findComment(commentId)
                .orElseThrow(() -> new ResourceNotFoundException("Comment not found: " + commentId));
        Post post = postStore.findPost(comment.postId)
                .orElseThrow(() -> new ResourceNotFoundException("Post not found: " + comment.postId));

        if (!botId.equals(post.botId)) {
            throw new ValidationException("Comment " + commentId + " is not on a post by @" + bot.handle);
        }
        if (postStore.hasCommented(post.id, botId, commentId)) {
            LOG.debugf("Job %d: @%s already replied to comment %s", jobId, bot.handle, commentId);
            return;
        }

        PromptType prompt = promptComposer.commentReplyPrompt(bot, post, comment);
        String reply = router.generateChat(new CaptionRequestType(prompt.systemPrompt(), prompt.userPrompt(),
                REPLY_MAX_TOKENS, CaptionRequestType.DEFAULT_TEMPERATURE, false), ToolContextType.forBot(bot));
        if (reply == null || reply.isBlank()) {
            throw new GenerationException("Empty reply from chat model");
        }

        UUID replyId = postStore.addComment(post.id, botId, commentId, reply.trim());
        LOG.infof("Job %d: @%s replied to comment %s (reply %s)", jobId, bot.handle, commentId, replyId);
    }
}
