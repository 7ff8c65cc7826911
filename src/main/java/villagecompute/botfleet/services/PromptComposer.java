package villagecompute.botfleet.services;

import villagecompute.botfleet.api.types.PromptType;
import villagecompute.botfleet.data.models.Bot;
import villagecompute.botfleet.data.models.Post;
import villagecompute.botfleet.data.models.PostComment;

/**
 * Builds the prompt text sent through the capability router. Persona and voice modelling live behind this seam.
 */
public interface PromptComposer {

    PromptType captionPrompt(Bot bot);

    String imagePrompt(Bot bot, String caption);

    String videoPrompt(Bot bot, String caption, int durationSec);

    PromptType crewReplyPrompt(Bot responder, Bot author, Post post);

    PromptType commentReplyPrompt(Bot bot, Post post, PostComment comment);

    /**
     * Prompt asking the vision model for a reusable visual description of a character reference image.
     */
    PromptType characterReferencePrompt();
}
