package villagecompute.botfleet.services;

import jakarta.enterprise.context.ApplicationScoped;

import villagecompute.botfleet.api.types.PromptType;
import villagecompute.botfleet.data.models.Bot;
import villagecompute.botfleet.data.models.Post;
import villagecompute.botfleet.data.models.PostComment;

/**
 * Fixed-template {@link PromptComposer} built from the bot's name, bio, niche and aesthetic.
 */
@ApplicationScoped
public class TemplatePromptComposer implements PromptComposer {

    static final int MAX_QUOTED_POST_CHARS = 300;

    @Override
    public PromptType captionPrompt(Bot bot) {
        String system = persona(bot) + "\n\nWrite one social media post caption in your own voice. "
                + "Keep it under 280 characters. No hashtags unless they are part of your style. "
                + "Write the caption directly, no preamble.";
        String user = bot.niche != null && !bot.niche.isBlank()
                ? "Write today's post about something in " + bot.niche + "."
                : "Write today's post.";
        return new PromptType(system, user);
    }

    @Override
    public String imagePrompt(Bot bot, String caption) {
        StringBuilder prompt = new StringBuilder(caption);
        if (bot.aesthetic != null && !bot.aesthetic.isBlank()) {
            prompt.append(". Visual style: ").append(bot.aesthetic);
        }
        if (bot.characterRefDescription != null && !bot.characterRefDescription.isBlank()) {
            prompt.append(". Main subject: ").append(bot.characterRefDescription);
        }
        return prompt.toString();
    }

    @Override
    public String videoPrompt(Bot bot, String caption, int durationSec) {
        String pacing = durationSec <= 6 ? "a single continuous shot" : "a short sequence with gentle camera movement";
        return imagePrompt(bot, caption) + ". Vertical video, " + pacing + ".";
    }

    @Override
    public PromptType crewReplyPrompt(Bot responder, Bot author, Post post) {
        String system = persona(responder) + "\n\nYou're reading a post by your crew-mate " + author.name + " (@"
                + author.handle + "):\n\"" + quote(post.caption) + "\"\n\n"
                + "Write a short reply (1-2 sentences, max 200 chars) in YOUR character, not theirs. "
                + "React genuinely: agree, playfully disagree, or build on their idea. "
                + "No hashtags, no meta-commentary. Write the reply directly.";
        return new PromptType(system, "Write your reply to your crew-mate's post.");
    }

    @Override
    public PromptType commentReplyPrompt(Bot bot, Post post, PostComment comment) {
        String author = comment.authorHandle != null ? "@" + comment.authorHandle : "someone";
        String system = persona(bot) + "\n\nSomeone commented on your post.\n\nYOUR POST: \"" + quote(post.caption)
                + "\"\n\nCOMMENT by " + author + ": \"" + comment.body + "\"\n\n"
                + "Write a short reply (1-2 sentences, max 200 chars) that stays in your character and responds "
                + "to the comment naturally. No hashtags, no \"thanks for your comment\". Write the reply directly.";
        return new PromptType(system, "Write your reply.");
    }

    @Override
    public PromptType characterReferencePrompt() {
        String system = "You are an expert visual analyst. Describe the character or subject in this reference image "
                + "so the description can be reused in future image generation prompts to keep it visually "
                + "consistent. Cover physical appearance, clothing, color palette, art style and key motifs. "
                + "Write a single paragraph of 100-200 words, starting directly with the description.";
        return new PromptType(system,
                "Analyze this character reference image and provide a detailed, reusable visual description.");
    }

    private static String persona(Bot bot) {
        StringBuilder persona = new StringBuilder("You are ").append(bot.name != null ? bot.name : bot.handle)
                .append(" (@").append(bot.handle).append(").");
        if (bot.bio != null && !bot.bio.isBlank()) {
            persona.append("\nBio: ").append(bot.bio);
        }
        if (bot.niche != null && !bot.niche.isBlank()) {
            persona.append("\nNiche: ").append(bot.niche);
        }
        return persona.toString();
    }

    private static String quote(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > MAX_QUOTED_POST_CHARS ? text.substring(0, MAX_QUOTED_POST_CHARS) : text;
    }
}
