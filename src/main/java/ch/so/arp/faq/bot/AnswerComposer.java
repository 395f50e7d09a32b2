package ch.so.arp.faq.bot;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a ranking into an {@link AnswerResult}. When the best entry is a
 * confident match its stored answer grounds a prompt for the completion
 * provider; otherwise a fixed fallback message is returned.
 */
public class AnswerComposer {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnswerComposer.class);

    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.5d;

    public static final String NO_MATCH_MESSAGE =
            "I could not find a close match. Please rephrase or ask a team member.";

    public static final String COMPLETION_UNAVAILABLE_MESSAGE =
            "I found a similar answer but could not reach the AI writer. Please try again later.";

    static final String CONTEXT_LABEL = "Context answer: ";

    static final String QUESTION_LABEL = "User question: ";

    private static final String INSTRUCTIONS = """
            You are a helpful FAQ assistant. Use the provided answer as trusted context to respond to \
            the user's question. If the context does not cover the question, say you are unsure and \
            ask the user to rephrase.
            """;

    private final double confidenceThreshold;

    public AnswerComposer() {
        this(DEFAULT_CONFIDENCE_THRESHOLD);
    }

    public AnswerComposer(double confidenceThreshold) {
        if (Double.isNaN(confidenceThreshold) || confidenceThreshold < -1.0d || confidenceThreshold > 1.0d) {
            throw new IllegalArgumentException("confidence threshold must be within [-1, 1] but was "
                    + confidenceThreshold);
        }
        this.confidenceThreshold = confidenceThreshold;
    }

    public double confidenceThreshold() {
        return confidenceThreshold;
    }

    public AnswerResult compose(String query, List<ScoredEntry> ranked, CompletionProvider completionProvider) {
        Objects.requireNonNull(ranked, "ranked");
        Objects.requireNonNull(completionProvider, "completionProvider");
        if (ranked.isEmpty()) {
            return AnswerResult.withoutMatch(NO_MATCH_MESSAGE, 0.0d, AnswerOutcome.NO_CONFIDENT_MATCH);
        }
        ScoredEntry top = ranked.get(0);
        if (top.score() < confidenceThreshold) {
            LOGGER.debug("Best match '{}' scored {} which is below the threshold {}", top.entry().question(),
                    top.score(), confidenceThreshold);
            return AnswerResult.withoutMatch(NO_MATCH_MESSAGE, top.score(), AnswerOutcome.NO_CONFIDENT_MATCH);
        }

        String prompt = buildPrompt(query, top.entry().answer());
        try {
            String text = completionProvider.complete(prompt);
            if (text == null) {
                throw new CompletionUnavailableException("Completion provider returned no text");
            }
            return AnswerResult.withMatch(text, top.entry().question(), top.score(), AnswerOutcome.ANSWERED);
        } catch (RuntimeException ex) {
            LOGGER.warn("Completion failed for matched question '{}': {}", top.entry().question(), ex.getMessage(),
                    ex);
            return AnswerResult.withMatch(degradedText(ex), top.entry().question(), top.score(),
                    AnswerOutcome.COMPLETION_UNAVAILABLE);
        }
    }

    /**
     * Prompt that grounds the model on a single stored answer and asks for a
     * short reply in two to three sentences.
     */
    static String buildPrompt(String query, String contextAnswer) {
        return INSTRUCTIONS
                + "\n"
                + CONTEXT_LABEL + contextAnswer + "\n"
                + QUESTION_LABEL + query + "\n"
                + "Respond in 2-3 friendly sentences.";
    }

    private static String degradedText(RuntimeException failure) {
        if (failure.getMessage() == null || failure.getMessage().isBlank()) {
            return COMPLETION_UNAVAILABLE_MESSAGE;
        }
        return COMPLETION_UNAVAILABLE_MESSAGE + " Technical details: " + failure.getMessage();
    }
}
