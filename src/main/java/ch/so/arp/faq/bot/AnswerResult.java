package ch.so.arp.faq.bot;

import java.util.Objects;
import java.util.Optional;

/**
 * Answer returned by {@link RetrievalService#answer(String)}. Degraded answers
 * still carry the retrieval metadata that was available when the failure
 * occurred.
 */
public record AnswerResult(String text, Optional<String> matchedQuestion, double score, AnswerOutcome outcome) {

    public AnswerResult {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(matchedQuestion, "matchedQuestion");
        Objects.requireNonNull(outcome, "outcome");
    }

    static AnswerResult withoutMatch(String text, double score, AnswerOutcome outcome) {
        return new AnswerResult(text, Optional.empty(), score, outcome);
    }

    static AnswerResult withMatch(String text, String matchedQuestion, double score, AnswerOutcome outcome) {
        return new AnswerResult(text, Optional.of(matchedQuestion), score, outcome);
    }

    public boolean isDegraded() {
        return outcome == AnswerOutcome.EMBEDDING_UNAVAILABLE || outcome == AnswerOutcome.COMPLETION_UNAVAILABLE;
    }
}
