package ch.so.arp.faq.bot;

import java.util.Objects;

/**
 * Question/answer pair of the FAQ corpus. Its identity is the position inside
 * the corpus it was loaded from.
 */
public record CorpusEntry(String question, String answer) {

    public CorpusEntry {
        Objects.requireNonNull(question, "question");
        Objects.requireNonNull(answer, "answer");
    }

    /**
     * Text that is sent to the embedding provider when the index is built.
     */
    public String embeddingText() {
        return "Question: " + question + "\nAnswer: " + answer;
    }
}
