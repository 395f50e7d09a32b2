package ch.so.arp.faq.bot;

/**
 * Describes how an {@link AnswerResult} was produced.
 */
public enum AnswerOutcome {

    /** A confident match was found and the completion provider produced the text. */
    ANSWERED,

    /** The best score stayed below the confidence threshold, or the corpus is empty. */
    NO_CONFIDENT_MATCH,

    /** The query could not be embedded, so no ranking took place. */
    EMBEDDING_UNAVAILABLE,

    /** Retrieval found a match but the completion provider failed. */
    COMPLETION_UNAVAILABLE
}
