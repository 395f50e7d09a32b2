package ch.so.arp.faq.bot;

/**
 * Strategy abstraction used to compute embeddings for corpus entries and
 * queries. Implementations can either call a remote embedding API or provide
 * deterministic placeholders that are suited for tests and local development.
 * Implementations must be safe for concurrent use.
 */
@FunctionalInterface
public interface EmbeddingProvider {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding, never {@link EmbeddingVector#EMPTY}
     * @throws EmbeddingUnavailableException if no embedding could be obtained
     */
    EmbeddingVector embed(String text);
}
