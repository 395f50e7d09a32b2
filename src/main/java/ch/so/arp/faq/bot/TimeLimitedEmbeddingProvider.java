package ch.so.arp.faq.bot;

import java.util.Objects;

/**
 * Decorator bounding every {@link EmbeddingProvider#embed(String)} call by a
 * timeout.
 */
class TimeLimitedEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingProvider delegate;
    private final ProviderTimeLimiter timeLimiter;

    TimeLimitedEmbeddingProvider(EmbeddingProvider delegate, ProviderTimeLimiter timeLimiter) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.timeLimiter = Objects.requireNonNull(timeLimiter, "timeLimiter");
    }

    @Override
    public EmbeddingVector embed(String text) {
        return timeLimiter.call(() -> delegate.embed(text), "Embedding request",
                EmbeddingUnavailableException::new);
    }
}
