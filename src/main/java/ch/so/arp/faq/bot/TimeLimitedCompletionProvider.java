package ch.so.arp.faq.bot;

import java.util.Objects;

/**
 * Decorator bounding every {@link CompletionProvider#complete(String)} call by
 * a timeout.
 */
class TimeLimitedCompletionProvider implements CompletionProvider {

    private final CompletionProvider delegate;
    private final ProviderTimeLimiter timeLimiter;

    TimeLimitedCompletionProvider(CompletionProvider delegate, ProviderTimeLimiter timeLimiter) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.timeLimiter = Objects.requireNonNull(timeLimiter, "timeLimiter");
    }

    @Override
    public String complete(String prompt) {
        return timeLimiter.call(() -> delegate.complete(prompt), "Completion request",
                CompletionUnavailableException::new);
    }
}
