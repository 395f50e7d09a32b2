package ch.so.arp.faq.bot;

/**
 * Raised by an {@link EmbeddingProvider} when no embedding could be obtained,
 * for example because the provider is unreachable, timed out or returned a
 * malformed payload.
 */
public class EmbeddingUnavailableException extends RuntimeException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
