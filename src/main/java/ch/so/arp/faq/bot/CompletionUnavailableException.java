package ch.so.arp.faq.bot;

/**
 * Raised by a {@link CompletionProvider} when no text could be generated.
 */
public class CompletionUnavailableException extends RuntimeException {

    public CompletionUnavailableException(String message) {
        super(message);
    }

    public CompletionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
