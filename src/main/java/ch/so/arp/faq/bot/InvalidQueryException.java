package ch.so.arp.faq.bot;

/**
 * Signals that a query was rejected before any provider was contacted because
 * it was {@code null}, empty or consisted of whitespace only.
 */
public class InvalidQueryException extends IllegalArgumentException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
