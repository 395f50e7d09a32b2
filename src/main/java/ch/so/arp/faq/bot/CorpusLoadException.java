package ch.so.arp.faq.bot;

/**
 * Thrown when the FAQ corpus cannot be read or contains invalid entries.
 */
public class CorpusLoadException extends IllegalStateException {

    public CorpusLoadException(String message) {
        super(message);
    }

    public CorpusLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
