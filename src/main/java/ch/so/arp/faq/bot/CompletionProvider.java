package ch.so.arp.faq.bot;

/**
 * Abstraction over the language model integration. Implementations can either
 * invoke a real model server or return predictable responses for testing.
 * Implementations must be safe for concurrent use.
 */
@FunctionalInterface
public interface CompletionProvider {

    /**
     * Generate text for the given prompt.
     *
     * @param prompt the complete prompt including grounding context
     * @return the generated text
     * @throws CompletionUnavailableException if the model could not be reached
     */
    String complete(String prompt);
}
