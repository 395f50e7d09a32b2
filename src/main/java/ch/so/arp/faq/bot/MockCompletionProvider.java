package ch.so.arp.faq.bot;

/**
 * Deterministic {@link CompletionProvider} used in tests and local development
 * where no Ollama server should be contacted. It answers with the grounding
 * context found in the prompt.
 */
class MockCompletionProvider implements CompletionProvider {

    @Override
    public String complete(String prompt) {
        String context = extractContext(prompt);
        if (context.isEmpty()) {
            return "[mocked answer] Start Ollama and set faq.bot.mock-ollama=false to reach the real model.";
        }
        return "[mocked answer] " + context;
    }

    private String extractContext(String prompt) {
        if (prompt == null) {
            return "";
        }
        int start = prompt.indexOf(AnswerComposer.CONTEXT_LABEL);
        if (start < 0) {
            return "";
        }
        int from = start + AnswerComposer.CONTEXT_LABEL.length();
        int end = prompt.indexOf('\n', from);
        return (end < 0 ? prompt.substring(from) : prompt.substring(from, end)).strip();
    }
}
