package ch.so.arp.faq.bot;

/**
 * Result of scoring one indexed entry against a query vector.
 */
public record ScoredEntry(int position, CorpusEntry entry, double score) {
}
