package ch.so.arp.faq.bot;

import java.util.Objects;

/**
 * Corpus entry together with the embedding computed for it at index build time.
 */
public record IndexedEntry(int position, CorpusEntry entry, EmbeddingVector vector) {

    public IndexedEntry {
        Objects.requireNonNull(entry, "entry");
        Objects.requireNonNull(vector, "vector");
    }
}
