package ch.so.arp.faq.bot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only collection of corpus entries and their embeddings. The index is
 * built once and never changes afterwards, so it can be shared between
 * concurrent requests without locking. Its entries appear in corpus order.
 */
public final class CorpusIndex {

    private static final Logger LOGGER = LoggerFactory.getLogger(CorpusIndex.class);

    private final List<IndexedEntry> entries;
    private final int dimension;

    private CorpusIndex(List<IndexedEntry> entries, int dimension) {
        this.entries = Collections.unmodifiableList(entries);
        this.dimension = dimension;
    }

    /**
     * Embed every entry sequentially. An entry whose embedding fails is kept
     * with {@link EmbeddingVector#EMPTY} so that the service can still start.
     */
    public static CorpusIndex build(List<CorpusEntry> corpus, EmbeddingProvider embeddingProvider) {
        Objects.requireNonNull(corpus, "corpus");
        Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        List<EmbeddingVector> vectors = new ArrayList<>(corpus.size());
        for (int i = 0; i < corpus.size(); i++) {
            vectors.add(embedEntry(i, corpus.get(i), embeddingProvider));
        }
        return assemble(corpus, vectors);
    }

    /**
     * Embed the entries concurrently on the given executor. The resulting
     * index has the same order as the corpus.
     */
    public static CorpusIndex build(List<CorpusEntry> corpus, EmbeddingProvider embeddingProvider, Executor executor) {
        Objects.requireNonNull(corpus, "corpus");
        Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        Objects.requireNonNull(executor, "executor");
        List<CompletableFuture<EmbeddingVector>> futures = new ArrayList<>(corpus.size());
        for (int i = 0; i < corpus.size(); i++) {
            int position = i;
            CorpusEntry entry = corpus.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> embedEntry(position, entry, embeddingProvider), executor));
        }
        List<EmbeddingVector> vectors = futures.stream().map(CompletableFuture::join).toList();
        return assemble(corpus, vectors);
    }

    private static EmbeddingVector embedEntry(int position, CorpusEntry entry, EmbeddingProvider embeddingProvider) {
        try {
            EmbeddingVector vector = embeddingProvider.embed(entry.embeddingText());
            return vector == null ? EmbeddingVector.EMPTY : vector;
        } catch (RuntimeException ex) {
            LOGGER.warn("Embedding failed for corpus entry {} ('{}'): {}", position, entry.question(), ex.getMessage(), ex);
            return EmbeddingVector.EMPTY;
        }
    }

    private static CorpusIndex assemble(List<CorpusEntry> corpus, List<EmbeddingVector> vectors) {
        int dimension = 0;
        int missing = 0;
        List<IndexedEntry> indexed = new ArrayList<>(corpus.size());
        for (int i = 0; i < corpus.size(); i++) {
            EmbeddingVector vector = vectors.get(i);
            if (!vector.isEmpty()) {
                if (dimension == 0) {
                    dimension = vector.dimension();
                } else if (vector.dimension() != dimension) {
                    LOGGER.warn("Discarding embedding of corpus entry {}: dimension {} differs from {}", i,
                            vector.dimension(), dimension);
                    vector = EmbeddingVector.EMPTY;
                }
            }
            if (vector.isEmpty()) {
                missing++;
            }
            indexed.add(new IndexedEntry(i, corpus.get(i), vector));
        }
        LOGGER.info("Built corpus index with {} entries (dimension={}, missing embeddings={})", indexed.size(),
                dimension, missing);
        return new CorpusIndex(indexed, dimension);
    }

    public List<IndexedEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Dimension of the embeddings in this index, or {@code 0} when no entry
     * could be embedded.
     */
    public int dimension() {
        return dimension;
    }

    public long missingEmbeddings() {
        return entries.stream().filter(entry -> entry.vector().isEmpty()).count();
    }
}
