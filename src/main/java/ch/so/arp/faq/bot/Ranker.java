package ch.so.arp.faq.bot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Scores every indexed entry against a query vector by cosine similarity.
 */
public class Ranker {

    private static final Comparator<ScoredEntry> BY_SCORE_DESCENDING = Comparator
            .comparingDouble(ScoredEntry::score).reversed()
            .thenComparingInt(ScoredEntry::position);

    /**
     * Rank the whole index. The result is ordered by descending score; entries
     * with the same score keep their corpus order.
     *
     * @param queryVector embedding of the query
     * @param index       the corpus index
     * @return one scored entry per indexed entry
     */
    public List<ScoredEntry> rank(EmbeddingVector queryVector, CorpusIndex index) {
        Objects.requireNonNull(queryVector, "queryVector");
        Objects.requireNonNull(index, "index");
        List<ScoredEntry> scored = new ArrayList<>(index.size());
        for (IndexedEntry indexed : index.entries()) {
            scored.add(new ScoredEntry(indexed.position(), indexed.entry(), cosine(queryVector, indexed.vector())));
        }
        scored.sort(BY_SCORE_DESCENDING);
        return scored;
    }

    /**
     * Cosine similarity of two vectors. Empty vectors, vectors of different
     * length and zero vectors score {@code 0.0}; the result never is NaN.
     */
    public static double cosine(EmbeddingVector a, EmbeddingVector b) {
        if (a.isEmpty() || b.isEmpty() || a.dimension() != b.dimension()) {
            return 0.0d;
        }
        double dot = 0.0d;
        double normA = 0.0d;
        double normB = 0.0d;
        for (int i = 0; i < a.dimension(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0.0d || normB == 0.0d) {
            return 0.0d;
        }
        double score = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        if (!Double.isFinite(score)) {
            return 0.0d;
        }
        // rounding can push identical vectors slightly past one
        return Math.max(-1.0d, Math.min(1.0d, score));
    }
}
