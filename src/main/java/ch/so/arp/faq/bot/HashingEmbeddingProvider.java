package ch.so.arp.faq.bot;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline embedding provider used when no Ollama server is configured. Every
 * lower-cased word is hashed into one of a fixed number of buckets and the
 * resulting bag-of-words vector is L2-normalised. A user question that shares
 * most of its words with a stored question therefore scores close to the
 * stored entry, so the FAQ bot gives useful answers during local development
 * and tests without a model. Identical texts always yield identical vectors.
 */
class HashingEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(HashingEmbeddingProvider.class);

    private final int dimensions;

    HashingEmbeddingProvider(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
        LOGGER.info("Using hashed bag-of-words embeddings with {} dimensions", dimensions);
    }

    @Override
    public EmbeddingVector embed(String text) {
        double[] vector = new double[dimensions];
        if (text != null) {
            for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
                if (!token.isEmpty()) {
                    vector[Math.floorMod(token.hashCode(), dimensions)] += 1.0d;
                }
            }
        }
        double norm = 0.0d;
        for (double value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        if (norm > 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] = vector[i] / norm;
            }
        }
        return EmbeddingVector.of(vector);
    }
}
