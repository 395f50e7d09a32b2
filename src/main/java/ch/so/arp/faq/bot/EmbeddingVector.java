package ch.so.arp.faq.bot;

import java.util.Arrays;

/**
 * Immutable embedding returned by an {@link EmbeddingProvider}. A vector of
 * length zero ({@link #EMPTY}) marks an embedding that could not be computed.
 */
public final class EmbeddingVector {

    public static final EmbeddingVector EMPTY = new EmbeddingVector(new double[0]);

    private final double[] values;

    private EmbeddingVector(double[] values) {
        this.values = values;
    }

    public static EmbeddingVector of(double... values) {
        if (values == null || values.length == 0) {
            return EMPTY;
        }
        return new EmbeddingVector(values.clone());
    }

    public static EmbeddingVector of(float[] values) {
        if (values == null || values.length == 0) {
            return EMPTY;
        }
        double[] copy = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i];
        }
        return new EmbeddingVector(copy);
    }

    public int dimension() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public double get(int index) {
        return values[index];
    }

    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof EmbeddingVector vector && Arrays.equals(values, vector.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "EmbeddingVector[dimension=" + values.length + "]";
    }
}
