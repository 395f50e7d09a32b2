package ch.so.arp.faq.bot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class RankerTest {

    private static final double TOLERANCE = 1e-9;

    private final Ranker ranker = new Ranker();

    @Test
    void cosineIsSymmetric() {
        EmbeddingVector a = EmbeddingVector.of(0.3d, -1.2d, 4.0d, 0.5d);
        EmbeddingVector b = EmbeddingVector.of(2.0d, 0.7d, -0.1d, 3.3d);

        assertThat(Ranker.cosine(a, b)).isEqualTo(Ranker.cosine(b, a));
    }

    @Test
    void cosineOfVectorWithItselfIsOne() {
        EmbeddingVector a = EmbeddingVector.of(0.1d, 0.2d, 0.3d, 123.456d, -7.0d);

        assertThat(Ranker.cosine(a, a)).isCloseTo(1.0d, within(TOLERANCE));
    }

    @Test
    void cosineOfOppositeVectorsIsMinusOne() {
        EmbeddingVector a = EmbeddingVector.of(1.0d, 2.0d, 3.0d);
        EmbeddingVector b = EmbeddingVector.of(-1.0d, -2.0d, -3.0d);

        assertThat(Ranker.cosine(a, b)).isCloseTo(-1.0d, within(TOLERANCE));
    }

    @Test
    void cosineWithEmptyVectorIsZero() {
        EmbeddingVector a = EmbeddingVector.of(1.0d, 2.0d);

        assertThat(Ranker.cosine(a, EmbeddingVector.EMPTY)).isZero();
        assertThat(Ranker.cosine(EmbeddingVector.EMPTY, a)).isZero();
        assertThat(Ranker.cosine(EmbeddingVector.EMPTY, EmbeddingVector.EMPTY)).isZero();
    }

    @Test
    void cosineWithZeroNormIsZero() {
        EmbeddingVector zero = EmbeddingVector.of(0.0d, 0.0d, 0.0d);
        EmbeddingVector a = EmbeddingVector.of(1.0d, 2.0d, 3.0d);

        assertThat(Ranker.cosine(zero, a)).isZero();
        assertThat(Ranker.cosine(a, zero)).isZero();
    }

    @Test
    void cosineOfMismatchedDimensionsIsZero() {
        EmbeddingVector a = EmbeddingVector.of(1.0d, 2.0d, 3.0d);
        EmbeddingVector b = EmbeddingVector.of(1.0d, 2.0d);

        assertThat(Ranker.cosine(a, b)).isZero();
    }

    @Test
    void ranksExactMatchFirstWithScoreOne() {
        EmbeddingVector query = EmbeddingVector.of(0.0d, 1.0d, 0.0d);
        CorpusIndex index = indexOf(Map.of(
                "first", EmbeddingVector.of(1.0d, 0.0d, 0.0d),
                "second", EmbeddingVector.of(0.0d, 1.0d, 0.0d),
                "third", EmbeddingVector.of(0.0d, 0.0d, 1.0d)),
                "first", "second", "third");

        List<ScoredEntry> ranked = ranker.rank(query, index);

        assertThat(ranked).hasSize(3);
        assertThat(ranked.get(0).entry().question()).isEqualTo("second");
        assertThat(ranked.get(0).position()).isEqualTo(1);
        assertThat(ranked.get(0).score()).isCloseTo(1.0d, within(TOLERANCE));
        assertThat(ranked.get(1).score()).isZero();
        assertThat(ranked.get(2).score()).isZero();

        List<String> prompts = new ArrayList<>();
        AnswerResult result = new AnswerComposer().compose("second?", ranked, prompt -> {
            prompts.add(prompt);
            return "generated";
        });

        assertThat(result.matchedQuestion()).contains("second");
        assertThat(result.score()).isCloseTo(1.0d, within(TOLERANCE));
        assertThat(prompts).singleElement().asString().contains("answer to second");
    }

    @Test
    void keepsCorpusOrderForEqualScores() {
        EmbeddingVector query = EmbeddingVector.of(1.0d, 1.0d);
        CorpusIndex index = indexOf(Map.of(
                "low", EmbeddingVector.of(1.0d, -1.0d),
                "tie-a", EmbeddingVector.of(2.0d, 2.0d),
                "tie-b", EmbeddingVector.of(2.0d, 2.0d),
                "missing", EmbeddingVector.EMPTY),
                "low", "tie-a", "tie-b", "missing");

        List<ScoredEntry> ranked = ranker.rank(query, index);

        assertThat(ranked).extracting(entry -> entry.entry().question())
                .containsExactly("tie-a", "tie-b", "low", "missing");
    }

    @Test
    void rankingIsReproducible() {
        EmbeddingVector query = EmbeddingVector.of(0.5d, 0.5d, 0.1d);
        CorpusIndex index = indexOf(Map.of(
                "a", EmbeddingVector.of(0.4d, 0.6d, 0.0d),
                "b", EmbeddingVector.of(0.6d, 0.4d, 0.0d),
                "c", EmbeddingVector.of(0.5d, 0.5d, 0.1d)),
                "a", "b", "c");

        assertThat(ranker.rank(query, index)).isEqualTo(ranker.rank(query, index));
    }

    @Test
    void ranksEmptyIndexToEmptyList() {
        CorpusIndex index = CorpusIndex.build(List.of(), text -> EmbeddingVector.of(1.0d));

        assertThat(ranker.rank(EmbeddingVector.of(1.0d), index)).isEmpty();
    }

    private static CorpusIndex indexOf(Map<String, EmbeddingVector> vectors, String... questions) {
        List<CorpusEntry> corpus = Arrays.stream(questions)
                .map(question -> new CorpusEntry(question, "answer to " + question))
                .toList();
        return CorpusIndex.build(corpus, text -> {
            for (CorpusEntry entry : corpus) {
                if (entry.embeddingText().equals(text)) {
                    EmbeddingVector vector = vectors.get(entry.question());
                    if (vector.isEmpty()) {
                        throw new EmbeddingUnavailableException("no vector for " + entry.question());
                    }
                    return vector;
                }
            }
            throw new IllegalStateException("unexpected text " + text);
        });
    }
}
