package ch.so.arp.faq.bot;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers questions against the FAQ corpus: the query is embedded, the index
 * is ranked and the best entry is handed to the {@link AnswerComposer}.
 * Provider failures never escape this class; they are turned into degraded
 * {@link AnswerResult answers}. Only invalid input is reported as an
 * exception.
 */
public class RetrievalService {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetrievalService.class);

    private final CorpusIndex index;
    private final EmbeddingProvider embeddingProvider;
    private final CompletionProvider completionProvider;
    private final Ranker ranker;
    private final AnswerComposer answerComposer;

    public RetrievalService(CorpusIndex index, EmbeddingProvider embeddingProvider,
            CompletionProvider completionProvider, Ranker ranker, AnswerComposer answerComposer) {
        this.index = Objects.requireNonNull(index, "index");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.completionProvider = Objects.requireNonNull(completionProvider, "completionProvider");
        this.ranker = Objects.requireNonNull(ranker, "ranker");
        this.answerComposer = Objects.requireNonNull(answerComposer, "answerComposer");
    }

    /**
     * Answer the query.
     *
     * @param query the user question
     * @return the answer, possibly degraded when a provider is unavailable
     * @throws InvalidQueryException if the query is null, empty or blank
     */
    public AnswerResult answer(String query) {
        if (query == null || query.isBlank()) {
            throw new InvalidQueryException("Query must not be empty");
        }
        String question = query.strip();

        EmbeddingVector queryVector;
        try {
            queryVector = embeddingProvider.embed(question);
        } catch (RuntimeException ex) {
            LOGGER.warn("Unable to embed query '{}': {}", question, ex.getMessage(), ex);
            return AnswerResult.withoutMatch(AnswerComposer.NO_MATCH_MESSAGE, 0.0d,
                    AnswerOutcome.EMBEDDING_UNAVAILABLE);
        }
        if (queryVector == null || queryVector.isEmpty()) {
            LOGGER.warn("Embedding provider returned no vector for query '{}'", question);
            return AnswerResult.withoutMatch(AnswerComposer.NO_MATCH_MESSAGE, 0.0d,
                    AnswerOutcome.EMBEDDING_UNAVAILABLE);
        }

        List<ScoredEntry> ranked = ranker.rank(queryVector, index);
        if (LOGGER.isDebugEnabled() && !ranked.isEmpty()) {
            ScoredEntry top = ranked.get(0);
            LOGGER.debug("Query '{}' ranked {} entries, best '{}' with score {}", question, ranked.size(),
                    top.entry().question(), top.score());
        }
        return answerComposer.compose(question, ranked, completionProvider);
    }

    public CorpusIndex index() {
        return index;
    }
}
