package ch.so.arp.faq.bot;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Central configuration wiring the FAQ bot together. The
 * {@code faq.bot.mock-ollama} toggle decides whether the offline providers or
 * the Ollama HTTP providers are used.
 */
@Configuration
@EnableConfigurationProperties(FaqBotProperties.class)
public class FaqBotConfiguration {

    static final int MOCK_EMBEDDING_DIMENSIONS = 768;

    @Bean(destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "providerExecutor")
    public ExecutorService providerExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("faq-provider-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Bean
    @ConditionalOnProperty(name = "faq.bot.mock-ollama", havingValue = "true", matchIfMissing = true)
    public EmbeddingProvider mockEmbeddingProvider(FaqBotProperties properties, ExecutorService providerExecutor) {
        return new TimeLimitedEmbeddingProvider(new HashingEmbeddingProvider(MOCK_EMBEDDING_DIMENSIONS),
                new ProviderTimeLimiter("embedding", providerExecutor, properties.getOllama().getEmbeddingTimeout()));
    }

    @Bean
    @ConditionalOnProperty(name = "faq.bot.mock-ollama", havingValue = "true", matchIfMissing = true)
    public CompletionProvider mockCompletionProvider(FaqBotProperties properties, ExecutorService providerExecutor) {
        return new TimeLimitedCompletionProvider(new MockCompletionProvider(),
                new ProviderTimeLimiter("completion", providerExecutor, properties.getOllama().getCompletionTimeout()));
    }

    @Bean
    @ConditionalOnProperty(name = "faq.bot.mock-ollama", havingValue = "false")
    public EmbeddingProvider ollamaEmbeddingProvider(FaqBotProperties properties, ExecutorService providerExecutor) {
        FaqBotProperties.Ollama ollama = properties.getOllama();
        RestClient restClient = ollamaRestClient(ollama.getBaseUrl(), ollama.getEmbeddingTimeout());
        return new TimeLimitedEmbeddingProvider(new OllamaEmbeddingProvider(restClient, ollama.getEmbeddingModel()),
                new ProviderTimeLimiter("ollamaEmbedding", providerExecutor, ollama.getEmbeddingTimeout()));
    }

    @Bean
    @ConditionalOnProperty(name = "faq.bot.mock-ollama", havingValue = "false")
    public CompletionProvider ollamaCompletionProvider(FaqBotProperties properties, ExecutorService providerExecutor) {
        FaqBotProperties.Ollama ollama = properties.getOllama();
        RestClient restClient = ollamaRestClient(ollama.getBaseUrl(), ollama.getCompletionTimeout());
        return new TimeLimitedCompletionProvider(new OllamaCompletionProvider(restClient, ollama.getModel()),
                new ProviderTimeLimiter("ollamaCompletion", providerExecutor, ollama.getCompletionTimeout()));
    }

    @Bean
    public CorpusIndex corpusIndex(FaqBotProperties properties, ResourceLoader resourceLoader,
            ObjectProvider<ObjectMapper> objectMapper, EmbeddingProvider embeddingProvider) {
        JsonCorpusLoader loader = new JsonCorpusLoader(objectMapper.getIfAvailable(ObjectMapper::new));
        List<CorpusEntry> corpus = loader.load(resourceLoader.getResource(properties.getCorpus()));
        if (!properties.getIndex().isParallel()) {
            return CorpusIndex.build(corpus, embeddingProvider);
        }
        // separate pool: every embed call blocks on a task of the provider executor
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("faq-index-");
        threadFactory.setDaemon(true);
        ExecutorService indexExecutor = Executors.newFixedThreadPool(properties.getIndex().getThreads(), threadFactory);
        try {
            return CorpusIndex.build(corpus, embeddingProvider, indexExecutor);
        } finally {
            indexExecutor.shutdownNow();
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public Ranker ranker() {
        return new Ranker();
    }

    @Bean
    @ConditionalOnMissingBean
    public AnswerComposer answerComposer(FaqBotProperties properties) {
        return new AnswerComposer(properties.getConfidenceThreshold());
    }

    @Bean
    public RetrievalService retrievalService(CorpusIndex corpusIndex, EmbeddingProvider embeddingProvider,
            CompletionProvider completionProvider, Ranker ranker, AnswerComposer answerComposer) {
        return new RetrievalService(corpusIndex, embeddingProvider, completionProvider, ranker, answerComposer);
    }

    private static RestClient ollamaRestClient(String baseUrl, Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);
        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }
}
