package ch.so.arp.faq.bot;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.FileNotFoundException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

class FaqBotConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(FaqBotConfiguration.class);

    @Test
    void usesOfflineProvidersByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(EmbeddingProvider.class);
            assertThat(context).hasSingleBean(CompletionProvider.class);
            assertThat(context).hasBean("mockEmbeddingProvider");
            assertThat(context).hasBean("mockCompletionProvider");
            assertThat(context).hasSingleBean(RetrievalService.class);

            CorpusIndex index = context.getBean(CorpusIndex.class);
            assertThat(index.size()).isPositive();
            assertThat(index.dimension()).isEqualTo(FaqBotConfiguration.MOCK_EMBEDDING_DIMENSIONS);
            assertThat(index.missingEmbeddings()).isZero();

            AnswerResult result = context.getBean(RetrievalService.class)
                    .answer(index.entries().get(0).entry().embeddingText());
            assertThat(result.outcome()).isEqualTo(AnswerOutcome.ANSWERED);
            assertThat(result.matchedQuestion()).contains(index.entries().get(0).entry().question());
        });
    }

    @Test
    void createsOllamaProvidersWhenMocksDisabled() {
        contextRunner
                .withPropertyValues(
                        "faq.bot.mock-ollama=false",
                        "faq.bot.corpus=classpath:empty_faq.json",
                        "faq.bot.ollama.base-url=http://localhost:1",
                        "faq.bot.ollama.model=mistral",
                        "faq.bot.ollama.embedding-model=all-minilm",
                        "faq.bot.ollama.embedding-timeout=5s",
                        "faq.bot.ollama.completion-timeout=90s")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasBean("ollamaEmbeddingProvider");
                    assertThat(context).hasBean("ollamaCompletionProvider");
                    assertThat(context).doesNotHaveBean("mockEmbeddingProvider");

                    FaqBotProperties properties = context.getBean(FaqBotProperties.class);
                    assertThat(properties.getOllama().getModel()).isEqualTo("mistral");
                    assertThat(properties.getOllama().getEmbeddingModel()).isEqualTo("all-minilm");
                    assertThat(properties.getOllama().getEmbeddingTimeout()).isEqualTo(Duration.ofSeconds(5));
                    assertThat(properties.getOllama().getCompletionTimeout()).isEqualTo(Duration.ofSeconds(90));
                    assertThat(context.getBean(CorpusIndex.class).isEmpty()).isTrue();
                });
    }

    @Test
    void readsEmbeddingModelFromEnvironmentVariable() {
        contextRunner
                .withPropertyValues("OLLAMA_EMBED_MODEL=mxbai-embed-large")
                .run(context -> assertThat(context.getBean(FaqBotProperties.class).getOllama().getEmbeddingModel())
                        .isEqualTo("mxbai-embed-large"));
    }

    @Test
    void defaultsMatchOllamaSetup() {
        contextRunner.run(context -> {
            FaqBotProperties properties = context.getBean(FaqBotProperties.class);
            assertThat(properties.getConfidenceThreshold()).isEqualTo(0.5d);
            assertThat(properties.getOllama().getBaseUrl()).isEqualTo("http://localhost:11434");
            assertThat(properties.getOllama().getModel()).isEqualTo("llama3");
            assertThat(properties.getOllama().getEmbeddingTimeout()).isEqualTo(Duration.ofSeconds(45));
        });
    }

    @Test
    void buildsIndexInParallelWhenEnabled() {
        contextRunner
                .withPropertyValues("faq.bot.index.parallel=true")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(CorpusIndex.class).missingEmbeddings()).isZero();
                });
    }

    @Test
    void parallelBuildDoesNotStarveBoundedProviderExecutor() {
        contextRunner
                .withBean("providerExecutor", ExecutorService.class, FaqBotConfigurationTest::singleThreadExecutor)
                .withPropertyValues("faq.bot.index.parallel=true", "faq.bot.index.threads=3",
                        "faq.bot.ollama.embedding-timeout=2s")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    CorpusIndex index = context.getBean(CorpusIndex.class);
                    assertThat(index.size()).isGreaterThan(1);
                    assertThat(index.missingEmbeddings()).isZero();
                });
    }

    @Test
    void appliesConfiguredThreshold() {
        contextRunner
                .withPropertyValues("faq.bot.confidence-threshold=0.8")
                .run(context -> assertThat(context.getBean(AnswerComposer.class).confidenceThreshold())
                        .isEqualTo(0.8d));
    }

    @Test
    void failsOnThresholdOutsideCosineRange() {
        contextRunner
                .withPropertyValues("faq.bot.confidence-threshold=2")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void failsOnNonPositiveIndexThreads() {
        contextRunner
                .withPropertyValues("faq.bot.index.threads=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void failsOnMissingCorpus() {
        contextRunner
                .withPropertyValues("faq.bot.corpus=classpath:missing.json")
                .run(context -> assertThat(context).getFailure()
                        .isInstanceOf(BeanCreationException.class)
                        .hasRootCauseInstanceOf(FileNotFoundException.class));
    }

    private static ExecutorService singleThreadExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("test-provider-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(1, threadFactory);
    }
}
