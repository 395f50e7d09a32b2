package ch.so.arp.faq.bot;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Configuration of the FAQ bot: where the corpus lives, the confidence
 * threshold and how to reach Ollama.
 */
@ConfigurationProperties(prefix = "faq.bot")
public class FaqBotProperties implements EnvironmentAware {

    /**
     * Location of the JSON corpus.
     */
    private String corpus = "classpath:faq_data.json";

    /**
     * Minimum cosine similarity the best match needs before it is used as
     * grounding context.
     */
    private double confidenceThreshold = AnswerComposer.DEFAULT_CONFIDENCE_THRESHOLD;

    private final Index index = new Index();

    private final Ollama ollama = new Ollama();

    public String getCorpus() {
        return corpus;
    }

    public void setCorpus(String corpus) {
        this.corpus = corpus;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public Index getIndex() {
        return index;
    }

    public Ollama getOllama() {
        return ollama;
    }

    @Override
    public void setEnvironment(Environment environment) {
        ollama.environment = environment;
    }

    public static class Index {

        /**
         * Embed the corpus entries concurrently while building the index.
         */
        private boolean parallel;

        /**
         * Number of threads embedding entries during a parallel build.
         */
        private int threads = 4;

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            if (threads <= 0) {
                throw new IllegalArgumentException("faq.bot.index.threads must be positive");
            }
            this.threads = threads;
        }

        public boolean isParallel() {
            return parallel;
        }

        public void setParallel(boolean parallel) {
            this.parallel = parallel;
        }
    }

    public static class Ollama {

        static final String DEFAULT_EMBEDDING_MODEL = "nomic-embed-text";

        private String baseUrl = "http://localhost:11434";

        /**
         * Model used to generate answers.
         */
        private String model = "llama3";

        /**
         * Model used for embeddings. Falls back to the OLLAMA_EMBED_MODEL
         * environment variable.
         */
        private String embeddingModel;

        private Duration embeddingTimeout = Duration.ofSeconds(45);

        private Duration completionTimeout = Duration.ofSeconds(60);

        private Environment environment;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getEmbeddingModel() {
            if (StringUtils.hasText(embeddingModel)) {
                return embeddingModel;
            }
            String fromEnvironment = environment != null ? environment.getProperty("OLLAMA_EMBED_MODEL") : null;
            return StringUtils.hasText(fromEnvironment) ? fromEnvironment : DEFAULT_EMBEDDING_MODEL;
        }

        public void setEmbeddingModel(String embeddingModel) {
            this.embeddingModel = embeddingModel;
        }

        public Duration getEmbeddingTimeout() {
            return embeddingTimeout;
        }

        public void setEmbeddingTimeout(Duration embeddingTimeout) {
            this.embeddingTimeout = embeddingTimeout;
        }

        public Duration getCompletionTimeout() {
            return completionTimeout;
        }

        public void setCompletionTimeout(Duration completionTimeout) {
            this.completionTimeout = completionTimeout;
        }
    }
}
