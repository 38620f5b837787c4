package com.opro.config;

import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "opro")
public class OproProperties {

    private AiProvider aiProvider = AiProvider.GOOGLE;
    private GoogleConfig google = new GoogleConfig();
    private OpenAIConfig openai = new OpenAIConfig();
    private SessionDefaults defaults = new SessionDefaults();
    private RetryConfig proposer = new RetryConfig(2, Duration.ofSeconds(1));
    private GraderConfig grader = new GraderConfig();
    private ScoringConfig scoring = new ScoringConfig();
    private BenchmarkConfig benchmark = new BenchmarkConfig();
    private StoreConfig store = new StoreConfig();
    private AutoRunConfig autoRun = new AutoRunConfig();
    private StreamConfig stream = new StreamConfig();

    public enum AiProvider {
        GOOGLE, OPENAI
    }

    public enum StoreType {
        MEMORY, JPA
    }

    public static class GoogleConfig {
        private String apiKey;

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    }

    public static class OpenAIConfig {
        private String apiKey;
        private String baseUrl = "https://api.openai.com";
        private String model = "gpt-4o-mini";

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    /**
     * Values applied when a create-session request leaves a config field unset.
     */
    public static class SessionDefaults {
        private int k = 4;
        private int topX = 20;
        private String optimizerModel = "gemini-2.5-flash";
        private double optimizerTemperature = 1.0;
        private String scorerModel = "gemini-2.5-flash";
        private double scorerTemperature = 0.0;

        public int getK() { return k; }
        public void setK(int k) { this.k = k; }
        public int getTopX() { return topX; }
        public void setTopX(int topX) { this.topX = topX; }
        public String getOptimizerModel() { return optimizerModel; }
        public void setOptimizerModel(String optimizerModel) { this.optimizerModel = optimizerModel; }
        public double getOptimizerTemperature() { return optimizerTemperature; }
        public void setOptimizerTemperature(double optimizerTemperature) { this.optimizerTemperature = optimizerTemperature; }
        public String getScorerModel() { return scorerModel; }
        public void setScorerModel(String scorerModel) { this.scorerModel = scorerModel; }
        public double getScorerTemperature() { return scorerTemperature; }
        public void setScorerTemperature(double scorerTemperature) { this.scorerTemperature = scorerTemperature; }
    }

    public static class RetryConfig {
        private int maxAttempts;
        private Duration baseDelay;

        public RetryConfig() {
            this(2, Duration.ofSeconds(1));
        }

        public RetryConfig(int maxAttempts, Duration baseDelay) {
            this.maxAttempts = maxAttempts;
            this.baseDelay = baseDelay;
        }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getBaseDelay() { return baseDelay; }
        public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }
    }

    public static class GraderConfig extends RetryConfig {
        private Duration callTimeout = Duration.ofSeconds(120);
        private Duration dispatchStagger = Duration.ofMillis(10);

        public GraderConfig() {
            super(2, Duration.ofSeconds(5));
        }

        public Duration getCallTimeout() { return callTimeout; }
        public void setCallTimeout(Duration callTimeout) { this.callTimeout = callTimeout; }
        public Duration getDispatchStagger() { return dispatchStagger; }
        public void setDispatchStagger(Duration dispatchStagger) { this.dispatchStagger = dispatchStagger; }
    }

    public static class ScoringConfig {
        private int batchConcurrency = 8;
        private Integer batchSize;

        public int getBatchConcurrency() { return batchConcurrency; }
        public void setBatchConcurrency(int batchConcurrency) { this.batchConcurrency = batchConcurrency; }
        public Integer getBatchSize() { return batchSize; }
        public void setBatchSize(Integer batchSize) { this.batchSize = batchSize; }
    }

    public static class BenchmarkConfig {
        private String location = "classpath:benchmark/gsm_train.tsv";

        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
    }

    public static class StoreConfig {
        private StoreType type = StoreType.MEMORY;

        public StoreType getType() { return type; }
        public void setType(StoreType type) { this.type = type; }
    }

    public static class AutoRunConfig {
        private Duration stepDelay = Duration.ofSeconds(1);

        public Duration getStepDelay() { return stepDelay; }
        public void setStepDelay(Duration stepDelay) { this.stepDelay = stepDelay; }
    }

    public static class StreamConfig {
        private List<String> allowedOrigins = List.of("*");

        public List<String> getAllowedOrigins() { return allowedOrigins; }
        public void setAllowedOrigins(List<String> allowedOrigins) { this.allowedOrigins = allowedOrigins; }
    }

    public AiProvider getAiProvider() {
        return aiProvider;
    }

    public void setAiProvider(AiProvider aiProvider) {
        this.aiProvider = aiProvider;
    }

    public GoogleConfig getGoogle() {
        return google;
    }

    public void setGoogle(GoogleConfig google) {
        this.google = google;
    }

    public OpenAIConfig getOpenai() {
        return openai;
    }

    public void setOpenai(OpenAIConfig openai) {
        this.openai = openai;
    }

    public SessionDefaults getDefaults() {
        return defaults;
    }

    public void setDefaults(SessionDefaults defaults) {
        this.defaults = defaults != null ? defaults : new SessionDefaults();
    }

    public RetryConfig getProposer() {
        return proposer;
    }

    public void setProposer(RetryConfig proposer) {
        this.proposer = proposer != null ? proposer : new RetryConfig(2, Duration.ofSeconds(1));
    }

    public GraderConfig getGrader() {
        return grader;
    }

    public void setGrader(GraderConfig grader) {
        this.grader = grader != null ? grader : new GraderConfig();
    }

    public ScoringConfig getScoring() {
        return scoring;
    }

    public void setScoring(ScoringConfig scoring) {
        this.scoring = scoring != null ? scoring : new ScoringConfig();
    }

    public BenchmarkConfig getBenchmark() {
        return benchmark;
    }

    public void setBenchmark(BenchmarkConfig benchmark) {
        this.benchmark = benchmark != null ? benchmark : new BenchmarkConfig();
    }

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store != null ? store : new StoreConfig();
    }

    public AutoRunConfig getAutoRun() {
        return autoRun;
    }

    public void setAutoRun(AutoRunConfig autoRun) {
        this.autoRun = autoRun != null ? autoRun : new AutoRunConfig();
    }

    public StreamConfig getStream() {
        return stream;
    }

    public void setStream(StreamConfig stream) {
        this.stream = stream != null ? stream : new StreamConfig();
    }
}
