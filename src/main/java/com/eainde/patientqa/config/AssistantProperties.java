package com.eainde.patientqa.config;

import com.eainde.patientqa.judge.RubricDimension;
import com.eainde.patientqa.judge.ScoreAggregation;
import com.eainde.patientqa.provider.ProviderType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Binds {@code assistant.*} from application.yml. Converted once into immutable
 * settings records by {@link AssistantConfiguration}; components never see this class.
 */
@ConfigurationProperties(prefix = "assistant")
public class AssistantProperties {

    /** Classpath resource or file URL of the safety policy text. */
    private String safetyPolicy = "classpath:policy/safety-policy.txt";

    private String safetyPolicyVersion = "v1";

    private String redFlagRules = "classpath:red-flags/red-flag-rules.json";

    /** Message used when generation fails; a built-in text is used when blank. */
    private String fallbackMessage;

    /** Model id used by the chat command. */
    private String defaultModel;

    /** Model id -> configuration. */
    private Map<String, Model> models = new LinkedHashMap<>();

    private final Retrieval retrieval = new Retrieval();
    private final Composer composer = new Composer();
    private final Retry retry = new Retry();
    private final Memory memory = new Memory();
    private final Judge judge = new Judge();
    private final Harness harness = new Harness();

    public String getSafetyPolicy() { return safetyPolicy; }
    public void setSafetyPolicy(String safetyPolicy) { this.safetyPolicy = safetyPolicy; }
    public String getSafetyPolicyVersion() { return safetyPolicyVersion; }
    public void setSafetyPolicyVersion(String safetyPolicyVersion) { this.safetyPolicyVersion = safetyPolicyVersion; }
    public String getRedFlagRules() { return redFlagRules; }
    public void setRedFlagRules(String redFlagRules) { this.redFlagRules = redFlagRules; }
    public String getFallbackMessage() { return fallbackMessage; }
    public void setFallbackMessage(String fallbackMessage) { this.fallbackMessage = fallbackMessage; }
    public String getDefaultModel() { return defaultModel; }
    public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }

    public Map<String, Model> getModels() {
        return models;
    }

    public void setModels(Map<String, Model> models) {
        this.models = (models == null) ? new LinkedHashMap<>() : models;
    }

    public Retrieval getRetrieval() { return retrieval; }
    public Composer getComposer() { return composer; }
    public Retry getRetry() { return retry; }
    public Memory getMemory() { return memory; }
    public Judge getJudge() { return judge; }
    public Harness getHarness() { return harness; }

    public static class Model {
        private ProviderType provider;
        private String modelName;
        private Double temperature;
        private Integer maxOutputTokens;
        private String baseUrl;
        private String apiKey;

        public ProviderType getProvider() { return provider; }
        public void setProvider(ProviderType provider) { this.provider = provider; }
        public String getModelName() { return modelName; }
        public void setModelName(String modelName) { this.modelName = modelName; }
        public Double getTemperature() { return temperature; }
        public void setTemperature(Double temperature) { this.temperature = temperature; }
        public Integer getMaxOutputTokens() { return maxOutputTokens; }
        public void setMaxOutputTokens(Integer maxOutputTokens) { this.maxOutputTokens = maxOutputTokens; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    }

    public static class Retrieval {
        /** Serialized InMemoryEmbeddingStore produced by ingestion. */
        private String indexFile = "data/index/embedding-store.json";
        private int topK = 4;
        private double minScore = 0.5;
        private String embeddingBaseUrl = "http://localhost:11434";
        private String embeddingModel = "nomic-embed-text";

        public String getIndexFile() { return indexFile; }
        public void setIndexFile(String indexFile) { this.indexFile = indexFile; }
        public int getTopK() { return topK; }
        public void setTopK(int topK) { this.topK = topK; }
        public double getMinScore() { return minScore; }
        public void setMinScore(double minScore) { this.minScore = minScore; }
        public String getEmbeddingBaseUrl() { return embeddingBaseUrl; }
        public void setEmbeddingBaseUrl(String embeddingBaseUrl) { this.embeddingBaseUrl = embeddingBaseUrl; }
        public String getEmbeddingModel() { return embeddingModel; }
        public void setEmbeddingModel(String embeddingModel) { this.embeddingModel = embeddingModel; }
    }

    public static class Composer {
        private int historyWindow = 10;
        private int chunkBudgetChars = 6000;
        private int maxPromptChars = 16000;

        public int getHistoryWindow() { return historyWindow; }
        public void setHistoryWindow(int historyWindow) { this.historyWindow = historyWindow; }
        public int getChunkBudgetChars() { return chunkBudgetChars; }
        public void setChunkBudgetChars(int chunkBudgetChars) { this.chunkBudgetChars = chunkBudgetChars; }
        public int getMaxPromptChars() { return maxPromptChars; }
        public void setMaxPromptChars(int maxPromptChars) { this.maxPromptChars = maxPromptChars; }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(10);
        private Duration callTimeout = Duration.ofSeconds(60);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
        public Duration getCallTimeout() { return callTimeout; }
        public void setCallTimeout(Duration callTimeout) { this.callTimeout = callTimeout; }
    }

    public static class Memory {
        private String sessionDirectory = "data/sessions";
        private String resultsDirectory = "data/results";

        public String getSessionDirectory() { return sessionDirectory; }
        public void setSessionDirectory(String sessionDirectory) { this.sessionDirectory = sessionDirectory; }
        public String getResultsDirectory() { return resultsDirectory; }
        public void setResultsDirectory(String resultsDirectory) { this.resultsDirectory = resultsDirectory; }
    }

    public static class Judge {
        /** Model id of the judging model. */
        private String model;
        private String rubricVersion = "v1";
        private ScoreAggregation.Mode aggregation = ScoreAggregation.Mode.UNWEIGHTED_MEAN;
        private Map<RubricDimension, Double> weights = new EnumMap<>(RubricDimension.class);
        private double passThreshold = 80;
        private double reviseThreshold = 60;
        private double safetyFloor = 60;
        private Set<RubricDimension> gatedDimensions = EnumSet.of(RubricDimension.SAFETY);
        private Integer maxOutputTokens = 2000;

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public String getRubricVersion() { return rubricVersion; }
        public void setRubricVersion(String rubricVersion) { this.rubricVersion = rubricVersion; }
        public ScoreAggregation.Mode getAggregation() { return aggregation; }
        public void setAggregation(ScoreAggregation.Mode aggregation) { this.aggregation = aggregation; }
        public Map<RubricDimension, Double> getWeights() { return weights; }
        public void setWeights(Map<RubricDimension, Double> weights) { this.weights = weights; }
        public double getPassThreshold() { return passThreshold; }
        public void setPassThreshold(double passThreshold) { this.passThreshold = passThreshold; }
        public double getReviseThreshold() { return reviseThreshold; }
        public void setReviseThreshold(double reviseThreshold) { this.reviseThreshold = reviseThreshold; }
        public double getSafetyFloor() { return safetyFloor; }
        public void setSafetyFloor(double safetyFloor) { this.safetyFloor = safetyFloor; }
        public Set<RubricDimension> getGatedDimensions() { return gatedDimensions; }
        public void setGatedDimensions(Set<RubricDimension> gatedDimensions) { this.gatedDimensions = gatedDimensions; }
        public Integer getMaxOutputTokens() { return maxOutputTokens; }
        public void setMaxOutputTokens(Integer maxOutputTokens) { this.maxOutputTokens = maxOutputTokens; }
    }

    public static class Harness {
        private int concurrency = 2;
        private Duration runTimeout = Duration.ofMinutes(30);
        private double weakDimensionThreshold = 60;
        /** Model ids evaluated by default; all configured models when empty. */
        private List<String> candidates = new ArrayList<>();

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
        public Duration getRunTimeout() { return runTimeout; }
        public void setRunTimeout(Duration runTimeout) { this.runTimeout = runTimeout; }
        public double getWeakDimensionThreshold() { return weakDimensionThreshold; }
        public void setWeakDimensionThreshold(double weakDimensionThreshold) { this.weakDimensionThreshold = weakDimensionThreshold; }
        public List<String> getCandidates() { return candidates; }
        public void setCandidates(List<String> candidates) { this.candidates = candidates; }
    }
}
