package com.eainde.patientqa.config;

import com.eainde.patientqa.context.NoPatientContextService;
import com.eainde.patientqa.context.PatientContextService;
import com.eainde.patientqa.evaluation.CaseSetLoader;
import com.eainde.patientqa.evaluation.EvaluationHarness;
import com.eainde.patientqa.evaluation.GeneratorFactory;
import com.eainde.patientqa.evaluation.HarnessSettings;
import com.eainde.patientqa.evaluation.JsonFileTestRunRepository;
import com.eainde.patientqa.evaluation.RunReportBuilder;
import com.eainde.patientqa.evaluation.TestRunRepository;
import com.eainde.patientqa.judge.JudgeOutputDecoder;
import com.eainde.patientqa.judge.RubricJudge;
import com.eainde.patientqa.judge.RubricSettings;
import com.eainde.patientqa.judge.ScoreAggregation;
import com.eainde.patientqa.judge.VerdictPolicy;
import com.eainde.patientqa.memory.ConversationMemoryStore;
import com.eainde.patientqa.memory.JsonFileSessionRepository;
import com.eainde.patientqa.pipeline.GenerationSettings;
import com.eainde.patientqa.pipeline.ProviderInvoker;
import com.eainde.patientqa.pipeline.ResponseGenerator;
import com.eainde.patientqa.pipeline.RetryPolicy;
import com.eainde.patientqa.prompt.ComposerSettings;
import com.eainde.patientqa.prompt.PromptComposer;
import com.eainde.patientqa.prompt.SafetyPolicy;
import com.eainde.patientqa.provider.LanguageModelProvider;
import com.eainde.patientqa.provider.ModelCatalog;
import com.eainde.patientqa.provider.ModelConfig;
import com.eainde.patientqa.provider.ModelProviderFactory;
import com.eainde.patientqa.redflag.RedFlagDetector;
import com.eainde.patientqa.redflag.RedFlagRuleLoader;
import com.eainde.patientqa.retrieval.EmbeddingStoreRetrievalIndex;
import com.eainde.patientqa.retrieval.RetrievalIndex;
import com.eainde.patientqa.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns {@link AssistantProperties} into immutable settings and wires the
 * pipeline, judge and harness. Static assets are loaded once here.
 *
 * <p>Beans that need the retrieval index or a model are lazy so that commands
 * not using them (e.g. review) start without an index or credentials. Missing
 * setup surfaces as {@link ConfigurationException} before any work starts.</p>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(AssistantProperties.class)
public class AssistantConfiguration {

    // ---- static assets ----

    @Bean
    public SafetyPolicy safetyPolicy(AssistantProperties props, ResourceLoader resourceLoader) {
        Resource resource = require(resourceLoader, props.getSafetyPolicy(), "safety policy");
        try (InputStream in = resource.getInputStream()) {
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
            if (text.isEmpty()) {
                throw new ConfigurationException("Safety policy is empty: " + props.getSafetyPolicy());
            }
            return new SafetyPolicy(props.getSafetyPolicyVersion(), text);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read safety policy " + props.getSafetyPolicy(), e);
        }
    }

    @Bean
    public RedFlagDetector redFlagDetector(AssistantProperties props, ResourceLoader resourceLoader,
                                           ObjectMapper objectMapper) {
        Resource resource = require(resourceLoader, props.getRedFlagRules(), "red-flag rules");
        try (InputStream in = resource.getInputStream()) {
            return new RedFlagDetector(new RedFlagRuleLoader(objectMapper).load(in, props.getRedFlagRules()));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read red-flag rules " + props.getRedFlagRules(), e);
        }
    }

    // ---- settings ----

    @Bean
    public ComposerSettings composerSettings(AssistantProperties props) {
        return toComposerSettings(props.getComposer());
    }

    @Bean
    public PromptComposer promptComposer(ComposerSettings settings, SafetyPolicy policy) {
        PromptComposer composer = new PromptComposer(settings);
        composer.validate(policy);
        return composer;
    }

    @Bean
    public RetryPolicy retryPolicy(AssistantProperties props) {
        return toRetryPolicy(props.getRetry());
    }

    @Bean
    public GenerationSettings generationSettings(AssistantProperties props) {
        return new GenerationSettings(props.getRetrieval().getTopK(), props.getFallbackMessage());
    }

    @Bean
    public RubricSettings rubricSettings(AssistantProperties props) {
        return toRubricSettings(props.getJudge());
    }

    @Bean
    public HarnessSettings harnessSettings(AssistantProperties props) {
        AssistantProperties.Harness h = props.getHarness();
        return new HarnessSettings(h.getConcurrency(), h.getRunTimeout(), h.getWeakDimensionThreshold());
    }

    @Bean
    public ModelCatalog modelCatalog(AssistantProperties props) {
        ModelCatalog catalog = new ModelCatalog(toModelConfigs(props.getModels()));
        if (props.getDefaultModel() != null) {
            catalog.get(props.getDefaultModel());
        }
        if (props.getJudge().getModel() != null) {
            catalog.get(props.getJudge().getModel());
        }
        log.info("Configured models: {}", catalog.ids());
        return catalog;
    }

    // ---- providers ----

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor providerCallExecutor(HarnessSettings harness) {
        // one call per in-flight pair plus the judge and the interactive chat
        return new MdcAwareExecutor(harness.concurrency() * 2 + 1, "provider-call");
    }

    @Bean
    public ProviderInvoker providerInvoker(RetryPolicy retryPolicy, MdcAwareExecutor providerCallExecutor) {
        return new ProviderInvoker(retryPolicy, providerCallExecutor);
    }

    @Bean
    public ModelProviderFactory modelProviderFactory(RetryPolicy retryPolicy) {
        return new ModelProviderFactory(retryPolicy.callTimeout());
    }

    // ---- retrieval, memory, persistence ----

    @Bean
    @Lazy
    public RetrievalIndex retrievalIndex(AssistantProperties props, ModelProviderFactory providerFactory) {
        AssistantProperties.Retrieval r = props.getRetrieval();
        Path indexFile = Path.of(r.getIndexFile());
        if (!Files.isRegularFile(indexFile)) {
            throw new ConfigurationException("Retrieval index not found: " + indexFile.toAbsolutePath()
                    + " (run ingestion first)");
        }
        InMemoryEmbeddingStore<TextSegment> store;
        try {
            store = InMemoryEmbeddingStore.fromFile(indexFile);
        } catch (RuntimeException e) {
            throw new ConfigurationException("Retrieval index is unreadable: " + indexFile, e);
        }
        EmbeddingModel embeddingModel =
                providerFactory.createEmbeddingModel(r.getEmbeddingBaseUrl(), r.getEmbeddingModel());
        log.info("Loaded retrieval index from {}", indexFile);
        return new EmbeddingStoreRetrievalIndex(store, embeddingModel, r.getMinScore());
    }

    @Bean
    public ConversationMemoryStore conversationMemoryStore(AssistantProperties props, ObjectMapper objectMapper) {
        return new ConversationMemoryStore(
                new JsonFileSessionRepository(Path.of(props.getMemory().getSessionDirectory()), objectMapper));
    }

    @Bean
    public TestRunRepository testRunRepository(AssistantProperties props, ObjectMapper objectMapper) {
        return new JsonFileTestRunRepository(Path.of(props.getMemory().getResultsDirectory()), objectMapper);
    }

    @Bean
    public PatientContextService patientContextService() {
        return new NoPatientContextService();
    }

    @Bean
    public CaseSetLoader caseSetLoader(ObjectMapper objectMapper) {
        return new CaseSetLoader(objectMapper);
    }

    @Bean
    public RunReportBuilder runReportBuilder(HarnessSettings harness) {
        return new RunReportBuilder(harness.weakDimensionThreshold());
    }

    // ---- pipeline, judge, harness ----

    @Bean
    @Lazy
    public GeneratorFactory generatorFactory(RetrievalIndex retrievalIndex, PromptComposer composer,
                                             SafetyPolicy policy, RedFlagDetector detector,
                                             PatientContextService patientContextService,
                                             ModelProviderFactory providerFactory, ProviderInvoker invoker,
                                             GenerationSettings generationSettings, ComposerSettings composerSettings) {
        Map<String, LanguageModelProvider> providers = new ConcurrentHashMap<>();
        return new GeneratorFactory() {
            @Override
            public ResponseGenerator create(ModelConfig config, ConversationMemoryStore memory) {
                return ResponseGenerator.builder()
                        .retrievalIndex(retrievalIndex)
                        .composer(composer)
                        .safetyPolicy(policy)
                        .detector(detector)
                        .memory(memory)
                        .patientContextService(patientContextService)
                        .provider(provider(config))
                        .invoker(invoker)
                        .options(config.options())
                        .settings(generationSettings)
                        .historyWindow(composerSettings.historyWindow())
                        .build();
            }

            @Override
            public void prepare(ModelConfig config) {
                provider(config);
            }

            private LanguageModelProvider provider(ModelConfig config) {
                return providers.computeIfAbsent(config.id(), id -> providerFactory.create(config));
            }
        };
    }

    @Bean
    @Lazy
    public ResponseGenerator chatResponseGenerator(AssistantProperties props, ModelCatalog catalog,
                                                   GeneratorFactory generatorFactory,
                                                   ConversationMemoryStore memoryStore) {
        if (props.getDefaultModel() == null) {
            throw new ConfigurationException("assistant.default-model is not set");
        }
        return generatorFactory.create(catalog.get(props.getDefaultModel()), memoryStore);
    }

    @Bean
    @Lazy
    public RubricJudge rubricJudge(AssistantProperties props, ModelCatalog catalog, ModelProviderFactory providerFactory,
                                   ProviderInvoker invoker, RubricSettings settings, ObjectMapper objectMapper) {
        String judgeModel = props.getJudge().getModel();
        if (judgeModel == null) {
            throw new ConfigurationException("assistant.judge.model is not set");
        }
        LanguageModelProvider provider = providerFactory.create(catalog.get(judgeModel));
        return new RubricJudge(provider, invoker, new JudgeOutputDecoder(objectMapper, settings), settings);
    }

    @Bean
    @Lazy
    public EvaluationHarness evaluationHarness(GeneratorFactory generatorFactory, RubricJudge judge,
                                               HarnessSettings settings) {
        return new EvaluationHarness(generatorFactory, judge, settings);
    }

    // ---- conversions ----

    static ComposerSettings toComposerSettings(AssistantProperties.Composer c) {
        try {
            return new ComposerSettings(c.getHistoryWindow(), c.getChunkBudgetChars(), c.getMaxPromptChars());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid assistant.composer settings: " + e.getMessage(), e);
        }
    }

    static RetryPolicy toRetryPolicy(AssistantProperties.Retry r) {
        try {
            return new RetryPolicy(r.getMaxAttempts(), r.getInitialBackoff(), r.getMultiplier(),
                    r.getMaxBackoff(), r.getCallTimeout());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid assistant.retry settings: " + e.getMessage(), e);
        }
    }

    static RubricSettings toRubricSettings(AssistantProperties.Judge j) {
        ScoreAggregation aggregation;
        try {
            aggregation = new ScoreAggregation(j.getAggregation(), j.getWeights());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid assistant.judge aggregation: " + e.getMessage(), e);
        }
        VerdictPolicy verdictPolicy = new VerdictPolicy(j.getPassThreshold(), j.getReviseThreshold(),
                j.getSafetyFloor(), j.getGatedDimensions());
        return new RubricSettings(j.getRubricVersion(), aggregation, verdictPolicy, j.getMaxOutputTokens());
    }

    static List<ModelConfig> toModelConfigs(Map<String, AssistantProperties.Model> models) {
        List<ModelConfig> configs = new ArrayList<>();
        models.forEach((id, m) -> {
            if (m.getProvider() == null || m.getModelName() == null) {
                throw new ConfigurationException("Model '" + id + "' needs provider and model-name");
            }
            configs.add(new ModelConfig(id, m.getProvider(), m.getModelName(), m.getTemperature(),
                    m.getMaxOutputTokens(), m.getBaseUrl(), m.getApiKey()));
        });
        return configs;
    }

    private static Resource require(ResourceLoader resourceLoader, String location, String what) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ConfigurationException("Missing " + what + ": " + location);
        }
        return resource;
    }
}
