package com.eainde.patientqa;

import com.eainde.patientqa.config.AssistantProperties;
import com.eainde.patientqa.config.ConfigurationException;
import com.eainde.patientqa.evaluation.CaseSetLoader;
import com.eainde.patientqa.evaluation.EvaluationHarness;
import com.eainde.patientqa.evaluation.RunReportBuilder;
import com.eainde.patientqa.evaluation.RunStatus;
import com.eainde.patientqa.evaluation.TestRun;
import com.eainde.patientqa.evaluation.TestRunRepository;
import com.eainde.patientqa.memory.ConversationMemoryStore;
import com.eainde.patientqa.memory.InMemorySessionRepository;
import com.eainde.patientqa.memory.PersistenceException;
import com.eainde.patientqa.pipeline.ResponseGenerator;
import com.eainde.patientqa.pipeline.TurnResult;
import com.eainde.patientqa.provider.ModelCatalog;
import com.eainde.patientqa.provider.ModelConfig;
import com.eainde.patientqa.provider.ProviderType;
import com.eainde.patientqa.redflag.RedFlagMatch;
import com.eainde.patientqa.redflag.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ObjectProvider;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AssistantCommandRunnerTest {

    private AssistantProperties properties;
    private ObjectProvider<ResponseGenerator> chatProvider;
    private ObjectProvider<EvaluationHarness> harnessProvider;
    private TestRunRepository repository;
    private ConversationMemoryStore memory;
    private ByteArrayOutputStream output;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        properties = new AssistantProperties();
        properties.getJudge().setModel("judge");
        chatProvider = mock(ObjectProvider.class);
        harnessProvider = mock(ObjectProvider.class);
        repository = mock(TestRunRepository.class);
        memory = new ConversationMemoryStore(new InMemorySessionRepository());
        output = new ByteArrayOutputStream();
    }

    private AssistantCommandRunner runner(String input) {
        ModelCatalog catalog = new ModelCatalog(List.of(
                new ModelConfig("claude", ProviderType.ANTHROPIC, "m", null, null, null, "key"),
                new ModelConfig("llama", ProviderType.OLLAMA, "m", null, null, "http://localhost:11434", null),
                new ModelConfig("judge", ProviderType.ANTHROPIC, "m", null, null, null, "key")));
        return new AssistantCommandRunner(properties, chatProvider, harnessProvider, memory,
                new CaseSetLoader(TestFixtures.objectMapper()), catalog, repository, new RunReportBuilder(60),
                new BufferedReader(new StringReader(input)), new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Argument handling")
    class Arguments {

        @Test
        void usageErrors() {
            assertThat(runner("").dispatch(List.of())).isEqualTo(AssistantCommandRunner.EXIT_USAGE);
            assertThat(runner("").dispatch(List.of("deploy"))).isEqualTo(AssistantCommandRunner.EXIT_USAGE);
            assertThat(runner("").dispatch(List.of("review"))).isEqualTo(AssistantCommandRunner.EXIT_USAGE);
            assertThat(printed()).contains(AssistantCommandRunner.USAGE);
        }

        @Test
        @DisplayName("spring-style options are ignored and the exit code is exposed")
        void runSetsExitCode() {
            AssistantCommandRunner runner = runner("");
            runner.run("--spring.profiles.active=dev");

            assertThat(runner.getExitCode()).isEqualTo(AssistantCommandRunner.EXIT_USAGE);
        }

        @Test
        @DisplayName("configuration errors map to their own exit code")
        void configurationError() {
            when(chatProvider.getObject()).thenThrow(new ConfigurationException("assistant.default-model is not set"));

            assertThat(runner("").dispatch(List.of("chat"))).isEqualTo(AssistantCommandRunner.EXIT_CONFIGURATION);
            assertThat(printed()).contains("assistant.default-model is not set");
        }

        @Test
        @DisplayName("startup failures wrapping a configuration error exit with 2")
        void startupExitCodes() {
            RuntimeException wrapped = new BeanCreationException("retrievalIndex",
                    "failed", new ConfigurationException("Retrieval index not found"));

            assertThat(PatientQaApplication.exitCodeFor(wrapped)).isEqualTo(AssistantCommandRunner.EXIT_CONFIGURATION);
            assertThat(PatientQaApplication.exitCodeFor(new IllegalStateException("boom")))
                    .isEqualTo(AssistantCommandRunner.EXIT_FAILURE);
        }
    }

    @Nested
    @DisplayName("Commands")
    class Commands {

        @Test
        @DisplayName("chat prints answers, urgency and the session summary")
        void chat() {
            ResponseGenerator generator = mock(ResponseGenerator.class);
            when(generator.getModelId()).thenReturn("claude");
            RedFlagMatch match = new RedFlagMatch("heavy-bleeding", "bleeding", Severity.CRITICAL, "bleeding", "Call now.");
            when(generator.respond(eq("patient-1"), anyString())).thenReturn(new TurnResult("patient-1",
                    "Answer.\n\nCall now.", match, null, List.of("Call now."), List.of(), false, false, null,
                    false, List.of(), 5));
            when(chatProvider.getObject()).thenReturn(generator);

            int code = runner("I am bleeding a lot\n\n/summary\nexit\n").dispatch(List.of("chat", "patient-1"));

            assertThat(code).isEqualTo(AssistantCommandRunner.EXIT_OK);
            assertThat(printed())
                    .contains("Answer.\n\nCall now.")
                    .contains("[urgent: CRITICAL]")
                    .contains("could not be saved")
                    .contains("Session patient-1: 0 message(s)");
            verify(generator).respond("patient-1", "I am bleeding a lot");
        }

        @Test
        @DisplayName("evaluate runs every model except the judge and saves the results")
        void evaluate() {
            EvaluationHarness harness = mock(EvaluationHarness.class);
            TestRun run = new TestRun("run-1", Instant.parse("2024-05-01T10:00:00Z"), List.of(), List.of("claude"));
            run.complete(RunStatus.COMPLETED, Instant.parse("2024-05-01T10:01:00Z"));
            when(harness.run(anyList(), anyList())).thenReturn(run);
            when(harnessProvider.getObject()).thenReturn(harness);

            int code = runner("").dispatch(List.of("evaluate"));

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<ModelConfig>> configs = ArgumentCaptor.forClass(List.class);
            verify(harness).run(anyList(), configs.capture());
            assertThat(configs.getValue()).extracting(ModelConfig::id).containsExactly("claude", "llama");
            assertThat(code).isEqualTo(AssistantCommandRunner.EXIT_OK);
            assertThat(printed()).contains("EVALUATION RUN run-1").contains("Results saved under run id run-1");
            verify(repository).save(run);
        }

        @Test
        @DisplayName("evaluate exits with 2 when a candidate model cannot be configured")
        void evaluateConfigurationError() {
            EvaluationHarness harness = mock(EvaluationHarness.class);
            when(harness.run(anyList(), anyList()))
                    .thenThrow(new ConfigurationException("Model 'claude' needs an Anthropic API key"));
            when(harnessProvider.getObject()).thenReturn(harness);

            assertThat(runner("").dispatch(List.of("evaluate"))).isEqualTo(AssistantCommandRunner.EXIT_CONFIGURATION);
            assertThat(printed()).contains("needs an Anthropic API key");
            verify(repository, never()).save(any());
        }

        @Test
        @DisplayName("evaluate reports a failed save with a non-zero exit")
        void evaluateSaveFails() {
            EvaluationHarness harness = mock(EvaluationHarness.class);
            TestRun run = new TestRun("run-2", Instant.parse("2024-05-01T10:00:00Z"), List.of(), List.of());
            when(harness.run(anyList(), anyList())).thenReturn(run);
            when(harnessProvider.getObject()).thenReturn(harness);
            doThrow(new PersistenceException("read-only", null)).when(repository).save(any());

            assertThat(runner("").dispatch(List.of("evaluate"))).isEqualTo(AssistantCommandRunner.EXIT_FAILURE);
        }

        @Test
        @DisplayName("review of an unknown run is a usage error")
        void reviewUnknownRun() {
            when(repository.load("nope")).thenReturn(Optional.empty());
            when(repository.listRunIds()).thenReturn(List.of("run-1"));

            assertThat(runner("").dispatch(List.of("review", "nope"))).isEqualTo(AssistantCommandRunner.EXIT_USAGE);
            assertThat(printed()).contains("Known runs: [run-1]");
        }
    }
}
