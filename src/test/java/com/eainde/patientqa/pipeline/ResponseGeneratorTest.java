package com.eainde.patientqa.pipeline;

import com.eainde.patientqa.TestFixtures;
import com.eainde.patientqa.context.PatientContext;
import com.eainde.patientqa.memory.ConversationMemoryStore;
import com.eainde.patientqa.memory.InMemorySessionRepository;
import com.eainde.patientqa.memory.Message;
import com.eainde.patientqa.memory.PersistenceException;
import com.eainde.patientqa.memory.SessionRepository;
import com.eainde.patientqa.prompt.ComposerSettings;
import com.eainde.patientqa.prompt.PromptComposer;
import com.eainde.patientqa.prompt.PromptPayload;
import com.eainde.patientqa.provider.LanguageModelProvider;
import com.eainde.patientqa.provider.ProviderException;
import com.eainde.patientqa.redflag.Severity;
import com.eainde.patientqa.retrieval.RetrievalException;
import com.eainde.patientqa.retrieval.RetrievalIndex;
import com.eainde.patientqa.retrieval.RetrievedChunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResponseGeneratorTest {

    private static final String BLEEDING_WITH_DIZZINESS = "I've had rectal bleeding for 3 weeks and feel dizzy";

    private RetrievalIndex retrieval;
    private LanguageModelProvider provider;
    private ConversationMemoryStore memory;

    @BeforeEach
    void setUp() {
        retrieval = mock(RetrievalIndex.class);
        provider = mock(LanguageModelProvider.class);
        when(provider.id()).thenReturn("test-model");
        memory = new ConversationMemoryStore(new InMemorySessionRepository());
    }

    private ResponseGenerator.Builder generator() {
        return ResponseGenerator.builder()
                .retrievalIndex(retrieval)
                .composer(new PromptComposer(new ComposerSettings(10, 4000, 20_000)))
                .safetyPolicy(TestFixtures.policy())
                .detector(TestFixtures.shippedDetector())
                .memory(memory)
                .provider(provider)
                .invoker(new ProviderInvoker(RetryPolicy.noRetry(), null));
    }

    @Nested
    @DisplayName("Red-flag escalation")
    class Escalation {

        @Test
        @DisplayName("bleeding with dizziness escalates to urgent care and flags the stored messages")
        void bleedingWithDizzinessEscalates() {
            when(retrieval.search(anyString(), anyInt())).thenReturn(List.of());
            when(provider.generate(any(), any())).thenReturn("Hemorrhoids are a common cause of bleeding.");

            TurnResult result = generator().build().respond("s-a", BLEEDING_WITH_DIZZINESS);

            assertThat(result.redFlag()).isTrue();
            assertThat(result.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(result.answer())
                    .startsWith("Hemorrhoids are a common cause of bleeding.")
                    .contains("emergency");

            List<Message> stored = memory.getSession("s-a").messages();
            assertThat(stored).hasSize(2);
            assertThat(stored.get(0).redFlag()).isTrue();
            assertThat(stored.get(0).redFlagRuleId()).isEqualTo("bleeding-with-dizziness");
            assertThat(stored.get(1).redFlag()).isTrue();
            assertThat(stored.get(1).escalationText()).contains("emergency");
            assertThat(stored.get(1).text()).isEqualTo(result.answer());
        }

        @Test
        @DisplayName("a red flag stated in the drafted answer is caught by the post-check")
        void postCheck() {
            when(retrieval.search(anyString(), anyInt())).thenReturn(List.of());
            when(provider.generate(any(), any()))
                    .thenReturn("Eat more fiber. The black, tarry stools you mentioned earlier need a doctor's check today.");

            TurnResult result = generator().build().respond("s-post", "How do I stay regular?");

            assertThat(result.preCheck()).isNull();
            assertThat(result.postCheck().ruleId()).isEqualTo("black-tarry-stool");
            assertThat(result.escalations()).hasSize(1);
            assertThat(result.answer()).endsWith(result.escalations().get(0));
            assertThat(memory.getSession("s-post").messages().get(0).redFlag()).isFalse();
            assertThat(memory.getSession("s-post").messages().get(1).redFlag()).isTrue();
        }

        @Test
        @DisplayName("an ordinary answer that lists warning signs is not escalated")
        void warningSignsInAdviceAreNotEscalated() {
            when(retrieval.search(anyString(), anyInt())).thenReturn(List.of());
            String advice = "Drink plenty of water and add fiber slowly. "
                    + "Contact your doctor if you ever notice black or tarry stools or develop a fever. "
                    + "Warning signs such as heavy bleeding or severe pain need urgent care.";
            when(provider.generate(any(), any())).thenReturn(advice);

            TurnResult result = generator().build()
                    .respond("s-advice", "What can I do at home to help with my constipation?");

            assertThat(result.redFlag()).isFalse();
            assertThat(result.escalations()).isEmpty();
            assertThat(result.answer()).isEqualTo(advice);
            assertThat(memory.getSession("s-advice").messages()).noneMatch(Message::redFlag);
        }

        @Test
        @DisplayName("escalation text already present is not repeated and nothing is removed")
        void noDuplicateEscalation() {
            String answer = ResponseGenerator.appendEscalations("Call now.\n\nSee a doctor.", List.of("See a doctor."));

            assertThat(answer).isEqualTo("Call now.\n\nSee a doctor.");
            assertThat(ResponseGenerator.appendEscalations("Draft", List.of("A", "B"))).isEqualTo("Draft\n\nA\n\nB");
        }
    }

    @Nested
    @DisplayName("Degraded paths")
    class Degraded {

        @Test
        @DisplayName("no retrieved chunks still produces an answer from policy and history")
        void noChunksStillAnswers() {
            when(retrieval.search(anyString(), anyInt())).thenReturn(List.of());
            when(provider.generate(any(), any())).thenReturn("first answer", "second answer");
            ResponseGenerator generator = generator().build();

            generator.respond("s-b", "What foods help with constipation?");
            TurnResult result = generator.respond("s-b", "And how much water?");

            ArgumentCaptor<PromptPayload> captor = ArgumentCaptor.forClass(PromptPayload.class);
            verify(provider, times(2)).generate(captor.capture(), any());
            PromptPayload second = captor.getAllValues().get(1);
            assertThat(second.systemText()).isEqualTo(TestFixtures.POLICY_TEXT);
            assertThat(second.history()).extracting(Message::text)
                    .containsExactly("What foods help with constipation?", "first answer");
            assertThat(result.answer()).isEqualTo("second answer");
            assertThat(result.retrievalDegraded()).isFalse();
        }

        @Test
        @DisplayName("a failing retrieval index degrades instead of failing the turn")
        void retrievalDown() {
            when(retrieval.search(anyString(), anyInt())).thenThrow(new RetrievalException("index offline", null));
            when(provider.generate(any(), any())).thenReturn("general advice");

            TurnResult result = generator().build().respond("s-r", "Is walking good for constipation?");

            assertThat(result.retrievalDegraded()).isTrue();
            assertThat(result.chunks()).isEmpty();
            assertThat(result.answer()).isEqualTo("general advice");
            assertThat(result.states()).containsExactly(TurnState.values());
        }

        @Test
        @DisplayName("generation failure yields the fallback and still escalates")
        void fallback() {
            when(retrieval.search(anyString(), anyInt())).thenReturn(List.of());
            when(provider.generate(any(), any())).thenThrow(ProviderException.fatal("401 unauthorized", null));

            TurnResult result = generator().build().respond("s-f", BLEEDING_WITH_DIZZINESS);

            assertThat(result.fallback()).isTrue();
            assertThat(result.failureReason()).contains("401 unauthorized");
            assertThat(result.answer()).startsWith(GenerationSettings.DEFAULT_FALLBACK).contains("emergency");
            assertThat(result.postCheck()).isNull();
        }

        @Test
        @DisplayName("a failed write is reported on the result but the answer is still returned")
        void persistenceFailure() {
            SessionRepository repository = mock(SessionRepository.class);
            when(repository.load(any())).thenReturn(Optional.empty());
            doThrow(new PersistenceException("disk full", null)).when(repository).save(any());
            memory = new ConversationMemoryStore(repository);
            when(retrieval.search(anyString(), anyInt())).thenReturn(List.of());
            when(provider.generate(any(), any())).thenReturn("answer");

            TurnResult result = generator().build().respond("s-p", "question");

            assertThat(result.persisted()).isFalse();
            assertThat(result.answer()).isEqualTo("answer");
        }
    }

    @Nested
    @DisplayName("Retrieval and patient context")
    class Context {

        @Test
        @DisplayName("retrieved chunks reach the prompt")
        void chunksUsed() {
            when(retrieval.search(anyString(), anyInt()))
                    .thenReturn(List.of(new RetrievedChunk("fiber-guide", "Aim for 25-30 g of fiber a day.", 0.8)));
            when(provider.generate(any(), any())).thenReturn("Aim for about 25 grams.");

            TurnResult result = generator().settings(new GenerationSettings(3, null)).build()
                    .respond("s-c", "How much fiber should I eat?");

            verify(retrieval).search("How much fiber should I eat?", 3);
            assertThat(result.chunks()).extracting(RetrievedChunk::sourceId).containsExactly("fiber-guide");
        }

        @Test
        @DisplayName("patient context is looked up, shown to the model and kept on the session")
        void patientContext() {
            when(retrieval.search(anyString(), anyInt())).thenReturn(List.of());
            when(provider.generate(any(), any())).thenReturn("ok");
            PatientContext context = new PatientContext("p1", Map.of("pregnant", "yes"));

            generator().patientContextService(userId -> Optional.of(context)).build()
                    .respond("s-ctx", "p1", "Can I take a laxative?");

            ArgumentCaptor<PromptPayload> captor = ArgumentCaptor.forClass(PromptPayload.class);
            verify(provider).generate(captor.capture(), any());
            assertThat(captor.getValue().systemText()).contains("pregnant: yes");
            assertThat(memory.getSession("s-ctx").patientContext()).isEqualTo(context);
        }

        @Test
        @DisplayName("a failing context lookup falls back to the stored snapshot")
        void contextLookupFails() {
            when(retrieval.search(anyString(), anyInt())).thenReturn(List.of());
            when(provider.generate(any(), any())).thenReturn("ok");
            memory.attachPatientContext("s-snap", new PatientContext("p1", Map.of("age", "61")));

            generator().patientContextService(userId -> {
                throw new IllegalStateException("records service down");
            }).build().respond("s-snap", "p1", "Is this normal at my age?");

            ArgumentCaptor<PromptPayload> captor = ArgumentCaptor.forClass(PromptPayload.class);
            verify(provider).generate(captor.capture(), any());
            assertThat(captor.getValue().systemText()).contains("age: 61");
        }
    }
}
