package com.eainde.patientqa.pipeline;

import com.eainde.patientqa.context.PatientContext;
import com.eainde.patientqa.context.PatientContextService;
import com.eainde.patientqa.memory.ConversationMemoryStore;
import com.eainde.patientqa.memory.Message;
import com.eainde.patientqa.memory.PersistenceException;
import com.eainde.patientqa.prompt.PromptComposer;
import com.eainde.patientqa.prompt.PromptPayload;
import com.eainde.patientqa.prompt.SafetyPolicy;
import com.eainde.patientqa.provider.GenerationOptions;
import com.eainde.patientqa.provider.LanguageModelProvider;
import com.eainde.patientqa.redflag.RedFlagDetector;
import com.eainde.patientqa.redflag.RedFlagMatch;
import com.eainde.patientqa.retrieval.RetrievalIndex;
import com.eainde.patientqa.retrieval.RetrievedChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Safety-gated answer pipeline for one user turn.
 *
 * <pre>
 * RECEIVED → RETRIEVING → COMPOSING → RED_FLAG_CHECK(pre) → GENERATING → RED_FLAG_CHECK(post) → FINALIZED
 * </pre>
 *
 * <ul>
 *   <li>Retrieval failure degrades to an empty reference section.</li>
 *   <li>Patient-context lookup failure degrades to the session's stored snapshot, or none.</li>
 *   <li>Generation failure after retries yields the safe fallback message, never an empty answer.</li>
 *   <li>A red flag at either checkpoint appends its escalation notice; nothing is ever removed.</li>
 *   <li>User then assistant message are appended to memory; a failed write is logged, not rolled back.</li>
 * </ul>
 */
public class ResponseGenerator {

    private static final Logger log = LoggerFactory.getLogger(ResponseGenerator.class);

    static final String ESCALATION_SEPARATOR = "\n\n";

    private final RetrievalIndex retrievalIndex;
    private final PromptComposer composer;
    private final SafetyPolicy safetyPolicy;
    private final RedFlagDetector detector;
    private final ConversationMemoryStore memory;
    private final PatientContextService patientContextService;
    private final LanguageModelProvider provider;
    private final ProviderInvoker invoker;
    private final GenerationOptions options;
    private final GenerationSettings settings;
    private final int historyWindow;

    private ResponseGenerator(Builder builder) {
        this.retrievalIndex = Objects.requireNonNull(builder.retrievalIndex, "retrievalIndex");
        this.composer = Objects.requireNonNull(builder.composer, "composer");
        this.safetyPolicy = Objects.requireNonNull(builder.safetyPolicy, "safetyPolicy");
        this.detector = Objects.requireNonNull(builder.detector, "detector");
        this.memory = Objects.requireNonNull(builder.memory, "memory");
        this.patientContextService = Objects.requireNonNull(builder.patientContextService, "patientContextService");
        this.provider = Objects.requireNonNull(builder.provider, "provider");
        this.invoker = Objects.requireNonNull(builder.invoker, "invoker");
        this.options = builder.options != null ? builder.options : GenerationOptions.defaults();
        this.settings = Objects.requireNonNull(builder.settings, "settings");
        this.historyWindow = builder.historyWindow;
        composer.validate(safetyPolicy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getModelId() {
        return provider.id();
    }

    public TurnResult respond(String sessionId, String userText) {
        return respond(sessionId, null, userText);
    }

    /**
     * Runs one turn.
     *
     * @param sessionId session to read history from and append to
     * @param userId    patient id for context lookup, may be null
     * @param userText  the patient's message
     */
    public TurnResult respond(String sessionId, String userId, String userText) {
        Objects.requireNonNull(sessionId, "sessionId");
        String question = userText == null ? "" : userText;
        long started = System.nanoTime();
        List<TurnState> states = new ArrayList<>();

        MDC.put("sessionId", sessionId);
        try {
            enter(states, TurnState.RECEIVED);

            enter(states, TurnState.RETRIEVING);
            boolean degraded = false;
            List<RetrievedChunk> chunks;
            try {
                chunks = settings.retrievalTopK() == 0 ? List.of() : retrievalIndex.search(question, settings.retrievalTopK());
            } catch (RuntimeException e) {
                log.warn("Retrieval unavailable, answering without reference material (degraded mode)", e);
                chunks = List.of();
                degraded = true;
            }
            PatientContext lookedUp = lookupPatientContext(userId);
            PatientContext patientContext = lookedUp != null ? lookedUp : memory.getSession(sessionId).patientContext();

            enter(states, TurnState.COMPOSING);
            List<Message> history = memory.historyWindow(sessionId, historyWindow);
            PromptPayload payload = composer.compose(history, chunks, patientContext, safetyPolicy, question);

            enter(states, TurnState.RED_FLAG_CHECK_PRE);
            RedFlagMatch pre = detector.detect(question).orElse(null);
            if (pre != null) {
                log.info("Red flag on user message: rule={} severity={}", pre.ruleId(), pre.severity());
            }

            enter(states, TurnState.GENERATING);
            String draft;
            boolean fallback = false;
            String failureReason = null;
            try {
                draft = invoker.invoke(provider, payload, options);
            } catch (GenerationException e) {
                log.error("Generation failed after {} attempt(s), returning safe fallback", e.getAttempts(), e);
                draft = settings.fallbackMessage();
                fallback = true;
                failureReason = rootMessage(e);
            }

            enter(states, TurnState.RED_FLAG_CHECK_POST);
            RedFlagMatch post = fallback ? null : detector.detectInAnswer(draft).orElse(null);
            if (post != null) {
                log.info("Red flag in drafted answer: rule={} severity={}", post.ruleId(), post.severity());
            }

            List<String> escalations = escalations(pre, post);
            String answer = appendEscalations(draft, escalations);

            enter(states, TurnState.FINALIZED);
            boolean persisted = persist(sessionId, question, answer, pre, post, escalations, lookedUp);

            long latencyMs = (System.nanoTime() - started) / 1_000_000;
            log.info("Turn finalized in {}ms (chunks={}, redFlag={}, fallback={}, degraded={})",
                    latencyMs, payload.chunks().size(), pre != null || post != null, fallback, degraded);

            return new TurnResult(sessionId, answer, pre, post, escalations, payload.chunks(), degraded,
                    fallback, failureReason, persisted, states, latencyMs);
        } finally {
            MDC.remove("sessionId");
        }
    }

    private PatientContext lookupPatientContext(String userId) {
        if (userId == null) {
            return null;
        }
        try {
            Optional<PatientContext> context = patientContextService.lookup(userId);
            return context.orElse(null);
        } catch (RuntimeException e) {
            log.warn("Patient context lookup failed for {}, continuing without it", userId, e);
            return null;
        }
    }

    static List<String> escalations(RedFlagMatch pre, RedFlagMatch post) {
        List<String> texts = new ArrayList<>(2);
        if (pre != null) {
            texts.add(pre.escalationText());
        }
        if (post != null && !texts.contains(post.escalationText())) {
            texts.add(post.escalationText());
        }
        return texts;
    }

    /**
     * Appends each escalation notice not already present verbatim. Content is only ever added.
     */
    static String appendEscalations(String draft, List<String> escalations) {
        StringBuilder answer = new StringBuilder(draft);
        for (String escalation : escalations) {
            if (answer.indexOf(escalation) < 0) {
                answer.append(ESCALATION_SEPARATOR).append(escalation);
            }
        }
        return answer.toString();
    }

    private boolean persist(String sessionId, String question, String answer,
                            RedFlagMatch pre, RedFlagMatch post, List<String> escalations,
                            PatientContext lookedUp) {
        boolean persisted = true;

        if (lookedUp != null && !lookedUp.equals(memory.getSession(sessionId).patientContext())) {
            try {
                memory.attachPatientContext(sessionId, lookedUp);
            } catch (PersistenceException e) {
                log.error("Patient context snapshot not persisted for session {}", sessionId, e);
                persisted = false;
            }
        }

        Message userMessage = Message.user(question);
        if (pre != null) {
            userMessage = userMessage.flagged(pre);
        }

        Message assistantMessage = Message.assistant(answer);
        RedFlagMatch strongest = pre == null ? post
                : post == null ? pre
                : post.severity().isAbove(pre.severity()) ? post : pre;
        if (strongest != null) {
            assistantMessage = assistantMessage.flagged(strongest)
                    .withEscalation(String.join(ESCALATION_SEPARATOR, escalations));
        }

        // each append keeps the message in memory even if the write fails, so order is preserved
        for (Message message : List.of(userMessage, assistantMessage)) {
            try {
                memory.append(sessionId, message);
            } catch (PersistenceException e) {
                log.error("Failed to persist {} message for session {}; answer already delivered",
                        message.role().getWireName(), sessionId, e);
                persisted = false;
            }
        }
        return persisted;
    }

    private static void enter(List<TurnState> states, TurnState state) {
        states.add(state);
        log.debug("Turn state → {}", state);
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause == e ? e.getMessage() : e.getMessage() + ": " + cause.getMessage();
    }

    // ==========================================================================
    //  Builder
    // ==========================================================================

    public static class Builder {
        private RetrievalIndex retrievalIndex;
        private PromptComposer composer;
        private SafetyPolicy safetyPolicy;
        private RedFlagDetector detector;
        private ConversationMemoryStore memory;
        private PatientContextService patientContextService = userId -> Optional.empty();
        private LanguageModelProvider provider;
        private ProviderInvoker invoker;
        private GenerationOptions options;
        private GenerationSettings settings = new GenerationSettings(4, null);
        private int historyWindow = 10;

        private Builder() {
        }

        public Builder retrievalIndex(RetrievalIndex retrievalIndex) { this.retrievalIndex = retrievalIndex; return this; }
        public Builder composer(PromptComposer composer) { this.composer = composer; return this; }
        public Builder safetyPolicy(SafetyPolicy safetyPolicy) { this.safetyPolicy = safetyPolicy; return this; }
        public Builder detector(RedFlagDetector detector) { this.detector = detector; return this; }
        public Builder memory(ConversationMemoryStore memory) { this.memory = memory; return this; }
        public Builder patientContextService(PatientContextService service) { this.patientContextService = service; return this; }
        public Builder provider(LanguageModelProvider provider) { this.provider = provider; return this; }
        public Builder invoker(ProviderInvoker invoker) { this.invoker = invoker; return this; }
        public Builder options(GenerationOptions options) { this.options = options; return this; }
        public Builder settings(GenerationSettings settings) { this.settings = settings; return this; }

        /** Number of most recent messages read from memory; the composer may trim further. */
        public Builder historyWindow(int historyWindow) { this.historyWindow = historyWindow; return this; }

        /** Copies shared collaborators so only the provider needs replacing. */
        public Builder from(ResponseGenerator other) {
            this.retrievalIndex = other.retrievalIndex;
            this.composer = other.composer;
            this.safetyPolicy = other.safetyPolicy;
            this.detector = other.detector;
            this.memory = other.memory;
            this.patientContextService = other.patientContextService;
            this.provider = other.provider;
            this.invoker = other.invoker;
            this.options = other.options;
            this.settings = other.settings;
            this.historyWindow = other.historyWindow;
            return this;
        }

        public ResponseGenerator build() {
            return new ResponseGenerator(this);
        }
    }
}
