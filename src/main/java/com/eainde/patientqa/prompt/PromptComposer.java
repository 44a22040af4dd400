package com.eainde.patientqa.prompt;

import com.eainde.patientqa.config.ConfigurationException;
import com.eainde.patientqa.context.PatientContext;
import com.eainde.patientqa.memory.Message;
import com.eainde.patientqa.memory.Role;
import com.eainde.patientqa.retrieval.RetrievedChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Assembles the model input in a fixed order:
 * <ol>
 *   <li>safety policy</li>
 *   <li>patient context, if any</li>
 *   <li>retrieved chunks: ranked, deduplicated by source span, cut to the chunk budget</li>
 *   <li>trailing window of session history</li>
 *   <li>the current question</li>
 * </ol>
 *
 * <p>The payload never exceeds {@code maxPromptChars}. Trimming drops the
 * lowest-ranked chunks first, then the oldest history, then patient context,
 * and finally shortens the question. The safety policy is never touched.</p>
 */
public class PromptComposer {

    private static final Logger log = LoggerFactory.getLogger(PromptComposer.class);

    static final String CONTEXT_HEADER = "\n\n## Patient context\n";
    static final String REFERENCE_HEADER = "\n\n## Reference material\n"
            + "Answer only from the material below when it is relevant. If it does not cover the question, say so.\n";

    private final ComposerSettings settings;

    public PromptComposer(ComposerSettings settings) {
        this.settings = settings;
    }

    /**
     * Validates that the policy leaves room for a question under the ceiling.
     */
    public void validate(SafetyPolicy policy) {
        if (policy.text().length() >= settings.maxPromptChars()) {
            throw new ConfigurationException("Safety policy (" + policy.text().length()
                    + " chars) does not fit the prompt ceiling of " + settings.maxPromptChars() + " chars");
        }
    }

    public PromptPayload compose(List<Message> sessionHistory,
                                 List<RetrievedChunk> retrievedChunks,
                                 PatientContext patientContext,
                                 SafetyPolicy safetyPolicy,
                                 String question) {
        validate(safetyPolicy);

        List<RetrievedChunk> chunks = fitToChunkBudget(rankAndDeduplicate(retrievedChunks));
        List<Message> history = trailingWindow(sessionHistory);
        boolean includeContext = patientContext != null && !patientContext.isEmpty();
        String q = question == null ? "" : question;

        int trimmedChunks = 0;
        int trimmedMessages = 0;
        String systemText = systemText(safetyPolicy, includeContext ? patientContext : null, chunks);

        while (PromptPayload.lengthOf(systemText, history, q) > settings.maxPromptChars()) {
            if (!chunks.isEmpty()) {
                chunks.remove(chunks.size() - 1);
                trimmedChunks++;
            } else if (!history.isEmpty()) {
                history.remove(0);
                trimmedMessages++;
            } else if (includeContext) {
                includeContext = false;
            } else {
                int room = settings.maxPromptChars() - systemText.length();
                q = q.substring(0, Math.max(0, room));
                log.warn("Question truncated to {} chars to respect the prompt ceiling", q.length());
                break;
            }
            systemText = systemText(safetyPolicy, includeContext ? patientContext : null, chunks);
        }

        if (trimmedChunks > 0 || trimmedMessages > 0) {
            log.debug("Prompt trimmed: {} chunks, {} history messages dropped", trimmedChunks, trimmedMessages);
        }
        return new PromptPayload(systemText, history, q, chunks, includeContext, trimmedChunks, trimmedMessages);
    }

    List<RetrievedChunk> rankAndDeduplicate(List<RetrievedChunk> retrieved) {
        if (retrieved == null || retrieved.isEmpty()) {
            return new ArrayList<>();
        }
        List<RetrievedChunk> ranked = new ArrayList<>(retrieved);
        ranked.sort(Comparator.comparingDouble(RetrievedChunk::score).reversed());

        Set<String> seen = new HashSet<>();
        List<RetrievedChunk> unique = new ArrayList<>();
        for (RetrievedChunk chunk : ranked) {
            if (chunk.text() == null || chunk.text().isBlank()) continue;
            if (seen.add(chunk.spanKey())) {
                unique.add(chunk);
            }
        }
        return unique;
    }

    private List<RetrievedChunk> fitToChunkBudget(List<RetrievedChunk> ranked) {
        List<RetrievedChunk> kept = new ArrayList<>();
        int remaining = settings.chunkBudgetChars();
        for (RetrievedChunk chunk : ranked) {
            if (remaining <= 0) break;
            String text = chunk.text();
            if (text.length() > remaining) {
                kept.add(new RetrievedChunk(chunk.sourceId(), text.substring(0, remaining), chunk.score()));
                break;
            }
            kept.add(chunk);
            remaining -= text.length();
        }
        return kept;
    }

    private List<Message> trailingWindow(List<Message> sessionHistory) {
        if (sessionHistory == null || sessionHistory.isEmpty()) {
            return new ArrayList<>();
        }
        List<Message> conversational = sessionHistory.stream()
                .filter(m -> m.role() != Role.SYSTEM_NOTE)
                .toList();
        int from = Math.max(0, conversational.size() - settings.historyWindow());
        return new ArrayList<>(conversational.subList(from, conversational.size()));
    }

    private static String systemText(SafetyPolicy policy, PatientContext context, List<RetrievedChunk> chunks) {
        StringBuilder sb = new StringBuilder(policy.text());
        if (context != null) {
            sb.append(CONTEXT_HEADER).append(context.render());
        }
        if (!chunks.isEmpty()) {
            sb.append(REFERENCE_HEADER);
            for (int i = 0; i < chunks.size(); i++) {
                RetrievedChunk c = chunks.get(i);
                sb.append("\n[").append(i + 1).append("] (source: ").append(c.sourceId()).append(")\n")
                        .append(c.text()).append('\n');
            }
        }
        return sb.toString();
    }
}
