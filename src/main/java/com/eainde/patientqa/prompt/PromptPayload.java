package com.eainde.patientqa.prompt;

import com.eainde.patientqa.memory.Message;
import com.eainde.patientqa.retrieval.RetrievedChunk;

import java.util.List;

/**
 * Model input produced by {@link PromptComposer}.
 *
 * @param systemText      safety policy, patient context and reference material
 * @param history         prior conversation turns, oldest first
 * @param question        the patient's current message
 * @param chunks          retrieved chunks that made it into {@code systemText}
 * @param patientContextIncluded whether patient context survived trimming
 * @param trimmedChunks   chunks removed to respect the ceiling
 * @param trimmedMessages history messages removed to respect the ceiling
 */
public record PromptPayload(
        String systemText,
        List<Message> history,
        String question,
        List<RetrievedChunk> chunks,
        boolean patientContextIncluded,
        int trimmedChunks,
        int trimmedMessages
) {

    public PromptPayload {
        history = List.copyOf(history);
        chunks = List.copyOf(chunks);
    }

    /**
     * Single-turn payload with no retrieval or history, e.g. a rubric prompt.
     */
    public static PromptPayload instruction(String systemText, String userText) {
        return new PromptPayload(systemText, List.of(), userText, List.of(), false, 0, 0);
    }

    /** Size measured against the configured ceiling. */
    public int totalLength() {
        return lengthOf(systemText, history, question);
    }

    static int lengthOf(String systemText, List<Message> history, String question) {
        int total = systemText.length() + question.length();
        for (Message m : history) {
            total += m.text().length();
        }
        return total;
    }

    /** Flattened single-string rendering, used for logging and single-shot models. */
    public String render() {
        StringBuilder sb = new StringBuilder(systemText);
        if (!history.isEmpty()) {
            sb.append("\n\n## Conversation so far\n");
            for (Message m : history) {
                sb.append(m.role().getWireName()).append(": ").append(m.text()).append('\n');
            }
        }
        sb.append("\n\n## Patient question\n").append(question);
        return sb.toString();
    }
}
