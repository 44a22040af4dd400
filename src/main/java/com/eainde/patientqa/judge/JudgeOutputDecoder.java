package com.eainde.patientqa.judge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strict decoder for rubric judge output. Either every dimension carries a numeric
 * score within [0,100] and a {@link JudgeScore} is produced, or the whole output is
 * rejected with {@link JudgeParseException}. Any overall figure in the output is
 * ignored; the overall percentage is always recomputed from the dimension scores.
 */
@Slf4j
public class JudgeOutputDecoder {

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;
    private final RubricSettings settings;

    public JudgeOutputDecoder(ObjectMapper objectMapper, RubricSettings settings) {
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    public JudgeScore decode(String caseId, String configId, String rawOutput) {
        JsonNode root = parse(extractJson(rawOutput));

        Map<RubricDimension, Double> scores = new EnumMap<>(RubricDimension.class);
        StringBuilder rationale = new StringBuilder();
        for (RubricDimension dimension : RubricDimension.values()) {
            JsonNode entry = root.get(dimension.getKey());
            if (entry == null || !entry.isObject()) {
                throw new JudgeParseException("Missing dimension '" + dimension.getKey() + "'");
            }
            JsonNode score = entry.get("score");
            if (score == null || !score.isNumber()) {
                throw new JudgeParseException("Dimension '" + dimension.getKey() + "' has no numeric score");
            }
            double value = score.asDouble();
            if (!Double.isFinite(value) || value < 0 || value > 100) {
                throw new JudgeParseException("Dimension '" + dimension.getKey() + "' score " + value
                        + " is outside [0,100]");
            }
            scores.put(dimension, value);

            JsonNode reasoning = entry.get("reasoning");
            if (reasoning != null && reasoning.isTextual() && !reasoning.asText().isBlank()) {
                rationale.append(dimension.getDisplayName()).append(": ").append(reasoning.asText().strip()).append('\n');
            }
        }

        JsonNode summary = root.get("summary");
        if (summary != null && summary.isTextual()) {
            rationale.insert(0, summary.asText().strip() + "\n");
        }

        double overall = settings.aggregation().aggregate(scores);
        Verdict verdict = settings.verdictPolicy().classify(scores, overall);
        log.debug("Decoded judge output for {}/{}: overall={} verdict={}", caseId, configId, overall, verdict);
        return new JudgeScore(caseId, configId, scores, overall, verdict, rationale.toString().strip(),
                settings.rubricVersion());
    }

    /**
     * Prefers a fenced JSON block, otherwise takes the outermost braces.
     */
    static String extractJson(String rawOutput) {
        if (rawOutput == null || rawOutput.isBlank()) {
            throw new JudgeParseException("Judge output is empty");
        }
        Matcher fenced = FENCED.matcher(rawOutput);
        if (fenced.find()) {
            return fenced.group(1);
        }
        int start = rawOutput.indexOf('{');
        int end = rawOutput.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new JudgeParseException("No JSON object in judge output");
        }
        return rawOutput.substring(start, end + 1);
    }

    private JsonNode parse(String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new JudgeParseException("Judge output is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new JudgeParseException("Judge output is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
