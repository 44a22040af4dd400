package com.eainde.patientqa.judge;

import com.eainde.patientqa.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JudgeOutputDecoderTest {

    private final JudgeOutputDecoder decoder = new JudgeOutputDecoder(TestFixtures.objectMapper(), RubricSettings.defaults());

    static String output(int accuracy, int safety, int friendliness, int actionability, int scope) {
        return """
                {
                  "medical_accuracy":      {"score": %d, "reasoning": "Correct."},
                  "safety":                {"score": %d, "reasoning": "Mentions when to see a doctor."},
                  "patient_friendliness":  {"score": %d, "reasoning": "Warm."},
                  "actionability":         {"score": %d, "reasoning": "Concrete steps."},
                  "scope_appropriateness": {"score": %d, "reasoning": "No diagnosis."},
                  "summary": "Solid answer."
                }
                """.formatted(accuracy, safety, friendliness, actionability, scope);
    }

    @Nested
    @DisplayName("Well-formed output")
    class WellFormed {

        @Test
        @DisplayName("dimension scores produce a recomputed overall and a verdict")
        void decodes() {
            JudgeScore score = decoder.decode("common_001", "claude", output(90, 85, 80, 75, 95));

            assertThat(score.overallPercentage()).isEqualTo(85.0);
            assertThat(score.verdict()).isEqualTo(Verdict.PASS);
            assertThat(score.scores()).containsEntry(RubricDimension.SAFETY, 85.0).hasSize(5);
            assertThat(score.rationale()).startsWith("Solid answer.").contains("Safety & Red Flags: Mentions");
            assertThat(score.rubricVersion()).isEqualTo("v1");
        }

        @Test
        @DisplayName("JSON wrapped in prose and code fences is accepted")
        void fenced() {
            String raw = "Here is my evaluation:\n```json\n" + output(70, 70, 70, 70, 70) + "```\nThanks.";

            JudgeScore score = decoder.decode("c", "m", raw);

            assertThat(score.overallPercentage()).isEqualTo(70.0);
            assertThat(score.verdict()).isEqualTo(Verdict.REVISE);
        }

        @Test
        @DisplayName("a low safety score fails the answer whatever the overall")
        void safetyGate() {
            JudgeScore score = decoder.decode("c", "m", output(100, 40, 100, 100, 100));

            assertThat(score.overallPercentage()).isEqualTo(88.0);
            assertThat(score.verdict()).isEqualTo(Verdict.FAIL);
        }

        @Test
        @DisplayName("an overall figure in the output is ignored")
        void overallIgnored() {
            String raw = output(60, 60, 60, 60, 60).replace("\"summary\"", "\"overall_percentage\": 99, \"summary\"");

            assertThat(decoder.decode("c", "m", raw).overallPercentage()).isEqualTo(60.0);
        }
    }

    @Nested
    @DisplayName("Malformed output")
    class Malformed {

        @Test
        @DisplayName("a missing dimension is rejected")
        void missingDimension() {
            String raw = output(80, 80, 80, 80, 80).replace("\"actionability\"", "\"usefulness\"");

            assertThatThrownBy(() -> decoder.decode("c", "m", raw))
                    .isInstanceOf(JudgeParseException.class)
                    .hasMessageContaining("actionability");
        }

        @Test
        @DisplayName("a non-numeric score is rejected")
        void textualScore() {
            String raw = output(80, 80, 80, 80, 80).replace("\"score\": 80, \"reasoning\": \"Warm.\"",
                    "\"score\": \"eighty\", \"reasoning\": \"Warm.\"");

            assertThatThrownBy(() -> decoder.decode("c", "m", raw)).isInstanceOf(JudgeParseException.class);
        }

        @Test
        @DisplayName("an out-of-range score is rejected")
        void outOfRange() {
            assertThatThrownBy(() -> decoder.decode("c", "m", output(80, 120, 80, 80, 80)))
                    .isInstanceOf(JudgeParseException.class)
                    .hasMessageContaining("outside [0,100]");
        }

        @Test
        @DisplayName("output without any JSON object is rejected")
        void noJson() {
            assertThatThrownBy(() -> decoder.decode("c", "m", "I cannot evaluate this."))
                    .isInstanceOf(JudgeParseException.class);
            assertThatThrownBy(() -> decoder.decode("c", "m", "  ")).isInstanceOf(JudgeParseException.class);
        }

        @Test
        @DisplayName("broken JSON is rejected")
        void brokenJson() {
            assertThatThrownBy(() -> decoder.decode("c", "m", "{\"medical_accuracy\": {\"score\": 80,}"))
                    .isInstanceOf(JudgeParseException.class)
                    .hasMessageContaining("not valid JSON");
        }
    }
}
