package com.eainde.patientqa.review;

import com.eainde.patientqa.evaluation.CaseCategory;
import com.eainde.patientqa.evaluation.EvaluationCase;
import com.eainde.patientqa.evaluation.ModelResponse;
import com.eainde.patientqa.evaluation.TestRun;
import com.eainde.patientqa.judge.RubricDimension;
import com.eainde.patientqa.judge.Verdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleReviewSessionTest {

    private static final Instant NOW = Instant.parse("2024-05-02T09:00:00Z");

    private TestRun run;
    private ByteArrayOutputStream output;

    @BeforeEach
    void setUp() {
        run = new TestRun("run-1", NOW, List.of(
                EvaluationCase.single("c1", CaseCategory.COMMON, "What foods help?"),
                EvaluationCase.single("c2", CaseCategory.COMMON, "How much water?"),
                EvaluationCase.single("c3", CaseCategory.COMMON, "Is coffee ok?")),
                List.of("claude"));
        run.addResponse(new ModelResponse("c1", "claude", "Fiber.", List.of(), 10, false, false, null, null, null));
        run.addResponse(ModelResponse.failed("c2", "claude", "", 10, "Generation failed: 401"));
        run.addResponse(new ModelResponse("c3", "claude", "In moderation.", List.of(), 10, false, false, null, null, null));
        output = new ByteArrayOutputStream();
    }

    private int review(String input) {
        ConsoleReviewSession session = new ConsoleReviewSession(new BufferedReader(new StringReader(input)),
                new PrintStream(output, true, StandardCharsets.UTF_8), Clock.fixed(NOW, ZoneOffset.UTC));
        return session.review(new HumanReviewService(run));
    }

    @Test
    @DisplayName("scores, verdict and notes are submitted for completed responses only")
    void reviewsCompletedResponses() {
        String input = String.join("\n",
                "dr-a",
                "90", "", "abc", "80", "70", "60",
                "pass",
                "clear answer",
                "50", "50", "50", "50", "50",
                "maybe", "FAIL",
                "",
                "");

        int submitted = review(input);

        assertThat(submitted).isEqualTo(2);
        List<HumanScore> scores = run.getHumanScores();
        assertThat(scores).extracting(HumanScore::caseId).containsExactly("c1", "c3");
        HumanScore first = scores.get(0);
        assertThat(first.verdict()).isEqualTo(Verdict.PASS);
        assertThat(first.notes()).isEqualTo("clear answer");
        assertThat(first.scores()).doesNotContainKey(RubricDimension.SAFETY).containsEntry(RubricDimension.SCOPE, 60.0);
        assertThat(first.submittedAt()).isEqualTo(NOW);
        assertThat(scores.get(1).verdict()).isEqualTo(Verdict.FAIL);
        assertThat(output.toString(StandardCharsets.UTF_8))
                .contains("Please enter a number between 0 and 100.")
                .contains("Please enter PASS, REVISE or FAIL.")
                .doesNotContain("c2 / claude");
    }

    @Test
    @DisplayName("s skips a response and q ends the session")
    void skipAndQuit() {
        String input = String.join("\n",
                "dr-a",
                "", "", "", "", "", "s",
                "", "", "", "", "", "q");

        assertThat(review(input)).isZero();
        assertThat(run.getHumanScores()).isEmpty();
    }

    @Test
    @DisplayName("end of input ends the session without error")
    void endOfInput() {
        assertThat(review("dr-a\n90\n")).isZero();
        assertThat(review("")).isZero();
    }
}
