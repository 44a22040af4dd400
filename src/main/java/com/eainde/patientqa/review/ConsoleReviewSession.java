package com.eainde.patientqa.review;

import com.eainde.patientqa.evaluation.EvaluationCase;
import com.eainde.patientqa.evaluation.ModelResponse;
import com.eainde.patientqa.evaluation.TestRun;
import com.eainde.patientqa.judge.JudgeScore;
import com.eainde.patientqa.judge.RubricDimension;
import com.eainde.patientqa.judge.Verdict;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Line-oriented review of a stored run. For every completed response the reviewer
 * enters a 0-100 score per dimension (blank skips the dimension), a verdict,
 * optional notes. Entering {@code s} at the verdict prompt skips the response,
 * {@code q} ends the session. End of input ends the session too.
 */
@Slf4j
public class ConsoleReviewSession {

    private static final String RULE = "=".repeat(72);

    private final BufferedReader in;
    private final PrintStream out;
    private final Clock clock;

    public ConsoleReviewSession(BufferedReader in, PrintStream out) {
        this(in, out, Clock.systemUTC());
    }

    public ConsoleReviewSession(BufferedReader in, PrintStream out, Clock clock) {
        this.in = in;
        this.out = out;
        this.clock = clock;
    }

    /**
     * @return number of reviews submitted
     */
    public int review(HumanReviewService service) {
        TestRun run = service.getRun();
        String reviewerId = prompt("Reviewer id: ");
        if (reviewerId == null || reviewerId.isBlank()) {
            out.println("No reviewer id given, nothing to review.");
            return 0;
        }

        List<ModelResponse> responses = run.getResponses().stream().filter(r -> !r.isFailed()).toList();
        int submitted = 0;
        for (int i = 0; i < responses.size(); i++) {
            ModelResponse response = responses.get(i);
            show(run, response, i + 1, responses.size());

            Map<RubricDimension, Double> scores = new EnumMap<>(RubricDimension.class);
            for (RubricDimension dimension : RubricDimension.values()) {
                ScoreInput input = readScore(dimension);
                if (input.endOfInput()) {
                    return finish(submitted);
                }
                if (input.value() != null) {
                    scores.put(dimension, input.value());
                }
            }

            Verdict verdict = null;
            while (verdict == null) {
                String answer = prompt("Verdict (PASS/REVISE/FAIL, s=skip, q=quit): ");
                if (answer == null || answer.equalsIgnoreCase("q")) {
                    return finish(submitted);
                }
                if (answer.equalsIgnoreCase("s")) {
                    break;
                }
                try {
                    verdict = Verdict.parse(answer);
                } catch (IllegalArgumentException e) {
                    out.println("Please enter PASS, REVISE or FAIL.");
                }
            }
            if (verdict == null) {
                continue;
            }

            String notes = prompt("Notes (optional): ");
            service.submit(response.caseId(), response.configId(), new HumanScore(response.caseId(),
                    response.configId(), reviewerId.strip(), scores, notes == null ? "" : notes.strip(),
                    verdict, clock.instant()));
            submitted++;
        }
        return finish(submitted);
    }

    private void show(TestRun run, ModelResponse response, int index, int total) {
        out.println();
        out.println(RULE);
        out.printf("Case %d of %d: %s / %s%n", index, total, response.caseId(), response.configId());
        out.println(RULE);
        run.findCase(response.caseId()).map(EvaluationCase::questions).ifPresent(questions -> {
            out.println("PATIENT QUESTION:");
            questions.forEach(q -> out.println("  " + q));
        });
        out.println("ASSISTANT ANSWER:");
        out.println(response.text());
        if (response.redFlag()) {
            out.println("[red flag: " + response.redFlagRuleId() + ", " + response.severity() + "]");
        }
        run.findJudgeScore(response.caseId(), response.configId())
                .filter(JudgeScore::isScored)
                .ifPresent(s -> out.printf("Judge: %s%% %s%n", s.overallPercentage(), s.verdict()));
        List<HumanScore> previous = run.findHumanScores(response.caseId(), response.configId());
        if (!previous.isEmpty()) {
            out.println("Previous reviews: " + previous.size());
        }
        out.println(RULE);
    }

    private ScoreInput readScore(RubricDimension dimension) {
        while (true) {
            String answer = prompt(dimension.getDisplayName() + " (0-100, blank to skip): ");
            if (answer == null) {
                return new ScoreInput(true, null);
            }
            if (answer.isBlank()) {
                return new ScoreInput(false, null);
            }
            try {
                double value = Double.parseDouble(answer.strip());
                if (value >= 0 && value <= 100) {
                    return new ScoreInput(false, value);
                }
            } catch (NumberFormatException e) {
                log.debug("Rejected score input '{}'", answer);
            }
            out.println("Please enter a number between 0 and 100.");
        }
    }

    private String prompt(String text) {
        out.print(text);
        out.flush();
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read reviewer input", e);
        }
    }

    private int finish(int submitted) {
        out.println();
        out.println("Submitted " + submitted + " review(s).");
        return submitted;
    }

    /** A null value means the dimension was skipped. */
    private record ScoreInput(boolean endOfInput, Double value) {}
}
