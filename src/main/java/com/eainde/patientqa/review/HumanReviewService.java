package com.eainde.patientqa.review;

import com.eainde.patientqa.evaluation.ModelResponse;
import com.eainde.patientqa.evaluation.PairKey;
import com.eainde.patientqa.evaluation.TestRun;
import com.eainde.patientqa.judge.JudgeScore;
import com.eainde.patientqa.judge.RubricDimension;
import com.eainde.patientqa.judge.Verdict;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Collects human reviews on a run and reconciles them with judge scores.
 * Humans win on disagreement; among several reviews of one pair the most recent
 * by arrival wins and all are kept on the run.
 */
@Slf4j
public class HumanReviewService {

    private final TestRun run;

    public HumanReviewService(TestRun run) {
        this.run = Objects.requireNonNull(run, "run");
    }

    public void submit(String caseId, String configId, HumanScore humanScore) {
        Objects.requireNonNull(humanScore, "humanScore");
        if (!caseId.equals(humanScore.caseId()) || !configId.equals(humanScore.configId())) {
            throw new IllegalArgumentException("Score is for " + humanScore.caseId() + "/" + humanScore.configId()
                    + ", not " + caseId + "/" + configId);
        }
        if (run.findResponse(caseId, configId).isEmpty()) {
            throw new IllegalArgumentException("Run " + run.getId() + " has no response for " + caseId + "/" + configId);
        }
        if (humanScore.reviewerId() == null || humanScore.reviewerId().isBlank()) {
            throw new IllegalArgumentException("Reviewer id is required");
        }
        if (humanScore.verdict() == null || humanScore.verdict() == Verdict.UNSCORED) {
            throw new IllegalArgumentException("Human verdict must be PASS, REVISE or FAIL");
        }
        for (Map.Entry<RubricDimension, Double> entry : humanScore.scores().entrySet()) {
            Double value = entry.getValue();
            if (value == null || value < 0 || value > 100) {
                throw new IllegalArgumentException("Score for " + entry.getKey() + " must be within [0,100]");
            }
        }

        run.addHumanScore(humanScore);
        Optional<JudgeScore> judge = run.findJudgeScore(caseId, configId);
        if (judge.isPresent() && judge.get().isScored() && judge.get().verdict() != humanScore.verdict()) {
            log.info("Reviewer {} overrides judge on {}/{}: {} -> {}", humanScore.reviewerId(), caseId, configId,
                    judge.get().verdict(), humanScore.verdict());
        }
    }

    public ReconciledVerdict reconcile(String caseId, String configId) {
        List<HumanScore> reviews = run.findHumanScores(caseId, configId);
        Verdict judgeVerdict = run.findJudgeScore(caseId, configId).map(JudgeScore::verdict).orElse(null);
        Verdict humanVerdict = reviews.isEmpty() ? null : reviews.get(reviews.size() - 1).verdict();
        return new ReconciledVerdict(new PairKey(caseId, configId), judgeVerdict, humanVerdict, reviews.size());
    }

    public List<ReconciledVerdict> reconcileAll() {
        List<ReconciledVerdict> result = new ArrayList<>();
        for (ModelResponse response : run.getResponses()) {
            result.add(reconcile(response.caseId(), response.configId()));
        }
        return result;
    }

    /** Pairs where a scored judge verdict differs from the latest human verdict. */
    public List<VerdictDiscrepancy> discrepancies() {
        List<VerdictDiscrepancy> result = new ArrayList<>();
        for (ModelResponse response : run.getResponses()) {
            List<HumanScore> reviews = run.findHumanScores(response.caseId(), response.configId());
            Optional<JudgeScore> judge = run.findJudgeScore(response.caseId(), response.configId());
            if (reviews.isEmpty() || judge.isEmpty() || !judge.get().isScored()) {
                continue;
            }
            HumanScore latest = reviews.get(reviews.size() - 1);
            JudgeScore score = judge.get();
            if (score.verdict() != latest.verdict()) {
                result.add(new VerdictDiscrepancy(response.key(), score.verdict(), latest.verdict(),
                        score.overallPercentage(), latest.reviewerId(),
                        rank(score.verdict()) > rank(latest.verdict())));
            }
        }
        return result;
    }

    /**
     * Share of human-reviewed, judge-scored pairs where the judge was more lenient
     * than the human. 0 when nothing has been reviewed.
     */
    public double judgeOverestimateRate() {
        int compared = 0;
        int overestimated = 0;
        for (ModelResponse response : run.getResponses()) {
            List<HumanScore> reviews = run.findHumanScores(response.caseId(), response.configId());
            Optional<JudgeScore> judge = run.findJudgeScore(response.caseId(), response.configId());
            if (reviews.isEmpty() || judge.isEmpty() || !judge.get().isScored()) {
                continue;
            }
            compared++;
            if (rank(judge.get().verdict()) > rank(reviews.get(reviews.size() - 1).verdict())) {
                overestimated++;
            }
        }
        return compared == 0 ? 0.0 : (double) overestimated / compared;
    }

    public TestRun getRun() {
        return run;
    }

    static int rank(Verdict verdict) {
        return switch (verdict) {
            case PASS -> 2;
            case REVISE -> 1;
            case FAIL, UNSCORED -> 0;
        };
    }
}
