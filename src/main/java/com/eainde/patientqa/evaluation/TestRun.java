package com.eainde.patientqa.evaluation;

import com.eainde.patientqa.judge.JudgeScore;
import com.eainde.patientqa.review.HumanScore;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One evaluation run. Owns its responses and scores exclusively; all result
 * collections are append-only and safe for concurrent appends from harness workers.
 * Human scores are kept in arrival order.
 */
@JsonPropertyOrder({"id", "startedAt", "completedAt", "status", "cases", "configIds",
        "responses", "judgeScores", "humanScores", "skipped"})
public class TestRun {

    private final String id;
    private final Instant startedAt;
    private final List<EvaluationCase> cases;
    private final List<String> configIds;
    private final List<ModelResponse> responses;
    private final List<JudgeScore> judgeScores;
    private final List<HumanScore> humanScores;
    private final List<PairKey> skipped;
    private volatile Instant completedAt;
    private volatile RunStatus status;

    public TestRun(String id, Instant startedAt, List<EvaluationCase> cases, List<String> configIds) {
        this(id, startedAt, null, RunStatus.RUNNING, cases, configIds, null, null, null, null);
    }

    @JsonCreator
    public TestRun(@JsonProperty("id") String id,
                   @JsonProperty("startedAt") Instant startedAt,
                   @JsonProperty("completedAt") Instant completedAt,
                   @JsonProperty("status") RunStatus status,
                   @JsonProperty("cases") List<EvaluationCase> cases,
                   @JsonProperty("configIds") List<String> configIds,
                   @JsonProperty("responses") List<ModelResponse> responses,
                   @JsonProperty("judgeScores") List<JudgeScore> judgeScores,
                   @JsonProperty("humanScores") List<HumanScore> humanScores,
                   @JsonProperty("skipped") List<PairKey> skipped) {
        this.id = Objects.requireNonNull(id, "id");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.completedAt = completedAt;
        this.status = status == null ? RunStatus.RUNNING : status;
        this.cases = cases == null ? List.of() : List.copyOf(cases);
        this.configIds = configIds == null ? List.of() : List.copyOf(configIds);
        this.responses = synchronizedCopy(responses);
        this.judgeScores = synchronizedCopy(judgeScores);
        this.humanScores = synchronizedCopy(humanScores);
        this.skipped = synchronizedCopy(skipped);
    }

    private static <T> List<T> synchronizedCopy(List<T> source) {
        return Collections.synchronizedList(source == null ? new ArrayList<>() : new ArrayList<>(source));
    }

    private static <T> List<T> snapshot(List<T> list) {
        synchronized (list) {
            return List.copyOf(list);
        }
    }

    // ---- appends ----

    public void addResponse(ModelResponse response) {
        responses.add(Objects.requireNonNull(response));
    }

    public void addJudgeScore(JudgeScore score) {
        judgeScores.add(Objects.requireNonNull(score));
    }

    public void addHumanScore(HumanScore score) {
        humanScores.add(Objects.requireNonNull(score));
    }

    public void markSkipped(PairKey pair) {
        skipped.add(Objects.requireNonNull(pair));
    }

    public void complete(RunStatus finalStatus, Instant at) {
        this.status = finalStatus;
        this.completedAt = at;
    }

    // ---- lookups ----

    public Optional<EvaluationCase> findCase(String caseId) {
        return cases.stream().filter(c -> c.id().equals(caseId)).findFirst();
    }

    public Optional<ModelResponse> findResponse(String caseId, String configId) {
        return getResponses().stream()
                .filter(r -> r.caseId().equals(caseId) && r.configId().equals(configId))
                .findFirst();
    }

    public Optional<JudgeScore> findJudgeScore(String caseId, String configId) {
        return getJudgeScores().stream()
                .filter(s -> s.caseId().equals(caseId) && s.configId().equals(configId))
                .findFirst();
    }

    /** Human scores for one pair, oldest first. */
    public List<HumanScore> findHumanScores(String caseId, String configId) {
        return getHumanScores().stream()
                .filter(s -> s.caseId().equals(caseId) && s.configId().equals(configId))
                .toList();
    }

    // ---- accessors ----

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("startedAt")
    public Instant getStartedAt() {
        return startedAt;
    }

    @JsonProperty("completedAt")
    public Instant getCompletedAt() {
        return completedAt;
    }

    @JsonProperty("status")
    public RunStatus getStatus() {
        return status;
    }

    @JsonProperty("cases")
    public List<EvaluationCase> getCases() {
        return cases;
    }

    @JsonProperty("configIds")
    public List<String> getConfigIds() {
        return configIds;
    }

    @JsonProperty("responses")
    public List<ModelResponse> getResponses() {
        return snapshot(responses);
    }

    @JsonProperty("judgeScores")
    public List<JudgeScore> getJudgeScores() {
        return snapshot(judgeScores);
    }

    @JsonProperty("humanScores")
    public List<HumanScore> getHumanScores() {
        return snapshot(humanScores);
    }

    @JsonProperty("skipped")
    public List<PairKey> getSkipped() {
        return snapshot(skipped);
    }
}
