package com.eainde.patientqa.evaluation;

import com.eainde.patientqa.config.ConfigurationException;
import com.eainde.patientqa.judge.JudgeScore;
import com.eainde.patientqa.judge.RubricJudge;
import com.eainde.patientqa.memory.ConversationMemoryStore;
import com.eainde.patientqa.memory.InMemorySessionRepository;
import com.eainde.patientqa.pipeline.ResponseGenerator;
import com.eainde.patientqa.pipeline.TurnResult;
import com.eainde.patientqa.provider.ModelConfig;
import com.eainde.patientqa.redflag.RedFlagMatch;
import com.eainde.patientqa.thread.MdcAwareExecutor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Replays a case set against candidate model configurations and judges each answer.
 *
 * <p>Every (case, configuration) pair runs in isolation with its own memory
 * store and session. A failing pair is recorded with a failure marker and never
 * aborts the run. At most {@code concurrency} pairs are in flight. Cancellation
 * and the total-run timeout stop scheduling; pairs already started finish and
 * their results are kept.</p>
 *
 * <p>Configuration problems are not per-pair failures. Every candidate is prepared
 * before the first pair is scheduled, and a {@link ConfigurationException} raised
 * later still stops the run and is rethrown.</p>
 */
@Slf4j
public class EvaluationHarness {

    private static final DateTimeFormatter RUN_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final GeneratorFactory generatorFactory;
    private final RubricJudge judge;
    private final HarnessSettings settings;
    private final Clock clock;

    /**
     * @param judge rubric judge, or null to collect responses without judging
     */
    public EvaluationHarness(GeneratorFactory generatorFactory, RubricJudge judge, HarnessSettings settings) {
        this(generatorFactory, judge, settings, Clock.systemUTC());
    }

    public EvaluationHarness(GeneratorFactory generatorFactory, RubricJudge judge, HarnessSettings settings, Clock clock) {
        this.generatorFactory = generatorFactory;
        this.judge = judge;
        this.settings = settings;
        this.clock = clock;
    }

    public TestRun run(List<EvaluationCase> cases, List<ModelConfig> configs) {
        return run(cases, configs, new CancellationToken());
    }

    public TestRun run(List<EvaluationCase> cases, List<ModelConfig> configs, CancellationToken cancellation) {
        checkUnique(cases, configs);
        for (ModelConfig config : configs) {
            generatorFactory.prepare(config);
        }
        Instant startedAt = clock.instant();
        String runId = newRunId(startedAt);
        TestRun run = new TestRun(runId, startedAt, cases, configs.stream().map(ModelConfig::id).toList());

        MDC.put("runId", runId);
        log.info("Starting run {}: {} case(s) x {} configuration(s), concurrency={}",
                runId, cases.size(), configs.size(), settings.concurrency());

        long deadline = System.nanoTime() + settings.runTimeout().toNanos();
        Semaphore permits = new Semaphore(settings.concurrency());
        List<CompletableFuture<Void>> inFlight = new ArrayList<>();
        AtomicReference<ConfigurationException> configurationError = new AtomicReference<>();
        RunStatus status = RunStatus.COMPLETED;

        MdcAwareExecutor executor = new MdcAwareExecutor(settings.concurrency(), "eval-" + runId);
        try {
            List<Pair> pairs = pairs(cases, configs);
            for (int i = 0; i < pairs.size(); i++) {
                Pair pair = pairs.get(i);
                RunStatus stop = acquire(permits, deadline, cancellation);
                // a worker records the error before releasing its permit
                if (stop == null && configurationError.get() != null) {
                    permits.release();
                    stop = RunStatus.CANCELLED;
                }
                if (stop != null) {
                    status = stop;
                    List<Pair> remaining = pairs.subList(i, pairs.size());
                    remaining.forEach(p -> run.markSkipped(p.key()));
                    log.warn("Run {} {}: {} pair(s) not scheduled", runId, stop, remaining.size());
                    break;
                }
                inFlight.add(CompletableFuture.runAsync(() -> {
                    try {
                        evaluatePair(run, pair);
                    } catch (ConfigurationException e) {
                        configurationError.compareAndSet(null, e);
                    } finally {
                        permits.release();
                    }
                }, executor));
            }
            CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0])).join();
        } finally {
            executor.shutdown();
            MDC.remove("runId");
        }

        if (configurationError.get() != null) {
            log.error("Run {} stopped by a configuration error: {}", runId, configurationError.get().getMessage());
            throw configurationError.get();
        }

        run.complete(status, clock.instant());
        log.info("Run {} finished with status {}: {} response(s), {} skipped",
                runId, status, run.getResponses().size(), run.getSkipped().size());
        return run;
    }

    /**
     * @return null when a permit was obtained, otherwise the reason scheduling stops
     */
    private static RunStatus acquire(Semaphore permits, long deadline, CancellationToken cancellation) {
        if (cancellation.isCancelled()) {
            return RunStatus.CANCELLED;
        }
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
            return RunStatus.TIMED_OUT;
        }
        try {
            if (!permits.tryAcquire(remaining, TimeUnit.NANOSECONDS)) {
                return RunStatus.TIMED_OUT;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RunStatus.CANCELLED;
        }
        if (cancellation.isCancelled()) {
            permits.release();
            return RunStatus.CANCELLED;
        }
        return null;
    }

    private void evaluatePair(TestRun run, Pair pair) {
        EvaluationCase evaluationCase = pair.evaluationCase();
        ModelConfig config = pair.config();
        MDC.put("caseId", evaluationCase.id());
        MDC.put("configId", config.id());
        long started = System.nanoTime();
        try {
            ModelResponse response = respond(run.getId(), evaluationCase, config, started);
            run.addResponse(response);

            if (response.isFailed()) {
                log.warn("Pair {} failed: {}", pair.key(), response.failure());
                return;
            }
            if (judge != null) {
                JudgeScore score = judgeQuietly(evaluationCase, response);
                run.addJudgeScore(score);
                log.info("Pair {} done in {}ms: redFlag={} verdict={}",
                        pair.key(), response.latencyMs(), response.redFlag(), score.verdict());
            } else {
                log.info("Pair {} done in {}ms: redFlag={}", pair.key(), response.latencyMs(), response.redFlag());
            }
        } finally {
            MDC.remove("caseId");
            MDC.remove("configId");
        }
    }

    private ModelResponse respond(String runId, EvaluationCase evaluationCase, ModelConfig config, long started) {
        String sessionId = "run-" + runId + "-" + evaluationCase.id() + "-" + config.id();
        try {
            ResponseGenerator generator = generatorFactory.create(config,
                    new ConversationMemoryStore(new InMemorySessionRepository()));

            TurnResult last = null;
            RedFlagMatch strongest = null;
            boolean questionFlagged = false;
            for (String question : evaluationCase.questions()) {
                last = generator.respond(sessionId, question);
                questionFlagged |= last.preCheck() != null;
                RedFlagMatch match = last.strongestMatch();
                if (match != null && (strongest == null || match.severity().isAbove(strongest.severity()))) {
                    strongest = match;
                }
                if (last.fallback()) {
                    return ModelResponse.failed(evaluationCase.id(), config.id(), last.answer(), elapsedMs(started),
                            "Generation failed: " + last.failureReason());
                }
            }
            return new ModelResponse(evaluationCase.id(), config.id(), last.answer(), last.chunks(),
                    elapsedMs(started), strongest != null, questionFlagged,
                    strongest == null ? null : strongest.severity(),
                    strongest == null ? null : strongest.ruleId(),
                    null);
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Pair {}/{} raised an error", evaluationCase.id(), config.id(), e);
            return ModelResponse.failed(evaluationCase.id(), config.id(), null, elapsedMs(started),
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private JudgeScore judgeQuietly(EvaluationCase evaluationCase, ModelResponse response) {
        try {
            return judge.score(evaluationCase, response);
        } catch (RuntimeException e) {
            log.error("Judge raised an error for {}", response.key(), e);
            return JudgeScore.unscored(evaluationCase.id(), response.configId(),
                    "Judge error: " + e.getMessage(), null);
        }
    }

    private static List<Pair> pairs(List<EvaluationCase> cases, List<ModelConfig> configs) {
        List<Pair> pairs = new ArrayList<>(cases.size() * configs.size());
        for (EvaluationCase evaluationCase : cases) {
            for (ModelConfig config : configs) {
                pairs.add(new Pair(evaluationCase, config));
            }
        }
        return pairs;
    }

    private static void checkUnique(List<EvaluationCase> cases, List<ModelConfig> configs) {
        Set<String> caseIds = new HashSet<>();
        for (EvaluationCase c : cases) {
            if (!caseIds.add(c.id())) throw new IllegalArgumentException("Duplicate case id: " + c.id());
        }
        Set<String> configIds = new HashSet<>();
        for (ModelConfig c : configs) {
            if (!configIds.add(c.id())) throw new IllegalArgumentException("Duplicate configuration id: " + c.id());
        }
    }

    private static String newRunId(Instant startedAt) {
        return RUN_ID_FORMAT.format(startedAt) + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static long elapsedMs(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }

    private record Pair(EvaluationCase evaluationCase, ModelConfig config) {
        PairKey key() {
            return new PairKey(evaluationCase.id(), config.id());
        }
    }
}
