package com.eainde.patientqa;

import com.eainde.patientqa.config.AssistantProperties;
import com.eainde.patientqa.config.ConfigurationException;
import com.eainde.patientqa.evaluation.CaseSetLoader;
import com.eainde.patientqa.evaluation.EvaluationCase;
import com.eainde.patientqa.evaluation.EvaluationHarness;
import com.eainde.patientqa.evaluation.RunReport;
import com.eainde.patientqa.evaluation.RunReportBuilder;
import com.eainde.patientqa.evaluation.RunReportFormatter;
import com.eainde.patientqa.evaluation.TestRun;
import com.eainde.patientqa.evaluation.TestRunRepository;
import com.eainde.patientqa.memory.ConversationMemoryStore;
import com.eainde.patientqa.memory.PersistenceException;
import com.eainde.patientqa.memory.SessionSummary;
import com.eainde.patientqa.pipeline.ResponseGenerator;
import com.eainde.patientqa.pipeline.TurnResult;
import com.eainde.patientqa.provider.ModelCatalog;
import com.eainde.patientqa.provider.ModelConfig;
import com.eainde.patientqa.review.ConsoleReviewSession;
import com.eainde.patientqa.review.HumanReviewService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Command-line surface:
 * <pre>
 *   chat [sessionId]      interactive chat loop
 *   evaluate [caseFile]   run the harness and print the report
 *   review &lt;runId&gt;       human review of a stored run
 * </pre>
 */
@Slf4j
@Component
public class AssistantCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_CONFIGURATION = 2;
    public static final int EXIT_USAGE = 64;

    static final String USAGE = "Usage: chat [sessionId] | evaluate [caseFile] | review <runId>";
    static final String DEFAULT_SESSION = "local-user";

    private final AssistantProperties properties;
    private final ObjectProvider<ResponseGenerator> chatGenerator;
    private final ObjectProvider<EvaluationHarness> harness;
    private final ConversationMemoryStore memoryStore;
    private final CaseSetLoader caseSetLoader;
    private final ModelCatalog catalog;
    private final TestRunRepository runRepository;
    private final RunReportBuilder reportBuilder;
    private final BufferedReader in;
    private final PrintStream out;

    private int exitCode = EXIT_OK;

    public AssistantCommandRunner(AssistantProperties properties,
                                  ObjectProvider<ResponseGenerator> chatGenerator,
                                  ObjectProvider<EvaluationHarness> harness,
                                  ConversationMemoryStore memoryStore,
                                  CaseSetLoader caseSetLoader,
                                  ModelCatalog catalog,
                                  TestRunRepository runRepository,
                                  RunReportBuilder reportBuilder) {
        this(properties, chatGenerator, harness, memoryStore, caseSetLoader, catalog, runRepository, reportBuilder,
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    AssistantCommandRunner(AssistantProperties properties,
                           ObjectProvider<ResponseGenerator> chatGenerator,
                           ObjectProvider<EvaluationHarness> harness,
                           ConversationMemoryStore memoryStore,
                           CaseSetLoader caseSetLoader,
                           ModelCatalog catalog,
                           TestRunRepository runRepository,
                           RunReportBuilder reportBuilder,
                           BufferedReader in,
                           PrintStream out) {
        this.properties = properties;
        this.chatGenerator = chatGenerator;
        this.harness = harness;
        this.memoryStore = memoryStore;
        this.caseSetLoader = caseSetLoader;
        this.catalog = catalog;
        this.runRepository = runRepository;
        this.reportBuilder = reportBuilder;
        this.in = in;
        this.out = out;
    }

    @Override
    public void run(String... args) {
        List<String> positional = Arrays.stream(args).filter(a -> !a.startsWith("--")).toList();
        exitCode = dispatch(positional);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int dispatch(List<String> args) {
        if (args.isEmpty()) {
            out.println(USAGE);
            return EXIT_USAGE;
        }
        String command = args.get(0);
        List<String> rest = args.subList(1, args.size());
        try {
            return switch (command) {
                case "chat" -> rest.size() > 1 ? usage() : chat(rest.isEmpty() ? DEFAULT_SESSION : rest.get(0));
                case "evaluate" -> rest.size() > 1 ? usage() : evaluate(rest.isEmpty() ? null : rest.get(0));
                case "review" -> rest.size() != 1 ? usage() : review(rest.get(0));
                default -> usage();
            };
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage(), e);
            out.println("Configuration error: " + e.getMessage());
            return EXIT_CONFIGURATION;
        }
    }

    private int usage() {
        out.println(USAGE);
        return EXIT_USAGE;
    }

    int chat(String sessionId) {
        ResponseGenerator generator = chatGenerator.getObject();
        out.println("Patient Q&A assistant (" + generator.getModelId() + "), session " + sessionId);
        out.println("Type your question; '/summary' shows the session summary, 'exit' quits.");
        while (true) {
            out.print("> ");
            out.flush();
            String line = readLine();
            if (line == null || line.strip().equalsIgnoreCase("exit") || line.strip().equalsIgnoreCase("quit")) {
                return EXIT_OK;
            }
            if (line.isBlank()) {
                continue;
            }
            if (line.strip().equalsIgnoreCase("/summary")) {
                printSummary(memoryStore.summarize(sessionId));
                continue;
            }
            TurnResult result = generator.respond(sessionId, line);
            out.println();
            out.println(result.answer());
            if (result.redFlag()) {
                out.println("[urgent: " + result.severity() + "]");
            }
            if (!result.persisted()) {
                out.println("(note: this exchange could not be saved)");
            }
            out.println();
        }
    }

    int evaluate(String caseFile) {
        List<EvaluationCase> cases = caseFile == null ? caseSetLoader.loadCurated() : caseSetLoader.load(Path.of(caseFile));
        List<ModelConfig> configs = candidates();
        EvaluationHarness evaluationHarness = harness.getObject();

        TestRun run = evaluationHarness.run(cases, configs);
        RunReport report = reportBuilder.build(run);
        out.println(RunReportFormatter.format(report));
        try {
            runRepository.save(run);
            runRepository.saveReport(report);
            out.println("Results saved under run id " + run.getId());
            return EXIT_OK;
        } catch (PersistenceException e) {
            log.error("Run {} finished but could not be saved", run.getId(), e);
            out.println("Run finished but results could not be saved: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    int review(String runId) {
        Optional<TestRun> stored = runRepository.load(runId);
        if (stored.isEmpty()) {
            out.println("No stored run with id " + runId + ". Known runs: " + runRepository.listRunIds());
            return EXIT_USAGE;
        }
        HumanReviewService service = new HumanReviewService(stored.get());
        int submitted = new ConsoleReviewSession(in, out).review(service);
        if (submitted == 0) {
            return EXIT_OK;
        }
        RunReport report = reportBuilder.build(stored.get());
        runRepository.save(stored.get());
        runRepository.saveReport(report);
        out.println(RunReportFormatter.format(report));
        return EXIT_OK;
    }

    /** Configured candidates, or every model except the judge. */
    private List<ModelConfig> candidates() {
        List<String> ids = properties.getHarness().getCandidates();
        if (ids != null && !ids.isEmpty()) {
            return catalog.select(ids);
        }
        String judgeModel = properties.getJudge().getModel();
        List<ModelConfig> all = catalog.select(List.of()).stream().filter(c -> !c.id().equals(judgeModel)).toList();
        if (all.isEmpty()) {
            throw new ConfigurationException("No candidate models configured besides the judge");
        }
        return all;
    }

    private void printSummary(SessionSummary summary) {
        out.println("Session " + summary.sessionId() + ": " + summary.totalMessages() + " message(s)");
        if (summary.firstActivity() != null) {
            out.println("  from " + summary.firstActivity() + " to " + summary.lastActivity());
        }
        out.println("  red-flagged messages: " + summary.redFlaggedMessages()
                + (summary.distinctRedFlagRules().isEmpty() ? "" : " " + summary.distinctRedFlagRules()));
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from console", e);
        }
    }
}
