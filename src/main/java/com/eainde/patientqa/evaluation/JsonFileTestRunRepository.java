package com.eainde.patientqa.evaluation;

import com.eainde.patientqa.memory.PersistenceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Writes {@code <runId>.json} and {@code <runId>-report.json} under a results directory.
 */
@Slf4j
public class JsonFileTestRunRepository implements TestRunRepository {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]{1,120}");
    private static final String REPORT_SUFFIX = "-report.json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonFileTestRunRepository(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(TestRun run) {
        write(runFile(run.getId()), run, "run " + run.getId());
        log.info("Saved run {} to {}", run.getId(), runFile(run.getId()));
    }

    @Override
    public void saveReport(RunReport report) {
        write(directory.resolve(checkId(report.runId()) + REPORT_SUFFIX), report, "report " + report.runId());
    }

    @Override
    public Optional<TestRun> load(String runId) {
        Path file = runFile(runId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), TestRun.class));
        } catch (IOException e) {
            throw new PersistenceException("Failed to read run " + runId + " from " + file, e);
        }
    }

    @Override
    public List<String> listRunIds() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(p -> p.getFileName().toString())
                    .filter(n -> n.endsWith(".json") && !n.endsWith(REPORT_SUFFIX))
                    .map(n -> n.substring(0, n.length() - ".json".length()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new PersistenceException("Failed to list runs in " + directory, e);
        }
    }

    private Path runFile(String runId) {
        return directory.resolve(checkId(runId) + ".json");
    }

    private static String checkId(String runId) {
        if (runId == null || !SAFE_ID.matcher(runId).matches() || runId.endsWith("-report")) {
            throw new IllegalArgumentException("Invalid run id: " + runId);
        }
        return runId;
    }

    private void write(Path target, Object value, String what) {
        try {
            Files.createDirectories(directory);
            byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
            Path tmp = Files.createTempFile(directory, ".run-", ".tmp");
            try {
                Files.write(tmp, json);
                try {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to write " + what + " to " + target, e);
        }
    }
}
