package com.eainde.patientqa.evaluation;

import java.util.List;
import java.util.Optional;

/**
 * Keyed storage for test runs and their reports.
 */
public interface TestRunRepository {

    void save(TestRun run);

    void saveReport(RunReport report);

    Optional<TestRun> load(String runId);

    List<String> listRunIds();
}
