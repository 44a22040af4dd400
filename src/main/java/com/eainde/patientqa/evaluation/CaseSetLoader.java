package com.eainde.patientqa.evaluation;

import com.eainde.patientqa.config.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads a case set from the classpath or a file.
 *
 * <pre>
 * { "version": "curated-v1", "cases": [ { "id": "...", "category": "red-flag", "questions": ["..."] } ] }
 * </pre>
 */
@Slf4j
public class CaseSetLoader {

    public static final String CURATED_RESOURCE = "cases/curated-cases.json";

    private final ObjectMapper objectMapper;

    public CaseSetLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<EvaluationCase> loadCurated() {
        return loadClasspath(CURATED_RESOURCE);
    }

    public List<EvaluationCase> loadClasspath(String resource) {
        InputStream in = CaseSetLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new ConfigurationException("Case set not found on classpath: " + resource);
        }
        try (in) {
            return load(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to close case set " + resource, e);
        }
    }

    public List<EvaluationCase> load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Case set file does not exist: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read case set " + file, e);
        }
    }

    public List<EvaluationCase> load(InputStream in, String origin) {
        CaseFile file;
        try {
            file = objectMapper.readValue(in, CaseFile.class);
        } catch (IOException e) {
            throw new ConfigurationException("Invalid case set " + origin + ": " + e.getMessage(), e);
        }
        if (file.cases() == null || file.cases().isEmpty()) {
            throw new ConfigurationException("Case set " + origin + " contains no cases");
        }
        Set<String> ids = new HashSet<>();
        for (EvaluationCase evaluationCase : file.cases()) {
            if (!ids.add(evaluationCase.id())) {
                throw new ConfigurationException("Duplicate case id '" + evaluationCase.id() + "' in " + origin);
            }
        }
        log.info("Loaded {} evaluation case(s) (version {}) from {}", file.cases().size(), file.version(), origin);
        return List.copyOf(file.cases());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CaseFile(
            @JsonProperty("version") String version,
            @JsonProperty("cases")   List<EvaluationCase> cases
    ) {}
}
