package com.eainde.patientqa;

import com.eainde.patientqa.prompt.SafetyPolicy;
import com.eainde.patientqa.redflag.RedFlagDetector;
import com.eainde.patientqa.redflag.RedFlagRuleLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

public final class TestFixtures {

    public static final String POLICY_TEXT = "You are a careful patient education assistant. Never diagnose.";

    private TestFixtures() {
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public static SafetyPolicy policy() {
        return new SafetyPolicy("test", POLICY_TEXT);
    }

    /** Detector over the shipped rule file. */
    public static RedFlagDetector shippedDetector() {
        try (InputStream in = TestFixtures.class.getClassLoader()
                .getResourceAsStream("red-flags/red-flag-rules.json")) {
            return new RedFlagDetector(new RedFlagRuleLoader(objectMapper()).load(in, "test"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
