package com.eainde.patientqa.memory;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate view of a session, for follow-up conversations and audit.
 */
public record SessionSummary(
        String sessionId,
        int totalMessages,
        Instant firstActivity,
        Instant lastActivity,
        int redFlaggedMessages,
        List<String> distinctRedFlagRules
) {}
