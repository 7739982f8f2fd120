package com.acme.cqrs.projection;

import java.time.Instant;

public record ProjectorStats(
    String projectorName,
    boolean enabled,
    long executions,
    long successes,
    long failures,
    String lastError,
    Instant lastExecutedAt) {}
