package io.github.drompincen.annostore.protocol.api;

import java.time.Instant;
import java.util.List;

public record TaskSummary(
        String id,
        TaskState state,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        Instant expiresAfter,
        int totalUnits,
        int unitsProcessed,
        int resultCount,
        List<String> errors,
        long processingTimeInMillis
) {}
