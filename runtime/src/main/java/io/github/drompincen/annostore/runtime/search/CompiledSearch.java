package io.github.drompincen.annostore.runtime.search;

import org.springframework.data.mongodb.core.aggregation.AggregationOperation;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A query compiled and counted once. {@code totalHits} is frozen at creation; pages are read
 * from the live collection.
 */
public record CompiledSearch(
        String id,
        String containerName,
        Map<String, Object> query,
        List<AggregationOperation> stages,
        long totalHits,
        Instant createdAt
) {}
