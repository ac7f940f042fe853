package io.github.drompincen.annostore.protocol.api;

public record IndexChoreStatus(
        String containerName,
        String field,
        IndexType type,
        String indexName,
        TaskSummary status
) {}
