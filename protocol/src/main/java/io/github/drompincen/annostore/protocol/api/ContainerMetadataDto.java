package io.github.drompincen.annostore.protocol.api;

import java.time.Instant;
import java.util.List;

public record ContainerMetadataDto(
        String id,
        String label,
        Instant createdAt,
        Instant modifiedAt,
        long size,
        List<IndexConfig> indexes
) {}
