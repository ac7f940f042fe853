package io.github.drompincen.annostore.protocol.api;

import java.time.Instant;

public record ContainerDto(
        String id,
        String name,
        String label,
        Instant createdAt,
        Instant modifiedAt,
        long size,
        boolean readOnlyForAnonymous
) {}
