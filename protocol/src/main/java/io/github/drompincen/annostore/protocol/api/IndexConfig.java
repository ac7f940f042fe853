package io.github.drompincen.annostore.protocol.api;

public record IndexConfig(
        String field,
        IndexType type,
        String url
) {}
