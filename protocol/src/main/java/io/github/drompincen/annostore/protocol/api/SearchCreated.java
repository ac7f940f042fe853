package io.github.drompincen.annostore.protocol.api;

public record SearchCreated(
        String id,
        long hits
) {}
