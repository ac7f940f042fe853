package io.github.drompincen.annostore.protocol.api;

public record CreateContainerRequest(
        String name,
        String label,
        boolean readOnlyForAnonymous
) {}
