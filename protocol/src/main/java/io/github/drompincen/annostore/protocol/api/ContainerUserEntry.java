package io.github.drompincen.annostore.protocol.api;

public record ContainerUserEntry(
        String userName,
        Role role
) {}
