package io.github.drompincen.annostore.protocol.api;

public record UserEntry(
        String userName,
        String apiKey
) {}
