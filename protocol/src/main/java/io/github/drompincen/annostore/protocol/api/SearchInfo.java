package io.github.drompincen.annostore.protocol.api;

import java.util.Map;

public record SearchInfo(
        Map<String, Object> query,
        long hits
) {}
