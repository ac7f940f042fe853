package io.github.drompincen.annostore.protocol.api;

import java.util.Map;

public record GlobalSearchStatus(
        Map<String, Object> query,
        TaskSummary status
) {}
