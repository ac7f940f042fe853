package io.github.drompincen.annostore.protocol.api;

import java.util.Map;

public record AnnotationDto(
        String containerName,
        String annotationName,
        String etag,
        Map<String, Object> annotation
) {}
