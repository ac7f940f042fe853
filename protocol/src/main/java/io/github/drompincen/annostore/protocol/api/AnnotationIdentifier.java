package io.github.drompincen.annostore.protocol.api;

public record AnnotationIdentifier(
        String containerName,
        String annotationName,
        String etag
) {}
