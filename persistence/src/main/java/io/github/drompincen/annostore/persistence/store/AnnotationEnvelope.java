package io.github.drompincen.annostore.persistence.store;

import java.util.Map;

/**
 * An annotation as stored in its container collection: the container-scoped name,
 * the opaque annotation body and the concurrency token issued on the last write.
 */
public record AnnotationEnvelope(
        String name,
        Map<String, Object> annotation,
        String etag
) {}
