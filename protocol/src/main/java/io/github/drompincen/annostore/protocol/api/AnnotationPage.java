package io.github.drompincen.annostore.protocol.api;

import java.util.List;
import java.util.Map;

/**
 * One page of search results. {@code prev} and {@code next} are null at the respective boundary.
 */
public record AnnotationPage(
        String id,
        String partOf,
        long startIndex,
        List<Map<String, Object>> items,
        String prev,
        String next
) {}
