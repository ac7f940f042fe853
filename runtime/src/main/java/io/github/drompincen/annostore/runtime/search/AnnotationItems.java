package io.github.drompincen.annostore.runtime.search;

import io.github.drompincen.annostore.persistence.store.AnnotationEnvelope;
import io.github.drompincen.annostore.runtime.config.UriFactory;

import java.util.LinkedHashMap;
import java.util.Map;

final class AnnotationItems {

    private AnnotationItems() {}

    /** The annotation body with {@code id} pointing at the annotation's own URL. */
    static Map<String, Object> toItem(UriFactory uriFactory, String containerName, AnnotationEnvelope envelope) {
        Map<String, Object> item = new LinkedHashMap<>(envelope.annotation());
        item.put("id", uriFactory.annotationUrl(containerName, envelope.name()));
        return item;
    }
}
