package io.github.drompincen.annostore.gateway.controller;

import io.github.drompincen.annostore.runtime.error.AnnoStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs a controller action and maps the store's client-facing failures to
 * {@code {"error": message}} responses.
 */
final class ApiResponses {

    private static final Logger log = LoggerFactory.getLogger(ApiResponses.class);

    private ApiResponses() {}

    static ResponseEntity<?> call(Supplier<ResponseEntity<?>> action) {
        try {
            return action.get();
        } catch (AnnoStoreException e) {
            log.debug("Request failed with {}: {}", e.getKind(), e.getMessage());
            return error(e);
        }
    }

    static ResponseEntity<Map<String, String>> error(AnnoStoreException e) {
        HttpStatus status = switch (e.getKind()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_AUTHORIZED -> HttpStatus.UNAUTHORIZED;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case PRECONDITION_FAILED -> HttpStatus.PRECONDITION_FAILED;
        };
        return ResponseEntity.status(status).body(Map.of("error", String.valueOf(e.getMessage())));
    }

    /** If-Match values arrive quoted, possibly weak. */
    static String unquote(String etag) {
        if (etag == null) return null;
        String value = etag.trim();
        if (value.startsWith("W/")) value = value.substring(2);
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            value = value.substring(1, value.length() - 1);
        }
        return value;
    }
}
