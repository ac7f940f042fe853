package io.github.drompincen.annostore.gateway.controller;

import io.github.drompincen.annostore.gateway.auth.ApiKeyAuthenticator;
import io.github.drompincen.annostore.protocol.api.AnnotationDto;
import io.github.drompincen.annostore.protocol.api.ContainerDto;
import io.github.drompincen.annostore.protocol.api.CreateContainerRequest;
import io.github.drompincen.annostore.runtime.access.UserPrincipal;
import io.github.drompincen.annostore.runtime.service.ContainerServiceOperations;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.Map;

/**
 * W3C-style container and annotation endpoints.
 */
@RestController
@RequestMapping("/w3c")
public class ContainerController {

    private final ContainerServiceOperations operations;
    private final ApiKeyAuthenticator authenticator;

    public ContainerController(ContainerServiceOperations operations, ApiKeyAuthenticator authenticator) {
        this.operations = operations;
        this.authenticator = authenticator;
    }

    @PostMapping
    public ResponseEntity<?> createContainer(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                             @RequestHeader(value = "Slug", required = false) String slug,
                                             @RequestBody(required = false) CreateContainerRequest req) {
        return ApiResponses.call(() -> {
            UserPrincipal principal = authenticator.resolve(authorization);
            CreateContainerRequest request = req != null ? req : new CreateContainerRequest(null, null, false);
            if (slug != null && !slug.isBlank()) {
                request = new CreateContainerRequest(slug, request.label(), request.readOnlyForAnonymous());
            }
            ContainerDto container = operations.createContainer(principal, request);
            return ResponseEntity.created(URI.create(container.id())).body(container);
        });
    }

    @GetMapping("/{containerName}")
    public ResponseEntity<?> getContainer(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                          @PathVariable String containerName) {
        return ApiResponses.call(() ->
                ResponseEntity.ok(operations.getContainer(authenticator.resolve(authorization), containerName)));
    }

    @DeleteMapping("/{containerName}")
    public ResponseEntity<?> deleteContainer(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                             @PathVariable String containerName) {
        return ApiResponses.call(() -> {
            operations.deleteContainer(authenticator.resolve(authorization), containerName);
            return ResponseEntity.noContent().build();
        });
    }

    @PostMapping("/{containerName}")
    public ResponseEntity<?> createAnnotation(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                              @RequestHeader(value = "Slug", required = false) String slug,
                                              @PathVariable String containerName,
                                              @RequestBody Map<String, Object> annotation) {
        return ApiResponses.call(() -> {
            AnnotationDto created = operations.createAnnotation(authenticator.resolve(authorization),
                    containerName, slug, annotation);
            return ResponseEntity.created(URI.create((String) created.annotation().get("id")))
                    .eTag(created.etag())
                    .body(created.annotation());
        });
    }

    @GetMapping("/{containerName}/{annotationName}")
    public ResponseEntity<?> getAnnotation(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                           @PathVariable String containerName,
                                           @PathVariable String annotationName) {
        return ApiResponses.call(() -> {
            AnnotationDto annotation = operations.getAnnotation(authenticator.resolve(authorization),
                    containerName, annotationName);
            return ResponseEntity.ok().eTag(annotation.etag()).body(annotation.annotation());
        });
    }

    @PutMapping("/{containerName}/{annotationName}")
    public ResponseEntity<?> replaceAnnotation(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                               @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch,
                                               @PathVariable String containerName,
                                               @PathVariable String annotationName,
                                               @RequestBody Map<String, Object> annotation) {
        return ApiResponses.call(() -> {
            AnnotationDto replaced = operations.replaceAnnotation(authenticator.resolve(authorization),
                    containerName, annotationName, ApiResponses.unquote(ifMatch), annotation);
            return ResponseEntity.ok().eTag(replaced.etag()).body(replaced.annotation());
        });
    }

    @DeleteMapping("/{containerName}/{annotationName}")
    public ResponseEntity<?> deleteAnnotation(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                              @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch,
                                              @PathVariable String containerName,
                                              @PathVariable String annotationName) {
        return ApiResponses.call(() -> {
            operations.deleteAnnotation(authenticator.resolve(authorization), containerName, annotationName,
                    ApiResponses.unquote(ifMatch));
            return ResponseEntity.noContent().build();
        });
    }
}
