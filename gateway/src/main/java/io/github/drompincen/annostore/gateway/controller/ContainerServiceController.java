package io.github.drompincen.annostore.gateway.controller;

import io.github.drompincen.annostore.gateway.auth.ApiKeyAuthenticator;
import io.github.drompincen.annostore.protocol.api.ContainerUserEntry;
import io.github.drompincen.annostore.protocol.api.IndexChoreStatus;
import io.github.drompincen.annostore.protocol.api.SearchCreated;
import io.github.drompincen.annostore.runtime.config.UriFactory;
import io.github.drompincen.annostore.runtime.service.ContainerServiceOperations;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Search, index and administration services of a single container.
 */
@RestController
@RequestMapping("/services/{containerName}")
public class ContainerServiceController {

    private final ContainerServiceOperations operations;
    private final ApiKeyAuthenticator authenticator;
    private final UriFactory uriFactory;

    public ContainerServiceController(ContainerServiceOperations operations,
                                      ApiKeyAuthenticator authenticator,
                                      UriFactory uriFactory) {
        this.operations = operations;
        this.authenticator = authenticator;
        this.uriFactory = uriFactory;
    }

    // ---- Search ----

    @PostMapping("/search")
    public ResponseEntity<?> createSearch(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                          @PathVariable String containerName,
                                          @RequestBody Map<String, Object> query) {
        return ApiResponses.call(() -> {
            SearchCreated search = operations.createSearch(authenticator.resolve(authorization), containerName, query);
            return ResponseEntity.created(URI.create(uriFactory.searchUrl(containerName, search.id())))
                    .header(HttpHeaders.LINK, "<" + uriFactory.searchInfoUrl(containerName, search.id()) + ">; rel=\"info\"")
                    .body(search);
        });
    }

    @GetMapping("/search/{searchId}")
    public ResponseEntity<?> getSearchResultPage(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                                 @PathVariable String containerName,
                                                 @PathVariable String searchId,
                                                 @RequestParam(defaultValue = "0") int page) {
        return ApiResponses.call(() -> ResponseEntity.ok(
                operations.getSearchResultPage(authenticator.resolve(authorization), containerName, searchId, page)));
    }

    @GetMapping("/search/{searchId}/info")
    public ResponseEntity<?> getSearchInfo(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                           @PathVariable String containerName,
                                           @PathVariable String searchId) {
        return ApiResponses.call(() -> ResponseEntity.ok(
                operations.getSearchInfo(authenticator.resolve(authorization), containerName, searchId)));
    }

    // ---- Indexes ----

    @GetMapping("/indexes")
    public ResponseEntity<?> listIndexes(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                         @PathVariable String containerName) {
        return ApiResponses.call(() -> ResponseEntity.ok(
                operations.listIndexes(authenticator.resolve(authorization), containerName)));
    }

    @PutMapping("/indexes/{field}/{indexType}")
    public ResponseEntity<?> addIndex(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                      @PathVariable String containerName,
                                      @PathVariable String field,
                                      @PathVariable String indexType) {
        return ApiResponses.call(() -> {
            IndexChoreStatus status = operations.addIndex(authenticator.resolve(authorization), containerName, field, indexType);
            return ResponseEntity.created(URI.create(uriFactory.indexUrl(containerName, field, status.type())))
                    .header(HttpHeaders.LINK, "<" + uriFactory.indexStatusUrl(containerName, field, status.type()) + ">; rel=\"status\"")
                    .body(status);
        });
    }

    @GetMapping("/indexes/{field}/{indexType}")
    public ResponseEntity<?> getIndex(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                      @PathVariable String containerName,
                                      @PathVariable String field,
                                      @PathVariable String indexType) {
        return ApiResponses.call(() -> ResponseEntity.ok(
                operations.getIndex(authenticator.resolve(authorization), containerName, field, indexType)));
    }

    @GetMapping("/indexes/{field}/{indexType}/status")
    public ResponseEntity<?> getIndexStatus(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                            @PathVariable String containerName,
                                            @PathVariable String field,
                                            @PathVariable String indexType) {
        return ApiResponses.call(() -> ResponseEntity.ok(
                operations.getIndexStatus(authenticator.resolve(authorization), containerName, field, indexType)));
    }

    @DeleteMapping("/indexes/{field}/{indexType}")
    public ResponseEntity<?> deleteIndex(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                         @PathVariable String containerName,
                                         @PathVariable String field,
                                         @PathVariable String indexType) {
        return ApiResponses.call(() -> {
            operations.deleteIndex(authenticator.resolve(authorization), containerName, field, indexType);
            return ResponseEntity.noContent().build();
        });
    }

    // ---- Container users ----

    @GetMapping("/users")
    public ResponseEntity<?> getUsers(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                      @PathVariable String containerName) {
        return ApiResponses.call(() -> ResponseEntity.ok(
                operations.getContainerUsers(authenticator.resolve(authorization), containerName)));
    }

    @PostMapping("/users")
    public ResponseEntity<?> addUsers(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                      @PathVariable String containerName,
                                      @RequestBody List<ContainerUserEntry> users) {
        return ApiResponses.call(() -> ResponseEntity.ok(
                operations.addContainerUsers(authenticator.resolve(authorization), containerName, users)));
    }

    @DeleteMapping("/users/{userName}")
    public ResponseEntity<?> removeUser(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                        @PathVariable String containerName,
                                        @PathVariable String userName) {
        return ApiResponses.call(() -> {
            operations.removeContainerUser(authenticator.resolve(authorization), containerName, userName);
            return ResponseEntity.noContent().build();
        });
    }

    // ---- Container data ----

    @GetMapping("/fields")
    public ResponseEntity<?> getFieldCounts(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                            @PathVariable String containerName) {
        return ApiResponses.call(() -> ResponseEntity.ok(
                operations.getFieldCounts(authenticator.resolve(authorization), containerName)));
    }

    @GetMapping("/distinct-values/{field}")
    public ResponseEntity<?> getDistinctValues(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                               @PathVariable String containerName,
                                               @PathVariable String field) {
        return ApiResponses.call(() -> ResponseEntity.ok(
                operations.getDistinctValues(authenticator.resolve(authorization), containerName, field)));
    }

    @GetMapping("/metadata")
    public ResponseEntity<?> getMetadata(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                         @PathVariable String containerName) {
        return ApiResponses.call(() -> ResponseEntity.ok(
                operations.getMetadata(authenticator.resolve(authorization), containerName)));
    }

    @PostMapping("/annotations-batch")
    public ResponseEntity<?> uploadBatch(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                         @PathVariable String containerName,
                                         @RequestBody List<Map<String, Object>> annotations) {
        return ApiResponses.call(() -> ResponseEntity.ok(
                operations.batchUpload(authenticator.resolve(authorization), containerName, annotations)));
    }
}
