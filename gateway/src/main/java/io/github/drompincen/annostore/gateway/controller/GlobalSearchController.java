package io.github.drompincen.annostore.gateway.controller;

import io.github.drompincen.annostore.gateway.auth.ApiKeyAuthenticator;
import io.github.drompincen.annostore.protocol.api.GlobalSearchStatus;
import io.github.drompincen.annostore.runtime.access.UserPrincipal;
import io.github.drompincen.annostore.runtime.config.UriFactory;
import io.github.drompincen.annostore.runtime.search.ContainerSearchTask;
import io.github.drompincen.annostore.runtime.search.GlobalSearchService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.Map;

@RestController
@RequestMapping("/global/search")
public class GlobalSearchController {

    private final GlobalSearchService globalSearchService;
    private final ApiKeyAuthenticator authenticator;
    private final UriFactory uriFactory;

    public GlobalSearchController(GlobalSearchService globalSearchService,
                                  ApiKeyAuthenticator authenticator,
                                  UriFactory uriFactory) {
        this.globalSearchService = globalSearchService;
        this.authenticator = authenticator;
        this.uriFactory = uriFactory;
    }

    @PostMapping
    public ResponseEntity<?> startSearch(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                         @RequestBody Map<String, Object> query) {
        return ApiResponses.call(() -> {
            UserPrincipal principal = authenticator.resolve(authorization);
            ContainerSearchTask task = globalSearchService.startGlobalSearch(principal, query);
            return ResponseEntity.created(URI.create(uriFactory.globalSearchUrl(task.getId())))
                    .header(HttpHeaders.LINK, "<" + uriFactory.globalSearchStatusUrl(task.getId()) + ">; rel=\"status\"")
                    .body(new GlobalSearchStatus(task.getQuery(), task.summary()));
        });
    }

    @GetMapping("/{searchId}")
    public ResponseEntity<?> getResultPage(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                           @PathVariable String searchId,
                                           @RequestParam(defaultValue = "0") int page) {
        return ApiResponses.call(() -> ResponseEntity.ok(
                globalSearchService.getResultPage(authenticator.resolve(authorization), searchId, page)));
    }

    @GetMapping("/{searchId}/status")
    public ResponseEntity<?> getStatus(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                       @PathVariable String searchId) {
        return ApiResponses.call(() -> ResponseEntity.ok(
                globalSearchService.getStatus(authenticator.resolve(authorization), searchId)));
    }
}
