package io.github.drompincen.annostore.gateway.controller;

import io.github.drompincen.annostore.gateway.auth.ApiKeyAuthenticator;
import io.github.drompincen.annostore.protocol.api.UserEntry;
import io.github.drompincen.annostore.runtime.access.UserPrincipal;
import io.github.drompincen.annostore.runtime.access.UserService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Root-only user administration.
 */
@RestController
@RequestMapping("/admin/users")
public class AdminController {

    private final UserService userService;
    private final ApiKeyAuthenticator authenticator;

    public AdminController(UserService userService, ApiKeyAuthenticator authenticator) {
        this.userService = userService;
        this.authenticator = authenticator;
    }

    @GetMapping
    public ResponseEntity<?> listUsers(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return ApiResponses.call(() -> ResponseEntity.ok(userService.listUsers(authenticator.resolve(authorization))));
    }

    @PostMapping
    public ResponseEntity<?> addUsers(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                      @RequestBody List<UserEntry> users) {
        return ApiResponses.call(() -> {
            UserPrincipal principal = authenticator.resolve(authorization);
            List<String> rejected = userService.addUsers(principal, users);
            List<String> added = users.stream()
                    .map(UserEntry::userName)
                    .filter(name -> !rejected.contains(name))
                    .toList();
            return ResponseEntity.ok(Map.of("added", added, "rejected", rejected));
        });
    }

    @DeleteMapping("/{userName}")
    public ResponseEntity<?> deleteUser(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                        @PathVariable String userName) {
        return ApiResponses.call(() -> {
            userService.deleteUser(authenticator.resolve(authorization), userName);
            return ResponseEntity.noContent().build();
        });
    }
}
