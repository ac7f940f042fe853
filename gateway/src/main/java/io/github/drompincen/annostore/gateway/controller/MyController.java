package io.github.drompincen.annostore.gateway.controller;

import io.github.drompincen.annostore.gateway.auth.ApiKeyAuthenticator;
import io.github.drompincen.annostore.runtime.service.ContainerServiceOperations;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/my")
public class MyController {

    private final ContainerServiceOperations operations;
    private final ApiKeyAuthenticator authenticator;

    public MyController(ContainerServiceOperations operations, ApiKeyAuthenticator authenticator) {
        this.operations = operations;
        this.authenticator = authenticator;
    }

    @GetMapping("/containers")
    public ResponseEntity<?> containers(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return ApiResponses.call(() -> ResponseEntity.ok(
                operations.getAccessibleContainers(authenticator.resolve(authorization))));
    }
}
