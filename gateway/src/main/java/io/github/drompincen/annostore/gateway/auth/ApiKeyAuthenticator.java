package io.github.drompincen.annostore.gateway.auth;

import io.github.drompincen.annostore.runtime.access.UserPrincipal;
import io.github.drompincen.annostore.runtime.access.UserService;
import org.springframework.stereotype.Component;

/**
 * Turns the {@code Authorization} header into a principal. The key may be sent bare or as
 * {@code Bearer <key>}; no header at all means an anonymous caller ({@code null}).
 */
@Component
public class ApiKeyAuthenticator {

    private static final String BEARER = "Bearer ";

    private final UserService userService;

    public ApiKeyAuthenticator(UserService userService) {
        this.userService = userService;
    }

    public UserPrincipal resolve(String authorization) {
        if (authorization == null) {
            return null;
        }
        String key = authorization.regionMatches(true, 0, BEARER, 0, BEARER.length())
                ? authorization.substring(BEARER.length())
                : authorization;
        return userService.authenticate(key.trim()).orElse(null);
    }
}
