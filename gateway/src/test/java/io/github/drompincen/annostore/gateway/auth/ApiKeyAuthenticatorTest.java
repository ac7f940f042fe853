package io.github.drompincen.annostore.gateway.auth;

import io.github.drompincen.annostore.runtime.access.UserPrincipal;
import io.github.drompincen.annostore.runtime.access.UserService;
import io.github.drompincen.annostore.runtime.error.NotAuthorizedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ApiKeyAuthenticatorTest {

    @Mock private UserService userService;

    private ApiKeyAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        authenticator = new ApiKeyAuthenticator(userService);
        when(userService.authenticate("k-alice")).thenReturn(Optional.of(UserPrincipal.named("alice")));
        when(userService.authenticate("bad")).thenThrow(new NotAuthorizedException("Unknown api key"));
    }

    @Test
    void noHeaderIsAnonymous() {
        assertThat(authenticator.resolve(null)).isNull();
        verifyNoInteractions(userService);
    }

    @Test
    void bearerPrefixIsOptional() {
        assertThat(authenticator.resolve("Bearer k-alice")).isEqualTo(UserPrincipal.named("alice"));
        assertThat(authenticator.resolve("bearer k-alice")).isEqualTo(UserPrincipal.named("alice"));
        assertThat(authenticator.resolve("k-alice")).isEqualTo(UserPrincipal.named("alice"));
    }

    @Test
    void unknownKeyPropagates() {
        assertThatThrownBy(() -> authenticator.resolve("Bearer bad")).isInstanceOf(NotAuthorizedException.class);
    }
}
