package io.github.drompincen.annostore.runtime.service;

import io.github.drompincen.annostore.protocol.api.ContainerUserEntry;
import io.github.drompincen.annostore.protocol.api.Role;
import io.github.drompincen.annostore.protocol.api.SearchCreated;
import io.github.drompincen.annostore.runtime.access.ContainerAccessChecker;
import io.github.drompincen.annostore.runtime.access.ContainerUserService;
import io.github.drompincen.annostore.runtime.access.UserPrincipal;
import io.github.drompincen.annostore.runtime.container.ContainerService;
import io.github.drompincen.annostore.runtime.error.NotAuthorizedException;
import io.github.drompincen.annostore.runtime.error.NotFoundException;
import io.github.drompincen.annostore.runtime.error.ValidationException;
import io.github.drompincen.annostore.runtime.index.IndexManager;
import io.github.drompincen.annostore.runtime.search.CompiledSearch;
import io.github.drompincen.annostore.runtime.search.SearchCacheService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ContainerServiceOperationsTest {

    private static final String CONTAINER = "letters";
    private static final Map<String, Object> QUERY = Map.of("body.type", "Page");

    @Mock private ContainerUserService containerUserService;
    @Mock private ContainerService containerService;
    @Mock private SearchCacheService searchCacheService;
    @Mock private IndexManager indexManager;

    private ContainerServiceOperations operations;

    @BeforeEach
    void setUp() {
        operations = new ContainerServiceOperations(new ContainerAccessChecker(containerUserService),
                containerService, containerUserService, searchCacheService, indexManager);
        when(containerUserService.getUserRole(anyString(), anyString())).thenReturn(Optional.empty());
        when(containerUserService.getUserRole(CONTAINER, "gus")).thenReturn(Optional.of(Role.GUEST));
        when(containerUserService.getUserRole(CONTAINER, "ada")).thenReturn(Optional.of(Role.ADMIN));
        when(containerService.exists(CONTAINER)).thenReturn(true);
        when(searchCacheService.create(CONTAINER, QUERY)).thenReturn(
                new CompiledSearch("s-1", CONTAINER, QUERY, List.of(), 4, Instant.EPOCH));
    }

    @Test
    void guestCanSearchButNotManageIndexes() {
        SearchCreated created = operations.createSearch(UserPrincipal.named("gus"), CONTAINER, QUERY);
        assertThat(created).isEqualTo(new SearchCreated("s-1", 4));

        assertThatThrownBy(() -> operations.addIndex(UserPrincipal.named("gus"), CONTAINER, "body.type", "hashed"))
                .isInstanceOf(NotAuthorizedException.class);
        verify(indexManager, never()).startIndexCreation(anyString(), anyString(), anyString());
    }

    @Test
    void unknownIndexKindIsReportedBeforeAMissingContainer() {
        when(containerService.exists("gone")).thenReturn(false);

        assertThatThrownBy(() -> operations.addIndex(UserPrincipal.root(), "gone", "body.type", "geo"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("hashed, ascending, descending, text");
        assertThatThrownBy(() -> operations.getIndex(UserPrincipal.root(), "gone", "body.type", "geo"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> operations.getIndexStatus(UserPrincipal.root(), "gone", "body.type", "geo"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> operations.deleteIndex(UserPrincipal.root(), "gone", "body.type", "geo"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> operations.addIndex(UserPrincipal.root(), "gone", "body.type", "hashed"))
                .isInstanceOf(NotFoundException.class);
        verify(indexManager, never()).startIndexCreation(anyString(), anyString(), anyString());
    }

    @Test
    void userWithoutRoleCannotSearch() {
        assertThatThrownBy(() -> operations.createSearch(UserPrincipal.named("mallory"), CONTAINER, QUERY))
                .isInstanceOf(NotAuthorizedException.class)
                .hasMessageContaining("mallory");
        verify(searchCacheService, never()).create(anyString(), any());
    }

    @Test
    void anonymousReadDependsOnTheContainerFlag() {
        assertThatThrownBy(() -> operations.createSearch(null, CONTAINER, QUERY))
                .isInstanceOf(NotAuthorizedException.class);

        when(containerService.isReadOnlyForAnonymous(CONTAINER)).thenReturn(true);
        assertThat(operations.createSearch(null, CONTAINER, QUERY).hits()).isEqualTo(4);
        assertThatThrownBy(() -> operations.createAnnotation(null, CONTAINER, null, Map.of("a", 1)))
                .isInstanceOf(NotAuthorizedException.class);
    }

    @Test
    void guestCannotReadContainerUsers() {
        assertThatThrownBy(() -> operations.getContainerUsers(UserPrincipal.named("gus"), CONTAINER))
                .isInstanceOf(NotAuthorizedException.class);

        when(containerUserService.getUsersForContainer(CONTAINER))
                .thenReturn(List.of(new ContainerUserEntry("ada", Role.ADMIN)));
        assertThat(operations.getContainerUsers(UserPrincipal.named("ada"), CONTAINER)).hasSize(1);
    }

    @Test
    void indexOperationsOnAMissingContainerAreNotFoundForRoot() {
        assertThatThrownBy(() -> operations.addIndex(UserPrincipal.root(), "nope", "f", "hashed"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void missingIndexStatusIsNotFound() {
        when(indexManager.getIndexChore(CONTAINER, "f", "hashed")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> operations.getIndexStatus(UserPrincipal.named("ada"), CONTAINER, "f", "hashed"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void addingContainerUsersNeedsNameAndRole() {
        assertThatThrownBy(() -> operations.addContainerUsers(UserPrincipal.named("ada"), CONTAINER,
                List.of(new ContainerUserEntry("ed", Role.EDITOR), new ContainerUserEntry("x", null))))
                .isInstanceOf(ValidationException.class);
        verify(containerUserService, never()).setUserRole(anyString(), anyString(), any());

        operations.addContainerUsers(UserPrincipal.named("ada"), CONTAINER,
                List.of(new ContainerUserEntry("ed", Role.EDITOR)));
        verify(containerUserService).setUserRole(CONTAINER, "ed", Role.EDITOR);
    }

    @Test
    void rootSeesEveryContainerAsAdmin() {
        when(containerService.allContainerNames()).thenReturn(List.of("a", "b"));

        assertThat(operations.getAccessibleContainers(UserPrincipal.root()))
                .containsExactly(Map.entry(Role.ADMIN, List.of("a", "b")));
        assertThatThrownBy(() -> operations.getAccessibleContainers(null))
                .isInstanceOf(NotAuthorizedException.class);
    }

    @Test
    void deletingAContainerForgetsItsIndexChores() {
        operations.deleteContainer(UserPrincipal.named("ada"), CONTAINER);

        verify(containerService).deleteContainer(CONTAINER);
        verify(indexManager).forgetContainer(CONTAINER);
    }
}
