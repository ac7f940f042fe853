package io.github.drompincen.annostore.runtime.service;

import io.github.drompincen.annostore.protocol.api.AnnotationDto;
import io.github.drompincen.annostore.protocol.api.AnnotationIdentifier;
import io.github.drompincen.annostore.protocol.api.AnnotationPage;
import io.github.drompincen.annostore.protocol.api.ContainerDto;
import io.github.drompincen.annostore.protocol.api.ContainerMetadataDto;
import io.github.drompincen.annostore.protocol.api.ContainerUserEntry;
import io.github.drompincen.annostore.protocol.api.CreateContainerRequest;
import io.github.drompincen.annostore.protocol.api.IndexChoreStatus;
import io.github.drompincen.annostore.protocol.api.IndexConfig;
import io.github.drompincen.annostore.protocol.api.Role;
import io.github.drompincen.annostore.protocol.api.SearchCreated;
import io.github.drompincen.annostore.protocol.api.SearchInfo;
import io.github.drompincen.annostore.runtime.access.ContainerAccessChecker;
import io.github.drompincen.annostore.runtime.access.ContainerUserService;
import io.github.drompincen.annostore.runtime.access.UserPrincipal;
import io.github.drompincen.annostore.runtime.container.ContainerService;
import io.github.drompincen.annostore.runtime.error.NotAuthorizedException;
import io.github.drompincen.annostore.runtime.error.NotFoundException;
import io.github.drompincen.annostore.runtime.error.ValidationException;
import io.github.drompincen.annostore.runtime.index.IndexChore;
import io.github.drompincen.annostore.runtime.index.IndexManager;
import io.github.drompincen.annostore.runtime.index.IndexNames;
import io.github.drompincen.annostore.runtime.search.CompiledSearch;
import io.github.drompincen.annostore.runtime.search.SearchCacheService;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Entry point for every container-scoped operation. Each call passes the access gate before it
 * touches anything; {@code principal} is null for anonymous callers.
 */
@Service
public class ContainerServiceOperations {

    private final ContainerAccessChecker accessChecker;
    private final ContainerService containerService;
    private final ContainerUserService containerUserService;
    private final SearchCacheService searchCacheService;
    private final IndexManager indexManager;

    public ContainerServiceOperations(ContainerAccessChecker accessChecker,
                                      ContainerService containerService,
                                      ContainerUserService containerUserService,
                                      SearchCacheService searchCacheService,
                                      IndexManager indexManager) {
        this.accessChecker = accessChecker;
        this.containerService = containerService;
        this.containerUserService = containerUserService;
        this.searchCacheService = searchCacheService;
        this.indexManager = indexManager;
    }

    // ---- Containers ----

    public ContainerDto createContainer(UserPrincipal principal, CreateContainerRequest request) {
        return containerService.createContainer(principal, request);
    }

    public ContainerDto getContainer(UserPrincipal principal, String containerName) {
        checkRead(principal, containerName);
        return containerService.getContainer(containerName);
    }

    public void deleteContainer(UserPrincipal principal, String containerName) {
        accessChecker.checkAdminRights(principal, containerName);
        containerService.deleteContainer(containerName);
        indexManager.forgetContainer(containerName);
    }

    public ContainerMetadataDto getMetadata(UserPrincipal principal, String containerName) {
        checkRead(principal, containerName);
        ContainerDto container = containerService.getContainer(containerName);
        return new ContainerMetadataDto(container.id(), container.label(), container.createdAt(),
                container.modifiedAt(), container.size(), indexManager.listIndexes(containerName));
    }

    public Map<String, Integer> getFieldCounts(UserPrincipal principal, String containerName) {
        checkRead(principal, containerName);
        return containerService.getFieldCounts(containerName);
    }

    public List<Object> getDistinctValues(UserPrincipal principal, String containerName, String field) {
        checkRead(principal, containerName);
        return containerService.getDistinctValues(containerName, field);
    }

    /** Container names the caller has a role in, grouped by role; root sees every container as admin. */
    public Map<Role, List<String>> getAccessibleContainers(UserPrincipal principal) {
        if (principal == null) {
            throw new NotAuthorizedException("No authentication found");
        }
        if (principal instanceof UserPrincipal.Root) {
            Map<Role, List<String>> all = new TreeMap<>();
            all.put(Role.ADMIN, containerService.allContainerNames());
            return all;
        }
        return containerUserService.getContainersByRole(principal.name());
    }

    // ---- Annotations ----

    public AnnotationDto createAnnotation(UserPrincipal principal, String containerName, String suggestedName,
                                          Map<String, Object> annotation) {
        accessChecker.checkEditRights(principal, containerName);
        return containerService.createAnnotation(containerName, suggestedName, annotation);
    }

    public AnnotationDto getAnnotation(UserPrincipal principal, String containerName, String annotationName) {
        checkRead(principal, containerName);
        return containerService.getAnnotation(containerName, annotationName);
    }

    public AnnotationDto replaceAnnotation(UserPrincipal principal, String containerName, String annotationName,
                                           String etag, Map<String, Object> annotation) {
        accessChecker.checkEditRights(principal, containerName);
        return containerService.replaceAnnotation(containerName, annotationName, etag, annotation);
    }

    public void deleteAnnotation(UserPrincipal principal, String containerName, String annotationName, String etag) {
        accessChecker.checkEditRights(principal, containerName);
        containerService.deleteAnnotation(containerName, annotationName, etag);
    }

    public List<AnnotationIdentifier> batchUpload(UserPrincipal principal, String containerName,
                                                  List<Map<String, Object>> annotations) {
        accessChecker.checkEditRights(principal, containerName);
        return containerService.batchUpload(containerName, annotations);
    }

    // ---- Search ----

    public SearchCreated createSearch(UserPrincipal principal, String containerName, Map<String, Object> query) {
        checkRead(principal, containerName);
        CompiledSearch search = searchCacheService.create(containerName, query);
        return new SearchCreated(search.id(), search.totalHits());
    }

    public AnnotationPage getSearchResultPage(UserPrincipal principal, String containerName, String searchId, int page) {
        checkRead(principal, containerName);
        return searchCacheService.getPage(containerName, searchId, page);
    }

    public SearchInfo getSearchInfo(UserPrincipal principal, String containerName, String searchId) {
        checkRead(principal, containerName);
        return searchCacheService.getInfo(containerName, searchId);
    }

    // ---- Indexes ----

    public IndexChoreStatus addIndex(UserPrincipal principal, String containerName, String field, String type) {
        accessChecker.checkAdminRights(principal, containerName);
        IndexNames.parseType(type);
        requireContainer(containerName);
        return indexManager.startIndexCreation(containerName, field, type).status();
    }

    public IndexConfig getIndex(UserPrincipal principal, String containerName, String field, String type) {
        accessChecker.checkAdminRights(principal, containerName);
        IndexNames.parseType(type);
        requireContainer(containerName);
        return indexManager.getIndexConfig(containerName, field, type)
                .orElseThrow(() -> new NotFoundException("No " + type + " index on field '" + field + "'"));
    }

    public IndexChoreStatus getIndexStatus(UserPrincipal principal, String containerName, String field, String type) {
        accessChecker.checkAdminRights(principal, containerName);
        IndexNames.parseType(type);
        return indexManager.getIndexChore(containerName, field, type)
                .map(IndexChore::status)
                .orElseThrow(() -> new NotFoundException("No index chore for " + type + " index on field '" + field + "'"));
    }

    public List<IndexConfig> listIndexes(UserPrincipal principal, String containerName) {
        checkRead(principal, containerName);
        requireContainer(containerName);
        return indexManager.listIndexes(containerName);
    }

    public void deleteIndex(UserPrincipal principal, String containerName, String field, String type) {
        accessChecker.checkAdminRights(principal, containerName);
        IndexNames.parseType(type);
        requireContainer(containerName);
        indexManager.deleteIndex(containerName, field, type);
    }

    // ---- Container users ----

    public List<ContainerUserEntry> getContainerUsers(UserPrincipal principal, String containerName) {
        accessChecker.checkAdminRights(principal, containerName);
        requireContainer(containerName);
        return containerUserService.getUsersForContainer(containerName);
    }

    public List<ContainerUserEntry> addContainerUsers(UserPrincipal principal, String containerName,
                                                      List<ContainerUserEntry> users) {
        accessChecker.checkAdminRights(principal, containerName);
        requireContainer(containerName);
        for (ContainerUserEntry entry : users) {
            if (entry.userName() == null || entry.userName().isBlank() || entry.role() == null) {
                throw new ValidationException("Each container user needs a userName and a role");
            }
        }
        users.forEach(u -> containerUserService.setUserRole(containerName, u.userName(), u.role()));
        return containerUserService.getUsersForContainer(containerName);
    }

    public void removeContainerUser(UserPrincipal principal, String containerName, String userName) {
        accessChecker.checkAdminRights(principal, containerName);
        requireContainer(containerName);
        containerUserService.removeUser(containerName, userName);
    }

    private void checkRead(UserPrincipal principal, String containerName) {
        accessChecker.checkReadRights(principal, containerName, containerService.isReadOnlyForAnonymous(containerName));
    }

    private void requireContainer(String containerName) {
        if (!containerService.exists(containerName)) {
            throw new NotFoundException("Container '" + containerName + "' not found");
        }
    }
}
