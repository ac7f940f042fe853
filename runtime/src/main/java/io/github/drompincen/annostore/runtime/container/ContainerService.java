package io.github.drompincen.annostore.runtime.container;

import io.github.drompincen.annostore.persistence.document.ContainerMetadataDocument;
import io.github.drompincen.annostore.persistence.repository.ContainerMetadataRepository;
import io.github.drompincen.annostore.persistence.store.AnnotationCollectionService;
import io.github.drompincen.annostore.persistence.store.AnnotationEnvelope;
import io.github.drompincen.annostore.protocol.api.AnnotationDto;
import io.github.drompincen.annostore.protocol.api.AnnotationIdentifier;
import io.github.drompincen.annostore.protocol.api.ContainerDto;
import io.github.drompincen.annostore.protocol.api.CreateContainerRequest;
import io.github.drompincen.annostore.protocol.api.Role;
import io.github.drompincen.annostore.runtime.access.ContainerUserService;
import io.github.drompincen.annostore.runtime.access.UserPrincipal;
import io.github.drompincen.annostore.runtime.config.UriFactory;
import io.github.drompincen.annostore.runtime.error.NotAuthorizedException;
import io.github.drompincen.annostore.runtime.error.NotFoundException;
import io.github.drompincen.annostore.runtime.error.PreconditionFailedException;
import io.github.drompincen.annostore.runtime.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Containers and the annotations inside them. Keeps each container's metadata record
 * (modification time, field occurrence counts) in step with its collection.
 */
@Service
public class ContainerService {

    private static final Logger log = LoggerFactory.getLogger(ContainerService.class);

    private static final Set<String> RESERVED_NAMES = Set.of("container_metadata", "container_users", "users");

    private final AnnotationCollectionService store;
    private final ContainerMetadataRepository containerMetadataRepository;
    private final ContainerUserService containerUserService;
    private final UriFactory uriFactory;
    private final Clock clock;

    public ContainerService(AnnotationCollectionService store,
                            ContainerMetadataRepository containerMetadataRepository,
                            ContainerUserService containerUserService,
                            UriFactory uriFactory,
                            Clock clock) {
        this.store = store;
        this.containerMetadataRepository = containerMetadataRepository;
        this.containerUserService = containerUserService;
        this.uriFactory = uriFactory;
        this.clock = clock;
    }

    // ---- Containers ----

    /**
     * Creates the collection and its metadata. A suggested name that is taken or unusable is
     * replaced by a generated one; a named creator becomes the container's admin.
     */
    public ContainerDto createContainer(UserPrincipal principal, CreateContainerRequest request) {
        if (principal == null) {
            throw new NotAuthorizedException("No authentication found");
        }
        String suggested = request != null ? request.name() : null;
        String name = isAvailable(suggested) ? suggested : UUID.randomUUID().toString();
        ContainerMetadataDocument metadata = new ContainerMetadataDocument();
        metadata.setName(name);
        metadata.setLabel(request != null && request.label() != null ? request.label() : "");
        metadata.setCreatedAt(clock.instant());
        metadata.setModifiedAt(metadata.getCreatedAt());
        metadata.setReadOnlyForAnonymous(request != null && request.readOnlyForAnonymous());
        store.createCollection(name);
        metadata = containerMetadataRepository.save(metadata);
        if (principal instanceof UserPrincipal.Named named) {
            containerUserService.setUserRole(name, named.name(), Role.ADMIN);
        }
        log.info("Created container {} for {}", name, principal.name());
        return toDto(metadata);
    }

    public ContainerDto getContainer(String containerName) {
        return toDto(getMetadata(containerName));
    }

    public ContainerMetadataDocument getMetadata(String containerName) {
        return containerMetadataRepository.findByName(containerName)
                .orElseThrow(() -> new NotFoundException("Container '" + containerName + "' not found"));
    }

    public boolean exists(String containerName) {
        return containerMetadataRepository.existsByName(containerName);
    }

    public List<String> allContainerNames() {
        return containerMetadataRepository.findAllByOrderByNameAsc().stream()
                .map(ContainerMetadataDocument::getName)
                .toList();
    }

    public boolean isReadOnlyForAnonymous(String containerName) {
        return containerMetadataRepository.findByName(containerName)
                .map(ContainerMetadataDocument::isReadOnlyForAnonymous)
                .orElse(false);
    }

    /** Only an empty container can be deleted. */
    public void deleteContainer(String containerName) {
        getMetadata(containerName);
        long size = store.countDocuments(containerName);
        if (size > 0) {
            throw new ValidationException("Container '" + containerName + "' is not empty, it still has "
                    + size + " annotation(s)");
        }
        store.dropCollection(containerName);
        containerMetadataRepository.deleteByName(containerName);
        containerUserService.removeAllUsers(containerName);
        log.info("Deleted container {}", containerName);
    }

    // ---- Annotations ----

    public AnnotationDto createAnnotation(String containerName, String suggestedName, Map<String, Object> annotation) {
        getMetadata(containerName);
        requireBody(annotation);
        String name = suggestedName == null || suggestedName.isBlank() || store.annotationExists(containerName, suggestedName)
                ? UUID.randomUUID().toString()
                : suggestedName;
        AnnotationEnvelope created = store.insert(containerName, name, annotation);
        updateFieldCounts(containerName, List.of(FieldPaths.of(annotation)), List.of());
        log.debug("Created annotation {} in container {}", name, containerName);
        return toDto(containerName, created);
    }

    public AnnotationDto getAnnotation(String containerName, String annotationName) {
        return toDto(containerName, findAnnotation(containerName, annotationName));
    }

    /** Full replace; {@code etag} must equal the stored one. */
    public AnnotationDto replaceAnnotation(String containerName, String annotationName, String etag,
                                           Map<String, Object> annotation) {
        requireBody(annotation);
        AnnotationEnvelope current = findAnnotation(containerName, annotationName);
        if (etag == null || !etag.equals(current.etag())) {
            throw new PreconditionFailedException("Etag does not match the current version of " + annotationName);
        }
        AnnotationEnvelope replaced = store.replace(containerName, annotationName, annotation, etag)
                .orElseThrow(() -> new PreconditionFailedException(
                        "Annotation " + annotationName + " was modified concurrently"));
        updateFieldCounts(containerName, List.of(FieldPaths.of(annotation)), List.of(FieldPaths.of(current.annotation())));
        return toDto(containerName, replaced);
    }

    /** Deletes the annotation; when {@code etag} is given it must equal the stored one. */
    public void deleteAnnotation(String containerName, String annotationName, String etag) {
        AnnotationEnvelope current = findAnnotation(containerName, annotationName);
        if (etag != null && !etag.equals(current.etag())) {
            throw new PreconditionFailedException("Etag does not match the current version of " + annotationName);
        }
        store.delete(containerName, annotationName).ifPresent(deleted ->
                updateFieldCounts(containerName, List.of(), List.of(FieldPaths.of(deleted.annotation()))));
    }

    /** Stores every annotation under a generated name. */
    public List<AnnotationIdentifier> batchUpload(String containerName, List<Map<String, Object>> annotations) {
        getMetadata(containerName);
        Map<String, Map<String, Object>> byName = new LinkedHashMap<>();
        List<Set<String>> added = new ArrayList<>();
        for (Map<String, Object> annotation : annotations) {
            requireBody(annotation);
            byName.put(UUID.randomUUID().toString(), annotation);
            added.add(FieldPaths.of(annotation));
        }
        List<AnnotationIdentifier> identifiers = store.insertAll(containerName, byName).stream()
                .map(e -> new AnnotationIdentifier(containerName, e.name(), e.etag()))
                .toList();
        updateFieldCounts(containerName, added, List.of());
        log.info("Uploaded {} annotation(s) to container {}", identifiers.size(), containerName);
        return identifiers;
    }

    public Map<String, Integer> getFieldCounts(String containerName) {
        return new TreeMap<>(getMetadata(containerName).fieldCountMap());
    }

    public List<Object> getDistinctValues(String containerName, String field) {
        getMetadata(containerName);
        return store.distinctValues(containerName, field);
    }

    // ---- internals ----

    private boolean isAvailable(String name) {
        return name != null && !name.isBlank()
                && !name.contains("$") && !name.startsWith("system.")
                && !RESERVED_NAMES.contains(name)
                && !containerMetadataRepository.existsByName(name)
                && !store.collectionExists(name);
    }

    private AnnotationEnvelope findAnnotation(String containerName, String annotationName) {
        getMetadata(containerName);
        return store.find(containerName, annotationName)
                .orElseThrow(() -> new NotFoundException(
                        "Annotation '" + annotationName + "' not found in container '" + containerName + "'"));
    }

    private static void requireBody(Map<String, Object> annotation) {
        if (annotation == null || annotation.isEmpty()) {
            throw new ValidationException("Annotation body must be a non-empty JSON object");
        }
    }

    // read-modify-write of the metadata record; serialized within this instance only
    private synchronized void updateFieldCounts(String containerName, Collection<Set<String>> added,
                                                Collection<Set<String>> removed) {
        containerMetadataRepository.findByName(containerName).ifPresent(metadata -> {
            Map<String, Integer> counts = metadata.fieldCountMap();
            added.forEach(fields -> fields.stream()
                    .filter(f -> !f.contains("@"))
                    .forEach(f -> counts.merge(f, 1, Integer::sum)));
            removed.forEach(fields -> fields.stream()
                    .filter(f -> !f.contains("@"))
                    .forEach(f -> counts.computeIfPresent(f, (k, c) -> c > 1 ? c - 1 : null)));
            metadata.replaceFieldCounts(counts);
            metadata.setModifiedAt(clock.instant());
            containerMetadataRepository.save(metadata);
        });
    }

    private ContainerDto toDto(ContainerMetadataDocument metadata) {
        return new ContainerDto(uriFactory.containerUrl(metadata.getName()), metadata.getName(), metadata.getLabel(),
                metadata.getCreatedAt(), metadata.getModifiedAt(), store.countDocuments(metadata.getName()),
                metadata.isReadOnlyForAnonymous());
    }

    private AnnotationDto toDto(String containerName, AnnotationEnvelope envelope) {
        Map<String, Object> body = new LinkedHashMap<>(envelope.annotation());
        body.put("id", uriFactory.annotationUrl(containerName, envelope.name()));
        return new AnnotationDto(containerName, envelope.name(), envelope.etag(), body);
    }
}
