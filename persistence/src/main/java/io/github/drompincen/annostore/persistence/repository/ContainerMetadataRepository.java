package io.github.drompincen.annostore.persistence.repository;

import io.github.drompincen.annostore.persistence.document.ContainerMetadataDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface ContainerMetadataRepository extends MongoRepository<ContainerMetadataDocument, String> {
    Optional<ContainerMetadataDocument> findByName(String name);
    boolean existsByName(String name);
    void deleteByName(String name);
    List<ContainerMetadataDocument> findAllByOrderByNameAsc();
}
