package io.github.drompincen.annostore.persistence.repository;

import io.github.drompincen.annostore.persistence.document.ContainerUserDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface ContainerUserRepository extends MongoRepository<ContainerUserDocument, String> {
    Optional<ContainerUserDocument> findByContainerNameAndUserName(String containerName, String userName);
    List<ContainerUserDocument> findByContainerNameOrderByUserNameAsc(String containerName);
    List<ContainerUserDocument> findByUserName(String userName);
    void deleteByContainerNameAndUserName(String containerName, String userName);
    void deleteByContainerName(String containerName);
    void deleteByUserName(String userName);
}
