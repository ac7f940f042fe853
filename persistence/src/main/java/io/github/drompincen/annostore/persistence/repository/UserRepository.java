package io.github.drompincen.annostore.persistence.repository;

import io.github.drompincen.annostore.persistence.document.UserDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface UserRepository extends MongoRepository<UserDocument, String> {
    Optional<UserDocument> findByApiKey(String apiKey);
    List<UserDocument> findAllByOrderByUserNameAsc();
}
