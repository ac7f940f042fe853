package io.github.drompincen.annostore.runtime.access;

import io.github.drompincen.annostore.persistence.document.UserDocument;
import io.github.drompincen.annostore.persistence.repository.ContainerUserRepository;
import io.github.drompincen.annostore.persistence.repository.UserRepository;
import io.github.drompincen.annostore.protocol.api.UserEntry;
import io.github.drompincen.annostore.runtime.config.StoreSettings;
import io.github.drompincen.annostore.runtime.error.NotAuthorizedException;
import io.github.drompincen.annostore.runtime.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * API-key authentication and the root-only user administration.
 */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final ContainerUserRepository containerUserRepository;
    private final StoreSettings settings;

    public UserService(UserRepository userRepository,
                       ContainerUserRepository containerUserRepository,
                       StoreSettings settings) {
        this.userRepository = userRepository;
        this.containerUserRepository = containerUserRepository;
        this.settings = settings;
    }

    /**
     * Resolves an API key. An absent key means an anonymous caller; an unknown key is rejected.
     */
    public Optional<UserPrincipal> authenticate(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return Optional.empty();
        }
        String rootKey = settings.rootApiKey();
        if (rootKey != null && !rootKey.isBlank() && rootKey.equals(apiKey)) {
            return Optional.of(UserPrincipal.root());
        }
        return Optional.of(userRepository.findByApiKey(apiKey)
                .map(u -> UserPrincipal.named(u.getUserName()))
                .orElseThrow(() -> new NotAuthorizedException("Unknown api key")));
    }

    public List<UserEntry> listUsers(UserPrincipal principal) {
        checkRoot(principal);
        return userRepository.findAllByOrderByUserNameAsc().stream()
                .map(u -> new UserEntry(u.getUserName(), u.getApiKey()))
                .toList();
    }

    /**
     * Adds the users whose name and key are both unused; returns the names that were rejected.
     * A malformed entry rejects the whole request before anything is stored.
     */
    public List<String> addUsers(UserPrincipal principal, List<UserEntry> users) {
        checkRoot(principal);
        for (UserEntry entry : users) {
            if (entry.userName() == null || entry.userName().isBlank() || entry.apiKey() == null || entry.apiKey().isBlank()) {
                throw new ValidationException("userName and apiKey are required");
            }
            if (UserPrincipal.ROOT_NAME.equalsIgnoreCase(entry.userName().trim())) {
                throw new ValidationException("User name '" + entry.userName() + "' is reserved");
            }
        }
        List<String> rejected = new ArrayList<>();
        for (UserEntry entry : users) {
            if (userRepository.existsById(entry.userName()) || userRepository.findByApiKey(entry.apiKey()).isPresent()) {
                rejected.add(entry.userName());
                continue;
            }
            UserDocument doc = new UserDocument();
            doc.setUserName(entry.userName());
            doc.setApiKey(entry.apiKey());
            doc.setCreatedAt(Instant.now());
            userRepository.save(doc);
            log.info("Added user {}", entry.userName());
        }
        return rejected;
    }

    public void deleteUser(UserPrincipal principal, String userName) {
        checkRoot(principal);
        userRepository.deleteById(userName);
        containerUserRepository.deleteByUserName(userName);
        log.info("Deleted user {}", userName);
    }

    private static void checkRoot(UserPrincipal principal) {
        if (!(principal instanceof UserPrincipal.Root)) {
            throw new NotAuthorizedException("Only root may manage users");
        }
    }
}
