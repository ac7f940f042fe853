package io.github.drompincen.annostore.runtime.access;

import io.github.drompincen.annostore.persistence.document.ContainerUserDocument;
import io.github.drompincen.annostore.persistence.repository.ContainerUserRepository;
import io.github.drompincen.annostore.protocol.api.ContainerUserEntry;
import io.github.drompincen.annostore.protocol.api.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Role store: which role a user holds in a container.
 */
@Service
public class ContainerUserService {

    private static final Logger log = LoggerFactory.getLogger(ContainerUserService.class);

    private final ContainerUserRepository containerUserRepository;

    public ContainerUserService(ContainerUserRepository containerUserRepository) {
        this.containerUserRepository = containerUserRepository;
    }

    public Optional<Role> getUserRole(String containerName, String userName) {
        return containerUserRepository.findByContainerNameAndUserName(containerName, userName)
                .map(ContainerUserDocument::getRole);
    }

    /** Assigns {@code role}, replacing any role the user already had in the container. */
    public void setUserRole(String containerName, String userName, Role role) {
        ContainerUserDocument doc = containerUserRepository.findByContainerNameAndUserName(containerName, userName)
                .orElseGet(ContainerUserDocument::new);
        doc.setContainerName(containerName);
        doc.setUserName(userName);
        doc.setRole(role);
        containerUserRepository.save(doc);
        log.info("User {} now has role {} in container {}", userName, role, containerName);
    }

    public void removeUser(String containerName, String userName) {
        containerUserRepository.deleteByContainerNameAndUserName(containerName, userName);
    }

    public void removeAllUsers(String containerName) {
        containerUserRepository.deleteByContainerName(containerName);
    }

    public List<ContainerUserEntry> getUsersForContainer(String containerName) {
        return containerUserRepository.findByContainerNameOrderByUserNameAsc(containerName).stream()
                .map(d -> new ContainerUserEntry(d.getUserName(), d.getRole()))
                .toList();
    }

    /** Container names the user has a role in, grouped by role. */
    public Map<Role, List<String>> getContainersByRole(String userName) {
        return containerUserRepository.findByUserName(userName).stream()
                .collect(Collectors.groupingBy(ContainerUserDocument::getRole, TreeMap::new,
                        Collectors.mapping(ContainerUserDocument::getContainerName,
                                Collectors.collectingAndThen(Collectors.toList(), l -> l.stream().sorted().toList()))));
    }
}
