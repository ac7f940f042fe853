package io.github.drompincen.annostore.runtime.access;

import io.github.drompincen.annostore.protocol.api.Role;
import io.github.drompincen.annostore.runtime.error.NotAuthorizedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a caller may perform an operation on a container.
 */
@Component
public class ContainerAccessChecker {

    private static final Logger log = LoggerFactory.getLogger(ContainerAccessChecker.class);

    private final ContainerUserService containerUserService;

    public ContainerAccessChecker(ContainerUserService containerUserService) {
        this.containerUserService = containerUserService;
    }

    public void checkAdminRights(UserPrincipal principal, String containerName) {
        authorize(principal, containerName, RoleSets.ADMIN_ONLY, false);
    }

    public void checkEditRights(UserPrincipal principal, String containerName) {
        authorize(principal, containerName, RoleSets.ADMIN_OR_EDITOR, false);
    }

    public void checkReadRights(UserPrincipal principal, String containerName, boolean anonymousHasAccess) {
        authorize(principal, containerName, RoleSets.ANY_ROLE, anonymousHasAccess);
    }

    /**
     * @param principal        the caller, {@code null} when anonymous
     * @param allowedRoles     roles that may perform the operation
     * @param anonymousAllowed whether anonymous callers may perform it
     * @throws NotAuthorizedException when the caller may not
     */
    public void authorize(UserPrincipal principal, String containerName, Set<Role> allowedRoles,
                          boolean anonymousAllowed) {
        if (principal instanceof UserPrincipal.Root) {
            return;
        }
        if (principal instanceof UserPrincipal.Named named) {
            Optional<Role> role = containerUserService.getUserRole(containerName, named.name());
            if (role.isPresent() && allowedRoles.contains(role.get())) {
                return;
            }
            log.debug("User {} with role {} denied on container {}", named.name(), role.orElse(null), containerName);
            throw new NotAuthorizedException(
                    "User " + named.name() + " does not have access rights to this endpoint");
        }
        if (!anonymousAllowed) {
            throw new NotAuthorizedException("No authentication found");
        }
    }
}
