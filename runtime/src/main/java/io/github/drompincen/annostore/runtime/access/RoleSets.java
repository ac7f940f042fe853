package io.github.drompincen.annostore.runtime.access;

import io.github.drompincen.annostore.protocol.api.Role;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The role sets operations are guarded with. Every allowed role is listed explicitly.
 */
public final class RoleSets {

    /** Container user management, index mutation, container deletion. */
    public static final Set<Role> ADMIN_ONLY = Collections.unmodifiableSet(EnumSet.of(Role.ADMIN));

    /** Annotation writes. */
    public static final Set<Role> ADMIN_OR_EDITOR = Collections.unmodifiableSet(EnumSet.of(Role.ADMIN, Role.EDITOR));

    /** Reads and searches. */
    public static final Set<Role> ANY_ROLE = Collections.unmodifiableSet(EnumSet.of(Role.ADMIN, Role.EDITOR, Role.GUEST));

    private RoleSets() {}
}
