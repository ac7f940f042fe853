package io.github.drompincen.annostore.protocol.api;

public enum Role {
    ADMIN,
    EDITOR,
    GUEST
}
