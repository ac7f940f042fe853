package io.github.drompincen.annostore.runtime.access;

/**
 * An authenticated caller. Anonymous callers are represented by a {@code null} principal.
 */
public sealed interface UserPrincipal permits UserPrincipal.Root, UserPrincipal.Named {

    /** Display name of the superuser; reserved, no registered user may take it. */
    String ROOT_NAME = "root";

    String name();

    static UserPrincipal root() {
        return Root.INSTANCE;
    }

    static UserPrincipal named(String name) {
        return new Named(name);
    }

    /** The superuser; passes every container role check. */
    final class Root implements UserPrincipal {

        private static final Root INSTANCE = new Root();

        private Root() {}

        @Override
        public String name() {
            return ROOT_NAME;
        }

        @Override
        public String toString() {
            return "Root";
        }
    }

    record Named(String name) implements UserPrincipal {
        public Named {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("user name must not be blank");
            }
        }
    }
}
