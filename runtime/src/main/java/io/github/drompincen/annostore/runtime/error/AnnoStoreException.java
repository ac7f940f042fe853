package io.github.drompincen.annostore.runtime.error;

/**
 * Base class of the client-facing failures raised by the core.
 * Anything else escaping a synchronous call is an internal failure.
 */
public abstract class AnnoStoreException extends RuntimeException {

    private final ErrorKind kind;

    protected AnnoStoreException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
