package io.github.drompincen.annostore.runtime.error;

public class NotAuthorizedException extends AnnoStoreException {

    public NotAuthorizedException(String message) {
        super(ErrorKind.NOT_AUTHORIZED, message);
    }
}
