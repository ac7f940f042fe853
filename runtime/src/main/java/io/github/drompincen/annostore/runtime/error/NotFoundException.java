package io.github.drompincen.annostore.runtime.error;

public class NotFoundException extends AnnoStoreException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
