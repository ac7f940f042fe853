package io.github.drompincen.annostore.runtime.error;

public class ValidationException extends AnnoStoreException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
