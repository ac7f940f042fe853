package io.github.drompincen.annostore.runtime.error;

public class PreconditionFailedException extends AnnoStoreException {

    public PreconditionFailedException(String message) {
        super(ErrorKind.PRECONDITION_FAILED, message);
    }
}
