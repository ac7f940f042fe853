package io.github.drompincen.annostore.runtime.error;

public enum ErrorKind {
    VALIDATION,
    NOT_AUTHORIZED,
    NOT_FOUND,
    PRECONDITION_FAILED
}
