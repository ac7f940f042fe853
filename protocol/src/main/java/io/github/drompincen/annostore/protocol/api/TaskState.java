package io.github.drompincen.annostore.protocol.api;

public enum TaskState {
    CREATED,
    RUNNING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
