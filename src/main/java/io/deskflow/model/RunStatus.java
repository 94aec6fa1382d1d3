package io.deskflow.model;

public enum RunStatus {
    SUCCESS,
    FAILED,
    SKIPPED
}
