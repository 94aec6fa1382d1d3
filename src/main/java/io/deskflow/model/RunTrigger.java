package io.deskflow.model;

public enum RunTrigger {
    MANUAL,
    SCHEDULED
}
