package io.deskflow.model;

public record SelectorOutcome(
        String stepId,
        String selector,
        boolean success
) {
}
