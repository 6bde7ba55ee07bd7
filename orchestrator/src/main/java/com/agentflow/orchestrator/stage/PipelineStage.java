package com.agentflow.orchestrator.stage;

import java.util.Locale;
import java.util.Optional;

/**
 * Ordered pipeline stages. Declaration order is pipeline order.
 *
 * The persisted form is {@link #value()}. Older deployments wrote a few
 * other spellings; {@link #fromValue} accepts those too. Anything else is
 * not a stage this deployment knows, and callers must not guess a position
 * for it.
 */
public enum PipelineStage {

    IMPLEMENTATION("implementation"),
    QUALITY("quality"),
    SECURITY("security"),
    TESTING("testing"),
    WAITING_EXTERNAL_INTEGRATION("waiting-external-integration"),
    WAITING_MERGE("waiting-merge"),
    COMPLETED("completed");

    private final String value;

    PipelineStage(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isWaiting() {
        return this == WAITING_EXTERNAL_INTEGRATION || this == WAITING_MERGE;
    }

    public boolean isTerminal() {
        return this == COMPLETED;
    }

    /** Parse a persisted stage name; empty when the name is not recognized. */
    public static Optional<PipelineStage> fromValue(String raw) {
        if (raw == null) return Optional.empty();
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "implementation", "implementation-in-progress"                 -> Optional.of(IMPLEMENTATION);
            case "quality", "quality-in-progress"                               -> Optional.of(QUALITY);
            case "security", "security-in-progress"                             -> Optional.of(SECURITY);
            case "testing", "testing-in-progress"                               -> Optional.of(TESTING);
            case "waiting-external-integration", "waiting-atlas-integration",
                 "atlas"                                                        -> Optional.of(WAITING_EXTERNAL_INTEGRATION);
            case "waiting-merge", "waiting-pr-merged", "merge"                  -> Optional.of(WAITING_MERGE);
            case "completed", "complete", "done"                                -> Optional.of(COMPLETED);
            default                                                             -> Optional.empty();
        };
    }
}
