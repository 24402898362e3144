package io.github.samzhu.keeper.exception;

import java.util.List;

/**
 * 所有候選供應商都無法開機。
 *
 * <p>Session 已被標記為 {@code error}，不會產生費用。
 */
public class NoCapacityException extends RuntimeException {

    private final String sessionId;
    private final List<String> attemptedProviders;

    public NoCapacityException(String sessionId, List<String> attemptedProviders) {
        super(String.format("No GPU capacity available for session '%s' (attempted: %s)",
            sessionId, attemptedProviders.isEmpty() ? "none" : String.join(", ", attemptedProviders)));
        this.sessionId = sessionId;
        this.attemptedProviders = List.copyOf(attemptedProviders);
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<String> getAttemptedProviders() {
        return attemptedProviders;
    }
}
