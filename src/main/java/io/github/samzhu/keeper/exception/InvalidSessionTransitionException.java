package io.github.samzhu.keeper.exception;

/**
 * 不合法的 Session 狀態轉移。
 *
 * <p>例如對已終止的 Session 呼叫 start，或對 burst Session 呼叫 pause。
 */
public class InvalidSessionTransitionException extends RuntimeException {

    private final String sessionId;
    private final String from;
    private final String to;

    public InvalidSessionTransitionException(String sessionId, String from, String to) {
        super(String.format("Invalid session transition: sessionId='%s', %s -> %s", sessionId, from, to));
        this.sessionId = sessionId;
        this.from = from;
        this.to = to;
    }

    public InvalidSessionTransitionException(String sessionId, String from, String to, String detail) {
        super(String.format("Invalid session transition: sessionId='%s', %s -> %s (%s)", sessionId, from, to, detail));
        this.sessionId = sessionId;
        this.from = from;
        this.to = to;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }
}
