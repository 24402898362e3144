package io.github.samzhu.keeper.exception;

/**
 * 配額不足，拒絕建立新的 Session。
 */
public class QuotaExceededException extends RuntimeException {

    private final String userId;
    private final String violation;

    public QuotaExceededException(String userId, String violation, String reason) {
        super(reason);
        this.userId = userId;
        this.violation = violation;
    }

    public String getUserId() {
        return userId;
    }

    /**
     * @return 違反的配額項目，例如 {@code MAX_CONCURRENT_SESSIONS}
     */
    public String getViolation() {
        return violation;
    }
}
