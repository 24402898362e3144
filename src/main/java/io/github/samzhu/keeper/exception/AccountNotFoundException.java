package io.github.samzhu.keeper.exception;

/**
 * 找不到用戶帳戶。
 */
public class AccountNotFoundException extends RuntimeException {

    private final String userId;

    public AccountNotFoundException(String userId) {
        super("Account not found: " + userId);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
