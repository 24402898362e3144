package io.github.samzhu.keeper.exception;

/**
 * 建立 Session 的請求內容不合法，例如未知的 GPU 等級。
 */
public class InvalidSessionRequestException extends RuntimeException {

    private final String field;

    public InvalidSessionRequestException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
