package io.github.samzhu.keeper.exception;

/**
 * GPU 供應商呼叫失敗異常。
 *
 * <p>供應商回應錯誤、逾時或回傳無法解析的內容時拋出。
 * 通常被 Circuit Breaker 包裝為 {@link DependencyUnavailableException}。
 */
public class ProviderException extends RuntimeException {

    private final String provider;
    private final String operation;

    public ProviderException(String provider, String operation, String message) {
        super(String.format("Provider '%s' %s failed: %s", provider, operation, message));
        this.provider = provider;
        this.operation = operation;
    }

    public ProviderException(String provider, String operation, Throwable cause) {
        super(String.format("Provider '%s' %s failed: %s", provider, operation, cause.getMessage()), cause);
        this.provider = provider;
        this.operation = operation;
    }

    public String getProvider() {
        return provider;
    }

    public String getOperation() {
        return operation;
    }
}
