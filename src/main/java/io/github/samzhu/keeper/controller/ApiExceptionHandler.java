package io.github.samzhu.keeper.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import io.github.samzhu.keeper.exception.AccountNotFoundException;
import io.github.samzhu.keeper.exception.DependencyUnavailableException;
import io.github.samzhu.keeper.exception.InvalidSessionRequestException;
import io.github.samzhu.keeper.exception.InvalidSessionTransitionException;
import io.github.samzhu.keeper.exception.NoCapacityException;
import io.github.samzhu.keeper.exception.ProviderException;
import io.github.samzhu.keeper.exception.QuotaExceededException;
import io.github.samzhu.keeper.exception.SessionNotFoundException;

/**
 * 將領域例外轉為 RFC 7807 {@link ProblemDetail} 回應。
 *
 * <p>每個回應帶有 {@code code} 屬性供用戶端判斷。
 *
 * @see <a href="https://docs.spring.io/spring-framework/reference/web/webmvc/mvc-ann-rest-exceptions.html">Error Responses</a>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SessionNotFoundException.class)
    public ProblemDetail handleSessionNotFound(SessionNotFoundException e) {
        return problem(HttpStatus.NOT_FOUND, "SESSION_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(AccountNotFoundException.class)
    public ProblemDetail handleAccountNotFound(AccountNotFoundException e) {
        return problem(HttpStatus.NOT_FOUND, "ACCOUNT_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(InvalidSessionTransitionException.class)
    public ProblemDetail handleInvalidTransition(InvalidSessionTransitionException e) {
        ProblemDetail detail = problem(HttpStatus.CONFLICT, "INVALID_SESSION_TRANSITION", e.getMessage());
        detail.setProperty("from", e.getFrom());
        detail.setProperty("to", e.getTo());
        return detail;
    }

    @ExceptionHandler(InvalidSessionRequestException.class)
    public ProblemDetail handleInvalidRequest(InvalidSessionRequestException e) {
        ProblemDetail detail = problem(HttpStatus.BAD_REQUEST, "INVALID_SESSION_REQUEST", e.getMessage());
        detail.setProperty("field", e.getField());
        return detail;
    }

    @ExceptionHandler(QuotaExceededException.class)
    public ProblemDetail handleQuotaExceeded(QuotaExceededException e) {
        ProblemDetail detail = problem(HttpStatus.TOO_MANY_REQUESTS, "QUOTA_EXCEEDED", e.getMessage());
        detail.setProperty("violation", e.getViolation());
        return detail;
    }

    @ExceptionHandler(NoCapacityException.class)
    public ProblemDetail handleNoCapacity(NoCapacityException e) {
        ProblemDetail detail = problem(HttpStatus.SERVICE_UNAVAILABLE, "NO_CAPACITY", e.getMessage());
        detail.setProperty("sessionId", e.getSessionId());
        return detail;
    }

    @ExceptionHandler(DependencyUnavailableException.class)
    public ProblemDetail handleDependencyUnavailable(DependencyUnavailableException e) {
        log.warn("Dependency unavailable: {}", e.getMessage());
        ProblemDetail detail = problem(HttpStatus.SERVICE_UNAVAILABLE, "DEPENDENCY_UNAVAILABLE", e.getMessage());
        detail.setProperty("dependency", e.getDependency());
        return detail;
    }

    @ExceptionHandler(ProviderException.class)
    public ProblemDetail handleProvider(ProviderException e) {
        log.error("Provider error: {}", e.getMessage(), e);
        ProblemDetail detail = problem(HttpStatus.BAD_GATEWAY, "PROVIDER_ERROR", e.getMessage());
        detail.setProperty("provider", e.getProvider());
        return detail;
    }

    private static ProblemDetail problem(HttpStatus status, String code, String message) {
        ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, message);
        detail.setProperty("code", code);
        return detail;
    }
}
