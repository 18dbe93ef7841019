package com.autobudget.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the service's unchecked exceptions. The {@link ErrorCode} names the failing
 * collaborator; {@code details} carries response context (operation, HTTP status) for logs.
 */
@Getter
public abstract class AutoBudgetException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected AutoBudgetException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }
}
