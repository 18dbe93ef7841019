package com.autobudget.exception;

import java.util.Map;

/**
 * Raised by the remote ads API client when a call times out, fails at the transport
 * level, or returns a body that is not JSON or carries an error code.
 */
public class RemoteApiException extends AutoBudgetException {

    public RemoteApiException(String message) {
        super(ErrorCode.REMOTE_API_ERROR, message, null, null);
    }

    public RemoteApiException(String message, Map<String, Object> details) {
        super(ErrorCode.REMOTE_API_ERROR, message, details, null);
    }

    public RemoteApiException(String message, Throwable cause) {
        super(ErrorCode.REMOTE_API_ERROR, message, null, cause);
    }
}
