package com.example.cliporganizer.common.exception;

/**
 * Failure that is reported to the caller as an error code instead of a 500.
 */
public class BusinessException extends RuntimeException {

    private final String code;
    private final String userAction;

    public BusinessException(String code, String message) {
        this(code, message, null, null);
    }

    public BusinessException(String code, String message, String userAction) {
        this(code, message, userAction, null);
    }

    public BusinessException(String code, String message, Throwable cause) {
        this(code, message, null, cause);
    }

    protected BusinessException(String code, String message, String userAction, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.userAction = userAction;
    }

    public String getCode() {
        return code;
    }

    /**
     * Hint for the operator, such as which setting to fix. May be null.
     */
    public String getUserAction() {
        return userAction;
    }
}
