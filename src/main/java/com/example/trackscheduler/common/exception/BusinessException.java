package com.example.trackscheduler.common.exception;

/**
 * Rejects invalid caller input. Recoverable scheduling conditions (missing
 * tracks, empty scopes) never raise this; they resolve to empty results.
 */
public class BusinessException extends RuntimeException {

    private final String code;
    private final String userAction;

    public BusinessException(String code, String message) {
        this(code, message, null);
    }

    public BusinessException(String code, String message, String userAction) {
        super(message);
        this.code = code;
        this.userAction = userAction;
    }

    public static BusinessException badRequest(String message) {
        return new BusinessException("400", message, "请检查输入参数后重试");
    }

    public static BusinessException notFound(String message) {
        return new BusinessException("404", message, "请刷新后重试");
    }

    public String getCode() {
        return code;
    }

    public String getUserAction() {
        return userAction;
    }
}
