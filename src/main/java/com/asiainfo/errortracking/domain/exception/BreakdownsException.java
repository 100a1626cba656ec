package com.asiainfo.errortracking.domain.exception;

/**
 * 拆分查询异常基类
 * 所有子类对当前请求都是终止性的，不做重试
 */
public abstract class BreakdownsException extends RuntimeException {

    protected BreakdownsException(String message) {
        super(message);
    }

    protected BreakdownsException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 返回给调用方的业务状态码
     */
    public abstract String getStatusCode();
}
