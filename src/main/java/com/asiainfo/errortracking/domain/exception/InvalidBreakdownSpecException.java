package com.asiainfo.errortracking.domain.exception;

/**
 * 请求不满足基本形状约束，例如维度列表为空
 */
public class InvalidBreakdownSpecException extends BreakdownsException {

    private final String field;

    public InvalidBreakdownSpecException(String field, String reason) {
        super(String.format("Invalid breakdown query: %s %s", field, reason));
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public String getStatusCode() {
        return "4002";
    }
}
