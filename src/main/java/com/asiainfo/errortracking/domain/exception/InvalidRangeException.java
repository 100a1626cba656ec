package com.asiainfo.errortracking.domain.exception;

/**
 * 时间范围非法：date_to 为 "all"、表达式无法解析、或 from 晚于 to
 */
public class InvalidRangeException extends BreakdownsException {

    private final String field;
    private final String input;

    public InvalidRangeException(String field, String input, String reason) {
        super(String.format("Invalid date range: %s=%s (%s)", field, input, reason));
        this.field = field;
        this.input = input;
    }

    public String getField() {
        return field;
    }

    public String getInput() {
        return input;
    }

    @Override
    public String getStatusCode() {
        return "4001";
    }
}
