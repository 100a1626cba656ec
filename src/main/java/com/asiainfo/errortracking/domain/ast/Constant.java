package com.asiainfo.errortracking.domain.ast;

import java.time.Instant;

/**
 * 字面量
 * 只允许 null、String、Number、Boolean、Instant，保证计划可以被序列化和重放
 */
public record Constant(Object value) implements Expr {

    public Constant {
        if (value != null
                && !(value instanceof String)
                && !(value instanceof Number)
                && !(value instanceof Boolean)
                && !(value instanceof Instant)) {
            throw new IllegalArgumentException("Unsupported constant type: " + value.getClass().getName());
        }
    }
}
