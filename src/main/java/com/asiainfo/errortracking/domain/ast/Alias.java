package com.asiainfo.errortracking.domain.ast;

import java.util.Objects;

/**
 * 为计算表达式绑定输出列名
 */
public record Alias(String alias, Expr expr) implements Expr {

    public Alias {
        Objects.requireNonNull(alias, "alias");
        Objects.requireNonNull(expr, "expr");
    }
}
