package com.asiainfo.errortracking.domain.ast;

import java.util.Objects;

/**
 * 排序子句，不是 Expr，只能出现在 ORDER BY 或窗口定义中
 */
public record OrderExpr(Expr expr, Direction order) {

    public OrderExpr {
        Objects.requireNonNull(expr, "expr");
        order = order == null ? Direction.ASC : order;
    }

    public enum Direction {
        ASC,
        DESC
    }
}
