package com.asiainfo.errortracking.domain.ast;

import java.util.List;

/**
 * 窗口函数：name(args) OVER (PARTITION BY ... ORDER BY ...)
 * partitionBy 和 orderBy 可以为空
 */
public record WindowFunction(String name, List<Expr> args, List<Expr> partitionBy, List<OrderExpr> orderBy)
        implements Expr {

    public WindowFunction {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Window function requires a name");
        }
        args = args == null ? List.of() : List.copyOf(args);
        partitionBy = partitionBy == null ? List.of() : List.copyOf(partitionBy);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
    }
}
