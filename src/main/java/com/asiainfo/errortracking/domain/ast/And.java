package com.asiainfo.errortracking.domain.ast;

import java.util.List;

/**
 * 合取，子条件按插入顺序保留
 */
public record And(List<Expr> exprs) implements Expr {

    public And {
        if (exprs == null || exprs.isEmpty()) {
            throw new IllegalArgumentException("And requires at least one condition");
        }
        exprs = List.copyOf(exprs);
    }
}
