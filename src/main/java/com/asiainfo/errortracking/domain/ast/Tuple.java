package com.asiainfo.errortracking.domain.ast;

import java.util.List;

public record Tuple(List<Expr> exprs) implements Expr {

    public Tuple {
        if (exprs == null || exprs.isEmpty()) {
            throw new IllegalArgumentException("Tuple must have at least one element");
        }
        exprs = List.copyOf(exprs);
    }
}
