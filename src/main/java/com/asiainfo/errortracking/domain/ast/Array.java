package com.asiainfo.errortracking.domain.ast;

import java.util.List;

public record Array(List<Expr> exprs) implements Expr {

    public Array {
        exprs = exprs == null ? List.of() : List.copyOf(exprs);
    }
}
