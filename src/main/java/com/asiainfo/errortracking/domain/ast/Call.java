package com.asiainfo.errortracking.domain.ast;

import java.util.List;
import java.util.Objects;

/**
 * 标量或聚合函数调用
 */
public record Call(String name, List<Expr> args) implements Expr {

    public Call {
        Objects.requireNonNull(name, "name");
        args = args == null ? List.of() : List.copyOf(args);
    }
}
