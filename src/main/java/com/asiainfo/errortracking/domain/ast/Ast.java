package com.asiainfo.errortracking.domain.ast;

import java.util.List;

/**
 * 构造表达式树的静态工厂
 */
public final class Ast {

    private Ast() {
    }

    public static Constant constant(Object value) {
        return new Constant(value);
    }

    public static Field field(String... chain) {
        return new Field(List.of(chain));
    }

    public static Call call(String name, Expr... args) {
        return new Call(name, List.of(args));
    }

    public static Tuple tuple(Expr... exprs) {
        return new Tuple(List.of(exprs));
    }

    public static Array array(List<? extends Expr> exprs) {
        return new Array(List.copyOf(exprs));
    }

    public static Alias alias(String alias, Expr expr) {
        return new Alias(alias, expr);
    }

    public static CompareOperation compare(Expr left, CompareOperation.Op op, Expr right) {
        return new CompareOperation(left, right, op);
    }

    public static And and(List<? extends Expr> exprs) {
        return new And(List.copyOf(exprs));
    }

    public static OrderExpr asc(Expr expr) {
        return new OrderExpr(expr, OrderExpr.Direction.ASC);
    }

    public static OrderExpr desc(Expr expr) {
        return new OrderExpr(expr, OrderExpr.Direction.DESC);
    }
}
