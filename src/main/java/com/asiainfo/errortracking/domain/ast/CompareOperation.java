package com.asiainfo.errortracking.domain.ast;

import java.util.Objects;

public record CompareOperation(Expr left, Expr right, Op op) implements Expr {

    public CompareOperation {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(op, "op");
    }

    public enum Op {
        EQ("="),
        NOT_EQ("!="),
        GT(">"),
        GT_EQ(">="),
        LT("<"),
        LT_EQ("<=");

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }
}
