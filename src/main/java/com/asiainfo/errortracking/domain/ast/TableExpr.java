package com.asiainfo.errortracking.domain.ast;

/**
 * 可以出现在 FROM 中的表达式：表引用或嵌套子查询
 */
public sealed interface TableExpr extends Expr permits Field, SelectQuery {
}
