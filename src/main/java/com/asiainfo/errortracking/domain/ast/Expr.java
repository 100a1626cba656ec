package com.asiainfo.errortracking.domain.ast;

/**
 * 列表达式树节点
 * <p>
 * 封闭层次，每种节点对应一个不可变 record，构造时只接受已构造好的子节点。
 * record 自带结构相等，便于对生成的查询计划做快照断言。
 */
public sealed interface Expr
        permits Constant, Call, Tuple, Array, Alias, CompareOperation, And, WindowFunction, TableExpr {
}
