package com.asiainfo.errortracking.domain.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 关系查询节点
 * <p>
 * from 只接受一个表表达式（表引用或子查询），通过嵌套 from 形成逐层的流水线，
 * 每层只引用紧挨着的下一层，因此整棵树天然无环。
 *
 * @param select  输出列
 * @param from    数据来源
 * @param where   过滤条件，可为 null
 * @param groupBy 分组键，无分组时为空
 * @param orderBy 排序，无排序时为空
 * @param limit   行数上限，可为 null
 */
public record SelectQuery(
        List<Expr> select,
        TableExpr from,
        Expr where,
        List<Expr> groupBy,
        List<OrderExpr> orderBy,
        Expr limit
) implements TableExpr {

    public SelectQuery {
        if (select == null || select.isEmpty()) {
            throw new IllegalArgumentException("SelectQuery requires at least one select expression");
        }
        Objects.requireNonNull(from, "from");
        select = List.copyOf(select);
        groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 返回只替换了 limit 的副本
     */
    public SelectQuery withLimit(Expr newLimit) {
        return new SelectQuery(select, from, where, groupBy, orderBy, newLimit);
    }

    public static final class Builder {
        private final List<Expr> select = new ArrayList<>();
        private TableExpr from;
        private Expr where;
        private final List<Expr> groupBy = new ArrayList<>();
        private final List<OrderExpr> orderBy = new ArrayList<>();
        private Expr limit;

        private Builder() {
        }

        public Builder select(Expr... exprs) {
            select.addAll(List.of(exprs));
            return this;
        }

        public Builder select(List<? extends Expr> exprs) {
            select.addAll(exprs);
            return this;
        }

        public Builder from(TableExpr from) {
            this.from = from;
            return this;
        }

        public Builder where(Expr where) {
            this.where = where;
            return this;
        }

        public Builder groupBy(Expr... exprs) {
            groupBy.addAll(List.of(exprs));
            return this;
        }

        public Builder orderBy(OrderExpr... exprs) {
            orderBy.addAll(List.of(exprs));
            return this;
        }

        public Builder limit(Expr limit) {
            this.limit = limit;
            return this;
        }

        public SelectQuery build() {
            return new SelectQuery(select, from, where, groupBy, orderBy, limit);
        }
    }
}
