package com.asiainfo.errortracking.domain.generator;

import com.asiainfo.errortracking.domain.ast.Field;
import com.asiainfo.errortracking.domain.ast.OrderExpr;
import com.asiainfo.errortracking.domain.ast.SelectQuery;
import com.asiainfo.errortracking.domain.ast.TableExpr;
import com.asiainfo.errortracking.domain.ast.WindowFunction;

import java.util.List;
import java.util.Objects;

import static com.asiainfo.errortracking.domain.ast.Ast.alias;
import static com.asiainfo.errortracking.domain.ast.Ast.asc;
import static com.asiainfo.errortracking.domain.ast.Ast.call;
import static com.asiainfo.errortracking.domain.ast.Ast.compare;
import static com.asiainfo.errortracking.domain.ast.Ast.constant;
import static com.asiainfo.errortracking.domain.ast.Ast.desc;
import static com.asiainfo.errortracking.domain.ast.Ast.field;
import static com.asiainfo.errortracking.domain.ast.CompareOperation.Op.LT_EQ;
import static com.asiainfo.errortracking.domain.model.BreakdownConstants.COUNT;
import static com.asiainfo.errortracking.domain.model.BreakdownConstants.ROW_NUMBER;
import static com.asiainfo.errortracking.domain.model.BreakdownConstants.TOTAL_COUNT;

/**
 * 每个分区取前 K 个值（聚合 -> 排名 -> 过滤）
 * <p>
 * 输入是一张至少包含 (partitionKey, valueKey) 两列的表，输出列为
 * partitionKey, valueKey, count, total_count，其中 total_count 是该分区
 * 所有取值在排名过滤之前的计数之和。
 */
public final class TopKPerPartition {

    private final Field partitionKey;
    private final Field valueKey;

    public TopKPerPartition(Field partitionKey, Field valueKey) {
        this.partitionKey = Objects.requireNonNull(partitionKey, "partitionKey");
        this.valueKey = Objects.requireNonNull(valueKey, "valueKey");
    }

    /**
     * 按计数降序取每个分区的前 k 个值，k <= 0 时没有行保留
     */
    public SelectQuery build(TableExpr source, int k) {
        return build(source, desc(field(COUNT)), k);
    }

    public SelectQuery build(TableExpr source, OrderExpr rankOrder, int k) {
        return filter(rank(aggregate(source), rankOrder), rankOrder, k);
    }

    /**
     * GROUP BY (partition, value)，窗口求和作用在聚合后的行上
     */
    SelectQuery aggregate(TableExpr source) {
        return SelectQuery.builder()
                .select(partitionKey, valueKey)
                .select(alias(COUNT, call("count")))
                .select(alias(TOTAL_COUNT, new WindowFunction(
                        "sum",
                        List.of(call("count")),
                        List.of(partitionKey),
                        List.of())))
                .from(source)
                .groupBy(partitionKey, valueKey)
                .build();
    }

    SelectQuery rank(SelectQuery aggregated, OrderExpr rankOrder) {
        return SelectQuery.builder()
                .select(partitionKey, valueKey, field(COUNT), field(TOTAL_COUNT))
                .select(alias(ROW_NUMBER, new WindowFunction(
                        "row_number",
                        List.of(),
                        List.of(partitionKey),
                        List.of(rankOrder))))
                .from(aggregated)
                .build();
    }

    SelectQuery filter(SelectQuery ranked, OrderExpr rankOrder, int k) {
        return SelectQuery.builder()
                .select(partitionKey, valueKey, field(COUNT), field(TOTAL_COUNT))
                .from(ranked)
                .where(compare(field(ROW_NUMBER), LT_EQ, constant(k)))
                .orderBy(asc(partitionKey), rankOrder)
                .build();
    }
}
