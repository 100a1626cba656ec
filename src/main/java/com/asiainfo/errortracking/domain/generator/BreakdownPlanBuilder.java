package com.asiainfo.errortracking.domain.generator;

import com.asiainfo.errortracking.common.config.BreakdownsConfig;
import com.asiainfo.errortracking.domain.ast.Expr;
import com.asiainfo.errortracking.domain.ast.SelectQuery;
import com.asiainfo.errortracking.domain.model.BreakdownSpec;
import com.asiainfo.errortracking.domain.model.ResolvedWindow;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.asiainfo.errortracking.domain.ast.Ast.alias;
import static com.asiainfo.errortracking.domain.ast.Ast.and;
import static com.asiainfo.errortracking.domain.ast.Ast.array;
import static com.asiainfo.errortracking.domain.ast.Ast.call;
import static com.asiainfo.errortracking.domain.ast.Ast.compare;
import static com.asiainfo.errortracking.domain.ast.Ast.constant;
import static com.asiainfo.errortracking.domain.ast.Ast.field;
import static com.asiainfo.errortracking.domain.ast.Ast.tuple;
import static com.asiainfo.errortracking.domain.ast.CompareOperation.Op.EQ;
import static com.asiainfo.errortracking.domain.ast.CompareOperation.Op.GT_EQ;
import static com.asiainfo.errortracking.domain.ast.CompareOperation.Op.LT_EQ;
import static com.asiainfo.errortracking.domain.model.BreakdownConstants.*;

/**
 * 拆分查询计划构造器
 * <p>
 * 生成五层嵌套查询：
 * <ol>
 *   <li>展开：每个维度一个 (维度名, 维度值) 元组，arrayJoin 把一行事件变成 N 行</li>
 *   <li>拆元组：breakdown_property / breakdown_value</li>
 *   <li>聚合：按 (维度, 值) 计数，并用窗口求出维度总数</li>
 *   <li>排名：维度内按计数降序 row_number</li>
 *   <li>过滤排序：rn &lt;= limit，按维度升序、计数降序输出</li>
 * </ol>
 * 第 3-5 层由 {@link TopKPerPartition} 生成。
 */
@ApplicationScoped
public class BreakdownPlanBuilder {

    private static final Logger log = LoggerFactory.getLogger(BreakdownPlanBuilder.class);

    private final TopKPerPartition topK = new TopKPerPartition(field(BREAKDOWN_PROPERTY), field(BREAKDOWN_VALUE));

    @Inject
    BreakdownsConfig config;

    /**
     * 未指定 limit 时取配置的默认值
     */
    public SelectQuery build(BreakdownSpec spec, ResolvedWindow window) {
        return build(spec, window, spec.effectiveLimit(config.getDefaultLimit()));
    }

    /**
     * @param limit 已套用默认值后的每维度取值个数，与缓存 Key 使用同一个值
     */
    public SelectQuery build(BreakdownSpec spec, ResolvedWindow window, int limit) {
        if (limit <= 0) {
            log.debug("Non-positive limit {} for issue {}, plan will return no rows", limit, spec.issueId());
        }
        return topK.build(decompose(unpivot(spec, window)), limit);
    }

    SelectQuery unpivot(BreakdownSpec spec, ResolvedWindow window) {
        List<Expr> tuples = new ArrayList<>();
        for (String property : spec.breakdownProperties()) {
            tuples.add(tuple(
                    constant(property),
                    call("ifNull",
                            call("toString", field("properties", property)),
                            constant(NULL_SENTINEL))));
        }

        return SelectQuery.builder()
                .select(alias(BREAKDOWN_TUPLE, call("arrayJoin", array(tuples))))
                .from(field(EVENTS_TABLE))
                .where(buildWhereClause(spec, window))
                .build();
    }

    SelectQuery decompose(SelectQuery unpivoted) {
        return SelectQuery.builder()
                .select(alias(BREAKDOWN_PROPERTY, call("tupleElement", field(BREAKDOWN_TUPLE), constant(1))))
                .select(alias(BREAKDOWN_VALUE, call("tupleElement", field(BREAKDOWN_TUPLE), constant(2))))
                .from(unpivoted)
                .build();
    }

    /**
     * 条件顺序固定，保证生成的 SQL 可重复
     */
    Expr buildWhereClause(BreakdownSpec spec, ResolvedWindow window) {
        List<Expr> conditions = new ArrayList<>();

        // 时间窗口
        conditions.add(compare(field("timestamp"), GT_EQ, constant(window.from())));
        conditions.add(compare(field("timestamp"), LT_EQ, constant(window.to())));

        // 只看异常事件
        conditions.add(compare(field("event"), EQ, constant(EXCEPTION_EVENT)));

        // 限定 issue
        conditions.add(compare(field("properties", ISSUE_ID_PROPERTY), EQ, constant(spec.issueId())));

        if (spec.filterTestAccounts()) {
            conditions.add(compare(
                    call("ifNull", call("toBool", field("properties", IS_IDENTIFIED_PROPERTY)), constant(false)),
                    EQ,
                    constant(true)));
        }

        return and(conditions);
    }
}
