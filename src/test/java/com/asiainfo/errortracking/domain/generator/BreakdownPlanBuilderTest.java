package com.asiainfo.errortracking.domain.generator;

import com.asiainfo.errortracking.domain.ast.Alias;
import com.asiainfo.errortracking.domain.ast.And;
import com.asiainfo.errortracking.domain.ast.Array;
import com.asiainfo.errortracking.domain.ast.Call;
import com.asiainfo.errortracking.domain.ast.CompareOperation;
import com.asiainfo.errortracking.domain.ast.Expr;
import com.asiainfo.errortracking.domain.ast.SelectQuery;
import com.asiainfo.errortracking.domain.model.BreakdownSpec;
import com.asiainfo.errortracking.domain.model.ResolvedWindow;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.asiainfo.errortracking.domain.ast.Ast.*;
import static com.asiainfo.errortracking.domain.ast.CompareOperation.Op.EQ;
import static com.asiainfo.errortracking.domain.ast.CompareOperation.Op.GT_EQ;
import static com.asiainfo.errortracking.domain.ast.CompareOperation.Op.LT_EQ;
import static org.junit.jupiter.api.Assertions.*;

class BreakdownPlanBuilderTest {

    private static final ResolvedWindow WINDOW = new ResolvedWindow(
            Instant.parse("2024-05-08T10:30:00Z"), Instant.parse("2024-05-15T10:30:00Z"));

    private final BreakdownPlanBuilder builder = GeneratorTestSupport.newPlanBuilder(3);

    private static BreakdownSpec spec(List<String> properties, boolean filterTestAccounts, Integer limit) {
        return new BreakdownSpec(properties, "-7d", null, filterTestAccounts, "issue-1", limit);
    }

    @Test
    void testFiveLayerPlan() {
        SelectQuery plan = builder.build(spec(List.of("$browser", "$os"), false, null), WINDOW);

        SelectQuery ranked = (SelectQuery) plan.from();
        SelectQuery aggregated = (SelectQuery) ranked.from();
        SelectQuery decomposed = (SelectQuery) aggregated.from();
        SelectQuery unpivoted = (SelectQuery) decomposed.from();
        assertEquals(field("events"), unpivoted.from());

        // 展开层：每个维度一个元组
        Alias tupleAlias = (Alias) unpivoted.select().get(0);
        assertEquals("breakdown_tuple", tupleAlias.alias());
        Call arrayJoin = (Call) tupleAlias.expr();
        assertEquals("arrayJoin", arrayJoin.name());
        Array tuples = (Array) arrayJoin.args().get(0);
        assertEquals(2, tuples.exprs().size());
        assertEquals(tuple(constant("$browser"),
                        call("ifNull", call("toString", field("properties", "$browser")),
                                constant("$$_posthog_breakdown_null_$$"))),
                tuples.exprs().get(0));

        // 拆元组层
        assertEquals(List.of(
                        alias("breakdown_property", call("tupleElement", field("breakdown_tuple"), constant(1))),
                        alias("breakdown_value", call("tupleElement", field("breakdown_tuple"), constant(2)))),
                decomposed.select());

        assertEquals(List.of(field("breakdown_property"), field("breakdown_value")), aggregated.groupBy());
        assertNull(plan.limit());
    }

    @Test
    void testWhereClauseOrder() {
        Expr where = builder.buildWhereClause(spec(List.of("$browser"), false, null), WINDOW);

        assertEquals(and(List.of(
                compare(field("timestamp"), GT_EQ, constant(WINDOW.from())),
                compare(field("timestamp"), LT_EQ, constant(WINDOW.to())),
                compare(field("event"), EQ, constant("$exception")),
                compare(field("properties", "$exception_issue_id"), EQ, constant("issue-1")))), where);
    }

    @Test
    void testFilterTestAccountsAddsLastCondition() {
        And where = (And) builder.buildWhereClause(spec(List.of("$browser"), true, null), WINDOW);

        assertEquals(5, where.exprs().size());
        assertEquals(compare(
                        call("ifNull", call("toBool", field("properties", "$is_identified")), constant(false)),
                        EQ,
                        constant(true)),
                where.exprs().get(4));
    }

    @Test
    void testDefaultAndExplicitLimit() {
        SelectQuery defaulted = builder.build(spec(List.of("$browser"), false, null), WINDOW);
        assertEquals(compare(field("rn"), LT_EQ, constant(3)), defaulted.where());

        SelectQuery explicit = builder.build(spec(List.of("$browser"), false, 10), WINDOW);
        assertEquals(compare(field("rn"), LT_EQ, constant(10)), explicit.where());

        SelectQuery configured = GeneratorTestSupport.newPlanBuilder(5)
                .build(spec(List.of("$browser"), false, null), WINDOW);
        assertEquals(compare(field("rn"), LT_EQ, constant(5)), configured.where());

        // 调用方已经确定的 limit 优先于配置默认值
        SelectQuery resolved = builder.build(spec(List.of("$browser"), false, null), WINDOW, 7);
        assertEquals(compare(field("rn"), LT_EQ, constant(7)), resolved.where());
    }

    @Test
    void testNonPositiveLimitKeepsNothing() {
        SelectQuery plan = builder.build(spec(List.of("$browser"), false, 0), WINDOW);
        CompareOperation where = (CompareOperation) plan.where();
        assertEquals(constant(0), where.right());
    }

    @Test
    void testPlanIsDeterministic() {
        BreakdownSpec spec = spec(List.of("$browser", "$os", "$lib"), true, 4);
        assertEquals(builder.build(spec, WINDOW), builder.build(spec, WINDOW));
    }
}
