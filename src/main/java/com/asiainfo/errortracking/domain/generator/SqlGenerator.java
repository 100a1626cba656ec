package com.asiainfo.errortracking.domain.generator;

import com.asiainfo.errortracking.domain.ast.Alias;
import com.asiainfo.errortracking.domain.ast.And;
import com.asiainfo.errortracking.domain.ast.Array;
import com.asiainfo.errortracking.domain.ast.Call;
import com.asiainfo.errortracking.domain.ast.CompareOperation;
import com.asiainfo.errortracking.domain.ast.Constant;
import com.asiainfo.errortracking.domain.ast.Expr;
import com.asiainfo.errortracking.domain.ast.Field;
import com.asiainfo.errortracking.domain.ast.OrderExpr;
import com.asiainfo.errortracking.domain.ast.SelectQuery;
import com.asiainfo.errortracking.domain.ast.TableExpr;
import com.asiainfo.errortracking.domain.ast.Tuple;
import com.asiainfo.errortracking.domain.ast.WindowFunction;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.regex.Pattern;

import static com.asiainfo.errortracking.domain.ast.Ast.and;
import static com.asiainfo.errortracking.domain.ast.Ast.compare;
import static com.asiainfo.errortracking.domain.ast.Ast.constant;
import static com.asiainfo.errortracking.domain.ast.Ast.field;
import static com.asiainfo.errortracking.domain.model.BreakdownConstants.EVENTS_TABLE;

/**
 * 将查询计划打印为 DuckDB SQL
 * <p>
 * 计划中使用的是逻辑函数名（arrayJoin、tupleElement、ifNull ...），这里统一映射到 DuckDB 的等价写法：
 * <pre>
 * arrayJoin(x)        -> unnest(x)
 * tupleElement(t, n)  -> struct_extract(t, n)
 * ifNull(a, b)        -> coalesce(a, b)
 * toString(x)         -> CAST(x AS VARCHAR)
 * toBool(x)           -> TRY_CAST(x AS BOOLEAN)
 * count()             -> count(*)
 * </pre>
 * properties.xxx 读取 JSON 列；读取逻辑表 events 的每一层都会加上 team_id 过滤。
 */
@ApplicationScoped
public class SqlGenerator {

    private static final Pattern FUNCTION_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final DateTimeFormatter TIMESTAMP_FMT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS").withZone(ZoneOffset.UTC);
    private static final String PROPERTIES = "properties";
    private static final String TEAM_ID = "team_id";

    /**
     * @param teamId      租户，为 null 时不加租户过滤
     * @param eventsTable 逻辑表 events 对应的物理表，可带 schema 前缀
     */
    public record PrintContext(Long teamId, String eventsTable) {

        public PrintContext {
            eventsTable = eventsTable == null || eventsTable.isBlank() ? EVENTS_TABLE : eventsTable;
        }
    }

    public String generateSql(SelectQuery query, PrintContext ctx) {
        StringBuilder sql = new StringBuilder();
        printSelect(query, ctx, sql);
        return sql.toString();
    }

    private void printSelect(SelectQuery query, PrintContext ctx, StringBuilder sql) {
        sql.append("SELECT ");
        printList(query.select(), ctx, sql);

        sql.append(" FROM ");
        printTable(query.from(), ctx, sql);

        Expr where = query.where();
        if (ctx.teamId() != null && isEventsTable(query.from())) {
            Expr guard = compare(field(TEAM_ID), CompareOperation.Op.EQ, constant(ctx.teamId()));
            where = where == null ? guard : and(List.of(guard, where));
        }
        if (where != null) {
            sql.append(" WHERE ");
            printExpr(where, ctx, sql);
        }

        if (!query.groupBy().isEmpty()) {
            sql.append(" GROUP BY ");
            printList(query.groupBy(), ctx, sql);
        }

        if (!query.orderBy().isEmpty()) {
            sql.append(" ORDER BY ");
            printOrder(query.orderBy(), ctx, sql);
        }

        if (query.limit() != null) {
            sql.append(" LIMIT ");
            printExpr(query.limit(), ctx, sql);
        }
    }

    private void printTable(TableExpr table, PrintContext ctx, StringBuilder sql) {
        if (table instanceof SelectQuery sub) {
            sql.append('(');
            printSelect(sub, ctx, sql);
            sql.append(')');
        } else if (isEventsTable(table)) {
            printQualified(List.of(ctx.eventsTable().split("\\.")), sql);
        } else {
            printQualified(((Field) table).chain(), sql);
        }
    }

    private boolean isEventsTable(TableExpr table) {
        return table instanceof Field f && f.chain().size() == 1 && EVENTS_TABLE.equals(f.chain().get(0));
    }

    private void printExpr(Expr expr, PrintContext ctx, StringBuilder sql) {
        if (expr instanceof Constant c) {
            printConstant(c.value(), sql);
        } else if (expr instanceof Field f) {
            printField(f, sql);
        } else if (expr instanceof Call call) {
            printCall(call, ctx, sql);
        } else if (expr instanceof Tuple t) {
            sql.append("row(");
            printList(t.exprs(), ctx, sql);
            sql.append(')');
        } else if (expr instanceof Array a) {
            sql.append('[');
            printList(a.exprs(), ctx, sql);
            sql.append(']');
        } else if (expr instanceof Alias a) {
            printExpr(a.expr(), ctx, sql);
            sql.append(" AS ").append(quoteIdentifier(a.alias()));
        } else if (expr instanceof CompareOperation op) {
            printExpr(op.left(), ctx, sql);
            sql.append(' ').append(op.op().symbol()).append(' ');
            printExpr(op.right(), ctx, sql);
        } else if (expr instanceof And and) {
            sql.append('(');
            for (int i = 0; i < and.exprs().size(); i++) {
                if (i > 0) {
                    sql.append(" AND ");
                }
                printExpr(and.exprs().get(i), ctx, sql);
            }
            sql.append(')');
        } else if (expr instanceof WindowFunction w) {
            printWindow(w, ctx, sql);
        } else if (expr instanceof SelectQuery sub) {
            sql.append('(');
            printSelect(sub, ctx, sql);
            sql.append(')');
        } else {
            throw new IllegalArgumentException("Unsupported expression: " + expr);
        }
    }

    private void printConstant(Object value, StringBuilder sql) {
        if (value == null) {
            sql.append("NULL");
        } else if (value instanceof String s) {
            sql.append(quoteString(s));
        } else if (value instanceof Boolean b) {
            sql.append(b ? "true" : "false");
        } else if (value instanceof Instant instant) {
            sql.append("TIMESTAMP ").append(quoteString(TIMESTAMP_FMT.format(instant)));
        } else {
            sql.append(value);
        }
    }

    private void printField(Field field, StringBuilder sql) {
        List<String> chain = field.chain();
        if (chain.size() > 1 && PROPERTIES.equals(chain.get(0))) {
            StringBuilder path = new StringBuilder("$");
            for (String key : chain.subList(1, chain.size())) {
                path.append(".\"").append(key.replace("\"", "\\\"")).append('"');
            }
            sql.append("json_extract_string(").append(quoteIdentifier(PROPERTIES)).append(", ")
                    .append(quoteString(path.toString())).append(')');
            return;
        }
        printQualified(chain, sql);
    }

    private void printCall(Call call, PrintContext ctx, StringBuilder sql) {
        List<Expr> args = call.args();
        switch (call.name()) {
            case "arrayJoin" -> printFunction("unnest", args, ctx, sql);
            case "tupleElement" -> printFunction("struct_extract", args, ctx, sql);
            case "ifNull" -> printFunction("coalesce", args, ctx, sql);
            case "toString" -> printCast(args, "VARCHAR", "CAST", ctx, sql);
            case "toBool" -> printCast(args, "BOOLEAN", "TRY_CAST", ctx, sql);
            case "count" -> {
                if (args.isEmpty()) {
                    sql.append("count(*)");
                } else {
                    printFunction("count", args, ctx, sql);
                }
            }
            default -> printFunction(call.name(), args, ctx, sql);
        }
    }

    private void printCast(List<Expr> args, String type, String castFunction, PrintContext ctx, StringBuilder sql) {
        if (args.size() != 1) {
            throw new IllegalArgumentException(castFunction + " expects exactly one argument, got " + args.size());
        }
        sql.append(castFunction).append('(');
        printExpr(args.get(0), ctx, sql);
        sql.append(" AS ").append(type).append(')');
    }

    private void printFunction(String name, List<Expr> args, PrintContext ctx, StringBuilder sql) {
        if (!FUNCTION_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Illegal function name: " + name);
        }
        sql.append(name).append('(');
        printList(args, ctx, sql);
        sql.append(')');
    }

    private void printWindow(WindowFunction window, PrintContext ctx, StringBuilder sql) {
        printCall(new Call(window.name(), window.args()), ctx, sql);
        sql.append(" OVER (");
        boolean partitioned = !window.partitionBy().isEmpty();
        if (partitioned) {
            sql.append("PARTITION BY ");
            printList(window.partitionBy(), ctx, sql);
        }
        if (!window.orderBy().isEmpty()) {
            if (partitioned) {
                sql.append(' ');
            }
            sql.append("ORDER BY ");
            printOrder(window.orderBy(), ctx, sql);
        }
        sql.append(')');
    }

    private void printOrder(List<OrderExpr> orderBy, PrintContext ctx, StringBuilder sql) {
        for (int i = 0; i < orderBy.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            OrderExpr order = orderBy.get(i);
            printExpr(order.expr(), ctx, sql);
            sql.append(' ').append(order.order().name());
        }
    }

    private void printList(List<? extends Expr> exprs, PrintContext ctx, StringBuilder sql) {
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            printExpr(exprs.get(i), ctx, sql);
        }
    }

    private void printQualified(List<String> parts, StringBuilder sql) {
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                sql.append('.');
            }
            sql.append(quoteIdentifier(parts.get(i)));
        }
    }

    static String quoteIdentifier(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    static String quoteString(String value) {
        return '\'' + value.replace("'", "''") + '\'';
    }
}
