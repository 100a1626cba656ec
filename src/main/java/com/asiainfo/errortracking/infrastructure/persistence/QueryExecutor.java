package com.asiainfo.errortracking.infrastructure.persistence;

import com.asiainfo.errortracking.domain.ast.SelectQuery;
import com.asiainfo.errortracking.domain.exception.QueryExecutionException;
import com.asiainfo.errortracking.domain.model.ExecutionContext;
import com.asiainfo.errortracking.domain.model.QueryResult;

/**
 * 查询执行器
 * 接收查询计划和执行上下文（租户、耗时记录、结果上限），返回扁平结果行。
 * 一次阻塞调用，只有成功或失败两种结果，不返回部分结果。
 */
public interface QueryExecutor {

    /**
     * @throws QueryExecutionException 执行失败，携带已生成的 SQL 和耗时
     */
    QueryResult execute(SelectQuery plan, ExecutionContext ctx);
}
