package com.asiainfo.errortracking.api;

import com.asiainfo.errortracking.api.dto.BreakdownsQueryRequest;
import com.asiainfo.errortracking.api.dto.BreakdownsQueryResult;
import com.asiainfo.errortracking.application.engine.BreakdownsQueryEngine;
import com.asiainfo.errortracking.application.engine.BreakdownsResponse;
import com.asiainfo.errortracking.domain.exception.BreakdownsException;
import com.asiainfo.errortracking.domain.exception.InvalidBreakdownSpecException;
import com.asiainfo.errortracking.domain.exception.QueryExecutionException;
import com.asiainfo.errortracking.domain.model.BreakdownSpec;
import com.asiainfo.errortracking.domain.model.Team;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 错误追踪拆分查询 REST API
 */
@ApplicationScoped
@Path("/api/v2/error-tracking")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ErrorTrackingBreakdownsResource {
    private static final Logger log = LoggerFactory.getLogger(ErrorTrackingBreakdownsResource.class);

    @Inject
    BreakdownsQueryEngine engine;

    /**
     * 按维度统计某个 issue 的异常事件分布
     *
     * @param teamId  租户
     * @param request 查询请求
     * @return 查询结果（results, status, msg, hogql, timings, cached）
     */
    @POST
    @Path("/breakdowns")
    public BreakdownsQueryResult breakdowns(@HeaderParam("X-Team-Id") Long teamId, BreakdownsQueryRequest request) {
        try {
            log.info("收到拆分查询请求: team={}, request={}", teamId, request);
            if (teamId == null) {
                throw new InvalidBreakdownSpecException("X-Team-Id", "header is required");
            }
            if (request == null) {
                throw new InvalidBreakdownSpecException("body", "request body is required");
            }
            BreakdownSpec spec = request.toSpec();
            BreakdownsResponse response = engine.execute(spec, new Team(teamId));

            StringBuilder msgBuilder = new StringBuilder("查询成功！");
            msgBuilder.append(" 返回 ").append(response.results().size()).append(" 个维度");
            if (response.cached()) {
                msgBuilder.append(" [缓存]");
            }
            return BreakdownsQueryResult.success(response, msgBuilder.toString());

        } catch (QueryExecutionException e) {
            log.error("拆分查询执行失败: team={}", teamId, e);
            return BreakdownsQueryResult.error(e.getStatusCode(), "查询失败: " + e.getMessage(),
                    e.getQueryText(), e.getTimings());
        } catch (BreakdownsException e) {
            log.warn("拆分查询参数非法: team={}, {}", teamId, e.getMessage());
            return BreakdownsQueryResult.error(e.getStatusCode(), e.getMessage());
        } catch (Exception e) {
            log.error("拆分查询失败: team={}", teamId, e);
            return BreakdownsQueryResult.error("9999", "查询失败: " + e.getMessage());
        }
    }
}
