package com.asiainfo.errortracking.infrastructure.cache;

import com.asiainfo.errortracking.domain.model.BreakdownSpec;
import com.asiainfo.errortracking.domain.model.Team;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 拆分查询结果的缓存 Key
 * 维度顺序影响展开顺序，不排序；日期使用原始表达式，依靠较短的 TTL 控制相对时间漂移
 */
public class BreakdownsCacheKey {

    private static final String PREFIX = "errortracking:breakdowns:";

    private final long teamId;
    private final List<String> properties;
    private final String dateFrom;
    private final String dateTo;
    private final String issueId;
    private final boolean filterTestAccounts;
    private final int limit;

    private BreakdownsCacheKey(long teamId, List<String> properties, String dateFrom, String dateTo,
                               String issueId, boolean filterTestAccounts, int limit) {
        this.teamId = teamId;
        this.properties = new ArrayList<>(properties);
        this.dateFrom = dateFrom;
        this.dateTo = dateTo;
        this.issueId = issueId;
        this.filterTestAccounts = filterTestAccounts;
        this.limit = limit;
    }

    /**
     * @param effectiveLimit 已经套用默认值后的 limit，保证 limit=null 与 limit=默认值 命中同一条缓存
     */
    public static BreakdownsCacheKey of(Team team, BreakdownSpec spec, int effectiveLimit) {
        return new BreakdownsCacheKey(
                team.id(),
                spec.breakdownProperties(),
                spec.dateFrom(),
                spec.dateTo(),
                spec.issueId(),
                spec.filterTestAccounts(),
                effectiveLimit);
    }

    /**
     * 格式:
     * errortracking:breakdowns:team:1|props:$browser,$os|from:-7d|to:null|issue:abc|test:false|limit:3
     */
    public String toL1Key() {
        StringBuilder sb = new StringBuilder(PREFIX);
        sb.append("team:").append(teamId).append("|");
        sb.append("props:").append(String.join(",", properties)).append("|");
        sb.append("from:").append(dateFrom).append("|");
        sb.append("to:").append(dateTo).append("|");
        sb.append("issue:").append(issueId).append("|");
        sb.append("test:").append(filterTestAccounts).append("|");
        sb.append("limit:").append(limit);
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        BreakdownsCacheKey that = (BreakdownsCacheKey) o;
        return teamId == that.teamId &&
                filterTestAccounts == that.filterTestAccounts &&
                limit == that.limit &&
                Objects.equals(properties, that.properties) &&
                Objects.equals(dateFrom, that.dateFrom) &&
                Objects.equals(dateTo, that.dateTo) &&
                Objects.equals(issueId, that.issueId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(teamId, properties, dateFrom, dateTo, issueId, filterTestAccounts, limit);
    }

    @Override
    public String toString() {
        return toL1Key();
    }
}
