package com.asiainfo.errortracking.application.engine;

import com.asiainfo.errortracking.domain.model.BreakdownValue;
import com.asiainfo.errortracking.domain.model.DimensionBreakdown;
import com.asiainfo.errortracking.domain.model.FlatResultRow;
import com.asiainfo.errortracking.domain.model.GroupedBreakdownResult;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 将扁平结果行按维度重组
 * <p>
 * 维度顺序和维度内取值顺序都沿用行的到达顺序，不重新排序；
 * total_count 取该维度第一行上的值。
 */
@ApplicationScoped
public class BreakdownResultGrouper {

    public GroupedBreakdownResult group(List<FlatResultRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return GroupedBreakdownResult.empty();
        }

        Map<String, Long> totals = new LinkedHashMap<>();
        Map<String, List<BreakdownValue>> values = new LinkedHashMap<>();
        for (FlatResultRow row : rows) {
            totals.putIfAbsent(row.dimensionName(), row.totalCountForDimension());
            values.computeIfAbsent(row.dimensionName(), k -> new ArrayList<>())
                    .add(new BreakdownValue(row.dimensionValue(), row.count()));
        }

        Map<String, DimensionBreakdown> grouped = new LinkedHashMap<>();
        totals.forEach((dimension, total) ->
                grouped.put(dimension, new DimensionBreakdown(total, values.get(dimension))));
        return new GroupedBreakdownResult(grouped);
    }
}
