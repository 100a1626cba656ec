package com.asiainfo.errortracking.domain.parser;

import com.asiainfo.errortracking.domain.exception.InvalidRangeException;
import com.asiainfo.errortracking.domain.model.ResolvedWindow;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;
import java.time.Instant;

import static com.asiainfo.errortracking.domain.model.BreakdownConstants.DEFAULT_WINDOW_DAYS;

/**
 * 将请求中的 date_from / date_to 解析为绝对时间窗口
 * <p>
 * date_from 为 null、空串或 "all" 时取 now 往前默认天数；date_to 为空或空白时取 now，
 * 为 "all" 时视为非法。两者不对称是已有行为，保留不改。
 */
@ApplicationScoped
public class DateRangeResolver {

    static final String ALL = "all";

    @Inject
    RelativeDateParser parser;

    @ConfigProperty(name = "breakdowns.default.window-days", defaultValue = "7")
    int defaultWindowDays = DEFAULT_WINDOW_DAYS;

    public ResolvedWindow resolve(String dateFrom, String dateTo, Instant now) {
        return new ResolvedWindow(resolveFrom(dateFrom, now), resolveTo(dateTo, now));
    }

    public Instant resolveFrom(String expr, Instant now) {
        if (expr == null || expr.isBlank() || ALL.equals(expr)) {
            return now.minus(Duration.ofDays(defaultWindowDays));
        }
        Instant parsed = parser.parse("date_from", expr, now, false);
        // 起点不晚于 now
        return parsed.isAfter(now) ? now : parsed;
    }

    public Instant resolveTo(String expr, Instant now) {
        if (expr == null || expr.isBlank()) {
            return now;
        }
        if (ALL.equals(expr)) {
            throw new InvalidRangeException("date_to", expr, "\"all\" is not a valid end of range");
        }
        return parser.parse("date_to", expr, now, true);
    }
}
