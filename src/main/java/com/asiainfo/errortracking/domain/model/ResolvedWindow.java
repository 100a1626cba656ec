package com.asiainfo.errortracking.domain.model;

import com.asiainfo.errortracking.domain.exception.InvalidRangeException;

import java.time.Instant;
import java.util.Objects;

/**
 * 解析后的绝对时间窗口 [from, to]，UTC
 */
public record ResolvedWindow(Instant from, Instant to) {

    public ResolvedWindow {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (from.isAfter(to)) {
            throw new InvalidRangeException("dateRange", from + ".." + to, "date_from is after date_to");
        }
    }
}
