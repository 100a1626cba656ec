package com.asiainfo.errortracking.domain.parser;

import com.asiainfo.errortracking.domain.exception.InvalidRangeException;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalAdjusters;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 相对/绝对日期解析器
 * <p>
 * 支持的格式：
 * <ul>
 *   <li>绝对日期 {@code 2024-01-15}：取当天开始；increase=true 时取当天最后一微秒</li>
 *   <li>绝对时间 {@code 2024-01-15T10:00:00Z}、{@code 2024-01-15T10:00:00}、{@code 2024-01-15 10:00:00}，无时区按 UTC</li>
 *   <li>相对表达式 {@code -7d}、{@code -24h}、{@code -1mStart}、{@code dStart}、{@code -1yEnd}，
 *       单位 M=分钟 h=小时 d=天 w=周 m=月 q=季度 y=年；数量总是向过去偏移，省略时为 0</li>
 * </ul>
 * 所有计算以传入的 now 为锚点，不读取系统时钟。
 */
@ApplicationScoped
public class RelativeDateParser {

    private static final Logger log = LoggerFactory.getLogger(RelativeDateParser.class);

    private static final Pattern DATE_ONLY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern DATE_TIME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}[T ].+$");
    // 匹配 -7d、-1mStart、dStart、-2wEnd
    private static final Pattern RELATIVE = Pattern.compile("^-?(\\d+)?([Mhdwmqy])(Start|End)?$");

    // 周期结束时刻精确到微秒，与存储的时间戳精度一致
    private static final long END_OF_PERIOD_NANOS = 1_000L;

    public Instant parse(String field, String input, Instant now, boolean increase) {
        if (input == null || input.isBlank()) {
            throw new InvalidRangeException(field, input, "empty date expression");
        }
        String text = input.trim();

        if (DATE_ONLY.matcher(text).matches()) {
            return parseDate(field, text, increase);
        }
        if (DATE_TIME.matcher(text).matches()) {
            return parseDateTime(field, text);
        }

        Matcher matcher = RELATIVE.matcher(text);
        if (!matcher.matches()) {
            throw new InvalidRangeException(field, input, "unrecognized date expression");
        }

        Period period = Period.of(matcher.group(2).charAt(0));
        String position = matcher.group(3);

        ZonedDateTime result;
        try {
            int amount = matcher.group(1) != null ? Integer.parseInt(matcher.group(1)) : 0;
            result = period.minus(now.atZone(ZoneOffset.UTC), amount);
            if ("Start".equals(position)) {
                result = period.truncate(result);
            } else if ("End".equals(position)) {
                result = period.next(period.truncate(result)).minusNanos(END_OF_PERIOD_NANOS);
            }
        } catch (NumberFormatException | DateTimeException e) {
            throw new InvalidRangeException(field, input, e.getMessage());
        }

        log.debug("Resolved {}='{}' to {} (anchor={}, increase={})", field, input, result, now, increase);
        return result.toInstant();
    }

    private Instant parseDate(String field, String text, boolean increase) {
        try {
            LocalDate date = LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE);
            LocalDateTime dateTime = increase
                    ? date.atTime(LocalTime.MAX.truncatedTo(ChronoUnit.MICROS))
                    : date.atStartOfDay();
            return dateTime.toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidRangeException(field, text, e.getMessage());
        }
    }

    private Instant parseDateTime(String field, String text) {
        String normalized = text.replace(' ', 'T');
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(normalized, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidRangeException(field, text, e.getMessage());
        }
    }

    private enum Period {
        MINUTE('M'),
        HOUR('h'),
        DAY('d'),
        WEEK('w'),
        MONTH('m'),
        QUARTER('q'),
        YEAR('y');

        private final char code;

        Period(char code) {
            this.code = code;
        }

        static Period of(char code) {
            for (Period p : values()) {
                if (p.code == code) {
                    return p;
                }
            }
            throw new IllegalArgumentException("Unknown period: " + code);
        }

        ZonedDateTime minus(ZonedDateTime t, int amount) {
            return switch (this) {
                case MINUTE -> t.minusMinutes(amount);
                case HOUR -> t.minusHours(amount);
                case DAY -> t.minusDays(amount);
                case WEEK -> t.minusWeeks(amount);
                case MONTH -> t.minusMonths(amount);
                case QUARTER -> t.minusMonths(3L * amount);
                case YEAR -> t.minusYears(amount);
            };
        }

        ZonedDateTime truncate(ZonedDateTime t) {
            return switch (this) {
                case MINUTE -> t.truncatedTo(ChronoUnit.MINUTES);
                case HOUR -> t.truncatedTo(ChronoUnit.HOURS);
                case DAY -> t.truncatedTo(ChronoUnit.DAYS);
                case WEEK -> t.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).truncatedTo(ChronoUnit.DAYS);
                case MONTH -> t.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS);
                case QUARTER -> t.withMonth((t.getMonthValue() - 1) / 3 * 3 + 1)
                        .withDayOfMonth(1)
                        .truncatedTo(ChronoUnit.DAYS);
                case YEAR -> t.withDayOfYear(1).truncatedTo(ChronoUnit.DAYS);
            };
        }

        ZonedDateTime next(ZonedDateTime periodStart) {
            return switch (this) {
                case MINUTE -> periodStart.plusMinutes(1);
                case HOUR -> periodStart.plusHours(1);
                case DAY -> periodStart.plusDays(1);
                case WEEK -> periodStart.plusWeeks(1);
                case MONTH -> periodStart.plusMonths(1);
                case QUARTER -> periodStart.plusMonths(3);
                case YEAR -> periodStart.plusYears(1);
            };
        }
    }
}
