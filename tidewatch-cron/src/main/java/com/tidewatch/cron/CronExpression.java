package com.tidewatch.cron;

import java.time.LocalDateTime;
import java.util.BitSet;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Five-field cron expression: minute, hour, day of month, month, day of week
 * (0 = Sunday).
 * <p>
 * Each field is a comma-separated list of {@code *}, {@code a}, {@code a-b},
 * optionally followed by {@code /step}. A bare value with a step only
 * matches that value. A minute matches when all five fields match; the
 * POSIX rule that ORs day-of-month with day-of-week is not applied.
 */
public final class CronExpression {

    private static final Pattern NUMBER = Pattern.compile("\\d{1,9}");
    private static final String[] FIELD_NAMES = { "minute", "hour", "day of month", "month", "day of week" };
    private static final int[] MIN = { 0, 0, 1, 1, 0 };
    private static final int[] MAX = { 59, 23, 31, 12, 6 };

    private final String source;
    private final BitSet[] fields;

    private CronExpression(String source, BitSet[] fields) {
        this.source = source;
        this.fields = fields;
    }

    /**
     * @throws CronValidationException if the expression is malformed
     */
    public static CronExpression parse(String expr) {
        if (expr == null || expr.isBlank()) {
            throw new CronValidationException("Invalid cron expression (need 5 fields): \"\"");
        }
        String[] parts = expr.trim().split("\\s+");
        if (parts.length != 5) {
            throw new CronValidationException("Invalid cron expression (need 5 fields): \"" + expr + "\"");
        }
        BitSet[] fields = new BitSet[5];
        for (int i = 0; i < 5; i++) {
            fields[i] = parseField(parts[i], i);
        }
        return new CronExpression(String.join(" ", parts), fields);
    }

    /**
     * @throws CronValidationException if the expression is malformed
     */
    public static boolean matches(String expr, LocalDateTime time) {
        return parse(expr).matches(time);
    }

    /**
     * @return the problem with {@code expr}, or empty if it is valid
     */
    public static Optional<String> validate(String expr) {
        try {
            parse(expr);
            return Optional.empty();
        } catch (CronValidationException e) {
            return Optional.of(e.getMessage());
        }
    }

    public boolean matches(LocalDateTime time) {
        return fields[0].get(time.getMinute())
                && fields[1].get(time.getHour())
                && fields[2].get(time.getDayOfMonth())
                && fields[3].get(time.getMonthValue())
                && fields[4].get(time.getDayOfWeek().getValue() % 7);
    }

    @Override
    public String toString() {
        return source;
    }

    private static BitSet parseField(String field, int index) {
        int min = MIN[index];
        int max = MAX[index];
        BitSet values = new BitSet(max + 1);

        for (String part : field.split(",", -1)) {
            if (part.isEmpty()) {
                throw invalid(field, index, "empty list element");
            }
            String[] rangeAndStep = part.split("/", -1);
            if (rangeAndStep.length > 2) {
                throw invalid(field, index, "more than one step");
            }
            int step = 1;
            if (rangeAndStep.length == 2) {
                String stepStr = rangeAndStep[1];
                if (!NUMBER.matcher(stepStr).matches() || Integer.parseInt(stepStr) < 1) {
                    throw new CronValidationException("Invalid step \"" + stepStr + "\" in field \"" + field + "\"");
                }
                step = Integer.parseInt(stepStr);
            }

            String range = rangeAndStep[0];
            int lo;
            int hi;
            if (range.equals("*")) {
                lo = min;
                hi = max;
            } else if (range.contains("-")) {
                String[] bounds = range.split("-", -1);
                if (bounds.length != 2) {
                    throw invalid(field, index, "malformed range");
                }
                lo = number(bounds[0], field);
                hi = number(bounds[1], field);
            } else {
                lo = number(range, field);
                hi = lo;
            }

            if (lo < min || hi > max) {
                throw new CronValidationException(
                        "Value out of range in \"" + field + "\" (allowed " + min + "-" + max + ")");
            }
            if (lo > hi) {
                throw invalid(field, index, "range " + lo + "-" + hi + " is reversed");
            }
            for (int v = lo; v <= hi; v += step) {
                values.set(v);
            }
        }
        return values;
    }

    private static int number(String raw, String field) {
        if (!NUMBER.matcher(raw).matches()) {
            throw new CronValidationException("Invalid value in field \"" + field + "\"");
        }
        return Integer.parseInt(raw);
    }

    private static CronValidationException invalid(String field, int index, String why) {
        return new CronValidationException(
                "Invalid " + FIELD_NAMES[index] + " field \"" + field + "\": " + why);
    }
}
