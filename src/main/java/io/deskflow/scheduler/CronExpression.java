package io.deskflow.scheduler;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Six-field cron expression: second, minute, hour, day of month, month, day of
 * week. Five-field expressions get a leading {@code 0} second.
 *
 * <p>Each field accepts {@code *}, values, {@code a-b} ranges and comma lists.
 * {@code *}{@code /n} matches values divisible by {@code n}, so {@code *}{@code /2}
 * in the day-of-month field fires on even days; {@code a-b/n} and {@code a/n} step
 * from {@code a}. Months and weekdays also accept three-letter names. Day of week
 * runs 0-6 from Monday to Sunday. Day of month and day of week must both match.
 */
public final class CronExpression {
    private static final Map<String, Integer> MONTH_NAMES = Map.ofEntries(
            Map.entry("JAN", 1), Map.entry("FEB", 2), Map.entry("MAR", 3), Map.entry("APR", 4),
            Map.entry("MAY", 5), Map.entry("JUN", 6), Map.entry("JUL", 7), Map.entry("AUG", 8),
            Map.entry("SEP", 9), Map.entry("OCT", 10), Map.entry("NOV", 11), Map.entry("DEC", 12)
    );
    private static final Map<String, Integer> DAY_NAMES = Map.of(
            "MON", 0, "TUE", 1, "WED", 2, "THU", 3, "FRI", 4, "SAT", 5, "SUN", 6
    );
    private static final int SEARCH_YEARS = 5;

    private final String expression;
    private final BitSet seconds;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;

    private CronExpression(String expression, String[] fields) {
        this.expression = expression;
        this.seconds = parseField(fields[0], 0, 59, Map.of(), "second");
        this.minutes = parseField(fields[1], 0, 59, Map.of(), "minute");
        this.hours = parseField(fields[2], 0, 23, Map.of(), "hour");
        this.daysOfMonth = parseField(fields[3], 1, 31, Map.of(), "day of month");
        this.months = parseField(fields[4], 1, 12, MONTH_NAMES, "month");
        this.daysOfWeek = parseField(fields[5], 0, 6, DAY_NAMES, "day of week");
    }

    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression cannot be empty");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length == 5) {
            String[] withSeconds = new String[6];
            withSeconds[0] = "0";
            System.arraycopy(fields, 0, withSeconds, 1, 5);
            fields = withSeconds;
        }
        if (fields.length != 6) {
            throw new IllegalArgumentException("Cron expression must have 5 or 6 fields: " + expression);
        }
        return new CronExpression(expression.trim(), fields);
    }

    public String expression() {
        return expression;
    }

    public boolean matches(LocalDateTime time) {
        return seconds.get(time.getSecond())
                && minutes.get(time.getMinute())
                && hours.get(time.getHour())
                && dayMatches(time)
                && months.get(time.getMonthValue());
    }

    /**
     * First matching whole second strictly after {@code after}, searching a few
     * years ahead; empty for expressions that never match (such as 31 February).
     */
    public Optional<LocalDateTime> nextFireAfter(LocalDateTime after) {
        LocalDateTime t = after.truncatedTo(ChronoUnit.SECONDS).plusSeconds(1);
        LocalDateTime limit = after.plusYears(SEARCH_YEARS);
        while (t.isBefore(limit)) {
            if (!months.get(t.getMonthValue())) {
                t = t.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
            } else if (!dayMatches(t)) {
                t = t.truncatedTo(ChronoUnit.DAYS).plusDays(1);
            } else if (!hours.get(t.getHour())) {
                t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
            } else if (!minutes.get(t.getMinute())) {
                t = t.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
            } else if (!seconds.get(t.getSecond())) {
                t = t.plusSeconds(1);
            } else {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    private boolean dayMatches(LocalDateTime time) {
        int dow = time.getDayOfWeek().getValue() - 1;
        return daysOfMonth.get(time.getDayOfMonth()) && daysOfWeek.get(dow);
    }

    private static BitSet parseField(String field, int min, int max, Map<String, Integer> names, String label) {
        BitSet bits = new BitSet(max + 1);
        for (String part : field.split(",")) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Empty list item in " + label + " field: " + field);
            }
            int step = 1;
            String range = part;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                step = number(part.substring(slash + 1), Map.of(), label);
                if (step <= 0) {
                    throw new IllegalArgumentException("Step must be positive in " + label + " field: " + part);
                }
                range = part.substring(0, slash);
            }
            int from;
            int to;
            if ("*".equals(range)) {
                from = min;
                to = max;
            } else if (range.indexOf('-') > 0) {
                int dash = range.indexOf('-');
                from = number(range.substring(0, dash), names, label);
                to = number(range.substring(dash + 1), names, label);
            } else {
                from = number(range, names, label);
                to = slash >= 0 ? max : from;
            }
            if (from < min || to > max || from > to) {
                throw new IllegalArgumentException(
                        "Value out of range " + min + "-" + max + " in " + label + " field: " + part);
            }
            if ("*".equals(range)) {
                for (int v = from; v <= to; v++) {
                    if (v % step == 0) {
                        bits.set(v);
                    }
                }
            } else {
                for (int v = from; v <= to; v += step) {
                    bits.set(v);
                }
            }
        }
        return bits;
    }

    private static int number(String raw, Map<String, Integer> names, String label) {
        Integer named = names.get(raw.toUpperCase(Locale.ROOT));
        if (named != null) {
            return named;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + label + " value: " + raw, e);
        }
    }

    @Override
    public String toString() {
        return expression;
    }
}
