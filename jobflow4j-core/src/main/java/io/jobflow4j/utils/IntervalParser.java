package io.jobflow4j.utils;

import io.jobflow4j.core.InvalidScheduleException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Cron and duration parsing for the scheduler.
 * <p>
 * Supported cron forms:
 * <ul>
 *   <li>5-field Unix cron: "*&#47;5 * * * *" (seconds fixed at 0)</li>
 *   <li>6-field cron with a leading seconds field: "*&#47;10 * * * * *"</li>
 *   <li>Native Quartz expressions (containing '?', or 7 fields with a year)</li>
 * </ul>
 * Unix day-of-week numbers (0 or 7 = Sunday) are mapped to Quartz numbering (1 = Sunday).
 * <p>
 * Supported durations: plain seconds ("90"), compact ("30m", "1h", "2d"), or unit pairs
 * ("1 day 3 hours").
 */
public final class IntervalParser {
    private IntervalParser() {
    }

    /**
     * Normalize a cron expression into Quartz syntax.
     */
    public static String normalizeCron(String expression) {
        if (expression == null) {
            throw new InvalidScheduleException("cron expression must not be null");
        }
        String s = expression.trim();
        if (s.isEmpty()) {
            throw new InvalidScheduleException("cron expression must not be empty");
        }
        if (s.contains("?")) {
            return s;
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = unixDayOfWeek(dayOfWeek);

        // Quartz needs exactly one of the two day fields to be '?'
        if ("*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom)) {
            dom = "?";
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    private static String unixDayOfWeek(String field) {
        StringBuilder out = new StringBuilder();
        for (String part : field.split(",")) {
            if (out.length() > 0) {
                out.append(',');
            }
            String range = part;
            String step = null;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                range = part.substring(0, slash);
                step = part.substring(slash + 1);
            }
            int dash = range.indexOf('-');
            if (dash > 0) {
                out.append(shiftDay(range.substring(0, dash))).append('-').append(shiftDay(range.substring(dash + 1)));
            } else {
                out.append(shiftDay(range));
            }
            if (step != null) {
                out.append('/').append(step);
            }
        }
        return out.toString();
    }

    private static String shiftDay(String token) {
        if (!token.matches("^\\d+$")) {
            return token;
        }
        int unix = Integer.parseInt(token);
        if (unix > 7) {
            return token;
        }
        return Integer.toString((unix % 7) + 1);
    }

    /**
     * Returns true if the string can be parsed as a cron expression in any supported form.
     */
    public static boolean isValidCron(String expression) {
        try {
            return CronExpression.isValidExpression(normalizeCron(expression));
        } catch (Exception ignored) {
            return false;
        }
    }

    /**
     * Parse and validate a cron expression.
     *
     * @throws InvalidScheduleException if the expression is malformed
     */
    public static CronExpression parseCron(String expression, ZoneId zone) {
        String cron = normalizeCron(expression);
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (ParseException ex) {
            throw new InvalidScheduleException("Invalid cron expression: " + expression + " (" + ex.getMessage() + ")", ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone == null ? ZoneId.systemDefault() : zone));
        return exp;
    }

    /**
     * First occurrence of {@code expression} strictly after {@code from}.
     *
     * @throws InvalidScheduleException if the expression is malformed or never fires again
     */
    public static Instant nextFireTime(String expression, ZoneId zone, Instant from) {
        Objects.requireNonNull(from, "from must not be null");
        CronExpression exp = parseCron(expression, zone);

        Date nextDate = exp.getNextValidTimeAfter(Date.from(from));
        if (nextDate == null) {
            throw new InvalidScheduleException("Cron expression produced no next execution time: " + expression);
        }
        return nextDate.toInstant();
    }

    /**
     * Parse a delay such as "90", "30m", "1h" or "2 hours 5 minutes".
     *
     * @throws InvalidScheduleException if the text is not a valid positive duration
     */
    public static Duration parseDuration(String input) {
        if (input == null) {
            throw new InvalidScheduleException("duration must not be null");
        }
        String s = input.trim().toLowerCase();
        if (s.isEmpty()) {
            throw new InvalidScheduleException("duration must not be empty");
        }

        if (s.matches("^\\d+$")) {
            return Duration.ofSeconds(parseCount(s, input));
        }

        if (s.matches("^\\d+\\s*[smhdw]$")) {
            String digits = s.replaceAll("[^0-9]", "");
            char u = s.replaceAll("[0-9\\s]", "").charAt(0);
            long n = parseCount(digits, input);
            ChronoUnit unit = switch (u) {
                case 's' -> ChronoUnit.SECONDS;
                case 'm' -> ChronoUnit.MINUTES;
                case 'h' -> ChronoUnit.HOURS;
                case 'd' -> ChronoUnit.DAYS;
                case 'w' -> ChronoUnit.WEEKS;
                default -> throw new InvalidScheduleException("Unsupported compact unit: " + u);
            };
            return Duration.ofSeconds(addUnits(0, unit, n, input));
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new InvalidScheduleException("Invalid duration format. Expected pairs like '3 minutes': " + input);
        }

        boolean seenWeek = false, seenDay = false, seenHour = false, seenMinute = false, seenSecond = false;
        long totalSeconds = 0;

        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new InvalidScheduleException("Invalid number in duration: " + parts[i]);
            }
            if (n < 0) {
                throw new InvalidScheduleException("Duration values must be non-negative: " + input);
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            switch (unit) {
                case "week" -> {
                    if (seenWeek) throw new InvalidScheduleException("Duplicate unit: week");
                    seenWeek = true;
                    totalSeconds = addUnits(totalSeconds, ChronoUnit.WEEKS, n, input);
                }
                case "day" -> {
                    if (seenDay) throw new InvalidScheduleException("Duplicate unit: day");
                    seenDay = true;
                    totalSeconds = addUnits(totalSeconds, ChronoUnit.DAYS, n, input);
                }
                case "hour" -> {
                    if (seenHour) throw new InvalidScheduleException("Duplicate unit: hour");
                    seenHour = true;
                    totalSeconds = addUnits(totalSeconds, ChronoUnit.HOURS, n, input);
                }
                case "minute" -> {
                    if (seenMinute) throw new InvalidScheduleException("Duplicate unit: minute");
                    seenMinute = true;
                    totalSeconds = addUnits(totalSeconds, ChronoUnit.MINUTES, n, input);
                }
                case "second" -> {
                    if (seenSecond) throw new InvalidScheduleException("Duplicate unit: second");
                    seenSecond = true;
                    totalSeconds = addUnits(totalSeconds, ChronoUnit.SECONDS, n, input);
                }
                default -> throw new InvalidScheduleException("Unsupported duration unit: " + parts[i + 1]);
            }
        }

        return Duration.ofSeconds(totalSeconds);
    }

    private static long addUnits(long totalSeconds, ChronoUnit unit, long n, String input) {
        try {
            return Math.addExact(totalSeconds, Math.multiplyExact(unit.getDuration().getSeconds(), n));
        } catch (ArithmeticException e) {
            throw new InvalidScheduleException("Duration out of range: " + input, e);
        }
    }

    private static long parseCount(String digits, String input) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException ex) {
            throw new InvalidScheduleException("Duration out of range: " + input);
        }
    }
}
