package tickwork.engine.scheduler;

import tickwork.engine.config.EngineConfig;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Parses job schedule expressions.
 *
 * <ul>
 * <li>{@code 3600}: interval in seconds</li>
 * <li>{@code PT15M}: ISO-8601 interval</li>
 * <li>{@code @every 90s}: interval with a unit suffix</li>
 * <li>{@code @hourly}, {@code @daily}, {@code @weekly}, {@code @monthly}: cron shortcuts</li>
 * <li>anything else: five-field UNIX cron, UTC</li>
 * </ul>
 */
public final class Schedules {

    private static final Map<String, String> SHORTCUTS = Map.of(
            "@hourly", "0 * * * *",
            "@daily", "0 0 * * *",
            "@midnight", "0 0 * * *",
            "@weekly", "0 0 * * 0",
            "@monthly", "0 0 1 * *",
            "@yearly", "0 0 1 1 *");

    private Schedules() {
    }

    /**
     * @throws ScheduleException if the expression is malformed
     */
    public static Schedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ScheduleException("schedule is empty");
        }
        String s = expression.trim();
        String lower = s.toLowerCase(Locale.ROOT);

        if (s.chars().allMatch(Character::isDigit)) {
            try {
                return new IntervalSchedule(Duration.ofSeconds(Long.parseLong(s)));
            } catch (NumberFormatException e) {
                throw new ScheduleException("interval out of range: " + s, e);
            }
        }
        if (lower.startsWith("p")) {
            return new IntervalSchedule(duration(s, expression));
        }
        if (lower.startsWith("@every")) {
            String amount = s.substring("@every".length()).trim();
            return new IntervalSchedule(duration(amount, expression));
        }
        if (lower.startsWith("@")) {
            String cron = SHORTCUTS.get(lower);
            if (cron == null) {
                throw new ScheduleException("unknown schedule shortcut: " + s);
            }
            return new CronSchedule(cron);
        }
        return new CronSchedule(s);
    }

    /** True if the expression parses. */
    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (ScheduleException e) {
            return false;
        }
    }

    private static Duration duration(String value, String expression) {
        try {
            return EngineConfig.parseDuration(value);
        } catch (RuntimeException e) {
            throw new ScheduleException("invalid interval schedule '" + expression + "'", e);
        }
    }
}
