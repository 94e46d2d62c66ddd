package tickwork.engine.scheduler;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-period schedule anchored on the previous run, so a late tick does not
 * shift the cadence. Intervals are whole milliseconds, the precision next-run
 * times are stored with.
 */
public final class IntervalSchedule implements Schedule {

    private static final Duration MIN_INTERVAL = Duration.ofMillis(1);

    private final Duration interval;

    public IntervalSchedule(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new ScheduleException("interval must be positive, got " + interval);
        }
        if (interval.compareTo(MIN_INTERVAL) < 0 || interval.getNano() % 1_000_000 != 0) {
            throw new ScheduleException("interval must be a whole number of milliseconds, got " + interval);
        }
        this.interval = interval;
    }

    public Duration interval() {
        return interval;
    }

    @Override
    public Instant initialRun(Instant now) {
        return now;
    }

    /**
     * @throws ScheduleException if the next run is beyond the representable time range
     */
    @Override
    public Instant nextRun(Instant previous, Instant now) {
        try {
            if (previous == null || previous.isAfter(now)) {
                Instant base = previous == null ? now : previous;
                return base.plus(interval);
            }
            long periods = Duration.between(previous, now).dividedBy(interval) + 1;
            return previous.plus(interval.multipliedBy(periods));
        } catch (ArithmeticException | DateTimeException e) {
            throw new ScheduleException("interval " + interval + " overflows after " + previous, e);
        }
    }

    @Override
    public String expression() {
        return interval.toString();
    }

    @Override
    public String toString() {
        return "every " + interval;
    }
}
