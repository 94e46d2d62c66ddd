package tickwork.engine.scheduler;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Five-field UNIX cron schedule evaluated in UTC.
 */
public final class CronSchedule implements Schedule {

    private static final CronParser PARSER = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private final String expression;
    private final ExecutionTime executionTime;
    private final ZoneId zone;

    public CronSchedule(String expression) {
        this(expression, ZoneOffset.UTC);
    }

    public CronSchedule(String expression, ZoneId zone) {
        Cron cron;
        try {
            cron = PARSER.parse(expression.trim());
            cron.validate();
        } catch (IllegalArgumentException e) {
            throw new ScheduleException("invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
        this.expression = cron.asString();
        this.executionTime = ExecutionTime.forCron(cron);
        this.zone = zone;
    }

    @Override
    public Instant initialRun(Instant now) {
        return after(now);
    }

    @Override
    public Instant nextRun(Instant previous, Instant now) {
        Instant base = previous != null && previous.isAfter(now) ? previous : now;
        return after(base);
    }

    private Instant after(Instant base) {
        ZonedDateTime from = ZonedDateTime.ofInstant(base, zone);
        Instant next = executionTime.nextExecution(from)
                .map(ZonedDateTime::toInstant)
                .orElseThrow(() -> new ScheduleException("cron expression '" + expression + "' has no next run"));
        if (!next.isAfter(base)) {
            // guard against an inclusive match on the base instant
            next = executionTime.nextExecution(from.plusSeconds(1))
                    .map(ZonedDateTime::toInstant)
                    .orElseThrow(() -> new ScheduleException("cron expression '" + expression + "' has no next run"));
        }
        return next;
    }

    @Override
    public String expression() {
        return expression;
    }

    @Override
    public String toString() {
        return "cron " + expression;
    }
}
