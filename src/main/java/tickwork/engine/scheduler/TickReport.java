package tickwork.engine.scheduler;

import java.time.Instant;

/**
 * Outcome of one scheduler tick.
 *
 * @param skippedLocked due jobs whose lock was held elsewhere
 * @param skippedRaced  due jobs another scheduler advanced first
 */
public record TickReport(
        Instant tickTime,
        int due,
        int enqueued,
        int skippedLocked,
        int skippedRaced,
        int disabled,
        int errored) {

    public static TickReport idle(Instant tickTime) {
        return new TickReport(tickTime, 0, 0, 0, 0, 0, 0);
    }

    public boolean isIdle() {
        return due == 0;
    }

    static final class Builder {
        private final Instant tickTime;
        private int due;
        private int enqueued;
        private int skippedLocked;
        private int skippedRaced;
        private int disabled;
        private int errored;

        Builder(Instant tickTime) {
            this.tickTime = tickTime;
        }

        Builder due(int due) {
            this.due = due;
            return this;
        }

        void enqueued() {
            enqueued++;
        }

        void skippedLocked() {
            skippedLocked++;
        }

        void skippedRaced() {
            skippedRaced++;
        }

        void disabled() {
            disabled++;
        }

        void errored() {
            errored++;
        }

        TickReport build() {
            return new TickReport(tickTime, due, enqueued, skippedLocked, skippedRaced, disabled, errored);
        }
    }
}
