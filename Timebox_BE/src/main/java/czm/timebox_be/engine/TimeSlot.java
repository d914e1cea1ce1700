package czm.timebox_be.engine;

import java.time.Instant;
import java.util.Objects;

/**
 * Concrete dated candidate window derived from one rule occurrence.
 *
 * <p>Slots are regenerated for every pass. Availability can only be cleared.</p>
 */
public final class TimeSlot {
    private final Instant start;
    private final Instant end;
    private final double durationHours;
    private boolean available = true;

    public TimeSlot(Instant start, Instant end) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        this.durationHours = (end.toEpochMilli() - start.toEpochMilli()) / 3_600_000d;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public double getDurationHours() {
        return durationHours;
    }

    public boolean isAvailable() {
        return available;
    }

    public void markUnavailable() {
        this.available = false;
    }

    @Override
    public String toString() {
        return "TimeSlot[" + start + " - " + end + (available ? "" : ", blocked") + "]";
    }
}
