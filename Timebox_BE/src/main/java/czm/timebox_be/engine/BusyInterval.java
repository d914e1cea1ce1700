package czm.timebox_be.engine;

import java.time.Instant;

/**
 * Opaque, read-only occupied range supplied by the calendar provider.
 * Either endpoint may be missing; such intervals never block anything.
 */
public record BusyInterval(Instant start, Instant end) {

    public boolean isComplete() {
        return start != null && end != null;
    }
}
