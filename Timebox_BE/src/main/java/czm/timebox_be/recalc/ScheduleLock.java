package czm.timebox_be.recalc;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serialises every operation that rewrites the stored schedule, so two recalculations never interleave.
 */
@Component
public class ScheduleLock {
    private final ReentrantLock lock = new ReentrantLock();

    public <T> T runExclusive(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked() {
        return lock.isLocked();
    }
}
