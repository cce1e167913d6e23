package uk.gegc.studyscheduler.shared.scheduling;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle of one recurring tick registration. Closing it cancels the tick; closing twice is a no-op.
 */
@Slf4j
public final class TickHandle implements AutoCloseable {

    private final String name;
    private final ScheduledFuture<?> future;
    private final AtomicBoolean released = new AtomicBoolean(false);

    TickHandle(String name, ScheduledFuture<?> future) {
        this.name = name;
        this.future = future;
    }

    public String getName() {
        return name;
    }

    public boolean isActive() {
        return !released.get() && !future.isDone();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            future.cancel(false);
            log.debug("Released tick handle name={}", name);
        }
    }
}
