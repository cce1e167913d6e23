package uk.gegc.studyscheduler.shared.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Registers cooperative recurring ticks on the study tick pool.
 * <p>
 * Each tick body runs inside its own try/catch so one failing tick is logged and the next one
 * still runs.
 */
@Slf4j
@Component
public class RecurringTickScheduler {

    private final TaskScheduler taskScheduler;

    public RecurringTickScheduler(@Qualifier("studyTickScheduler") TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    public TickHandle scheduleEvery(String name, Duration period, Runnable tick) {
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Tick period must be positive: " + period);
        }
        ScheduledFuture<?> future = taskScheduler.scheduleAtFixedRate(() -> runSafely(name, tick), period);
        log.debug("Registered tick name={} period={}", name, period);
        return new TickHandle(name, future);
    }

    private void runSafely(String name, Runnable tick) {
        try {
            tick.run();
        } catch (Exception e) {
            log.error("Tick {} failed", name, e);
        }
    }
}
