package uk.gegc.studyscheduler.shared.scheduling;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.scheduling.TaskScheduler;
import uk.gegc.studyscheduler.BaseUnitTest;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("RecurringTickScheduler unit tests")
class RecurringTickSchedulerTest extends BaseUnitTest {

    @Mock private TaskScheduler taskScheduler;
    @Mock private ScheduledFuture<Object> future;

    private RecurringTickScheduler tickScheduler;

    @BeforeEach
    void setUp() {
        tickScheduler = new RecurringTickScheduler(taskScheduler);
    }

    @Test
    @DisplayName("Closing the handle cancels the tick exactly once")
    void closeCancelsOnce() {
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofSeconds(60)));

        TickHandle handle = tickScheduler.scheduleEvery("t", Duration.ofSeconds(60), () -> { });
        assertTrue(handle.isActive());

        handle.close();
        handle.close();

        verify(future, times(1)).cancel(false);
        assertFalse(handle.isActive());
    }

    @Test
    @DisplayName("A throwing tick is contained so later ticks still run")
    void tickFailureContained() {
        ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(captor.capture(), eq(Duration.ofSeconds(1)));
        AtomicInteger runs = new AtomicInteger();

        tickScheduler.scheduleEvery("boom", Duration.ofSeconds(1), () -> {
            runs.incrementAndGet();
            throw new IllegalStateException("boom");
        });

        assertDoesNotThrow(() -> captor.getValue().run());
        assertDoesNotThrow(() -> captor.getValue().run());
        assertEquals(2, runs.get());
    }

    @Test
    @DisplayName("Rejects a non-positive period")
    void rejectsBadPeriod() {
        assertThrows(IllegalArgumentException.class, () -> tickScheduler.scheduleEvery("t", Duration.ZERO, () -> { }));
        verifyNoInteractions(taskScheduler);
    }
}
