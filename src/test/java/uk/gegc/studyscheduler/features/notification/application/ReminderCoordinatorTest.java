package uk.gegc.studyscheduler.features.notification.application;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import uk.gegc.studyscheduler.BaseUnitTest;
import uk.gegc.studyscheduler.features.notification.config.NotificationProperties;
import uk.gegc.studyscheduler.features.notification.domain.model.NotificationKind;
import uk.gegc.studyscheduler.features.notification.domain.model.NotificationPrefs;
import uk.gegc.studyscheduler.features.repetition.application.ReviewQueueBuilder;
import uk.gegc.studyscheduler.features.repetition.domain.model.CardState;
import uk.gegc.studyscheduler.features.session.application.BreakReminderRequest;
import uk.gegc.studyscheduler.features.session.application.event.BreakReminderRequestedEvent;
import uk.gegc.studyscheduler.features.streak.application.StreakTracker;
import uk.gegc.studyscheduler.features.streak.config.StreakProperties;
import uk.gegc.studyscheduler.features.streak.domain.model.StreakRecord;
import uk.gegc.studyscheduler.shared.exception.PersistenceUnavailableException;
import uk.gegc.studyscheduler.shared.persistence.LearnerStateStore;
import uk.gegc.studyscheduler.shared.scheduling.RecurringTickScheduler;
import uk.gegc.studyscheduler.shared.scheduling.TickHandle;
import uk.gegc.studyscheduler.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("ReminderCoordinator unit tests")
class ReminderCoordinatorTest extends BaseUnitTest {

    private static final String LEARNER = "learner-9";
    private static final Instant NOW = Instant.parse("2025-10-01T09:00:00Z");

    @Mock private LearnerStateStore learnerStateStore;
    @Mock private NotificationDispatcher dispatcher;
    @Mock private RecurringTickScheduler tickScheduler;
    @Mock private TickHandle tickHandle;

    private MutableClock clock;
    private ReminderCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        NotificationDispatchService dispatchService = new NotificationDispatchService(dispatcher, new SimpleMeterRegistry());
        coordinator = new ReminderCoordinator(clock, learnerStateStore, new ReviewQueueBuilder(), new StreakTracker(),
                new StreakProperties(), new NotificationProperties(), dispatchService, tickScheduler);
        lenient().when(tickScheduler.scheduleEvery(anyString(), eq(Duration.ofSeconds(60)), any(Runnable.class)))
                .thenReturn(tickHandle);
    }

    @Test
    @DisplayName("Poll announces due cards once across repeated polls")
    void pollAnnouncesDueCardsOnce() {
        when(dispatcher.isSupported()).thenReturn(true);
        when(dispatcher.isEnabled()).thenReturn(true);
        when(learnerStateStore.loadStreak(LEARNER)).thenReturn(StreakRecord.empty());
        when(learnerStateStore.loadCardStates(LEARNER)).thenReturn(List.of(CardState.initial("c1", NOW.minusSeconds(60))));
        LearnerReminders reminders = coordinator.attach(LEARNER, NotificationPrefs.defaults(ZoneOffset.UTC));

        assertEquals(1, coordinator.poll(reminders));
        clock.advance(Duration.ofMinutes(1));
        assertEquals(0, coordinator.poll(reminders));

        verify(dispatcher, times(1)).show(eq(NotificationKind.DUE_CARDS_READY), any());
    }

    @Test
    @DisplayName("Store outage skips the poll without throwing")
    void pollSkipsOnStoreOutage() {
        when(learnerStateStore.loadStreak(LEARNER)).thenThrow(new PersistenceUnavailableException("down"));
        LearnerReminders reminders = coordinator.attach(LEARNER, NotificationPrefs.defaults(ZoneOffset.UTC));

        assertEquals(0, assertDoesNotThrow(() -> coordinator.poll(reminders)));
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("Break reminder event reaches the attached learner immediately")
    void routesBreakReminder() {
        when(dispatcher.isSupported()).thenReturn(true);
        when(dispatcher.isEnabled()).thenReturn(true);
        when(learnerStateStore.loadStreak(LEARNER)).thenReturn(StreakRecord.empty());
        when(learnerStateStore.loadCardStates(LEARNER)).thenReturn(List.of());
        coordinator.attach(LEARNER, NotificationPrefs.defaults(ZoneOffset.UTC));

        coordinator.onBreakReminder(new BreakReminderRequestedEvent(
                new BreakReminderRequest("s-1", LEARNER, 1, 1, Duration.ofMinutes(25), NOW)));

        verify(dispatcher).show(eq(NotificationKind.BREAK_REMINDER), any());
    }

    @Test
    @DisplayName("Closing the registration releases the poll tick and detaches the learner")
    void closeDetaches() {
        LearnerReminders reminders = coordinator.attach(LEARNER, NotificationPrefs.defaults(ZoneOffset.UTC));
        assertTrue(coordinator.isAttached(LEARNER));

        reminders.close();

        verify(tickHandle).close();
        assertFalse(coordinator.isAttached(LEARNER));
    }

    @Test
    @DisplayName("Attaching again replaces the previous registration")
    void reattachReplaces() {
        LearnerReminders first = coordinator.attach(LEARNER, NotificationPrefs.defaults(ZoneOffset.UTC));
        LearnerReminders second = coordinator.attach(LEARNER, NotificationPrefs.defaults(ZoneOffset.UTC));

        assertNotSame(first, second);
        assertTrue(coordinator.isAttached(LEARNER));
        verify(tickHandle, times(1)).close();
    }

    @Test
    @DisplayName("Concurrent polls of one learner show a break reminder once")
    void concurrentPollsShowOnce() throws Exception {
        when(dispatcher.isSupported()).thenReturn(true);
        when(dispatcher.isEnabled()).thenReturn(true);
        when(learnerStateStore.loadStreak(LEARNER)).thenReturn(StreakRecord.empty());
        when(learnerStateStore.loadCardStates(LEARNER)).thenReturn(List.of());
        AtomicInteger shown = new AtomicInteger();
        doAnswer(invocation -> {
            shown.incrementAndGet();
            Thread.sleep(100);
            return null;
        }).when(dispatcher).show(any(), any());
        LearnerReminders reminders = coordinator.attach(LEARNER, NotificationPrefs.defaults(ZoneOffset.UTC));
        reminders.getScheduler().enqueueBreakReminder(
                new BreakReminderRequest("s-1", LEARNER, 1, 1, Duration.ofMinutes(25), NOW));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Integer>> polls = List.of(
                    pool.submit(() -> { go.await(); return coordinator.poll(reminders); }),
                    pool.submit(() -> { go.await(); return coordinator.poll(reminders); }));
            go.countDown();
            int delivered = 0;
            for (Future<Integer> poll : polls) {
                delivered += poll.get(5, TimeUnit.SECONDS);
            }

            assertEquals(1, delivered);
            assertEquals(1, shown.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Replacing a registration closes the displaced poll tick and keeps the new one")
    void reattachClosesDisplacedTick() {
        TickHandle secondHandle = mock(TickHandle.class);
        when(tickScheduler.scheduleEvery(anyString(), eq(Duration.ofSeconds(60)), any(Runnable.class)))
                .thenReturn(tickHandle, secondHandle);

        LearnerReminders first = coordinator.attach(LEARNER, NotificationPrefs.defaults(ZoneOffset.UTC));
        LearnerReminders second = coordinator.attach(LEARNER, NotificationPrefs.defaults(ZoneOffset.UTC));

        verify(tickHandle).close();
        verify(secondHandle, never()).close();
        assertTrue(coordinator.isAttached(LEARNER));

        first.close();
        assertTrue(coordinator.isAttached(LEARNER));
        second.close();
        assertFalse(coordinator.isAttached(LEARNER));
    }

    @Test
    @DisplayName("A tick attached after the registration closed is released at once")
    void lateTickOnClosedRegistration() {
        LearnerReminders reminders = new LearnerReminders(LEARNER, NotificationPrefs.defaults(ZoneOffset.UTC),
                mock(NotificationScheduler.class), closed -> { });
        reminders.close();

        reminders.attachTickHandle(tickHandle);

        verify(tickHandle).close();
    }
}
