package review;

import model.ReviewConfig;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ReviewSessionTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void newSession_shouldBeInitializing() {
        ReviewSession session = new ReviewSession(ReviewConfig.empty(), 3, clock);

        SessionSnapshot snapshot = session.snapshot();
        assertEquals(SessionStatus.INITIALIZING, snapshot.status());
        assertEquals(0, snapshot.progress());
        assertEquals("Starting analysis...", snapshot.currentStep());
        assertNull(snapshot.error());
        assertEquals(3, snapshot.fileCount());
        assertEquals(clock.instant(), snapshot.createdAt());
        assertNotNull(session.getId());
    }

    @Test
    void updateProgress_shouldNeverDecrease() {
        ReviewSession session = new ReviewSession(ReviewConfig.empty(), 1, clock);
        session.updateProgress(10, "scan");

        session.updateProgress(50, "half");
        session.updateProgress(20, "late write");

        assertEquals(50, session.getProgress());
        assertEquals("late write", session.snapshot().currentStep());
    }

    @Test
    void updateProgress_shouldClampTo100() {
        ReviewSession session = new ReviewSession(ReviewConfig.empty(), 1, clock);
        session.updateProgress(10, "scan");

        session.updateProgress(250, "overflow");

        assertEquals(100, session.getProgress());
    }

    @Test
    void updateProgress_firstWrite_shouldMoveToRunning() {
        ReviewSession session = new ReviewSession(ReviewConfig.empty(), 1, clock);
        assertNull(session.snapshot().startedAt());

        assertTrue(session.updateProgress(25, "scan"));

        SessionSnapshot snapshot = session.snapshot();
        assertEquals(SessionStatus.RUNNING, snapshot.status());
        assertEquals(clock.instant(), snapshot.startedAt());
        assertEquals("scan", snapshot.currentStep());
    }

    @Test
    void fail_whileInitializing_shouldNeverBecomeRunning() {
        ReviewSession session = new ReviewSession(ReviewConfig.empty(), 1, clock);

        assertTrue(session.fail("Review cancelled by request"));

        assertFalse(session.updateProgress(50, "scan"));
        assertEquals(SessionStatus.FAILED, session.getStatus());
        assertNull(session.snapshot().startedAt());
    }

    @Test
    void complete_shouldRunPublishBeforeTransition() {
        ReviewSession session = new ReviewSession(ReviewConfig.empty(), 1, clock);
        session.updateProgress(10, "scan");
        AtomicBoolean published = new AtomicBoolean();

        boolean completed = session.complete(() -> {
            assertEquals(SessionStatus.RUNNING, session.getStatus());
            published.set(true);
        });

        assertTrue(completed);
        assertTrue(published.get());
        SessionSnapshot snapshot = session.snapshot();
        assertEquals(SessionStatus.COMPLETED, snapshot.status());
        assertEquals(100, snapshot.progress());
        assertNotNull(snapshot.completedAt());
    }

    @Test
    void complete_whenPublishFails_shouldLeaveSessionRunning() {
        ReviewSession session = new ReviewSession(ReviewConfig.empty(), 1, clock);
        session.updateProgress(10, "scan");

        assertThrows(IllegalStateException.class, () -> session.complete(() -> {
            throw new IllegalStateException("store full");
        }));

        assertEquals(SessionStatus.RUNNING, session.getStatus());
    }

    @Test
    void terminalSession_shouldIgnoreFurtherMutations() {
        ReviewSession session = new ReviewSession(ReviewConfig.empty(), 1, clock);
        session.updateProgress(40, "scan");
        assertTrue(session.fail("boom"));

        assertFalse(session.updateProgress(90, "later"));
        assertFalse(session.fail("again"));
        assertFalse(session.complete(() -> fail("publish must not run for a failed session")));

        SessionSnapshot snapshot = session.snapshot();
        assertEquals(SessionStatus.FAILED, snapshot.status());
        assertEquals(40, snapshot.progress());
        assertEquals("boom", snapshot.error());
    }

    @Test
    void fail_withBlankMessage_shouldStoreNonEmptyError() {
        ReviewSession session = new ReviewSession(ReviewConfig.empty(), 1, clock);

        session.fail("  ");

        assertFalse(session.snapshot().error().isBlank());
    }

    @Test
    void snapshot_shouldSerializeStatusInLowerCase() {
        assertEquals("completed", SessionStatus.COMPLETED.getValue());
        assertEquals("initializing", SessionStatus.INITIALIZING.getValue());
        assertTrue(SessionStatus.FAILED.isTerminal());
        assertFalse(SessionStatus.RUNNING.isTerminal());
    }
}
