package me.golemcore.gametime.domain.service;

import me.golemcore.gametime.domain.model.LedgerException;
import me.golemcore.gametime.domain.model.LedgerFailureKind;
import me.golemcore.gametime.domain.model.PlaytimeHistory;
import me.golemcore.gametime.domain.model.SnapshotResult;
import me.golemcore.gametime.infrastructure.config.GametimeProperties;
import me.golemcore.gametime.port.outbound.LedgerPort;
import me.golemcore.gametime.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Failure paths of the tracker against a mocked ledger.
 */
class GametimeTrackerFailureTest {

    private static final Instant T0 = Instant.parse("2026-03-01T20:00:00Z");
    private static final String ALICE = "alice";
    private static final String BOB = "bob";
    private static final String DOOM = "doom";

    private LedgerPort ledgerPort;
    private MutableClock clock;
    private ExecutorService mergeExecutor;
    private GametimeTracker tracker;

    @BeforeEach
    void setUp() {
        ledgerPort = mock(LedgerPort.class);
        clock = new MutableClock(T0);
        GametimeProperties properties = new GametimeProperties();
        properties.getSnapshot().setInterval(Duration.ZERO);
        properties.getShutdown().setGracePeriod(Duration.ofSeconds(5));
        mergeExecutor = Executors.newFixedThreadPool(2);
        tracker = new GametimeTracker(ledgerPort, clock, properties, mergeExecutor);
        tracker.init();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        tracker.shutdown();
        mergeExecutor.shutdownNow();
        mergeExecutor.awaitTermination(2, TimeUnit.SECONDS);
    }

    @Test
    void shouldContinueSnapshotWhenOneMergeFails() {
        when(ledgerPort.merge(eq(BOB), anyString(), any(Duration.class)))
                .thenThrow(new LedgerException(LedgerFailureKind.TRANSACTION_FAILED, "disk full"));
        tracker.startSession(ALICE, DOOM);
        tracker.startSession(BOB, DOOM);
        clock.advance(Duration.ofSeconds(30));

        SnapshotResult result = tracker.snapshot();

        assertEquals(new SnapshotResult(1, 1, 0), result);
        verify(ledgerPort).merge(ALICE, DOOM, Duration.ofSeconds(30));
        assertEquals(2, tracker.getLiveSessionCount());
    }

    @Test
    void shouldDropStretchWhenEndMergeFails() throws Exception {
        when(ledgerPort.merge(eq(ALICE), anyString(), any(Duration.class)))
                .thenThrow(new LedgerException(LedgerFailureKind.DECODE_CORRUPTION, "bad value"));
        tracker.startSession(ALICE, DOOM);
        clock.advance(Duration.ofSeconds(30));

        tracker.requestEnd(ALICE).get(5, TimeUnit.SECONDS);

        verify(ledgerPort).merge(ALICE, DOOM, Duration.ofSeconds(30));
        assertTrue(tracker.getLiveSession(ALICE).isEmpty());
        assertEquals(0, tracker.getInFlightMergeCount());
    }

    @Test
    void shouldKeepServingOtherIdentitiesAfterFailedMerge() throws Exception {
        when(ledgerPort.merge(eq(ALICE), anyString(), any(Duration.class)))
                .thenThrow(new LedgerException(LedgerFailureKind.TRANSACTION_FAILED, "io"));
        tracker.startSession(ALICE, DOOM);
        tracker.startSession(BOB, DOOM);
        clock.advance(Duration.ofSeconds(3));

        tracker.requestEnd(ALICE).get(5, TimeUnit.SECONDS);
        tracker.requestEnd(BOB).get(5, TimeUnit.SECONDS);

        verify(ledgerPort).merge(BOB, DOOM, Duration.ofSeconds(3));
    }

    @Test
    void shouldPropagateQueryFailuresToCaller() {
        LedgerException failure = new LedgerException(LedgerFailureKind.DECODE_CORRUPTION, "bad value");
        when(ledgerPort.query(ALICE)).thenThrow(failure);

        LedgerException ex = assertThrows(LedgerException.class, () -> tracker.getTotal(ALICE));

        assertSame(failure, ex);
    }

    @Test
    void shouldDelegateTotalsToLedger() {
        PlaytimeHistory history = PlaytimeHistory.of(ALICE, Map.of(DOOM, 5L));
        when(ledgerPort.query(ALICE)).thenReturn(history);

        assertSame(history, tracker.totalsFor(ALICE));
    }

    @Test
    void shouldSkipPeriodicTickWithoutLiveSessions() {
        tracker.snapshotTick();

        verifyNoInteractions(ledgerPort);
    }

    @Test
    void shouldMergeOnPeriodicTick() {
        tracker.startSession(ALICE, DOOM);
        clock.advance(Duration.ofMinutes(5));

        tracker.snapshotTick();

        verify(ledgerPort).merge(ALICE, DOOM, Duration.ofMinutes(5));
    }

    @Test
    void shouldNotMergeWhenNothingWasPlayed() throws Exception {
        tracker.requestEnd(ALICE).get(5, TimeUnit.SECONDS);

        verify(ledgerPort, never()).merge(anyString(), anyString(), any(Duration.class));
    }
}
