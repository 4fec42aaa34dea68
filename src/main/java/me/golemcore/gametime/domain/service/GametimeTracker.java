package me.golemcore.gametime.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gametime.domain.model.LedgerException;
import me.golemcore.gametime.domain.model.PlaySession;
import me.golemcore.gametime.domain.model.PlayStretch;
import me.golemcore.gametime.domain.model.PlaytimeHistory;
import me.golemcore.gametime.domain.model.SnapshotResult;
import me.golemcore.gametime.infrastructure.config.GametimeProperties;
import me.golemcore.gametime.port.inbound.ActivitySignalPort;
import me.golemcore.gametime.port.outbound.LedgerPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Tracks which game every identity is playing and hands elapsed time over to
 * the {@link LedgerPort}.
 *
 * <p>
 * Session lifecycle:
 * <ul>
 * <li>{@link #startSession} opens a live session. A session already live for
 * the identity is closed first and its stretch merged, so switching games
 * never loses time.</li>
 * <li>{@link #requestEnd} only enqueues. A dedicated thread drains the queue
 * and fans every request out to the merge executor, which removes the session,
 * cuts its stretch and merges it in one ledger transaction.</li>
 * <li>{@link #snapshot} cuts every live session at the current instant,
 * restarts it from there and merges the cut stretch, so the next cut never
 * counts the same time twice.</li>
 * </ul>
 *
 * <p>
 * The live-session map is only changed through per-key atomic operations
 * ({@code put}, {@code remove(key, value)}, {@code computeIfPresent}). Each end
 * request carries the id of the session it was issued for; a session started
 * after the request is never ended by it. A session whose end is requested is
 * no longer reported by {@link #currentActivity}, so a quick stop and restart
 * of the same game opens a new session.
 *
 * <p>
 * Signals and shutdown share {@code lifecycleLock}: signals hold the read side
 * while they check that the tracker is accepting and change the map, shutdown
 * takes the write side to stop accepting. No session is opened after the final
 * snapshot.
 *
 * <p>
 * Totals returned by {@link #getTotal} cover merged time only. Callers that
 * want "played so far" add {@link #getLiveElapsed} themselves.
 *
 * <p>
 * Failed merges are logged and dropped (at most once per stretch); nothing is
 * retried.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class GametimeTracker implements ActivitySignalPort {

    private static final String LOG_PREFIX = "[Gametime]";
    private static final EndRequest STOP = new EndRequest("", -1L, new CompletableFuture<>());
    private static final int SCHEDULER_TERMINATION_TIMEOUT_SECONDS = 5;

    private final LedgerPort ledgerPort;
    private final Clock clock;
    private final GametimeProperties properties;
    private final ExecutorService mergeExecutor;

    private final Map<String, PlaySession> liveSessions = new ConcurrentHashMap<>();
    private final BlockingQueue<EndRequest> endRequests = new LinkedBlockingQueue<>();
    private final Set<CompletableFuture<Void>> inFlightMerges = ConcurrentHashMap.newKeySet();
    private final Set<Long> endPendingSessions = ConcurrentHashMap.newKeySet();
    private final ReadWriteLock lifecycleLock = new ReentrantReadWriteLock();
    private final AtomicLong sessionSequence = new AtomicLong();
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final AtomicBoolean snapshotting = new AtomicBoolean(false);

    private Thread endRequestThread;
    private ScheduledExecutorService snapshotScheduler;
    private ScheduledFuture<?> snapshotTask;

    public GametimeTracker(LedgerPort ledgerPort, Clock clock, GametimeProperties properties,
            @Qualifier("gametimeMergeExecutor") ExecutorService mergeExecutor) {
        this.ledgerPort = ledgerPort;
        this.clock = clock;
        this.properties = properties;
        this.mergeExecutor = mergeExecutor;
    }

    @PostConstruct
    public void init() {
        endRequestThread = new Thread(this::processEndRequests, "gametime-end-requests");
        endRequestThread.setDaemon(true);
        endRequestThread.start();

        Duration interval = properties.getSnapshot().getInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            log.info("{} Periodic snapshot disabled", LOG_PREFIX);
            return;
        }
        snapshotScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gametime-snapshot");
            t.setDaemon(true);
            return t;
        });
        snapshotTask = snapshotScheduler.scheduleAtFixedRate(this::snapshotTick,
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("{} Periodic snapshot every {}", LOG_PREFIX, interval);
    }

    // ==================== Signals ====================

    @Override
    public void activityStarted(String identity, String activity) {
        startSession(identity, activity);
    }

    @Override
    public void activityEnded(String identity) {
        requestEnd(identity);
    }

    @Override
    public PlaytimeHistory totalsFor(String identity) {
        return getTotal(identity);
    }

    @Override
    public Optional<String> currentActivity(String identity) {
        return getLiveSession(identity)
                .filter(session -> !endPendingSessions.contains(session.getSessionId()))
                .map(PlaySession::getActivity);
    }

    /**
     * Open a session for {@code identity}, closing (and merging) the one already
     * live for it.
     *
     * @return {@code false} if the tracker is shut down and the start was ignored
     */
    public boolean startSession(String identity, String activity) {
        lifecycleLock.readLock().lock();
        try {
            if (!accepting.get()) {
                log.warn("{} Ignoring start for {} on {}: tracker is shut down", LOG_PREFIX, identity, activity);
                return false;
            }
            Instant now = clock.instant();
            PlaySession session = PlaySession.builder()
                    .sessionId(sessionSequence.incrementAndGet())
                    .identity(identity)
                    .activity(activity)
                    .startedAt(now)
                    .build();
            PlaySession previous = liveSessions.put(identity, session);
            if (previous != null) {
                log.info("{} {} switched from {} to {}, closing previous session", LOG_PREFIX, identity,
                        previous.getActivity(), activity);
                dispatchMerge(previous.cut(now));
            }
        } finally {
            lifecycleLock.readLock().unlock();
        }
        log.info("{} Starting to count for {} on {}", LOG_PREFIX, identity, activity);
        return true;
    }

    /**
     * Enqueue the end of the session currently live for {@code identity}.
     * Returns at once; the returned future completes when the stretch has been
     * merged (or dropped).
     */
    public CompletableFuture<Void> requestEnd(String identity) {
        lifecycleLock.readLock().lock();
        try {
            PlaySession current = liveSessions.get(identity);
            if (current == null) {
                log.debug("{} No live session to end for {}", LOG_PREFIX, identity);
                return CompletableFuture.completedFuture(null);
            }
            if (!accepting.get()) {
                log.warn("{} Ignoring end for {}: tracker is shut down", LOG_PREFIX, identity);
                return CompletableFuture.completedFuture(null);
            }
            long sessionId = current.getSessionId();
            EndRequest request = new EndRequest(identity, sessionId, new CompletableFuture<>());
            endPendingSessions.add(sessionId);
            request.completion().whenComplete((ignored, error) -> endPendingSessions.remove(sessionId));
            track(request.completion());
            endRequests.add(request);
            return request.completion();
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    /**
     * Consumer loop of the end-request queue. Runs on the
     * {@code gametime-end-requests} thread until shutdown.
     */
    void processEndRequests() {
        while (true) {
            EndRequest request;
            try {
                request = endRequests.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} End-request consumer interrupted", LOG_PREFIX);
                return;
            }
            if (request == STOP) {
                return;
            }
            dispatchEnd(request);
        }
    }

    // ==================== Snapshot ====================

    /**
     * Merge the elapsed time of every live session and restart each from now.
     * Sessions stay live. A failing merge is logged and does not stop the
     * others.
     */
    public SnapshotResult snapshot() {
        return cutLiveSessions(true);
    }

    /**
     * Cut every live session at the current instant and merge the stretches.
     * With {@code keepLive} each session restarts from the cut, otherwise it is
     * removed in the same atomic step.
     */
    private SnapshotResult cutLiveSessions(boolean keepLive) {
        int merged = 0;
        int failed = 0;
        int skipped = 0;
        for (String identity : new ArrayList<>(liveSessions.keySet())) {
            PlayStretch[] cut = new PlayStretch[1];
            liveSessions.computeIfPresent(identity, (key, session) -> {
                Instant now = clock.instant();
                cut[0] = session.cut(now);
                return keepLive ? session.withStartedAt(now) : null;
            });
            if (cut[0] == null) {
                continue;
            }
            switch (mergeStretch(cut[0])) {
            case MERGED -> merged++;
            case FAILED -> failed++;
            case SKIPPED -> skipped++;
            }
        }
        SnapshotResult result = new SnapshotResult(merged, failed, skipped);
        log.info("{} Snapshot done: {} merged, {} failed, {} skipped", LOG_PREFIX, merged, failed, skipped);
        return result;
    }

    void snapshotTick() {
        if (!snapshotting.compareAndSet(false, true)) {
            log.debug("{} Snapshot skipped: previous one still in progress", LOG_PREFIX);
            return;
        }
        try {
            if (!liveSessions.isEmpty()) {
                snapshot();
            }
        } catch (Exception e) { // NOSONAR - must not kill scheduler thread
            log.error("{} Periodic snapshot failed: {}", LOG_PREFIX, e.getMessage(), e);
        } finally {
            snapshotting.set(false);
        }
    }

    // ==================== Queries ====================

    /**
     * Merged totals for {@code identity}. Does not include the live session.
     *
     * @throws LedgerException
     *             when the ledger cannot be read
     */
    public PlaytimeHistory getTotal(String identity) {
        return ledgerPort.query(identity);
    }

    /**
     * Time played in the live session that is not merged yet.
     */
    public Optional<Duration> getLiveElapsed(String identity) {
        return getLiveSession(identity).map(session -> session.elapsedAt(clock.instant()));
    }

    public Optional<PlaySession> getLiveSession(String identity) {
        return Optional.ofNullable(liveSessions.get(identity));
    }

    public int getLiveSessionCount() {
        return liveSessions.size();
    }

    public int getInFlightMergeCount() {
        return inFlightMerges.size();
    }

    /**
     * Wait until every end request and merge dispatched so far has completed.
     *
     * @return {@code false} if the timeout elapsed first
     */
    public boolean awaitInFlightMerges(Duration timeout) {
        CompletableFuture<?>[] pending = inFlightMerges.toArray(new CompletableFuture<?>[0]);
        if (pending.length == 0) {
            return true;
        }
        try {
            CompletableFuture.allOf(pending).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("{} {} merges still running after {}", LOG_PREFIX, inFlightMerges.size(), timeout);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            log.error("{} Merge completed exceptionally: {}", LOG_PREFIX, e.getMessage(), e);
            return true;
        }
    }

    // ==================== Shutdown ====================

    /**
     * Stop accepting signals, finish pending end requests, then merge every
     * still-live session. Runs before the ledger is closed.
     */
    @PreDestroy
    public void shutdown() {
        lifecycleLock.writeLock().lock();
        try {
            if (!accepting.compareAndSet(true, false)) {
                return;
            }
        } finally {
            lifecycleLock.writeLock().unlock();
        }
        log.info("{} Shutting down with {} live sessions", LOG_PREFIX, liveSessions.size());
        stopSnapshotScheduler();
        stopEndRequestConsumer();

        Duration gracePeriod = properties.getShutdown().getGracePeriod();
        if (!awaitInFlightMerges(gracePeriod)) {
            log.warn("{} Grace period of {} elapsed with merges still running", LOG_PREFIX, gracePeriod);
        }

        SnapshotResult result = cutLiveSessions(false);
        log.info("{} Shut down, final snapshot saved {} of {} sessions", LOG_PREFIX, result.merged(),
                result.total());
    }

    private void stopSnapshotScheduler() {
        if (snapshotTask != null) {
            snapshotTask.cancel(false);
        }
        if (snapshotScheduler != null) {
            snapshotScheduler.shutdown();
            try {
                if (!snapshotScheduler.awaitTermination(SCHEDULER_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    snapshotScheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                snapshotScheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private void stopEndRequestConsumer() {
        if (endRequestThread != null) {
            endRequests.add(STOP);
            try {
                endRequestThread.join(properties.getShutdown().getGracePeriod().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (endRequestThread.isAlive()) {
                log.warn("{} End-request consumer did not stop in time", LOG_PREFIX);
                endRequestThread.interrupt();
            }
        }
        List<EndRequest> leftover = new ArrayList<>();
        endRequests.drainTo(leftover);
        for (EndRequest request : leftover) {
            if (request != STOP) {
                dispatchEnd(request);
            }
        }
    }

    // ==================== Merge units ====================

    private void dispatchEnd(EndRequest request) {
        try {
            CompletableFuture.runAsync(() -> endSession(request), mergeExecutor)
                    .whenComplete((ignored, error) -> request.completion().complete(null));
        } catch (RejectedExecutionException e) {
            log.error("{} Merge executor rejected end of {}", LOG_PREFIX, request.identity(), e);
            request.completion().complete(null);
        }
    }

    private void dispatchMerge(PlayStretch stretch) {
        CompletableFuture<Void> completion = new CompletableFuture<>();
        track(completion);
        try {
            CompletableFuture.runAsync(() -> mergeStretch(stretch), mergeExecutor)
                    .whenComplete((ignored, error) -> completion.complete(null));
        } catch (RejectedExecutionException e) {
            log.error("{} Merge executor rejected stretch of {} on {}", LOG_PREFIX, stretch.identity(),
                    stretch.activity(), e);
            completion.complete(null);
        }
    }

    private void endSession(EndRequest request) {
        PlayStretch[] cut = new PlayStretch[1];
        // a snapshot keeps the session id on its restarted copy
        liveSessions.computeIfPresent(request.identity(), (key, session) -> {
            if (session.getSessionId() != request.sessionId()) {
                return session;
            }
            cut[0] = session.cut(clock.instant());
            return null;
        });
        if (cut[0] == null) {
            log.debug("{} Session {} of {} already gone", LOG_PREFIX, request.sessionId(), request.identity());
            return;
        }
        mergeStretch(cut[0]);
    }

    private MergeOutcome mergeStretch(PlayStretch stretch) {
        if (stretch.isNegative()) {
            log.warn("{} Dropping negative stretch of {} for {} on {}", LOG_PREFIX, stretch.elapsed(),
                    stretch.identity(), stretch.activity());
            return MergeOutcome.SKIPPED;
        }
        try {
            long total = ledgerPort.merge(stretch.identity(), stretch.activity(), stretch.elapsed());
            log.info("{} Saved {} on {}: +{} (total {})", LOG_PREFIX, stretch.identity(), stretch.activity(),
                    stretch.elapsed(), Duration.ofNanos(total));
            return MergeOutcome.MERGED;
        } catch (Exception e) { // NOSONAR - a failed merge must not affect other identities
            log.error("{} Error while updating game time of {} on {}: {}", LOG_PREFIX, stretch.identity(),
                    stretch.activity(), e.getMessage(), e);
            return MergeOutcome.FAILED;
        }
    }

    private void track(CompletableFuture<Void> completion) {
        inFlightMerges.add(completion);
        completion.whenComplete((ignored, error) -> inFlightMerges.remove(completion));
    }

    private enum MergeOutcome {
        MERGED, FAILED, SKIPPED
    }

    private record EndRequest(String identity, long sessionId, CompletableFuture<Void> completion) {
    }
}
