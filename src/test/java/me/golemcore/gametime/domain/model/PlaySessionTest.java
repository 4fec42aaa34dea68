package me.golemcore.gametime.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlaySessionTest {

    private static final Instant START = Instant.parse("2026-03-01T20:00:00Z");

    private final PlaySession session = PlaySession.builder()
            .sessionId(7L)
            .identity("alice")
            .activity("doom")
            .startedAt(START)
            .build();

    @Test
    void shouldCutStretchUpToInstant() {
        PlayStretch stretch = session.cut(START.plusSeconds(75));

        assertEquals(new PlayStretch("alice", "doom", Duration.ofSeconds(75)), stretch);
    }

    @Test
    void shouldKeepIdWhenRestarted() {
        PlaySession restarted = session.withStartedAt(START.plusSeconds(60));

        assertEquals(7L, restarted.getSessionId());
        assertEquals(START.plusSeconds(60), restarted.getStartedAt());
        assertEquals(START, session.getStartedAt());
    }

    @Test
    void shouldFlagNegativeStretch() {
        assertTrue(session.cut(START.minusSeconds(1)).isNegative());
    }
}
