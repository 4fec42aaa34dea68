package me.golemcore.gametime;

import me.golemcore.gametime.domain.model.PresenceChangedEvent;
import me.golemcore.gametime.domain.service.GametimeTracker;
import me.golemcore.gametime.port.outbound.LedgerPort;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@DirtiesContext
class GametimeContextTest {

    @TempDir
    static Path storeDir;

    @DynamicPropertySource
    static void gametimeProperties(DynamicPropertyRegistry registry) {
        registry.add("gametime.storage.path", () -> storeDir.toString());
        registry.add("gametime.snapshot.interval", () -> "0");
    }

    @Autowired
    private ApplicationEventPublisher eventPublisher;

    @Autowired
    private GametimeTracker tracker;

    @Autowired
    private LedgerPort ledgerPort;

    @Test
    void shouldCountPresenceFromStartToEnd() {
        eventPublisher.publishEvent(new PresenceChangedEvent("alice", "doom"));

        assertEquals("doom", tracker.getLiveSession("alice").orElseThrow().getActivity());

        eventPublisher.publishEvent(new PresenceChangedEvent("alice", null));

        assertTrue(tracker.awaitInFlightMerges(Duration.ofSeconds(5)));
        assertTrue(tracker.getLiveSession("alice").isEmpty());
        assertTrue(ledgerPort.query("alice").hasHistory());
        assertTrue(ledgerPort.listIdentities().contains("alice"));
    }
}
