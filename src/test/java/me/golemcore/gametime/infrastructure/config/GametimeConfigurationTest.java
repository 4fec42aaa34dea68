package me.golemcore.gametime.infrastructure.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GametimeConfigurationTest {

    @Test
    void shouldBoundMergeExecutorByConfiguredThreads() {
        GametimeProperties properties = new GametimeProperties();
        properties.getLedger().setMergeThreads(3);

        ExecutorService executor = new GametimeConfiguration(properties).gametimeMergeExecutor();
        try {
            ThreadPoolExecutor pool = assertInstanceOf(ThreadPoolExecutor.class, executor);
            assertEquals(3, pool.getMaximumPoolSize());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldUseAtLeastOneMergeThread() {
        GametimeProperties properties = new GametimeProperties();
        properties.getLedger().setMergeThreads(0);

        ExecutorService executor = new GametimeConfiguration(properties).gametimeMergeExecutor();
        try {
            assertEquals(1, ((ThreadPoolExecutor) executor).getMaximumPoolSize());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldProvideSystemClock() {
        assertNotNull(GametimeConfiguration.clock());
    }

    @Test
    void shouldHaveSensibleDefaults() {
        GametimeProperties properties = new GametimeProperties();

        assertTrue(properties.getStorage().getPath().endsWith(".golemcore/gametime"));
        assertTrue(properties.getStorage().isDurableWrites());
        assertEquals(4, properties.getLedger().getMergeThreads());
        assertEquals(Duration.ofMinutes(5), properties.getSnapshot().getInterval());
        assertEquals(Duration.ofSeconds(5), properties.getShutdown().getGracePeriod());
    }
}
