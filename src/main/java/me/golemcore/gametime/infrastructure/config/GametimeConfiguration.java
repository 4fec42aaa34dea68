package me.golemcore.gametime.infrastructure.config;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for the gametime engine.
 *
 * <p>
 * Provides:
 * <ul>
 * <li>the {@link Clock} every component reads time from</li>
 * <li>the bounded executor merges fan out to</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class GametimeConfiguration {

    private static final long MERGE_THREAD_KEEP_ALIVE_SECONDS = 60L;

    private final GametimeProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Pool the tracker spawns merge units on. The thread count bounds how many
     * merges run at once; extra units wait in the queue.
     */
    @Bean(name = "gametimeMergeExecutor", destroyMethod = "shutdown")
    public ExecutorService gametimeMergeExecutor() {
        int threads = Math.max(1, properties.getLedger().getMergeThreads());
        AtomicInteger counter = new AtomicInteger();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(threads, threads,
                MERGE_THREAD_KEEP_ALIVE_SECONDS, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), r -> {
                    Thread t = new Thread(r, "gametime-merge-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Gametime starting...");
        log.info("Ledger Path: {}", properties.getStorage().getPath());
        log.info("Merge Threads: {}", properties.getLedger().getMergeThreads());
        log.info("Snapshot Interval: {}", properties.getSnapshot().getInterval());
    }
}
