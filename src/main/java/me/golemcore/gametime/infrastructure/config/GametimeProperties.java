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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the gametime engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code gametime.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - ledger environment location</li>
 * <li>{@link LedgerProperties} - merge fan-out bound</li>
 * <li>{@link SnapshotProperties} - periodic checkpoint</li>
 * <li>{@link ShutdownProperties} - drain behaviour on shutdown</li>
 * </ul>
 *
 * @since 1.0
 */
@ConfigurationProperties(prefix = "gametime")
@Data
public class GametimeProperties {

    private StorageProperties storage = new StorageProperties();
    private LedgerProperties ledger = new LedgerProperties();
    private SnapshotProperties snapshot = new SnapshotProperties();
    private ShutdownProperties shutdown = new ShutdownProperties();

    @Data
    public static class StorageProperties {
        private String path = "${user.home}/.golemcore/gametime";
        private boolean durableWrites = true;
    }

    @Data
    public static class LedgerProperties {
        private int mergeThreads = 4;
    }

    @Data
    public static class SnapshotProperties {
        private Duration interval = Duration.ofMinutes(5);
    }

    @Data
    public static class ShutdownProperties {
        private Duration gracePeriod = Duration.ofSeconds(5);
    }
}
