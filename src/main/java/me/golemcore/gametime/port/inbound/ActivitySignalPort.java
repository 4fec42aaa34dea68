package me.golemcore.gametime.port.inbound;

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

import me.golemcore.gametime.domain.model.PlaytimeHistory;

import java.util.Optional;

/**
 * Inbound port used by chat adapters to report play activity and to read
 * accumulated totals.
 */
public interface ActivitySignalPort {

    /**
     * The identity started playing {@code activity}.
     */
    void activityStarted(String identity, String activity);

    /**
     * The identity stopped playing. Never blocks on persistence.
     */
    void activityEnded(String identity);

    /**
     * Merged totals for the identity. Time of a session that is still live is
     * not included.
     */
    PlaytimeHistory totalsFor(String identity);

    /**
     * Game the identity is currently recorded as playing, if any. A session
     * whose end has been requested is not reported.
     */
    Optional<String> currentActivity(String identity);
}
