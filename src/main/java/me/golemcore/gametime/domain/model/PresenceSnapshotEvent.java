package me.golemcore.gametime.domain.model;

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

import java.util.List;

/**
 * Event published once the chat connection is ready, carrying the presence of
 * every visible user so that games already in progress start counting.
 *
 * @since 1.0
 */
public record PresenceSnapshotEvent(List<PresenceChangedEvent> presences) {

    public PresenceSnapshotEvent {
        presences = presences != null ? List.copyOf(presences) : List.of();
    }
}
