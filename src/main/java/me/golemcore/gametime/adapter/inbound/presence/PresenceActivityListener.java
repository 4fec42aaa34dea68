package me.golemcore.gametime.adapter.inbound.presence;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gametime.domain.model.PresenceChangedEvent;
import me.golemcore.gametime.domain.model.PresenceSnapshotEvent;
import me.golemcore.gametime.port.inbound.ActivitySignalPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns presence events published by the chat adapter into start and end
 * signals.
 *
 * <p>
 * A presence naming the game already being counted is a duplicate and is
 * ignored. A presence naming another game switches sessions. A presence
 * without a game ends the live session, if any.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PresenceActivityListener {

    private final ActivitySignalPort activitySignalPort;

    @EventListener
    public void onPresenceChanged(PresenceChangedEvent event) {
        String identity = event.identity();
        if (identity == null || identity.isBlank()) {
            log.debug("[Presence] Ignoring presence without identity");
            return;
        }

        Optional<String> current = activitySignalPort.currentActivity(identity);
        if (event.isPlaying()) {
            if (current.isPresent() && current.get().equals(event.activity())) {
                log.debug("[Presence] Ignoring multiple presence from {}", identity);
                return;
            }
            activitySignalPort.activityStarted(identity, event.activity());
        } else if (current.isPresent()) {
            activitySignalPort.activityEnded(identity);
        }
    }

    @EventListener
    public void onPresenceSnapshot(PresenceSnapshotEvent event) {
        int playing = 0;
        for (PresenceChangedEvent presence : event.presences()) {
            if (presence.isPlaying()) {
                onPresenceChanged(presence);
                playing++;
            }
        }
        log.info("[Presence] Ready: counting for {} of {} users", playing, event.presences().size());
    }
}
