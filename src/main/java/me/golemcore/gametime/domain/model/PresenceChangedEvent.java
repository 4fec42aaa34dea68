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

/**
 * Event published by the chat adapter when a user's presence changes.
 *
 * <p>
 * {@code activity} is the game the user is now playing, or {@code null} when
 * the user stopped playing.
 *
 * @since 1.0
 */
public record PresenceChangedEvent(String identity, String activity) {

    public boolean isPlaying() {
        return activity != null && !activity.isBlank();
    }
}
