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

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.time.Instant;

/**
 * One in-progress stretch of an identity playing an activity.
 *
 * <p>
 * Instances are immutable. A snapshot replaces the live session with a copy
 * whose {@code startedAt} is moved forward; the {@code sessionId} survives the
 * replacement so that end requests issued before the snapshot still match.
 *
 * @since 1.0
 */
@Value
@Builder
public class PlaySession {

    long sessionId;
    String identity;
    String activity;
    @With
    Instant startedAt;

    /**
     * Elapsed time between {@code startedAt} and {@code now}. Negative when the
     * wall clock stepped backwards.
     */
    public Duration elapsedAt(Instant now) {
        return Duration.between(startedAt, now);
    }

    /**
     * Cuts the stretch played up to {@code now}.
     */
    public PlayStretch cut(Instant now) {
        return new PlayStretch(identity, activity, elapsedAt(now));
    }
}
