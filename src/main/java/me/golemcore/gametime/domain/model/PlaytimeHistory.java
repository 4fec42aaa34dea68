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

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of a ledger query for one identity.
 *
 * <p>
 * Distinguishes an identity that never played anything ({@link #noHistory})
 * from one whose recorded totals happen to be zero. Totals are nanosecond
 * counts keyed by activity and cover merged time only; the stretch of a
 * session that is still live is not included.
 *
 * @since 1.0
 */
public final class PlaytimeHistory {

    private final String identity;
    private final Map<String, Long> nanosByActivity;

    private PlaytimeHistory(String identity, Map<String, Long> nanosByActivity) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.nanosByActivity = nanosByActivity;
    }

    public static PlaytimeHistory noHistory(String identity) {
        return new PlaytimeHistory(identity, null);
    }

    public static PlaytimeHistory of(String identity, Map<String, Long> nanosByActivity) {
        Objects.requireNonNull(nanosByActivity, "nanosByActivity");
        return new PlaytimeHistory(identity, Collections.unmodifiableMap(new LinkedHashMap<>(nanosByActivity)));
    }

    public String getIdentity() {
        return identity;
    }

    public boolean hasHistory() {
        return nanosByActivity != null;
    }

    /**
     * Nanoseconds played per activity.
     *
     * @throws IllegalStateException
     *             if the identity has no history
     */
    public Map<String, Long> getTotals() {
        if (nanosByActivity == null) {
            throw new IllegalStateException("No history for " + identity);
        }
        return nanosByActivity;
    }

    /**
     * Total for one activity, zero if the activity was never played.
     */
    public Duration getTotal(String activity) {
        if (nanosByActivity == null) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(nanosByActivity.getOrDefault(activity, 0L));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PlaytimeHistory other)) {
            return false;
        }
        return identity.equals(other.identity) && Objects.equals(nanosByActivity, other.nanosByActivity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, nanosByActivity);
    }

    @Override
    public String toString() {
        return hasHistory()
                ? "PlaytimeHistory{identity=" + identity + ", totals=" + nanosByActivity + "}"
                : "PlaytimeHistory{identity=" + identity + ", no history}";
    }
}
