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
 * Outcome of one snapshot pass over the live sessions.
 *
 * @param merged
 *            sessions whose stretch was written to the ledger
 * @param failed
 *            sessions whose merge failed; their stretch is dropped
 * @param skipped
 *            sessions whose stretch was negative and not merged
 */
public record SnapshotResult(int merged, int failed, int skipped) {

    public int total() {
        return merged + failed + skipped;
    }
}
