package me.golemcore.gametime.port.outbound;

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

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Port for the durable playtime ledger: cumulative elapsed time per
 * (identity, activity), updated transactionally.
 *
 * <p>
 * All operations may block on I/O and must not be called from a thread that
 * cannot tolerate blocking. Failures are reported as
 * {@link me.golemcore.gametime.domain.model.LedgerException}.
 */
public interface LedgerPort {

    /**
     * Attach the durable store at the given location.
     */
    void open(Path storePath);

    /**
     * Add {@code elapsed} to the stored total for (identity, activity) in one
     * transaction, creating the identity namespace and the entry when absent.
     *
     * @param identity
     *            tracked user
     * @param activity
     *            game being played
     * @param elapsed
     *            time to add
     * @return the new total in nanoseconds
     */
    long merge(String identity, String activity, Duration elapsed);

    /**
     * Read every activity total of one identity.
     *
     * @return totals, or {@link PlaytimeHistory#noHistory(String)} when the
     *         identity never played anything
     */
    PlaytimeHistory query(String identity);

    /**
     * Identities that have a namespace in the ledger.
     */
    List<String> listIdentities();

    /**
     * Flush and release the store. Safe to call more than once.
     */
    void close();
}
