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
 * Classification of ledger failures.
 *
 * <p>
 * A query for an identity without history is not a failure and has no kind
 * here; it is reported as {@link PlaytimeHistory#noHistory(String)}.
 */
public enum LedgerFailureKind {

    /**
     * The durable store could not be opened (inaccessible, locked by another
     * process, corrupt).
     */
    STORE_OPEN,

    /**
     * A transaction aborted (I/O error, namespace creation failure). Nothing was
     * written.
     */
    TRANSACTION_FAILED,

    /**
     * A stored total could not be decoded as a signed varint.
     */
    DECODE_CORRUPTION,

    /**
     * The store was already closed.
     */
    STORE_CLOSED
}
