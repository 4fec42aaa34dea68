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

package me.golemcore.gametime.adapter.outbound.ledger;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jetbrains.exodus.ArrayByteIterable;
import jetbrains.exodus.ByteIterable;
import jetbrains.exodus.ExodusException;
import jetbrains.exodus.bindings.StringBinding;
import jetbrains.exodus.env.Cursor;
import jetbrains.exodus.env.Environment;
import jetbrains.exodus.env.EnvironmentConfig;
import jetbrains.exodus.env.Environments;
import jetbrains.exodus.env.Store;
import jetbrains.exodus.env.StoreConfig;
import jetbrains.exodus.env.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gametime.domain.model.LedgerException;
import me.golemcore.gametime.domain.model.LedgerFailureKind;
import me.golemcore.gametime.domain.model.PlaytimeHistory;
import me.golemcore.gametime.infrastructure.config.GametimeProperties;
import me.golemcore.gametime.port.outbound.LedgerPort;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Xodus implementation of {@link LedgerPort}.
 *
 * <p>
 * Layout inside the environment:
 * <ul>
 * <li>one named store per identity, {@code player:<identity>}</li>
 * <li>one key per activity (UTF-8 string binding)</li>
 * <li>value: signed varint nanosecond count, see {@link SignedVarintCodec}</li>
 * </ul>
 *
 * <p>
 * Merges run in exclusive transactions, so at most one write commits at a time
 * regardless of how many threads request one. Queries run in read-only
 * transactions and see a consistent snapshot.
 *
 * <p>
 * Location configured via {@code gametime.storage.path}, defaults to
 * {@code ${user.home}/.golemcore/gametime}.
 *
 * @see me.golemcore.gametime.port.outbound.LedgerPort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class XodusLedgerAdapter implements LedgerPort {

    static final String NAMESPACE_PREFIX = "player:";

    private static final String LOG_PREFIX = "[Ledger]";

    private final GametimeProperties properties;

    private final Object lifecycleLock = new Object();
    private volatile Environment environment;

    @PostConstruct
    public void init() {
        String pathStr = properties.getStorage().getPath();
        Path storePath = Paths.get(pathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        open(storePath);
    }

    @Override
    public void open(Path storePath) {
        synchronized (lifecycleLock) {
            if (environment != null) {
                throw new LedgerException(LedgerFailureKind.STORE_OPEN,
                        "Ledger already open at " + environment.getLocation());
            }
            try {
                Files.createDirectories(storePath);
                EnvironmentConfig config = new EnvironmentConfig()
                        .setLogDurableWrite(properties.getStorage().isDurableWrites());
                environment = Environments.newInstance(storePath.toFile(), config);
            } catch (Exception e) { // NOSONAR - any open failure is fatal
                throw new LedgerException(LedgerFailureKind.STORE_OPEN,
                        "Failed to open ledger at " + storePath + ": " + e.getMessage(), e);
            }
        }
        log.info("{} Ledger opened at: {}", LOG_PREFIX, storePath);
    }

    @Override
    public long merge(String identity, String activity, Duration elapsed) {
        Environment env = requireOpen();
        try {
            long total = env.computeInExclusiveTransaction(txn -> {
                Store namespace = env.openStore(namespaceOf(identity), StoreConfig.WITHOUT_DUPLICATES, txn);
                ByteIterable key = StringBinding.stringToEntry(activity);
                ByteIterable stored = namespace.get(txn, key);
                long current = stored != null ? SignedVarintCodec.decode(toBytes(stored)) : 0L;
                long updated = current + elapsed.toNanos();
                namespace.put(txn, key, new ArrayByteIterable(SignedVarintCodec.encode(updated)));
                return updated;
            });
            log.debug("{} Merged {}ns into {}/{} (total {}ns)", LOG_PREFIX, elapsed.toNanos(), identity, activity,
                    total);
            return total;
        } catch (LedgerException e) {
            throw e;
        } catch (ExodusException e) {
            throw new LedgerException(LedgerFailureKind.TRANSACTION_FAILED,
                    "Merge failed for " + identity + "/" + activity + ": " + e.getMessage(), e);
        }
    }

    @Override
    public PlaytimeHistory query(String identity) {
        Environment env = requireOpen();
        try {
            return env.computeInReadonlyTransaction(txn -> {
                String storeName = namespaceOf(identity);
                if (!env.storeExists(storeName, txn)) {
                    return PlaytimeHistory.noHistory(identity);
                }
                Store namespace = env.openStore(storeName, StoreConfig.USE_EXISTING, txn);
                return PlaytimeHistory.of(identity, readTotals(namespace, txn));
            });
        } catch (LedgerException e) {
            throw e;
        } catch (ExodusException e) {
            throw new LedgerException(LedgerFailureKind.TRANSACTION_FAILED,
                    "Query failed for " + identity + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> listIdentities() {
        Environment env = requireOpen();
        try {
            List<String> storeNames = env.computeInReadonlyTransaction(env::getAllStoreNames);
            return storeNames.stream()
                    .filter(name -> name.startsWith(NAMESPACE_PREFIX))
                    .map(name -> name.substring(NAMESPACE_PREFIX.length()))
                    .sorted()
                    .toList();
        } catch (ExodusException e) {
            throw new LedgerException(LedgerFailureKind.TRANSACTION_FAILED,
                    "Failed to list identities: " + e.getMessage(), e);
        }
    }

    @Override
    @PreDestroy
    public void close() {
        Environment env;
        synchronized (lifecycleLock) {
            env = environment;
            environment = null;
        }
        if (env == null) {
            return;
        }
        try {
            env.close();
            log.info("{} Ledger closed: {}", LOG_PREFIX, env.getLocation());
        } catch (ExodusException e) {
            log.error("{} Failed to close ledger cleanly: {}", LOG_PREFIX, env.getLocation(), e);
        }
    }

    private Map<String, Long> readTotals(Store namespace, Transaction txn) {
        Map<String, Long> totals = new LinkedHashMap<>();
        Cursor cursor = namespace.openCursor(txn);
        try {
            while (cursor.getNext()) {
                String activity = StringBinding.entryToString(cursor.getKey());
                try {
                    totals.put(activity, SignedVarintCodec.decode(toBytes(cursor.getValue())));
                } catch (LedgerException e) {
                    throw new LedgerException(e.getKind(),
                            e.getMessage() + " (" + namespace.getName() + "/" + activity + ")", e);
                }
            }
        } finally {
            cursor.close();
        }
        return totals;
    }

    private Environment requireOpen() {
        Environment env = environment;
        if (env == null) {
            throw new LedgerException(LedgerFailureKind.STORE_CLOSED, "Ledger is not open");
        }
        return env;
    }

    private static String namespaceOf(String identity) {
        return NAMESPACE_PREFIX + identity;
    }

    private static byte[] toBytes(ByteIterable iterable) {
        return Arrays.copyOf(iterable.getBytesUnsafe(), iterable.getLength());
    }
}
