package me.golemcore.contextengine.adapter.outbound.store;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.contextengine.port.outbound.StoragePort;
import me.golemcore.contextengine.port.outbound.StoreContentionException;
import me.golemcore.contextengine.port.outbound.StoreUnavailableException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * One persisted table: rows keyed by primary key, kept in insertion order,
 * cached in memory and written back as a single JSON array document after each
 * mutation.
 *
 * <p>
 * Every operation holds the table lock, so read-check-write sequences such as
 * insert-or-ignore are atomic within the process. Failing to get the lock within
 * the timeout raises {@link StoreContentionException}. Rows returned to callers
 * are copies. The previous version of the document is kept as a backup and
 * used when the current one cannot be parsed.
 */
@Slf4j
class JsonTable<T> {

    private static final String BACKUP_SUFFIX = ".bak";

    private final String name;
    private final String directory;
    private final String fileName;
    private final Class<T> rowType;
    private final Function<T, String> keyFunction;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final long lockTimeoutMs;
    private final ReentrantLock lock = new ReentrantLock();

    private Map<String, T> rows;

    JsonTable(String name, String directory, Class<T> rowType, Function<T, String> keyFunction,
            StoragePort storagePort, ObjectMapper objectMapper, Duration lockTimeout) {
        this.name = name;
        this.directory = directory;
        this.fileName = name + ".json";
        this.rowType = rowType;
        this.keyFunction = keyFunction;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.lockTimeoutMs = lockTimeout != null ? lockTimeout.toMillis() : 250L;
    }

    String getName() {
        return name;
    }

    /**
     * Run a read-only function over the rows. The map passed in must not be
     * mutated.
     */
    <R> R read(Function<Map<String, T>, R> reader) {
        acquire();
        try {
            return reader.apply(loadedRows());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run a mutating function and persist the result. On persistence failure the
     * cache is dropped so the next operation reloads the last durable state.
     */
    <R> R write(Function<Map<String, T>, R> writer) {
        acquire();
        try {
            Map<String, T> current = loadedRows();
            R result = writer.apply(current);
            persist(current);
            return result;
        } finally {
            lock.unlock();
        }
    }

    String keyOf(T row) {
        return keyFunction.apply(row);
    }

    T copy(T row) {
        return row == null ? null : objectMapper.convertValue(row, rowType);
    }

    List<T> copyAll(Iterable<T> source) {
        List<T> copies = new ArrayList<>();
        for (T row : source) {
            copies.add(copy(row));
        }
        return copies;
    }

    private void acquire() {
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while waiting for table " + name, e);
        }
        if (!acquired) {
            throw new StoreContentionException("Table " + name + " is locked");
        }
    }

    private Map<String, T> loadedRows() {
        if (rows == null) {
            rows = load();
        }
        return rows;
    }

    private Map<String, T> load() {
        String content = storagePort.getText(directory, fileName).join();
        try {
            return parse(content);
        } catch (StoreUnavailableException e) {
            String backup = storagePort.getText(directory, fileName + BACKUP_SUFFIX).join();
            if (backup == null) {
                throw e;
            }
            log.warn("[Store] Table {} is unreadable, recovering from backup: {}", name, e.getMessage());
            return parse(backup);
        }
    }

    private Map<String, T> parse(String content) {
        Map<String, T> loaded = new LinkedHashMap<>();
        if (content == null || content.isBlank()) {
            return loaded;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Table " + name + " is corrupt: " + e.getOriginalMessage(), e);
        }
        if (!root.isArray()) {
            throw new StoreUnavailableException("Table " + name + " is not a JSON array");
        }
        int skipped = 0;
        for (JsonNode node : root) {
            try {
                T row = objectMapper.treeToValue(node, rowType);
                String key = row != null ? keyFunction.apply(row) : null;
                if (key == null || key.isBlank()) {
                    skipped++;
                    continue;
                }
                loaded.put(key, row);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("[Store] Skipped {} malformed row(s) in table {}", skipped, name);
        }
        log.debug("[Store] Loaded {} row(s) from table {}", loaded.size(), name);
        return loaded;
    }

    private void persist(Map<String, T> current) {
        try {
            ArrayNode array = objectMapper.createArrayNode();
            for (T row : current.values()) {
                array.add(objectMapper.valueToTree(row));
            }
            String payload = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(array);
            storagePort.putTextAtomic(directory, fileName, payload, true).join();
        } catch (JsonProcessingException | RuntimeException e) {
            rows = null;
            throw new StoreUnavailableException("Failed to persist table " + name + ": " + e.getMessage(), e);
        }
    }
}
