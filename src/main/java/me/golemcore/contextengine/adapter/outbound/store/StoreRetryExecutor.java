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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.contextengine.infrastructure.config.ContextEngineProperties;
import me.golemcore.contextengine.port.outbound.StoreContentionException;
import me.golemcore.contextengine.port.outbound.StoreUnavailableException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs store operations with exponential backoff on lock contention (100 ms,
 * 200 ms, 400 ms with the defaults). Reads that still fail throw
 * {@link StoreUnavailableException}; writes that still fail are logged and
 * replaced by a fallback value.
 */
@Component
@Slf4j
public class StoreRetryExecutor {

    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final int maxAttempts;
    private final long initialBackoffMs;

    public StoreRetryExecutor(ContextEngineProperties properties) {
        this(properties.getStore().getMaxAttempts(), properties.getStore().getInitialBackoff());
    }

    StoreRetryExecutor(int maxAttempts, Duration initialBackoff) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = initialBackoff != null ? Math.max(0L, initialBackoff.toMillis()) : 100L;
    }

    public <T> T read(String operation, Supplier<T> action) {
        return execute(operation, action);
    }

    public <T> T write(String operation, Supplier<T> action, T fallback) {
        try {
            return execute(operation, action);
        } catch (StoreUnavailableException e) {
            log.warn("[Store] Write '{}' dropped: {}", operation, e.getMessage());
            return fallback;
        }
    }

    public void write(String operation, Runnable action) {
        write(operation, () -> {
            action.run();
            return null;
        }, null);
    }

    private <T> T execute(String operation, Supplier<T> action) {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (StoreContentionException e) {
                if (attempt + 1 >= maxAttempts) {
                    throw new StoreUnavailableException(
                            "Store contention on '" + operation + "' after " + maxAttempts + " attempts", e);
                }
                long backoffMs = (long) (initialBackoffMs * Math.pow(BACKOFF_MULTIPLIER, attempt));
                log.debug("[Store] Contention on '{}' (attempt {}/{}), retrying in {}ms",
                        operation, attempt + 1, maxAttempts, backoffMs);
                sleep(operation, backoffMs);
            } catch (StoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new StoreUnavailableException("Store operation '" + operation + "' failed: " + e.getMessage(),
                        e);
            }
        }
        throw new StoreUnavailableException("Store operation '" + operation + "' exhausted retries");
    }

    private void sleep(String operation, long backoffMs) {
        if (backoffMs <= 0) {
            return;
        }
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted during backoff for '" + operation + "'", ie);
        }
    }
}
