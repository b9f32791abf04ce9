/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.storage;

import ai.evacortex.qubitsim.core.SimulationResult;
import ai.evacortex.qubitsim.core.circuit.Circuit;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Bounded memo of simulation results keyed by circuit content.
 *
 * <p>An edited circuit is a different key, so stale entries are never served; they age out
 * by size. Thread-safe.</p>
 */
public class SimulationCache implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(SimulationCache.class);

    /* hash speeds up lookups, circuit equality guards against collisions */
    private record Key(long hash, Circuit circuit) {}

    private final Cache<Key, SimulationResult> cache;
    private final AtomicBoolean isClosed = new AtomicBoolean(false);

    public SimulationCache(int maxEntries) {
        if (maxEntries < 0) {
            throw new IllegalArgumentException("maxEntries must be >= 0: " + maxEntries);
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .recordStats()
                .build();
        log.info("Simulation cache created (maxEntries={})", maxEntries);
    }

    /**
     * Returns the cached result for {@code circuit}, computing it with {@code simulator} on a miss.
     * After {@link #close()} every call computes directly.
     */
    public SimulationResult get(Circuit circuit, Function<Circuit, SimulationResult> simulator) {
        Objects.requireNonNull(circuit, "circuit must not be null");
        Objects.requireNonNull(simulator, "simulator must not be null");
        if (isClosed.get()) {
            return simulator.apply(circuit);
        }
        long hash = CircuitHashing.contentHash(circuit);
        return cache.get(new Key(hash, circuit), k -> {
            log.debug("Cache miss for circuit {}", Long.toHexString(k.hash()));
            return simulator.apply(k.circuit());
        });
    }

    public SimulationResult getIfPresent(Circuit circuit) {
        if (isClosed.get()) return null;
        return cache.getIfPresent(new Key(CircuitHashing.contentHash(circuit), circuit));
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public void close() {
        isClosed.set(true);
        cache.invalidateAll();
        cache.cleanUp();
    }
}
