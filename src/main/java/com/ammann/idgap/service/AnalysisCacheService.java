/* (C)2026 */
package com.ammann.idgap.service;

import com.ammann.idgap.dto.GapAnalysisResultDTO;
import com.ammann.idgap.exception.AnalysisTimeoutException;
import com.ammann.idgap.exception.CacheException;
import com.ammann.idgap.exception.SomeThingWentWrongException;
import com.ammann.idgap.model.AnalysisKey;
import com.ammann.idgap.model.CachedAnalysis;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Time-bounded cache of gap analysis results.
 *
 * <p>Each entry carries its own expiry instant. Expiry is checked on read against the
 * injected {@link Clock}: an entry is served while {@code now < expiresAt} and removed on
 * the first read after that. Caffeine also drops expired entries during its
 * maintenance and bounds the number of entries.
 *
 * <p>Partial results are returned to the caller but never stored. Concurrent misses for
 * the same key are coalesced so only one computation runs; the others wait for its
 * outcome. A forced refresh does not join a running computation, it recomputes and
 * overwrites the entry.
 *
 * <p>Each entity has an invalidation generation. A computation stores its result only if
 * the generation it started under is still current, so a result read before
 * {@link #invalidateEntity(String)} is handed to its callers but never cached.
 *
 * <p>A malfunctioning cache never fails a request: read and write errors are logged and
 * the request proceeds as a miss.
 */
@ApplicationScoped
public class AnalysisCacheService {

    private static final Logger LOG = Logger.getLogger(AnalysisCacheService.class);

    static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    static final long DEFAULT_MAX_ENTRIES = 500;

    /**
     * Stored analysis with its expiry.
     *
     * @param result stored complete result
     * @param storedAt instant the entry was written
     * @param expiresAt first instant at which the entry is no longer served
     */
    record CacheEntry(GapAnalysisResultDTO result, Instant storedAt, Instant expiresAt) {}

    private final Clock clock;
    private final Duration ttl;
    private final Cache<AnalysisKey, CacheEntry> entries;
    private final ConcurrentMap<AnalysisKey, CompletableFuture<GapAnalysisResultDTO>> inFlight =
            new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AtomicLong> generations = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    @Inject
    public AnalysisCacheService(
            Clock clock,
            @ConfigProperty(name = "gap-analysis.cache.ttl", defaultValue = "5m") Duration ttl,
            @ConfigProperty(name = "gap-analysis.cache.max-entries", defaultValue = "500")
                    long maxEntries) {
        this(clock, ttl, newCache(clock, maxEntries));
    }

    AnalysisCacheService(Clock clock, Duration ttl, Cache<AnalysisKey, CacheEntry> entries) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be positive, got " + ttl);
        }
        this.clock = clock;
        this.ttl = ttl;
        this.entries = entries;
        LOG.infof("Analysis cache initialized with ttl=%s", ttl);
    }

    static Cache<AnalysisKey, CacheEntry> newCache(Clock clock, long maxEntries) {
        return Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new ClockExpiry(clock))
                .build();
    }

    /**
     * Looks up a non-expired entry.
     *
     * @param key analysis key
     * @return the cached analysis with its age, or empty on a miss
     */
    public Optional<CachedAnalysis> get(AnalysisKey key) {
        CacheEntry entry;
        try {
            entry = read(key);
        } catch (CacheException e) {
            failures.incrementAndGet();
            LOG.warnf(e, "Analysis cache read failed for %s, treating as miss", key);
            misses.incrementAndGet();
            return Optional.empty();
        }

        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }

        Instant now = clock.instant();
        if (!now.isBefore(entry.expiresAt())) {
            LOG.debugf("Analysis cache entry %s expired at %s", key, entry.expiresAt());
            removeIfSame(key, entry);
            misses.incrementAndGet();
            return Optional.empty();
        }

        hits.incrementAndGet();
        return Optional.of(new CachedAnalysis(entry.result(), true, ageOf(entry, now)));
    }

    /**
     * Stores a complete result under the configured TTL. Partial results are ignored.
     *
     * @param key analysis key
     * @param result result to store
     * @return whether the result was stored
     */
    public boolean put(AnalysisKey key, GapAnalysisResultDTO result) {
        return put(key, result, ttl);
    }

    /**
     * Stores a complete result. Partial results are ignored.
     *
     * @param key analysis key
     * @param result result to store
     * @param entryTtl time the entry is served for
     * @return whether the result was stored
     */
    public boolean put(AnalysisKey key, GapAnalysisResultDTO result, Duration entryTtl) {
        return store(key, result, entryTtl) != null;
    }

    /**
     * Removes the entry of a single key.
     *
     * @param key analysis key
     */
    public void invalidate(AnalysisKey key) {
        try {
            entries.invalidate(key);
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            LOG.warnf(e, "Analysis cache invalidation failed for %s", key);
        }
    }

    /**
     * Removes every entry of an entity, whatever its range and options.
     *
     * <p>Computations of the entity that are still running are detached: later callers
     * start a new computation instead of joining them, and their results are not stored.
     *
     * @param entityId entity identifier
     * @return number of removed entries
     */
    public int invalidateEntity(String entityId) {
        long generation = generationCounter(entityId).incrementAndGet();
        inFlight.keySet().removeIf(key -> key.entityId().equals(entityId));

        int removed = 0;
        for (AnalysisKey key : entries.asMap().keySet()) {
            if (key.entityId().equals(entityId) && entries.asMap().remove(key) != null) {
                removed++;
            }
        }
        LOG.infof(
                "Invalidated %d cached analyses of entity %s (generation %d)",
                removed, entityId, generation);
        return removed;
    }

    /**
     * Returns the cached analysis for {@code key} or computes it.
     *
     * <p>Without {@code forceRefresh} a valid entry is returned as is. On a miss the
     * caller either runs {@code loader} or, if another caller is already computing the
     * same key, waits for that computation until {@code deadline}.
     *
     * @param key analysis key
     * @param forceRefresh skip the lookup and recompute
     * @param loader computation of a fresh result
     * @param deadline latest instant to wait for a concurrent computation
     * @return cached or computed analysis
     * @throws AnalysisTimeoutException if waiting for a concurrent computation times out
     */
    public CachedAnalysis getOrCompute(
            AnalysisKey key,
            boolean forceRefresh,
            Supplier<GapAnalysisResultDTO> loader,
            Instant deadline) {
        if (forceRefresh) {
            LOG.debugf("Forced refresh of %s", key);
            return computeAndStore(key, loader, null);
        }

        Optional<CachedAnalysis> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        CompletableFuture<GapAnalysisResultDTO> own = new CompletableFuture<>();
        CompletableFuture<GapAnalysisResultDTO> running = inFlight.putIfAbsent(key, own);
        if (running != null) {
            LOG.debugf("Joining in-flight analysis of %s", key);
            GapAnalysisResultDTO result = await(key, running, deadline);
            return new CachedAnalysis(result, false, Duration.ZERO);
        }

        // A computation may have finished between the lookup and the registration.
        Optional<CachedAnalysis> stored = peek(key);
        if (stored.isPresent()) {
            own.complete(stored.get().result());
            inFlight.remove(key, own);
            return stored.get();
        }

        return computeAndStore(key, loader, own);
    }

    /** Returns the approximate number of stored entries. */
    public long size() {
        return entries.estimatedSize();
    }

    /** Returns the number of computations currently running for waiting callers. */
    public int inFlightCount() {
        return inFlight.size();
    }

    public long hitCount() {
        return hits.get();
    }

    public long missCount() {
        return misses.get();
    }

    public long failureCount() {
        return failures.get();
    }

    public Duration ttl() {
        return ttl;
    }

    private CachedAnalysis computeAndStore(
            AnalysisKey key,
            Supplier<GapAnalysisResultDTO> loader,
            CompletableFuture<GapAnalysisResultDTO> own) {
        long generation = currentGeneration(key.entityId());
        try {
            GapAnalysisResultDTO result = loader.get();
            storeIfCurrent(key, result, generation);
            if (own != null) {
                own.complete(result);
            }
            return CachedAnalysis.fresh(result);
        } catch (RuntimeException | Error e) {
            if (own != null) {
                own.completeExceptionally(e);
            }
            throw e;
        } finally {
            if (own != null) {
                inFlight.remove(key, own);
            }
        }
    }

    private void storeIfCurrent(AnalysisKey key, GapAnalysisResultDTO result, long generation) {
        if (currentGeneration(key.entityId()) != generation) {
            LOG.debugf("Not caching analysis of %s, entity was invalidated during computation", key);
            return;
        }
        CacheEntry entry = store(key, result, ttl);
        // An invalidation between the check and the write must still win.
        if (entry != null && currentGeneration(key.entityId()) != generation) {
            removeIfSame(key, entry);
        }
    }

    private CacheEntry store(AnalysisKey key, GapAnalysisResultDTO result, Duration entryTtl) {
        if (Boolean.TRUE.equals(result.partial())) {
            LOG.debugf("Not caching partial analysis for %s", key);
            return null;
        }

        Instant now = clock.instant();
        CacheEntry entry = new CacheEntry(result, now, now.plus(entryTtl));
        try {
            write(key, entry);
            return entry;
        } catch (CacheException e) {
            failures.incrementAndGet();
            LOG.warnf(e, "Analysis cache write failed for %s, result not cached", key);
            return null;
        }
    }

    private void removeIfSame(AnalysisKey key, CacheEntry entry) {
        try {
            entries.asMap().remove(key, entry);
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            LOG.warnf(e, "Analysis cache removal failed for %s", key);
        }
    }

    private long currentGeneration(String entityId) {
        return generationCounter(entityId).get();
    }

    private AtomicLong generationCounter(String entityId) {
        return generations.computeIfAbsent(entityId, id -> new AtomicLong());
    }

    private Optional<CachedAnalysis> peek(AnalysisKey key) {
        try {
            CacheEntry entry = read(key);
            Instant now = clock.instant();
            if (entry == null || !now.isBefore(entry.expiresAt())) {
                return Optional.empty();
            }
            return Optional.of(new CachedAnalysis(entry.result(), true, ageOf(entry, now)));
        } catch (CacheException e) {
            return Optional.empty();
        }
    }

    private GapAnalysisResultDTO await(
            AnalysisKey key, CompletableFuture<GapAnalysisResultDTO> running, Instant deadline) {
        long remainingMillis = Math.max(0, Duration.between(clock.instant(), deadline).toMillis());
        try {
            return running.get(remainingMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new AnalysisTimeoutException(
                    "Timed out waiting for the running analysis of " + key, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisTimeoutException(
                    "Interrupted while waiting for the running analysis of " + key, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new SomeThingWentWrongException("waiting for the analysis of " + key, cause);
        }
    }

    private CacheEntry read(AnalysisKey key) {
        try {
            return entries.getIfPresent(key);
        } catch (RuntimeException e) {
            throw new CacheException("Cache read failed for " + key, e);
        }
    }

    private void write(AnalysisKey key, CacheEntry entry) {
        try {
            entries.put(key, entry);
        } catch (RuntimeException e) {
            throw new CacheException("Cache write failed for " + key, e);
        }
    }

    private static Duration ageOf(CacheEntry entry, Instant now) {
        Duration age = Duration.between(entry.result().computedAt(), now);
        return age.isNegative() ? Duration.ZERO : age;
    }

    /** Lets Caffeine evict an entry once its own expiry instant has passed. */
    static final class ClockExpiry implements Expiry<AnalysisKey, CacheEntry> {

        private final Clock clock;

        ClockExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(AnalysisKey key, CacheEntry entry, long currentTime) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterUpdate(
                AnalysisKey key, CacheEntry entry, long currentTime, long currentDuration) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterRead(
                AnalysisKey key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(CacheEntry entry) {
            Duration remaining = Duration.between(clock.instant(), entry.expiresAt());
            return remaining.isNegative() ? 0L : remaining.toNanos();
        }
    }
}
