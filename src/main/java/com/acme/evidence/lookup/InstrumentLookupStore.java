/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence.lookup;

import com.acme.evidence.util.ScoreUtil;
import com.acme.evidence.util.TextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves disease-specific instrument scores through three tiers:
 * <ol>
 *   <li>{@link ResolutionState#STATIC} the built-in table, answered when at least two
 *       distinct instruments match the endpoint labels;</li>
 *   <li>{@link ResolutionState#CACHE} a fresh entry in the injected {@link InstrumentCache};</li>
 *   <li>{@link ResolutionState#FETCH} the {@link InstrumentFetcher}, whose result is cached.</li>
 * </ol>
 * Only one fetch per disease key runs at a time; concurrent callers share its result.
 * Fetch failures and timeouts degrade to an empty mapping that is cached for the
 * negative TTL.
 */
public class InstrumentLookupStore {
    private static final Logger log = LoggerFactory.getLogger(InstrumentLookupStore.class);

    public static final Duration DEFAULT_TTL = Duration.ofDays(90);
    public static final Duration DEFAULT_NEGATIVE_TTL = Duration.ofDays(1);
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(30);
    public static final int STATIC_MATCH_THRESHOLD = 2;

    private final StaticInstrumentTable staticTable;
    private final InstrumentCache cache;
    private final InstrumentFetcher fetcher;
    private final Clock clock;
    private final Duration ttl;
    private final Duration negativeTtl;
    private final Duration fetchTimeout;
    private final Executor fetchExecutor;
    private final ConcurrentHashMap<String, CompletableFuture<Map<String, Double>>> inFlight = new ConcurrentHashMap<>();

    public InstrumentLookupStore(StaticInstrumentTable staticTable, InstrumentCache cache, InstrumentFetcher fetcher,
                                 Clock clock, Duration ttl, Duration negativeTtl,
                                 Duration fetchTimeout, Executor fetchExecutor) {
        this.staticTable = Objects.requireNonNull(staticTable, "staticTable");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.fetcher = fetcher == null ? InstrumentFetcher.NONE : fetcher;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.negativeTtl = Objects.requireNonNull(negativeTtl, "negativeTtl");
        this.fetchTimeout = Objects.requireNonNull(fetchTimeout, "fetchTimeout");
        this.fetchExecutor = Objects.requireNonNull(fetchExecutor, "fetchExecutor");
    }

    public LookupResult lookup(String disease, Collection<String> endpointLabels) {
        Collection<String> labels = endpointLabels == null ? List.of() : endpointLabels;
        Map<String, Double> staticMatches = staticTable.match(disease, labels);
        if (staticMatches.size() >= STATIC_MATCH_THRESHOLD || TextUtil.isBlank(disease)) {
            return new LookupResult(staticMatches, ResolutionState.STATIC);
        }

        String key = TextUtil.normalizeKey(disease);
        Optional<CachedInstruments> cached = freshEntry(key);
        if (cached.isPresent()) {
            log.debug("Instrument cache hit for '{}' ({} instruments)", key, cached.get().instruments().size());
            return new LookupResult(merge(staticMatches, cached.get().instruments()), ResolutionState.CACHE);
        }

        Map<String, Double> fetched = fetchOnce(key, disease);
        return new LookupResult(merge(staticMatches, fetched), ResolutionState.FETCH);
    }

    /** Number of fetches currently running; exposed for monitoring and tests. */
    public int inFlightCount() { return inFlight.size(); }

    private Optional<CachedInstruments> freshEntry(String key) {
        return cache.get(key).filter(e -> e.isFresh(clock.instant(), ttl, negativeTtl));
    }

    private Map<String, Double> fetchOnce(String key, String disease) {
        CompletableFuture<Map<String, Double>> mine = new CompletableFuture<>();
        CompletableFuture<Map<String, Double>> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            log.debug("Waiting on in-flight instrument fetch for '{}'", key);
            return running.join();
        }
        try {
            // a fetch for this key may have completed between the cache check and putIfAbsent
            Optional<CachedInstruments> cached = freshEntry(key);
            Map<String, Double> result = cached.isPresent() ? cached.get().instruments() : fetchAndStore(key, disease);
            mine.complete(result);
            return result;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private Map<String, Double> fetchAndStore(String key, String disease) {
        log.info("Fetching instruments for disease '{}'", disease);
        try {
            Map<String, Double> fetched = CompletableFuture
                    .supplyAsync(() -> callFetcher(disease), fetchExecutor)
                    .get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
            Map<String, Double> clean = sanitize(fetched);
            if (clean.isEmpty()) {
                log.debug("Instrument fetch for '{}' returned nothing; caching negative result", disease);
                cache.put(key, CachedInstruments.failed(clock.instant()));
            } else {
                cache.put(key, CachedInstruments.of(clean, clock.instant()));
            }
            return clean;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Instrument fetch for '{}' interrupted", disease);
            return Map.of();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause() : e.getCause();
            log.warn("Instrument fetch for '{}' failed: {}", disease, String.valueOf(cause));
        } catch (TimeoutException e) {
            log.warn("Instrument fetch for '{}' timed out after {}", disease, fetchTimeout);
        }
        cache.put(key, CachedInstruments.failed(clock.instant()));
        return Map.of();
    }

    private Map<String, Double> callFetcher(String disease) {
        try {
            return fetcher.fetchInstruments(disease);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    /** Drops blank names and scores that are not finite; clamps scores to [1,10]. */
    private static Map<String, Double> sanitize(Map<String, Double> fetched) {
        Map<String, Double> out = new LinkedHashMap<>();
        if (fetched == null) return out;
        for (Map.Entry<String, Double> e : fetched.entrySet()) {
            if (TextUtil.isBlank(e.getKey()) || e.getValue() == null || !Double.isFinite(e.getValue())) continue;
            out.put(e.getKey(), ScoreUtil.clampScore(e.getValue()));
        }
        return out;
    }

    private static Map<String, Double> merge(Map<String, Double> staticMatches, Map<String, Double> resolved) {
        Map<String, Double> out = new LinkedHashMap<>(staticMatches);
        resolved.forEach(out::putIfAbsent);
        return out;
    }
}
