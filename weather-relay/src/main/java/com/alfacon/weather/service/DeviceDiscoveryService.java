package com.alfacon.weather.service;

import com.alfacon.weather.config.WeatherRelayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Finds which candidate devices currently exist on the platform.
 *
 * Every candidate is probed on a pool capped at discovery.concurrency threads.
 * Results are read only after all probes have been joined, and only membership is kept,
 * so the answer does not depend on which probe finished first.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeviceDiscoveryService {

    private final DeviceProbe deviceProbe;
    private final WeatherRelayProperties properties;

    /**
     * @param candidates identifiers to probe, in enumeration order
     * @return reachable identifiers in natural order; empty if none answered
     * @throws InterruptedException if the run is cancelled; unfinished probes are cancelled
     *                              and no partial result is returned
     */
    public SortedSet<String> discover(List<String> candidates) throws InterruptedException {
        if (candidates.isEmpty()) {
            return Collections.emptySortedSet();
        }

        int concurrency = Math.min(properties.getDiscovery().getConcurrency(), candidates.size());
        log.info("Probing {} candidate devices ({} concurrent)", candidates.size(), concurrency);

        ExecutorService pool = Executors.newFixedThreadPool(concurrency, namedThreads("probe"));
        try {
            List<Callable<Boolean>> probes = new ArrayList<>(candidates.size());
            for (String id : candidates) {
                probes.add(() -> safeProbe(id));
            }

            // invokeAll returns only once every probe has completed
            List<Future<Boolean>> results = pool.invokeAll(probes);

            SortedSet<String> reachable = new TreeSet<>();
            for (int i = 0; i < candidates.size(); i++) {
                if (isTrue(results.get(i), candidates.get(i))) {
                    reachable.add(candidates.get(i));
                }
            }

            log.info("Discovery complete: {}/{} devices reachable", reachable.size(), candidates.size());
            return Collections.unmodifiableSortedSet(reachable);

        } finally {
            pool.shutdownNow();
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private boolean safeProbe(String id) {
        try {
            return deviceProbe.probe(id);
        } catch (RuntimeException e) {
            log.debug("Probe for {} threw, treating as unreachable: {}", id, e.getMessage());
            return false;
        }
    }

    private boolean isTrue(Future<Boolean> future, String id) throws InterruptedException {
        try {
            return Boolean.TRUE.equals(future.get());
        } catch (ExecutionException e) {
            log.debug("Probe for {} failed, treating as unreachable: {}", id, e.getCause().getMessage());
            return false;
        }
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
