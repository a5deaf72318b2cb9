package com.alfacon.weather.service;

import com.alfacon.weather.config.WeatherRelayProperties;
import com.alfacon.weather.model.DeliveryOutcome;
import com.alfacon.weather.model.DispatchTally;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Pushes one value to a list of devices in fixed-size batches.
 *
 * Batches run concurrently (dispatch.concurrency, default 3); inside a batch devices are
 * written one after another with a short pause to stay under the platform's rate limit.
 * Each batch returns its own tally and tallies are summed after join, so no counter is shared.
 * A batch that throws or does not finish within dispatch.phase-timeout counts all of its
 * devices as failed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeviceDispatchService {

    private final DevicePush devicePush;
    private final WeatherRelayProperties properties;

    public DispatchTally dispatch(List<String> devices, double value) throws InterruptedException {
        if (devices.isEmpty()) {
            return DispatchTally.EMPTY;
        }

        List<List<String>> batches = partition(devices, properties.getDispatch().getBatchSize());
        int concurrency = Math.min(properties.getDispatch().getConcurrency(), batches.size());
        log.info("Dispatching {} to {} devices in {} batches ({} concurrent)",
                value, devices.size(), batches.size(), concurrency);

        ExecutorService pool = Executors.newFixedThreadPool(concurrency, DeviceDiscoveryService.namedThreads("dispatch"));
        try {
            List<Callable<DispatchTally>> tasks = new ArrayList<>(batches.size());
            for (int i = 0; i < batches.size(); i++) {
                int batchNo = i + 1;
                List<String> batch = batches.get(i);
                tasks.add(() -> processBatch(batchNo, batch, value));
            }

            long timeoutMs = properties.getDispatch().getPhaseTimeout().toMillis();
            List<Future<DispatchTally>> futures = pool.invokeAll(tasks, timeoutMs, TimeUnit.MILLISECONDS);

            DispatchTally total = DispatchTally.EMPTY;
            for (int i = 0; i < futures.size(); i++) {
                total = total.plus(collect(futures.get(i), i + 1, batches.get(i)));
            }

            log.info("Dispatch complete: {} delivered, {} failed, {} not found",
                    total.delivered(), total.failed(), total.notFound());
            return total;

        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Contiguous slices of at most batchSize, in the order given.
     */
    static List<List<String>> partition(List<String> devices, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1, was " + batchSize);
        }
        List<List<String>> batches = new ArrayList<>();
        for (int i = 0; i < devices.size(); i += batchSize) {
            batches.add(List.copyOf(devices.subList(i, Math.min(i + batchSize, devices.size()))));
        }
        return batches;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private DispatchTally processBatch(int batchNo, List<String> batch, double value) throws InterruptedException {
        log.debug("Batch {} started ({} devices)", batchNo, batch.size());
        long delayMs = properties.getDispatch().getInterDeviceDelayMs();

        DispatchTally tally = DispatchTally.EMPTY;
        for (int i = 0; i < batch.size(); i++) {
            if (i > 0 && delayMs > 0) {
                Thread.sleep(delayMs);
            }
            DeliveryOutcome outcome = devicePush.push(batch.get(i), value);
            tally = tally.record(outcome);
        }

        log.debug("Batch {} done: {}", batchNo, tally);
        return tally;
    }

    private DispatchTally collect(Future<DispatchTally> future, int batchNo, List<String> batch)
            throws InterruptedException {
        try {
            return future.get();
        } catch (CancellationException e) {
            log.warn("Batch {} did not finish in time, counting {} devices as failed", batchNo, batch.size());
            return DispatchTally.allFailed(batch.size());
        } catch (ExecutionException e) {
            log.warn("Batch {} aborted ({}), counting {} devices as failed",
                    batchNo, e.getCause().toString(), batch.size());
            return DispatchTally.allFailed(batch.size());
        }
    }
}
