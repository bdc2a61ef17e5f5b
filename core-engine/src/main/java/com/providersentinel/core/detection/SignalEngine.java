package com.providersentinel.core.detection;

import com.providersentinel.core.model.SignalHit;
import com.providersentinel.core.model.SignalKind;
import com.providersentinel.core.resolve.ResolvedDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every configured detector concurrently over one frozen dataset.
 *
 * <p>
 * Each detector is one task on a fixed-size worker pool. {@link #run} is a
 * barrier: it returns only once every task has finished. A detector that
 * throws is logged and reported in {@link EngineResult#getFailedSignals()};
 * the other detectors still complete and their hits are kept.
 * </p>
 *
 * @since 1.0.0
 */
public class SignalEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SignalEngine.class);

    private final List<SignalDetector> detectors;
    private final int threads;

    /**
     * @param detectors detectors to run, at most one per kind
     * @param threads   worker pool size, at least 1
     * @throws IllegalArgumentException if {@code threads < 1} or two detectors
     *                                  share a kind
     */
    public SignalEngine(List<SignalDetector> detectors, int threads) {
        Objects.requireNonNull(detectors, "detectors must not be null");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got: " + threads);
        }
        Map<SignalKind, SignalDetector> byKind = new EnumMap<>(SignalKind.class);
        for (SignalDetector detector : detectors) {
            if (byKind.put(detector.getKind(), detector) != null) {
                throw new IllegalArgumentException("More than one detector for signal kind '"
                        + detector.getKind().getId() + "'");
            }
        }
        this.detectors = List.copyOf(byKind.values());
        this.threads = threads;
    }

    /**
     * Run all detectors and wait for every one of them.
     *
     * @param dataset the frozen resolved dataset
     * @return hits per kind plus the failed kinds
     * @throws IllegalStateException if the calling thread is interrupted while
     *                               waiting
     */
    public EngineResult run(ResolvedDataset dataset) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        LOG.info("Running {} detector(s) on {} thread(s)", detectors.size(), threads);

        ExecutorService pool = Executors.newFixedThreadPool(
                Math.min(threads, Math.max(1, detectors.size())), new DetectorThreadFactory());
        Map<SignalDetector, Future<TimedHits>> futures = new LinkedHashMap<>();
        try {
            for (SignalDetector detector : detectors) {
                futures.put(detector, pool.submit(() -> {
                    long start = System.nanoTime();
                    List<SignalHit> hits = detector.detect(dataset);
                    return new TimedHits(hits, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
                }));
            }

            Map<SignalKind, List<SignalHit>> hitsByKind = new EnumMap<>(SignalKind.class);
            Map<SignalKind, Long> millis = new EnumMap<>(SignalKind.class);
            List<SignalKind> failed = new ArrayList<>();
            for (Map.Entry<SignalDetector, Future<TimedHits>> e : futures.entrySet()) {
                SignalDetector detector = e.getKey();
                try {
                    TimedHits result = e.getValue().get();
                    hitsByKind.put(detector.getKind(), result.hits);
                    millis.put(detector.getKind(), result.millis);
                    LOG.info("Detector [{}] produced {} hit(s) in {} ms",
                            detector.getRuleName(), result.hits.size(), result.millis);
                } catch (ExecutionException ex) {
                    failed.add(detector.getKind());
                    LOG.error("Detector [{}] failed; continuing without '{}' signals",
                            detector.getRuleName(), detector.getKind().getId(), ex.getCause());
                }
            }
            return new EngineResult(hitsByKind, failed, millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for detectors", e);
        } finally {
            pool.shutdownNow();
        }
    }

    public List<SignalDetector> getDetectors() {
        return detectors;
    }

    private static final class TimedHits {

        private final List<SignalHit> hits;
        private final long millis;

        TimedHits(List<SignalHit> hits, long millis) {
            this.hits = Objects.requireNonNull(hits, "Detector returned null hits");
            this.millis = millis;
        }
    }

    private static final class DetectorThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "signal-detector-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
