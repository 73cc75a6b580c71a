package com.swing.cache;

import com.swing.indicator.InsufficientHistoryException;
import com.swing.model.IndexSnapshot;
import com.swing.model.PriceSeries;
import com.swing.model.Snapshot;
import com.swing.model.Universe;
import com.swing.model.UniverseEntry;
import com.swing.provider.MarketDataProvider;
import com.swing.provider.ProviderFatalException;
import com.swing.provider.ProviderUnavailableException;
import com.swing.snapshot.SnapshotBuilder;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Sole owner of cache refreshes.
 *
 * <ul>
 *   <li>The periodic timer and stale reads both call {@link #requestRefresh(String)}</li>
 *   <li>At most one pass is in flight; triggers arriving meanwhile get that pass's future</li>
 *   <li>A pass fetches and scores every symbol in parallel, then publishes one generation</li>
 *   <li>Per-symbol failures are contained: transient ones carry the old snapshot over,
 *       permanent ones drop the symbol</li>
 *   <li>A symbol's deadline starts when its task starts running, not when it is queued</li>
 *   <li>A carried-over snapshot older than the carry-over limit is dropped instead</li>
 *   <li>A pass with no fresh data fails and leaves the previous generation in place</li>
 * </ul>
 */
@Service
public class UniverseRefresher {

    private static final Logger log = LoggerFactory.getLogger(UniverseRefresher.class);

    private final UniverseCache cache;
    private final MarketDataProvider provider;
    private final SnapshotBuilder snapshotBuilder;
    private final Universe universe;
    private final Executor computeExecutor;
    private final Clock clock;
    private final int historyDays;
    private final long symbolTimeoutMs;
    private final Duration maxCarryAge;
    private final boolean warmOnStartup;

    /** Runs the refresh passes themselves, one at a time. */
    private final ExecutorService refreshExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "universe-refresh");
        t.setDaemon(true);
        return t;
    });

    private final Object refreshLock = new Object();
    /** Guarded by refreshLock. */
    private CompletableFuture<CacheGeneration> inFlight;

    private final Set<String> reportedFatal = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong(0);
    private final AtomicLong refreshCount = new AtomicLong(0);
    private final AtomicLong failedRefreshCount = new AtomicLong(0);
    private volatile Instant lastAttemptAt;
    private volatile Instant lastSuccessAt;
    private volatile String lastError;

    @Autowired
    public UniverseRefresher(UniverseCache cache,
                             MarketDataProvider provider,
                             SnapshotBuilder snapshotBuilder,
                             Universe universe,
                             @Qualifier("signalComputeExecutor") Executor computeExecutor,
                             Clock clock,
                             @Value("${swing.refresh.history-days:90}") int historyDays,
                             @Value("${swing.refresh.symbol-timeout-ms:30000}") long symbolTimeoutMs,
                             @Value("${swing.refresh.max-carry-age-seconds:1800}") long maxCarryAgeSeconds,
                             @Value("${swing.refresh.warm-on-startup:true}") boolean warmOnStartup) {
        this.cache = cache;
        this.provider = provider;
        this.snapshotBuilder = snapshotBuilder;
        this.universe = universe;
        this.computeExecutor = computeExecutor;
        this.clock = clock;
        this.historyDays = historyDays;
        this.symbolTimeoutMs = symbolTimeoutMs;
        this.maxCarryAge = Duration.ofSeconds(maxCarryAgeSeconds);
        this.warmOnStartup = warmOnStartup;
    }

    /**
     * Current generation for a reader. Triggers a refresh when the cache is empty or
     * stale but never waits for it.
     */
    public Optional<CacheGeneration> read() {
        if (cache.needsRefresh()) {
            requestRefresh("read");
        }
        return cache.current();
    }

    /**
     * Start a refresh pass, or join the one already in flight.
     *
     * @param trigger label for logging ("timer", "read", "startup")
     * @return future completed with the published generation, or exceptionally with
     *         {@link RefreshFailedException}
     */
    public CompletableFuture<CacheGeneration> requestRefresh(String trigger) {
        synchronized (refreshLock) {
            if (inFlight != null) {
                log.debug("Refresh requested by {} coalesced into in-flight pass", trigger);
                return inFlight;
            }
            CompletableFuture<CacheGeneration> future = new CompletableFuture<>();
            inFlight = future;
            try {
                refreshExecutor.execute(() -> runPass(future, trigger));
            } catch (RejectedExecutionException e) {
                inFlight = null;
                future.completeExceptionally(new RefreshFailedException("Refresher is shut down", e));
            }
            return future;
        }
    }

    public boolean isRefreshing() {
        synchronized (refreshLock) {
            return inFlight != null;
        }
    }

    @Scheduled(fixedRateString = "${swing.refresh.interval-ms:120000}",
            initialDelayString = "${swing.refresh.interval-ms:120000}")
    public void scheduledRefresh() {
        requestRefresh("timer");
    }

    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        if (warmOnStartup) {
            log.info("Background pre-fetch triggered on startup for {} symbols", universe.size());
            requestRefresh("startup");
        }
    }

    public RefreshStatus status() {
        boolean refreshing = isRefreshing();
        CacheState state = refreshing ? CacheState.REFRESHING : cache.state();
        return new RefreshStatus(state, refreshing, lastAttemptAt, lastSuccessAt, lastError,
                refreshCount.get(), failedRefreshCount.get());
    }

    public Universe getUniverse() {
        return universe;
    }

    public String dataSource() {
        return provider.description();
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        log.info("Shutdown: waiting for in-flight refresh to finish");
        refreshExecutor.shutdown();
        if (!refreshExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
            log.warn("Refresh did not finish within 10s, interrupting");
            refreshExecutor.shutdownNow();
        }
    }

    private void runPass(CompletableFuture<CacheGeneration> future, String trigger) {
        CacheGeneration published = null;
        Throwable failure = null;
        try {
            published = refreshOnce(trigger);
        } catch (RefreshFailedException e) {
            failure = e;
        } catch (RuntimeException e) {
            failure = recordCrash(trigger, e);
        } catch (Error e) {
            failure = recordCrash(trigger, e);
            throw e;
        } finally {
            synchronized (refreshLock) {
                inFlight = null;
            }
            if (failure == null) {
                future.complete(published);
            } else {
                future.completeExceptionally(failure);
            }
        }
    }

    private RefreshFailedException recordCrash(String trigger, Throwable cause) {
        lastError = "Refresh crashed: " + cause.getMessage();
        failedRefreshCount.incrementAndGet();
        log.error("Refresh started by {} crashed", trigger, cause);
        return new RefreshFailedException(lastError, cause);
    }

    CacheGeneration refreshOnce(String trigger) {
        Instant builtAt = Instant.now(clock);
        lastAttemptAt = builtAt;
        long started = System.nanoTime();
        log.info("Refresh started by {}: {} symbols", trigger, universe.size());

        CacheGeneration previous = cache.current().orElse(null);

        List<CompletableFuture<SymbolOutcome>> pending = new ArrayList<>();
        for (UniverseEntry entry : universe.getEntries()) {
            pending.add(withDeadline(() -> computeSymbol(entry, builtAt),
                    SymbolOutcome.unavailable(entry, "timed out after " + symbolTimeoutMs + "ms")));
        }
        CompletableFuture<IndexSnapshot> indexFuture = withDeadline(() -> fetchIndex(previous, builtAt),
                carriedIndex(previous, builtAt));

        Map<String, Snapshot> snapshots = new LinkedHashMap<>();
        List<String> omitted = new ArrayList<>();
        int fresh = 0;
        int carried = 0;
        for (CompletableFuture<SymbolOutcome> f : pending) {
            SymbolOutcome outcome = f.join();
            String symbol = outcome.entry().symbol();
            switch (outcome.status()) {
                case FRESH:
                    snapshots.put(symbol, outcome.snapshot());
                    fresh++;
                    break;
                case UNAVAILABLE:
                    Optional<Snapshot> old = previous == null ? Optional.empty() : previous.find(symbol);
                    Duration carryAge = old.map(o -> Duration.between(o.asOf(), builtAt)).orElse(Duration.ZERO);
                    if (old.isPresent() && carryAge.compareTo(maxCarryAge) <= 0) {
                        snapshots.put(symbol, old.get().markStale());
                        carried++;
                        log.warn("[{}] Provider unavailable ({}), carrying over snapshot from {} ({}s old)",
                                symbol, outcome.error(), old.get().asOf(), carryAge.getSeconds());
                    } else if (old.isPresent()) {
                        omitted.add(symbol);
                        log.warn("[{}] Provider unavailable ({}), last snapshot is {}s old, dropping it",
                                symbol, outcome.error(), carryAge.getSeconds());
                    } else {
                        omitted.add(symbol);
                        log.warn("[{}] Provider unavailable ({}), no earlier snapshot to carry over",
                                symbol, outcome.error());
                    }
                    break;
                case FATAL:
                    omitted.add(symbol);
                    if (reportedFatal.add(symbol)) {
                        log.warn("[{}] Excluded from universe: {}", symbol, outcome.error());
                    }
                    break;
            }
        }

        if (fresh == 0) {
            String message = "No fresh data for any of " + universe.size() + " symbols";
            lastError = message;
            failedRefreshCount.incrementAndGet();
            log.error("Refresh failed: {}; keeping generation {}", message,
                    previous == null ? "<none>" : String.valueOf(previous.sequence()));
            throw new RefreshFailedException(message);
        }

        CacheGeneration generation = new CacheGeneration(sequence.incrementAndGet(), snapshots,
                indexFuture.join(), builtAt, fresh, carried, omitted);
        cache.publish(generation);
        lastSuccessAt = builtAt;
        lastError = null;
        refreshCount.incrementAndGet();

        log.info("Published generation #{}: fresh={} carried={} omitted={} in {}ms",
                generation.sequence(), fresh, carried, omitted.size(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return generation;
    }

    /**
     * Runs {@code work} on the compute pool. The deadline is armed when the task starts,
     * so time spent queued behind other symbols does not count against it.
     */
    private <T> CompletableFuture<T> withDeadline(Supplier<T> work, T onTimeout) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            computeExecutor.execute(() -> {
                result.completeOnTimeout(onTimeout, symbolTimeoutMs, TimeUnit.MILLISECONDS);
                try {
                    result.complete(work.get());
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new RefreshFailedException("Compute pool rejected work", e));
        }
        return result;
    }

    private SymbolOutcome computeSymbol(UniverseEntry entry, Instant builtAt) {
        try {
            PriceSeries series = provider.fetchDaily(entry.symbol(), historyDays);
            return SymbolOutcome.fresh(entry, snapshotBuilder.build(entry, series, builtAt));
        } catch (ProviderFatalException e) {
            return SymbolOutcome.fatal(entry, e.getMessage());
        } catch (ProviderUnavailableException | InsufficientHistoryException e) {
            return SymbolOutcome.unavailable(entry, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("[{}] Unexpected failure while computing snapshot", entry.symbol(), e);
            return SymbolOutcome.unavailable(entry, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private IndexSnapshot fetchIndex(CacheGeneration previous, Instant builtAt) {
        String indexSymbol = universe.getIndexSymbol();
        try {
            PriceSeries series = provider.fetchDaily(indexSymbol, 10);
            if (!series.isEmpty()) {
                return IndexSnapshot.fromSeries(series, builtAt);
            }
            log.warn("Index {} returned no bars", indexSymbol);
        } catch (RuntimeException e) {
            log.warn("Index {} fetch failed: {}", indexSymbol, e.getMessage());
        }
        return carriedIndex(previous, builtAt);
    }

    private IndexSnapshot carriedIndex(CacheGeneration previous, Instant builtAt) {
        if (previous != null && previous.index() != null && previous.index().available()) {
            return previous.index();
        }
        return IndexSnapshot.unavailable(universe.getIndexSymbol(), builtAt);
    }

    /**
     * Result of fetching and scoring one symbol.
     */
    record SymbolOutcome(UniverseEntry entry, Status status, Snapshot snapshot, String error) {

        enum Status { FRESH, UNAVAILABLE, FATAL }

        static SymbolOutcome fresh(UniverseEntry entry, Snapshot snapshot) {
            return new SymbolOutcome(entry, Status.FRESH, snapshot, null);
        }

        static SymbolOutcome unavailable(UniverseEntry entry, String error) {
            return new SymbolOutcome(entry, Status.UNAVAILABLE, null, error);
        }

        static SymbolOutcome fatal(UniverseEntry entry, String error) {
            return new SymbolOutcome(entry, Status.FATAL, null, error);
        }
    }
}
