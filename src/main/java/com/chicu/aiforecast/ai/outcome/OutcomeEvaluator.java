package com.chicu.aiforecast.ai.outcome;

import com.chicu.aiforecast.ai.guard.AuditReport;
import com.chicu.aiforecast.ai.guard.TemporalIntegrityGuard;
import com.chicu.aiforecast.common.exception.MarketDataUnavailableException;
import com.chicu.aiforecast.common.exception.TemporalIntegrityViolationException;
import com.chicu.aiforecast.common.time.Timeframe;
import com.chicu.aiforecast.ledger.PredictionLedger;
import com.chicu.aiforecast.ledger.PredictionOutcome;
import com.chicu.aiforecast.ledger.PredictionRecord;
import com.chicu.aiforecast.ledger.PredictionState;
import com.chicu.aiforecast.market.MarketDataProvider;
import com.chicu.aiforecast.market.PricePoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
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
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Вторая фаза конвейера: считает фактические исходы созревших прогнозов.
 * Прогноз не меняется никогда; исход пишется отдельной строкой, один на (прогноз, горизонт).
 * Повторный прогон безопасен: уже существующий исход: просто пропуск.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutcomeEvaluator {

    private static final int MAX_ERRORS_IN_REPORT = 100;

    private final PredictionLedger ledger;
    private final TemporalIntegrityGuard guard;
    private final MarketDataProvider marketData;
    private final EvaluationProperties props;
    private final Clock clock;
    @Qualifier("evaluationExecutor")
    private final ExecutorService executor;

    public EvaluationReport evaluatePending() {
        Instant startedAt = clock.instant();

        AuditReport audit = guard.requireNoCritical("evaluation");
        Set<String> quarantined = audit.quarantinedPredictionIds();

        Instant now = clock.instant();
        List<Timeframe> horizons = props.horizonFrames();
        List<PredictionState> due = ledger.pendingDue(now.minus(props.getMinDelay()), props.getBatchSize());

        Tally tally = new Tally();
        Map<String, List<PredictionState>> bySymbol = new LinkedHashMap<>();
        for (PredictionState st : due) {
            if (quarantined.contains(st.getPredictionId())) {
                tally.quarantined.incrementAndGet();
                continue;
            }
            bySymbol.computeIfAbsent(st.getSymbol(), k -> new ArrayList<>()).add(st);
        }

        log.info("🧩 EVAL START candidates={} symbols={} quarantined={} horizons={}",
                due.size(), bySymbol.size(), tally.quarantined.get(), props.getHorizons());

        Map<String, Future<?>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, List<PredictionState>> e : bySymbol.entrySet()) {
            futures.put(e.getKey(), executor.submit(() -> evaluateSymbol(e.getKey(), e.getValue(), horizons, now, tally)));
        }

        // задачи стоят в очереди по parallelism штук, поэтому общий бюджет ожидания растёт с числом "волн"
        int waves = (int) Math.ceil((double) Math.max(1, futures.size()) / Math.max(1, props.getParallelism()));
        long budgetNanos = props.getSymbolTimeout().multipliedBy(waves).plusSeconds(1).toNanos();
        long deadline = System.nanoTime() + budgetNanos;

        for (Map.Entry<String, Future<?>> e : futures.entrySet()) {
            String symbol = e.getKey();
            Future<?> f = e.getValue();
            try {
                f.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException ex) {
                f.cancel(true);
                tally.timedOut.add(symbol);
                log.warn("⚠️ EVAL symbol={} timed out, predictions stay PENDING", symbol);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                futures.values().forEach(x -> x.cancel(true));
                log.warn("⚠️ EVAL interrupted, written outcomes are kept");
                break;
            } catch (CancellationException ex) {
                tally.timedOut.add(symbol);
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                tally.failed.incrementAndGet();
                tally.error(symbol, cause.toString());
                log.error("❌ EVAL symbol={} task failed: {}", symbol, cause.getMessage(), cause);
            }
        }

        TemporalIntegrityViolationException halt = tally.halt.get();
        if (halt != null) {
            log.error("❌ EVAL halted by integrity violation: {}", halt.getMessage());
            throw halt;
        }

        EvaluationReport report = tally.toReport(startedAt, clock.instant(), due.size());
        log.info("✅ EVAL DONE evaluated={} outcomes={} already={} notDue={} deferred={} expired={} failed={} timedOut={}",
                report.evaluatedPredictions(), report.outcomesWritten(), report.alreadyEvaluated(),
                report.skippedNotDue(), report.deferred(), report.expired(), report.failed(),
                report.timedOutSymbols());
        return report;
    }

    // =========================================================
    // per symbol
    // =========================================================

    private void evaluateSymbol(String symbol, List<PredictionState> states, List<Timeframe> horizons,
                                Instant now, Tally tally) {
        long deadline = System.nanoTime() + props.getSymbolTimeout().toNanos();

        for (PredictionState st : states) {
            if (Thread.currentThread().isInterrupted() || tally.halt.get() != null) return;
            if (System.nanoTime() > deadline) {
                tally.timedOut.add(symbol);
                log.warn("⚠️ EVAL symbol={} ran out of time, rest stays PENDING", symbol);
                return;
            }
            try {
                evaluateOne(st, horizons, now, deadline, tally);
            } catch (TemporalIntegrityViolationException e) {
                tally.halt.compareAndSet(null, e);
                return;
            } catch (SymbolTimeout e) {
                tally.timedOut.add(symbol);
                log.warn("⚠️ EVAL symbol={} ran out of time at prediction={}", symbol, st.getPredictionId());
                return;
            } catch (CancellationException e) {
                return;
            } catch (RuntimeException e) {
                tally.failed.incrementAndGet();
                tally.error(st.getPredictionId(), e.toString());
                log.warn("⚠️ EVAL prediction={} failed: {}", st.getPredictionId(), e.toString());
            }
        }
    }

    private void evaluateOne(PredictionState st, List<Timeframe> horizons, Instant now, long deadline, Tally tally) {
        String id = st.getPredictionId();
        Optional<PredictionRecord> found = ledger.find(id);
        if (found.isEmpty()) {
            throw new IllegalStateException("state without prediction id=" + id);
        }
        PredictionRecord p = found.get();
        Instant ts = p.getPredictionTimestamp();

        boolean complete = true;
        MarketDataUnavailableException missing = null;
        boolean expire = false;
        PricePoint entry = null;

        for (Timeframe h : horizons) {
            Instant exitAt = ts.plus(h.toDuration());
            if (exitAt.isAfter(now)) {
                tally.notDue.incrementAndGet();
                complete = false;
                continue;
            }
            if (ledger.hasOutcome(id, h.getCode())) {
                tally.already.incrementAndGet();
                continue;
            }

            try {
                if (entry == null) entry = fetchWithRetry(p.getSymbol(), ts, deadline);
                PricePoint exit = fetchWithRetry(p.getSymbol(), exitAt, deadline);

                double ret = ReturnCalculator.returnPct(entry.close(), exit.close());
                PredictionOutcome outcome = PredictionOutcome.builder()
                        .outcomeId(UUID.randomUUID().toString())
                        .predictionId(id)
                        .horizon(h.getCode())
                        .entryPrice(entry.close())
                        .exitPrice(exit.close())
                        .entryAt(ts)
                        .exitAt(exitAt)
                        .actualReturnPct(ret)
                        .actualDirection(ReturnCalculator.direction(ret))
                        .evaluationTimestamp(now)
                        .build();

                if (ledger.appendOutcome(outcome)) {
                    tally.written.incrementAndGet();
                } else {
                    tally.already.incrementAndGet();
                }
            } catch (MarketDataUnavailableException e) {
                complete = false;
                missing = e;
                if (Duration.between(exitAt, now).compareTo(props.getExpireAfter()) >= 0) {
                    expire = true;
                }
            }
        }

        if (complete) {
            if (ledger.markEvaluated(id)) {
                tally.evaluated.incrementAndGet();
            }
            return;
        }
        if (missing == null) {
            // просто ещё не все горизонты наступили
            return;
        }

        ledger.recordFailure(id, missing.getMessage());
        if (expire) {
            ledger.markExpired(id);
            tally.expired.incrementAndGet();
            log.warn("⚠️ EVAL prediction={} symbol={} EXPIRED: {}", id, p.getSymbol(), missing.getMessage());
        } else {
            tally.deferred.incrementAndGet();
            log.debug("🧩 EVAL prediction={} deferred: {}", id, missing.getMessage());
        }
    }

    /**
     * Ограниченный повтор с экспоненциальной паузой. Пауза обрезается по дедлайну символа.
     */
    private PricePoint fetchWithRetry(String symbol, Instant at, long deadline) {
        int attempts = Math.max(1, props.getMaxAttempts());
        long backoffMs = Math.max(0L, props.getInitialBackoff().toMillis());
        MarketDataUnavailableException last = null;

        for (int i = 1; i <= attempts; i++) {
            if (System.nanoTime() > deadline) throw new SymbolTimeout();
            try {
                return marketData.closeAt(symbol, at);
            } catch (MarketDataUnavailableException e) {
                last = e;
                if (i == attempts) break;
                long left = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (left <= 0) throw new SymbolTimeout();
                sleep(Math.min(backoffMs, left));
                backoffMs = backoffMs * 2;
            }
        }
        throw last;
    }

    private static void sleep(long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("evaluation interrupted");
        }
    }

    private static final class SymbolTimeout extends RuntimeException {
        SymbolTimeout() {
            super("symbol timeout", null, false, false);
        }
    }

    private static final class Tally {
        final AtomicInteger evaluated = new AtomicInteger();
        final AtomicInteger written = new AtomicInteger();
        final AtomicInteger notDue = new AtomicInteger();
        final AtomicInteger already = new AtomicInteger();
        final AtomicInteger deferred = new AtomicInteger();
        final AtomicInteger expired = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();
        final AtomicInteger quarantined = new AtomicInteger();
        final List<String> timedOut = new CopyOnWriteArrayList<>();
        final Map<String, String> errors = new ConcurrentHashMap<>();
        final AtomicReference<TemporalIntegrityViolationException> halt = new AtomicReference<>();

        void error(String key, String message) {
            if (errors.size() < MAX_ERRORS_IN_REPORT) errors.put(key, message);
        }

        EvaluationReport toReport(Instant startedAt, Instant finishedAt, int candidates) {
            return EvaluationReport.builder()
                    .startedAt(startedAt)
                    .finishedAt(finishedAt)
                    .candidates(candidates)
                    .evaluatedPredictions(evaluated.get())
                    .outcomesWritten(written.get())
                    .skippedNotDue(notDue.get())
                    .alreadyEvaluated(already.get())
                    .deferred(deferred.get())
                    .expired(expired.get())
                    .failed(failed.get())
                    .quarantined(quarantined.get())
                    .timedOutSymbols(timedOut.stream().distinct().toList())
                    .errors(errors)
                    .build();
        }
    }
}
