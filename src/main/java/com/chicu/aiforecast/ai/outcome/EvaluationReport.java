package com.chicu.aiforecast.ai.outcome;

import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Итог прогона оценщика: сколько оценено, сколько пропущено и почему.
 *
 * @param evaluatedPredictions прогнозы, перешедшие в EVALUATED в этом прогоне
 * @param skippedNotDue        горизонты, время которых ещё не наступило
 * @param alreadyEvaluated     горизонты, у которых исход уже был (повторный прогон)
 * @param deferred             прогнозы без рыночных данных, повтор в следующем прогоне
 * @param quarantined          прогнозы, пропущенные из-за карантина аудита
 */
@Builder
public record EvaluationReport(
        Instant startedAt,
        Instant finishedAt,
        int candidates,
        int evaluatedPredictions,
        int outcomesWritten,
        int skippedNotDue,
        int alreadyEvaluated,
        int deferred,
        int expired,
        int failed,
        int quarantined,
        List<String> timedOutSymbols,
        Map<String, String> errors
) {
    public EvaluationReport {
        timedOutSymbols = timedOutSymbols == null ? List.of() : List.copyOf(timedOutSymbols);
        errors = errors == null ? Map.of() : Map.copyOf(errors);
    }

    /** count_evaluated */
    public int countEvaluated() {
        return evaluatedPredictions;
    }
}
