package com.chicu.aiforecast.ai.guard;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Builder
public record AuditReport(
        Instant auditedAt,
        AuditWindow window,
        int predictionsChecked,
        int outcomesChecked,
        List<Violation> violations
) {
    public AuditReport {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    /**
     * Пройден, если нет ни критичных, ни карантинных находок. Предупреждения не валят аудит.
     */
    @JsonProperty("passed")
    public boolean passed() {
        return violations.stream().allMatch(v -> v.severity() == Severity.WARNING);
    }

    @JsonProperty("hasCritical")
    public boolean hasCritical() {
        return violations.stream().anyMatch(v -> v.severity() == Severity.CRITICAL);
    }

    public List<Violation> critical() {
        return violations.stream().filter(v -> v.severity() == Severity.CRITICAL).toList();
    }

    public Set<String> quarantinedPredictionIds() {
        Set<String> out = new LinkedHashSet<>();
        for (Violation v : violations) {
            if (v.severity() == Severity.HIGH && v.predictionId() != null) out.add(v.predictionId());
        }
        return out;
    }

    public Set<String> quarantinedOutcomeIds() {
        Set<String> out = new LinkedHashSet<>();
        for (Violation v : violations) {
            if (v.severity() == Severity.HIGH && v.outcomeId() != null) out.add(v.outcomeId());
        }
        return out;
    }

    public Map<Severity, Long> countsBySeverity() {
        Map<Severity, Long> m = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) m.put(s, 0L);
        for (Violation v : violations) m.merge(v.severity(), 1L, Long::sum);
        return m;
    }
}
