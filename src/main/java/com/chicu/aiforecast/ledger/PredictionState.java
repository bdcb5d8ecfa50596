package com.chicu.aiforecast.ledger;

import com.chicu.aiforecast.common.enums.PredictionStatus;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Состояние жизненного цикла прогноза. Живёт отдельно от неизменяемой записи прогноза,
 * чтобы оценщик мог двигать статус, не касаясь самого прогноза.
 */
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Entity
@Table(
        name = "prediction_state",
        indexes = {
                @Index(name = "ix_state_status_ts", columnList = "status,prediction_timestamp")
        }
)
public class PredictionState {

    @Id
    @Column(name = "prediction_id", nullable = false, updatable = false, length = 36)
    private String predictionId;

    @Column(name = "symbol", nullable = false, updatable = false, length = 32)
    private String symbol;

    @Column(name = "prediction_timestamp", nullable = false, updatable = false)
    private Instant predictionTimestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PredictionStatus status;

    @Column(name = "failed_attempts", nullable = false)
    private int failedAttempts;

    @Column(name = "first_failure_at")
    private Instant firstFailureAt;

    @Column(name = "last_error", length = 512)
    private String lastError;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    public static PredictionState pending(PredictionRecord p, Instant now) {
        return PredictionState.builder()
                .predictionId(p.getPredictionId())
                .symbol(p.getSymbol())
                .predictionTimestamp(p.getPredictionTimestamp())
                .status(PredictionStatus.PENDING)
                .failedAttempts(0)
                .updatedAt(now)
                .build();
    }

    /**
     * @return false, если прогноз уже в состоянии next (повторный вызов ничего не меняет)
     */
    public boolean transitionTo(PredictionStatus next, Instant now) {
        if (status == next) return false;
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("illegal transition " + status + " -> " + next
                    + " prediction=" + predictionId);
        }
        this.status = next;
        this.updatedAt = now;
        return true;
    }

    public void recordFailure(String error, Instant now) {
        this.failedAttempts++;
        if (this.firstFailureAt == null) this.firstFailureAt = now;
        this.lastError = error == null ? null : (error.length() > 500 ? error.substring(0, 500) : error);
        this.updatedAt = now;
    }
}
