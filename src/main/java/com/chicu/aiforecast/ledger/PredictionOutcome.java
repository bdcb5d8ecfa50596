package com.chicu.aiforecast.ledger;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Фактический результат прогноза на одном горизонте.
 * Отдельная таблица со ссылкой на прогноз; сам прогноз при оценке не трогается.
 */
@Getter
@Builder
@ToString(exclude = "prediction")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Entity
@Immutable
@Table(
        name = "prediction_outcome",
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_outcome_prediction_horizon", columnNames = {"prediction_id", "horizon"})
        },
        indexes = {
                @Index(name = "ix_outcome_prediction", columnList = "prediction_id"),
                @Index(name = "ix_outcome_eval_ts", columnList = "evaluation_timestamp")
        }
)
public class PredictionOutcome implements Persistable<String> {

    @Id
    @Column(name = "outcome_id", nullable = false, updatable = false, length = 36)
    private String outcomeId;

    @Column(name = "prediction_id", nullable = false, updatable = false, length = 36)
    private String predictionId;

    // только ради внешнего ключа в схеме; читаем через predictionId
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "prediction_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_outcome_prediction"))
    private PredictionRecord prediction;

    /** Код горизонта: 1h / 4h / 1d. */
    @Column(name = "horizon", nullable = false, updatable = false, length = 8)
    private String horizon;

    @Column(name = "entry_price", nullable = false, updatable = false)
    private double entryPrice;

    @Column(name = "exit_price", nullable = false, updatable = false)
    private double exitPrice;

    @Column(name = "entry_at", nullable = false, updatable = false)
    private Instant entryAt;

    @Column(name = "exit_at", nullable = false, updatable = false)
    private Instant exitAt;

    /** (exit - entry) / entry * 100 */
    @Column(name = "actual_return_pct", nullable = false, updatable = false)
    private double actualReturnPct;

    /** +1 / -1 / 0 */
    @Column(name = "actual_direction", nullable = false, updatable = false)
    private int actualDirection;

    @Column(name = "evaluation_timestamp", nullable = false, updatable = false)
    private Instant evaluationTimestamp;

    @Transient
    private transient boolean persisted;

    @PrePersist
    void prePersist() {
        if (predictionId != null) predictionId = predictionId.trim();
        if (horizon != null) horizon = horizon.trim();
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.persisted = true;
    }

    @Override
    public String getId() {
        return outcomeId;
    }

    @Override
    public boolean isNew() {
        return !persisted;
    }
}
