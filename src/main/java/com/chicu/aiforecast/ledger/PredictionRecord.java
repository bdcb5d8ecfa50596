package com.chicu.aiforecast.ledger;

import com.chicu.aiforecast.common.enums.TradeAction;
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
import java.util.Locale;

/**
 * Прогноз в леджере. Пишется один раз и больше никогда не меняется:
 * нет сеттеров, все колонки updatable=false, сущность @Immutable.
 * Исправление ошибки = новый прогноз с новым id.
 */
@Getter
@Builder
@ToString(exclude = "featuresJson")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Entity
@Immutable
@Table(
        name = "prediction_record",
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_prediction_symbol_bucket", columnNames = {"symbol", "bucket_start"})
        },
        indexes = {
                @Index(name = "ix_prediction_ts", columnList = "prediction_timestamp"),
                @Index(name = "ix_prediction_symbol_ts", columnList = "symbol,prediction_timestamp")
        }
)
public class PredictionRecord implements Persistable<String> {

    public static final int SYMBOL_MAX_LENGTH = 32;
    public static final int FEATURES_JSON_MAX_LENGTH = 16384;

    @Id
    @Column(name = "prediction_id", nullable = false, updatable = false, length = 36)
    private String predictionId;

    @Column(name = "symbol", nullable = false, updatable = false, length = SYMBOL_MAX_LENGTH)
    private String symbol;

    /** Начало бакета (symbol, bucket): ключ дедупликации. */
    @Column(name = "bucket_start", nullable = false, updatable = false)
    private Instant bucketStart;

    /** Момент сбора фич. Задаётся один раз. */
    @Column(name = "prediction_timestamp", nullable = false, updatable = false)
    private Instant predictionTimestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "predicted_action", nullable = false, updatable = false, length = 16)
    private TradeAction predictedAction;

    @Column(name = "action_confidence", nullable = false, updatable = false)
    private double actionConfidence;

    /** +1 / -1, null если модель направления воздержалась. */
    @Column(name = "predicted_direction", updatable = false)
    private Integer predictedDirection;

    /** Ожидаемая доходность в процентах, со знаком. */
    @Column(name = "predicted_magnitude", nullable = false, updatable = false)
    private double predictedMagnitude;

    @Column(name = "features_json", nullable = false, updatable = false, length = FEATURES_JSON_MAX_LENGTH)
    private String featuresJson;

    @Column(name = "schema_hash", nullable = false, updatable = false, length = 64)
    private String schemaHash;

    @Column(name = "model_version", nullable = false, updatable = false, length = 128)
    private String modelVersion;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Transient
    private transient boolean persisted;

    @PrePersist
    void prePersist() {
        if (symbol != null) symbol = symbol.trim().toUpperCase(Locale.ROOT);
        if (predictionId != null) predictionId = predictionId.trim();
        if (modelVersion != null) modelVersion = modelVersion.trim();
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.persisted = true;
    }

    @Override
    public String getId() {
        return predictionId;
    }

    /**
     * Всегда persist, никогда merge: повторная запись того же id должна упасть на ключе, а не обновить строку.
     */
    @Override
    public boolean isNew() {
        return !persisted;
    }
}
