package com.chicu.aiforecast.ai.persistence;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Запись реестра моделей. Бандлы не удаляются: при продвижении новой версии старая только теряет флаг promoted.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "payload")
@Entity
@Table(
        name = "model_artifact",
        uniqueConstraints = @UniqueConstraint(name = "uq_model_artifact_version", columnNames = {"version"}),
        indexes = {
                @Index(name = "idx_model_artifact_created", columnList = "created_at DESC"),
                @Index(name = "idx_model_artifact_promoted", columnList = "promoted")
        }
)
public class ModelArtifactEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Версия бандла (например: "forecast-2026-01-03T12-30-00Z").
     */
    @Column(name = "version", nullable = false, updatable = false, length = 128)
    private String version;

    @Column(name = "schema_hash", nullable = false, updatable = false, length = 64)
    private String schemaHash;

    /** Имена фич через запятую, в порядке схемы. */
    @Column(name = "feature_names", nullable = false, updatable = false, length = 4096)
    private String featureNames;

    @Column(name = "trained_from", updatable = false)
    private Instant trainedFrom;

    @Column(name = "trained_to", updatable = false)
    private Instant trainedTo;

    // --- holdout ---

    @Column(name = "holdout_rows", nullable = false, updatable = false)
    private int holdoutRows;

    @Column(name = "action_accuracy", nullable = false, updatable = false)
    private double actionAccuracy;

    @Column(name = "direction_accuracy", nullable = false, updatable = false)
    private double directionAccuracy;

    @Column(name = "direction_coverage", nullable = false, updatable = false)
    private double directionCoverage;

    @Column(name = "magnitude_mae", nullable = false, updatable = false)
    private double magnitudeMae;

    @Column(name = "promoted", nullable = false)
    private boolean promoted;

    @Column(name = "promoted_at")
    private Instant promotedAt;

    /**
     * Java-сериализованный {@link com.chicu.aiforecast.ai.ml.model.ModelBundle}.
     */
    @JdbcTypeCode(SqlTypes.VARBINARY)
    @Column(name = "payload", nullable = false, updatable = false, length = 64 * 1024 * 1024)
    private byte[] payload;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
