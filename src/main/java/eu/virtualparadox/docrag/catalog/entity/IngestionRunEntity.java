package eu.virtualparadox.docrag.catalog.entity;

import eu.virtualparadox.docrag.catalog.EIngestionStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "ingestion_runs")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IngestionRunEntity {

    @Id
    @Column(length = 64, nullable = false)
    private String id;

    @Column(length = 1024, nullable = false)
    private String source;

    @Column(name = "store_location", length = 256, nullable = false)
    private String storeLocation;

    @Column(name = "index_name", length = 256, nullable = false)
    private String indexName;

    @Column(name = "chunk_size", nullable = false)
    private int chunkSize;

    @Column(name = "chunk_overlap", nullable = false)
    private int chunkOverlap;

    @Column(name = "embed_model", length = 128, nullable = false)
    private String embedModel;

    @Column(nullable = false)
    private int segments;

    @Column(name = "store_version")
    private Long storeVersion;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 32, nullable = false)
    private EIngestionStatus status;

    @Column(name = "error", length = 2048)
    private String error;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @PrePersist
    void prePersist() {
        if (startedAt == null) {
            startedAt = Instant.now();
        }

        if (embedModel == null) {
            embedModel = "unknown";
        }

        if (status == null) {
            status = EIngestionStatus.RUNNING;
        }
    }
}
