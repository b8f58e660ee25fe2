package eu.virtualparadox.docrag.store.jpa;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "store_locations")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StoreLocationEntity {

    @Id
    @Column(length = 256, nullable = false)
    private String location;

    @Column(name = "change_tracking", nullable = false)
    private boolean changeTracking;

    @Column(name = "change_version", nullable = false)
    private long changeVersion;

    @Column(name = "row_count", nullable = false)
    private long rowCount;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
