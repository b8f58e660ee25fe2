package eu.virtualparadox.docrag.store.jpa;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "segment_rows",
        uniqueConstraints = @UniqueConstraint(name = "uk_segment_rows_location_segment",
                columnNames = {"location", "segment_id"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SegmentRowEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long pk;

    @Column(length = 256, nullable = false)
    private String location;

    @Column(name = "segment_id", nullable = false)
    private long segmentId;

    @Lob
    @Column(nullable = false)
    private String content;
}
