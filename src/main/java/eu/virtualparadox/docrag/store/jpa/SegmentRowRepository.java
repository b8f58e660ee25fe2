package eu.virtualparadox.docrag.store.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface SegmentRowRepository extends JpaRepository<SegmentRowEntity, Long> {

    List<SegmentRowEntity> findByLocationOrderBySegmentIdAsc(String location);

    long countByLocation(String location);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from SegmentRowEntity r where r.location = :location")
    int deleteAllByLocation(@Param("location") String location);
}
