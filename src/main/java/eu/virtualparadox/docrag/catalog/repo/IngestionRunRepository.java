package eu.virtualparadox.docrag.catalog.repo;

import eu.virtualparadox.docrag.catalog.EIngestionStatus;
import eu.virtualparadox.docrag.catalog.entity.IngestionRunEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface IngestionRunRepository extends JpaRepository<IngestionRunEntity, String> {

    List<IngestionRunEntity> findAllByOrderByStartedAtDesc();

    Optional<IngestionRunEntity> findFirstByIndexNameAndStatusOrderByFinishedAtDesc(String indexName,
                                                                                  EIngestionStatus status);
}
