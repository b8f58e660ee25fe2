package eu.virtualparadox.docrag.store.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

public interface StoreLocationRepository extends JpaRepository<StoreLocationEntity, String> {
}
