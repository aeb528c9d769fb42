package com.componenttracker.repository;

import com.componenttracker.model.ComponentRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ComponentRecordRepository extends JpaRepository<ComponentRecord, UUID> {
    /**
     * Finds a component by its business key.
     */
    Optional<ComponentRecord> findByExternalKey(String externalKey);
    /**
     * Loads all components ordered for export.
     */
    List<ComponentRecord> findAllByOrderByTowerNameAscComponentLabelAsc();
}
