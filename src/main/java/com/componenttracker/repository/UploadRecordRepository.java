package com.componenttracker.repository;

import com.componenttracker.model.UploadRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface UploadRecordRepository extends JpaRepository<UploadRecord, UUID> {
    /**
     * Loads the uploads submitted by an actor, newest first.
     */
    List<UploadRecord> findAllByActorOrderByReceivedAtDesc(String actor);
}
