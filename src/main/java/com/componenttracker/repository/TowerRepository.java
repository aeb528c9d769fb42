package com.componenttracker.repository;

import com.componenttracker.model.Tower;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface TowerRepository extends JpaRepository<Tower, UUID> {

    Optional<Tower> findByName(String name);
}
