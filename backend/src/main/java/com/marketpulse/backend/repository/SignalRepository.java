package com.marketpulse.backend.repository;

import com.marketpulse.backend.model.Signal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface SignalRepository extends JpaRepository<Signal, Long>, JpaSpecificationExecutor<Signal> {

    Optional<Signal> findTopByAssetOrderByTsDesc(String asset);

    boolean existsByAssetAndTs(String asset, Instant ts);
}
