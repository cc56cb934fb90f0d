package com.tablehub.gameservice.infrastructure.jpa.repository;

import com.tablehub.gameservice.infrastructure.jpa.entity.GameSnapshotEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * 快照 Repository
 */
@Repository
public interface GameSnapshotRepository extends JpaRepository<GameSnapshotEntity, Long> {

    Optional<GameSnapshotEntity> findByGameIdAndVersion(String gameId, int version);

    @Modifying
    @Query("DELETE FROM GameSnapshotEntity s WHERE s.gameId = :gameId")
    int deleteByGameId(@Param("gameId") String gameId);
}
