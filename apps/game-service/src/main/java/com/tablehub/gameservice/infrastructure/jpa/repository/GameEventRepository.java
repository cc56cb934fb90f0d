package com.tablehub.gameservice.infrastructure.jpa.repository;

import com.tablehub.gameservice.infrastructure.jpa.entity.GameEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 审计事件 Repository
 */
@Repository
public interface GameEventRepository extends JpaRepository<GameEventEntity, Long> {

    List<GameEventEntity> findByGameIdOrderByIdAsc(String gameId);

    List<GameEventEntity> findByGameIdAndEventTypeOrderByIdAsc(String gameId, String eventType);

    @Modifying
    @Query("DELETE FROM GameEventEntity e WHERE e.gameId = :gameId")
    int deleteByGameId(@Param("gameId") String gameId);
}
