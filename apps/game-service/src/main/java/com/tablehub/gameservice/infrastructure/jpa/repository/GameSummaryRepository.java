package com.tablehub.gameservice.infrastructure.jpa.repository;

import com.tablehub.gameservice.infrastructure.jpa.entity.GameSummaryEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * 摘要 Repository
 */
@Repository
public interface GameSummaryRepository extends JpaRepository<GameSummaryEntity, Long> {

    Optional<GameSummaryEntity> findByGameId(String gameId);

    /**
     * 按最近更新倒序
     */
    @Query("SELECT s FROM GameSummaryEntity s ORDER BY s.updatedAt DESC, s.id DESC")
    List<GameSummaryEntity> findRecent(Pageable pageable);

    @Modifying
    @Query("DELETE FROM GameSummaryEntity s WHERE s.gameId = :gameId")
    int deleteByGameId(@Param("gameId") String gameId);
}
