package com.tablehub.gameservice.games.pvp.domain.repository;

import com.tablehub.gameservice.games.pvp.domain.entity.PvpRoom;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * 房间 Repository
 */
@Repository
public interface PvpRoomRepository extends JpaRepository<PvpRoom, Long> {

    Optional<PvpRoom> findByRoomId(String roomId);

    /**
     * 行级排他锁读取（多实例部署时与进程内房间锁配合）
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM PvpRoom r WHERE r.roomId = :roomId")
    Optional<PvpRoom> findForUpdate(@Param("roomId") String roomId);

    /**
     * 按创建时间倒序
     */
    @Query("SELECT r FROM PvpRoom r ORDER BY r.createdAt DESC, r.id DESC")
    List<PvpRoom> findRecent(Pageable pageable);
}
