package com.tablehub.gameservice.infrastructure.jpa.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;

/**
 * 对局快照实体（只插不改）
 * 对应数据库表：game_snapshots，(game_id, version) 唯一
 */
@Entity
@Table(name = "game_snapshots",
        uniqueConstraints = @UniqueConstraint(name = "uk_game_snapshots_game_version", columnNames = {"game_id", "version"}),
        indexes = @Index(name = "idx_game_snapshots_game_id", columnList = "game_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameSnapshotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_id", nullable = false, length = 64, updatable = false)
    private String gameId;

    @Column(name = "version", nullable = false, updatable = false)
    private int version;

    /**
     * MatchState 序列化结果
     */
    @Column(name = "state_blob", nullable = false, updatable = false, columnDefinition = "text")
    private String stateBlob;

    /**
     * 客户端投影
     */
    @Column(name = "display_projection", nullable = false, updatable = false, columnDefinition = "text")
    private String displayProjection;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
