package com.tablehub.gameservice.infrastructure.jpa.entity;

import com.tablehub.gameservice.infrastructure.jpa.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 对局摘要实体
 * 对应数据库表：game_summaries，每个 game_id 一行
 */
@Entity
@Table(name = "game_summaries",
        uniqueConstraints = @UniqueConstraint(name = "uk_game_summaries_game_id", columnNames = "game_id"),
        indexes = @Index(name = "idx_game_summaries_updated_at", columnList = "updated_at"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameSummaryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_id", nullable = false, length = 64, updatable = false)
    private String gameId;

    /**
     * 最新快照版本
     */
    @Column(name = "latest_version", nullable = false)
    private int latestVersion;

    /**
     * 座次颜色（JSON 数组）
     */
    @Convert(converter = StringListConverter.class)
    @Column(name = "seat_colors", nullable = false, length = 255)
    @Builder.Default
    private List<String> seatColors = new ArrayList<>();

    /**
     * 当前行动座位
     */
    @Column(name = "current_color", length = 16)
    private String currentColor;

    @Column(name = "winner", length = 16)
    private String winner;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
