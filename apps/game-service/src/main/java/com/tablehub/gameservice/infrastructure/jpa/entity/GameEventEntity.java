package com.tablehub.gameservice.infrastructure.jpa.entity;

import com.tablehub.gameservice.infrastructure.jpa.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * 对局审计事件（只追加，仅随对局整体删除）
 * 对应数据库表：game_events
 */
@Entity
@Table(name = "game_events",
        indexes = {
                @Index(name = "idx_game_events_game_id", columnList = "game_id"),
                @Index(name = "idx_game_events_type", columnList = "game_id, event_type")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_id", nullable = false, length = 64, updatable = false)
    private String gameId;

    /**
     * 关联的快照版本（可空）
     */
    @Column(name = "version")
    private Integer version;

    @Column(name = "event_type", nullable = false, length = 64)
    private String eventType;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "payload", columnDefinition = "text")
    @Builder.Default
    private Map<String, Object> payload = new HashMap<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
