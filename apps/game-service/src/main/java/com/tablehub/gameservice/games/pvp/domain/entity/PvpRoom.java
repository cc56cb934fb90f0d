package com.tablehub.gameservice.games.pvp.domain.entity;

import com.tablehub.gameservice.engine.core.SeatColor;
import com.tablehub.gameservice.games.pvp.domain.dto.SeatAssignment;
import com.tablehub.gameservice.games.pvp.domain.dto.SeatListConverter;
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
import java.util.Optional;

/**
 * 多人房间实体
 * 对应数据库表：pvp_rooms
 * <p>
 * 座位列表长度固定（四色，按规范座次），第一个座位为房主位。
 */
@Entity
@Table(name = "pvp_rooms",
        uniqueConstraints = @UniqueConstraint(name = "uk_pvp_rooms_room_id", columnNames = "room_id"),
        indexes = @Index(name = "idx_pvp_rooms_created_at", columnList = "created_at"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PvpRoom {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "room_id", nullable = false, length = 64, updatable = false)
    private String roomId;

    @Column(name = "name", nullable = false, length = 128)
    private String name;

    /**
     * 座位（JSON）
     */
    @Convert(converter = SeatListConverter.class)
    @Column(name = "seats", nullable = false, columnDefinition = "text")
    @Builder.Default
    private List<SeatAssignment> seats = new ArrayList<>();

    @Column(name = "started", nullable = false)
    private boolean started;

    /**
     * 开局后绑定的对局ID
     */
    @Column(name = "game_id", length = 64)
    private String gameId;

    /**
     * 缓存的最新快照版本
     */
    @Column(name = "latest_version")
    private Integer latestVersion;

    @Column(name = "board_seed", nullable = false)
    private long boardSeed;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    /** 四个空座位 */
    public static List<SeatAssignment> emptySeats() {
        List<SeatAssignment> out = new ArrayList<>();
        for (SeatColor c : SeatColor.values()) {
            out.add(SeatAssignment.empty(c));
        }
        return out;
    }

    public Optional<SeatAssignment> seatOf(String userName) {
        return seats.stream().filter(s -> s.occupied() && s.getUserName().equals(userName)).findFirst();
    }

    /** 指定座位当前是否由该玩家占用 */
    public boolean holds(String color, String userName) {
        return seats.stream().anyMatch(s -> s.occupied()
                && s.getColor().name().equals(color) && s.getUserName().equals(userName));
    }

    public Optional<SeatAssignment> firstFreeSeat() {
        return seats.stream().filter(s -> !s.occupied()).findFirst();
    }

    public long occupiedCount() {
        return seats.stream().filter(SeatAssignment::occupied).count();
    }

    /**
     * 设置某座位的占用者（null 为清空）。整体替换列表，长度不变。
     */
    public void assign(SeatColor color, String userName) {
        List<SeatAssignment> next = new ArrayList<>(seats.size());
        for (SeatAssignment s : seats) {
            next.add(new SeatAssignment(s.getColor(), s.getColor() == color ? userName : s.getUserName()));
        }
        this.seats = next;
    }
}
