package com.tablehub.gameservice.games.pvp.domain.model;

import com.tablehub.gameservice.engine.core.SeatColor;
import com.tablehub.gameservice.games.pvp.domain.dto.SeatAssignment;
import com.tablehub.gameservice.games.pvp.domain.entity.PvpRoom;
import com.tablehub.session.model.RoomSession;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * 房间视图（HTTP 返回 / STOMP 广播）。
 * you：调用方所在座位；匿名或观战为 null。
 */
public record RoomView(String roomId,
                       String name,
                       boolean started,
                       String gameId,
                       Integer latestVersion,
                       List<SeatView> seats,
                       String you,
                       boolean spectator,
                       BoardPreview board,
                       OffsetDateTime createdAt,
                       OffsetDateTime updatedAt) {

    public record SeatView(String color, String userName, boolean occupied, boolean host, boolean you) {
    }

    public static RoomView of(PvpRoom room, RoomSession session, BoardPreview board) {
        String you = session == null ? null : session.seatColor();
        List<SeatView> seats = room.getSeats().stream()
                .map(s -> seatView(s, you))
                .toList();
        return new RoomView(room.getRoomId(), room.getName(), room.isStarted(), room.getGameId(),
                room.getLatestVersion(), seats, you, session != null && session.isSpectator(), board,
                room.getCreatedAt(), room.getUpdatedAt());
    }

    private static SeatView seatView(SeatAssignment s, String you) {
        return new SeatView(s.getColor().name(), s.getUserName(), s.occupied(),
                s.getColor() == SeatColor.HOST, s.getColor().name().equals(you));
    }
}
