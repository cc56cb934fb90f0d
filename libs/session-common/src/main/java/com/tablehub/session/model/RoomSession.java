package com.tablehub.session.model;

/**
 * 房间会话：令牌 -> （玩家名, 房间, 座位）。
 * <p>
 * seatColor 为 null 表示观战者；座位绑定在签发时确定，直到被吊销都不会变化。
 */
public record RoomSession(String token, String participantName, String roomId, String seatColor) {

    /** 是否为观战者（无座位） */
    public boolean isSpectator() {
        return seatColor == null;
    }

    /** 是否属于指定房间 */
    public boolean belongsTo(String otherRoomId) {
        return roomId != null && roomId.equals(otherRoomId);
    }
}
