package com.tablehub.gameservice.games.pvp.domain.model;

/**
 * 加入房间结果：令牌只在此处返回一次。
 */
public record JoinResult(String token, String seatColor, boolean spectator, RoomView room) {
}
