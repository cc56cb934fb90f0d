package com.tablehub.gameservice.games.pvp.interfaces.http.dto;

public record StartRoomResponse(String gameId) {
}
