package com.tablehub.gameservice.games.standalone.interfaces.http.dto;

public record CreateGameResponse(String gameId) {
}
