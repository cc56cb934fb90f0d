package com.tablehub.gameservice.games.standalone.interfaces.http.dto;

public record DeleteGameResponse(boolean deleted, String gameId) {
}
