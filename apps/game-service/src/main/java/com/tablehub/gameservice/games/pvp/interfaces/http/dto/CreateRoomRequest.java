package com.tablehub.gameservice.games.pvp.interfaces.http.dto;

import lombok.Data;

@Data
public class CreateRoomRequest {
    private String roomName;
}
