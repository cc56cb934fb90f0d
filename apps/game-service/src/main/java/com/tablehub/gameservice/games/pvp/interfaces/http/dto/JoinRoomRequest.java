package com.tablehub.gameservice.games.pvp.interfaces.http.dto;

import lombok.Data;

@Data
public class JoinRoomRequest {
    private String userName;
}
