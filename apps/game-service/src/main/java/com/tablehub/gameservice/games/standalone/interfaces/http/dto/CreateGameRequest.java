package com.tablehub.gameservice.games.standalone.interfaces.http.dto;

import lombok.Data;

import java.util.List;

/**
 * {"players": ["HUMAN", "RANDOM", "CAUTIOUS"]}
 */
@Data
public class CreateGameRequest {
    private List<String> players;
}
