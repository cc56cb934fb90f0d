package com.tablehub.gameservice.games.standalone.interfaces.http.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * {"action": [color, type, value]}；action 省略表示让自动座位走一步
 */
@Data
public class ActRequest {
    private JsonNode action;
}
