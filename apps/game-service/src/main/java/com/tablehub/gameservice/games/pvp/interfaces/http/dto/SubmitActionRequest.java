package com.tablehub.gameservice.games.pvp.interfaces.http.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * 提交动作请求体：
 * {"action": ["RED", "ROLL", null], "expectedVersion": 3}
 */
@Data
public class SubmitActionRequest {

    /** [color, type, value] */
    private JsonNode action;

    /** 可选：客户端读到的版本 */
    @JsonAlias("expected_state_index")
    private Integer expectedVersion;
}
