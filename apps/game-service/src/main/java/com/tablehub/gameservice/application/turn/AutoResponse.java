package com.tablehub.gameservice.application.turn;

import com.tablehub.gameservice.engine.core.ActionType;
import com.tablehub.gameservice.engine.core.SeatColor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次自动代答的议价响应。forced=true 表示决策失败或被拒后的强制拒绝。
 */
public record AutoResponse(SeatColor color, ActionType type, boolean forced) {

    public Map<String, Object> toPayload() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("color", color.name());
        m.put("type", type.name());
        m.put("forced", forced);
        return m;
    }
}
