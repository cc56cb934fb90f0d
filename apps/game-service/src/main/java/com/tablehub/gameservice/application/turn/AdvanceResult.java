package com.tablehub.gameservice.application.turn;

import com.tablehub.gameservice.engine.core.MatchState;

import java.util.List;

/**
 * 自动推进结果：推进后的状态 + 本次代答列表（为空即未处理任何座位）。
 */
public record AdvanceResult(MatchState state, List<AutoResponse> responses) {

    public static AdvanceResult idle(MatchState state) {
        return new AdvanceResult(state, List.of());
    }

    public boolean processed() {
        return !responses.isEmpty();
    }
}
