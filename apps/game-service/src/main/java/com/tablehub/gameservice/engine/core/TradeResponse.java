package com.tablehub.gameservice.engine.core;

import java.util.Objects;

/**
 * 议价响应：accept=true 为接受，false 为拒绝。
 */
public record TradeResponse(SeatColor color, boolean accept) implements GameAction {

    public TradeResponse {
        Objects.requireNonNull(color, "color");
    }

    @Override
    public ActionType type() {
        return accept ? ActionType.ACCEPT_TRADE : ActionType.REJECT_TRADE;
    }
}
