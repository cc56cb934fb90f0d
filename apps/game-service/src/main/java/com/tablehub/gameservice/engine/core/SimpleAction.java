package com.tablehub.gameservice.engine.core;

import java.util.Objects;

/**
 * 无参数动作：ROLL / BUILD / END_TURN / CANCEL_TRADE。
 */
public record SimpleAction(SeatColor color, ActionType type) implements GameAction {

    public SimpleAction {
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(type, "type");
        if (type == ActionType.OFFER_TRADE || type.isTradeResponse()) {
            throw new IllegalArgumentException(type + " is not a simple action");
        }
    }
}
