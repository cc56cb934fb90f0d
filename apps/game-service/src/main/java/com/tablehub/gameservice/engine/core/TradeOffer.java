package com.tablehub.gameservice.engine.core;

import java.util.Objects;

/**
 * 报价：offer 为发起方给出的资源，request 为索取的资源。
 */
public record TradeOffer(SeatColor color, int[] offer, int[] request) implements GameAction {

    public TradeOffer {
        Objects.requireNonNull(color, "color");
        if (offer == null || request == null
                || offer.length != Resource.COUNT || request.length != Resource.COUNT) {
            throw new IllegalArgumentException("offer/request must have " + Resource.COUNT + " entries");
        }
        offer = offer.clone();
        request = request.clone();
    }

    @Override
    public ActionType type() {
        return ActionType.OFFER_TRADE;
    }

    /** 单位报价：给 1 个 give，要 1 个 want */
    public static TradeOffer oneForOne(SeatColor color, Resource give, Resource want) {
        int[] offer = new int[Resource.COUNT];
        int[] request = new int[Resource.COUNT];
        offer[give.ordinal()] = 1;
        request[want.ordinal()] = 1;
        return new TradeOffer(color, offer, request);
    }
}
