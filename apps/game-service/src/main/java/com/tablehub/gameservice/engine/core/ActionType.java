package com.tablehub.gameservice.engine.core;

/**
 * 动作类型标签（动作变体的判别字段）。
 */
public enum ActionType {
    ROLL,
    BUILD,
    END_TURN,
    OFFER_TRADE,
    ACCEPT_TRADE,
    REJECT_TRADE,
    CANCEL_TRADE;

    /** 是否为议价响应（接受 / 拒绝） */
    public boolean isTradeResponse() {
        return this == ACCEPT_TRADE || this == REJECT_TRADE;
    }
}
