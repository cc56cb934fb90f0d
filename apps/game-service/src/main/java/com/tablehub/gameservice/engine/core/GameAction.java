package com.tablehub.gameservice.engine.core;

/**
 * 统一的“玩家 / 代理输入指令”抽象。
 * 变体：{@link SimpleAction}（无参数）、{@link TradeOffer}（报价）、{@link TradeResponse}（接受 / 拒绝）。
 * 传输层只按 [color, type, value] 编解码，对具体规则透明。
 */
public interface GameAction {

    /** 动作声明的行动方 */
    SeatColor color();

    ActionType type();

    static GameAction of(SeatColor color, ActionType type) {
        return new SimpleAction(color, type);
    }

    static GameAction reject(SeatColor color) {
        return new TradeResponse(color, false);
    }

    static GameAction accept(SeatColor color) {
        return new TradeResponse(color, true);
    }
}
