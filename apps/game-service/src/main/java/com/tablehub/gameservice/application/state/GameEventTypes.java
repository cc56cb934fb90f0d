package com.tablehub.gameservice.application.state;

/**
 * 审计事件类型
 */
public final class GameEventTypes {

    private GameEventTypes() {
    }

    /** 开局（版本 0） */
    public static final String GAME_CREATED = "GAME_CREATED";

    /** 人类提交的动作被接受 */
    public static final String ACTION_APPLIED = "ACTION_APPLIED";

    /** 自动推进代答的议价响应（payload.forced 标记强制拒绝） */
    public static final String AUTO_TRADE_RESPONSE = "AUTO_TRADE_RESPONSE";

    /** 单机对局中自动座位的一步决策 */
    public static final String BOT_ACTION = "BOT_ACTION";

    /** 请求协商建议（无论建议服务是否可用都会记录） */
    public static final String NEGOTIATION_ADVICE_REQUEST = "NEGOTIATION_ADVICE_REQUEST";
}
