package com.tablehub.gameservice.engine.core;

public enum TurnPhase {

    ROLL,                // 回合开始，必须先掷骰
    PLAY_TURN,           // 自由行动（建造 / 发起交易 / 结束回合）
    AWAITING_RESPONSES,  // 议价子阶段：等待其他座位接受或拒绝
    GAME_OVER            // 已决出胜者
}
