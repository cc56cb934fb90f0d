package com.tablehub.gameservice.engine.core;

import java.util.List;

/**
 * 自动代理决策抽象：给定状态与合法动作集合，返回一个动作。
 * 同步阻塞调用，无超时；可能抛出任意运行时异常，调用方负责兜底。
 */
public interface AgentDecider {

    GameAction decide(SeatState participant, MatchState state, List<GameAction> legalActions);
}
