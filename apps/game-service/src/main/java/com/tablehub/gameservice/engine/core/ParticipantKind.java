package com.tablehub.gameservice.engine.core;

/**
 * 座位控制方：人类（通过请求行动）或自动代理（由 AgentDecider 同步决策）。
 */
public enum ParticipantKind {
    HUMAN(false),
    RANDOM(true),
    CAUTIOUS(true);

    private final boolean bot;

    ParticipantKind(boolean bot) {
        this.bot = bot;
    }

    public boolean isBot() {
        return bot;
    }
}
