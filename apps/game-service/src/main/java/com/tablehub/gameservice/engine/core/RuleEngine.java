package com.tablehub.gameservice.engine.core;

import java.util.List;

/**
 * 规则引擎抽象（外部协作方）：开局、执行动作、列出合法动作。
 * <p>
 * apply 永远在副本上执行并返回新状态；非法动作抛出
 * {@link com.tablehub.gameservice.common.error.ValidationException}，入参状态保持不变。
 */
public interface RuleEngine {

    /**
     * 开局。
     *
     * @param gameId       对局ID
     * @param participants 按规范座次排列的参与方（2~4 个）
     * @param boardSeed    棋盘种子（同一种子生成同一棋盘）
     */
    MatchState newMatch(String gameId, List<Participant> participants, long boardSeed);

    /**
     * 执行动作。
     *
     * @param validate false 时跳过合法性校验（仅用于强制拒绝等兜底场景）
     */
    MatchState apply(MatchState state, GameAction action, boolean validate);

    default MatchState apply(MatchState state, GameAction action) {
        return apply(state, action, true);
    }

    /** 当前掌控行动的座位（actorIndex）可执行的动作 */
    List<GameAction> legalActions(MatchState state);
}
