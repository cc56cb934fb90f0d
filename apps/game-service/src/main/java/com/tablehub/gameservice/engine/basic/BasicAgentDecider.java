package com.tablehub.gameservice.engine.basic;

import com.tablehub.gameservice.engine.core.ActionType;
import com.tablehub.gameservice.engine.core.AgentDecider;
import com.tablehub.gameservice.engine.core.GameAction;
import com.tablehub.gameservice.engine.core.MatchState;
import com.tablehub.gameservice.engine.core.SeatState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 参考代理：
 * - RANDOM：在合法动作中均匀随机；
 * - CAUTIOUS：能建就建，报价一律拒绝，否则掷骰 / 结束回合，从不主动发起交易。
 */
@Component
public class BasicAgentDecider implements AgentDecider {

    private static final List<ActionType> CAUTIOUS_PREFERENCE = List.of(
            ActionType.BUILD,
            ActionType.REJECT_TRADE,
            ActionType.ROLL,
            ActionType.CANCEL_TRADE,
            ActionType.END_TURN);

    @Override
    public GameAction decide(SeatState participant, MatchState state, List<GameAction> legalActions) {
        if (legalActions == null || legalActions.isEmpty()) {
            throw new IllegalStateException("没有可选动作: seat=" + participant.getColor());
        }
        return switch (participant.getKind()) {
            case RANDOM -> legalActions.get(ThreadLocalRandom.current().nextInt(legalActions.size()));
            case CAUTIOUS -> cautious(legalActions);
            case HUMAN -> throw new IllegalStateException("人类座位不能由代理决策: seat=" + participant.getColor());
        };
    }

    private GameAction cautious(List<GameAction> legal) {
        for (ActionType preferred : CAUTIOUS_PREFERENCE) {
            for (GameAction a : legal) {
                if (a.type() == preferred) {
                    return a;
                }
            }
        }
        return legal.get(0);
    }
}
