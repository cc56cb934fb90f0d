package com.tablehub.gameservice.application.turn;

import com.tablehub.gameservice.common.error.ValidationException;
import com.tablehub.gameservice.engine.core.AgentDecider;
import com.tablehub.gameservice.engine.core.GameAction;
import com.tablehub.gameservice.engine.core.MatchState;
import com.tablehub.gameservice.engine.core.Negotiation;
import com.tablehub.gameservice.engine.core.RuleEngine;
import com.tablehub.gameservice.engine.core.SeatState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 议价子阶段的自动推进。
 * <p>
 * 按座次遍历尚未响应的非发起方：遇到人类座位即停止（等待其请求）；
 * 自动座位则切换控制权、重算合法动作并同步调用决策。
 * 决策抛异常、返回非接受/拒绝动作、或动作被规则引擎拒绝时，一律以跳过校验的强制拒绝代替，
 * 保证议价不会因自动座位卡死。决策失败只记 WARN，不向外传播。
 * <p>
 * 调用方须持有该对局的串行化锁。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TurnAdvancer {

    private final RuleEngine ruleEngine;
    private final AgentDecider agentDecider;

    public AdvanceResult drive(MatchState state) {
        if (!state.awaitingResponses()) {
            return AdvanceResult.idle(state);
        }
        int offerer = state.getNegotiation().getOffererSeat() >= 0
                ? state.getNegotiation().getOffererSeat()
                : state.getTurnIndex();

        MatchState current = state;
        List<AutoResponse> responses = new ArrayList<>();
        for (int i = 0; i < current.getSeats().size() && current.awaitingResponses(); i++) {
            Negotiation n = current.getNegotiation();
            if (i == offerer || n.responded(i)) {
                continue;
            }
            SeatState seat = current.seat(i);
            if (!seat.getKind().isBot()) {
                break;
            }
            MatchState controlled = current.copy();
            controlled.setActorIndex(i);

            GameAction decision = decide(seat, controlled);
            boolean forced = false;
            if (decision == null || !decision.type().isTradeResponse() || decision.color() != seat.getColor()) {
                if (decision != null) {
                    log.warn("自动座位返回了非议价响应，改为强制拒绝: gameId={}, seat={}, decision={}",
                            state.getGameId(), seat.getColor(), decision);
                }
                decision = GameAction.reject(seat.getColor());
                forced = true;
            }
            try {
                current = ruleEngine.apply(controlled, decision, true);
            } catch (ValidationException e) {
                log.warn("自动响应被规则拒绝，改为强制拒绝: gameId={}, seat={}, reason={}",
                        state.getGameId(), seat.getColor(), e.getMessage());
                decision = GameAction.reject(seat.getColor());
                forced = true;
                current = ruleEngine.apply(controlled, decision, false);
            }
            responses.add(new AutoResponse(seat.getColor(), decision.type(), forced));
        }

        if (current.awaitingResponses() && current.getActorIndex() != current.getTurnIndex()) {
            current = current.copy();
            current.setActorIndex(current.getTurnIndex());
        }
        if (!responses.isEmpty()) {
            log.debug("议价自动推进: gameId={}, responses={}, stillAwaiting={}",
                    state.getGameId(), responses.size(), current.awaitingResponses());
        }
        return new AdvanceResult(current, responses);
    }

    /** 决策失败返回 null */
    private GameAction decide(SeatState seat, MatchState controlled) {
        try {
            return agentDecider.decide(seat, controlled, ruleEngine.legalActions(controlled));
        } catch (RuntimeException e) {
            log.warn("自动座位决策失败，改为强制拒绝: gameId={}, seat={}", controlled.getGameId(), seat.getColor(), e);
            return null;
        }
    }
}
